package org.neuralchilli.swarmlink.serializer;

import com.hazelcast.nio.ObjectDataInput;
import com.hazelcast.nio.ObjectDataOutput;
import com.hazelcast.nio.serialization.StreamSerializer;
import org.neuralchilli.swarmlink.util.SwarmJson;

import java.io.IOException;

/**
 * Stores a domain record in Hazelcast as its JSON wire blob.
 * Output must stay deterministic: compare-and-swap on the maps compares serialized bytes.
 */
public abstract class JsonStreamSerializer<T> implements StreamSerializer<T> {

    private final Class<T> type;
    private final int typeId;

    protected JsonStreamSerializer(Class<T> type, int typeId) {
        this.type = type;
        this.typeId = typeId;
    }

    @Override
    public void write(ObjectDataOutput out, T value) throws IOException {
        out.writeString(SwarmJson.toJson(value));
    }

    @Override
    public T read(ObjectDataInput in) throws IOException {
        String json = in.readString();
        if (json == null) {
            throw new IOException("Missing JSON blob for " + type.getSimpleName());
        }
        return SwarmJson.fromJson(json, type);
    }

    @Override
    public int getTypeId() {
        return typeId;
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public void destroy() {
    }
}
