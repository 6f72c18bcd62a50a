package org.neuralchilli.swarmlink.serializer;

import org.neuralchilli.swarmlink.domain.SwarmNode;

/**
 * Serializer for node directory entries (TYPE_ID: 2002).
 */
public class SwarmNodeSerializer extends JsonStreamSerializer<SwarmNode> {

    public static final int TYPE_ID = 2002;

    public SwarmNodeSerializer() {
        super(SwarmNode.class, TYPE_ID);
    }
}
