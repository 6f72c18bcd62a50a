package org.neuralchilli.swarmlink.serializer;

import org.neuralchilli.swarmlink.domain.SwarmTask;

/**
 * Serializer for tasks sitting in the capability queues (TYPE_ID: 2001).
 */
public class SwarmTaskSerializer extends JsonStreamSerializer<SwarmTask> {

    public static final int TYPE_ID = 2001;

    public SwarmTaskSerializer() {
        super(SwarmTask.class, TYPE_ID);
    }
}
