package org.neuralchilli.swarmlink.serializer;

import org.neuralchilli.swarmlink.domain.TaskStatusRecord;

/**
 * Serializer for task status records (TYPE_ID: 2003).
 */
public class TaskStatusRecordSerializer extends JsonStreamSerializer<TaskStatusRecord> {

    public static final int TYPE_ID = 2003;

    public TaskStatusRecordSerializer() {
        super(TaskStatusRecord.class, TYPE_ID);
    }
}
