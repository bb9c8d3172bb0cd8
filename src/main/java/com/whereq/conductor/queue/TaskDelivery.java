package com.whereq.conductor.queue;

import com.whereq.conductor.model.TaskMessage;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A message reserved by a worker. The raw payload is kept because acknowledgement removes the
 * exact element from the worker's unacked list.
 */
@Data
@AllArgsConstructor
public class TaskDelivery {

    private String queue;

    private String workerName;

    private String payload;

    private TaskMessage message;
}
