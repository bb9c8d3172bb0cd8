package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Makes a queue eligible for a job. Unique per (jobId, queueName).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobQueueAssignment {

    private String jobId;

    private String queueName;
}
