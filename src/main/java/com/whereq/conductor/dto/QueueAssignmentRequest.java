package com.whereq.conductor.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueAssignmentRequest {

    @NotBlank
    private String jobId;

    @NotBlank
    private String queueName;
}
