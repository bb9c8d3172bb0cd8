package com.whereq.conductor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalActionRequest {

    private String comment;

    /**
     * Approve a one-off run even though its start time already passed
     */
    private boolean force;
}
