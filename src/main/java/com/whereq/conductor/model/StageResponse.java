package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One approver's decision or comment on a stage. State is null for plain comments.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StageResponse {

    private String user;

    private ApprovalState state;

    private String comment;

    private Instant createdAt;
}
