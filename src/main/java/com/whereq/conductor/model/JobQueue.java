package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobQueue {

    private String name;

    private BackendType backendType;

    private String description;

    private String tenant;

    private Instant createdAt;
}
