package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Uploaded file held for a FILE variable until the consuming job finishes
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileProxy {

    private String id;

    private String name;

    private String contentType;

    private byte[] content;

    private Instant uploadedAt;
}
