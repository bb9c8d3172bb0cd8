package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Declared input of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobVariable {

    private String name;

    private VariableType type;

    private String label;

    private String description;

    @Builder.Default
    private boolean required = true;

    private Object defaultValue;

    private Integer minLength;

    private Integer maxLength;

    private String regex;

    private Long minValue;

    private Long maxValue;

    /**
     * Allowed values for CHOICE
     */
    private List<String> choices;

    /**
     * Record type for OBJECT and MULTI_OBJECT, e.g. "dcim.device"
     */
    private String objectType;
}
