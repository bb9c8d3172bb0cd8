package com.whereq.conductor.dto;

import com.whereq.conductor.model.BackendType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateQueueRequest {

    @NotBlank
    private String name;

    @NotNull
    private BackendType backendType;

    private String description;

    private String tenant;
}
