package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference to a record in the inventory record store
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ObjectRef {

    /**
     * Record type, e.g. "dcim.device"
     */
    private String type;

    private String id;

    @Override
    public String toString() {
        return type + ":" + id;
    }
}
