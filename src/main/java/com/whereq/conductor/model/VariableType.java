package com.whereq.conductor.model;

/**
 * Kinds of job input variables
 */
public enum VariableType {
    STRING,
    INTEGER,
    BOOLEAN,
    CHOICE,
    /**
     * Reference to one record of the inventory, {"type": ..., "id": ...}
     */
    OBJECT,
    MULTI_OBJECT,
    /**
     * Id of an uploaded {@link FileProxy}
     */
    FILE,
    IP_ADDRESS,
    /**
     * CIDR prefix, e.g. 10.0.0.0/24
     */
    NETWORK
}
