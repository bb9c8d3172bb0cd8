package com.whereq.conductor.model;

public enum ApprovalState {
    PENDING,
    APPROVED,
    DENIED
}
