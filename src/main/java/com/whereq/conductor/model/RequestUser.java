package com.whereq.conductor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Caller identity as forwarded by the gateway
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequestUser {

    public static final String ADMIN = "admin";

    private String username;

    @Builder.Default
    private Set<String> groups = new HashSet<>();

    @Builder.Default
    private Set<String> permissions = new HashSet<>();

    public boolean isAdmin() {
        return permissions.contains(ADMIN);
    }

    public boolean hasPermission(String permission) {
        return isAdmin() || permissions.contains(permission);
    }

    public boolean inGroup(String group) {
        return groups.contains(group);
    }

    public boolean canRun(String jobId) {
        return hasPermission("run_job") || hasPermission("run_job:" + jobId);
    }
}
