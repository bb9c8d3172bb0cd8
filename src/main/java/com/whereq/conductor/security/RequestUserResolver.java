package com.whereq.conductor.security;

import com.whereq.conductor.exception.PermissionDeniedException;
import com.whereq.conductor.model.RequestUser;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the caller identity that the gateway forwards as headers. Authentication happens
 * upstream; requests without a user are rejected.
 */
@Component
public class RequestUserResolver {

    public static final String USER_HEADER = "X-User";
    public static final String GROUPS_HEADER = "X-User-Groups";
    public static final String PERMISSIONS_HEADER = "X-User-Permissions";

    public RequestUser resolve(HttpHeaders headers) {
        String username = headers.getFirst(USER_HEADER);
        if (username == null || username.isBlank()) {
            throw new PermissionDeniedException("Missing " + USER_HEADER + " header");
        }
        return RequestUser.builder()
            .username(username.trim())
            .groups(split(headers.getFirst(GROUPS_HEADER)))
            .permissions(split(headers.getFirst(PERMISSIONS_HEADER)))
            .build();
    }

    public RequestUser requireAdmin(HttpHeaders headers) {
        RequestUser user = resolve(headers);
        if (!user.isAdmin()) {
            throw new PermissionDeniedException("User '" + user.getUsername() + "' is not an administrator");
        }
        return user;
    }

    private static Set<String> split(String value) {
        if (value == null || value.isBlank()) {
            return new HashSet<>();
        }
        return Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(item -> !item.isEmpty())
            .collect(Collectors.toSet());
    }
}
