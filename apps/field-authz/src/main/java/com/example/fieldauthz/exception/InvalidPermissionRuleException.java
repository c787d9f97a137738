package com.example.fieldauthz.exception;

import lombok.Getter;

/**
 * Thrown when a permission shorthand cannot be compiled.
 * Raised at registration time, never during a field access.
 */
@Getter
public class InvalidPermissionRuleException extends RuntimeException {

    private final String role;

    public InvalidPermissionRuleException(String role, String message) {
        super(String.format("Invalid permission shorthand for '%s': %s", role, message));
        this.role = role;
    }
}
