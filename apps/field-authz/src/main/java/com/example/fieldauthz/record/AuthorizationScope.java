package com.example.fieldauthz.record;

/**
 * Undo handle of a scoped authorization change, for use with try-with-resources.
 *
 * <pre>
 * try (AuthorizationScope ignored = user.allowed("update", "username")) {
 *     user.set("username", "jdoe");
 * }
 * </pre>
 */
@FunctionalInterface
public interface AuthorizationScope extends AutoCloseable {

    AuthorizationScope NOOP = () -> { };

    @Override
    void close();
}
