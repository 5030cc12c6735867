package com.toolport.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/** Checks {@code Authorization: Bearer <secret>} against the worker secret. */
public class SharedSecretAuthenticator {

    private static final String AUTH_PREFIX = "Bearer ";

    private final byte[] secret;

    public SharedSecretAuthenticator(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("Secret cannot be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
    }

    public boolean authenticate(String authorizationHeader) {
        var token = bearerToken(authorizationHeader);
        if (token == null) {
            return false;
        }
        // constant time
        return MessageDigest.isEqual(secret, token.getBytes(StandardCharsets.UTF_8));
    }

    /** Returns the bearer token, or null if the header is absent or not a bearer header. */
    public static String bearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return null;
        }
        var header = authorizationHeader.trim();
        if (!header.regionMatches(true, 0, AUTH_PREFIX, 0, AUTH_PREFIX.length())) {
            return null;
        }
        var token = header.substring(AUTH_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
