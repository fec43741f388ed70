package com.mchekin.runnerdispatch.github;

import java.time.Instant;

/**
 * Token returned by GitHub for installations and runner registration/removal.
 */
public record AccessToken(String token, Instant expiresAt) {

    @Override
    public String toString() {
        return "AccessToken[expiresAt=" + expiresAt + "]";
    }
}
