package com.mchekin.runnerdispatch.dto;

import java.time.Instant;

/**
 * Short-lived bearer credential for the GitHub API.
 *
 * @param expiresAt null when the source does not report an expiry (static fallback token)
 */
public record Credential(String token, Source source, Instant expiresAt) {

    public enum Source {
        INSTALLATION,
        FALLBACK
    }

    public boolean installationScoped() {
        return source == Source.INSTALLATION;
    }

    @Override
    public String toString() {
        return "Credential[source=" + source + ", expiresAt=" + expiresAt + "]";
    }
}
