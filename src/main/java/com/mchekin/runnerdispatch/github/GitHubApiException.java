package com.mchekin.runnerdispatch.github;

import lombok.Getter;

/**
 * A GitHub API call failed: non-2xx status, I/O error or timeout.
 */
@Getter
public class GitHubApiException extends RuntimeException {

    /** HTTP status, or 0 when no response was received. */
    private final int statusCode;

    public GitHubApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }
}
