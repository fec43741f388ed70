package com.mchekin.runnerdispatch.domain;

public enum AccountType {
    USER,
    ORGANIZATION;

    /**
     * Maps GitHub's {@code account.type} ("User", "Organization", "Bot") onto the directory's two kinds.
     */
    public static AccountType fromGitHub(String type) {
        return "Organization".equalsIgnoreCase(type) ? ORGANIZATION : USER;
    }
}
