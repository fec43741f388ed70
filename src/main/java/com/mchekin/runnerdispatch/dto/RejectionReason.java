package com.mchekin.runnerdispatch.dto;

public enum RejectionReason {
    COOLDOWN_ACTIVE("cooldown-active"),
    CAPACITY_SATURATED("capacity-saturated"),
    SUFFICIENT_RUNNERS("sufficient-runners"),
    QUEUE_CHECK_FAILED("queue-check-failed"),
    INSUFFICIENT_PERMISSIONS("insufficient-permissions"),
    NO_CREDENTIAL("no-credential");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
