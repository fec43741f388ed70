package com.mchekin.runnerdispatch.domain;

public enum DeliveryOutcome {
    IGNORED,
    ACKNOWLEDGED,
    REJECTED,
    PROVISIONED,
    PROVISION_FAILED
}
