package com.mchekin.runnerdispatch.dto;

public enum Intent {
    IGNORE,
    ACKNOWLEDGE,
    PROVISION_CANDIDATE
}
