package com.mchekin.runnerdispatch.dto;

public record AdmissionDecision(boolean accepted, RejectionReason reason, Credential credential, String triggerAnnotation) {

    public static AdmissionDecision accept(Credential credential, String triggerAnnotation) {
        return new AdmissionDecision(true, null, credential, triggerAnnotation);
    }

    public static AdmissionDecision reject(RejectionReason reason) {
        return new AdmissionDecision(false, reason, null, null);
    }
}
