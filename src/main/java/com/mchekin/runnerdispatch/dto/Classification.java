package com.mchekin.runnerdispatch.dto;

/**
 * Result of classifying one inbound event.
 *
 * @param directoryUpdate the event changes the installation directory
 * @param triggerAnnotation human-readable cause, set only for provision candidates
 */
public record Classification(Intent intent, String message, boolean directoryUpdate, String triggerAnnotation) {

    public static Classification ignore(String message) {
        return new Classification(Intent.IGNORE, message, false, null);
    }

    public static Classification acknowledge(String message) {
        return new Classification(Intent.ACKNOWLEDGE, message, false, null);
    }

    public static Classification directoryUpdate(String message) {
        return new Classification(Intent.ACKNOWLEDGE, message, true, null);
    }

    public static Classification provisionCandidate(String triggerAnnotation) {
        return new Classification(Intent.PROVISION_CANDIDATE, "Provision candidate", false, triggerAnnotation);
    }
}
