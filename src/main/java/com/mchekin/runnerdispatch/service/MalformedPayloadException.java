package com.mchekin.runnerdispatch.service;

public class MalformedPayloadException extends RuntimeException {

    public MalformedPayloadException(String event, Throwable cause) {
        super("Webhook payload is not valid JSON for event: " + event, cause);
    }
}
