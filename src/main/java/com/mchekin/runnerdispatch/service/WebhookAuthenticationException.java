package com.mchekin.runnerdispatch.service;

public class WebhookAuthenticationException extends RuntimeException {

    public WebhookAuthenticationException(String event) {
        super("Webhook signature verification failed for event: " + event);
    }
}
