package com.mchekin.runnerdispatch.compute;

public class ComputeLaunchException extends RuntimeException {

    public ComputeLaunchException(String message) {
        super(message);
    }

    public ComputeLaunchException(String message, Throwable cause) {
        super(message, cause);
    }
}
