package com.deviceguard.service;

public final class ApiException extends RuntimeException {
    private final int status;
    private final String publicMessage;

    public ApiException(int status, String publicMessage) {
        super(publicMessage);
        this.status = status;
        this.publicMessage = publicMessage;
    }

    public int status() {
        return status;
    }

    public String publicMessage() {
        return publicMessage;
    }

    public static ApiException badRequest(String message) {
        return new ApiException(400, message);
    }

    public static ApiException notFound(String message) {
        return new ApiException(404, message);
    }
}
