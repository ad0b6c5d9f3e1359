package com.deviceguard.domain;

import jakarta.annotation.Nullable;

public record AdmissionDecision(boolean allowed, @Nullable Reason reason, String message) {

    public enum Reason {
        REGISTERED("registered"),
        ALREADY_REGISTERED("already_registered");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }

    public static AdmissionDecision allowed(Reason reason, String message) {
        return new AdmissionDecision(true, reason, message);
    }

    public static AdmissionDecision denied(String blockMessage) {
        return new AdmissionDecision(false, null, blockMessage);
    }
}
