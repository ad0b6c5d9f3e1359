package com.deviceguard.domain;

public record EffectiveSettings(int maxDevices, String blockMessage, Source source) {

    public enum Source {
        CUSTOMER("customer"),
        GLOBAL("global"),
        DEFAULT("default");

        private final String code;

        Source(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
