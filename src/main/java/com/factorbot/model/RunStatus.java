package com.factorbot.model;

import java.util.Locale;

public enum RunStatus {
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed");

    private final String label;

    RunStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static RunStatus fromLabel(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return FAILED;
        }
        String target = raw.trim().toLowerCase(Locale.ROOT);
        for (RunStatus status : values()) {
            if (status.label.equals(target)) {
                return status;
            }
        }
        return FAILED;
    }
}
