package com.factorbot.model;

public enum QualityFlag {
    STALE_PRICE("stale_price"),
    FINANCIAL_STALE("financial_stale"),
    DATA_EXPIRED("data_expired"),
    CAPPED("capped");

    private final String label;

    QualityFlag(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
