package com.costwatch.anomaly.model;

/**
 * A single reporting dimension of the daily cost summary.
 */
public enum Dimension {
    SERVICE("service", "product_code"),
    ACCOUNT("account", "usage_account_id"),
    REGION("region", "region");

    private final String label;
    private final String column;

    Dimension(String label, String column) {
        this.label = label;
        this.column = column;
    }

    public String label() {
        return label;
    }

    public String column() {
        return column;
    }
}
