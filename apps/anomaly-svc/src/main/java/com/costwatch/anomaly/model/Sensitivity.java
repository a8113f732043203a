package com.costwatch.anomaly.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Caller facing presets for the point detection z-score threshold.
 */
public enum Sensitivity {
    LOW(3.0d),
    MEDIUM(2.5d),
    HIGH(2.0d);

    private final double zScoreThreshold;

    Sensitivity(double zScoreThreshold) {
        this.zScoreThreshold = zScoreThreshold;
    }

    public double zScoreThreshold() {
        return zScoreThreshold;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Sensitivity fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toUpperCase(Locale.ROOT);
            for (Sensitivity sensitivity : values()) {
                if (sensitivity.name().equals(normalized)) {
                    return sensitivity;
                }
            }
        }
        throw new InvalidConfigurationException("sensitivity must be one of " + labels() + ", got '" + label + "'");
    }

    /**
     * Closest preset for an arbitrary configured threshold.
     */
    public static Sensitivity forThreshold(double zScoreThreshold) {
        if (zScoreThreshold >= LOW.zScoreThreshold) {
            return LOW;
        }
        if (zScoreThreshold >= MEDIUM.zScoreThreshold) {
            return MEDIUM;
        }
        return HIGH;
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(Sensitivity::label).toList();
    }
}
