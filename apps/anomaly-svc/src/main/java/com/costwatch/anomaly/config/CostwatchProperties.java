package com.costwatch.anomaly.config;

import com.costwatch.anomaly.model.DetectionSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "costwatch")
public record CostwatchProperties(
        @Valid Anomaly anomaly,
        @Valid Store store
) {

    @ConstructorBinding
    public CostwatchProperties {
        if (anomaly == null) {
            anomaly = new Anomaly(null, null, null, null, null);
        }
        if (store == null) {
            store = new Store(null);
        }
    }

    /**
     * Defaults applied to every detection request that does not override them.
     */
    public record Anomaly(
            @Min(DetectionSettings.MIN_WINDOW_DAYS) Integer rollingWindowDays,
            @Positive Double zScoreThreshold,
            @PositiveOrZero Double minDailyCost,
            @Positive Double driftThresholdPct,
            @Min(1) @Max(64) Integer parallelism
    ) {
        public Anomaly {
            if (rollingWindowDays == null) rollingWindowDays = 14;
            if (zScoreThreshold == null) zScoreThreshold = 2.5d;
            if (minDailyCost == null) minDailyCost = 1.0d;
            if (driftThresholdPct == null) driftThresholdPct = DetectionSettings.DEFAULT_DRIFT_THRESHOLD_PERCENT;
            if (parallelism == null) parallelism = 4;
        }

        public DetectionSettings toSettings() {
            return new DetectionSettings(rollingWindowDays, zScoreThreshold, minDailyCost, driftThresholdPct);
        }
    }

    public record Store(@Pattern(regexp = "memory|jdbc") String type) {
        public Store {
            if (type == null || type.isBlank()) {
                type = "memory";
            }
        }
    }
}
