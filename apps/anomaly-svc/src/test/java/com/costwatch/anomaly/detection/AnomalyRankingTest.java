package com.costwatch.anomaly.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.GroupKey;
import com.costwatch.anomaly.model.GroupingDimensions;
import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class AnomalyRankingTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    @Test
    void severityComesFirst() {
        Anomaly warning = point("AmazonEC2", 3.5, Anomaly.Severity.WARNING, DAY);
        Anomaly critical = point("AmazonS3", 4.5, Anomaly.Severity.CRITICAL, DAY);
        Anomaly criticalTrend = trend("AmazonRDS", 300, Anomaly.Severity.CRITICAL);

        assertThat(AnomalyRanking.rank(List.of(warning, criticalTrend, critical)))
                .containsExactly(critical, criticalTrend, warning);
    }

    @Test
    void largerMagnitudeFirstRegardlessOfSign() {
        Anomaly spike = point("AmazonEC2", 5.0, Anomaly.Severity.CRITICAL, DAY);
        Anomaly drop = point("AmazonS3", -8.0, Anomaly.Severity.CRITICAL, DAY);

        assertThat(AnomalyRanking.rank(List.of(spike, drop))).containsExactly(drop, spike);
    }

    @Test
    void equalMagnitudeFallsBackToKeyThenDate() {
        Anomaly s3 = point("AmazonS3", 10.0, Anomaly.Severity.CRITICAL, DAY);
        Anomaly ec2Late = point("AmazonEC2", 10.0, Anomaly.Severity.CRITICAL, DAY);
        Anomaly ec2Early = point("AmazonEC2", 10.0, Anomaly.Severity.CRITICAL, DAY.minusDays(3));

        assertThat(AnomalyRanking.rank(List.of(s3, ec2Late, ec2Early))).containsExactly(ec2Early, ec2Late, s3);
    }

    @Test
    void pointPrecedesTrendAtEqualSeverity() {
        Anomaly point = point("AmazonS3", 3.5, Anomaly.Severity.WARNING, DAY);
        Anomaly trend = trend("AmazonEC2", 60, Anomaly.Severity.WARNING);

        assertThat(AnomalyRanking.rank(List.of(trend, point))).containsExactly(point, trend);
    }

    private static Anomaly point(String service, double z, Anomaly.Severity severity, LocalDate date) {
        return new Anomaly(GroupKey.of(service), GroupingDimensions.SERVICE, Anomaly.Kind.POINT, date, z,
                z > 0 ? Anomaly.Direction.SPIKE : Anomaly.Direction.DROP, severity,
                new Anomaly.Baseline(100, 50, 5, 13, date.minusDays(13), OptionalDouble.empty()));
    }

    private static Anomaly trend(String service, double drift, Anomaly.Severity severity) {
        return new Anomaly(GroupKey.of(service), GroupingDimensions.SERVICE, Anomaly.Kind.TREND, DAY, drift,
                Anomaly.Direction.DRIFT_UP, severity,
                new Anomaly.Baseline(100, 50, 5, 14, DAY.minusDays(13), OptionalDouble.of(3)));
    }
}
