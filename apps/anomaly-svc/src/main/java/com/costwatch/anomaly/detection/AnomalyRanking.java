package com.costwatch.anomaly.detection;

import com.costwatch.anomaly.model.Anomaly;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * The one ordering every consumer receives findings in: severity first, then kind
 * (point before trend, their magnitudes are not comparable), then magnitude
 * descending, then group key, then date.
 */
public final class AnomalyRanking {

    public static final Comparator<Anomaly> ORDER = Comparator
            .comparing(Anomaly::severity)
            .thenComparing(Anomaly::kind)
            .thenComparing(Comparator.comparingDouble(Anomaly::magnitude).reversed())
            .thenComparing(Anomaly::key)
            .thenComparing(Anomaly::date);

    private AnomalyRanking() {
    }

    public static List<Anomaly> rank(Collection<Anomaly> findings) {
        List<Anomaly> ranked = new ArrayList<>(findings);
        ranked.sort(ORDER);
        return List.copyOf(ranked);
    }
}
