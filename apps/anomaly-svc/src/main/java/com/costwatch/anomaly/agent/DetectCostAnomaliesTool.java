package com.costwatch.anomaly.agent;

import com.costwatch.anomaly.config.CostwatchProperties;
import com.costwatch.anomaly.detection.AnomalyDetectionService;
import com.costwatch.anomaly.detection.DetectionQuery;
import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.Dimension;
import com.costwatch.anomaly.model.GroupingDimensions;
import com.costwatch.anomaly.model.Sensitivity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The {@code detect_cost_anomalies} tool offered to the cost assistant agent. Tool
 * results are always JSON objects; invalid input comes back as {@code {"error": ...}}
 * so the model can correct itself instead of the loop failing.
 */
@Component
public class DetectCostAnomaliesTool {

    public static final String NAME = "detect_cost_anomalies";

    private static final Logger log = LoggerFactory.getLogger(DetectCostAnomaliesTool.class);

    private final AnomalyDetectionService detectionService;
    private final CostwatchProperties properties;
    private final ObjectMapper objectMapper;

    public DetectCostAnomaliesTool(AnomalyDetectionService detectionService,
                                   CostwatchProperties properties,
                                   ObjectMapper objectMapper) {
        this.detectionService = detectionService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public ObjectNode specification() {
        ObjectNode spec = objectMapper.createObjectNode();
        ObjectNode toolSpec = spec.putObject("toolSpec");
        toolSpec.put("name", NAME);
        toolSpec.put("description", "Detect cost anomalies in the local database using robust statistical methods "
                + "(median/MAD z-scores for point anomalies, Theil-Sen slope for gradual drift). Returns detected "
                + "anomalies with severity, direction, and statistical details. Use this when the user asks about "
                + "unusual spending, cost spikes, or anomalies.");
        ObjectNode schema = toolSpec.putObject("inputSchema").putObject("json");
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("days")
                .put("type", "integer")
                .put("description", "Rolling window size in days. Default " + properties.anomaly().rollingWindowDays() + ".");
        ObjectNode sensitivity = props.putObject("sensitivity");
        sensitivity.put("type", "string");
        ArrayNode levels = sensitivity.putArray("enum");
        Sensitivity.labels().forEach(levels::add);
        sensitivity.put("description", "Detection sensitivity: low (z>3), medium (z>2.5), high (z>2). Default "
                + defaultSensitivity().label() + ".");
        ObjectNode groupBy = props.putObject("group_by");
        groupBy.put("type", "array");
        ObjectNode items = groupBy.putObject("items");
        items.put("type", "string");
        ArrayNode columns = items.putArray("enum");
        for (Dimension dimension : Dimension.values()) {
            columns.add(dimension.column());
        }
        groupBy.put("description", "Dimensions to group by. Default ['product_code']. Use two for drill-down "
                + "(e.g. service + account).");
        schema.putArray("required");
        return spec;
    }

    public ObjectNode execute(JsonNode input) {
        JsonNode args = input == null || input.isNull() ? objectMapper.createObjectNode() : input;
        CostwatchProperties.Anomaly defaults = properties.anomaly();
        try {
            int days = args.hasNonNull("days") ? readDays(args.get("days")) : defaults.rollingWindowDays();
            Sensitivity sensitivity = args.hasNonNull("sensitivity")
                    ? Sensitivity.fromLabel(args.get("sensitivity").asText())
                    : defaultSensitivity();
            List<String> columns = args.hasNonNull("group_by")
                    ? readColumns(args.get("group_by"))
                    : List.of(Dimension.SERVICE.column());
            GroupingDimensions grouping = GroupingDimensions.fromColumns(columns);
            DetectionSettings settings = DetectionSettings.of(days, sensitivity, defaults.minDailyCost(), defaults.driftThresholdPct());

            List<Anomaly> anomalies = detectionService.detect(DetectionQuery.of(grouping, settings));
            return result(anomalies, days, sensitivity, columns);
        } catch (IllegalArgumentException e) {
            log.debug("{} rejected input {}: {}", NAME, args, e.getMessage());
            return error(e.getMessage());
        }
    }

    private ObjectNode result(List<Anomaly> anomalies, int days, Sensitivity sensitivity, List<String> columns) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("anomaly_count", anomalies.size());
        ArrayNode entries = result.putArray("anomalies");
        for (Anomaly anomaly : anomalies) {
            ObjectNode entry = entries.addObject();
            entry.put("usage_date", anomaly.date().toString());
            entry.put("group_by", anomaly.grouping().columnLabel());
            entry.put("group_value", anomaly.key().label());
            entry.put("current_cost", round(anomaly.baseline().currentCost(), 2));
            entry.put("median_cost", round(anomaly.baseline().median(), 2));
            entry.put("mad", round(anomaly.baseline().mad(), 4));
            entry.put("severity", anomaly.severity().name().toLowerCase(Locale.ROOT));
            entry.put("direction", anomaly.direction().name().toLowerCase(Locale.ROOT));
            entry.put("kind", anomaly.kind().name().toLowerCase(Locale.ROOT));
            if (anomaly.kind() == Anomaly.Kind.TREND) {
                entry.put("window_start", anomaly.windowStart().toString());
                entry.put("drift_pct", round(anomaly.metric(), 1));
            } else {
                entry.put("z_score", round(anomaly.metric(), 2));
            }
        }
        ObjectNode parameters = result.putObject("parameters");
        parameters.put("days", days);
        parameters.put("sensitivity", sensitivity.label());
        ArrayNode groupBy = parameters.putArray("group_by");
        columns.forEach(groupBy::add);
        result.put("summary", anomalies.size() + " anomalies detected over the last " + days
                + " days (sensitivity=" + sensitivity.label() + ").");
        return result;
    }

    private ObjectNode error(String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("error", message);
        return error;
    }

    private Sensitivity defaultSensitivity() {
        return Sensitivity.forThreshold(properties.anomaly().zScoreThreshold());
    }

    private static int readDays(JsonNode node) {
        if (!node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new IllegalArgumentException("days must be an integer, got " + node);
        }
        return node.intValue();
    }

    private static List<String> readColumns(JsonNode node) {
        List<String> columns = new ArrayList<>();
        if (node.isTextual()) {
            columns.add(node.asText());
        } else if (node.isArray()) {
            node.forEach(item -> columns.add(item.asText()));
        } else {
            throw new IllegalArgumentException("group_by must be a list of dimension names, got " + node);
        }
        return columns;
    }

    private static BigDecimal round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }
}
