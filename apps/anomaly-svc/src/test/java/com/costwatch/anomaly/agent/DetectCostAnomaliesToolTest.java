package com.costwatch.anomaly.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.costwatch.anomaly.config.CostwatchProperties;
import com.costwatch.anomaly.detection.AnomalyDetectionService;
import com.costwatch.anomaly.detection.DetectionQuery;
import com.costwatch.anomaly.model.Anomaly;
import com.costwatch.anomaly.model.DetectionSettings;
import com.costwatch.anomaly.model.GroupKey;
import com.costwatch.anomaly.model.GroupingDimensions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.LocalDate;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class DetectCostAnomaliesToolTest {

    private static final LocalDate DAY = LocalDate.of(2025, 1, 15);

    @Mock
    AnomalyDetectionService detectionService;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DetectCostAnomaliesTool tool;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        tool = new DetectCostAnomaliesTool(detectionService, new CostwatchProperties(null, null), objectMapper);
    }

    @Test
    void specificationDescribesInputs() {
        ObjectNode spec = tool.specification();

        JsonNode toolSpec = spec.get("toolSpec");
        assertThat(toolSpec.get("name").asText()).isEqualTo("detect_cost_anomalies");
        JsonNode props = toolSpec.at("/inputSchema/json/properties");
        assertThat(props.get("days").get("type").asText()).isEqualTo("integer");
        assertThat(props.at("/sensitivity/enum")).extracting(JsonNode::asText).containsExactly("low", "medium", "high");
        assertThat(props.at("/group_by/items/enum")).extracting(JsonNode::asText)
                .containsExactly("product_code", "usage_account_id", "region");
        assertThat(toolSpec.at("/inputSchema/json/required")).isEmpty();
    }

    @Test
    void defaultsComeFromConfiguration() {
        when(detectionService.detect(any())).thenReturn(List.of());

        ObjectNode result = tool.execute(objectMapper.createObjectNode());

        ArgumentCaptor<DetectionQuery> query = ArgumentCaptor.forClass(DetectionQuery.class);
        verify(detectionService).detect(query.capture());
        assertThat(query.getValue().grouping()).isEqualTo(GroupingDimensions.SERVICE);
        assertThat(query.getValue().settings()).isEqualTo(new DetectionSettings(14, 2.5, 1.0, 20.0));
        assertThat(result.get("anomaly_count").asInt()).isZero();
        assertThat(result.at("/parameters/days").asInt()).isEqualTo(14);
        assertThat(result.at("/parameters/sensitivity").asText()).isEqualTo("medium");
        assertThat(result.at("/parameters/group_by/0").asText()).isEqualTo("product_code");
        assertThat(result.get("summary").asText()).startsWith("0 anomalies detected over the last 14 days");
    }

    @Test
    void rendersRoundedFindings() throws Exception {
        when(detectionService.detect(any())).thenReturn(List.of(point(), trend()));

        ObjectNode result = tool.execute(objectMapper.readTree("""
                {"days": 7, "sensitivity": "high", "group_by": ["product_code", "usage_account_id"]}
                """));

        ArgumentCaptor<DetectionQuery> query = ArgumentCaptor.forClass(DetectionQuery.class);
        verify(detectionService).detect(query.capture());
        assertThat(query.getValue().grouping()).isEqualTo(GroupingDimensions.SERVICE_ACCOUNT);
        assertThat(query.getValue().settings().zScoreThreshold()).isEqualTo(2.0);
        assertThat(query.getValue().settings().windowDays()).isEqualTo(7);

        assertThat(result.get("anomaly_count").asInt()).isEqualTo(2);
        JsonNode point = result.at("/anomalies/0");
        assertThat(point.get("kind").asText()).isEqualTo("point");
        assertThat(point.get("group_by").asText()).isEqualTo("product_code+usage_account_id");
        assertThat(point.get("group_value").asText()).isEqualTo("AmazonEC2 / 111");
        assertThat(point.get("usage_date").asText()).isEqualTo("2025-01-15");
        assertThat(point.get("z_score").decimalValue()).isEqualByComparingTo("5.40");
        assertThat(point.get("current_cost").decimalValue()).isEqualByComparingTo("20.00");
        assertThat(point.get("mad").decimalValue()).isEqualByComparingTo("1.2346");
        assertThat(point.get("severity").asText()).isEqualTo("critical");
        assertThat(point.get("direction").asText()).isEqualTo("spike");
        assertThat(point.has("drift_pct")).isFalse();

        JsonNode trend = result.at("/anomalies/1");
        assertThat(trend.get("kind").asText()).isEqualTo("trend");
        assertThat(trend.get("direction").asText()).isEqualTo("drift_up");
        assertThat(trend.get("drift_pct").decimalValue()).isEqualByComparingTo("87.5");
        assertThat(trend.get("window_start").asText()).isEqualTo("2025-01-09");
        assertThat(trend.has("z_score")).isFalse();
    }

    @Test
    void singleGroupByStringIsAccepted() throws Exception {
        when(detectionService.detect(any())).thenReturn(List.of());

        tool.execute(objectMapper.readTree("{\"group_by\": \"usage_account_id\"}"));

        ArgumentCaptor<DetectionQuery> query = ArgumentCaptor.forClass(DetectionQuery.class);
        verify(detectionService).detect(query.capture());
        assertThat(query.getValue().grouping()).isEqualTo(GroupingDimensions.ACCOUNT);
    }

    @Test
    void invalidInputReturnsErrorObject() throws Exception {
        assertThat(tool.execute(objectMapper.readTree("{\"days\": \"two weeks\"}")).has("error")).isTrue();
        assertThat(tool.execute(objectMapper.readTree("{\"days\": 2.5}")).has("error")).isTrue();
        assertThat(tool.execute(objectMapper.readTree("{\"days\": 2}")).get("error").asText()).contains("at least 3 days");
        assertThat(tool.execute(objectMapper.readTree("{\"sensitivity\": \"extreme\"}")).has("error")).isTrue();
        assertThat(tool.execute(objectMapper.readTree("{\"group_by\": [\"line_item_type\"]}")).has("error")).isTrue();
        assertThat(tool.execute(objectMapper.readTree(
                "{\"group_by\": [\"product_code\", \"usage_account_id\", \"region\"]}")).has("error")).isTrue();

        verify(detectionService, never()).detect(any());
    }

    private static Anomaly point() {
        return new Anomaly(GroupKey.of("AmazonEC2", "111"), GroupingDimensions.SERVICE_ACCOUNT, Anomaly.Kind.POINT, DAY,
                0.6745 * 8, Anomaly.Direction.SPIKE, Anomaly.Severity.CRITICAL,
                new Anomaly.Baseline(20.0, 12.0, 1.23456, 5, DAY.minusDays(5), OptionalDouble.empty()));
    }

    private static Anomaly trend() {
        return new Anomaly(GroupKey.of("AmazonEC2", "222"), GroupingDimensions.SERVICE_ACCOUNT, Anomaly.Kind.TREND, DAY,
                87.5, Anomaly.Direction.DRIFT_UP, Anomaly.Severity.WARNING,
                new Anomaly.Baseline(22.0, 16.0, 4.0, 7, DAY.minusDays(6), OptionalDouble.of(2.0)));
    }
}
