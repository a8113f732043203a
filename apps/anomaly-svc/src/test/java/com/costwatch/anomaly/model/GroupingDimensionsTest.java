package com.costwatch.anomaly.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class GroupingDimensionsTest {

    @Test
    void labelsCoverSinglesAndPairs() {
        assertThat(GroupingDimensions.supportedLabels()).containsExactly(
                "service", "account", "region", "service+account", "service+region", "account+region");
        assertThat(GroupingDimensions.SERVICE_ACCOUNT.columnLabel()).isEqualTo("product_code+usage_account_id");
    }

    @Test
    void parsesLabelCaseInsensitively() {
        assertThat(GroupingDimensions.fromLabel(" Service+Region ")).isEqualTo(GroupingDimensions.SERVICE_REGION);
    }

    @Test
    void acceptsQueryDecodedSeparators() {
        assertThat(GroupingDimensions.fromLabel("service account")).isEqualTo(GroupingDimensions.SERVICE_ACCOUNT);
        assertThat(GroupingDimensions.fromLabel("account,region")).isEqualTo(GroupingDimensions.ACCOUNT_REGION);
        assertThat(GroupingDimensions.fromLabel("service + region")).isEqualTo(GroupingDimensions.SERVICE_REGION);
    }

    @Test
    void rejectsUnknownLabel() {
        assertThatThrownBy(() -> GroupingDimensions.fromLabel("service+account+region"))
                .isInstanceOf(InvalidGroupingException.class)
                .hasMessageContaining("service+account");
        assertThatThrownBy(() -> GroupingDimensions.fromLabel("operation"))
                .isInstanceOf(InvalidGroupingException.class);
        assertThatThrownBy(() -> GroupingDimensions.fromLabel(""))
                .isInstanceOf(InvalidGroupingException.class);
    }

    @Test
    void columnsResolveInAnyOrder() {
        assertThat(GroupingDimensions.fromColumns(List.of("product_code"))).isEqualTo(GroupingDimensions.SERVICE);
        assertThat(GroupingDimensions.fromColumns(List.of("region", "usage_account_id")))
                .isEqualTo(GroupingDimensions.ACCOUNT_REGION);
    }

    @Test
    void rejectsInvalidColumnSets() {
        assertThatThrownBy(() -> GroupingDimensions.fromColumns(List.of()))
                .isInstanceOf(InvalidGroupingException.class);
        assertThatThrownBy(() -> GroupingDimensions.fromColumns(List.of("product_code", "product_code")))
                .isInstanceOf(InvalidGroupingException.class)
                .hasMessageContaining("more than once");
        assertThatThrownBy(() -> GroupingDimensions.fromColumns(List.of("product_code", "usage_account_id", "region")))
                .isInstanceOf(InvalidGroupingException.class)
                .hasMessageContaining("at most two");
        assertThatThrownBy(() -> GroupingDimensions.fromColumns(List.of("line_item_type")))
                .isInstanceOf(InvalidGroupingException.class);
    }

    @Test
    void keyFollowsDimensionOrder() {
        CostRow row = new CostRow(LocalDate.of(2025, 1, 15), "AmazonEC2", "111", null, BigDecimal.TEN);

        assertThat(GroupingDimensions.SERVICE_REGION.keyOf(row)).isEqualTo(GroupKey.of("AmazonEC2", "unknown"));
        assertThat(GroupingDimensions.SERVICE_ACCOUNT.keyOf(row).label()).isEqualTo("AmazonEC2 / 111");
    }
}
