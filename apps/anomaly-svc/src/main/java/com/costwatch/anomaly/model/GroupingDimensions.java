package com.costwatch.anomaly.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The supported grouping whitelist: every single dimension and every pairwise
 * combination of them. Free-form dimension strings are parsed into one of these
 * constants at the boundary and never travel further.
 */
public enum GroupingDimensions {
    SERVICE(Dimension.SERVICE),
    ACCOUNT(Dimension.ACCOUNT),
    REGION(Dimension.REGION),
    SERVICE_ACCOUNT(Dimension.SERVICE, Dimension.ACCOUNT),
    SERVICE_REGION(Dimension.SERVICE, Dimension.REGION),
    ACCOUNT_REGION(Dimension.ACCOUNT, Dimension.REGION);

    private static final Pattern LABEL_SEPARATOR = Pattern.compile("[+,\\s]+");

    private final List<Dimension> dimensions;

    GroupingDimensions(Dimension... dimensions) {
        this.dimensions = List.of(dimensions);
    }

    public List<Dimension> dimensions() {
        return dimensions;
    }

    /**
     * User facing label, e.g. {@code service+account}.
     */
    public String label() {
        return dimensions.stream().map(Dimension::label).collect(Collectors.joining("+"));
    }

    /**
     * Store column label, e.g. {@code product_code+usage_account_id}.
     */
    public String columnLabel() {
        return dimensions.stream().map(Dimension::column).collect(Collectors.joining("+"));
    }

    public GroupKey keyOf(CostRow row) {
        List<String> values = new ArrayList<>(dimensions.size());
        for (Dimension dimension : dimensions) {
            values.add(row.valueOf(dimension));
        }
        return GroupKey.of(values);
    }

    /**
     * Parses a user facing label. Dimensions may be joined by {@code +}, {@code ,} or
     * whitespace, since an unencoded {@code +} in a query string arrives as a space.
     */
    public static GroupingDimensions fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new InvalidGroupingException("group-by must be one of " + supportedLabels() + ", got blank value");
        }
        String normalized = String.join("+", LABEL_SEPARATOR.split(label.trim().toLowerCase(Locale.ROOT)));
        for (GroupingDimensions grouping : values()) {
            if (grouping.label().equals(normalized)) {
                return grouping;
            }
        }
        throw new InvalidGroupingException("group-by must be one of " + supportedLabels() + ", got '" + label + "'");
    }

    /**
     * Resolves a list of store column names (the agent tool form, e.g.
     * {@code ["product_code", "usage_account_id"]}). Order of the columns is not significant.
     */
    public static GroupingDimensions fromColumns(Collection<String> columns) {
        if (columns == null || columns.isEmpty()) {
            throw new InvalidGroupingException("group_by must name at least one dimension");
        }
        Set<Dimension> requested = new LinkedHashSet<>();
        for (String column : columns) {
            Dimension dimension = Arrays.stream(Dimension.values())
                    .filter(candidate -> candidate.column().equals(column))
                    .findFirst()
                    .orElseThrow(() -> new InvalidGroupingException(
                            "group_by must be one of " + supportedColumns() + ", got '" + column + "'"));
            if (!requested.add(dimension)) {
                throw new InvalidGroupingException("group_by lists '" + column + "' more than once");
            }
        }
        for (GroupingDimensions grouping : values()) {
            if (grouping.dimensions.size() == requested.size() && requested.containsAll(grouping.dimensions)) {
                return grouping;
            }
        }
        throw new InvalidGroupingException("group_by supports at most two dimensions, got " + columns);
    }

    public static List<String> supportedLabels() {
        return Arrays.stream(values()).map(GroupingDimensions::label).toList();
    }

    private static List<String> supportedColumns() {
        return Arrays.stream(Dimension.values()).map(Dimension::column).toList();
    }
}
