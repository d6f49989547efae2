/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationContext;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a finite number lies between two bounds, inclusive by default.
 */
public class RangeRule extends SyncRule<Number> {

    private final double min;
    private final double max;
    private final boolean inclusive;

    public RangeRule(String name, double min, double max, boolean inclusive, RuleOptions options) {
        super(name, String.format("Validate value is between %s and %s", format(min), format(max)), options);
        if (min > max) {
            throw new IllegalArgumentException(String.format("min %s is greater than max %s", format(min), format(max)));
        }
        this.min = min;
        this.max = max;
        this.inclusive = inclusive;
    }

    public RangeRule(String name, double min, double max) {
        this(name, min, max, true, RuleOptions.defaults());
    }

    @Override
    public boolean appliesTo(Object value) {
        return value instanceof Number number && Double.isFinite(number.doubleValue());
    }

    @Override
    protected RuleResult validateSync(Number value, ValidationContext context) {
        double x = value.doubleValue();
        boolean inRange = inclusive ? x >= min && x <= max : x > min && x < max;

        if (inRange) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("min", min);
            metadata.put("max", max);
            metadata.put("value", value);
            return success(metadata);
        }

        String op = inclusive ? "≤" : "<";
        Map<String, Object> errorContext = new LinkedHashMap<>();
        errorContext.put("min", min);
        errorContext.put("max", max);
        errorContext.put("inclusive", inclusive);
        return failure(
                ErrorCodes.VALUE_OUT_OF_RANGE,
                String.format("Value %s is not in range %s %s x %s %s", format(x), format(min), op, op, format(max)),
                context,
                List.of(String.format("Provide value between %s and %s", format(min), format(max))),
                errorContext,
                value);
    }

    /**
     * Renders whole numbers without a fraction, e.g. {@code 150} rather than {@code 150.0}.
     */
    static String format(double number) {
        if (Double.isInfinite(number) || Double.isNaN(number)) {
            return Double.toString(number);
        }
        return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
    }
}
