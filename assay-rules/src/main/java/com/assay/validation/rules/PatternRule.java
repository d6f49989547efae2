/*
 * Copyright (c) 2025 Assay Validation
 * Licensed under the Apache License, Version 2.0
 */
package com.assay.validation.rules;

import com.assay.validation.api.model.ErrorCodes;
import com.assay.validation.api.model.RuleResult;
import com.assay.validation.api.model.ValidationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Checks a string against a regular expression.
 *
 * <p>The pattern is searched for anywhere in the value; anchor it with {@code ^...$}
 * to require a full match.
 */
public class PatternRule extends SyncRule<String> {

    private final Pattern pattern;
    private final String label;

    public PatternRule(String name, Pattern pattern, String label, RuleOptions options) {
        super(name, String.format("Validate string matches %s pattern", label), options);
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        this.label = label;
    }

    public PatternRule(String name, Pattern pattern, String label) {
        this(name, pattern, label, RuleOptions.defaults());
    }

    @Override
    public boolean appliesTo(Object value) {
        return value instanceof String;
    }

    @Override
    protected RuleResult validateSync(String value, ValidationContext context) {
        if (pattern.matcher(value).find()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("pattern", pattern.pattern());
            metadata.put("value", value);
            return success(metadata);
        }

        Map<String, Object> errorContext = new LinkedHashMap<>();
        errorContext.put("pattern", pattern.pattern());
        errorContext.put("patternName", label);
        return failure(
                ErrorCodes.PATTERN_MISMATCH,
                String.format("Value \"%s\" does not match %s pattern", value, label),
                context,
                List.of(String.format("Ensure value matches the required %s format", label)),
                errorContext,
                value);
    }
}
