/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Opaque identifier of a script revision.
 *
 * <p>Upstream exports frequently carry integer ids as floating point values
 * ({@code 4711.0}) and encode a missing parent as {@code NaN} or {@code None}.
 * {@link #parse(Object)} canonicalizes both forms so that the same revision
 * always maps to the same id and the same artifact file.
 */
public record ScriptId(String value) implements Serializable, Comparable<ScriptId> {

    public ScriptId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Script id cannot be blank");
        }
    }

    public static ScriptId of(String value) {
        return new ScriptId(value.trim());
    }

    /**
     * Parses a raw id cell. Returns empty for the root markers
     * ({@code null}, blank, {@code nan}, {@code none}, {@code null}).
     */
    public static Optional<ScriptId> parse(Object raw) {
        if (raw == null) {
            return Optional.empty();
        }
        if (raw instanceof Number number) {
            return parseNumber(number);
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("nan") || lower.equals("none") || lower.equals("null")) {
            return Optional.empty();
        }
        // "12.0" -> "12"
        if (text.endsWith(".0") && text.length() > 2 && isDigits(text.substring(0, text.length() - 2))) {
            text = text.substring(0, text.length() - 2);
        }
        return Optional.of(new ScriptId(text));
    }

    /**
     * Integral types keep every digit; floating point values are rendered
     * from their exact decimal form, so {@code 4711.0} becomes {@code 4711}.
     */
    private static Optional<ScriptId> parseNumber(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof BigInteger
                || number instanceof Short || number instanceof Byte) {
            return Optional.of(new ScriptId(number.toString()));
        }
        BigDecimal decimal;
        if (number instanceof BigDecimal big) {
            decimal = big;
        } else {
            double d = number.doubleValue();
            if (Double.isNaN(d)) {
                return Optional.empty();
            }
            if (Double.isInfinite(d)) {
                return Optional.of(new ScriptId(number.toString()));
            }
            decimal = BigDecimal.valueOf(d);
        }
        if (decimal.signum() == 0) {
            return Optional.of(new ScriptId("0"));
        }
        return Optional.of(new ScriptId(decimal.stripTrailingZeros().toPlainString()));
    }

    private static boolean isDigits(String s) {
        int start = s.startsWith("-") ? 1 : 0;
        if (start == s.length()) {
            return false;
        }
        for (int i = start; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(ScriptId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
