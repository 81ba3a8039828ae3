/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.oracle;

import com.speclineage.api.model.OracleResult;
import com.speclineage.api.model.OracleStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the text a solver printed.
 *
 * <p>Any line starting with {@code (error} makes the whole exchange an error,
 * on either stream. Otherwise the first standard output line that is exactly
 * {@code sat}, {@code unsat} or {@code unknown} is the answer; standard error
 * never contributes answers.
 */
public final class OracleOutputParser {

    private static final Pattern ERROR_LINE = Pattern.compile("^\\(error.*", Pattern.MULTILINE);
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private OracleOutputParser() {
    }

    public static boolean hasError(String output) {
        return output != null && ERROR_LINE.matcher(output).find();
    }

    public static boolean hasError(OracleResult result) {
        return hasError(result.rawOutput()) || hasError(result.errorOutput());
    }

    public static OracleStatus parseStatus(String output) {
        return parseStatus(output, "");
    }

    public static OracleStatus parseStatus(String stdout, String stderr) {
        if (hasError(stdout) || hasError(stderr)) {
            return OracleStatus.ERROR;
        }
        List<String> tokens = checkTokens(stdout);
        if (tokens.isEmpty()) {
            return OracleStatus.UNKNOWN;
        }
        return switch (tokens.get(0)) {
            case "sat" -> OracleStatus.SAT;
            case "unsat" -> OracleStatus.UNSAT;
            default -> OracleStatus.UNKNOWN;
        };
    }

    /**
     * Every {@code sat}/{@code unsat}/{@code unknown} answer, in output order.
     */
    public static List<String> checkTokens(String output) {
        List<String> tokens = new ArrayList<>();
        if (output == null || output.isEmpty()) {
            return tokens;
        }
        for (String line : LINE_BREAK.split(output)) {
            String trimmed = line.strip();
            if (trimmed.equals("sat") || trimmed.equals("unsat") || trimmed.equals("unknown")) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }
}
