/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.List;

/**
 * Cached outcome of a standalone solver run over one script.
 *
 * <p>{@code checks} holds one token per {@code (check-sat)} the solver answered,
 * or the single token {@code ERROR} when it reported an error. A script whose
 * record carries an error is never compared semantically.
 *
 * @param file      path of the script as it was checked
 * @param validSpec {@code "True"}, {@code "False"}, {@code "NA"} (timeout) or {@code "ERROR"}
 * @param checks    answer tokens
 * @param timeTaken seconds as text, {@code "TO"} on timeout
 */
public record SolverCheckRecord(String file, String validSpec, List<String> checks, String timeTaken) {

    public static final String ERROR_TOKEN = "ERROR";

    public SolverCheckRecord {
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public boolean hasError() {
        return checks.contains(ERROR_TOKEN);
    }

    public boolean isValidSpec() {
        return "True".equalsIgnoreCase(validSpec);
    }

    public String basename() {
        int slash = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
        return slash < 0 ? file : file.substring(slash + 1);
    }
}
