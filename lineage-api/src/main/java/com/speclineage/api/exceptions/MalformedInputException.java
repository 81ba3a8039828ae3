/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.exceptions;

import java.nio.file.Path;

/**
 * An input table (edge dataset, chain table, solver results) cannot be read.
 * Fatal for the current run.
 */
public class MalformedInputException extends LineageException {

    private final Path source;

    public MalformedInputException(Path source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public MalformedInputException(Path source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
