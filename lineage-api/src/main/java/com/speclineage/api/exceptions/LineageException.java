/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.exceptions;

/**
 * Base class of the analyzer's failures.
 *
 * <p>Unchecked, like the compilation failures of the rest of the pipeline, so
 * that per-pair degradation paths can catch exactly what they handle.
 */
public class LineageException extends RuntimeException {

    public LineageException(String message) {
        super(message);
    }

    public LineageException(String message, Throwable cause) {
        super(message, cause);
    }
}
