/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.exceptions;

/**
 * A script could not be turned into a solver query, or the solver exchange failed.
 */
public class OracleFailureException extends LineageException {

    public OracleFailureException(String message) {
        super(message);
    }

    public OracleFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
