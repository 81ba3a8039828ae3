/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

/**
 * Positions {@code (first, second)} of two scripts inside one chain.
 */
public record IndexPair(int first, int second) {

    public IndexPair {
        if (first < 0 || second <= first) {
            throw new IllegalArgumentException("Invalid index pair (" + first + ", " + second + ")");
        }
    }

    public int span() {
        return second - first;
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
