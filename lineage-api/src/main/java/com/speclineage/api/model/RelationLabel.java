/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Semantic relation between an ordered pair of scripts {@code (s1, s2)}.
 *
 * <p>The labels come from two satisfiability checks, {@code F1 and not F2} and
 * {@code F2 and not F1}. They are a heuristic reading of the solver's answers,
 * not a proof: symbol renaming, incremental scopes and scripts that are
 * unsatisfiable on their own are not accounted for.
 */
public enum RelationLabel {
    /** Both directions unsat. */
    EQUIVALENT("equivalent"),

    /** Both directions sat. */
    INCOMPARABLE("incomparable"),

    /** {@code F1 and not F2} unsat, {@code F2 and not F1} sat. */
    S1_REFINES_S2("s1_refines_s2"),

    /** {@code F1 and not F2} sat, {@code F2 and not F1} unsat. */
    S2_REFINES_S1("s2_refines_s1"),

    /** Any other combination of solver answers, including timeouts. */
    UNKNOWN("unknown"),

    /** The scripts could not be compared (missing, unparseable, solver error). */
    ERROR("ERROR");

    private final String wireName;

    RelationLabel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Label of the swapped pair {@code (s2, s1)}.
     */
    public RelationLabel inverse() {
        return switch (this) {
            case S1_REFINES_S2 -> S2_REFINES_S1;
            case S2_REFINES_S1 -> S1_REFINES_S2;
            default -> this;
        };
    }

    /** Labels that a non-consecutive pass can target. */
    public static Set<RelationLabel> targetLabels() {
        return EnumSet.of(EQUIVALENT, INCOMPARABLE, S1_REFINES_S2, S2_REFINES_S1);
    }

    public boolean isDefinite() {
        return targetLabels().contains(this);
    }

    public static RelationLabel fromWireName(String name) {
        for (RelationLabel label : values()) {
            if (label.wireName.equalsIgnoreCase(name) || label.name().equalsIgnoreCase(name)) {
                return label;
            }
        }
        // older result tables wrote solver failures as Z3_ERROR
        if ("Z3_ERROR".equalsIgnoreCase(name)) {
            return ERROR;
        }
        throw new IllegalArgumentException("Unknown relation label: " + name);
    }
}
