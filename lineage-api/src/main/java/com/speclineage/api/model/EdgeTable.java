/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Insertion-ordered {@code id -> parent} table read once per run.
 *
 * <p>Every id has at most one parent; a later edge for the same id replaces the
 * earlier one but keeps its original position, the same way a dictionary built
 * from the dataset rows behaves. Iteration order is the input order, which makes
 * chain reconstruction deterministic.
 */
public final class EdgeTable {

    private final Map<ScriptId, ScriptId> parents;

    private EdgeTable(Map<ScriptId, ScriptId> parents) {
        this.parents = Collections.unmodifiableMap(parents);
    }

    public static EdgeTable of(Collection<DerivationEdge> edges) {
        Map<ScriptId, ScriptId> map = new LinkedHashMap<>();
        for (DerivationEdge edge : edges) {
            map.put(edge.id(), edge.parentId());
        }
        return new EdgeTable(map);
    }

    public static EdgeTable empty() {
        return new EdgeTable(new LinkedHashMap<>());
    }

    /** Ids that appear as keys, in input order. */
    public Set<ScriptId> ids() {
        return parents.keySet();
    }

    public boolean contains(ScriptId id) {
        return parents.containsKey(id);
    }

    /**
     * Parent of {@code id}; empty both for roots and for ids that are not keys.
     * Use {@link #contains(ScriptId)} to tell the two apart.
     */
    public Optional<ScriptId> parentOf(ScriptId id) {
        return Optional.ofNullable(parents.get(id));
    }

    public int size() {
        return parents.size();
    }

    public boolean isEmpty() {
        return parents.isEmpty();
    }
}
