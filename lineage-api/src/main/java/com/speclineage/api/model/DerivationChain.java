/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ancestry of a script: the starting id followed by its recorded ancestors,
 * newest first. No id appears twice.
 */
public record DerivationChain(List<ScriptId> members) {

    public static final String SEPARATOR = " -> ";

    public DerivationChain {
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("A derivation chain needs at least one member");
        }
        members = List.copyOf(members);
        if (new HashSet<>(members).size() != members.size()) {
            throw new IllegalArgumentException("Derivation chain repeats an id: " + members);
        }
    }

    public static DerivationChain of(String... ids) {
        List<ScriptId> list = new ArrayList<>(ids.length);
        for (String id : ids) {
            list.add(ScriptId.of(id));
        }
        return new DerivationChain(list);
    }

    /** Starting id of the walk. */
    public ScriptId head() {
        return members.get(0);
    }

    /** Oldest recorded ancestor. */
    public ScriptId root() {
        return members.get(members.size() - 1);
    }

    public int length() {
        return members.size();
    }

    public Set<ScriptId> memberSet() {
        return Set.copyOf(members);
    }

    /** Chronological order, oldest revision first. */
    public List<ScriptId> rootFirst() {
        List<ScriptId> reversed = new ArrayList<>(members);
        Collections.reverse(reversed);
        return Collections.unmodifiableList(reversed);
    }

    /** {@code "4 -> 2 -> 1"} form used by the chain table. */
    public String format() {
        return members.stream().map(ScriptId::value).collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public String toString() {
        return format();
    }
}
