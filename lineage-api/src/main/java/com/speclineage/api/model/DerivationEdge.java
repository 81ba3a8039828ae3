/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single {@code id -> parent} link. A {@code null} parent marks a root revision.
 */
public record DerivationEdge(ScriptId id, ScriptId parentId) {

    public DerivationEdge {
        Objects.requireNonNull(id, "id");
    }

    public static DerivationEdge root(ScriptId id) {
        return new DerivationEdge(id, null);
    }

    public Optional<ScriptId> parent() {
        return Optional.ofNullable(parentId);
    }

    public boolean isRoot() {
        return parentId == null;
    }
}
