/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.exceptions;

import com.speclineage.api.model.ScriptId;

import java.nio.file.Path;

/**
 * A referenced script has no backing file. Recoverable everywhere.
 */
public class MissingArtifactException extends LineageException {

    private final ScriptId scriptId;

    public MissingArtifactException(ScriptId scriptId, Path expectedPath) {
        super("Script " + scriptId + " has no artifact at " + expectedPath);
        this.scriptId = scriptId;
    }

    public ScriptId getScriptId() {
        return scriptId;
    }
}
