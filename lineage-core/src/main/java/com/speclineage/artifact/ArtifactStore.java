/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.artifact;

import com.speclineage.api.exceptions.LineageException;
import com.speclineage.api.exceptions.MissingArtifactException;
import com.speclineage.api.model.ScriptId;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Directory of script files named {@code <id>.<extension>}.
 */
public final class ArtifactStore {

    private final Path baseDir;
    private final String extension;

    public ArtifactStore(Path baseDir, String extension) {
        this.baseDir = baseDir;
        this.extension = extension.startsWith(".") ? extension.substring(1) : extension;
    }

    public Path baseDir() {
        return baseDir;
    }

    public String extension() {
        return extension;
    }

    /** File name of the artifact, also the key of the solver-check table. */
    public String fileNameOf(ScriptId id) {
        return id.value() + "." + extension;
    }

    public Path pathOf(ScriptId id) {
        return baseDir.resolve(fileNameOf(id));
    }

    public boolean exists(ScriptId id) {
        return Files.isRegularFile(pathOf(id));
    }

    /**
     * Reads the script text.
     *
     * @throws MissingArtifactException if there is no file for {@code id}
     * @throws LineageException         if the file exists but cannot be read
     */
    public String read(ScriptId id) {
        Path path = pathOf(id);
        if (!Files.isRegularFile(path)) {
            throw new MissingArtifactException(id, path);
        }
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LineageException("Cannot read artifact " + path, e);
        }
    }

    /**
     * All artifacts below the base directory, sorted by path.
     */
    public List<Path> listAll() {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        String suffix = "." + extension;
        try (Stream<Path> files = Files.walk(baseDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new LineageException("Cannot list artifacts under " + baseDir, e);
        }
    }
}
