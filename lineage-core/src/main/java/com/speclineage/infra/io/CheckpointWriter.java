/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.io;

import com.speclineage.api.exceptions.LineageException;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic, atomic persistence of a result table.
 *
 * <p>The table is written to a temporary file next to the target and then moved
 * over it, so an interrupted run leaves either the previous checkpoint or the
 * new one, never a truncated file.
 *
 * <pre>{@code
 * CheckpointWriter checkpoint = new CheckpointWriter(out, HEADER, 50);
 * for (...) {
 *     rows.add(row);
 *     if (checkpoint.onComparison()) {
 *         checkpoint.write(rows);
 *     }
 * }
 * checkpoint.write(rows);
 * }</pre>
 */
public final class CheckpointWriter {

    private static final Logger logger = Logger.getLogger(CheckpointWriter.class.getName());

    @FunctionalInterface
    public interface TableWriter {
        void writeTo(Writer writer) throws IOException;
    }

    private final Path target;
    private final List<String> header;
    private final int interval;
    private int comparisons;
    private int checkpoints;

    public CheckpointWriter(Path target, List<String> header, int interval) {
        if (interval < 1) {
            throw new IllegalArgumentException("Checkpoint interval must be at least 1, got: " + interval);
        }
        this.target = target;
        this.header = List.copyOf(header);
        this.interval = interval;
    }

    /**
     * Counts one comparison.
     *
     * @return true when a checkpoint is due
     */
    public boolean onComparison() {
        comparisons++;
        return comparisons % interval == 0;
    }

    public int comparisons() {
        return comparisons;
    }

    public int checkpoints() {
        return checkpoints;
    }

    public Path target() {
        return target;
    }

    public void write(Collection<? extends List<?>> rows) {
        CsvTables.write(target, header, rows);
        checkpoints++;
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Checkpoint %d: %d rows after %d comparisons -> %s",
                    checkpoints, rows.size(), comparisons, target));
        }
    }

    /**
     * Writes {@code target} through a temporary sibling file and an atomic move.
     */
    public static void writeAtomically(Path target, TableWriter content) {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        Path temp = null;
        try {
            Files.createDirectories(dir);
            temp = Files.createTempFile(dir, absolute.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                content.writeTo(writer);
            }
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.fine("Atomic move not supported in " + dir + ", falling back to replace");
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new LineageException("Cannot write " + target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not remove temporary file " + temp, e);
        }
    }
}
