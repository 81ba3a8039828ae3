/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.io;

import com.speclineage.api.exceptions.LineageException;
import com.speclineage.api.exceptions.MalformedInputException;
import org.supercsv.exception.SuperCsvException;
import org.supercsv.io.CsvListReader;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListReader;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Reading and writing of the analysis tables.
 *
 * <p>All tables use comma separation, double-quote quoting and {@code \n} line
 * endings. Full rewrites go through {@link CheckpointWriter} so readers never
 * observe a half-written table.
 */
public final class CsvTables {

    private static final Logger logger = Logger.getLogger(CsvTables.class.getName());

    public static final CsvPreference PREFERENCE = new CsvPreference.Builder('"', ',', "\n").build();

    private CsvTables() {
    }

    /**
     * Reads a table with a header row.
     *
     * @throws MalformedInputException if the file is missing, unreadable or has no header
     */
    public static CsvTable read(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new MalformedInputException(file, "table does not exist");
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             ICsvListReader csv = new CsvListReader(reader, PREFERENCE)) {
            String[] header = csv.getHeader(true);
            if (header == null) {
                throw new MalformedInputException(file, "table has no header row");
            }
            List<Map<String, String>> rows = new ArrayList<>();
            List<String> cells;
            while ((cells = csv.read()) != null) {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    String value = i < cells.size() ? cells.get(i) : null;
                    row.put(header[i], value == null ? "" : value);
                }
                rows.add(row);
            }
            logger.fine(String.format("Read %d rows from %s", rows.size(), file));
            return new CsvTable(Arrays.asList(header), rows);
        } catch (IOException | SuperCsvException e) {
            throw new MalformedInputException(file, "cannot parse table: " + e.getMessage(), e);
        }
    }

    /**
     * Replaces {@code file} with the given table in one atomic step.
     */
    public static void write(Path file, List<String> header, Collection<? extends List<?>> rows) {
        CheckpointWriter.writeAtomically(file, writer -> writeTo(writer, header, rows, true));
    }

    /**
     * Appends rows, writing the header first when the file does not exist yet.
     */
    public static void append(Path file, List<String> header, Collection<? extends List<?>> rows) {
        boolean fresh = !Files.exists(file);
        try {
            if (file.toAbsolutePath().getParent() != null) {
                Files.createDirectories(file.toAbsolutePath().getParent());
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writeTo(writer, header, rows, fresh);
            }
        } catch (IOException e) {
            throw new LineageException("Cannot append to " + file, e);
        }
    }

    private static void writeTo(Writer writer, List<String> header, Collection<? extends List<?>> rows,
                                boolean withHeader) throws IOException {
        ICsvListWriter csv = new CsvListWriter(writer, PREFERENCE);
        if (withHeader) {
            csv.writeHeader(header.toArray(new String[0]));
        }
        for (List<?> row : rows) {
            csv.write(row);
        }
        csv.flush();
    }
}
