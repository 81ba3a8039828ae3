/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.chains;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.speclineage.api.exceptions.MalformedInputException;
import com.speclineage.api.model.DerivationEdge;
import com.speclineage.api.model.EdgeTable;
import com.speclineage.api.model.ScriptId;
import com.speclineage.infra.io.CsvTable;
import com.speclineage.infra.io.CsvTables;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Reads the {@code id -> parent} table of a dataset.
 *
 * <p>Two layouts are understood:
 * <ul>
 *   <li>JSON lines, one object per revision with at least {@code id} and
 *       {@code parent}; other fields are ignored. {@code NaN} literals are
 *       accepted since upstream exports write missing parents that way.</li>
 *   <li>CSV ({@code .csv} extension) with {@code id} and {@code parent} columns.</li>
 * </ul>
 */
public final class EdgeTableLoader {

    private static final Logger logger = Logger.getLogger(EdgeTableLoader.class.getName());

    public static final String FIELD_ID = "id";
    public static final String FIELD_PARENT = "parent";

    private final ObjectMapper mapper;

    public EdgeTableLoader() {
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .build();
    }

    /**
     * @throws MalformedInputException if the file is unreadable, a line is not
     *                                  valid JSON, or a row has no id
     */
    public EdgeTable load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new MalformedInputException(file, "edge table does not exist");
        }
        List<DerivationEdge> edges = file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".csv")
                ? loadCsv(file)
                : loadJsonLines(file);
        EdgeTable table = EdgeTable.of(edges);
        long roots = edges.stream().filter(DerivationEdge::isRoot).count();
        logger.info(String.format("Loaded %d edges (%d distinct ids, %d roots) from %s",
                edges.size(), table.size(), roots, file));
        return table;
    }

    private List<DerivationEdge> loadJsonLines(Path file) {
        List<DerivationEdge> edges = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node;
                try {
                    node = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    throw new MalformedInputException(file, "line " + lineNumber + " is not valid JSON", e);
                }
                if (node == null || !node.isObject()) {
                    throw new MalformedInputException(file, "line " + lineNumber + " is not a JSON object");
                }
                int currentLine = lineNumber;
                ScriptId id = parseId(node.get(FIELD_ID))
                        .orElseThrow(() -> new MalformedInputException(file, "line " + currentLine + " has no id"));
                edges.add(new DerivationEdge(id, parseId(node.get(FIELD_PARENT)).orElse(null)));
            }
        } catch (IOException e) {
            throw new MalformedInputException(file, "cannot read edge table", e);
        }
        return edges;
    }

    private List<DerivationEdge> loadCsv(Path file) {
        CsvTable table = CsvTables.read(file);
        if (!table.hasColumn(FIELD_ID) || !table.hasColumn(FIELD_PARENT)) {
            throw new MalformedInputException(file, "edge table needs 'id' and 'parent' columns");
        }
        List<DerivationEdge> edges = new ArrayList<>(table.size());
        int row = 1;
        for (Map<String, String> cells : table.rows()) {
            row++;
            int current = row;
            ScriptId id = ScriptId.parse(cells.get(FIELD_ID))
                    .orElseThrow(() -> new MalformedInputException(file, "row " + current + " has no id"));
            edges.add(new DerivationEdge(id, ScriptId.parse(cells.get(FIELD_PARENT)).orElse(null)));
        }
        return edges;
    }

    private static Optional<ScriptId> parseId(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isIntegralNumber()) {
            // exact digits, ids beyond 2^53 do not survive a trip through double
            return ScriptId.parse(node.asText());
        }
        if (node.isNumber()) {
            return ScriptId.parse(node.numberValue());
        }
        return ScriptId.parse(node.asText());
    }
}
