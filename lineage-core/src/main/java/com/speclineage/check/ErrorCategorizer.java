/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.check;

import com.speclineage.api.exceptions.LineageException;
import com.speclineage.artifact.ArtifactStore;
import com.speclineage.infra.io.CsvTables;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Sorts the {@code (error "line L column C: message")} reports of saved
 * solver outputs into a fixed set of categories.
 *
 * <p>Each output file {@code <name>.txt} is paired with the script
 * {@code <name>.<ext>} it came from; the first token of the offending script
 * line, parentheses removed, is kept as the error's context. Only the first
 * report per script line is kept. Categories are tried in order and the first
 * match wins, case-insensitively.
 */
public final class ErrorCategorizer {

    private static final Logger logger = Logger.getLogger(ErrorCategorizer.class.getName());

    public static final String ERRORS_FILE = "fmp_error_category.csv";
    public static final String CATEGORIZED_FILE = "fmp_error_category_categorized.csv";
    public static final List<String> HEADER = List.of("smt_file_path", "error_message", "(line, column)", "context");
    public static final List<String> CATEGORIZED_HEADER =
            List.of("smt_file_path", "error_message", "(line, column)", "context", "category");

    public static final String UNCATEGORIZED = "Uncategorized";
    static final String NO_CONTEXT = "N/A";

    private static final Pattern ERROR_REPORT = Pattern.compile("\\(error \"line (\\d+) column (\\d+): (.+?)\"\\)");

    private static final Map<String, Pattern> CATEGORIES = new LinkedHashMap<>();

    static {
        category("ambiguous constant reference", "ambiguous constant reference");
        category("array operation requires one sort parameter", "array operation requires one sort parameter");
        category("command is only available in interactive mode", "command is only available in interactive mode");
        category("datatype constructors have not been created", "datatype constructors have not been created");
        category("domain sort * and parameter * do not match", "domain sort (.*?) and parameter (.*?) do not match");
        category("expecting one integer parameter to bit-vector sort",
                "expecting one integer parameter to bit-vector sort");
        category("failed to open file", "failed to open file (.+)");
        category("function expects arity+1 rational parameters", "function expects arity\\+1 rational parameters");
        category("invalid array sort definition", "invalid array sort definition");
        category("invalid assert command", "invalid assert command");
        category("invalid attributed expression", "invalid attributed expression");
        category("invalid bit-vector literal", "invalid bit-vector literal");
        category("invalid command argument", "invalid command argument");
        category("invalid command", "invalid command");
        category("invalid const array definition", "invalid const array definition");
        category("invalid constant declaration", "invalid constant declaration");
        category("invalid constant definition", "invalid constant definition");
        category("invalid constructor declaration", "invalid constructor declaration");
        category("invalid datatype declaration", "invalid datatype declaration");
        category("invalid declaration", "invalid declaration");
        category("invalid expression", "invalid expression");
        category("invalid function application", "invalid function application");
        category("invalid function declaration", "invalid function declaration");
        category("invalid function/constant definition", "invalid function/constant definition");
        category("Invalid function name", "Invalid function name");
        category("invalid get-value command", "invalid get-value command");
        category("invalid indexed identifier", "invalid indexed identifier");
        category("invalid list of sorted variables", "invalid list of sorted variables");
        category("invalid named expression, declaration already defined with this name *",
                "invalid named expression");
        category("invalid non-Boolean sort applied to Pseudo-Boolean relation",
                "invalid non-Boolean sort applied to Pseudo-Boolean relation");
        category("invalid number of parameters to sort constructor",
                "invalid number of parameters to sort constructor");
        category("invalid pattern binding, '(' expected got *", "invalid pattern binding");
        category("invalid pop command, argument is greater than the current stack depth", "invalid pop command");
        category("invalid push command, integer expected", "invalid push command");
        category("invalid qualified/indexed identifier, '_' or 'as' expected",
                "invalid qualified/indexed identifier");
        category("invalid quantified expression, syntax error: *", "invalid quantified expression");
        category("invalid quantifier, list of sorted variables is empty",
                "invalid quantifier, list of sorted variables is empty");
        category("invalid s-expression, unexpected end of file", "invalid s-expression, unexpected end of file");
        category("invalid sort declaration", "invalid sort declaration");
        category("invalid sort,", "invalid sort");
        category("invalid sorted variable", "invalid sorted variable");
        category("logic does not support *", "logic does not support");
        category("logic must be set before initialization", "logic must be set before initialization");
        category("map expects to take as many arguments as the function being mapped, it was given * but expects *",
                "map expects to take as many arguments as the function being mapped");
        category("model is not available", "model is not available");
        category("named expression already defined", "named expression already defined");
        category("no arguments supplied to arithmetical operator", "no arguments supplied to arithmetical operator");
        category("Parsing function declaration", "Parsing function declaration");
        category("quantifier body must be a Boolean expression", "quantifier body must be a Boolean expression");
        category("select requires * arguments, but was provided with * arguments",
                "select requires (.*?) arguments, but was provided with");
        category("select takes at least two arguments", "select takes at least two arguments");
        category("sort already defined *", "sort already defined");
        category("sort constructor expects parameters", "sort constructor expects parameters");
        category("sort mismatch", "Sort mismatch");
        category("Sorts * and * are incompatible", "Sorts (.*?) and (.*?) incompatible");
        category("store expects the first argument *", "store expects the first argument");
        category("store takes at least * arguments", "store takes at least(.*?) arguments");
        category("the logic has already been set", "the logic has already been set");
        category("unbounded objectives on quantified constraints is not supported",
                "unbounded objectives on quantified constraints is not supported");
        category("unexpected character", "unexpected character");
        category("unexpected end of *", "unexpected end of");
        category("Unexpected number of arguments", "Unexpected number of arguments");
        category("unexpected token used as datatype name", "unexpected token used as datatype name");
        category("unknown constant *", "unknown constant");
        category("unknown sort *", "unknown sort");
        category("unsat assumptions construction is not enabled", "unsat assumptions construction is not enabled");
        category("unsat core construction is not enabled", "unsat core construction is not enabled");
        category("unsat core is not available", "unsat core is not available");
        category("Wrong number of arguments (0) passed to function *",
                "Wrong number of arguments(.*?) passed to function");
    }

    private static void category(String name, String regex) {
        CATEGORIES.put(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
    }

    /**
     * One error report of a script.
     *
     * @param script  path of the script the report is about
     * @param message text after {@code "line L column C: "}
     * @param line    1-based script line
     * @param column  column as reported by the solver
     * @param context first token of the script line, without parentheses
     */
    public record SolverError(String script, String message, int line, int column, String context) {

        public String position() {
            return "(" + line + ", " + column + ")";
        }

        List<String> toRow() {
            return List.of(script, message, position(), context);
        }
    }

    private final ArtifactStore scripts;

    public ErrorCategorizer(ArtifactStore scripts) {
        this.scripts = scripts;
    }

    /**
     * First category whose pattern occurs in {@code message}, or
     * {@link #UNCATEGORIZED}.
     */
    public static String categorize(String message) {
        for (Map.Entry<String, Pattern> entry : CATEGORIES.entrySet()) {
            if (entry.getValue().matcher(message).find()) {
                return entry.getKey();
            }
        }
        return UNCATEGORIZED;
    }

    /**
     * Error reports of one solver output, at most one per script line.
     */
    public static List<SolverError> extract(String script, String output, String scriptText) {
        List<String> lines = scriptText.lines().collect(Collectors.toList());
        Set<Integer> seen = new HashSet<>();
        List<SolverError> errors = new ArrayList<>();
        for (String outputLine : output.lines().collect(Collectors.toList())) {
            Matcher m = ERROR_REPORT.matcher(outputLine);
            if (!m.find()) {
                continue;
            }
            int line = Integer.parseInt(m.group(1));
            if (!seen.add(line)) {
                continue;
            }
            errors.add(new SolverError(script, m.group(3), line, Integer.parseInt(m.group(2)),
                    contextOf(lines, line)));
        }
        return errors;
    }

    private static String contextOf(List<String> lines, int line) {
        if (line < 1 || line > lines.size()) {
            return NO_CONTEXT;
        }
        String text = lines.get(line - 1).strip();
        if (text.isEmpty()) {
            return NO_CONTEXT;
        }
        return text.split("\\s+")[0].replace("(", "").replace(")", "");
    }

    /**
     * Reads every {@code .txt} output below {@code outputDir}, writes the error
     * table and its categorized copy to {@code resultsDir}.
     *
     * @return error count per category, most frequent first
     */
    public Map<String, Long> run(Path outputDir, Path resultsDir) {
        List<SolverError> errors = new ArrayList<>();
        int outputs = 0;
        for (Path output : listOutputs(outputDir)) {
            Path script = scriptOf(output);
            if (!Files.isRegularFile(script)) {
                logger.warning("Script not found for solver output " + output);
                continue;
            }
            outputs++;
            errors.addAll(extract(script.toString(), readText(output), readText(script)));
        }

        List<List<String>> rows = new ArrayList<>(errors.size());
        List<List<String>> categorized = new ArrayList<>(errors.size());
        Map<String, Long> counts = new LinkedHashMap<>();
        for (SolverError error : errors) {
            String category = categorize(error.message());
            rows.add(error.toRow());
            List<String> row = new ArrayList<>(error.toRow());
            row.add(category);
            categorized.add(row);
            counts.merge(category, 1L, Long::sum);
        }
        CsvTables.write(resultsDir.resolve(ERRORS_FILE), HEADER, rows);
        CsvTables.write(resultsDir.resolve(CATEGORIZED_FILE), CATEGORIZED_HEADER, categorized);

        Map<String, Long> ranked = counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
        logger.info(String.format("Categorized %d errors from %d solver outputs%n%s",
                errors.size(), outputs, formatTop(ranked, errors.size(), 10)));
        return ranked;
    }

    static String formatTop(Map<String, Long> ranked, int total, int limit) {
        StringBuilder sb = new StringBuilder();
        ranked.entrySet().stream().limit(limit).forEach(e -> sb.append(String.format(Locale.ROOT,
                "  %-60s %6d  %6.2f%%%n", e.getKey(), e.getValue(), total == 0 ? 0.0 : 100.0 * e.getValue() / total)));
        return sb.toString();
    }

    Path scriptOf(Path output) {
        String name = output.getFileName().toString();
        String base = name.substring(0, name.length() - ".txt".length());
        return scripts.baseDir().resolve(base + "." + scripts.extension());
    }

    private static List<Path> listOutputs(Path outputDir) {
        if (!Files.isDirectory(outputDir)) {
            logger.warning("No solver output directory at " + outputDir);
            return List.of();
        }
        try (Stream<Path> files = Files.walk(outputDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new LineageException("Cannot list solver outputs under " + outputDir, e);
        }
    }

    private static String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LineageException("Cannot read " + file, e);
        }
    }
}
