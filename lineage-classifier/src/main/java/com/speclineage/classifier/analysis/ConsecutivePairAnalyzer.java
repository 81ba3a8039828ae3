/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.analysis;

import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.ConsecutiveResult;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.LabelTally;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.infra.io.CheckpointWriter;
import com.speclineage.infra.io.ListLiterals;
import com.speclineage.infra.lifecycle.CancellationToken;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Classifies every adjacent pair of each chain, oldest pair first.
 *
 * <p>A pair with an errored endpoint is labelled {@link RelationLabel#ERROR}
 * without asking the solver; a pair with a missing artifact is left out of the
 * row altogether.
 */
public final class ConsecutivePairAnalyzer {

    private static final Logger logger = Logger.getLogger(ConsecutivePairAnalyzer.class.getName());

    public static final String OUTPUT_FILE = "chain_semantic_comparison.csv";
    public static final List<String> HEADER = List.of("id", "semantic_compare");

    private final PairAnalysisContext context;
    private final int checkpointInterval;
    private final boolean resume;
    private final CancellationToken cancellation;
    private Tracer tracer = OpenTelemetry.noop().getTracer("speclineage");

    public ConsecutivePairAnalyzer(PairAnalysisContext context, int checkpointInterval,
                                   boolean resume, CancellationToken cancellation) {
        this.context = context;
        this.checkpointInterval = checkpointInterval;
        this.resume = resume;
        this.cancellation = cancellation;
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Labels the adjacent pairs of {@code chain}, root first.
     *
     * @return the labels, or {@code null} if the run was cancelled while the
     *         chain was being compared; a partial row is never produced
     */
    public ConsecutiveResult compare(DerivationChain chain) {
        List<ScriptId> members = chain.rootFirst();
        List<RelationLabel> labels = new ArrayList<>(Math.max(0, members.size() - 1));
        for (int i = 0; i + 1 < members.size(); i++) {
            ScriptId first = members.get(i);
            ScriptId second = members.get(i + 1);
            if (context.hasErrorRecord(first) || context.hasErrorRecord(second)) {
                labels.add(RelationLabel.ERROR);
            } else if (context.exists(first) && context.exists(second)) {
                RelationLabel label = context.classify(first, second);
                if (cancellation.isCancelled()) {
                    return null;
                }
                labels.add(label);
            } else {
                logger.warning(String.format("Chain %s: missing artifact for pair %s, %s",
                        chain.head(), first, second));
            }
        }
        return new ConsecutiveResult(chain.head(), labels);
    }

    /**
     * Compares every chain, checkpointing {@code output} every
     * {@code checkpointInterval} chains.
     *
     * @return results of the chains processed by this call
     */
    public List<ConsecutiveResult> run(ChainSet chains, Path output) {
        String pass = "consecutive";
        Span span = tracer.spanBuilder(pass).startSpan();
        try (Scope scope = span.makeCurrent()) {
            ResultTable table = ResultTable.open(output, HEADER, resume);
            List<List<String>> rows = table.rows();
            CheckpointWriter checkpoint = new CheckpointWriter(output, HEADER, checkpointInterval);
            context.listener().onPassStart(pass, chains.size());

            List<ConsecutiveResult> results = new ArrayList<>();
            int done = 0;
            for (DerivationChain chain : chains) {
                done++;
                if (table.isDone(chain.head())) {
                    continue;
                }
                if (cancellation.isCancelled()) {
                    logger.warning(String.format("Consecutive pass stopped after %d of %d chains: %s",
                            done - 1, chains.size(), cancellation.reason()));
                    break;
                }
                ConsecutiveResult result;
                Span chainSpan = tracer.spanBuilder("chain").setAttribute("chain.id", chain.head().value()).startSpan();
                try (Scope chainScope = chainSpan.makeCurrent()) {
                    result = compare(chain);
                } finally {
                    chainSpan.end();
                }
                if (result == null) {
                    logger.warning(String.format("Consecutive pass stopped inside chain %s: %s",
                            chain.head(), cancellation.reason()));
                    break;
                }
                results.add(result);
                rows.add(toRow(result));
                context.listener().onChainComplete(pass, chain.head(), done, chains.size());
                if (checkpoint.onComparison()) {
                    checkpoint.write(rows);
                    context.listener().onCheckpoint(pass, checkpoint.comparisons());
                }
            }
            checkpoint.write(rows);

            LabelTally tally = LabelTally.of(results);
            span.setAttribute("chains", results.size());
            span.setAttribute("pairs", tally.total());
            logger.info(String.format("Consecutive pass finished: %d chains%n%s", results.size(), tally.format()));
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    static List<String> toRow(ConsecutiveResult result) {
        List<String> names = result.labels().stream()
                .map(RelationLabel::wireName)
                .collect(Collectors.toList());
        return List.of(result.id().value(), ListLiterals.format(names));
    }

    /**
     * Reads a table written by {@link #run}; used for the summary of a resumed
     * or earlier run.
     */
    public static LabelTally tally(Path output) {
        ResultTable table = ResultTable.open(output, HEADER, true);
        LabelTally tally = new LabelTally();
        for (List<String> row : table.rows()) {
            for (String name : ListLiterals.parse(row.get(1))) {
                tally.add(RelationLabel.fromWireName(name));
            }
        }
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Tallied %d rows of %s", table.rows().size(), output));
        }
        return tally;
    }
}
