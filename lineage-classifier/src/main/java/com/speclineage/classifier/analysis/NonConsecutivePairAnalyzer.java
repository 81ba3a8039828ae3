/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.analysis;

import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.IndexPair;
import com.speclineage.api.model.NonConsecutiveResult;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.classifier.analysis.policy.RedundancyPolicy;
import com.speclineage.infra.io.CheckpointWriter;
import com.speclineage.infra.io.ListLiterals;
import com.speclineage.infra.lifecycle.CancellationToken;
import com.speclineage.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Counts, per chain, the non-adjacent pairs {@code (i, j)}, {@code j >= i + 2},
 * whose relation is a given label.
 *
 * <p>For every candidate pair, in order:
 * <ol>
 *   <li>skip it when either endpoint failed its standalone solver check;</li>
 *   <li>skip it when the {@link RedundancyPolicy} prunes it;</li>
 *   <li>classify it and count it when the label is the target.</li>
 * </ol>
 * Chains with fewer than three members have no such pair and produce no row.
 * Each target label is an independent pass; a shared memo keeps the passes
 * from asking the solver about the same pair twice.
 */
public final class NonConsecutivePairAnalyzer {

    private static final Logger logger = Logger.getLogger(NonConsecutivePairAnalyzer.class.getName());

    public static final List<String> HEADER = List.of("id", "chain", "count", "pairs");

    private final PairAnalysisContext context;
    private final RedundancyPolicy policy;
    private final int checkpointInterval;
    private final boolean resume;
    private final CancellationToken cancellation;
    private final MetricsRegistry metrics;
    private Tracer tracer = OpenTelemetry.noop().getTracer("speclineage");

    public NonConsecutivePairAnalyzer(PairAnalysisContext context, RedundancyPolicy policy,
                                      int checkpointInterval, boolean resume,
                                      CancellationToken cancellation, MetricsRegistry metrics) {
        this.context = context;
        this.policy = policy;
        this.checkpointInterval = checkpointInterval;
        this.resume = resume;
        this.cancellation = cancellation;
        this.metrics = metrics;
    }

    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    public static String outputFileName(RelationLabel target) {
        return "non_consecutive_" + target.wireName() + "_pairs.csv";
    }

    /**
     * Runs one pass over one chain.
     *
     * @param chain  the chain; pairs are indexed oldest first
     * @param target one of {@link RelationLabel#targetLabels()}
     */
    public NonConsecutiveResult classifyNonConsecutivePairs(DerivationChain chain, RelationLabel target) {
        return classify(chain, target, null, List.of());
    }

    /**
     * @param rows completed rows, persisted whenever a checkpoint falls inside this chain
     * @return null when the run was cancelled before the chain was finished
     */
    private NonConsecutiveResult classify(DerivationChain chain, RelationLabel target,
                                          CheckpointWriter checkpoint, List<List<String>> rows) {
        if (!target.isDefinite()) {
            throw new IllegalArgumentException("Not a countable label: " + target);
        }
        List<ScriptId> members = chain.rootFirst();
        int n = members.size();
        List<IndexPair> pairs = new ArrayList<>();
        List<IndexPair> skipped = new ArrayList<>();
        int compared = 0;

        for (int i = 0; i < n; i++) {
            for (int j = i + 2; j < n; j++) {
                if (cancellation.isCancelled()) {
                    return null;
                }
                IndexPair pair = new IndexPair(i, j);
                if (context.hasErrorRecord(members.get(i)) || context.hasErrorRecord(members.get(j))) {
                    skipped.add(pair);
                    continue;
                }
                if (policy.prune(context, members, i, j, target)) {
                    skipped.add(pair);
                    metrics.counter("pruned_pairs_total", "label", target.wireName()).increment();
                    continue;
                }
                RelationLabel label = context.classify(members.get(i), members.get(j));
                compared++;
                if (label == target) {
                    pairs.add(pair);
                }
                if (checkpoint != null && checkpoint.onComparison()) {
                    checkpoint.write(rows);
                    context.listener().onCheckpoint(passName(target), checkpoint.comparisons());
                }
            }
        }
        if (cancellation.isCancelled()) {
            // the last answers may be failures caused by the shutdown
            return null;
        }
        return new NonConsecutiveResult(chain.head(), members, target, pairs.size(), pairs, skipped, compared);
    }

    private NonConsecutiveResult classifyTraced(DerivationChain chain, RelationLabel target,
                                                CheckpointWriter checkpoint, List<List<String>> rows) {
        Span span = tracer.spanBuilder("chain").setAttribute("chain.id", chain.head().value()).startSpan();
        try (Scope scope = span.makeCurrent()) {
            return classify(chain, target, checkpoint, rows);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Runs one pass over every chain, writing {@code output} periodically and
     * at the end.
     *
     * @return results of the chains processed by this call
     */
    public List<NonConsecutiveResult> run(ChainSet chains, RelationLabel target, Path output) {
        String pass = passName(target);
        Span span = tracer.spanBuilder(pass).startSpan();
        try (Scope scope = span.makeCurrent()) {
            ResultTable table = ResultTable.open(output, HEADER, resume);
            List<List<String>> rows = table.rows();
            CheckpointWriter checkpoint = new CheckpointWriter(output, HEADER, checkpointInterval);

            List<DerivationChain> eligible = chains.stream()
                    .filter(c -> c.length() >= 3)
                    .collect(Collectors.toList());
            context.listener().onPassStart(pass, eligible.size());
            logger.info(String.format("Pass %s: %d chains with at least 3 members, policy=%s",
                    pass, eligible.size(), policy.name()));

            List<NonConsecutiveResult> results = new ArrayList<>();
            int done = 0;
            for (DerivationChain chain : eligible) {
                done++;
                if (table.isDone(chain.head())) {
                    continue;
                }
                if (cancellation.isCancelled()) {
                    logger.warning(String.format("Pass %s stopped after %d of %d chains: %s",
                            pass, done - 1, eligible.size(), cancellation.reason()));
                    break;
                }
                NonConsecutiveResult result = classifyTraced(chain, target, checkpoint, rows);
                if (result == null) {
                    break;
                }
                results.add(result);
                rows.add(toRow(result));
                context.listener().onChainComplete(pass, chain.head(), done, eligible.size());
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("%s: chain %s count=%d compared=%d skipped=%d",
                            pass, chain.head(), result.count(), result.compared(), result.skipped().size()));
                }
            }
            checkpoint.write(rows);

            int total = results.stream().mapToInt(NonConsecutiveResult::count).sum();
            span.setAttribute("chains", results.size());
            span.setAttribute("count", total);
            logger.info(String.format("Pass %s finished: %d chains, %d %s pairs, %d direct comparisons",
                    pass, results.size(), total, target.wireName(), checkpoint.comparisons()));
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Four independent passes, one per countable label, each with its own
     * output table under {@code resultsDir}.
     */
    public Map<RelationLabel, List<NonConsecutiveResult>> runAllLabels(ChainSet chains, Path resultsDir) {
        Map<RelationLabel, List<NonConsecutiveResult>> all = new EnumMap<>(RelationLabel.class);
        for (RelationLabel target : RelationLabel.targetLabels()) {
            if (cancellation.isCancelled()) {
                break;
            }
            all.put(target, run(chains, target, resultsDir.resolve(outputFileName(target))));
        }
        return all;
    }

    static List<String> toRow(NonConsecutiveResult result) {
        String chain = ListLiterals.format(result.chain().stream().map(ScriptId::value).collect(Collectors.toList()));
        String pairs = result.pairs().stream()
                .map(IndexPair::toString)
                .collect(Collectors.joining(", ", "[", "]"));
        return List.of(result.id().value(), chain, Integer.toString(result.count()), pairs);
    }

    private static String passName(RelationLabel target) {
        return "non-consecutive:" + target.wireName();
    }
}
