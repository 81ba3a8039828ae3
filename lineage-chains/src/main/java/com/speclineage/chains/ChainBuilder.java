/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.chains;

import com.speclineage.api.IChainBuilder;
import com.speclineage.api.model.ChainSet;
import com.speclineage.api.model.DerivationChain;
import com.speclineage.api.model.EdgeTable;
import com.speclineage.api.model.ScriptId;
import com.speclineage.artifact.ArtifactStore;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reconstructs maximal derivation chains from parent pointers.
 *
 * <p><b>Walk:</b> from every id, follow parents until a root, a cycle, or an id
 * that is not itself a key of the table. A parent without an artifact is left
 * out of the chain but the walk continues through it, so its own ancestors
 * still appear.
 *
 * <p><b>Containment filter:</b> a chain is dropped when another chain's member
 * set strictly contains its own. Among chains with identical member sets, the
 * first one in input order is kept.
 *
 * <p>Output order follows input order, so the same table always produces the
 * same chain set.
 */
public final class ChainBuilder implements IChainBuilder {

    private static final Logger logger = Logger.getLogger(ChainBuilder.class.getName());

    private final Predicate<ScriptId> artifactExists;
    private Tracer tracer = OpenTelemetry.noop().getTracer("speclineage");

    public ChainBuilder(Predicate<ScriptId> artifactExists) {
        this.artifactExists = artifactExists;
    }

    public ChainBuilder(ArtifactStore artifacts) {
        this(artifacts::exists);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public ChainSet buildChains(EdgeTable edges) {
        Span span = tracer.spanBuilder("build-chains").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("edges", edges.size());
            WalkStats stats = new WalkStats();
            List<DerivationChain> all = new ObjectArrayList<>(edges.size());
            for (ScriptId id : edges.ids()) {
                all.add(walk(id, edges, stats));
            }
            List<DerivationChain> maximal = keepMaximal(all);
            span.setAttribute("chains", maximal.size());
            logger.info(String.format(
                    "Built %d maximal chains from %d ids (%d missing artifacts skipped, %d cycles cut)",
                    maximal.size(), all.size(), stats.missing, stats.cycles));
            return new ChainSet(maximal);
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Ancestry of {@code start}, newest first.
     */
    DerivationChain walk(ScriptId start, EdgeTable edges, WalkStats stats) {
        List<ScriptId> chain = new ArrayList<>();
        chain.add(start);
        Set<ScriptId> visited = new ObjectOpenHashSet<>();
        visited.add(start);

        ScriptId current = start;
        while (edges.contains(current)) {
            Optional<ScriptId> parent = edges.parentOf(current);
            if (parent.isEmpty()) {
                break;
            }
            ScriptId next = parent.get();
            if (!visited.add(next)) {
                stats.cycles++;
                logger.warning(String.format("Cycle at %s while walking from %s, chain truncated", next, start));
                break;
            }
            if (!artifactExists.test(next)) {
                stats.missing++;
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("Artifact of %s does not exist, skipping node", next));
                }
                current = next;
                continue;
            }
            chain.add(next);
            current = next;
        }
        return new DerivationChain(chain);
    }

    /**
     * Drops every chain whose member set is contained in another chain's set.
     * Only chains sharing the candidate's head can contain it, which keeps the
     * check close to linear for realistic tables.
     */
    static List<DerivationChain> keepMaximal(List<DerivationChain> chains) {
        List<Set<ScriptId>> sets = new ArrayList<>(chains.size());
        Map<ScriptId, IntList> chainsByMember = new Object2ObjectOpenHashMap<>();
        for (int i = 0; i < chains.size(); i++) {
            Set<ScriptId> members = new ObjectOpenHashSet<>(chains.get(i).members());
            sets.add(members);
            for (ScriptId member : members) {
                chainsByMember.computeIfAbsent(member, k -> new IntArrayList()).add(i);
            }
        }

        List<DerivationChain> kept = new ObjectArrayList<>();
        for (int i = 0; i < chains.size(); i++) {
            Set<ScriptId> candidate = sets.get(i);
            boolean dominated = false;
            for (int j : chainsByMember.get(chains.get(i).head())) {
                if (j == i) {
                    continue;
                }
                Set<ScriptId> other = sets.get(j);
                if (other.size() < candidate.size() || !other.containsAll(candidate)) {
                    continue;
                }
                // strictly larger, or the same set seen earlier
                if (other.size() > candidate.size() || j < i) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated) {
                kept.add(chains.get(i));
            }
        }
        return kept;
    }

    static final class WalkStats {
        int missing;
        int cycles;
    }
}
