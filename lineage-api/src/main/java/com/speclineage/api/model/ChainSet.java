/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maximal derivation chains: no member's id-set is contained in another member's id-set.
 */
public record ChainSet(List<DerivationChain> chains) implements Iterable<DerivationChain> {

    public ChainSet {
        chains = List.copyOf(chains);
    }

    public static ChainSet empty() {
        return new ChainSet(List.of());
    }

    public int size() {
        return chains.size();
    }

    public boolean isEmpty() {
        return chains.isEmpty();
    }

    public Stream<DerivationChain> stream() {
        return chains.stream();
    }

    @Override
    public Iterator<DerivationChain> iterator() {
        return chains.iterator();
    }

    public OptionalInt maxLength() {
        return chains.stream().mapToInt(DerivationChain::length).max();
    }

    /** Distinct oldest ancestors across all chains. */
    public Set<ScriptId> initialScripts() {
        return chains.stream().map(DerivationChain::root).collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Summary figures of the chain table.
     */
    public Overview overview() {
        int count = chains.size();
        long longChains = chains.stream().filter(c -> c.length() >= 5).count();
        double share = count == 0 ? 0.0 : (double) longChains / count * 100.0;
        double mean = chains.stream().mapToInt(DerivationChain::length).average().orElse(0.0);
        return new Overview(count, maxLength().orElse(0), mean, share, initialScripts().size());
    }

    public record Overview(
        int chainCount,
        int maxLength,
        double meanLength,
        double lengthAtLeastFivePercent,
        int initialScriptCount
    ) {
        public String format() {
            return String.format(
                "Edit paths=%d, max length=%d, mean length=%.2f, length>=5=%.2f%%, initial scripts=%d",
                chainCount, maxLength, meanLength, lengthAtLeastFivePercent, initialScriptCount);
        }
    }
}
