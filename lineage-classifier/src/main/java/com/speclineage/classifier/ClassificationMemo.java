/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.speclineage.api.IPairClassifier;
import com.speclineage.api.model.RelationLabel;
import com.speclineage.api.model.ScriptId;
import com.speclineage.infra.metrics.Counter;
import com.speclineage.infra.metrics.MetricsRegistry;

import java.util.logging.Logger;

/**
 * Remembers the label of every ordered pair classified during a run.
 *
 * <p>The passes over the chains ask for the same adjacent pairs again and
 * again; with the memo each pair reaches the solver once. Lookups for the same
 * pair are atomic, so concurrent callers wait for the first classification
 * instead of starting their own. Labels are only remembered, never altered.
 *
 * <p>Keys are ordered: {@code (a, b)} and {@code (b, a)} are separate entries.
 */
public final class ClassificationMemo implements IPairClassifier {

    private static final Logger logger = Logger.getLogger(ClassificationMemo.class.getName());

    private final IPairClassifier delegate;
    private final Cache<PairKey, RelationLabel> cache;
    private final Counter hits;
    private final Counter misses;

    record PairKey(ScriptId first, ScriptId second) {
    }

    public ClassificationMemo(IPairClassifier delegate, long maximumSize, MetricsRegistry metrics) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
        this.hits = metrics.counter("memo_lookups_total", "result", "hit");
        this.misses = metrics.counter("memo_lookups_total", "result", "miss");
        logger.info(String.format("ClassificationMemo initialized: maxSize=%d", maximumSize));
    }

    @Override
    public RelationLabel classify(ScriptId first, ScriptId second) {
        PairKey key = new PairKey(first, second);
        RelationLabel known = cache.getIfPresent(key);
        if (known != null) {
            hits.increment();
            return known;
        }
        misses.increment();
        return cache.get(key, k -> delegate.classify(k.first(), k.second()));
    }

    public long size() {
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }
}
