/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.infra.lifecycle;

import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Cooperative stop signal shared by everything a run dispatches.
 *
 * <p>Workers poll {@link #isCancelled()} before starting a new unit of work;
 * work already in flight finishes or is killed by its owner.
 */
public final class CancellationToken {

    private static final Logger logger = Logger.getLogger(CancellationToken.class.getName());

    private final AtomicReference<String> reason = new AtomicReference<>();

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation. Only the first reason is kept.
     */
    public void cancel(String why) {
        if (reason.compareAndSet(null, why == null ? "cancelled" : why)) {
            logger.warning("Cancellation requested: " + reason.get());
        }
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }
}
