/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.api.model;

import java.util.List;

/**
 * Status of every member of a chain, chronological order.
 *
 * @param parseErrorFixSteps for each run of erroring scripts, revisions until the next non-error one
 * @param unsatToSatSteps    for each run of UNSAT scripts, revisions from its last member to the next SAT one
 */
public record ChainStatusRow(
    ScriptId id,
    List<ScriptId> chain,
    List<ChainStatus> statuses,
    List<Integer> parseErrorFixSteps,
    List<Integer> unsatToSatSteps
) {
    public ChainStatusRow {
        chain = List.copyOf(chain);
        statuses = List.copyOf(statuses);
        parseErrorFixSteps = List.copyOf(parseErrorFixSteps);
        unsatToSatSteps = List.copyOf(unsatToSatSteps);
    }

    public boolean hasError() {
        return statuses.contains(ChainStatus.ERROR);
    }
}
