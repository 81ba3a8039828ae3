/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.smt;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the query {@code F_A and not F_B}.
 *
 * <p>Declarations of both scripts are merged; when both declare the same
 * symbol the first script's declaration is used. Term annotations
 * ({@code (! t :named n)}) are stripped so names shared by both scripts do not
 * clash.
 */
public final class ComparisonFormulaBuilder {

    public String build(SmtScript first, SmtScript second) {
        StringBuilder sb = new StringBuilder();
        Set<String> declared = new LinkedHashSet<>();
        for (SmtScript script : List.of(first, second)) {
            for (SmtScript.Declaration declaration : script.declarations()) {
                if (declared.add(declaration.name())) {
                    sb.append(strip(declaration.command()).render()).append('\n');
                }
            }
        }
        sb.append("(assert ").append(conjunction(first.assertions())).append(")\n");
        sb.append("(assert (not ").append(conjunction(second.assertions())).append("))\n");
        sb.append("(check-sat)\n");
        return sb.toString();
    }

    /**
     * {@code true} for no assertions, the assertion itself for one, an
     * {@code and} otherwise.
     */
    static String conjunction(List<SExpr> assertions) {
        if (assertions.isEmpty()) {
            return "true";
        }
        if (assertions.size() == 1) {
            return strip(assertions.get(0)).render();
        }
        StringBuilder sb = new StringBuilder("(and");
        for (SExpr assertion : assertions) {
            sb.append(' ').append(strip(assertion).render());
        }
        return sb.append(')').toString();
    }

    static SExpr strip(SExpr expr) {
        if (!(expr instanceof SExpr.ListExpr list)) {
            return expr;
        }
        if (list.head().equals("!") && list.size() >= 2) {
            return strip(list.get(1));
        }
        List<SExpr> elements = new ArrayList<>(list.size());
        for (SExpr element : list.elements()) {
            elements.add(strip(element));
        }
        return SExpr.list(elements);
    }
}
