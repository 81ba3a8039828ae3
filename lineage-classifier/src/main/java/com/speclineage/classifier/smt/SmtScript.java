/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.smt;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Declarations and assertions of one script.
 *
 * <p>Assertions from every {@code push}/{@code pop} scope are flattened into one
 * list, as if all scopes were still open at the end. Commands other than
 * declarations, definitions and {@code assert} are dropped, which also removes
 * {@code (get-assignment)}, {@code (check-sat)} and option settings.
 */
public record SmtScript(List<Declaration> declarations, List<SExpr> assertions) {

    static final Set<String> DECLARATION_COMMANDS = Set.of(
            "declare-fun", "declare-const", "declare-sort",
            "declare-datatype", "declare-datatypes",
            "define-fun", "define-fun-rec", "define-funs-rec",
            "define-sort", "define-const");

    public SmtScript {
        declarations = List.copyOf(declarations);
        assertions = List.copyOf(assertions);
    }

    /**
     * A top-level declaration, keyed by the symbol it introduces.
     */
    public record Declaration(String name, SExpr command) {
    }

    public static SmtScript of(List<SExpr> commands) {
        List<Declaration> declarations = new ArrayList<>();
        List<SExpr> assertions = new ArrayList<>();
        for (SExpr command : commands) {
            if (!(command instanceof SExpr.ListExpr list) || list.size() < 2) {
                continue;
            }
            String head = list.head();
            if (head.equals("assert")) {
                assertions.add(list.get(1));
            } else if (DECLARATION_COMMANDS.contains(head)) {
                declarations.add(new Declaration(nameOf(list), list));
            }
        }
        return new SmtScript(declarations, assertions);
    }

    private static String nameOf(SExpr.ListExpr declaration) {
        SExpr subject = declaration.get(1);
        // datatype groups and recursive function groups are keyed by their full text
        return subject instanceof SExpr.Atom atom ? atom.text() : subject.render();
    }

    public boolean isEmpty() {
        return declarations.isEmpty() && assertions.isEmpty();
    }
}
