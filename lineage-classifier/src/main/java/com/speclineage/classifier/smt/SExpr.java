/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.smt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * SMT-LIB s-expression: an atom or a parenthesized list.
 */
public interface SExpr {

    /** Canonical text, single spaces between elements. */
    String render();

    static Atom atom(String text) {
        return new Atom(text);
    }

    static ListExpr list(List<SExpr> elements) {
        return new ListExpr(elements);
    }

    /**
     * Symbol, keyword, numeral, string literal or quoted symbol, kept verbatim.
     */
    record Atom(String text) implements SExpr {
        @Override
        public String render() {
            return text;
        }
    }

    record ListExpr(List<SExpr> elements) implements SExpr {

        public ListExpr {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        public SExpr get(int index) {
            return elements.get(index);
        }

        /** Text of the first element when it is an atom, otherwise empty. */
        public String head() {
            return !elements.isEmpty() && elements.get(0) instanceof Atom atom ? atom.text() : "";
        }

        @Override
        public String render() {
            return elements.stream().map(SExpr::render).collect(Collectors.joining(" ", "(", ")"));
        }
    }
}
