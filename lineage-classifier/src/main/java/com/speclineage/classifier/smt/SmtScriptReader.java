/*
 * Copyright (c) 2025 Spec Lineage Analyzer
 * Licensed under the Apache License, Version 2.0
 */
package com.speclineage.classifier.smt;

import com.speclineage.api.exceptions.OracleFailureException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tokenizes SMT-LIB text into top-level s-expressions.
 *
 * <p>Handles {@code ;} comments, string literals with doubled-quote escapes and
 * {@code |quoted symbols|}. Only the syntax is checked; whether commands make
 * sense is left to the solver.
 */
public final class SmtScriptReader {

    /**
     * @throws OracleFailureException on unbalanced parentheses or unterminated literals
     */
    public List<SExpr> readAll(String text) {
        List<SExpr> top = new ArrayList<>();
        Deque<List<SExpr>> open = new ArrayDeque<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == ';') {
                while (i < n && text.charAt(i) != '\n') {
                    i++;
                }
            } else if (c == '(') {
                open.push(new ArrayList<>());
                i++;
            } else if (c == ')') {
                if (open.isEmpty()) {
                    throw new OracleFailureException("Unexpected ')' at offset " + i);
                }
                SExpr closed = SExpr.list(open.pop());
                emit(closed, open, top);
                i++;
            } else if (c == '"') {
                int end = endOfString(text, i);
                emit(SExpr.atom(text.substring(i, end)), open, top);
                i = end;
            } else if (c == '|') {
                int close = text.indexOf('|', i + 1);
                if (close < 0) {
                    throw new OracleFailureException("Unterminated quoted symbol at offset " + i);
                }
                emit(SExpr.atom(text.substring(i, close + 1)), open, top);
                i = close + 1;
            } else {
                int start = i;
                while (i < n && !isDelimiter(text.charAt(i))) {
                    i++;
                }
                emit(SExpr.atom(text.substring(start, i)), open, top);
            }
        }
        if (!open.isEmpty()) {
            throw new OracleFailureException(open.size() + " unclosed '(' at end of script");
        }
        return top;
    }

    public SmtScript read(String text) {
        return SmtScript.of(readAll(text));
    }

    private static void emit(SExpr expr, Deque<List<SExpr>> open, List<SExpr> top) {
        if (open.isEmpty()) {
            top.add(expr);
        } else {
            open.peek().add(expr);
        }
    }

    private static int endOfString(String text, int start) {
        int i = start + 1;
        while (i < text.length()) {
            if (text.charAt(i) == '"') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        throw new OracleFailureException("Unterminated string literal at offset " + start);
    }

    private static boolean isDelimiter(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')' || c == ';' || c == '"' || c == '|';
    }
}
