/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cpptree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * Construction-time invariant checks for directive trees.
 *
 * Every check either returns normally or throws a
 * {@link StructureException} naming the violated invariant and the
 * offending field. Nothing is coerced, retried or logged.
 */
public final class StructuralValidator {

    private StructuralValidator() {
    }

    /* pp */ static void requireField(@CheckForNull Object value, @Nonnull String field) {
        if (value == null)
            throw new StructureException(Violation.NULL_FIELD, field, "must not be null");
    }

    /**
     * Checks that a raw directive line names the expected keyword.
     *
     * Whitespace around the <code>#</code> is ignored; the keyword
     * itself is compared exactly.
     *
     * @throws StructureException with {@link Violation#RAW_FORMAT}.
     */
    public static void expectDirective(@CheckForNull String raw, @Nonnull String expected, @Nonnull String field) {
        if (Directives.isBlank(raw))
            throw new StructureException(Violation.RAW_FORMAT, field, "directive raw must be non-empty");
        String kw = Directives.keyword(raw);
        if (kw == null)
            throw new StructureException(Violation.RAW_FORMAT, field,
                    "directive raw must start with '#': " + quote(raw));
        if (!kw.equals(expected))
            throw new StructureException(Violation.RAW_FORMAT, field,
                    "raw directive keyword mismatch: expected #" + expected
                    + ", got #" + kw + " in " + quote(raw));
    }

    /* pp */ static void requireCondition(@CheckForNull String condition, @Nonnull String field) {
        if (Directives.isBlank(condition))
            throw new StructureException(Violation.EMPTY_CONDITION, field, "condition must be non-empty");
    }

    /* pp */ static void requireIdentifier(@CheckForNull String condition, @Nonnull String field) {
        requireCondition(condition, field);
        if (!Directives.isIdentifier(Directives.strip(condition)))
            throw new StructureException(Violation.INVALID_IDENTIFIER, field,
                    "expected C identifier for ifdef/ifndef condition, got " + quote(condition));
    }

    /* pp */ static void requireBody(@CheckForNull List<?> body, @Nonnull String field) {
        if (body == null)
            throw new StructureException(Violation.NULL_BODY, field, "must not be null");
    }

    /* pp */ static void requireEntry(@CheckForNull ConditionalBranch entry, @Nonnull String field) {
        requireField(entry, field);
        if (!entry.getKind().isOpening())
            throw new StructureException(Violation.ILLEGAL_ENTRY, field + ".kind",
                    "must be one of if/ifdef/ifndef, got " + entry.getKind().getText());
    }

    /* pp */ static void requireElifs(@CheckForNull List<ConditionalBranch> elifs, @Nonnull String field) {
        if (elifs == null)
            return;
        for (int i = 0; i < elifs.size(); i++) {
            ConditionalBranch b = elifs.get(i);
            if (b == null || b.getKind() != ConditionalBranch.Kind.ELIF)
                throw new StructureException(Violation.HETEROGENEOUS_ELIF, field + "[" + i + "].kind",
                        "must be 'elif', got " + (b == null ? "null" : b.getKind().getText()));
        }
    }

    /* pp */ static void requireElse(@CheckForNull List<?> elseBody, @CheckForNull String elseRaw, @Nonnull String field) {
        if (elseRaw == null)
            return;
        if (elseBody == null)
            throw new StructureException(Violation.MALFORMED_ELSE, field,
                    "else raw given without an else body: " + quote(elseRaw));
        expectDirective(elseRaw, PreprocessorCommand.PP_ELSE.getText(), field);
    }

    /**
     * Checks the direct children of one body.
     *
     * Nested groups and text are accepted as they are. A flat directive
     * whose keyword is a conditional keyword is rejected: such lines
     * must already have been grouped.
     *
     * @throws StructureException with
     *  {@link Violation#ILLEGAL_NESTED_DIRECTIVE} or
     *  {@link Violation#UNKNOWN_NODE_TYPE}.
     */
    public static void checkBody(@Nonnull List<? extends Node> body, @Nonnull String field) {
        for (int i = 0; i < body.size(); i++) {
            final String where = field + "[" + i + "]";
            Node node = body.get(i);
            if (node == null)
                throw new StructureException(Violation.UNKNOWN_NODE_TYPE, where, "unknown node type in body: null");
            node.accept(new NodeVisitor<Void>() {
                @Override
                public Void visitText(@Nonnull TextBlock text) {
                    return null;
                }

                @Override
                public Void visitDirective(@Nonnull DirectiveNode directive) {
                    checkNestedDirective(directive.getRaw(), where);
                    return null;
                }

                @Override
                public Void visitGroup(@Nonnull ConditionalGroup group) {
                    return null;
                }
            });
        }
    }

    /**
     * Rejects a raw line whose keyword opens, continues or closes a
     * conditional block.
     */
    /* pp */ static void checkNestedDirective(@Nonnull String raw, @Nonnull String field) {
        PreprocessorCommand ppcmd = Directives.command(raw);
        if (ppcmd != null && ppcmd.isConditional())
            throw new StructureException(Violation.ILLEGAL_NESTED_DIRECTIVE, field,
                    "illegal conditional directive inside body: " + quote(raw));
    }

    /* pp */ static void requirePath(@CheckForNull String path, @Nonnull String field) {
        if (Directives.isBlank(path))
            throw new StructureException(Violation.EMPTY_PATH, field, "must be non-empty");
    }

    /* pp */ static void requireItems(@CheckForNull List<?> items, @Nonnull String field) {
        requireBody(items, field);
        for (int i = 0; i < items.size(); i++)
            if (items.get(i) == null)
                throw new StructureException(Violation.NULL_ITEM, field + "[" + i + "]", "must not be null");
    }

    /**
     * Returns an unmodifiable copy which, unlike List.copyOf, keeps
     * null elements so that they reach the body check.
     */
    @Nonnull
    /* pp */ static <E> List<E> copyOf(@Nonnull List<? extends E> list) {
        return Collections.unmodifiableList(new ArrayList<E>(list));
    }

    @Nonnull
    private static String quote(@CheckForNull String s) {
        if (s == null)
            return "null";
        StringBuilder buf = new StringBuilder("'");
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\':
                    buf.append("\\\\");
                    break;
                case '\'':
                    buf.append("\\'");
                    break;
                case '\n':
                    buf.append("\\n");
                    break;
                case '\r':
                    buf.append("\\r");
                    break;
                default:
                    buf.append(c);
            }
        }
        return buf.append('\'').toString();
    }
}
