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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.Stack;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a directive tree from source text.
 *
 * The builder is line-oriented. Each logical line, with its line
 * terminator and any backslash-newline continuations, becomes exactly
 * one raw field or part of one text block, so that the
 * {@link Stringifier} reproduces the input exactly.
 *
 * Directives which have no node kind (<code>#line</code>,
 * <code>#warning</code>, linemarkers, the null directive, ...) are
 * kept as text unless {@link Feature#STRICT} is enabled. Lines
 * inside a block comment which began on an earlier line are text.
 *
 * A builder holds no state between calls and may be shared.
 */
public class DirectiveTreeBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(DirectiveTreeBuilder.class);

    private final Set<Feature> features;

    public DirectiveTreeBuilder() {
        this.features = EnumSet.noneOf(Feature.class);
    }

    public DirectiveTreeBuilder(@Nonnull Collection<Feature> features) {
        this();
        this.features.addAll(features);
    }

    public DirectiveTreeBuilder(Feature... features) {
        this();
        for (Feature f : features)
            this.features.add(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Reads and builds a UTF-8 source file.
     */
    @Nonnull
    public FileRoot build(@Nonnull File file)
            throws IOException,
            DirectiveSyntaxException {
        return build(file.getPath(), FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    }

    /**
     * Builds the tree of the given source text.
     *
     * @throws DirectiveSyntaxException if the conditional directives do
     *  not nest, or a directive line is malformed.
     */
    @Nonnull
    public FileRoot build(@Nonnull String path, @Nonnull String source)
            throws DirectiveSyntaxException {
        State state = new State();
        boolean inComment = false;
        int pos = 0;
        int line = 1;
        while (pos < source.length()) {
            int end = logicalLineEnd(source, pos);
            String text = source.substring(pos, end);
            if (!inComment && isDirective(text))
                directive(state, text, line);
            else
                state.text.append(text);
            inComment = scanComment(text, inComment);
            line += countNewlines(text);
            pos = end;
        }
        state.flushText();
        if (!state.frames.isEmpty()) {
            Frame frame = state.frames.peek();
            throw new DirectiveSyntaxException(frame.line,
                    "Unterminated #" + frame.entryKind.getText());
        }
        try {
            return new FileRoot(path, state.items);
        } catch (StructureException e) {
            throw new DirectiveSyntaxException(line, e.getMessage(), e);
        }
    }

    private void directive(@Nonnull State state, @Nonnull String raw, int line)
            throws DirectiveSyntaxException {
        PreprocessorCommand ppcmd = Directives.command(raw);
        if (ppcmd == null) {
            if (getFeature(Feature.STRICT))
                throw new DirectiveSyntaxException(line,
                        "Unknown preprocessor directive " + raw.trim());
            state.text.append(raw);
            return;
        }
        try {
            switch (ppcmd) {
                case PP_INCLUDE:
                case PP_DEFINE:
                case PP_UNDEF:
                case PP_PRAGMA:
                case PP_ERROR:
                    state.flushText();
                    state.body().add(new DirectiveNode(DirectiveNode.Kind.forCommand(ppcmd), raw));
                    break;

                case PP_IF:
                case PP_IFDEF:
                case PP_IFNDEF:
                    state.flushText();
                    state.frames.push(new Frame(ConditionalBranch.Kind.forCommand(ppcmd), raw, line));
                    break;

                case PP_ELIF: {
                    state.flushText();
                    Frame frame = state.frame("#elif without #if", line);
                    if (frame.elseBody != null)
                        throw new DirectiveSyntaxException(line, "#elif after #else");
                    frame.closeBranch();
                    frame.openBranch(ConditionalBranch.Kind.ELIF, raw, line);
                    break;
                }

                case PP_ELSE: {
                    state.flushText();
                    Frame frame = state.frame("#else without #if", line);
                    if (frame.elseBody != null)
                        throw new DirectiveSyntaxException(line, "#else after #else");
                    frame.closeBranch();
                    frame.elseRaw = raw;
                    frame.elseBody = new ArrayList<Node>();
                    break;
                }

                case PP_ENDIF: {
                    state.flushText();
                    Frame frame = state.frame("#endif without #if", line);
                    if (frame.elseBody == null)
                        frame.closeBranch();
                    ConditionalGroup group = new ConditionalGroup(frame.entry, frame.elifs,
                            frame.elseBody, frame.elseRaw, raw);
                    state.frames.pop();
                    state.body().add(group);
                    if (getFeature(Feature.DEBUG))
                        LOG.debug("Closed #" + frame.entryKind.getText() + " from line " + frame.line
                                + " at line " + line + " with " + frame.elifs.size() + " #elif");
                    break;
                }

                default:
                    if (getFeature(Feature.STRICT))
                        throw new DirectiveSyntaxException(line,
                                "Directive #" + ppcmd.getText() + " has no node kind");
                    if (getFeature(Feature.DEBUG))
                        LOG.debug("Keeping #" + ppcmd.getText() + " at line " + line + " as text");
                    state.text.append(raw);
                    break;
            }
        } catch (StructureException e) {
            throw new DirectiveSyntaxException(line, e.getMessage(), e);
        }
    }

    /**
     * Returns true if the first non-whitespace character of the line is
     * a <code>#</code>.
     */
    private static boolean isDirective(@Nonnull String line) {
        return Directives.afterHash(line) != null;
    }

    /**
     * Returns the end of the logical line starting at pos: after the
     * first newline not preceded by a backslash, or the end of input.
     */
    /* pp */ static int logicalLineEnd(@Nonnull String source, int pos) {
        for (;;) {
            int nl = source.indexOf('\n', pos);
            if (nl == -1)
                return source.length();
            int last = nl - 1;
            if (last >= pos && source.charAt(last) == '\r')
                last--;
            if (last < pos || source.charAt(last) != '\\')
                return nl + 1;
            pos = nl + 1;
        }
    }

    /**
     * Returns whether a block comment is still open at the end of the
     * line.
     */
    /* pp */ static boolean scanComment(@Nonnull String line, boolean inComment) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            char next = i + 1 < line.length() ? line.charAt(i + 1) : 0;
            if (inComment) {
                if (c == '*' && next == '/') {
                    inComment = false;
                    i++;
                }
            } else if (quote != 0) {
                if (c == '\\')
                    i++;
                else if (c == quote || c == '\n')
                    quote = 0;
            } else if (c == '/' && next == '*') {
                inComment = true;
                i++;
            } else if (c == '/' && next == '/') {
                /* The rest of the logical line is a comment. */
                return false;
            } else if (c == '"' || c == '\'') {
                quote = c;
            }
        }
        return inComment;
    }

    /**
     * Removes comments from a directive argument, replacing each block
     * comment by a space.
     */
    @Nonnull
    /* pp */ static String stripComments(@Nonnull String text) {
        StringBuilder buf = new StringBuilder();
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : 0;
            if (quote != 0) {
                buf.append(c);
                if (c == '\\' && next != 0) {
                    buf.append(next);
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '/' && next == '*') {
                int close = text.indexOf("*/", i + 2);
                buf.append(' ');
                if (close == -1)
                    break;
                i = close + 1;
            } else if (c == '/' && next == '/') {
                break;
            } else {
                if (c == '"' || c == '\'')
                    quote = c;
                buf.append(c);
            }
        }
        return buf.toString().trim();
    }

    private static int countNewlines(@Nonnull String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++)
            if (s.charAt(i) == '\n')
                n++;
        return n;
    }

    /* Condition text of a branch line: the argument without comments. */
    @Nonnull
    private static String condition(@Nonnull String raw) {
        String arg = Directives.argument(raw);
        return arg == null ? "" : stripComments(arg);
    }

    private static final class State {

        private final List<Node> items = new ArrayList<Node>();
        private final Stack<Frame> frames = new Stack<Frame>();
        private final StringBuilder text = new StringBuilder();

        @Nonnull
        List<Node> body() {
            return frames.isEmpty() ? items : frames.peek().body();
        }

        void flushText() {
            if (text.length() == 0)
                return;
            body().add(new TextBlock(text.toString()));
            text.setLength(0);
        }

        @Nonnull
        Frame frame(@Nonnull String msg, int line)
                throws DirectiveSyntaxException {
            if (frames.isEmpty())
                throw new DirectiveSyntaxException(line, msg);
            return frames.peek();
        }
    }

    /* An open conditional block. */
    private static final class Frame {

        private final ConditionalBranch.Kind entryKind;
        private final int line;
        @CheckForNull
        private ConditionalBranch entry;
        private final List<ConditionalBranch> elifs = new ArrayList<ConditionalBranch>();
        @CheckForNull
        private List<Node> elseBody;
        @CheckForNull
        private String elseRaw;

        /* The branch being collected, until closeBranch(). */
        private ConditionalBranch.Kind kind;
        private String raw;
        private int branchLine;
        private List<Node> branchBody;

        Frame(@Nonnull ConditionalBranch.Kind kind, @Nonnull String raw, int line) {
            this.entryKind = kind;
            this.line = line;
            openBranch(kind, raw, line);
        }

        void openBranch(@Nonnull ConditionalBranch.Kind kind, @Nonnull String raw, int line) {
            this.kind = kind;
            this.raw = raw;
            this.branchLine = line;
            this.branchBody = new ArrayList<Node>();
        }

        void closeBranch()
                throws DirectiveSyntaxException {
            ConditionalBranch branch;
            try {
                branch = new ConditionalBranch(kind, condition(raw), branchBody, raw);
            } catch (StructureException e) {
                throw new DirectiveSyntaxException(branchLine, e.getMessage(), e);
            }
            if (entry == null)
                entry = branch;
            else
                elifs.add(branch);
        }

        @Nonnull
        List<Node> body() {
            return elseBody != null ? elseBody : branchBody;
        }
    }
}
