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

import java.util.Collection;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Regenerates source text from directive trees.
 *
 * A single node, a node sequence or a file is rendered by
 * concatenating the raw and content fields in tree order. Nothing is
 * inserted between them: line terminators belong to the fields
 * themselves, so a tree built from source text reproduces that text
 * exactly.
 *
 * A path-keyed map of files is rendered as an amalgamation, in which
 * <code>#include</code> directives naming another file of the map are
 * replaced by that file's text. Each file is inlined at most once.
 * With {@link Feature#LINEMARKERS} the output carries
 * <code># line "file" flags</code> markers in the format of cpp:
 * flag <code>1</code> enters an included file, flag <code>2</code>
 * returns to the includer.
 */
public class Stringifier {

    private static final Logger LOG = LoggerFactory.getLogger(Stringifier.class);

    /** Emitted for an else branch whose raw line was not recorded. */
    public static final String DEFAULT_ELSE = "#else\n";

    private final Set<Feature> features;

    public Stringifier() {
        this.features = EnumSet.noneOf(Feature.class);
    }

    public Stringifier(@Nonnull Collection<Feature> features) {
        this();
        this.features.addAll(features);
    }

    public Stringifier(Feature... features) {
        this();
        for (Feature f : features)
            this.features.add(f);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    @Nonnull
    public String stringify(@Nonnull Node node) {
        StringBuilder buf = new StringBuilder();
        node.accept(new Writer(buf, null, null));
        return buf.toString();
    }

    @Nonnull
    public String stringify(@Nonnull List<? extends Node> nodes) {
        StringBuilder buf = new StringBuilder();
        new Writer(buf, null, null).walk(nodes);
        return buf.toString();
    }

    @Nonnull
    public String stringify(@Nonnull FileRoot file) {
        return stringify(file.getItems());
    }

    /**
     * Renders every file of the map, in iteration order, as one
     * translation unit.
     *
     * A quoted or angled include whose target resolves to a key of the
     * map is replaced by that file, unless the file was already
     * emitted. Files which were inlined are not rendered again at top
     * level. Targets resolve relative to the including file first, then
     * as a key, then as a suffix <code>/target</code> of a key.
     */
    @Nonnull
    public String stringify(@Nonnull Map<String, ? extends List<? extends Node>> files) {
        Amalgamation amalgamation = new Amalgamation(files);
        StringBuilder buf = new StringBuilder();
        for (Map.Entry<String, ? extends List<? extends Node>> e : files.entrySet()) {
            String path = e.getKey();
            if (!amalgamation.claim(path)) {
                if (getFeature(Feature.DEBUG))
                    LOG.debug("Skipping " + path + ": already included");
                continue;
            }
            ensureNewline(buf);
            if (getFeature(Feature.LINEMARKERS))
                linemarker(buf, 1, path, null);
            new Writer(buf, amalgamation, path).walk(e.getValue());
        }
        return buf.toString();
    }

    /**
     * Returns the file named by an include directive, or null for
     * computed includes.
     */
    @CheckForNull
    /* pp */ static String includeTarget(@Nonnull DirectiveNode directive) {
        String arg = directive.getArgument();
        if (arg.length() < 2)
            return null;
        char close;
        switch (arg.charAt(0)) {
            case '"':
                close = '"';
                break;
            case '<':
                close = '>';
                break;
            default:
                return null;
        }
        int end = arg.indexOf(close, 1);
        if (end <= 1)
            return null;
        return arg.substring(1, end);
    }

    private static void ensureNewline(@Nonnull StringBuilder buf) {
        if (buf.length() > 0 && buf.charAt(buf.length() - 1) != '\n')
            buf.append('\n');
    }

    private static void linemarker(@Nonnull StringBuilder buf, int line, @Nonnull String path, @CheckForNull String flag) {
        ensureNewline(buf);
        buf.append("# ").append(line).append(" \"");
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\\' || c == '"')
                buf.append('\\');
            buf.append(c);
        }
        buf.append('"');
        if (flag != null)
            buf.append(' ').append(flag);
        buf.append('\n');
    }

    private static int countNewlines(@Nonnull String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++)
            if (s.charAt(i) == '\n')
                n++;
        return n;
    }

    private static final class Amalgamation {

        private final Map<String, ? extends List<? extends Node>> files;
        private final Set<String> emitted = new HashSet<String>();

        Amalgamation(@Nonnull Map<String, ? extends List<? extends Node>> files) {
            this.files = files;
        }

        /** Marks the file as emitted; returns false if it already was. */
        boolean claim(@Nonnull String path) {
            return emitted.add(path);
        }

        @CheckForNull
        String resolve(@Nonnull String from, @Nonnull String target) {
            String sibling = FilenameUtils.concat(FilenameUtils.getFullPath(from), target);
            if (sibling != null) {
                sibling = FilenameUtils.separatorsToUnix(sibling);
                if (files.containsKey(sibling))
                    return sibling;
            }
            if (files.containsKey(target))
                return target;
            for (String key : files.keySet())
                if (key.endsWith("/" + target))
                    return key;
            return null;
        }

        @Nonnull
        List<? extends Node> get(@Nonnull String path) {
            return files.get(path);
        }
    }

    private final class Writer implements NodeVisitor<Void> {

        private final StringBuilder buf;
        @CheckForNull
        private final Amalgamation amalgamation;
        @CheckForNull
        private final String path;
        /* The line of the current file which the next emitted text starts on. */
        private int line = 1;

        Writer(@Nonnull StringBuilder buf, @CheckForNull Amalgamation amalgamation, @CheckForNull String path) {
            this.buf = buf;
            this.amalgamation = amalgamation;
            this.path = path;
        }

        void walk(@Nonnull List<? extends Node> nodes) {
            for (Node node : nodes)
                node.accept(this);
        }

        private void emit(@Nonnull String text) {
            buf.append(text);
            line += countNewlines(text);
        }

        @Override
        public Void visitText(@Nonnull TextBlock text) {
            emit(text.getContent());
            return null;
        }

        @Override
        public Void visitDirective(@Nonnull DirectiveNode directive) {
            if (amalgamation != null && directive.getKind() == DirectiveNode.Kind.INCLUDE) {
                String included = resolveInclude(directive);
                if (included != null) {
                    line += countNewlines(directive.getRaw());
                    inline(included);
                    return null;
                }
            }
            emit(directive.getRaw());
            return null;
        }

        @CheckForNull
        private String resolveInclude(@Nonnull DirectiveNode directive) {
            String target = includeTarget(directive);
            if (target == null)
                return null;
            String included = amalgamation.resolve(path, target);
            if (included == null) {
                if (getFeature(Feature.DEBUG))
                    LOG.debug(path + ": " + target + " not in the file set; keeping include");
                return null;
            }
            if (!amalgamation.claim(included)) {
                if (getFeature(Feature.DEBUG))
                    LOG.debug(path + ": " + included + " already emitted; keeping include");
                return null;
            }
            return included;
        }

        private void inline(@Nonnull String included) {
            if (getFeature(Feature.DEBUG))
                LOG.debug(path + ": inlining " + included);
            if (getFeature(Feature.LINEMARKERS))
                linemarker(buf, 1, included, "1");
            else
                ensureNewline(buf);
            new Writer(buf, amalgamation, included).walk(amalgamation.get(included));
            ensureNewline(buf);
            if (getFeature(Feature.LINEMARKERS))
                linemarker(buf, line, path, "2");
        }

        @Override
        public Void visitGroup(@Nonnull ConditionalGroup group) {
            ConditionalBranch entry = group.getEntry();
            emit(entry.getRaw());
            walk(entry.getBody());
            for (ConditionalBranch elif : group.getElifs()) {
                emit(elif.getRaw());
                walk(elif.getBody());
            }
            List<Node> elseBody = group.getElseBody();
            if (elseBody != null) {
                String elseRaw = group.getElseRaw();
                emit(elseRaw != null ? elseRaw : DEFAULT_ELSE);
                walk(elseBody);
            }
            emit(group.getEndifRaw());
            return null;
        }
    }
}
