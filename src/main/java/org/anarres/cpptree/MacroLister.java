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
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;
import org.pcollections.Empty;
import org.pcollections.PMap;
import org.pcollections.PVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists which macros are in scope for which nodes.
 *
 * The walk follows document order, threading a persistent macro
 * environment through <code>#define</code> and <code>#undef</code>.
 * Text blocks and the remaining flat directives are the affected
 * nodes; consecutive affected nodes seeing an equal environment are
 * reported together, and nodes seeing no macros are not reported.
 *
 * Every branch of a conditional group starts from the environment in
 * effect at the group. After the group a macro stays in scope only if
 * every path through it, including the fall-through of a group without
 * an else, ends with the same definition of that macro.
 */
public class MacroLister {

    private static final Logger LOG = LoggerFactory.getLogger(MacroLister.class);

    private final PMap<String, MacroDefinition> predefined;
    private final Set<Feature> features = EnumSet.noneOf(Feature.class);

    public MacroLister() {
        this.predefined = Empty.map();
    }

    /**
     * @param predefined object-like macros in scope before the first
     *  node, as name to replacement text.
     * @throws IllegalArgumentException if a name is not an identifier.
     */
    public MacroLister(@Nonnull Map<String, String> predefined) {
        PMap<String, MacroDefinition> macros = Empty.map();
        for (Map.Entry<String, String> e : predefined.entrySet())
            macros = macros.plus(e.getKey(), MacroDefinition.predefined(e.getKey(), e.getValue()));
        this.predefined = macros;
    }

    public MacroLister(@Nonnull Map<String, String> predefined, @Nonnull Collection<Feature> features) {
        this(predefined);
        this.features.addAll(features);
    }

    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    @Nonnull
    public List<MacroInfo> list(@Nonnull List<? extends Node> nodes) {
        Walker walker = new Walker(predefined);
        walker.walk(nodes);
        walker.flush();
        return Collections.unmodifiableList(walker.result);
    }

    @Nonnull
    public List<MacroInfo> list(@Nonnull FileRoot file) {
        return list(file.getItems());
    }

    /**
     * Returns the nodes, in order, for which the named macro is in scope.
     */
    @Nonnull
    public static List<Node> affectedBy(@Nonnull List<MacroInfo> infos, @Nonnull String name) {
        List<Node> result = new ArrayList<Node>();
        for (MacroInfo info : infos)
            if (info.getDefinitions().containsKey(name))
                result.addAll(info.getAffected());
        return result;
    }

    /**
     * Keeps the definitions on which every path agrees.
     */
    @Nonnull
    /* pp */ static PMap<String, MacroDefinition> merge(@Nonnull List<PMap<String, MacroDefinition>> paths) {
        PMap<String, MacroDefinition> first = paths.get(0);
        PMap<String, MacroDefinition> result = first;
        for (Map.Entry<String, MacroDefinition> e : first.entrySet()) {
            for (int i = 1; i < paths.size(); i++) {
                if (!e.getValue().equals(paths.get(i).get(e.getKey()))) {
                    result = result.minus(e.getKey());
                    break;
                }
            }
        }
        return result;
    }

    private final class Walker implements NodeVisitor<Void> {

        private final List<MacroInfo> result = new ArrayList<MacroInfo>();
        private PMap<String, MacroDefinition> env;
        @CheckForNull
        private PMap<String, MacroDefinition> segmentEnv;
        private PVector<Node> segment = Empty.vector();

        Walker(@Nonnull PMap<String, MacroDefinition> env) {
            this.env = env;
        }

        void walk(@Nonnull List<? extends Node> nodes) {
            for (Node node : nodes)
                node.accept(this);
        }

        void flush() {
            if (segmentEnv != null && !segmentEnv.isEmpty() && !segment.isEmpty())
                result.add(new MacroInfo(segment, segmentEnv));
            segmentEnv = null;
            segment = Empty.vector();
        }

        private void affected(@Nonnull Node node) {
            if (!env.equals(segmentEnv)) {
                flush();
                segmentEnv = env;
            }
            segment = segment.plus(node);
        }

        @Override
        public Void visitText(@Nonnull TextBlock text) {
            affected(text);
            return null;
        }

        @Override
        public Void visitDirective(@Nonnull DirectiveNode directive) {
            switch (directive.getKind()) {
                case DEFINE:
                    define(directive);
                    break;
                case UNDEF:
                    undef(directive);
                    break;
                default:
                    affected(directive);
                    break;
            }
            return null;
        }

        private void define(@Nonnull DirectiveNode directive) {
            MacroDefinition m = MacroDefinition.parse(directive);
            if (m == null) {
                LOG.warn("Ignoring malformed #define: " + directive.getRaw().trim());
                return;
            }
            MacroDefinition old = env.get(m.getName());
            if (old != null && !old.equals(m))
                LOG.warn("Macro " + m.getName() + " redefined: was " + old + ", now " + m);
            if (getFeature(Feature.DEBUG))
                LOG.debug("Defined macro " + m);
            env = env.plus(m.getName(), m);
        }

        private void undef(@Nonnull DirectiveNode directive) {
            String name = Directives.leadingIdentifier(directive.getArgument());
            if (name.isEmpty()) {
                LOG.warn("Ignoring malformed #undef: " + directive.getRaw().trim());
                return;
            }
            env = env.minus(name);
        }

        @Override
        public Void visitGroup(@Nonnull ConditionalGroup group) {
            PMap<String, MacroDefinition> start = env;
            List<PMap<String, MacroDefinition>> ends = new ArrayList<PMap<String, MacroDefinition>>();

            walk(group.getEntry().getBody());
            ends.add(env);
            for (ConditionalBranch elif : group.getElifs()) {
                env = start;
                walk(elif.getBody());
                ends.add(env);
            }
            List<Node> elseBody = group.getElseBody();
            if (elseBody != null) {
                env = start;
                walk(elseBody);
                ends.add(env);
            } else {
                ends.add(start);
            }
            env = merge(ends);
            return null;
        }
    }
}
