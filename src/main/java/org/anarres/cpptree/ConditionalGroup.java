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

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A complete conditional block:
 * <pre>
 * #if / #ifdef / #ifndef   entry
 * #elif ...                elifs, zero or more
 * #else                    optional
 * #endif
 * </pre>
 *
 * The grammar is enforced once, on construction. Conditional keywords
 * may not appear as flat directives in any body; a nested block must
 * itself be a ConditionalGroup. Nested groups are not re-walked: each
 * validated its own bodies when it was built.
 */
public final class ConditionalGroup implements Node {

    public static final String DEFAULT_ENDIF = "#endif";

    private final ConditionalBranch entry;
    private final List<ConditionalBranch> elifs;
    @CheckForNull
    private final List<Node> elseBody;
    @CheckForNull
    private final String elseRaw;
    private final String endifRaw;

    /**
     * Constructs a group with elif branches, an optional else body and
     * explicit else and endif lines.
     *
     * @param entry the opening branch.
     * @param elifs the elif branches, or null for none.
     * @param elseBody the else body, or null if there is no else.
     * @param elseRaw the original else line, or null.
     * @param endifRaw the original endif line.
     * @throws StructureException if the group is malformed.
     */
    public ConditionalGroup(ConditionalBranch entry,
            @CheckForNull List<ConditionalBranch> elifs,
            @CheckForNull List<? extends Node> elseBody,
            @CheckForNull String elseRaw,
            String endifRaw) {
        StructuralValidator.requireEntry(entry, "entry");
        StructuralValidator.requireElifs(elifs, "elifs");
        StructuralValidator.requireElse(elseBody, elseRaw, "elseRaw");
        StructuralValidator.expectDirective(endifRaw, PreprocessorCommand.PP_ENDIF.getText(), "endifRaw");

        StructuralValidator.checkBody(entry.getBody(), "entry.body");
        if (elifs != null)
            for (int i = 0; i < elifs.size(); i++)
                StructuralValidator.checkBody(elifs.get(i).getBody(), "elifs[" + i + "].body");
        if (elseBody != null)
            StructuralValidator.checkBody(elseBody, "elseBody");

        this.entry = entry;
        this.elifs = elifs == null
                ? Collections.<ConditionalBranch>emptyList()
                : StructuralValidator.copyOf(elifs);
        this.elseBody = elseBody == null ? null : StructuralValidator.copyOf(elseBody);
        this.elseRaw = elseRaw;
        this.endifRaw = endifRaw;
    }

    /**
     * Constructs a group with a <code>#endif</code> terminator.
     */
    public ConditionalGroup(ConditionalBranch entry,
            @CheckForNull List<ConditionalBranch> elifs,
            @CheckForNull List<? extends Node> elseBody,
            @CheckForNull String elseRaw) {
        this(entry, elifs, elseBody, elseRaw, DEFAULT_ENDIF);
    }

    /**
     * Constructs a group with an unlabelled else and a
     * <code>#endif</code> terminator.
     */
    public ConditionalGroup(ConditionalBranch entry,
            @CheckForNull List<ConditionalBranch> elifs,
            @CheckForNull List<? extends Node> elseBody) {
        this(entry, elifs, elseBody, null, DEFAULT_ENDIF);
    }

    /**
     * Constructs a group consisting only of its entry branch.
     */
    public ConditionalGroup(ConditionalBranch entry) {
        this(entry, null, null, null, DEFAULT_ENDIF);
    }

    @Nonnull
    public ConditionalBranch getEntry() {
        return entry;
    }

    /**
     * Returns the elif branches in source order; empty if there are none.
     */
    @Nonnull
    public List<ConditionalBranch> getElifs() {
        return elifs;
    }

    public boolean hasElse() {
        return elseBody != null;
    }

    /**
     * Returns the else body, or null if the group has no else.
     */
    @CheckForNull
    public List<Node> getElseBody() {
        return elseBody;
    }

    /**
     * Returns the original else line, or null if it was not recorded.
     */
    @CheckForNull
    public String getElseRaw() {
        return elseRaw;
    }

    @Nonnull
    public String getEndifRaw() {
        return endifRaw;
    }

    @Override
    public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
        return visitor.visitGroup(this);
    }

    @Nonnull
    @Override
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", "conditional_group");
        result.add("entry", entry.toJson());
        if (!elifs.isEmpty()) {
            JsonArray branches = new JsonArray();
            for (ConditionalBranch elif : elifs)
                branches.add(elif.toJson());
            result.add("elifs", branches);
        }
        if (elseBody != null) {
            result.add("else_body", Nodes.toJson(elseBody));
            if (elseRaw != null)
                result.addProperty("else_raw", elseRaw);
        }
        result.addProperty("endif_raw", endifRaw);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ConditionalGroup) {
            ConditionalGroup o = (ConditionalGroup) obj;
            return entry.equals(o.entry)
                    && elifs.equals(o.elifs)
                    && Objects.equals(elseBody, o.elseBody)
                    && Objects.equals(elseRaw, o.elseRaw)
                    && endifRaw.equals(o.endifRaw);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(entry, elifs, elseBody, elseRaw, endifRaw);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
