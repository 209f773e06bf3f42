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

import com.google.gson.JsonObject;
import java.util.List;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * One clause of a conditional block: the test, the directive line
 * which carried it, and the nodes it guards.
 *
 * A branch is not itself a {@link Node}; it only occurs inside a
 * {@link ConditionalGroup}. The body is not inspected here.
 */
public final class ConditionalBranch {

    public enum Kind {
        IF(PreprocessorCommand.PP_IF),
        IFDEF(PreprocessorCommand.PP_IFDEF),
        IFNDEF(PreprocessorCommand.PP_IFNDEF),
        ELIF(PreprocessorCommand.PP_ELIF);

        private final PreprocessorCommand command;

        Kind(@Nonnull PreprocessorCommand command) {
            this.command = command;
        }

        @Nonnull
        public PreprocessorCommand getCommand() {
            return command;
        }

        @Nonnull
        public String getText() {
            return command.getText();
        }

        /** Returns true for the kinds which may open a group. */
        public boolean isOpening() {
            return this != ELIF;
        }

        /** Returns true for the kinds whose condition is a macro name. */
        public boolean isDefinedTest() {
            return this == IFDEF || this == IFNDEF;
        }

        @CheckForNull
        public static Kind forCommand(@Nonnull PreprocessorCommand command) {
            for (Kind kind : values())
                if (kind.command == command)
                    return kind;
            return null;
        }
    }

    private final Kind kind;
    private final String condition;
    private final List<Node> body;
    private final String raw;

    /**
     * @param kind the branch kind.
     * @param condition the test: an expression for <code>#if</code> and
     *  <code>#elif</code>, a macro name for <code>#ifdef</code> and
     *  <code>#ifndef</code>.
     * @param body the guarded nodes, possibly empty.
     * @param raw the original directive line.
     * @throws StructureException if any of the above is malformed.
     */
    public ConditionalBranch(Kind kind, String condition, List<? extends Node> body, String raw) {
        StructuralValidator.requireField(kind, "kind");
        StructuralValidator.expectDirective(raw, kind.getText(), "raw");
        if (kind.isDefinedTest())
            StructuralValidator.requireIdentifier(condition, "condition");
        else
            StructuralValidator.requireCondition(condition, "condition");
        StructuralValidator.requireBody(body, "body");
        this.kind = kind;
        this.condition = condition;
        this.body = StructuralValidator.copyOf(body);
        this.raw = raw;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    /**
     * Returns the condition exactly as given.
     */
    @Nonnull
    public String getCondition() {
        return condition;
    }

    /**
     * Returns the guarded nodes. The list is unmodifiable.
     */
    @Nonnull
    public List<Node> getBody() {
        return body;
    }

    @Nonnull
    public String getRaw() {
        return raw;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", kind.getText());
        result.addProperty("condition", condition);
        result.addProperty("raw", raw);
        result.add("body", Nodes.toJson(body));
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof ConditionalBranch) {
            ConditionalBranch o = (ConditionalBranch) obj;
            return kind == o.kind
                    && condition.equals(o.condition)
                    && raw.equals(o.raw)
                    && body.equals(o.body);
        }
        return false;
    }

    @Override
    public int hashCode() {
        int h = kind.hashCode();
        h = h * 31 + condition.hashCode();
        h = h * 31 + raw.hashCode();
        return h * 31 + body.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
