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
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A single-line directive which does not take part in conditional
 * compilation.
 */
public final class DirectiveNode implements Node {

    public enum Kind {
        INCLUDE(PreprocessorCommand.PP_INCLUDE),
        DEFINE(PreprocessorCommand.PP_DEFINE),
        UNDEF(PreprocessorCommand.PP_UNDEF),
        PRAGMA(PreprocessorCommand.PP_PRAGMA),
        ERROR(PreprocessorCommand.PP_ERROR);

        private final PreprocessorCommand command;

        Kind(@Nonnull PreprocessorCommand command) {
            this.command = command;
        }

        @Nonnull
        public PreprocessorCommand getCommand() {
            return command;
        }

        /** Returns the keyword, such as <code>"define"</code>. */
        @Nonnull
        public String getText() {
            return command.getText();
        }

        /**
         * Returns the kind for the given command, or null if the command
         * is not a flat directive.
         */
        @CheckForNull
        public static Kind forCommand(@Nonnull PreprocessorCommand command) {
            for (Kind kind : values())
                if (kind.command == command)
                    return kind;
            return null;
        }
    }

    private final Kind kind;
    private final String raw;

    /**
     * @param kind the directive kind.
     * @param raw the original source line, including the <code>#</code>.
     * @throws StructureException if raw does not name the given kind.
     */
    public DirectiveNode(Kind kind, String raw) {
        StructuralValidator.requireField(kind, "kind");
        StructuralValidator.expectDirective(raw, kind.getText(), "raw");
        this.kind = kind;
        this.raw = raw;
    }

    @Nonnull
    public Kind getKind() {
        return kind;
    }

    @Nonnull
    public String getRaw() {
        return raw;
    }

    /**
     * Returns the text after the keyword, trimmed, with line
     * continuations removed.
     */
    @Nonnull
    public String getArgument() {
        String arg = Directives.argument(raw);
        assert arg != null : "Validated raw without keyword";
        return arg;
    }

    @Override
    public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
        return visitor.visitDirective(this);
    }

    @Nonnull
    @Override
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", kind.getText());
        result.addProperty("raw", raw);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof DirectiveNode) {
            DirectiveNode o = (DirectiveNode) obj;
            return kind == o.kind && raw.equals(o.raw);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + raw.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
