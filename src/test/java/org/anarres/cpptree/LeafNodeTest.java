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

import static org.anarres.cpptree.TestTrees.structureFailure;
import static org.anarres.cpptree.TestTrees.violationOf;
import static org.assertj.core.api.Assertions.assertThat;

import com.google.gson.JsonObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("Leaf nodes")
class LeafNodeTest {

    @Nested
    @DisplayName("TextBlock")
    class Text {

        @Test
        @DisplayName("Accepts empty content")
        void emptyContent() {
            assertThat(new TextBlock("").getContent()).isEmpty();
        }

        @Test
        @DisplayName("Rejects null content")
        void nullContent() {
            StructureException e = structureFailure(() -> new TextBlock(null));
            assertThat(e.getViolation()).isEqualTo(Violation.NULL_FIELD);
            assertThat(e.getField()).isEqualTo("content");
        }

        @Test
        @DisplayName("Keeps directive-looking content verbatim")
        void directiveLookingContent() {
            assertThat(new TextBlock("#else\n").getContent()).isEqualTo("#else\n");
        }
    }

    @Nested
    @DisplayName("DirectiveNode")
    class Directive {

        @ParameterizedTest
        @EnumSource(DirectiveNode.Kind.class)
        @DisplayName("Accepts raw text naming its own kind")
        void everyKind(DirectiveNode.Kind kind) {
            DirectiveNode node = new DirectiveNode(kind, "#" + kind.getText() + " X 1\n");
            assertThat(node.getKind()).isEqualTo(kind);
            assertThat(node.getArgument()).isEqualTo("X 1");
        }

        @Test
        @DisplayName("Rejects raw text naming another kind")
        void kindMismatch() {
            assertThat(new DirectiveNode(DirectiveNode.Kind.DEFINE, "#define X 1").getRaw())
                    .isEqualTo("#define X 1");
            StructureException e = structureFailure(
                    () -> new DirectiveNode(DirectiveNode.Kind.UNDEF, "#define X 1"));
            assertThat(e.getViolation()).isEqualTo(Violation.RAW_FORMAT);
            assertThat(e.getField()).isEqualTo("raw");
            assertThat(e.getMessage()).contains("expected #undef, got #define");
        }

        @Test
        @DisplayName("Compares the keyword exactly")
        void exactKeyword() {
            assertThat(violationOf(() -> new DirectiveNode(DirectiveNode.Kind.DEFINE, "#DEFINE X")))
                    .isEqualTo(Violation.RAW_FORMAT);
            assertThat(violationOf(() -> new DirectiveNode(DirectiveNode.Kind.DEFINE, "#definex X")))
                    .isEqualTo(Violation.RAW_FORMAT);
            assertThat(violationOf(() -> new DirectiveNode(DirectiveNode.Kind.INCLUDE, "#includ <a.h>")))
                    .isEqualTo(Violation.RAW_FORMAT);
        }

        @Test
        @DisplayName("Ignores whitespace around the hash")
        void whitespaceAroundHash() {
            DirectiveNode node = new DirectiveNode(DirectiveNode.Kind.PRAGMA, "  #  pragma once\n");
            assertThat(node.getArgument()).isEqualTo("once");
        }

        @Test
        @DisplayName("Rejects raw text without a hash")
        void missingHash() {
            StructureException e = structureFailure(
                    () -> new DirectiveNode(DirectiveNode.Kind.DEFINE, "define X 1"));
            assertThat(e.getViolation()).isEqualTo(Violation.RAW_FORMAT);
            assertThat(e.getMessage()).contains("must start with '#'");
        }

        @Test
        @DisplayName("Rejects blank or null raw text")
        void blankRaw() {
            assertThat(violationOf(() -> new DirectiveNode(DirectiveNode.Kind.ERROR, "")))
                    .isEqualTo(Violation.RAW_FORMAT);
            assertThat(violationOf(() -> new DirectiveNode(DirectiveNode.Kind.ERROR, "  \n")))
                    .isEqualTo(Violation.RAW_FORMAT);
            assertThat(violationOf(() -> new DirectiveNode(DirectiveNode.Kind.ERROR, null)))
                    .isEqualTo(Violation.RAW_FORMAT);
        }

        @Test
        @DisplayName("Rejects a conditional keyword whatever the declared kind")
        void conditionalKeyword() {
            for (DirectiveNode.Kind kind : DirectiveNode.Kind.values())
                assertThat(violationOf(() -> new DirectiveNode(kind, "#else")))
                        .isEqualTo(Violation.RAW_FORMAT);
        }

        @Test
        @DisplayName("Rejects a null kind")
        void nullKind() {
            StructureException e = structureFailure(() -> new DirectiveNode(null, "#define X"));
            assertThat(e.getViolation()).isEqualTo(Violation.NULL_FIELD);
            assertThat(e.getField()).isEqualTo("kind");
        }

        @Test
        @DisplayName("Exports kind and raw text")
        void json() {
            JsonObject json = new DirectiveNode(DirectiveNode.Kind.INCLUDE, "#include <a.h>\n").toJson();
            assertThat(json.get("kind").getAsString()).isEqualTo("include");
            assertThat(json.get("raw").getAsString()).isEqualTo("#include <a.h>\n");
        }

        @Test
        @DisplayName("Compares by value")
        void equality() {
            assertThat(new DirectiveNode(DirectiveNode.Kind.DEFINE, "#define X"))
                    .isEqualTo(new DirectiveNode(DirectiveNode.Kind.DEFINE, "#define X"))
                    .hasSameHashCodeAs(new DirectiveNode(DirectiveNode.Kind.DEFINE, "#define X"))
                    .isNotEqualTo(new DirectiveNode(DirectiveNode.Kind.DEFINE, "# define X"));
        }
    }
}
