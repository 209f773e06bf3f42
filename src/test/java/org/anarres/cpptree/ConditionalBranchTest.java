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

import static org.anarres.cpptree.TestTrees.define;
import static org.anarres.cpptree.TestTrees.structureFailure;
import static org.anarres.cpptree.TestTrees.text;
import static org.anarres.cpptree.TestTrees.violationOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ConditionalBranch")
class ConditionalBranchTest {

    private static final List<Node> EMPTY = Collections.emptyList();

    @Nested
    @DisplayName("Raw text")
    class Raw {

        @Test
        @DisplayName("Accepts whitespace around the hash")
        void whitespace() {
            assertThat(new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "FOO", EMPTY, "#   ifdef FOO").getKind())
                    .isEqualTo(ConditionalBranch.Kind.IFDEF);
            assertThat(new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "FOO", EMPTY, "#ifdef FOO").getKind())
                    .isEqualTo(ConditionalBranch.Kind.IFDEF);
        }

        @Test
        @DisplayName("Rejects a misspelt keyword")
        void misspelt() {
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "FOO", EMPTY, "#ifde FOO")))
                    .isEqualTo(Violation.RAW_FORMAT);
        }

        @Test
        @DisplayName("Checks the keyword before the condition")
        void keywordFirst() {
            StructureException e = structureFailure(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IF, "", EMPTY, "#ifdef X"));
            assertThat(e.getViolation()).isEqualTo(Violation.RAW_FORMAT);
            assertThat(e.getField()).isEqualTo("raw");
        }

        @Test
        @DisplayName("Rejects blank raw text")
        void blank() {
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IF, "1", EMPTY, " ")))
                    .isEqualTo(Violation.RAW_FORMAT);
        }
    }

    @Nested
    @DisplayName("Conditions")
    class Conditions {

        @Test
        @DisplayName("Accepts any non-blank if expression")
        void ifExpression() {
            ConditionalBranch b = new ConditionalBranch(ConditionalBranch.Kind.IF,
                    "defined(X) && Y > 1", EMPTY, "#if defined(X) && Y > 1\n");
            assertThat(b.getCondition()).isEqualTo("defined(X) && Y > 1");
        }

        @Test
        @DisplayName("Rejects blank if and elif conditions")
        void blankExpression() {
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IF, "  ", EMPTY, "#if")))
                    .isEqualTo(Violation.EMPTY_CONDITION);
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.ELIF, null, EMPTY, "#elif")))
                    .isEqualTo(Violation.EMPTY_CONDITION);
        }

        @Test
        @DisplayName("Accepts an identifier for ifdef and ifndef")
        void identifier() {
            assertThat(new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "FOO_BAR", EMPTY, "#ifdef FOO_BAR")
                    .getCondition()).isEqualTo("FOO_BAR");
            assertThat(new ConditionalBranch(ConditionalBranch.Kind.IFNDEF, " _guard_h ", EMPTY, "#ifndef _guard_h")
                    .getCondition()).isEqualTo(" _guard_h ");
        }

        @Test
        @DisplayName("Treats a condition of Unicode spaces as blank")
        void unicodeBlankCondition() {
            StructureException e = structureFailure(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IF, "\u00A0", EMPTY, "#if \u00A0\n"));
            assertThat(e.getViolation()).isEqualTo(Violation.EMPTY_CONDITION);
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.ELIF, "\u2003\u3000", EMPTY, "#elif")))
                    .isEqualTo(Violation.EMPTY_CONDITION);
        }

        @Test
        @DisplayName("Strips Unicode spaces around an ifdef identifier")
        void unicodePaddedIdentifier() {
            ConditionalBranch b = new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "FOO\u2003", EMPTY,
                    "#ifdef FOO\u2003\n");
            assertThat(b.getCondition()).isEqualTo("FOO\u2003");
            assertThat(new ConditionalBranch(ConditionalBranch.Kind.IFNDEF, "\u00A0BAR", EMPTY,
                    "\u00A0#ifndef \u00A0BAR").getRaw()).isEqualTo("\u00A0#ifndef \u00A0BAR");
        }

        @Test
        @DisplayName("Rejects a malformed identifier for ifdef and ifndef")
        void badIdentifier() {
            StructureException e = structureFailure(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "1BAD", EMPTY, "#ifdef 1BAD"));
            assertThat(e.getViolation()).isEqualTo(Violation.INVALID_IDENTIFIER);
            assertThat(e.getField()).isEqualTo("condition");
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IFNDEF, "FOO BAR", EMPTY, "#ifndef FOO BAR")))
                    .isEqualTo(Violation.INVALID_IDENTIFIER);
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "defined(X)", EMPTY, "#ifdef defined(X)")))
                    .isEqualTo(Violation.INVALID_IDENTIFIER);
        }

        @Test
        @DisplayName("Reports a blank ifdef condition as empty")
        void blankIdentifier() {
            assertThat(violationOf(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IFDEF, "", EMPTY, "#ifdef")))
                    .isEqualTo(Violation.EMPTY_CONDITION);
        }
    }

    @Nested
    @DisplayName("Body")
    class Body {

        @Test
        @DisplayName("Rejects a null body")
        void nullBody() {
            StructureException e = structureFailure(
                    () -> new ConditionalBranch(ConditionalBranch.Kind.IF, "1", null, "#if 1"));
            assertThat(e.getViolation()).isEqualTo(Violation.NULL_BODY);
            assertThat(e.getField()).isEqualTo("body");
        }

        @Test
        @DisplayName("Copies the body")
        void copiesBody() {
            List<Node> body = new ArrayList<Node>(Arrays.<Node>asList(text("a\n"), define("X")));
            ConditionalBranch b = new ConditionalBranch(ConditionalBranch.Kind.IF, "1", body, "#if 1\n");
            body.clear();

            assertThat(b.getBody()).hasSize(2);
            assertThatThrownBy(() -> b.getBody().add(text("b\n")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("Does not inspect the body")
        void bodyNotInspected() {
            ConditionalBranch b = new ConditionalBranch(ConditionalBranch.Kind.IF, "1",
                    Arrays.<Node>asList(text("a\n"), null), "#if 1\n");
            assertThat(b.getBody()).containsExactly(text("a\n"), null);
        }
    }
}
