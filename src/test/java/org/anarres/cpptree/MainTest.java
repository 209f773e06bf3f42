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

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Main")
class MainTest {

    private static final String GUARD = "#ifndef A_H\n#define A_H\nint a;\n#endif\n";

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String stdin, String... args) throws IOException {
        return Main.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, "UTF-8"),
                new PrintStream(err, true, "UTF-8"));
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(Main.LOG_LEVEL_PROPERTY);
    }

    private String out() {
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    private String err() {
        return new String(err.toByteArray(), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("Modes")
    class Modes {

        @Test
        @DisplayName("Regenerates standard input by default")
        void regenerate() throws IOException {
            assertThat(run(GUARD)).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo(GUARD);
        }

        @Test
        @DisplayName("Checks the round trip")
        void check() throws IOException {
            assertThat(run(GUARD, "--check")).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo("<stdin>: OK" + System.lineSeparator());
        }

        @Test
        @DisplayName("Prints the tree as JSON")
        void tree() throws IOException {
            assertThat(run(GUARD, "--tree")).isEqualTo(Main.EXIT_OK);
            assertThat(out())
                    .contains("\"path\": \"<stdin>\"")
                    .contains("\"kind\": \"conditional_group\"")
                    .contains("\"condition\": \"A_H\"");
        }

        @Test
        @DisplayName("Lists macros with command-line definitions")
        void macros() throws IOException {
            assertThat(run("int x;\n", "--macros", "-D", "DEBUG", "-DLEVEL=3", "--define", "GONE", "-U", "GONE"))
                    .isEqualTo(Main.EXIT_OK);
            assertThat(out())
                    .contains("\"DEBUG\": \"1\"")
                    .contains("\"LEVEL\": \"3\"")
                    .doesNotContain("GONE");
        }

        @Test
        @DisplayName("Amalgamates input files")
        void amalgamate(@TempDir File dir) throws IOException {
            File main = new File(dir, "main.c");
            File header = new File(dir, "a.h");
            FileUtils.writeStringToFile(main, "#include \"a.h\"\nint main;\n", StandardCharsets.UTF_8);
            FileUtils.writeStringToFile(header, GUARD, StandardCharsets.UTF_8);

            assertThat(run("", "--amalgamate", main.getPath(), header.getPath())).isEqualTo(Main.EXIT_OK);
            assertThat(out()).isEqualTo(GUARD + "int main;\n");
        }

        @Test
        @DisplayName("Enables debug logging for the package")
        void debug() throws IOException {
            assertThat(run(GUARD)).isEqualTo(Main.EXIT_OK);
            assertThat(System.getProperty(Main.LOG_LEVEL_PROPERTY)).isNull();

            assertThat(run(GUARD, "--debug")).isEqualTo(Main.EXIT_OK);
            assertThat(System.getProperty(Main.LOG_LEVEL_PROPERTY)).isEqualTo("debug");
            assertThat(out()).isEqualTo(GUARD + GUARD);
        }

        @Test
        @DisplayName("Prints help")
        void help() throws IOException {
            assertThat(run("", "--help")).isEqualTo(Main.EXIT_OK);
            assertThat(out()).contains("--tree").contains("--amalgamate");
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Rejects more than one mode")
        void twoModes() throws IOException {
            assertThat(run(GUARD, "--tree", "--check")).isEqualTo(Main.EXIT_ERROR);
            assertThat(err()).contains("At most one of");
            assertThat(out()).isEmpty();
        }

        @Test
        @DisplayName("Reports a directive syntax error")
        void syntaxError() throws IOException {
            assertThat(run("int x;\n#endif\n")).isEqualTo(Main.EXIT_ERROR);
            assertThat(err()).isEqualTo("<stdin>: Error at 2: #endif without #if" + System.lineSeparator());
        }

        @Test
        @DisplayName("Rejects unknown options")
        void unknownOption() throws IOException {
            assertThat(run("", "--bogus")).isEqualTo(Main.EXIT_ERROR);
            assertThat(err()).contains("bogus");
        }

        @Test
        @DisplayName("Rejects a bad macro name")
        void badDefine() throws IOException {
            assertThat(run("", "--macros", "-D", "1X=2")).isEqualTo(Main.EXIT_ERROR);
            assertThat(err()).contains("Not a macro name: 1X");
        }

        @Test
        @DisplayName("Rejects unmodelled directives in strict mode")
        void strict() throws IOException {
            assertThat(run("#line 1\n")).isEqualTo(Main.EXIT_OK);
            assertThat(run("#line 1\n", "--strict")).isEqualTo(Main.EXIT_ERROR);
            assertThat(err()).contains("has no node kind");
        }
    }
}
