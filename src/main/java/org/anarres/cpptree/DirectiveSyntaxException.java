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

/**
 * Thrown when source text cannot be grouped into a directive tree.
 */
public class DirectiveSyntaxException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int line;

    public DirectiveSyntaxException(int line, String msg) {
        super("Error at " + line + ": " + msg);
        this.line = line;
    }

    public DirectiveSyntaxException(int line, String msg, Throwable cause) {
        super("Error at " + line + ": " + msg, cause);
        this.line = line;
    }

    /**
     * Returns the 1-based line on which the error was detected.
     */
    public int getLine() {
        return line;
    }
}
