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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The directive keywords recognised after a <code>#</code>.
 */
public enum PreprocessorCommand {

    PP_DEFINE("define"),
    PP_ELIF("elif"),
    PP_ELSE("else"),
    PP_ENDIF("endif"),
    PP_ERROR("error"),
    PP_IF("if"),
    PP_IFDEF("ifdef"),
    PP_IFNDEF("ifndef"),
    PP_INCLUDE("include"),
    PP_LINE("line"),
    PP_PRAGMA("pragma"),
    PP_UNDEF("undef"),
    PP_WARNING("warning"),
    PP_INCLUDE_NEXT("include_next"),
    PP_IMPORT("import"),
    PP_IDENT("ident");

    private static final Map<String, PreprocessorCommand> BY_TEXT = new HashMap<String, PreprocessorCommand>();

    static {
        for (PreprocessorCommand ppcmd : values())
            BY_TEXT.put(ppcmd.getText(), ppcmd);
    }

    private final String text;

    PreprocessorCommand(@Nonnull String text) {
        this.text = text;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    /**
     * Returns true for the keywords which open, continue or close a
     * conditional block.
     *
     * These may never appear as a flat directive inside a branch body.
     */
    public boolean isConditional() {
        switch (this) {
            case PP_IF:
            case PP_IFDEF:
            case PP_IFNDEF:
            case PP_ELIF:
            case PP_ELSE:
            case PP_ENDIF:
                return true;
            default:
                return false;
        }
    }

    /**
     * Returns the command for the given keyword, or null.
     *
     * The lookup is case-sensitive.
     */
    @CheckForNull
    public static PreprocessorCommand forText(@Nonnull String text) {
        return BY_TEXT.get(text);
    }
}
