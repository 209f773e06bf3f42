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
 * The structural invariant a rejected tree node violated.
 */
public enum Violation {
    /** Raw text is blank, lacks a <code>#</code>, or names the wrong keyword. */
    RAW_FORMAT,
    /** An <code>#if</code> or <code>#elif</code> condition is blank. */
    EMPTY_CONDITION,
    /** An <code>#ifdef</code> or <code>#ifndef</code> condition is not a C identifier. */
    INVALID_IDENTIFIER,
    /** A body or item sequence is null. */
    NULL_BODY,
    /** A required scalar field is null. */
    NULL_FIELD,
    /** A conditional group was opened by an <code>#elif</code> branch. */
    ILLEGAL_ENTRY,
    /** An <code>#elif</code> list contains a branch of another kind. */
    HETEROGENEOUS_ELIF,
    /** Else raw text was given without an else body. */
    MALFORMED_ELSE,
    /** A conditional keyword appears as a flat directive inside a body. */
    ILLEGAL_NESTED_DIRECTIVE,
    /** A body contains something which is not a node. */
    UNKNOWN_NODE_TYPE,
    /** A file path is blank. */
    EMPTY_PATH,
    /** A file item is null. */
    NULL_ITEM
}
