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
 * Features of the tree builder and stringifier which may be enabled.
 */
public enum Feature {
    /** Logs built conditional groups and amalgamation decisions. */
    DEBUG,
    /** Emits <code># line "file" flags</code> markers when amalgamating. */
    LINEMARKERS,
    /** Rejects directives which have no node kind instead of keeping them as text. */
    STRICT
}
