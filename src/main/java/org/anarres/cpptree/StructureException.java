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

import javax.annotation.Nonnull;

/**
 * Thrown when a tree node would violate a structural invariant.
 *
 * The node is never constructed.
 */
public class StructureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final Violation violation;
    private final String field;

    public StructureException(@Nonnull Violation violation, @Nonnull String field, @Nonnull String msg) {
        super(field + ": " + msg);
        this.violation = violation;
        this.field = field;
    }

    @Nonnull
    public Violation getViolation() {
        return violation;
    }

    /**
     * Returns the name of the offending field, such as
     * <code>"raw"</code> or <code>"entry.body[2]"</code>.
     */
    @Nonnull
    public String getField() {
        return field;
    }
}
