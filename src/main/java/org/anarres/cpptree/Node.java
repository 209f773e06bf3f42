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
import javax.annotation.Nonnull;

/**
 * A node of a directive tree.
 *
 * There are exactly three shapes of node. Code which needs to
 * distinguish them implements a {@link NodeVisitor}, so that adding
 * a shape is a compile error in every walk rather than a silent
 * fallthrough.
 *
 * Nodes are immutable and validated on construction.
 */
public sealed interface Node permits TextBlock, DirectiveNode, ConditionalGroup {

    <R> R accept(@Nonnull NodeVisitor<R> visitor);

    @Nonnull
    JsonObject toJson();
}
