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

import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import java.util.List;
import javax.annotation.Nonnull;

/* pp */ final class Nodes {

    private Nodes() {
    }

    @Nonnull
    /* pp */ static JsonArray toJson(@Nonnull List<? extends Node> nodes) {
        JsonArray result = new JsonArray();
        for (Node node : nodes) {
            if (node == null)
                result.add(JsonNull.INSTANCE);
            else
                result.add(node.toJson());
        }
        return result;
    }
}
