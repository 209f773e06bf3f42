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
import java.util.List;
import javax.annotation.Nonnull;

/**
 * The top-level nodes of one source file.
 *
 * Only the presence of each item is checked here; every item
 * validated itself when it was built.
 */
public final class FileRoot {

    private final String path;
    private final List<Node> items;

    /**
     * @throws StructureException if the path is blank, or items is null
     *  or contains null.
     */
    public FileRoot(String path, List<? extends Node> items) {
        StructuralValidator.requirePath(path, "path");
        StructuralValidator.requireItems(items, "items");
        this.path = path;
        this.items = StructuralValidator.copyOf(items);
    }

    @Nonnull
    public String getPath() {
        return path;
    }

    /**
     * Returns the top-level nodes in source order. The list is
     * unmodifiable.
     */
    @Nonnull
    public List<Node> getItems() {
        return items;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("path", path);
        result.add("items", Nodes.toJson(items));
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof FileRoot) {
            FileRoot o = (FileRoot) obj;
            return path.equals(o.path) && items.equals(o.items);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return path.hashCode() * 31 + items.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
