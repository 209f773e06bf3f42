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
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nonnull;
import org.pcollections.PMap;
import org.pcollections.PVector;

/**
 * A run of consecutive nodes, in document order, which see the same
 * set of macros.
 */
public final class MacroInfo {

    private final PVector<Node> affected;
    private final PMap<String, MacroDefinition> definitions;

    /* pp */ MacroInfo(@Nonnull PVector<Node> affected, @Nonnull PMap<String, MacroDefinition> definitions) {
        this.affected = affected;
        this.definitions = definitions;
    }

    /**
     * Returns the nodes in which these macros are in scope.
     */
    @Nonnull
    public PVector<Node> getAffected() {
        return affected;
    }

    /**
     * Returns each macro name mapped to its replacement text, ordered
     * by name.
     */
    @Nonnull
    public Map<String, String> getMacros() {
        Map<String, String> macros = new TreeMap<String, String>();
        for (MacroDefinition m : definitions.values())
            macros.put(m.getName(), m.getReplacement());
        return Collections.unmodifiableMap(macros);
    }

    @Nonnull
    public PMap<String, MacroDefinition> getDefinitions() {
        return definitions;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.add("affected", Nodes.toJson(affected));
        JsonObject macs = new JsonObject();
        for (Map.Entry<String, String> e : getMacros().entrySet())
            macs.addProperty(e.getKey(), e.getValue());
        result.add("macros", macs);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MacroInfo) {
            MacroInfo o = (MacroInfo) obj;
            return affected.equals(o.affected) && definitions.equals(o.definitions);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return affected.hashCode() ^ definitions.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
