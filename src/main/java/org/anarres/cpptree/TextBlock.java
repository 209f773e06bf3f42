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
 * Verbatim source text which contains no directive lines.
 */
public final class TextBlock implements Node {

    private final String content;

    public TextBlock(String content) {
        StructuralValidator.requireField(content, "content");
        this.content = content;
    }

    @Nonnull
    public String getContent() {
        return content;
    }

    @Override
    public <R> R accept(@Nonnull NodeVisitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Nonnull
    @Override
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("kind", "text");
        result.addProperty("content", content);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TextBlock) {
            TextBlock o = (TextBlock) obj;
            return content.equals(o.content);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
