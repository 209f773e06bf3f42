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
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A macro as written in a <code>#define</code> directive, or given
 * on the command line.
 *
 * Equality ignores the directive the macro came from, so the same
 * definition made in two branches compares equal.
 */
public final class MacroDefinition {

    /** The parameter name given to an anonymous variadic argument. */
    public static final String VA_ARGS = "__VA_ARGS__";

    private final String name;
    @CheckForNull
    private final List<String> parameters;
    private final boolean variadic;
    private final String replacement;
    @CheckForNull
    private final DirectiveNode source;

    private MacroDefinition(@Nonnull String name, @CheckForNull List<String> parameters, boolean variadic,
            @Nonnull String replacement, @CheckForNull DirectiveNode source) {
        this.name = name;
        this.parameters = parameters == null ? null : Collections.unmodifiableList(parameters);
        this.variadic = variadic;
        this.replacement = replacement;
        this.source = source;
    }

    /**
     * Returns an object-like macro which was not defined by a directive.
     */
    @Nonnull
    public static MacroDefinition predefined(@Nonnull String name, @Nonnull String replacement) {
        if (!Directives.isIdentifier(name))
            throw new IllegalArgumentException("Not a macro name: " + name);
        return new MacroDefinition(name, null, false, replacement.trim(), null);
    }

    /**
     * Parses the argument of a <code>#define</code> directive.
     *
     * Accepts <code>NAME</code>, <code>NAME text</code>,
     * <code>NAME(a, b) text</code>, <code>NAME(a, ...) text</code>
     * and the GNU form <code>NAME(args...) text</code>. A parameter
     * list is recognised only when the parenthesis immediately follows
     * the name.
     *
     * @return the definition, or null if the directive is not a define
     *  or is malformed.
     */
    @CheckForNull
    public static MacroDefinition parse(@Nonnull DirectiveNode directive) {
        if (directive.getKind() != DirectiveNode.Kind.DEFINE)
            return null;
        String arg = directive.getArgument();
        String name = Directives.leadingIdentifier(arg);
        if (name.isEmpty())
            return null;
        String rest = arg.substring(name.length());
        if (!rest.startsWith("("))
            return new MacroDefinition(name, null, false, rest.trim(), directive);

        int close = rest.indexOf(')');
        if (close == -1)
            return null;
        List<String> params = new ArrayList<String>();
        boolean variadic = false;
        String list = rest.substring(1, close).trim();
        if (!list.isEmpty()) {
            String[] parts = list.split(",", -1);
            for (int i = 0; i < parts.length; i++) {
                String param = parts[i].trim();
                if (param.endsWith("...")) {
                    if (i != parts.length - 1)
                        return null;    /* ellipsis must be on last argument */
                    variadic = true;
                    param = param.substring(0, param.length() - 3).trim();
                    if (param.isEmpty())
                        param = VA_ARGS;
                }
                if (!Directives.isIdentifier(param) || params.contains(param))
                    return null;
                params.add(param);
            }
        }
        return new MacroDefinition(name, params, variadic, rest.substring(close + 1).trim(), directive);
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public boolean isFunctionLike() {
        return parameters != null;
    }

    /**
     * Returns the parameter names, or null for an object-like macro.
     */
    @CheckForNull
    public List<String> getParameters() {
        return parameters;
    }

    public boolean isVariadic() {
        return variadic;
    }

    /**
     * Returns the replacement list as text, trimmed, with line
     * continuations removed.
     */
    @Nonnull
    public String getReplacement() {
        return replacement;
    }

    /**
     * Returns the directive which made this definition, or null if it
     * was predefined.
     */
    @CheckForNull
    public DirectiveNode getSource() {
        return source;
    }

    @Nonnull
    public JsonObject toJson() {
        JsonObject result = new JsonObject();
        result.addProperty("name", name);
        if (parameters != null) {
            JsonArray params = new JsonArray();
            for (String param : parameters)
                params.add(new JsonPrimitive(param));
            result.add("params", params);
            if (variadic)
                result.addProperty("variadic", true);
        }
        result.addProperty("replacement", replacement);
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MacroDefinition) {
            MacroDefinition o = (MacroDefinition) obj;
            return name.equals(o.name)
                    && Objects.equals(parameters, o.parameters)
                    && variadic == o.variadic
                    && replacement.equals(o.replacement);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameters, variadic, replacement);
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder(name);
        if (parameters != null) {
            buf.append('(');
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0)
                    buf.append(", ");
                buf.append(parameters.get(i));
            }
            if (variadic)
                buf.append("...");
            buf.append(')');
        }
        return buf.append(" => ").append(replacement).toString();
    }
}
