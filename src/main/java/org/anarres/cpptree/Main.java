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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line front end: builds the directive tree of each input and
 * prints the regenerated text, the tree, the macro listing or an
 * amalgamation.
 */
public class Main {

    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    /* pp */ static final int EXIT_OK = 0;
    /* pp */ static final int EXIT_MISMATCH = 1;
    /* pp */ static final int EXIT_ERROR = 2;

    private static final String STDIN = "<stdin>";

    /* Read by slf4j-simple when each logger of the package is created. */
    /* pp */ static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.log.org.anarres.cpptree";

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.in, System.out, System.err));
    }

    /**
     * Runs the command line.
     *
     * @return the process exit status.
     */
    public static int run(@Nonnull String[] args, @Nonnull InputStream in,
            @Nonnull PrintStream out, @Nonnull PrintStream err)
            throws IOException {

        OptionParser parser = new OptionParser();
        OptionSpec<?> helpOption = parser.accepts("help",
                "Displays command-line help.")
                .forHelp();
        OptionSpec<?> debugOption = parser.acceptsAll(Arrays.asList("debug"),
                "Enables debug output.");

        OptionSpec<String> defineOption = parser.acceptsAll(Arrays.asList("define", "D"),
                "Defines the given macro for --macros.")
                .withRequiredArg().ofType(String.class).describedAs("name[=definition]");
        OptionSpec<String> undefineOption = parser.acceptsAll(Arrays.asList("undefine", "U"),
                "Undefines the given macro, previously defined using -D.")
                .withRequiredArg().describedAs("name");
        OptionSpec<Void> treeOption = parser.accepts("tree",
                "Prints the directive tree of each input as JSON.");
        OptionSpec<Void> macrosOption = parser.accepts("macros",
                "Prints which macros are in scope for which nodes, as JSON.");
        OptionSpec<Void> amalgamateOption = parser.accepts("amalgamate",
                "Prints all inputs as one file, inlining includes between them.");
        OptionSpec<Void> checkOption = parser.accepts("check",
                "Checks that each input regenerates exactly.");
        OptionSpec<Void> linemarkersOption = parser.accepts("linemarkers",
                "Emits linemarkers when amalgamating.");
        OptionSpec<Void> strictOption = parser.accepts("strict",
                "Rejects directives which have no node kind.");
        OptionSpec<File> inputsOption = parser.nonOptions()
                .ofType(File.class).describedAs("Files to process.");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            err.println(e.getMessage());
            parser.printHelpOn(err);
            return EXIT_ERROR;
        }

        if (options.has(helpOption)) {
            parser.printHelpOn(out);
            return EXIT_OK;
        }

        int modes = 0;
        for (OptionSpec<?> mode : Arrays.asList(treeOption, macrosOption, amalgamateOption, checkOption))
            if (options.has(mode))
                modes++;
        if (modes > 1) {
            err.println("At most one of --tree, --macros, --amalgamate and --check may be given.");
            return EXIT_ERROR;
        }

        Set<Feature> features = EnumSet.noneOf(Feature.class);
        if (options.has(debugOption)) {
            features.add(Feature.DEBUG);
            enableDebugLogging();
        }
        if (options.has(linemarkersOption))
            features.add(Feature.LINEMARKERS);
        if (options.has(strictOption))
            features.add(Feature.STRICT);

        Map<String, String> macros = new LinkedHashMap<String, String>();
        for (String arg : options.valuesOf(defineOption)) {
            int idx = arg.indexOf('=');
            String name = idx == -1 ? arg : arg.substring(0, idx);
            if (!Directives.isIdentifier(name)) {
                err.println("Not a macro name: " + name);
                return EXIT_ERROR;
            }
            macros.put(name, idx == -1 ? "1" : arg.substring(idx + 1));
        }
        for (String arg : options.valuesOf(undefineOption))
            macros.remove(arg);

        /* Sources are kept so that --check can compare against them. */
        Map<String, String> sources = new LinkedHashMap<String, String>();
        List<File> inputs = options.valuesOf(inputsOption);
        if (inputs.isEmpty()) {
            sources.put(STDIN, IOUtils.toString(in, StandardCharsets.UTF_8));
        } else {
            for (File input : inputs)
                sources.put(input.getPath(), FileUtils.readFileToString(input, StandardCharsets.UTF_8));
        }

        if (features.contains(Feature.DEBUG)) {
            LOG.info("Inputs:");
            for (String path : sources.keySet())
                LOG.info("  " + path);
            LOG.info("Predefined macros: " + macros);
        }

        DirectiveTreeBuilder builder = new DirectiveTreeBuilder(features);
        List<FileRoot> roots = new ArrayList<FileRoot>();
        for (Map.Entry<String, String> e : sources.entrySet()) {
            try {
                roots.add(builder.build(e.getKey(), e.getValue()));
            } catch (DirectiveSyntaxException ex) {
                if (features.contains(Feature.DEBUG))
                    LOG.debug("Failed to build " + e.getKey(), ex);
                err.println(e.getKey() + ": " + ex.getMessage());
                return EXIT_ERROR;
            }
        }

        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        Stringifier stringifier = new Stringifier(features);

        if (options.has(treeOption)) {
            JsonArray trees = new JsonArray();
            for (FileRoot root : roots)
                trees.add(root.toJson());
            out.println(gson.toJson(trees));
        } else if (options.has(macrosOption)) {
            MacroLister lister = new MacroLister(macros, features);
            JsonObject listing = new JsonObject();
            for (FileRoot root : roots) {
                JsonArray infos = new JsonArray();
                for (MacroInfo info : lister.list(root))
                    infos.add(info.toJson());
                listing.add(root.getPath(), infos);
            }
            out.println(gson.toJson(listing));
        } else if (options.has(amalgamateOption)) {
            Map<String, List<Node>> files = new LinkedHashMap<String, List<Node>>();
            for (FileRoot root : roots)
                files.put(root.getPath(), root.getItems());
            out.print(stringifier.stringify(files));
        } else if (options.has(checkOption)) {
            int status = EXIT_OK;
            for (FileRoot root : roots) {
                if (stringifier.stringify(root).equals(sources.get(root.getPath()))) {
                    out.println(root.getPath() + ": OK");
                } else {
                    out.println(root.getPath() + ": MISMATCH");
                    status = EXIT_MISMATCH;
                }
            }
            return status;
        } else {
            for (FileRoot root : roots)
                out.print(stringifier.stringify(root));
        }
        out.flush();
        return EXIT_OK;
    }

    /**
     * Lowers the level of the package loggers which are created from
     * now on, so that the messages enabled by {@link Feature#DEBUG}
     * are printed. The shipped configuration prints INFO and above.
     */
    /* pp */ static void enableDebugLogging() {
        System.setProperty(LOG_LEVEL_PROPERTY, "debug");
    }
}
