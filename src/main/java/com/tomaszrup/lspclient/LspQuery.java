////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspclient;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Command-line query tool: launches a language server, opens one file, asks for
 * completion (or hover) at a position and prints the raw JSON result.
 *
 * <pre>
 * LspQuery --file query.sql --line 0 --character 7 -- sqls -config sqls.yml
 * LspQuery --config settings.json --file query.sql --hover
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 client or I/O failure, 2 usage error. Logs go
 * to stderr so stdout carries only the result.</p>
 */
public class LspQuery {

    private static final Logger logger = LoggerFactory.getLogger(LspQuery.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = "Usage: LspQuery --file PATH [--root URI] [--language ID] [--line N]"
            + " [--character N] [--hover] [--config SETTINGS.json] [-- COMMAND [ARGS...]]";

    private static final Gson PRETTY = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public static void main(String[] args) {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}", thread.getName(), throwable.getMessage(),
                        throwable));
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        QueryOptions options;
        LspClientSettings settings;
        try {
            options = QueryOptions.parse(args);
            settings = options.toSettings();
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            err.println("Cannot read settings: " + e.getMessage());
            return EXIT_FAILURE;
        }

        String text;
        try {
            text = Files.readString(options.file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Cannot read " + options.file + ": " + e.getMessage());
            return EXIT_FAILURE;
        }
        String documentUri = options.file.toAbsolutePath().toUri().toString();

        try (LspClient client = new LspClient(settings)) {
            client.start();
            client.initialize(options.rootUri, new JsonObject());
            client.initialized();
            client.didOpen(documentUri, options.languageId, text);
            JsonElement result = options.hover
                    ? client.hover(documentUri, options.line, options.character)
                    : client.completion(documentUri, options.line, options.character);
            out.println(PRETTY.toJson(result));
            return EXIT_OK;
        } catch (LspClientException e) {
            logger.error("Query against {} failed: {}", settings.getServerName(), e.getMessage());
            err.println(e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /** Parsed command line. */
    static final class QueryOptions {
        Path file;
        Path configFile;
        String rootUri;
        String languageId;
        int line;
        int character;
        boolean hover;
        List<String> command = Collections.emptyList();

        static QueryOptions parse(String[] args) {
            QueryOptions options = new QueryOptions();
            int i = 0;
            while (i < args.length) {
                String arg = args[i];
                if ("--".equals(arg)) {
                    options.command = List.copyOf(Arrays.asList(args).subList(i + 1, args.length));
                    break;
                }
                switch (arg) {
                    case "--file":
                        options.file = Path.of(value(args, ++i, arg));
                        break;
                    case "--config":
                        options.configFile = Path.of(value(args, ++i, arg));
                        break;
                    case "--root":
                        options.rootUri = value(args, ++i, arg);
                        break;
                    case "--language":
                        options.languageId = value(args, ++i, arg);
                        break;
                    case "--line":
                        options.line = nonNegative(value(args, ++i, arg), arg);
                        break;
                    case "--character":
                        options.character = nonNegative(value(args, ++i, arg), arg);
                        break;
                    case "--hover":
                        options.hover = true;
                        break;
                    default:
                        throw new IllegalArgumentException("Unknown option: " + arg);
                }
                i++;
            }

            if (options.file == null) {
                throw new IllegalArgumentException("Missing --file");
            }
            if (options.command.isEmpty() && options.configFile == null) {
                throw new IllegalArgumentException("Give the server command after -- or a --config file");
            }
            if (options.rootUri == null) {
                Path parent = options.file.toAbsolutePath().getParent();
                options.rootUri = parent != null ? parent.toUri().toString() : "file:///";
            }
            if (options.languageId == null) {
                options.languageId = languageIdFor(options.file);
            }
            return options;
        }

        LspClientSettings toSettings() throws IOException {
            LspClientSettings.Builder builder = configFile != null
                    ? LspClientSettingsParser.load(configFile).toBuilder()
                    : LspClientSettings.builder(command.get(0));
            if (!command.isEmpty()) {
                builder.command(command.get(0)).args(new ArrayList<>(command.subList(1, command.size())));
            }
            return builder.build();
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index];
        }

        private static int nonNegative(String value, String option) {
            String problem = option + " expects a non-negative integer, got '" + value + "'";
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(problem, e);
            }
            if (parsed < 0) {
                throw new IllegalArgumentException(problem);
            }
            return parsed;
        }

        private static String languageIdFor(Path file) {
            Path fileName = file.getFileName();
            String name = fileName != null ? fileName.toString() : "";
            int dot = name.lastIndexOf('.');
            return dot >= 0 && dot < name.length() - 1 ? name.substring(dot + 1).toLowerCase(Locale.ROOT)
                    : "plaintext";
        }
    }
}
