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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads {@link LspClientSettings} from a JSON document such as
 *
 * <pre>{@code
 * {
 *   "command": "sqls",
 *   "args": ["-config", "/home/me/.config/sq/sqls.yml"],
 *   "requestTimeoutMillis": 10000,
 *   "notificationCapacity": 100,
 *   "notificationOverflow": "DROP_OLDEST",
 *   "stderrLog": "/tmp/sqls.log",
 *   "logLevel": "DEBUG"
 * }
 * }</pre>
 *
 * <p>Only {@code command} is required. Ill-typed or invalid optional values
 * are ignored with a warning and the default is kept.</p>
 */
public final class LspClientSettingsParser {

    private static final Logger logger = LoggerFactory.getLogger(LspClientSettingsParser.class);

    static final String COMMAND_OPTION = "command";
    static final String ARGS_OPTION = "args";
    static final String WORKING_DIRECTORY_OPTION = "workingDirectory";
    static final String STDERR_LOG_OPTION = "stderrLog";
    static final String REQUEST_TIMEOUT_OPTION = "requestTimeoutMillis";
    static final String NOTIFICATION_CAPACITY_OPTION = "notificationCapacity";
    static final String NOTIFICATION_OVERFLOW_OPTION = "notificationOverflow";
    static final String LOG_LEVEL_OPTION = "logLevel";

    private LspClientSettingsParser() {
    }

    /**
     * Load settings from a JSON file.
     *
     * @throws IOException              if the file cannot be read
     * @throws IllegalArgumentException if it is not a JSON object or has no
     *                                  command
     */
    public static LspClientSettings load(Path file) throws IOException {
        JsonElement root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid JSON in " + file + ": " + e.getMessage(), e);
        }
        if (!root.isJsonObject()) {
            throw new IllegalArgumentException("Settings file " + file + " must contain a JSON object");
        }
        return parse(root.getAsJsonObject());
    }

    /**
     * Build settings from a parsed JSON object. A {@code logLevel} entry is
     * applied to the Logback root logger right away.
     */
    public static LspClientSettings parse(JsonObject opts) {
        JsonElement command = opts.get(COMMAND_OPTION);
        if (command == null || !command.isJsonPrimitive() || command.getAsString().isBlank()) {
            throw new IllegalArgumentException("Settings must define a non-empty \"" + COMMAND_OPTION + "\"");
        }
        applyLogLevelOption(opts);

        LspClientSettings.Builder builder = LspClientSettings.builder(command.getAsString());
        builder.args(parseArgsOption(opts));

        String workingDirectory = stringOption(opts, WORKING_DIRECTORY_OPTION);
        if (workingDirectory != null) {
            builder.workingDirectory(Path.of(workingDirectory));
        }
        String stderrLog = stringOption(opts, STDERR_LOG_OPTION);
        if (stderrLog != null) {
            builder.stderrLog(Path.of(stderrLog));
        }

        Long timeoutMillis = positiveLongOption(opts, REQUEST_TIMEOUT_OPTION);
        if (timeoutMillis != null) {
            builder.requestTimeout(Duration.ofMillis(timeoutMillis));
        }
        Long capacity = positiveLongOption(opts, NOTIFICATION_CAPACITY_OPTION);
        if (capacity != null && capacity <= Integer.MAX_VALUE) {
            builder.notificationCapacity(capacity.intValue());
        }
        NotificationSink.OverflowPolicy overflow = parseOverflowOption(opts);
        if (overflow != null) {
            builder.notificationOverflow(overflow);
        }

        LspClientSettings settings = builder.build();
        logger.debug("Parsed client settings: {}", settings);
        return settings;
    }

    private static List<String> parseArgsOption(JsonObject opts) {
        List<String> args = new ArrayList<>();
        if (!opts.has(ARGS_OPTION)) {
            return args;
        }
        if (!opts.get(ARGS_OPTION).isJsonArray()) {
            logger.warn("Ignoring \"{}\": expected an array of strings", ARGS_OPTION);
            return args;
        }
        for (JsonElement el : opts.getAsJsonArray(ARGS_OPTION)) {
            if (el.isJsonPrimitive()) {
                args.add(el.getAsString());
            } else {
                logger.warn("Ignoring non-string entry in \"{}\": {}", ARGS_OPTION, el);
            }
        }
        return args;
    }

    private static NotificationSink.OverflowPolicy parseOverflowOption(JsonObject opts) {
        String value = stringOption(opts, NOTIFICATION_OVERFLOW_OPTION);
        if (value == null) {
            return null;
        }
        try {
            return NotificationSink.OverflowPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown {} '{}', keeping default", NOTIFICATION_OVERFLOW_OPTION, value);
            return null;
        }
    }

    private static String stringOption(JsonObject opts, String name) {
        if (!opts.has(name)) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
            logger.warn("Ignoring \"{}\": expected a string, got {}", name, value);
            return null;
        }
        return value.getAsString();
    }

    private static Long positiveLongOption(JsonObject opts, String name) {
        if (!opts.has(name)) {
            return null;
        }
        JsonElement value = opts.get(name);
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isNumber()) {
            long parsed = value.getAsLong();
            if (parsed > 0) {
                return parsed;
            }
        }
        logger.warn("Ignoring \"{}\": expected a positive number, got {}", name, value);
        return null;
    }

    private static void applyLogLevelOption(JsonObject opts) {
        String level = stringOption(opts, LOG_LEVEL_OPTION);
        if (level != null) {
            applyLogLevel(level);
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        try {
            ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
            if (level == null) {
                logger.warn("Unknown log level '{}', keeping current level", levelName);
                return;
            }
            ch.qos.logback.classic.Logger root = (ch.qos.logback.classic.Logger)
                    LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            ch.qos.logback.classic.Level previous = root.getLevel();
            root.setLevel(level);
            logger.info("Log level changed from {} to {}", previous, level);
        } catch (ClassCastException e) {
            logger.warn("Failed to set log level to '{}': SLF4J is not bound to Logback", levelName);
        }
    }
}
