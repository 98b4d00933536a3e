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

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of one {@link LspClient}: which server to launch
 * and how the client behaves around it.
 */
public final class LspClientSettings {

    /** Applied to every request issued through the {@link LspClient} operations. */
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public static final String SQLS_COMMAND = "sqls";

    private final String command;
    private final List<String> args;
    private final Path workingDirectory;
    private final Path stderrLog;
    private final Duration requestTimeout;
    private final int notificationCapacity;
    private final NotificationSink.OverflowPolicy notificationOverflow;

    private LspClientSettings(Builder builder) {
        this.command = builder.command;
        this.args = Collections.unmodifiableList(new ArrayList<>(builder.args));
        this.workingDirectory = builder.workingDirectory;
        this.stderrLog = builder.stderrLog;
        this.requestTimeout = builder.requestTimeout;
        this.notificationCapacity = builder.notificationCapacity;
        this.notificationOverflow = builder.notificationOverflow;
    }

    public static Builder builder(String command) {
        return new Builder(command);
    }

    /**
     * Settings for the {@code sqls} SQL language server reading its
     * connections from {@code configPath}.
     */
    public static LspClientSettings forSqls(Path configPath) {
        return builder(SQLS_COMMAND)
                .args("-config", configPath.toString())
                .build();
    }

    public String getCommand() {
        return command;
    }

    public List<String> getArgs() {
        return args;
    }

    /** Executable followed by its arguments. */
    public List<String> getCommandLine() {
        List<String> commandLine = new ArrayList<>(args.size() + 1);
        commandLine.add(command);
        commandLine.addAll(args);
        return commandLine;
    }

    /** Short label for logs: the executable's file name. */
    public String getServerName() {
        Path fileName = Path.of(command).getFileName();
        return fileName != null ? fileName.toString() : command;
    }

    /** May be null: inherit the host's working directory. */
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /** May be null: discard the server's stderr. */
    public Path getStderrLog() {
        return stderrLog;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getNotificationCapacity() {
        return notificationCapacity;
    }

    public NotificationSink.OverflowPolicy getNotificationOverflow() {
        return notificationOverflow;
    }

    public Builder toBuilder() {
        return new Builder(command)
                .args(args)
                .workingDirectory(workingDirectory)
                .stderrLog(stderrLog)
                .requestTimeout(requestTimeout)
                .notificationCapacity(notificationCapacity)
                .notificationOverflow(notificationOverflow);
    }

    @Override
    public String toString() {
        return "LspClientSettings{command=" + getCommandLine()
                + ", workingDirectory=" + workingDirectory
                + ", stderrLog=" + stderrLog
                + ", requestTimeout=" + requestTimeout
                + ", notificationCapacity=" + notificationCapacity
                + ", notificationOverflow=" + notificationOverflow + "}";
    }

    public static final class Builder {
        private String command;
        private final List<String> args = new ArrayList<>();
        private Path workingDirectory;
        private Path stderrLog;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int notificationCapacity = NotificationSink.DEFAULT_CAPACITY;
        private NotificationSink.OverflowPolicy notificationOverflow = NotificationSink.OverflowPolicy.DROP_OLDEST;

        private Builder(String command) {
            command(command);
        }

        public Builder command(String command) {
            if (command == null || command.isBlank()) {
                throw new IllegalArgumentException("command must not be empty");
            }
            this.command = command;
            return this;
        }

        public Builder args(String... args) {
            return args(List.of(args));
        }

        public Builder args(List<String> args) {
            this.args.clear();
            for (String arg : args) {
                this.args.add(Objects.requireNonNull(arg, "argument"));
            }
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder stderrLog(Path stderrLog) {
            this.stderrLog = stderrLog;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive: " + requestTimeout);
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder notificationCapacity(int notificationCapacity) {
            if (notificationCapacity <= 0) {
                throw new IllegalArgumentException("notificationCapacity must be positive: " + notificationCapacity);
            }
            this.notificationCapacity = notificationCapacity;
            return this;
        }

        public Builder notificationOverflow(NotificationSink.OverflowPolicy notificationOverflow) {
            this.notificationOverflow = Objects.requireNonNull(notificationOverflow, "notificationOverflow");
            return this;
        }

        public LspClientSettings build() {
            return new LspClientSettings(this);
        }
    }
}
