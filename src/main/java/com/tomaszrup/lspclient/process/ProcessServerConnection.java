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
package com.tomaszrup.lspclient.process;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lspclient.LaunchException;
import com.tomaszrup.lspclient.LspClientSettings;

/**
 * A language server running as a child process and spoken to over its
 * standard input and output.
 *
 * <p>The child's standard error never reaches the host's own stderr: it is
 * discarded, or appended to a log file when one is configured. Either way
 * the OS drains it, so a chatty server cannot block on a full stderr
 * pipe.</p>
 */
public class ProcessServerConnection implements ServerConnection {

    private static final Logger logger = LoggerFactory.getLogger(ProcessServerConnection.class);

    /** How long {@link #close()} waits for the process to be reaped. */
    private static final long REAP_TIMEOUT_SECONDS = 5;

    private final Process process;
    private final List<String> commandLine;
    private final InputStream input;
    private final OutputStream output;

    ProcessServerConnection(Process process, List<String> commandLine) {
        this.process = process;
        this.commandLine = commandLine;
        this.input = process.getInputStream();
        this.output = process.getOutputStream();
    }

    /**
     * Connector that launches the process described by the settings.
     */
    public static ServerConnector connector(LspClientSettings settings) {
        return () -> launch(settings.getCommandLine(), settings.getWorkingDirectory(), settings.getStderrLog());
    }

    /**
     * Spawn the server process.
     *
     * @param commandLine      executable followed by its arguments
     * @param workingDirectory directory to start in, or {@code null} for ours
     * @param stderrLog        file the child's stderr is appended to, or
     *                         {@code null} to discard it
     * @throws LaunchException if the executable cannot be found or started,
     *                         or its pipes cannot be created
     */
    public static ProcessServerConnection launch(List<String> commandLine, Path workingDirectory, Path stderrLog)
            throws LaunchException {
        List<String> command = Collections.unmodifiableList(new ArrayList<>(commandLine));
        ProcessBuilder pb = new ProcessBuilder(command)
                .redirectInput(ProcessBuilder.Redirect.PIPE)
                .redirectOutput(ProcessBuilder.Redirect.PIPE)
                .redirectError(stderrLog != null
                        ? ProcessBuilder.Redirect.appendTo(stderrLog.toFile())
                        : ProcessBuilder.Redirect.DISCARD);
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException | SecurityException e) {
            throw new LaunchException("Failed to start language server: " + String.join(" ", command), e);
        }
        logger.info("Started language server pid={} command={}", process.pid(), command);
        return new ProcessServerConnection(process, command);
    }

    @Override
    public InputStream getInputStream() {
        return input;
    }

    @Override
    public OutputStream getOutputStream() {
        return output;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Kill the process, reap it, then close both pipes. The process goes
     * first: closing stdin waits for a writer blocked on a full pipe, and
     * that writer only fails once the process is gone.
     */
    @Override
    public void close() {
        if (process.isAlive()) {
            process.destroyForcibly();
        }
        try {
            if (!process.waitFor(REAP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Language server pid={} did not exit within {}s", process.pid(), REAP_TIMEOUT_SECONDS);
            } else {
                logger.debug("Language server pid={} exited with code {}", process.pid(), process.exitValue());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("Interrupted while reaping language server pid={}", process.pid());
        }
        closeStream(input, "stdout");
        closeStream(output, "stdin");
    }

    @Override
    public String describe() {
        return "pid " + process.pid() + " " + commandLine.get(0);
    }

    private void closeStream(Closeable stream, String name) {
        try {
            stream.close();
        } catch (IOException e) {
            logger.debug("Error closing {} of language server pid={}: {}", name, process.pid(), e.getMessage());
        }
    }
}
