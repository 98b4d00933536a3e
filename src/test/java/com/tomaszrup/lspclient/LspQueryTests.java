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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link LspQuery}: verifies command-line parsing, derived
 * defaults and exit codes for usage and launch failures.
 */
class LspQueryTests {

	@TempDir
	Path tempDir;

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private final ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args) {
		return LspQuery.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));
	}

	private String errText() {
		return err.toString(StandardCharsets.UTF_8);
	}

	// ------------------------------------------------------------------
	// Option parsing
	// ------------------------------------------------------------------

	@Test
	void testParseFullCommandLine() {
		LspQuery.QueryOptions options = LspQuery.QueryOptions.parse(new String[] {
				"--file", "/work/query.sql", "--line", "3", "--character", "12", "--hover",
				"--root", "file:///work", "--", "sqls", "-config", "/work/sqls.yml" });

		Assertions.assertEquals(Path.of("/work/query.sql"), options.file);
		Assertions.assertEquals(3, options.line);
		Assertions.assertEquals(12, options.character);
		Assertions.assertTrue(options.hover);
		Assertions.assertEquals("file:///work", options.rootUri);
		Assertions.assertEquals("sql", options.languageId);
		Assertions.assertEquals(List.of("sqls", "-config", "/work/sqls.yml"), options.command);
	}

	@Test
	void testDefaultsDerivedFromFile() {
		LspQuery.QueryOptions options = LspQuery.QueryOptions.parse(new String[] {
				"--file", tempDir.resolve("Notes").toString(), "--", "srv" });

		Assertions.assertEquals(0, options.line);
		Assertions.assertEquals(0, options.character);
		Assertions.assertFalse(options.hover);
		Assertions.assertEquals("plaintext", options.languageId);
		Assertions.assertEquals(tempDir.toAbsolutePath().toUri().toString(), options.rootUri);
	}

	@Test
	void testLanguageOverride() {
		LspQuery.QueryOptions options = LspQuery.QueryOptions.parse(new String[] {
				"--file", "q.SQL", "--language", "postgres", "--", "srv" });
		Assertions.assertEquals("postgres", options.languageId);
	}

	@Test
	void testInvalidOptionsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> LspQuery.QueryOptions.parse(new String[] { "--", "srv" }));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> LspQuery.QueryOptions.parse(new String[] { "--file", "q.sql" }));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> LspQuery.QueryOptions.parse(new String[] { "--file", "q.sql", "--line", "-1", "--", "srv" }));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> LspQuery.QueryOptions.parse(new String[] { "--file", "q.sql", "--line", "x", "--", "srv" }));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> LspQuery.QueryOptions.parse(new String[] { "--file" }));
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> LspQuery.QueryOptions.parse(new String[] { "--verbose", "--file", "q.sql", "--", "srv" }));
	}

	@Test
	void testCommandOverridesConfigFile() throws IOException {
		Path config = tempDir.resolve("settings.json");
		Files.writeString(config, "{\"command\":\"sqls\",\"args\":[\"-config\",\"a.yml\"],\"requestTimeoutMillis\":1234}",
				StandardCharsets.UTF_8);
		LspQuery.QueryOptions options = LspQuery.QueryOptions.parse(new String[] {
				"--file", "q.sql", "--config", config.toString(), "--", "other-server", "-v" });

		LspClientSettings settings = options.toSettings();

		Assertions.assertEquals(List.of("other-server", "-v"), settings.getCommandLine());
		Assertions.assertEquals(1234, settings.getRequestTimeout().toMillis());
	}

	// ------------------------------------------------------------------
	// Exit codes
	// ------------------------------------------------------------------

	@Test
	void testUsageErrorExitsWithTwo() {
		Assertions.assertEquals(LspQuery.EXIT_USAGE, run("--line", "1"));
		Assertions.assertTrue(errText().contains("Usage:"), errText());
		Assertions.assertEquals(0, out.size());
	}

	@Test
	void testUnreadableFileExitsWithOne() {
		int code = run("--file", tempDir.resolve("absent.sql").toString(), "--", "srv");
		Assertions.assertEquals(LspQuery.EXIT_FAILURE, code);
		Assertions.assertTrue(errText().contains("Cannot read"), errText());
	}

	@Test
	void testMissingConfigFileExitsWithOne() {
		int code = run("--file", "q.sql", "--config", tempDir.resolve("absent.json").toString());
		Assertions.assertEquals(LspQuery.EXIT_FAILURE, code);
		Assertions.assertTrue(errText().contains("Cannot read settings"), errText());
	}

	@Test
	void testServerLaunchFailureExitsWithOne() throws IOException {
		Path file = tempDir.resolve("query.sql");
		Files.writeString(file, "SELECT 1", StandardCharsets.UTF_8);

		int code = run("--file", file.toString(), "--", tempDir.resolve("no-such-server").toString());

		Assertions.assertEquals(LspQuery.EXIT_FAILURE, code);
		Assertions.assertEquals(0, out.size());
	}
}
