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
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.astscope.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

/**
 * Unit tests for {@link ScopeRangeOptions}: system property defaults, JSON
 * parsing and runtime log level changes.
 */
class ScopeRangeOptionsTests {

	private final Logger scopeLogger = (Logger) LoggerFactory.getLogger(ScopeRangeOptions.SCOPE_LOGGER_NAME);
	private final Level originalLevel = scopeLogger.getLevel();

	@AfterEach
	void tearDown() {
		System.clearProperty(ScopeRangeOptions.PROP_VERIFY_SOURCE_RANGES);
		scopeLogger.setLevel(originalLevel);
	}

	// ------------------------------------------------------------------
	// defaults()
	// ------------------------------------------------------------------

	@Test
	void testVerificationEnabledByDefault() {
		ScopeRangeOptions options = ScopeRangeOptions.defaults();
		Assertions.assertTrue(options.isVerifySourceRanges());
		Assertions.assertNull(options.getLogLevel());
	}

	@Test
	void testSystemPropertyDisablesVerification() {
		System.setProperty(ScopeRangeOptions.PROP_VERIFY_SOURCE_RANGES, "false");
		Assertions.assertFalse(ScopeRangeOptions.defaults().isVerifySourceRanges());
	}

	@Test
	void testWithVerifySourceRangesKeepsLogLevel() {
		ScopeRangeOptions options = new ScopeRangeOptions(true, "INFO").withVerifySourceRanges(false);
		Assertions.assertFalse(options.isVerifySourceRanges());
		Assertions.assertEquals("INFO", options.getLogLevel());
	}

	// ------------------------------------------------------------------
	// parse()
	// ------------------------------------------------------------------

	@Test
	void testParseNullReturnsDefaults() {
		ScopeRangeOptions options = ScopeRangeOptions.parse(null);
		Assertions.assertTrue(options.isVerifySourceRanges());
	}

	@Test
	void testParseNonObjectReturnsDefaults() {
		ScopeRangeOptions options = ScopeRangeOptions.parse(new JsonArray());
		Assertions.assertTrue(options.isVerifySourceRanges());
	}

	@Test
	void testParseVerifySourceRanges() {
		JsonObject json = new JsonObject();
		json.addProperty("verifySourceRanges", false);
		Assertions.assertFalse(ScopeRangeOptions.parse(json).isVerifySourceRanges());
	}

	@Test
	void testParseIgnoresNonBooleanVerifySourceRanges() {
		JsonObject json = new JsonObject();
		json.addProperty("verifySourceRanges", "no");
		Assertions.assertTrue(ScopeRangeOptions.parse(json).isVerifySourceRanges());
	}

	@Test
	void testParseIgnoresUnknownKeys() {
		JsonObject json = new JsonObject();
		json.addProperty("somethingElse", 42);
		ScopeRangeOptions options = ScopeRangeOptions.parse(json);
		Assertions.assertTrue(options.isVerifySourceRanges());
		Assertions.assertNull(options.getLogLevel());
	}

	@Test
	void testParseLogLevelAppliesIt() {
		JsonObject json = new JsonObject();
		json.addProperty("logLevel", "trace");
		ScopeRangeOptions options = ScopeRangeOptions.parse(json);
		Assertions.assertEquals("trace", options.getLogLevel());
		Assertions.assertEquals(Level.TRACE, scopeLogger.getLevel());
	}

	// ------------------------------------------------------------------
	// applyLogLevel()
	// ------------------------------------------------------------------

	@Test
	void testApplyUnknownLogLevelKeepsCurrentLevel() {
		scopeLogger.setLevel(Level.WARN);
		ScopeRangeOptions.applyLogLevel("LOUD");
		Assertions.assertEquals(Level.WARN, scopeLogger.getLevel());
	}

	@Test
	void testApplyLogLevelIsCaseInsensitive() {
		ScopeRangeOptions.applyLogLevel("debug");
		Assertions.assertEquals(Level.DEBUG, scopeLogger.getLevel());
	}
}
