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

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Options controlling scope range caching. Instances are immutable.
 *
 * <p>Defaults come from system properties so that a compiler driver can
 * toggle them without code changes:</p>
 * <ul>
 *   <li>{@code astscope.verifySourceRanges} (default {@code true}): run the
 *       containment and sibling-order checks after every cache write.</li>
 * </ul>
 *
 * <p>Options can also be read from a JSON object, as sent by an editor
 * client in its initialization options:</p>
 * <pre>{@code
 * { "verifySourceRanges": false, "logLevel": "DEBUG" }
 * }</pre>
 */
public final class ScopeRangeOptions {

	private static final Logger logger = LoggerFactory.getLogger(ScopeRangeOptions.class);

	/** System property consulted by {@link #defaults()}. */
	public static final String PROP_VERIFY_SOURCE_RANGES = "astscope.verifySourceRanges";

	private static final String VERIFY_SOURCE_RANGES_OPTION = "verifySourceRanges";
	private static final String LOG_LEVEL_OPTION = "logLevel";

	/** Logger whose level {@code logLevel} adjusts. */
	static final String SCOPE_LOGGER_NAME = "com.tomaszrup.astscope";

	private final boolean verifySourceRanges;
	private final String logLevel;

	public ScopeRangeOptions(boolean verifySourceRanges, String logLevel) {
		this.verifySourceRanges = verifySourceRanges;
		this.logLevel = logLevel;
	}

	/**
	 * Returns options built from system properties.
	 */
	public static ScopeRangeOptions defaults() {
		String verify = System.getProperty(PROP_VERIFY_SOURCE_RANGES);
		boolean verifySourceRanges = verify == null || Boolean.parseBoolean(verify);
		return new ScopeRangeOptions(verifySourceRanges, null);
	}

	public boolean isVerifySourceRanges() {
		return verifySourceRanges;
	}

	/**
	 * The requested log level, or {@code null} to leave logging alone.
	 */
	public String getLogLevel() {
		return logLevel;
	}

	public ScopeRangeOptions withVerifySourceRanges(boolean verify) {
		return new ScopeRangeOptions(verify, logLevel);
	}

	/**
	 * Parses options from a JSON object, falling back to {@link #defaults()}
	 * for anything absent or malformed, and applies the log level if one is
	 * given.
	 *
	 * @return the parsed options; the defaults if {@code json} is not a
	 *         {@link JsonObject}
	 */
	public static ScopeRangeOptions parse(Object json) {
		ScopeRangeOptions defaults = defaults();
		if (!(json instanceof JsonObject)) {
			return defaults;
		}
		JsonObject opts = (JsonObject) json;

		boolean verify = defaults.verifySourceRanges;
		JsonElement verifyElement = opts.get(VERIFY_SOURCE_RANGES_OPTION);
		if (verifyElement != null && verifyElement.isJsonPrimitive()
				&& verifyElement.getAsJsonPrimitive().isBoolean()) {
			verify = verifyElement.getAsBoolean();
			logger.info("Scope range verification {}", verify ? "enabled" : "disabled");
		}

		String level = null;
		JsonElement levelElement = opts.get(LOG_LEVEL_OPTION);
		if (levelElement != null && levelElement.isJsonPrimitive()) {
			level = levelElement.getAsString();
			applyLogLevel(level);
		}
		return new ScopeRangeOptions(verify, level);
	}

	/**
	 * Sets the Logback level of the scope loggers. Accepted values
	 * (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE. Invalid values are
	 * ignored and a warning is logged.
	 */
	static void applyLogLevel(String levelName) {
		try {
			ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
			if (level == null) {
				logger.warn("Unknown log level '{}', keeping current level", levelName);
				return;
			}
			ch.qos.logback.classic.Logger scopeLogger = (ch.qos.logback.classic.Logger)
					LoggerFactory.getLogger(SCOPE_LOGGER_NAME);
			ch.qos.logback.classic.Level previous = scopeLogger.getLevel();
			scopeLogger.setLevel(level);
			logger.info("Scope log level changed from {} to {}", previous, level);
		} catch (ClassCastException e) {
			logger.warn("Failed to set log level to '{}': SLF4J is not bound to Logback", levelName);
		}
	}

	@Override
	public String toString() {
		return "ScopeRangeOptions[verifySourceRanges=" + verifySourceRanges + ", logLevel=" + logLevel + "]";
	}
}
