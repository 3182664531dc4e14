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
package com.tomaszrup.hsls;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the initialization options sent by the client into
 * {@link ServerSettings}. Unknown keys are ignored; values of the wrong
 * shape fall back to the default with a warning.
 */
class InitializationOptionsParser {

    private static final Logger logger = LoggerFactory.getLogger(InitializationOptionsParser.class);

    static final String LOG_LEVEL_OPTION = "logLevel";
    static final String HELPER_COMMAND_OPTION = "helperCommand";
    static final String HELPER_TIMEOUT_OPTION = "helperTimeoutSeconds";
    static final String REQUEST_TIMEOUT_OPTION = "requestTimeoutSeconds";
    static final String CRADLE_CACHE_OPTION = "cradleCache";

    /**
     * Parse initialization options and apply the log level, if given.
     *
     * @return settings; {@link ServerSettings#defaults()} if the input is not
     *         a {@link JsonObject}
     */
    static ServerSettings parse(Object initOptions) {
        ServerSettings defaults = ServerSettings.defaults();
        if (!(initOptions instanceof JsonObject)) {
            return defaults;
        }
        JsonObject opts = (JsonObject) initOptions;
        applyLogLevelOption(opts);

        String helperCommand = defaults.getHelperCommand();
        JsonElement helper = primitive(opts, HELPER_COMMAND_OPTION);
        if (helper != null && !helper.getAsString().isBlank()) {
            helperCommand = helper.getAsString().trim();
            logger.info("Using metadata helper '{}'", helperCommand);
        }

        long helperTimeout = parsePositiveLong(opts, HELPER_TIMEOUT_OPTION, defaults.getHelperTimeoutSeconds());
        long requestTimeout = parsePositiveLong(opts, REQUEST_TIMEOUT_OPTION, defaults.getRequestTimeoutSeconds());

        boolean cradleCache = defaults.isCradleCacheEnabled();
        JsonElement cache = primitive(opts, CRADLE_CACHE_OPTION);
        if (cache != null && !cache.getAsBoolean()) {
            logger.info("Cradle caching disabled via initializationOptions");
            cradleCache = false;
        }

        return new ServerSettings(helperCommand, helperTimeout, requestTimeout, cradleCache);
    }

    private static void applyLogLevelOption(JsonObject opts) {
        JsonElement level = primitive(opts, LOG_LEVEL_OPTION);
        if (level != null) {
            applyLogLevel(level.getAsString());
        }
    }

    /**
     * Dynamically set the Logback root logger level from a string value.
     * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
     * Invalid values are ignored and a warning is logged.
     */
    static void applyLogLevel(String levelName) {
        ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
        if (level == null) {
            logger.warn("Unknown log level '{}', keeping current level", levelName);
            return;
        }
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (!(root instanceof ch.qos.logback.classic.Logger)) {
            logger.warn("Logging backend is not Logback, ignoring log level '{}'", levelName);
            return;
        }
        ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
        ch.qos.logback.classic.Level previous = logbackRoot.getLevel();
        logbackRoot.setLevel(level);
        logger.info("Log level changed from {} to {}", previous, level);
    }

    private static long parsePositiveLong(JsonObject opts, String option, long defaultValue) {
        JsonElement value = primitive(opts, option);
        if (value == null) {
            return defaultValue;
        }
        long parsed;
        try {
            parsed = value.getAsLong();
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {} '{}', using {}", option, value, defaultValue);
            return defaultValue;
        }
        if (parsed <= 0) {
            logger.warn("Ignoring non-positive {} {}, using {}", option, parsed, defaultValue);
            return defaultValue;
        }
        logger.info("{}: {}", option, parsed);
        return parsed;
    }

    private static JsonElement primitive(JsonObject opts, String option) {
        if (opts.has(option) && opts.get(option).isJsonPrimitive()) {
            return opts.get(option);
        }
        return null;
    }

    private InitializationOptionsParser() {
        // utility class
    }
}
