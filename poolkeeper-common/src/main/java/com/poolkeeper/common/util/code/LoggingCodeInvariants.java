/*
 * Copyright 2018 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package com.poolkeeper.common.util.code;

import java.util.IllegalFormatException;

import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes code invariant violations to the log, and counts them.
 */
public class LoggingCodeInvariants extends CodeInvariants {

    private static final Logger logger = LoggerFactory.getLogger(LoggingCodeInvariants.class);

    private static final String METRIC_VIOLATIONS = "poolkeeper.codeInvariants.violations";

    private final Counter inconsistentCounter;
    private final Counter unexpectedErrorCounter;

    public LoggingCodeInvariants(Registry registry) {
        this.inconsistentCounter = registry.counter(METRIC_VIOLATIONS, "kind", "inconsistent");
        this.unexpectedErrorCounter = registry.counter(METRIC_VIOLATIONS, "kind", "unexpectedError");
    }

    @Override
    public CodeInvariants isTrue(boolean condition, String message, Object... args) {
        if (!condition) {
            inconsistent(message, args);
        }
        return this;
    }

    @Override
    public CodeInvariants inconsistent(String message, Object... args) {
        inconsistentCounter.increment();
        logger.warn(format(message, args));
        return this;
    }

    @Override
    public CodeInvariants unexpectedError(String message, Throwable error) {
        unexpectedErrorCounter.increment();
        if (error == null || error.getMessage() == null) {
            logger.warn(message);
        } else {
            logger.warn("{}: {}", message, error.getMessage());
            logger.debug(message, error);
        }
        return this;
    }

    static String format(String message, Object... args) {
        if (args.length == 0) {
            return message;
        }
        try {
            return String.format(message, args);
        } catch (IllegalFormatException e) {
            return message + " (" + e.getMessage() + ')';
        }
    }
}
