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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps violations in memory. Used by tests to assert that no invariant was broken.
 */
public class RecordingCodeInvariants extends CodeInvariants {

    private final List<String> violations = new CopyOnWriteArrayList<>();

    public List<String> getViolations() {
        return new ArrayList<>(violations);
    }

    @Override
    public CodeInvariants isTrue(boolean condition, String message, Object... args) {
        if (!condition) {
            violations.add(LoggingCodeInvariants.format(message, args));
        }
        return this;
    }

    @Override
    public CodeInvariants inconsistent(String message, Object... args) {
        return isTrue(false, message, args);
    }

    @Override
    public CodeInvariants unexpectedError(String message, Throwable error) {
        violations.add(error == null ? message : message + ": " + error.getMessage());
        return this;
    }
}
