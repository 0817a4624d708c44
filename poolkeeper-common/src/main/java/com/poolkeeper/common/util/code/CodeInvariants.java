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

/**
 * Collects violations of internal invariants, that are not fatal but indicate a bug worth fixing (for example
 * an operation being resolved twice). Implementations must never throw.
 */
public abstract class CodeInvariants {

    /**
     * Registers a violation when <code>condition</code> is false. The message is a {@link String#format} pattern.
     */
    public abstract CodeInvariants isTrue(boolean condition, String message, Object... args);

    /**
     * Registers an inconsistency. The message is a {@link String#format} pattern.
     */
    public abstract CodeInvariants inconsistent(String message, Object... args);

    /**
     * Registers an error that was caught, but should never have happened.
     */
    public abstract CodeInvariants unexpectedError(String message, Throwable error);
}
