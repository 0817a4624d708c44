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

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LoggingCodeInvariantsTest {

    private final Registry registry = new DefaultRegistry();

    private final LoggingCodeInvariants invariants = new LoggingCodeInvariants(registry);

    @Test
    public void testViolationsAreCounted() {
        invariants.isTrue(true, "never reported");
        invariants.isTrue(false, "value %s", 1);
        invariants.inconsistent("bad format %d", "text");
        invariants.unexpectedError("failure", new RuntimeException("simulated"));

        assertThat(registry.counter("poolkeeper.codeInvariants.violations", "kind", "inconsistent").count()).isEqualTo(2);
        assertThat(registry.counter("poolkeeper.codeInvariants.violations", "kind", "unexpectedError").count()).isEqualTo(1);
    }

    @Test
    public void testFormat() {
        assertThat(LoggingCodeInvariants.format("no args")).isEqualTo("no args");
        assertThat(LoggingCodeInvariants.format("value %s", 1)).isEqualTo("value 1");
        assertThat(LoggingCodeInvariants.format("bad %d", "text")).startsWith("bad %d (");
    }

    @Test
    public void testRecordingInvariants() {
        RecordingCodeInvariants recording = new RecordingCodeInvariants();
        recording.isTrue(true, "ok");
        recording.inconsistent("state %s", "Failed");
        recording.unexpectedError("failure", new RuntimeException("simulated"));

        assertThat(recording.getViolations()).containsExactly("state Failed", "failure: simulated");
    }
}
