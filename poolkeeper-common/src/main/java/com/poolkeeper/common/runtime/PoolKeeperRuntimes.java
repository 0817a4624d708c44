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


package com.poolkeeper.common.runtime;

import com.netflix.spectator.api.DefaultRegistry;
import com.poolkeeper.common.runtime.internal.DefaultPoolKeeperRuntime;
import com.poolkeeper.common.util.code.RecordingCodeInvariants;
import com.poolkeeper.common.util.time.Clocks;
import reactor.core.scheduler.Scheduler;

public final class PoolKeeperRuntimes {

    private PoolKeeperRuntimes() {
    }

    public static PoolKeeperRuntime internal() {
        return DefaultPoolKeeperRuntime.newBuilder().build();
    }

    public static PoolKeeperRuntime test() {
        return DefaultPoolKeeperRuntime.newBuilder()
                .withCodeInvariants(new RecordingCodeInvariants())
                .build();
    }

    /**
     * Runtime with a clock driven by the given scheduler (usually a virtual time scheduler), recording
     * code invariants in memory.
     */
    public static PoolKeeperRuntime test(Scheduler scheduler) {
        return DefaultPoolKeeperRuntime.newBuilder()
                .withRegistry(new DefaultRegistry())
                .withClock(Clocks.scheduler(scheduler))
                .withCodeInvariants(new RecordingCodeInvariants())
                .build();
    }
}
