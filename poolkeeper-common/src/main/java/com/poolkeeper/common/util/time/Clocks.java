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


package com.poolkeeper.common.util.time;

import java.util.concurrent.TimeUnit;

import com.poolkeeper.common.util.time.internal.SystemClock;
import reactor.core.scheduler.Scheduler;

public class Clocks {

    public static Clock system() {
        return SystemClock.INSTANCE;
    }

    /**
     * Clock driven by a Reactor {@link Scheduler}. Backed by a virtual time scheduler it advances only when the
     * scheduler does.
     */
    public static Clock scheduler(Scheduler scheduler) {
        return () -> scheduler.now(TimeUnit.MILLISECONDS);
    }
}
