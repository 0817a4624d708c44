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


package com.poolkeeper.common.runtime.internal;

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import com.poolkeeper.common.runtime.PoolKeeperRuntime;
import com.poolkeeper.common.util.code.CodeInvariants;
import com.poolkeeper.common.util.code.LoggingCodeInvariants;
import com.poolkeeper.common.util.time.Clock;
import com.poolkeeper.common.util.time.Clocks;

@Singleton
public class DefaultPoolKeeperRuntime implements PoolKeeperRuntime {

    private final CodeInvariants codeInvariants;
    private final Registry registry;
    private final Clock clock;

    @Inject
    public DefaultPoolKeeperRuntime(Registry registry) {
        this(new LoggingCodeInvariants(registry), registry, Clocks.system());
    }

    public DefaultPoolKeeperRuntime(CodeInvariants codeInvariants, Registry registry, Clock clock) {
        this.codeInvariants = codeInvariants;
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public CodeInvariants getCodeInvariants() {
        return codeInvariants;
    }

    @Override
    public Registry getRegistry() {
        return registry;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {

        private CodeInvariants codeInvariants;
        private Registry registry;
        private Clock clock;

        private Builder() {
        }

        public Builder withCodeInvariants(CodeInvariants codeInvariants) {
            this.codeInvariants = codeInvariants;
            return this;
        }

        public Builder withRegistry(Registry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DefaultPoolKeeperRuntime build() {
            if (registry == null) {
                registry = new DefaultRegistry();
            }
            if (codeInvariants == null) {
                codeInvariants = new LoggingCodeInvariants(registry);
            }
            if (clock == null) {
                clock = Clocks.system();
            }
            return new DefaultPoolKeeperRuntime(codeInvariants, registry, clock);
        }
    }
}
