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

import com.netflix.spectator.api.Registry;
import com.poolkeeper.common.util.code.CodeInvariants;
import com.poolkeeper.common.util.time.Clock;

/**
 * Process wide services shared by all components.
 */
public interface PoolKeeperRuntime {

    CodeInvariants getCodeInvariants();

    Registry getRegistry();

    Clock getClock();
}
