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


package com.poolkeeper.server.backendpool.service;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "poolkeeper.backendPool")
public interface BackendPoolConfiguration {

    /**
     * Interval between drain cycles. Operations queued within one interval are applied together.
     */
    @DefaultValue("30000")
    long getUpdateIntervalMs();

    /**
     * Timeout of a single fetch or update call. A timeout is handled as a retriable failure.
     */
    @DefaultValue("60000")
    long getConnectorTimeoutMs();

    /**
     * Maximum number of backend pools updated concurrently within a drain cycle.
     */
    @DefaultValue("32")
    int getMaxConcurrentPoolUpdates();

    /**
     * If set, drained operations are checked again against the service routing table, and dropped if their
     * service is no longer local or moved to another load balancer.
     */
    @DefaultValue("true")
    boolean isDrainValidationEnabled();
}
