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


package com.poolkeeper.api.backendpool.service;

import com.poolkeeper.api.backendpool.model.BackendPoolOperation;
import com.poolkeeper.api.backendpool.model.ServiceName;

/**
 * Applies backend pool membership changes in batches. Operations queued within one update interval are merged per
 * load balancer pool, so each pool is read and written at most once (plus a single retry) per interval.
 */
public interface BackendPoolUpdater {

    /**
     * Queues an operation for the next drain cycle. Never blocks. The outcome is reported via
     * {@link BackendPoolOperation#completion()}.
     */
    void enqueue(BackendPoolOperation operation);

    /**
     * Removes all queued operations of the given service that were not picked up by a drain cycle yet.
     * Operations already being applied are not affected.
     *
     * @return number of withdrawn operations
     */
    int withdraw(ServiceName serviceName);

    /**
     * Number of operations waiting for the next drain cycle.
     */
    int getPendingCount();
}
