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


package com.poolkeeper.api.connector.cloud;

import com.poolkeeper.api.backendpool.model.BackendPool;
import reactor.core.publisher.Mono;

/**
 * Cloud network API used to read and write backend pool definitions. Failures are reported as
 * {@link BackendPoolConnectorException}; any other error type is treated as non-retriable.
 */
public interface BackendPoolConnector {

    /**
     * Emits the current pool definition, or {@link BackendPoolConnectorException} with the not-found status if the
     * pool does not exist.
     */
    Mono<BackendPool> getBackendPool(String loadBalancerName, String poolName);

    /**
     * Replaces the pool definition (including its full address list) with the given one.
     */
    Mono<Void> createOrUpdateBackendPool(String loadBalancerName, String poolName, BackendPool backendPool);
}
