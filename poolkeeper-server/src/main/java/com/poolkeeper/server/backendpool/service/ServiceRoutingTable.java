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

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.inject.Singleton;

import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.backendpool.model.ServiceRoutingEntry;

/**
 * Locally routed services, and the load balancer each of them is exposed on. A service missing from the table is
 * not local (or has not finished its initial load balancer reconciliation yet).
 */
@Singleton
public class ServiceRoutingTable {

    private final ConcurrentMap<String, ServiceRoutingEntry> entries = new ConcurrentHashMap<>();

    /**
     * @return the replaced entry, if any
     */
    public Optional<ServiceRoutingEntry> put(ServiceName serviceName, ServiceRoutingEntry entry) {
        return Optional.ofNullable(entries.put(serviceName.getKey(), entry));
    }

    public Optional<ServiceRoutingEntry> remove(ServiceName serviceName) {
        return Optional.ofNullable(entries.remove(serviceName.getKey()));
    }

    public Optional<ServiceRoutingEntry> findEntry(ServiceName serviceName) {
        return Optional.ofNullable(entries.get(serviceName.getKey()));
    }

    public boolean isLocal(ServiceName serviceName) {
        return entries.containsKey(serviceName.getKey());
    }

    public int size() {
        return entries.size();
    }
}
