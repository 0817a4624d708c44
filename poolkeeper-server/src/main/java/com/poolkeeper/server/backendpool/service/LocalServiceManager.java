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
import javax.inject.Inject;
import javax.inject.Singleton;

import com.poolkeeper.api.backendpool.model.IpFamily;
import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.backendpool.model.ServiceRoutingEntry;
import com.poolkeeper.api.backendpool.service.BackendPoolUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the service routing table in sync with service lifecycle events. Queued operations of a service that is
 * deleted, stops being local, or moves to another load balancer are withdrawn.
 */
@Singleton
public class LocalServiceManager {

    private static final Logger logger = LoggerFactory.getLogger(LocalServiceManager.class);

    private final ServiceRoutingTable routingTable;
    private final BackendPoolUpdater updater;

    @Inject
    public LocalServiceManager(ServiceRoutingTable routingTable, BackendPoolUpdater updater) {
        this.routingTable = routingTable;
        this.updater = updater;
    }

    /**
     * Called once the load balancer of a local service is reconciled.
     */
    public void onServiceLocal(ServiceName serviceName, String loadBalancerName, IpFamily ipFamily) {
        ServiceRoutingEntry entry = new ServiceRoutingEntry(loadBalancerName, ipFamily);
        Optional<ServiceRoutingEntry> previous = routingTable.put(serviceName, entry);
        if (!previous.isPresent()) {
            logger.info("Registered local service {} on load balancer {} ({})", serviceName, loadBalancerName, ipFamily);
            return;
        }
        if (!previous.get().getLoadBalancerName().equalsIgnoreCase(loadBalancerName)) {
            int withdrawn = updater.withdraw(serviceName);
            logger.info("Local service {} moved from load balancer {} to {}, withdrawn {} pending operations",
                    serviceName, previous.get().getLoadBalancerName(), loadBalancerName, withdrawn);
        } else if (!previous.get().equals(entry)) {
            logger.info("Local service {} changed IP family from {} to {}", serviceName, previous.get().getIpFamily(), ipFamily);
        }
    }

    /**
     * Called when a service is deleted, or its traffic policy is no longer local.
     */
    public void onServiceRemoved(ServiceName serviceName) {
        Optional<ServiceRoutingEntry> removed = routingTable.remove(serviceName);
        int withdrawn = updater.withdraw(serviceName);
        if (removed.isPresent()) {
            logger.info("Unregistered local service {}, withdrawn {} pending operations", serviceName, withdrawn);
        }
    }
}
