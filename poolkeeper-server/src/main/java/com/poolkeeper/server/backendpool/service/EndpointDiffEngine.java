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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.poolkeeper.api.backendpool.model.BackendPoolOperation;
import com.poolkeeper.api.backendpool.model.EndpointMembershipChange;
import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.backendpool.model.ServiceRoutingEntry;
import com.poolkeeper.api.backendpool.service.BackendPoolUpdater;
import com.poolkeeper.common.util.CollectionsExt;
import com.poolkeeper.common.util.NetworkExt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates endpoint membership changes of local services into backend pool operations, and queues them in the
 * {@link BackendPoolUpdater}. Events of services that are not (yet) known as local are dropped; the initial
 * reconciliation of a service brings its pools up to date anyway.
 */
@Singleton
public class EndpointDiffEngine {

    private static final Logger logger = LoggerFactory.getLogger(EndpointDiffEngine.class);

    private final ServiceRoutingTable routingTable;
    private final NodeIpResolver nodeIpResolver;
    private final BackendPoolUpdater updater;

    @Inject
    public EndpointDiffEngine(ServiceRoutingTable routingTable, NodeIpResolver nodeIpResolver, BackendPoolUpdater updater) {
        this.routingTable = routingTable;
        this.nodeIpResolver = nodeIpResolver;
        this.updater = updater;
    }

    /**
     * @return the queued operations, so the caller can observe their outcome
     */
    public List<BackendPoolOperation> onMembershipChange(EndpointMembershipChange change) {
        Optional<ServiceName> serviceNameOpt = change.getServiceName();
        if (!serviceNameOpt.isPresent()) {
            logger.debug("Endpoint change without a service name, ignoring: {}", change);
            return Collections.emptyList();
        }
        ServiceName serviceName = serviceNameOpt.get();

        Optional<ServiceRoutingEntry> entryOpt = routingTable.findEntry(serviceName);
        if (!entryOpt.isPresent()) {
            logger.debug("Service {} is not a local service, or its initial reconciliation has not finished yet. Ignoring endpoint change", serviceName);
            return Collections.emptyList();
        }
        ServiceRoutingEntry entry = entryOpt.get();

        Set<String> previousIps = nodeIpResolver.resolve(change.getPreviousNodes());
        Set<String> currentIps = nodeIpResolver.resolve(change.getCurrentNodes());
        if (previousIps.equals(currentIps)) {
            return Collections.emptyList();
        }

        List<BackendPoolOperation> operations = new ArrayList<>();
        if (entry.getIpFamily().includesIPv4()) {
            operations.addAll(diff(serviceName, entry.getLoadBalancerName(), false, previousIps, currentIps));
        }
        if (entry.getIpFamily().includesIPv6()) {
            operations.addAll(diff(serviceName, entry.getLoadBalancerName(), true, previousIps, currentIps));
        }

        operations.forEach(updater::enqueue);
        if (!operations.isEmpty()) {
            logger.info("Endpoints of service {} changed, queued {} backend pool operations on load balancer {}",
                    serviceName, operations.size(), entry.getLoadBalancerName());
        }
        return operations;
    }

    private List<BackendPoolOperation> diff(ServiceName serviceName,
                                            String loadBalancerName,
                                            boolean ipv6,
                                            Set<String> previousIps,
                                            Set<String> currentIps) {
        Predicate<String> inFamily = ip -> NetworkExt.isIPv6(ip) == ipv6;
        Set<String> added = CollectionsExt.difference(currentIps, previousIps).stream().filter(inFamily).collect(Collectors.toCollection(LinkedHashSet::new));
        Set<String> removed = CollectionsExt.difference(previousIps, currentIps).stream().filter(inFamily).collect(Collectors.toCollection(LinkedHashSet::new));

        String poolName = LocalServiceBackendPools.poolName(serviceName, ipv6);
        List<BackendPoolOperation> operations = new ArrayList<>(2);
        if (!added.isEmpty()) {
            operations.add(BackendPoolOperation.addIps(serviceName, loadBalancerName, poolName, added));
        }
        if (!removed.isEmpty()) {
            operations.add(BackendPoolOperation.removeIps(serviceName, loadBalancerName, poolName, removed));
        }
        return operations;
    }
}
