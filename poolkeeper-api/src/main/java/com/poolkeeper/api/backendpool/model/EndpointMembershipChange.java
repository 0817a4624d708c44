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


package com.poolkeeper.api.backendpool.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Change of the set of nodes hosting endpoints of a service. The service name is absent for endpoint groups that
 * do not belong to any service.
 */
public class EndpointMembershipChange {

    private final ServiceName serviceName;
    private final Set<String> previousNodes;
    private final Set<String> currentNodes;

    public EndpointMembershipChange(ServiceName serviceName, Set<String> previousNodes, Set<String> currentNodes) {
        this.serviceName = serviceName;
        this.previousNodes = previousNodes == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(previousNodes));
        this.currentNodes = currentNodes == null ? Collections.emptySet() : Collections.unmodifiableSet(new LinkedHashSet<>(currentNodes));
    }

    public Optional<ServiceName> getServiceName() {
        return Optional.ofNullable(serviceName);
    }

    public Set<String> getPreviousNodes() {
        return previousNodes;
    }

    public Set<String> getCurrentNodes() {
        return currentNodes;
    }

    @Override
    public String toString() {
        return "EndpointMembershipChange{" +
                "serviceName=" + serviceName +
                ", previousNodes=" + previousNodes +
                ", currentNodes=" + currentNodes +
                '}';
    }
}
