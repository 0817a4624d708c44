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

import java.util.Objects;

/**
 * Routing assignment of a locally routed service: the load balancer it is exposed on and its IP family.
 */
public class ServiceRoutingEntry {

    private final String loadBalancerName;
    private final IpFamily ipFamily;

    public ServiceRoutingEntry(String loadBalancerName, IpFamily ipFamily) {
        this.loadBalancerName = loadBalancerName;
        this.ipFamily = ipFamily;
    }

    public String getLoadBalancerName() {
        return loadBalancerName;
    }

    public IpFamily getIpFamily() {
        return ipFamily;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ServiceRoutingEntry that = (ServiceRoutingEntry) o;
        return Objects.equals(loadBalancerName, that.loadBalancerName) &&
                ipFamily == that.ipFamily;
    }

    @Override
    public int hashCode() {
        return Objects.hash(loadBalancerName, ipFamily);
    }

    @Override
    public String toString() {
        return "ServiceRoutingEntry{" +
                "loadBalancerName='" + loadBalancerName + '\'' +
                ", ipFamily=" + ipFamily +
                '}';
    }
}
