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
import java.util.List;

import com.poolkeeper.api.backendpool.model.IpFamily;
import com.poolkeeper.api.backendpool.model.ServiceName;

/**
 * Naming of the dedicated backend pools of local services. A local service owns one pool per IP family it
 * uses: <code>namespace-name</code> for IPv4 and <code>namespace-name-ipv6</code> for IPv6.
 */
public final class LocalServiceBackendPools {

    private static final String IPV6_SUFFIX = "-ipv6";

    private LocalServiceBackendPools() {
    }

    public static String poolName(ServiceName serviceName, boolean ipv6) {
        String base = serviceName.getKey().replace('/', '-');
        return ipv6 ? base + IPV6_SUFFIX : base;
    }

    public static List<String> poolNames(ServiceName serviceName, IpFamily ipFamily) {
        List<String> names = new ArrayList<>(2);
        if (ipFamily.includesIPv4()) {
            names.add(poolName(serviceName, false));
        }
        if (ipFamily.includesIPv6()) {
            names.add(poolName(serviceName, true));
        }
        return names;
    }
}
