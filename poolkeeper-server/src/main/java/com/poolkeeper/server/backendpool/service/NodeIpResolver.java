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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import javax.inject.Singleton;

import com.google.common.base.Strings;
import com.poolkeeper.common.util.CollectionsExt;

/**
 * Private IP addresses of cluster nodes, keyed by lower-cased node name. Kept up to date by node lifecycle events.
 */
@Singleton
public class NodeIpResolver {

    private final ConcurrentMap<String, Set<String>> nodeIps = new ConcurrentHashMap<>();

    public void updateNode(String nodeName, Collection<String> ipAddresses) {
        if (Strings.isNullOrEmpty(nodeName)) {
            return;
        }
        if (CollectionsExt.isNullOrEmpty(ipAddresses)) {
            nodeIps.remove(toKey(nodeName));
            return;
        }
        nodeIps.put(toKey(nodeName), Collections.unmodifiableSet(new LinkedHashSet<>(ipAddresses)));
    }

    public void removeNode(String nodeName) {
        if (!Strings.isNullOrEmpty(nodeName)) {
            nodeIps.remove(toKey(nodeName));
        }
    }

    public Set<String> getNodeIps(String nodeName) {
        if (Strings.isNullOrEmpty(nodeName)) {
            return Collections.emptySet();
        }
        return nodeIps.getOrDefault(toKey(nodeName), Collections.emptySet());
    }

    /**
     * Union of addresses of the given nodes. Nodes with no known address contribute nothing.
     */
    public Set<String> resolve(Collection<String> nodeNames) {
        Set<String> result = new LinkedHashSet<>();
        for (String nodeName : nodeNames) {
            result.addAll(getNodeIps(nodeName));
        }
        return result;
    }

    private static String toKey(String nodeName) {
        return nodeName.toLowerCase(Locale.ROOT);
    }
}
