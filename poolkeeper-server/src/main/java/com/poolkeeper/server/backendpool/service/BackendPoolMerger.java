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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.poolkeeper.api.backendpool.model.BackendAddress;
import com.poolkeeper.api.backendpool.model.BackendPool;
import com.poolkeeper.api.backendpool.model.BackendPoolOperation;

/**
 * Applies queued operations to a fetched pool definition. Operations are applied in the given order, and both
 * kinds are idempotent: adding a present address or removing an absent one changes nothing.
 * <p>
 * Addresses of the fetched pool that are members after the last operation keep their entries (cloud-assigned
 * names included) and their position, even if they were removed and added back in between. Addresses that were
 * not in the fetched pool are appended in the order they were first added.
 */
final class BackendPoolMerger {

    private BackendPoolMerger() {
    }

    static BackendPool merge(BackendPool current, List<BackendPoolOperation> operations) {
        Set<String> members = new LinkedHashSet<>();
        current.getAddresses().forEach(address -> members.add(address.getIpAddress()));
        Set<String> original = new LinkedHashSet<>(members);

        for (BackendPoolOperation operation : operations) {
            switch (operation.getKind()) {
                case AddIPs:
                    members.addAll(operation.getIpAddresses());
                    break;
                case RemoveIPs:
                    members.removeAll(operation.getIpAddresses());
                    break;
                default:
                    throw new IllegalStateException("Unknown operation kind: " + operation.getKind());
            }
        }

        List<BackendAddress> addresses = new ArrayList<>();
        for (BackendAddress address : current.getAddresses()) {
            if (members.contains(address.getIpAddress())) {
                addresses.add(address);
            }
        }
        for (String ipAddress : members) {
            if (!original.contains(ipAddress)) {
                addresses.add(BackendAddress.ofIp(ipAddress));
            }
        }
        return current.toBuilder().withAddresses(addresses).build();
    }
}
