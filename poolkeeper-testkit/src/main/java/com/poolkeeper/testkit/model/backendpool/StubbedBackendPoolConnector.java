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


package com.poolkeeper.testkit.model.backendpool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import com.poolkeeper.api.backendpool.model.BackendPool;
import com.poolkeeper.api.connector.cloud.BackendPoolConnector;
import com.poolkeeper.api.connector.cloud.BackendPoolConnectorException;
import reactor.core.publisher.Mono;

/**
 * In-memory cloud network API. Load balancer and pool names are case-insensitive, as in the cloud. Records every
 * call, and fails calls with errors queued by {@link #failNextGet(String, String, Throwable)} and
 * {@link #failNextUpdate(String, String, Throwable)}.
 */
public class StubbedBackendPoolConnector implements BackendPoolConnector {

    private final ConcurrentMap<String, BackendPool> pools = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, Queue<Throwable>> getFailures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Queue<Throwable>> updateFailures = new ConcurrentHashMap<>();

    private final ConcurrentMap<String, AtomicInteger> getCalls = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<BackendPool>> updateCalls = new ConcurrentHashMap<>();

    @Override
    public Mono<BackendPool> getBackendPool(String loadBalancerName, String poolName) {
        return Mono.defer(() -> {
            String key = toKey(loadBalancerName, poolName);
            getCalls.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();

            Throwable failure = poll(getFailures, key);
            if (failure != null) {
                return Mono.error(failure);
            }
            BackendPool pool = pools.get(key);
            return pool == null
                    ? Mono.error(BackendPoolConnectorException.notFound(loadBalancerName, poolName))
                    : Mono.just(pool);
        });
    }

    @Override
    public Mono<Void> createOrUpdateBackendPool(String loadBalancerName, String poolName, BackendPool backendPool) {
        return Mono.defer(() -> {
            String key = toKey(loadBalancerName, poolName);
            updateCalls.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(backendPool);

            Throwable failure = poll(updateFailures, key);
            if (failure != null) {
                return Mono.error(failure);
            }
            pools.put(key, backendPool);
            return Mono.empty();
        });
    }

    public BackendPool addBackendPool(String loadBalancerName, String poolName, String... ipAddresses) {
        BackendPool pool = BackendPool.newBuilder()
                .withId(String.format("/loadBalancers/%s/backendAddressPools/%s", loadBalancerName, poolName))
                .withName(poolName)
                .withIpAddresses(ipAddresses)
                .build();
        pools.put(toKey(loadBalancerName, poolName), pool);
        return pool;
    }

    public Optional<BackendPool> findBackendPool(String loadBalancerName, String poolName) {
        return Optional.ofNullable(pools.get(toKey(loadBalancerName, poolName)));
    }

    public List<String> getIpAddresses(String loadBalancerName, String poolName) {
        return findBackendPool(loadBalancerName, poolName).map(BackendPool::getIpAddresses).orElse(Collections.emptyList());
    }

    public void failNextGet(String loadBalancerName, String poolName, Throwable error) {
        getFailures.computeIfAbsent(toKey(loadBalancerName, poolName), k -> new ConcurrentLinkedQueue<>()).add(error);
    }

    public void failNextUpdate(String loadBalancerName, String poolName, Throwable error) {
        updateFailures.computeIfAbsent(toKey(loadBalancerName, poolName), k -> new ConcurrentLinkedQueue<>()).add(error);
    }

    public int getGetCallCount(String loadBalancerName, String poolName) {
        AtomicInteger counter = getCalls.get(toKey(loadBalancerName, poolName));
        return counter == null ? 0 : counter.get();
    }

    /**
     * Pool definitions passed to the update calls, including the failed ones, in call order.
     */
    public List<BackendPool> getUpdateCalls(String loadBalancerName, String poolName) {
        return new ArrayList<>(updateCalls.getOrDefault(toKey(loadBalancerName, poolName), Collections.emptyList()));
    }

    public int getTotalUpdateCallCount() {
        return updateCalls.values().stream().mapToInt(List::size).sum();
    }

    public int getTotalGetCallCount() {
        return getCalls.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    private static Throwable poll(Map<String, Queue<Throwable>> failures, String key) {
        Queue<Throwable> queue = failures.get(key);
        return queue == null ? null : queue.poll();
    }

    private static String toKey(String loadBalancerName, String poolName) {
        return (loadBalancerName + '/' + poolName).toLowerCase(Locale.ROOT);
    }
}
