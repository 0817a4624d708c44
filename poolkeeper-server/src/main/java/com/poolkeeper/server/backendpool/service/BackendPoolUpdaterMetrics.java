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

import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

import com.netflix.spectator.api.Counter;
import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spectator.api.Timer;
import com.netflix.spectator.api.patterns.PolledMeter;
import com.poolkeeper.api.backendpool.service.BackendPoolException;
import com.poolkeeper.api.connector.cloud.BackendPoolConnectorException;
import com.poolkeeper.common.runtime.PoolKeeperRuntime;
import com.poolkeeper.common.util.time.Clock;
import com.poolkeeper.server.MetricConstants;

class BackendPoolUpdaterMetrics {

    private static final String ROOT_NAME = MetricConstants.METRIC_BACKEND_POOL + "updater.";
    private static final String OPERATIONS = ROOT_NAME + "operations";
    private static final String REMOTE_CALLS = ROOT_NAME + "remoteCalls";

    private final Registry registry;
    private final Clock clock;

    private final Counter enqueuedCounter;
    private final Counter withdrawnCounter;
    private final Counter succeededCounter;
    private final Id failedId;
    private final Id remoteCallsId;
    private final Counter retryCounter;
    private final Counter unchangedCounter;
    private final Counter drainCycleCounter;
    private final Timer drainCycleLatency;
    private final Id pendingId;

    BackendPoolUpdaterMetrics(PoolKeeperRuntime runtime) {
        this.registry = runtime.getRegistry();
        this.clock = runtime.getClock();

        this.enqueuedCounter = registry.counter(OPERATIONS, "state", "enqueued");
        this.withdrawnCounter = registry.counter(OPERATIONS, "state", "withdrawn");
        this.succeededCounter = registry.counter(OPERATIONS, "state", "succeeded");
        this.failedId = registry.createId(OPERATIONS, "state", "failed");
        this.remoteCallsId = registry.createId(REMOTE_CALLS);
        this.retryCounter = registry.counter(ROOT_NAME + "retries");
        this.unchangedCounter = registry.counter(ROOT_NAME + "unchangedPools");
        this.drainCycleCounter = registry.counter(ROOT_NAME + "drainCycles");
        this.drainCycleLatency = registry.timer(ROOT_NAME + "drainCycleLatency");
        this.pendingId = registry.createId(ROOT_NAME + "pending");
    }

    <T> void monitorPending(T updater, ToDoubleFunction<T> pendingCount) {
        PolledMeter.using(registry).withId(pendingId).monitorValue(updater, pendingCount);
    }

    void shutdown() {
        PolledMeter.remove(registry, pendingId);
    }

    void enqueued() {
        enqueuedCounter.increment();
    }

    void withdrawn(int count) {
        withdrawnCounter.increment(count);
    }

    void succeeded() {
        succeededCounter.increment();
    }

    void failed(Throwable error) {
        String errorCode = error instanceof BackendPoolException
                ? "" + ((BackendPoolException) error).getErrorCode()
                : "unknown";
        registry.counter(failedId.withTags("errorCode", errorCode, "exception", error.getClass().getSimpleName())).increment();
    }

    void remoteCall(String call, Throwable error) {
        String status;
        if (error == null) {
            status = "success";
        } else if (BackendPoolConnectorException.isNotFound(error)) {
            status = "notFound";
        } else {
            status = BackendPoolConnectorException.isRetriable(error) ? "retriableError" : "error";
        }
        registry.counter(remoteCallsId.withTags("call", call, "status", status)).increment();
    }

    void retried() {
        retryCounter.increment();
    }

    void unchanged() {
        unchangedCounter.increment();
    }

    /**
     * Returns the cycle start time, to be passed to {@link #drainCycleFinished(long)}.
     */
    long drainCycleStarted() {
        drainCycleCounter.increment();
        return clock.wallTime();
    }

    void drainCycleFinished(long startTime) {
        drainCycleLatency.record(clock.wallTime() - startTime, TimeUnit.MILLISECONDS);
    }
}
