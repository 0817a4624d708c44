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

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import com.poolkeeper.api.backendpool.model.BackendPool;
import com.poolkeeper.api.backendpool.model.BackendPoolOperation;
import com.poolkeeper.api.backendpool.service.BackendPoolException;
import com.poolkeeper.api.connector.cloud.BackendPoolConnector;
import com.poolkeeper.api.connector.cloud.BackendPoolConnectorException;
import com.poolkeeper.common.util.code.CodeInvariants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import static java.lang.String.format;

/**
 * Fetch, merge and update sequence for the operations of a single backend pool drained in one cycle. A retriable
 * failure of either call restarts the whole sequence once, so the operations are merged again against a fresh
 * snapshot. Every operation of the group is resolved exactly once by {@link #reconcile(String, String, List)}.
 */
class BackendPoolGroupReconciler {

    private static final Logger logger = LoggerFactory.getLogger(BackendPoolGroupReconciler.class);

    private final BackendPoolConnector connector;
    private final BackendPoolConfiguration configuration;
    private final BackendPoolUpdaterMetrics metrics;
    private final CodeInvariants invariants;
    private final Scheduler scheduler;

    BackendPoolGroupReconciler(BackendPoolConnector connector,
                               BackendPoolConfiguration configuration,
                               BackendPoolUpdaterMetrics metrics,
                               CodeInvariants invariants,
                               Scheduler scheduler) {
        this.connector = connector;
        this.configuration = configuration;
        this.metrics = metrics;
        this.invariants = invariants;
        this.scheduler = scheduler;
    }

    /**
     * Never emits an error. The outcome is reported through the operations.
     */
    Mono<Void> reconcile(String loadBalancerName, String poolName, List<BackendPoolOperation> operations) {
        return fetchMergeApply(loadBalancerName, poolName, operations)
                .onErrorResume(error -> {
                    if (BackendPoolConnectorException.isNotFound(error) || !BackendPoolConnectorException.isRetriable(error)) {
                        return Mono.error(error);
                    }
                    logger.warn("Retriable error while updating backend pool {}/{}, retrying once: {}", loadBalancerName, poolName, error.getMessage());
                    metrics.retried();
                    return fetchMergeApply(loadBalancerName, poolName, operations);
                })
                .then(Mono.fromRunnable(() -> onSuccess(loadBalancerName, poolName, operations)))
                .onErrorResume(error -> Mono.fromRunnable(() -> onError(loadBalancerName, poolName, operations, error)))
                .then();
    }

    private Mono<Void> fetchMergeApply(String loadBalancerName, String poolName, List<BackendPoolOperation> operations) {
        return withTimeout(Mono.defer(() -> connector.getBackendPool(loadBalancerName, poolName)), "get", loadBalancerName, poolName)
                .switchIfEmpty(Mono.error(() -> BackendPoolConnectorException.notFound(loadBalancerName, poolName)))
                .doOnSuccess(pool -> metrics.remoteCall("get", null))
                .doOnError(error -> metrics.remoteCall("get", error))
                .flatMap(current -> {
                    BackendPool desired = BackendPoolMerger.merge(current, operations);
                    if (desired.equals(current)) {
                        logger.debug("Backend pool {}/{} already up to date, skipping the update call", loadBalancerName, poolName);
                        metrics.unchanged();
                        return Mono.empty();
                    }
                    logger.debug("Updating backend pool {}/{}: {} -> {}", loadBalancerName, poolName, current.getIpAddresses(), desired.getIpAddresses());
                    return withTimeout(Mono.defer(() -> connector.createOrUpdateBackendPool(loadBalancerName, poolName, desired)), "update", loadBalancerName, poolName)
                            .doOnSuccess(ignored -> metrics.remoteCall("update", null))
                            .doOnError(error -> metrics.remoteCall("update", error));
                });
    }

    private <T> Mono<T> withTimeout(Mono<T> call, String callName, String loadBalancerName, String poolName) {
        Duration timeout = Duration.ofMillis(configuration.getConnectorTimeoutMs());
        return call
                .timeout(timeout, scheduler)
                .onErrorMap(TimeoutException.class, e -> BackendPoolConnectorException.retriable(
                        format("Backend pool %s call for %s/%s timed out after %sms", callName, loadBalancerName, poolName, timeout.toMillis()), e
                ));
    }

    private void onSuccess(String loadBalancerName, String poolName, List<BackendPoolOperation> operations) {
        logger.info("Applied {} operations to backend pool {}/{}", operations.size(), loadBalancerName, poolName);
        operations.forEach(this::succeed);
    }

    private void onError(String loadBalancerName, String poolName, List<BackendPoolOperation> operations, Throwable error) {
        if (BackendPoolConnectorException.isNotFound(error)) {
            // Nothing to reconcile against a pool that does not exist.
            logger.debug("Backend pool {}/{} not found, completing {} operations without an update", loadBalancerName, poolName, operations.size());
            operations.forEach(this::succeed);
            return;
        }
        BackendPoolException failure = BackendPoolException.updateFailed(loadBalancerName, poolName, error);
        logWithLevel(
                BackendPoolException.getLogLevel(failure),
                format("Failed to apply %s operations to backend pool %s/%s", operations.size(), loadBalancerName, poolName),
                error
        );
        operations.forEach(operation -> fail(operation, failure));
    }

    private void succeed(BackendPoolOperation operation) {
        if (operation.succeed()) {
            metrics.succeeded();
        } else {
            invariants.inconsistent("Cannot complete backend pool operation in state %s: %s", operation.getState(), operation);
        }
    }

    static void logWithLevel(Level level, String message, Throwable error) {
        switch (level) {
            case ERROR:
                logger.error(message, error);
                break;
            case WARN:
                logger.warn("{}: {}", message, error.getMessage());
                break;
            case INFO:
                logger.info("{}: {}", message, error.getMessage());
                break;
            default:
                logger.debug(message, error);
        }
    }

    void fail(BackendPoolOperation operation, Throwable error) {
        if (operation.fail(error)) {
            metrics.failed(error);
        } else {
            invariants.inconsistent("Cannot fail backend pool operation in state %s: %s", operation.getState(), operation);
        }
    }
}
