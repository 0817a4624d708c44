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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import javax.annotation.PostConstruct;
import javax.annotation.PreDestroy;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.poolkeeper.api.backendpool.model.BackendPoolOperation;
import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.backendpool.model.ServiceRoutingEntry;
import com.poolkeeper.api.backendpool.service.BackendPoolException;
import com.poolkeeper.api.backendpool.service.BackendPoolUpdater;
import com.poolkeeper.api.connector.cloud.BackendPoolConnector;
import com.poolkeeper.common.runtime.PoolKeeperRuntime;
import com.poolkeeper.common.util.CollectionsExt;
import com.poolkeeper.common.util.code.CodeInvariants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Queues backend pool operations and applies them periodically. On each tick the whole queue is swapped with an
 * empty one, the drained operations are grouped by load balancer and pool (keeping the submission order within
 * each group), and every group is reconciled concurrently with the others. The next tick is not processed before
 * all groups of the previous one have finished, so a pool never has more than one update in flight.
 */
@Singleton
public class DefaultBackendPoolUpdater implements BackendPoolUpdater {

    private static final Logger logger = LoggerFactory.getLogger(DefaultBackendPoolUpdater.class);

    private final BackendPoolConfiguration configuration;
    private final ServiceRoutingTable routingTable;
    private final BackendPoolGroupReconciler groupReconciler;
    private final BackendPoolUpdaterMetrics metrics;
    private final CodeInvariants invariants;
    private final Scheduler scheduler;

    private final Object lock = new Object();

    // Guarded by lock.
    private List<BackendPoolOperation> pending = new ArrayList<>();
    private boolean shutdown;

    private volatile Disposable drainSubscription;

    @Inject
    public DefaultBackendPoolUpdater(PoolKeeperRuntime runtime,
                                     BackendPoolConfiguration configuration,
                                     BackendPoolConnector connector,
                                     ServiceRoutingTable routingTable) {
        this(runtime, configuration, connector, routingTable, Schedulers.boundedElastic());
    }

    @VisibleForTesting
    DefaultBackendPoolUpdater(PoolKeeperRuntime runtime,
                              BackendPoolConfiguration configuration,
                              BackendPoolConnector connector,
                              ServiceRoutingTable routingTable,
                              Scheduler scheduler) {
        this.configuration = configuration;
        this.routingTable = routingTable;
        this.invariants = runtime.getCodeInvariants();
        this.scheduler = scheduler;
        this.metrics = new BackendPoolUpdaterMetrics(runtime);
        this.groupReconciler = new BackendPoolGroupReconciler(connector, configuration, metrics, invariants, scheduler);
        metrics.monitorPending(this, DefaultBackendPoolUpdater::getPendingCount);
    }

    /**
     * Starts the drain loop. Invoked through {@link PostConstruct} by a lifecycle-aware container, or by the eager
     * activator bound in {@code BackendPoolModule} under plain Guice. Calls after the first one have no effect.
     */
    @PostConstruct
    public void activate() {
        synchronized (lock) {
            if (drainSubscription != null) {
                logger.debug("Backend pool updater already activated");
                return;
            }
            Duration interval = Duration.ofMillis(configuration.getUpdateIntervalMs());
            logger.info("Starting backend pool updater with update interval {}ms", interval.toMillis());

            this.drainSubscription = Flux.interval(interval, interval, scheduler)
                    .takeWhile(tick -> !isShutdown())
                    .onBackpressureDrop(tick -> logger.debug("Drain cycle still running, skipping tick {}", tick))
                    .concatMap(tick -> drainCycle(), 1)
                    .subscribe(
                            next -> {
                            },
                            error -> invariants.unexpectedError("Backend pool drain loop terminated", error),
                            () -> logger.info("Backend pool drain loop stopped")
                    );
        }
    }

    /**
     * Stops scheduling new drain cycles. A cycle in progress runs to completion. Operations still queued, and
     * operations enqueued afterwards, fail with {@link BackendPoolException.ErrorCode#UpdaterShutdown}.
     */
    @PreDestroy
    public void shutdown() {
        List<BackendPoolOperation> leftOver;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            leftOver = swapPending();
        }
        leftOver.forEach(this::rejectOnShutdown);
        metrics.shutdown();
        logger.info("Backend pool updater shut down, rejected {} pending operations", leftOver.size());
    }

    @Override
    public void enqueue(BackendPoolOperation operation) {
        Preconditions.checkNotNull(operation, "operation is null");
        boolean accepted;
        synchronized (lock) {
            accepted = !shutdown;
            if (accepted) {
                pending.add(operation);
            }
        }
        if (!accepted) {
            rejectOnShutdown(operation);
            return;
        }
        metrics.enqueued();
        logger.debug("Enqueued {}", operation);
    }

    @Override
    public int withdraw(ServiceName serviceName) {
        int withdrawn = 0;
        synchronized (lock) {
            Iterator<BackendPoolOperation> it = pending.iterator();
            while (it.hasNext()) {
                BackendPoolOperation operation = it.next();
                if (operation.getServiceName().equals(serviceName) && operation.markWithdrawn()) {
                    it.remove();
                    withdrawn++;
                }
            }
        }
        if (withdrawn > 0) {
            metrics.withdrawn(withdrawn);
            logger.info("Withdrawn {} pending backend pool operations of service {}", withdrawn, serviceName);
        }
        return withdrawn;
    }

    @Override
    public int getPendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private boolean isShutdown() {
        synchronized (lock) {
            return shutdown;
        }
    }

    /**
     * Caller must hold the lock.
     */
    private List<BackendPoolOperation> swapPending() {
        if (pending.isEmpty()) {
            return Collections.emptyList();
        }
        List<BackendPoolOperation> drained = pending;
        pending = new ArrayList<>();
        return drained;
    }

    @VisibleForTesting
    Mono<Void> drainCycle() {
        return Mono.defer(() -> {
            List<BackendPoolOperation> drained;
            synchronized (lock) {
                drained = swapPending();
            }
            if (drained.isEmpty()) {
                return Mono.<Void>empty();
            }
            long startTime = metrics.drainCycleStarted();

            List<BackendPoolOperation> accepted = startApplying(drained);
            List<Mono<Void>> groupUpdates = new ArrayList<>();
            // Cloud load balancer and pool names are case-insensitive
            Map<String, List<BackendPoolOperation>> byLoadBalancer = CollectionsExt.groupByOrdered(
                    accepted, operation -> operation.getLoadBalancerName().toLowerCase(Locale.ROOT)
            );
            byLoadBalancer.values().forEach(loadBalancerOperations ->
                    CollectionsExt.groupByOrdered(loadBalancerOperations, operation -> operation.getPoolName().toLowerCase(Locale.ROOT)).values().forEach(poolOperations -> {
                        BackendPoolOperation first = poolOperations.get(0);
                        groupUpdates.add(groupReconciler.reconcile(first.getLoadBalancerName(), first.getPoolName(), poolOperations).subscribeOn(scheduler));
                    })
            );
            logger.info("Drained {} backend pool operations, updating {} pools on {} load balancers",
                    drained.size(), groupUpdates.size(), byLoadBalancer.size());

            return Flux.fromIterable(groupUpdates)
                    .flatMap(update -> update, Math.max(1, configuration.getMaxConcurrentPoolUpdates()))
                    .then()
                    .doFinally(signal -> metrics.drainCycleFinished(startTime));
        }).onErrorResume(error -> {
            invariants.unexpectedError("Backend pool drain cycle failed", error);
            return Mono.empty();
        });
    }

    private List<BackendPoolOperation> startApplying(List<BackendPoolOperation> drained) {
        List<BackendPoolOperation> accepted = new ArrayList<>(drained.size());
        for (BackendPoolOperation operation : drained) {
            if (!operation.markApplying()) {
                invariants.inconsistent("Drained backend pool operation is not pending: %s", operation);
                continue;
            }
            Optional<BackendPoolException> rejection = configuration.isDrainValidationEnabled()
                    ? validate(operation)
                    : Optional.empty();
            if (rejection.isPresent()) {
                BackendPoolGroupReconciler.logWithLevel(BackendPoolException.getLogLevel(rejection.get()), "Dropping backend pool operation " + operation, rejection.get());
                groupReconciler.fail(operation, rejection.get());
            } else {
                accepted.add(operation);
            }
        }
        return accepted;
    }

    private Optional<BackendPoolException> validate(BackendPoolOperation operation) {
        Optional<ServiceRoutingEntry> entry = routingTable.findEntry(operation.getServiceName());
        if (!entry.isPresent()) {
            return Optional.of(BackendPoolException.serviceNotLocal(operation.getServiceName()));
        }
        String currentLoadBalancer = entry.get().getLoadBalancerName();
        if (!operation.getLoadBalancerName().equalsIgnoreCase(currentLoadBalancer)) {
            return Optional.of(BackendPoolException.loadBalancerChanged(operation.getServiceName(), operation.getLoadBalancerName(), currentLoadBalancer));
        }
        return Optional.empty();
    }

    private void rejectOnShutdown(BackendPoolOperation operation) {
        if (operation.markApplying()) {
            groupReconciler.fail(operation, BackendPoolException.updaterShutdown());
        }
    }
}
