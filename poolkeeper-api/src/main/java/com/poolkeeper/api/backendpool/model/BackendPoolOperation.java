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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import com.google.common.base.Preconditions;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * A requested change of a single backend pool membership. All fields are immutable. The only mutable part is the
 * lifecycle state, which moves forward only:
 * <pre>
 * Pending -> Withdrawn
 * Pending -> Applying -> Succeeded | Failed
 * </pre>
 * Reaching {@link State#Succeeded} or {@link State#Failed} resolves {@link #completion()} exactly once.
 * A withdrawn operation is never resolved.
 */
public class BackendPoolOperation {

    public enum Kind {AddIPs, RemoveIPs}

    public enum State {
        Pending,
        Withdrawn,
        Applying,
        Succeeded,
        Failed;

        public boolean isTerminal() {
            return this == Withdrawn || this == Succeeded || this == Failed;
        }
    }

    private final ServiceName serviceName;
    private final String loadBalancerName;
    private final String poolName;
    private final Kind kind;
    private final Set<String> ipAddresses;

    private final AtomicReference<State> state = new AtomicReference<>(State.Pending);
    private final Sinks.One<Void> completionSink = Sinks.one();

    private BackendPoolOperation(ServiceName serviceName, String loadBalancerName, String poolName, Kind kind, Collection<String> ipAddresses) {
        Preconditions.checkNotNull(serviceName, "serviceName is null");
        Preconditions.checkArgument(loadBalancerName != null && !loadBalancerName.isEmpty(), "Empty load balancer name");
        Preconditions.checkArgument(poolName != null && !poolName.isEmpty(), "Empty backend pool name");
        this.serviceName = serviceName;
        this.loadBalancerName = loadBalancerName;
        this.poolName = poolName;
        this.kind = kind;
        this.ipAddresses = Collections.unmodifiableSet(new LinkedHashSet<>(ipAddresses));
    }

    public static BackendPoolOperation addIps(ServiceName serviceName, String loadBalancerName, String poolName, Collection<String> ipAddresses) {
        return new BackendPoolOperation(serviceName, loadBalancerName, poolName, Kind.AddIPs, ipAddresses);
    }

    public static BackendPoolOperation removeIps(ServiceName serviceName, String loadBalancerName, String poolName, Collection<String> ipAddresses) {
        return new BackendPoolOperation(serviceName, loadBalancerName, poolName, Kind.RemoveIPs, ipAddresses);
    }

    public ServiceName getServiceName() {
        return serviceName;
    }

    public String getLoadBalancerName() {
        return loadBalancerName;
    }

    public String getPoolName() {
        return poolName;
    }

    public Kind getKind() {
        return kind;
    }

    public Set<String> getIpAddresses() {
        return ipAddresses;
    }

    public State getState() {
        return state.get();
    }

    /**
     * Emits onComplete when the operation succeeds, or the failure cause. Never terminates for a withdrawn
     * operation, so blocking callers should use a timeout.
     */
    public Mono<Void> completion() {
        return completionSink.asMono();
    }

    /**
     * @return true if the operation was pending and is now withdrawn
     */
    public boolean markWithdrawn() {
        return state.compareAndSet(State.Pending, State.Withdrawn);
    }

    /**
     * @return true if the operation was pending and is now picked up by a drain cycle
     */
    public boolean markApplying() {
        return state.compareAndSet(State.Pending, State.Applying);
    }

    /**
     * @return false if the operation was not in the {@link State#Applying} state, in which case nothing changes
     */
    public boolean succeed() {
        if (!state.compareAndSet(State.Applying, State.Succeeded)) {
            return false;
        }
        completionSink.tryEmitEmpty();
        return true;
    }

    /**
     * @return false if the operation was not in the {@link State#Applying} state, in which case nothing changes
     */
    public boolean fail(Throwable error) {
        if (!state.compareAndSet(State.Applying, State.Failed)) {
            return false;
        }
        completionSink.tryEmitError(error);
        return true;
    }

    @Override
    public String toString() {
        return "BackendPoolOperation{" +
                "serviceName=" + serviceName +
                ", loadBalancerName='" + loadBalancerName + '\'' +
                ", poolName='" + poolName + '\'' +
                ", kind=" + kind +
                ", ipAddresses=" + ipAddresses +
                ", state=" + state.get() +
                '}';
    }
}
