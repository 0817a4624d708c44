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


package com.poolkeeper.api.backendpool.service;

import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.connector.cloud.BackendPoolConnectorException;
import org.slf4j.event.Level;

import static java.lang.String.format;

public class BackendPoolException extends RuntimeException {

    public enum ErrorCode {
        UpdateFailed,
        ServiceNotLocal,
        LoadBalancerChanged,
        UpdaterShutdown
    }

    private final ErrorCode errorCode;

    private BackendPoolException(Builder builder) {
        super(builder.message, builder.cause);
        this.errorCode = builder.errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Terminal failure of a fetch or update call. The cause is the error reported by the cloud connector.
     */
    public static BackendPoolException updateFailed(String loadBalancerName, String poolName, Throwable cause) {
        return new Builder(ErrorCode.UpdateFailed, format("Cannot update backend pool %s/%s: %s", loadBalancerName, poolName, cause.getMessage()))
                .withCause(cause)
                .build();
    }

    public static BackendPoolException serviceNotLocal(ServiceName serviceName) {
        return new Builder(ErrorCode.ServiceNotLocal, format("Service %s is not a local service", serviceName)).build();
    }

    public static BackendPoolException loadBalancerChanged(ServiceName serviceName, String expectedLoadBalancer, String actualLoadBalancer) {
        return new Builder(
                ErrorCode.LoadBalancerChanged,
                format("Service %s moved from load balancer %s to %s", serviceName, expectedLoadBalancer, actualLoadBalancer)
        ).build();
    }

    public static BackendPoolException updaterShutdown() {
        return new Builder(ErrorCode.UpdaterShutdown, "Backend pool updater is shut down").build();
    }

    public static final class Builder {
        private final ErrorCode errorCode;
        private final String message;
        private Throwable cause;

        private Builder(ErrorCode errorCode, String message) {
            this.errorCode = errorCode;
            this.message = message;
        }

        public Builder withCause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public BackendPoolException build() {
            return new BackendPoolException(this);
        }
    }

    public static Level getLogLevel(Throwable throwable) {
        if (throwable instanceof BackendPoolException) {
            switch (((BackendPoolException) throwable).getErrorCode()) {
                case ServiceNotLocal:
                case LoadBalancerChanged:
                    return Level.INFO;
                case UpdaterShutdown:
                    return Level.WARN;
                default:
                    return getLogLevel(throwable.getCause());
            }
        }
        // A pool deleted out of band is not an exceptional case.
        if (BackendPoolConnectorException.isNotFound(throwable)) {
            return Level.DEBUG;
        }
        return Level.ERROR;
    }
}
