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


package com.poolkeeper.api.connector.cloud;

import static java.lang.String.format;

/**
 * Error returned by the cloud network API. Carries the information needed to decide on a retry.
 */
public class BackendPoolConnectorException extends RuntimeException {

    public static final int HTTP_NOT_FOUND = 404;
    public static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final boolean retriable;
    private final int httpStatusCode;

    private BackendPoolConnectorException(String message, boolean retriable, int httpStatusCode, Throwable cause) {
        super(message, cause);
        this.retriable = retriable;
        this.httpStatusCode = httpStatusCode;
    }

    public boolean isRetriable() {
        return retriable;
    }

    /**
     * Zero if the error did not come with an HTTP response.
     */
    public int getHttpStatusCode() {
        return httpStatusCode;
    }

    public boolean isNotFound() {
        return httpStatusCode == HTTP_NOT_FOUND;
    }

    public static BackendPoolConnectorException retriable(String message, Throwable cause) {
        return new BackendPoolConnectorException(message, true, 0, cause);
    }

    public static BackendPoolConnectorException retriable(String message, int httpStatusCode) {
        return new BackendPoolConnectorException(message, true, httpStatusCode, null);
    }

    public static BackendPoolConnectorException nonRetriable(String message, Throwable cause) {
        return new BackendPoolConnectorException(message, false, 0, cause);
    }

    public static BackendPoolConnectorException nonRetriable(String message, int httpStatusCode) {
        return new BackendPoolConnectorException(message, false, httpStatusCode, null);
    }

    public static BackendPoolConnectorException notFound(String loadBalancerName, String poolName) {
        return new BackendPoolConnectorException(
                format("Backend pool %s/%s not found", loadBalancerName, poolName), false, HTTP_NOT_FOUND, null
        );
    }

    public static boolean isRetriable(Throwable error) {
        return error instanceof BackendPoolConnectorException && ((BackendPoolConnectorException) error).isRetriable();
    }

    public static boolean isNotFound(Throwable error) {
        return error instanceof BackendPoolConnectorException && ((BackendPoolConnectorException) error).isNotFound();
    }

    @Override
    public String toString() {
        return "BackendPoolConnectorException{" +
                "retriable=" + retriable +
                ", httpStatusCode=" + httpStatusCode +
                ", message=" + getMessage() +
                '}';
    }
}
