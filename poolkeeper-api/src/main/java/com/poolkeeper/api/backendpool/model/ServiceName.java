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

import java.util.Locale;

import com.google.common.base.Preconditions;

/**
 * Identity of a cluster service (namespace and name). Two names are equal if their lower-cased
 * <code>namespace/name</code> keys are equal.
 */
public final class ServiceName {

    private final String namespace;
    private final String name;
    private final String key;

    private ServiceName(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
        this.key = (namespace + '/' + name).toLowerCase(Locale.ROOT);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    /**
     * Lower-cased <code>namespace/name</code>, used as a lookup key in all service indexed tables.
     */
    public String getKey() {
        return key;
    }

    public static ServiceName of(String namespace, String name) {
        Preconditions.checkArgument(namespace != null && !namespace.isEmpty(), "Empty namespace");
        Preconditions.checkArgument(name != null && !name.isEmpty(), "Empty service name");
        return new ServiceName(namespace, name);
    }

    /**
     * Parses <code>namespace/name</code>.
     */
    public static ServiceName parse(String value) {
        int idx = value == null ? -1 : value.indexOf('/');
        Preconditions.checkArgument(idx > 0 && idx < value.length() - 1, "Expected namespace/name, got %s", value);
        return of(value.substring(0, idx), value.substring(idx + 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return key.equals(((ServiceName) o).key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return namespace + '/' + name;
    }
}
