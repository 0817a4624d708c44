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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Snapshot of a remote backend pool definition. The address list order is the order returned by the cloud.
 */
public class BackendPool {

    private final String id;
    private final String name;
    private final List<BackendAddress> addresses;

    private BackendPool(String id, String name, List<BackendAddress> addresses) {
        this.id = id;
        this.name = name;
        this.addresses = Collections.unmodifiableList(new ArrayList<>(addresses));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public List<BackendAddress> getAddresses() {
        return addresses;
    }

    public List<String> getIpAddresses() {
        return addresses.stream().map(BackendAddress::getIpAddress).collect(Collectors.toList());
    }

    public Builder toBuilder() {
        return newBuilder().withId(id).withName(name).withAddresses(addresses);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BackendPool that = (BackendPool) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                addresses.equals(that.addresses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, addresses);
    }

    @Override
    public String toString() {
        return "BackendPool{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", addresses=" + getIpAddresses() +
                '}';
    }

    public static final class Builder {
        private String id;
        private String name;
        private List<BackendAddress> addresses = Collections.emptyList();

        private Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withAddresses(List<BackendAddress> addresses) {
            this.addresses = addresses;
            return this;
        }

        public Builder withIpAddresses(String... ipAddresses) {
            List<BackendAddress> result = new ArrayList<>();
            for (String ipAddress : ipAddresses) {
                result.add(BackendAddress.ofIp(ipAddress));
            }
            this.addresses = result;
            return this;
        }

        public BackendPool build() {
            return new BackendPool(id, name, addresses == null ? Collections.emptyList() : addresses);
        }
    }
}
