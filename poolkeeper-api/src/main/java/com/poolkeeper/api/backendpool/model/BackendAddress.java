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

import java.util.Objects;

/**
 * A single address entry of a backend pool. The name is assigned by the cloud and may be empty for entries
 * created by this process.
 */
public class BackendAddress {

    private final String name;
    private final String ipAddress;

    public BackendAddress(String name, String ipAddress) {
        this.name = name == null ? "" : name;
        this.ipAddress = ipAddress;
    }

    public static BackendAddress ofIp(String ipAddress) {
        return new BackendAddress("", ipAddress);
    }

    public String getName() {
        return name;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BackendAddress that = (BackendAddress) o;
        return name.equals(that.name) &&
                Objects.equals(ipAddress, that.ipAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, ipAddress);
    }

    @Override
    public String toString() {
        return "BackendAddress{" +
                "name='" + name + '\'' +
                ", ipAddress='" + ipAddress + '\'' +
                '}';
    }
}
