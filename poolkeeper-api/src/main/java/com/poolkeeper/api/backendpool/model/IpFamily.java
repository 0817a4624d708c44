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

public enum IpFamily {
    IPv4,
    IPv6,
    DualStack;

    public boolean includesIPv4() {
        return this != IPv6;
    }

    public boolean includesIPv6() {
        return this != IPv4;
    }

    /**
     * Case insensitive lookup. Unknown or empty values map to {@link #DualStack}, so both pools are kept in sync.
     */
    public static IpFamily parse(String value) {
        if (value != null) {
            for (IpFamily family : values()) {
                if (family.name().equalsIgnoreCase(value.trim())) {
                    return family;
                }
            }
        }
        return DualStack;
    }
}
