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

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class IpFamilyTest {

    @Test
    public void testParse() {
        assertThat(IpFamily.parse("ipv4")).isEqualTo(IpFamily.IPv4);
        assertThat(IpFamily.parse(" IPv6 ")).isEqualTo(IpFamily.IPv6);
        assertThat(IpFamily.parse("dualstack")).isEqualTo(IpFamily.DualStack);
        assertThat(IpFamily.parse("")).isEqualTo(IpFamily.DualStack);
        assertThat(IpFamily.parse(null)).isEqualTo(IpFamily.DualStack);
    }

    @Test
    public void testIncludedFamilies() {
        assertThat(IpFamily.IPv4.includesIPv4()).isTrue();
        assertThat(IpFamily.IPv4.includesIPv6()).isFalse();
        assertThat(IpFamily.IPv6.includesIPv4()).isFalse();
        assertThat(IpFamily.IPv6.includesIPv6()).isTrue();
        assertThat(IpFamily.DualStack.includesIPv4()).isTrue();
        assertThat(IpFamily.DualStack.includesIPv6()).isTrue();
    }
}
