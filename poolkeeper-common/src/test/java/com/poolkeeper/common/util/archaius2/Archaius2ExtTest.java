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


package com.poolkeeper.common.util.archaius2;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class Archaius2ExtTest {

    @Test
    public void testDefaultValues() {
        MyConfig config = Archaius2Ext.newConfiguration(MyConfig.class);

        assertThat(config.getIntervalMs()).isEqualTo(1_000);
        assertThat(config.isEnabled()).isTrue();
    }

    @Test
    public void testOverrides() {
        MyConfig config = Archaius2Ext.newConfiguration(MyConfig.class, "test.root.intervalMs", "5", "test.root.enabled", "false");

        assertThat(config.getIntervalMs()).isEqualTo(5);
        assertThat(config.isEnabled()).isFalse();
    }

    @Test
    public void testOddNumberOfArgumentsIsRejected() {
        assertThatThrownBy(() -> Archaius2Ext.newConfiguration(MyConfig.class, "test.root.intervalMs"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Configuration(prefix = "test.root")
    public interface MyConfig {

        @DefaultValue("1000")
        long getIntervalMs();

        @DefaultValue("true")
        boolean isEnabled();
    }
}
