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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.DefaultPropertyFactory;
import com.netflix.archaius.api.Config;
import com.netflix.archaius.config.MapConfig;

public final class Archaius2Ext {

    private static final Config EMPTY_CONFIG = new MapConfig(Collections.emptyMap());

    private Archaius2Ext() {
    }

    /**
     * Create Archaius based configuration object initialized with default values. Defaults can be overridden
     * by providing key/value pairs as parameters, with keys including the configuration prefix.
     */
    public static <C> C newConfiguration(Class<C> configType, String... keyValuePairs) {
        if (keyValuePairs.length == 0) {
            return newConfiguration(configType, EMPTY_CONFIG);
        }
        Preconditions.checkArgument(keyValuePairs.length % 2 == 0, "Expected even number of arguments");

        Map<String, String> props = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            props.put(keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return newConfiguration(configType, new MapConfig(props));
    }

    /**
     * Create Archaius based configuration object backed by the given {@link Config}.
     */
    public static <C> C newConfiguration(Class<C> configType, Config config) {
        ConfigProxyFactory factory = new ConfigProxyFactory(config, config.getDecoder(), DefaultPropertyFactory.from(config));
        return factory.newProxy(configType);
    }
}
