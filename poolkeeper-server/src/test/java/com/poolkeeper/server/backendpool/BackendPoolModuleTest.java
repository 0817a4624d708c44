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


package com.poolkeeper.server.backendpool;

import java.time.Duration;
import java.util.List;

import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.netflix.archaius.api.Config;
import com.netflix.archaius.config.MapConfig;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import com.poolkeeper.api.backendpool.model.BackendPoolOperation;
import com.poolkeeper.api.backendpool.model.EndpointMembershipChange;
import com.poolkeeper.api.backendpool.model.IpFamily;
import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.backendpool.service.BackendPoolUpdater;
import com.poolkeeper.api.connector.cloud.BackendPoolConnector;
import com.poolkeeper.server.backendpool.service.BackendPoolConfiguration;
import com.poolkeeper.server.backendpool.service.DefaultBackendPoolUpdater;
import com.poolkeeper.server.backendpool.service.EndpointDiffEngine;
import com.poolkeeper.server.backendpool.service.LocalServiceManager;
import com.poolkeeper.server.backendpool.service.NodeIpResolver;
import com.poolkeeper.testkit.model.backendpool.StubbedBackendPoolConnector;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import static com.poolkeeper.common.util.CollectionsExt.asSet;
import static java.util.Arrays.asList;
import static java.util.Collections.singletonMap;
import static org.assertj.core.api.Assertions.assertThat;

public class BackendPoolModuleTest {

    private static final ServiceName SERVICE = ServiceName.of("default", "svc1");

    private final StubbedBackendPoolConnector connector = new StubbedBackendPoolConnector();

    private Injector injector;

    @Before
    public void setUp() {
        injector = Guice.createInjector(
                new BackendPoolModule(),
                new AbstractModule() {
                    @Override
                    protected void configure() {
                        bind(Config.class).toInstance(new MapConfig(singletonMap("poolkeeper.backendPool.updateIntervalMs", "10")));
                        bind(Registry.class).toInstance(new DefaultRegistry());
                        bind(BackendPoolConnector.class).toInstance(connector);
                    }
                }
        );
    }

    @After
    public void tearDown() {
        injector.getInstance(DefaultBackendPoolUpdater.class).shutdown();
    }

    @Test
    public void testConfigurationIsBoundToArchaiusConfig() {
        BackendPoolConfiguration configuration = injector.getInstance(BackendPoolConfiguration.class);

        assertThat(configuration.getUpdateIntervalMs()).isEqualTo(10);
        assertThat(configuration.getConnectorTimeoutMs()).isEqualTo(60_000);
        assertThat(configuration.isDrainValidationEnabled()).isTrue();
    }

    @Test
    public void testUpdaterIsSingleton() {
        assertThat(injector.getInstance(BackendPoolUpdater.class)).isSameAs(injector.getInstance(DefaultBackendPoolUpdater.class));
    }

    @Test
    public void testUpdaterIsActivatedByInjector() {
        connector.addBackendPool("kubernetes", "default-svc1", "10.0.0.1");
        injector.getInstance(LocalServiceManager.class).onServiceLocal(SERVICE, "kubernetes", IpFamily.IPv4);

        BackendPoolOperation operation = BackendPoolOperation.addIps(SERVICE, "kubernetes", "default-svc1", asList("10.0.0.2"));
        injector.getInstance(BackendPoolUpdater.class).enqueue(operation);
        operation.completion().block(Duration.ofSeconds(5));

        assertThat(operation.getState()).isEqualTo(BackendPoolOperation.State.Succeeded);
        assertThat(connector.getIpAddresses("kubernetes", "default-svc1")).containsExactly("10.0.0.1", "10.0.0.2");
    }

    @Test
    public void testEndpointChangeIsAppliedToBackendPool() {
        connector.addBackendPool("kubernetes", "default-svc1", "10.0.0.1");

        injector.getInstance(LocalServiceManager.class).onServiceLocal(SERVICE, "kubernetes", IpFamily.IPv4);
        NodeIpResolver nodeIpResolver = injector.getInstance(NodeIpResolver.class);
        nodeIpResolver.updateNode("node1", asList("10.0.0.1"));
        nodeIpResolver.updateNode("node2", asList("10.0.0.2"));

        List<BackendPoolOperation> operations = injector.getInstance(EndpointDiffEngine.class)
                .onMembershipChange(new EndpointMembershipChange(SERVICE, asSet("node1"), asSet("node2")));
        assertThat(operations).hasSize(2);

        operations.forEach(operation -> operation.completion().block(Duration.ofSeconds(5)));

        assertThat(connector.getIpAddresses("kubernetes", "default-svc1")).containsExactly("10.0.0.2");
        assertThat(connector.getUpdateCalls("kubernetes", "default-svc1")).hasSize(1);
    }
}
