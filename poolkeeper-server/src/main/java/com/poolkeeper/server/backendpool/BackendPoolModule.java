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

import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.api.Config;
import com.poolkeeper.api.backendpool.service.BackendPoolUpdater;
import com.poolkeeper.common.runtime.PoolKeeperRuntime;
import com.poolkeeper.common.runtime.internal.DefaultPoolKeeperRuntime;
import com.poolkeeper.common.util.archaius2.Archaius2Ext;
import com.poolkeeper.server.backendpool.service.BackendPoolConfiguration;
import com.poolkeeper.server.backendpool.service.DefaultBackendPoolUpdater;

/**
 * Wires the backend pool reconciliation components. Expects {@link Config},
 * {@link com.netflix.spectator.api.Registry} and a
 * {@link com.poolkeeper.api.connector.cloud.BackendPoolConnector} to be bound by other modules.
 * <p>
 * Plain Guice does not run {@code @PostConstruct} methods, so the updater drain loop is started by an eagerly
 * created activator. {@link DefaultBackendPoolUpdater#shutdown()} is still a {@code @PreDestroy} method, which the
 * owner of the injector must call when no lifecycle-aware container manages it.
 */
public class BackendPoolModule extends AbstractModule {
    @Override
    protected void configure() {
        bind(PoolKeeperRuntime.class).to(DefaultPoolKeeperRuntime.class);
        bind(BackendPoolUpdater.class).to(DefaultBackendPoolUpdater.class);
        bind(UpdaterActivator.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    public BackendPoolConfiguration getBackendPoolConfiguration(Config config) {
        return Archaius2Ext.newConfiguration(BackendPoolConfiguration.class, config);
    }

    static class UpdaterActivator {
        @Inject
        UpdaterActivator(DefaultBackendPoolUpdater updater) {
            updater.activate();
        }
    }
}
