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


package com.poolkeeper.server.backendpool.service;

import com.poolkeeper.api.backendpool.model.IpFamily;
import com.poolkeeper.api.backendpool.model.ServiceName;
import com.poolkeeper.api.backendpool.model.ServiceRoutingEntry;
import com.poolkeeper.api.backendpool.service.BackendPoolUpdater;
import org.junit.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class LocalServiceManagerTest {

    private static final ServiceName SERVICE = ServiceName.of("default", "svc1");

    private final ServiceRoutingTable routingTable = new ServiceRoutingTable();

    private final BackendPoolUpdater updater = Mockito.mock(BackendPoolUpdater.class);

    private final LocalServiceManager manager = new LocalServiceManager(routingTable, updater);

    @Test
    public void testNewLocalServiceIsRegistered() {
        manager.onServiceLocal(SERVICE, "kubernetes", IpFamily.IPv4);

        assertThat(routingTable.findEntry(SERVICE)).contains(new ServiceRoutingEntry("kubernetes", IpFamily.IPv4));
        verify(updater, never()).withdraw(SERVICE);
    }

    @Test
    public void testSameLoadBalancerKeepsPendingOperations() {
        manager.onServiceLocal(SERVICE, "kubernetes", IpFamily.IPv4);
        manager.onServiceLocal(SERVICE, "Kubernetes", IpFamily.DualStack);

        assertThat(routingTable.findEntry(SERVICE)).contains(new ServiceRoutingEntry("Kubernetes", IpFamily.DualStack));
        verify(updater, never()).withdraw(SERVICE);
    }

    @Test
    public void testLoadBalancerChangeWithdrawsPendingOperations() {
        when(updater.withdraw(SERVICE)).thenReturn(3);

        manager.onServiceLocal(SERVICE, "kubernetes", IpFamily.IPv4);
        manager.onServiceLocal(SERVICE, "kubernetes-internal", IpFamily.IPv4);

        assertThat(routingTable.findEntry(SERVICE).map(ServiceRoutingEntry::getLoadBalancerName)).contains("kubernetes-internal");
        verify(updater).withdraw(SERVICE);
    }

    @Test
    public void testRemovedServiceIsUnregistered() {
        manager.onServiceLocal(SERVICE, "kubernetes", IpFamily.IPv4);
        manager.onServiceRemoved(ServiceName.of("DEFAULT", "svc1"));

        assertThat(routingTable.isLocal(SERVICE)).isFalse();
        verify(updater).withdraw(SERVICE);
    }

    @Test
    public void testRemovingUnknownServiceWithdrawsOperations() {
        manager.onServiceRemoved(SERVICE);

        assertThat(routingTable.size()).isZero();
        verify(updater).withdraw(SERVICE);
    }
}
