package com.ryuqq.workbundle.testkit.contract;

import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.RemoteStoreException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import com.ryuqq.workbundle.testkit.contract.FaultInjectingGateway.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link FaultInjectingGateway}.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class FaultInjectingGatewayTest {

    private static final BundleKey KEY = BundleKey.of("app1-ns1-vrg-mw", TestBundles.CLUSTER_A);

    @Mock
    private RemoteStoreGateway delegate;

    private FaultInjectingGateway gateway;
    private OperationContext ctx;

    @BeforeEach
    void setUp() {
        gateway = new FaultInjectingGateway(delegate);
        ctx = OperationContext.background();
    }

    @Test
    void testFailNext_ThrowsOnceThenDelegates() {
        // Given
        RemoteStoreException failure = new RemoteStoreException("connection reset");
        WorkBundle stored = TestBundles.bundle(KEY.name(), KEY.location()).withResourceVersion("1");
        when(delegate.get(ctx, KEY)).thenReturn(stored);
        gateway.failNext(Operation.GET, failure);

        // When & Then
        assertSame(failure, assertThrows(RemoteStoreException.class, () -> gateway.get(ctx, KEY)));
        assertSame(stored, gateway.get(ctx, KEY));
        verify(delegate, times(1)).get(ctx, KEY);
        assertEquals(2, gateway.callCount(Operation.GET));
    }

    @Test
    void testFailNext_OnlyAffectsGivenOperation() {
        // Given
        gateway.failNext(Operation.DELETE, new RemoteStoreException("forbidden"));

        // When
        gateway.update(ctx, TestBundles.bundle(KEY.name(), KEY.location()));

        // Then
        verify(delegate).update(eq(ctx), any());
        assertEquals(0, gateway.callCount(Operation.DELETE));
    }

    @Test
    void testBeforeNext_RunsHookBeforeDelegateOnce() {
        // Given
        List<String> events = new ArrayList<>();
        gateway.beforeNext(Operation.DELETE, () -> events.add("hook"));

        // When
        gateway.delete(ctx, KEY);
        gateway.delete(ctx, KEY);

        // Then
        assertEquals(List.of("hook"), events);
        verify(delegate, times(2)).delete(ctx, KEY);
    }

    @Test
    void testBeforeNext_HookSeesStateBeforeDelegateCall() {
        // Given
        RemoteStoreGateway peer = mock(RemoteStoreGateway.class);
        WorkBundle bundle = TestBundles.bundle(KEY.name(), KEY.location());
        gateway.beforeNext(Operation.CREATE, () -> peer.create(ctx, bundle));

        // When
        gateway.create(ctx, bundle);

        // Then
        InOrder inOrder = inOrder(peer, delegate);
        inOrder.verify(peer).create(ctx, bundle);
        inOrder.verify(delegate).create(ctx, bundle);
    }

    @Test
    void testReset_DropsPendingFailuresAndCounters() {
        // Given
        gateway.failNext(Operation.GET, new RemoteStoreException("boom"));
        gateway.delete(ctx, KEY);

        // When
        gateway.reset();
        gateway.get(ctx, KEY);

        // Then
        verify(delegate).get(ctx, KEY);
        assertEquals(1, gateway.callCount(Operation.GET));
        assertEquals(0, gateway.callCount(Operation.DELETE));
    }

    @Test
    void testConstructor_NullDelegate_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> new FaultInjectingGateway(null));
    }
}
