package com.ryuqq.workbundle.testkit.contract;

import com.ryuqq.workbundle.application.bundle.WorkDeleter;
import com.ryuqq.workbundle.application.bundle.WorkSynchronizer;
import com.ryuqq.workbundle.application.drcluster.DrClusterDeployment;
import com.ryuqq.workbundle.application.encoding.JacksonManifestEncoder;
import com.ryuqq.workbundle.application.manager.WorkBundleManager;
import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleConflictException;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.exception.RemoteStoreException;
import com.ryuqq.workbundle.core.exception.WorkBundleFetchException;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.naming.NameFormatter;
import com.ryuqq.workbundle.core.outcome.Deleted;
import com.ryuqq.workbundle.core.outcome.SyncOutcome;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import com.ryuqq.workbundle.testkit.contract.FaultInjectingGateway.Operation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end convergence suite run against a real {@link RemoteStoreGateway}.
 *
 * <p>The gateway returned by {@link #createGateway()} is wrapped in a
 * {@link FaultInjectingGateway} so scenarios can inject remote failures and
 * interleave a peer writer between the engine's read and write.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public abstract class AbstractConvergenceContractTest {

    protected RemoteStoreGateway store;
    protected FaultInjectingGateway gateway;
    protected WorkSynchronizer synchronizer;
    protected WorkDeleter deleter;
    protected WorkBundleManager manager;
    protected OperationContext ctx;

    /**
     * Creates a fresh, empty gateway for each test.
     *
     * @return gateway under test
     */
    protected abstract RemoteStoreGateway createGateway();

    @BeforeEach
    void setUpEngine() {
        store = createGateway();
        gateway = new FaultInjectingGateway(store);
        synchronizer = new WorkSynchronizer(gateway);
        deleter = new WorkDeleter(gateway);
        manager = new WorkBundleManager(TestBundles.OWNER, gateway, new JacksonManifestEncoder());
        ctx = OperationContext.background();
    }

    /**
     * Asserts the stored manifest sequence of a bundle.
     *
     * @param key bundle key
     * @param expected expected bundle content
     */
    protected void assertStoredManifests(BundleKey key, WorkBundle expected) {
        WorkBundle stored = store.get(ctx, key);
        assertEquals(expected.manifests(), stored.manifests(),
            String.format("Stored manifests of %s differ from %s", key, expected));
    }

    @Test
    void testConverge_ExampleLifecycle_CreatedUnchangedUpdated() {
        // Given
        String name = NameFormatter.format(TestBundles.OWNER, NameFormatter.WORKLOAD_KIND);
        assertEquals("app1-ns1-vrg-mw", name);
        WorkBundle first = TestBundles.bundle(name, TestBundles.CLUSTER_A, TestBundles.vrgManifest("primary"));
        WorkBundle changed = TestBundles.bundle(name, TestBundles.CLUSTER_A, TestBundles.vrgManifest("secondary"));

        // When & Then
        assertTrue(synchronizer.converge(ctx, first).isCreated());
        assertTrue(synchronizer.converge(ctx, first).isUnchanged());
        assertTrue(synchronizer.converge(ctx, changed).isUpdated());
        assertStoredManifests(changed.key(), changed);
    }

    @Test
    void testConverge_Twice_SecondCallDoesNotWrite() {
        // Given
        WorkBundle desired = TestBundles.bundle("app1-ns1-ns-mw", TestBundles.CLUSTER_A, TestBundles.namespace("ns1"));

        // When
        synchronizer.converge(ctx, desired);
        String versionAfterFirst = store.get(ctx, desired.key()).resourceVersion();
        SyncOutcome second = synchronizer.converge(ctx, desired);

        // Then
        assertTrue(second.isUnchanged());
        assertEquals(versionAfterFirst, store.get(ctx, desired.key()).resourceVersion());
        assertEquals(0, gateway.callCount(Operation.UPDATE));
    }

    @Test
    void testConverge_ManifestCountDiffers_UpdatedToExactSequence() {
        // Given
        WorkBundle one = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.namespace("ns1"));
        WorkBundle two = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A,
            TestBundles.namespace("ns1"), TestBundles.vrgManifest("primary"));
        synchronizer.converge(ctx, one);

        // When
        SyncOutcome outcome = synchronizer.converge(ctx, two);

        // Then
        assertTrue(outcome.isUpdated());
        assertStoredManifests(two.key(), two);
    }

    @Test
    void testConverge_PeerCreatesFirst_ContinuesWithUpdate() {
        // Given: a peer creates different content between our fetch and create
        WorkBundle desired = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.vrgManifest("primary"));
        WorkBundle peer = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.vrgManifest("secondary"));
        gateway.beforeNext(Operation.CREATE, () -> store.create(ctx, peer));

        // When
        SyncOutcome outcome = synchronizer.converge(ctx, desired);

        // Then
        assertTrue(outcome.isUpdated());
        assertEquals(1, gateway.callCount(Operation.CREATE));
        assertStoredManifests(desired.key(), desired);
    }

    @Test
    void testConverge_PeerUpdatesBetweenReadAndWrite_ConflictPropagated() {
        // Given
        WorkBundle desired = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.vrgManifest("primary"));
        synchronizer.converge(ctx, desired);
        WorkBundle changed = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.vrgManifest("secondary"));
        gateway.beforeNext(Operation.UPDATE, () -> {
            WorkBundle current = store.get(ctx, desired.key());
            store.update(ctx, current.withManifests(List.of(TestBundles.namespace("peer"))));
        });

        // When & Then
        assertThrows(BundleConflictException.class, () -> synchronizer.converge(ctx, changed));
        assertEquals(List.of(TestBundles.namespace("peer")), store.get(ctx, desired.key()).manifests());
    }

    @Test
    void testConverge_FetchFails_WrappedWithContext() {
        // Given
        WorkBundle desired = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.namespace("ns1"));
        gateway.failNext(Operation.GET, new RemoteStoreException("connection reset"));

        // When
        WorkBundleFetchException e = assertThrows(WorkBundleFetchException.class,
            () -> synchronizer.converge(ctx, desired));

        // Then
        assertTrue(e.getMessage().contains("app1-ns1-vrg-mw"));
        assertTrue(e.getMessage().contains(TestBundles.CLUSTER_A));
        assertEquals(0, gateway.callCount(Operation.CREATE));
    }

    @Test
    void testDelete_Twice_BothSucceed() {
        // Given
        WorkBundle desired = TestBundles.bundle("app1-ns1-vrg-mw", TestBundles.CLUSTER_A, TestBundles.namespace("ns1"));
        synchronizer.converge(ctx, desired);

        // When
        Deleted first = deleter.delete(ctx, desired.key());
        Deleted second = deleter.delete(ctx, desired.key());

        // Then
        assertTrue(first.existed());
        assertFalse(second.existed());
        assertThrows(BundleNotFoundException.class, () -> store.get(ctx, desired.key()));
    }

    @Test
    void testDeleteBundlesForCluster_NamespaceBundleSurvives() {
        // Given
        manager.createOrUpdateWorkloadBundle(ctx, "app1", "ns1", TestBundles.CLUSTER_A, TestBundles.vrg("primary"));
        manager.createOrUpdateNamespaceBundle(ctx, "app1", "ns1", TestBundles.CLUSTER_A);

        // When
        manager.deleteBundlesForCluster(ctx, TestBundles.CLUSTER_A);

        // Then
        assertThrows(BundleNotFoundException.class,
            () -> store.get(ctx, BundleKey.of("app1-ns1-vrg-mw", TestBundles.CLUSTER_A)));
        assertNotNull(store.get(ctx, BundleKey.of("app1-ns1-ns-mw", TestBundles.CLUSTER_A)));
    }

    @Test
    void testDrClusterBundle_Repeated_Unchanged() {
        // Given
        DrClusterDeployment deployment = new DrClusterDeployment().withDeploymentAutomationEnabled(true);

        // When
        SyncOutcome first = manager.createOrUpdateDrClusterBundle(ctx, TestBundles.CLUSTER_B, deployment);
        SyncOutcome second = manager.createOrUpdateDrClusterBundle(ctx, TestBundles.CLUSTER_B, deployment);

        // Then
        assertTrue(first.isCreated());
        assertTrue(second.isUnchanged());
        assertEquals(8, store.get(ctx, BundleKey.of(NameFormatter.DR_CLUSTER_BUNDLE_NAME, TestBundles.CLUSTER_B))
            .manifests().size());
    }

    @Test
    void testDrClusterBundle_AutomationToggled_Updated() {
        // Given
        manager.createOrUpdateDrClusterBundle(ctx, TestBundles.CLUSTER_B, new DrClusterDeployment());

        // When
        SyncOutcome outcome = manager.createOrUpdateDrClusterBundle(ctx, TestBundles.CLUSTER_B,
            new DrClusterDeployment().withDeploymentAutomationEnabled(true));

        // Then
        assertTrue(outcome.isUpdated());
    }
}
