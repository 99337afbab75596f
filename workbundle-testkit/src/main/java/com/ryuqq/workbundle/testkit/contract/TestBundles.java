package com.ryuqq.workbundle.testkit.contract;

import com.ryuqq.workbundle.application.encoding.JacksonManifestEncoder;
import com.ryuqq.workbundle.core.manifest.LabelSelector;
import com.ryuqq.workbundle.core.manifest.Namespace;
import com.ryuqq.workbundle.core.manifest.ObjectMeta;
import com.ryuqq.workbundle.core.manifest.VolumeReplicationGroup;
import com.ryuqq.workbundle.core.manifest.VolumeReplicationGroupSpec;
import com.ryuqq.workbundle.core.model.Manifest;
import com.ryuqq.workbundle.core.model.OwnerRef;
import com.ryuqq.workbundle.core.model.ProvenanceAnnotations;
import com.ryuqq.workbundle.core.model.WorkBundle;

import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for contract tests.
 *
 * <p>All manifests are produced by {@link JacksonManifestEncoder} so fixtures compare
 * exactly like bundles built by the engine.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class TestBundles {

    public static final OwnerRef OWNER = OwnerRef.of("app1", "ns1");
    public static final String CLUSTER_A = "cluster-a";
    public static final String CLUSTER_B = "cluster-b";

    private static final JacksonManifestEncoder ENCODER = new JacksonManifestEncoder();

    private TestBundles() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Encoded {@code Namespace} manifest.
     *
     * @param name namespace name
     * @return manifest
     */
    public static Manifest namespace(String name) {
        return ENCODER.encode(Namespace.named(name));
    }

    /**
     * Workload state object for the default owner.
     *
     * @param replicationState e.g. "primary" or "secondary"
     * @return VolumeReplicationGroup
     */
    public static VolumeReplicationGroup vrg(String replicationState) {
        return new VolumeReplicationGroup(
            ObjectMeta.namespaced(OWNER.name(), OWNER.namespace()),
            new VolumeReplicationGroupSpec(
                new LabelSelector(Map.of("appname", OWNER.name())),
                replicationState,
                List.of("s3-east", "s3-west"),
                "5m"
            )
        );
    }

    /**
     * Encoded workload state manifest.
     *
     * @param replicationState replication state
     * @return manifest
     */
    public static Manifest vrgManifest(String replicationState) {
        return ENCODER.encode(vrg(replicationState));
    }

    /**
     * Locally built bundle (no resourceVersion) owned by {@link #OWNER}.
     *
     * @param name bundle name
     * @param location target location
     * @param manifests manifests in apply order
     * @return bundle
     */
    public static WorkBundle bundle(String name, String location, Manifest... manifests) {
        return new WorkBundle(name, location, Map.of(), ProvenanceAnnotations.of(OWNER),
            List.of(manifests), null, null);
    }
}
