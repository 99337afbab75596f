package com.ryuqq.workbundle.application.manager;

import com.ryuqq.workbundle.application.bundle.WorkBundleBuilder;
import com.ryuqq.workbundle.application.bundle.WorkDeleter;
import com.ryuqq.workbundle.application.bundle.WorkSynchronizer;
import com.ryuqq.workbundle.application.drcluster.DrClusterDeployment;
import com.ryuqq.workbundle.application.drcluster.DrClusterManifests;
import com.ryuqq.workbundle.core.context.OperationContext;
import com.ryuqq.workbundle.core.exception.BundleNotFoundException;
import com.ryuqq.workbundle.core.exception.DeadlineExceededException;
import com.ryuqq.workbundle.core.exception.InvalidTargetException;
import com.ryuqq.workbundle.core.exception.OperationCancelledException;
import com.ryuqq.workbundle.core.exception.WorkBundleException;
import com.ryuqq.workbundle.core.exception.WorkBundleFetchException;
import com.ryuqq.workbundle.core.manifest.ManifestObject;
import com.ryuqq.workbundle.core.manifest.Namespace;
import com.ryuqq.workbundle.core.manifest.VolumeReplicationGroup;
import com.ryuqq.workbundle.core.model.BundleKey;
import com.ryuqq.workbundle.core.model.OwnerRef;
import com.ryuqq.workbundle.core.model.WorkBundle;
import com.ryuqq.workbundle.core.naming.NameFormatter;
import com.ryuqq.workbundle.core.outcome.Deleted;
import com.ryuqq.workbundle.core.outcome.SyncOutcome;
import com.ryuqq.workbundle.core.spi.ManifestEncoder;
import com.ryuqq.workbundle.core.spi.RemoteStoreGateway;
import com.ryuqq.workbundle.core.status.StatusInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 소유자 단위 WorkBundle 관리 Facade.
 *
 * <p>하나의 소유 요청(OwnerRef)을 기준으로 워크로드/네임스페이스/DR 클러스터 부트스트랩
 * WorkBundle을 생성, 갱신, 조회, 삭제합니다. 모든 WorkBundle에는 소유자의
 * provenance 어노테이션이 부착됩니다.</p>
 *
 * <p><strong>WorkBundle 종류:</strong></p>
 * <ul>
 *   <li>워크로드: {@code "{name}-{namespace}-vrg-mw"}, 라벨 {@code app=VRG}, Manifest 1개</li>
 *   <li>네임스페이스: {@code "{name}-{namespaceName}-ns-mw"}, 라벨 없음, Namespace Manifest 1개</li>
 *   <li>DR 클러스터 부트스트랩: 고정 이름 {@code "ramen-dr-cluster"}</li>
 * </ul>
 *
 * <p><strong>정리 정책:</strong> {@link #deleteBundlesForCluster}는 워크로드 WorkBundle만 삭제하며,
 * 네임스페이스 WorkBundle은 원격에 남겨둡니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class WorkBundleManager {

    private static final Logger log = LoggerFactory.getLogger(WorkBundleManager.class);
    private static final Map<String, String> WORKLOAD_LABELS = Map.of("app", "VRG");

    private final OwnerRef owner;
    private final RemoteStoreGateway gateway;
    private final WorkBundleBuilder builder;
    private final WorkSynchronizer synchronizer;
    private final WorkDeleter deleter;
    private final DrClusterManifests drClusterManifests;

    /**
     * 생성자.
     *
     * @param owner 소유자
     * @param gateway 원격 저장소 게이트웨이
     * @param encoder Manifest 인코더
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WorkBundleManager(OwnerRef owner, RemoteStoreGateway gateway, ManifestEncoder encoder) {
        this(owner, gateway, encoder, new DrClusterManifests());
    }

    /**
     * DR 클러스터 내용 생성기를 지정하는 생성자.
     *
     * @param owner 소유자
     * @param gateway 원격 저장소 게이트웨이
     * @param encoder Manifest 인코더
     * @param drClusterManifests DR 클러스터 부트스트랩 내용 생성기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public WorkBundleManager(OwnerRef owner, RemoteStoreGateway gateway, ManifestEncoder encoder,
                             DrClusterManifests drClusterManifests) {
        if (owner == null) {
            throw new IllegalArgumentException("owner cannot be null");
        }
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        if (encoder == null) {
            throw new IllegalArgumentException("encoder cannot be null");
        }
        if (drClusterManifests == null) {
            throw new IllegalArgumentException("drClusterManifests cannot be null");
        }
        this.owner = owner;
        this.gateway = gateway;
        this.builder = new WorkBundleBuilder(encoder);
        this.synchronizer = new WorkSynchronizer(gateway);
        this.deleter = new WorkDeleter(gateway);
        this.drClusterManifests = drClusterManifests;
    }

    /**
     * 소유자 기준 WorkBundle 이름 생성.
     *
     * @param bundleKind WorkBundle 종류 (예: "vrg")
     * @return 결정적 이름
     */
    public String buildBundleName(String bundleKind) {
        return NameFormatter.format(owner, bundleKind);
    }

    /**
     * WorkBundle 조회.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param name WorkBundle 이름
     * @param cluster 대상 위치
     * @return 원격 WorkBundle
     * @throws InvalidTargetException cluster가 비어 있는 경우
     * @throws BundleNotFoundException 존재하지 않는 경우
     * @throws WorkBundleFetchException 기타 조회 실패 시
     */
    public WorkBundle findBundle(OperationContext ctx, String name, String cluster) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        BundleKey key = BundleKey.of(name, cluster);
        ctx.checkActive("findBundle");
        try {
            return gateway.get(ctx, key);
        } catch (BundleNotFoundException | OperationCancelledException | DeadlineExceededException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new WorkBundleFetchException("findBundle", key, e);
        }
    }

    /**
     * 워크로드 WorkBundle 생성 또는 갱신.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param name 워크로드 이름
     * @param namespace 워크로드 네임스페이스
     * @param homeCluster 대상 클러스터
     * @param vrg 복제 상태 객체
     * @return convergence 결과
     * @throws IllegalArgumentException vrg가 null인 경우
     */
    public SyncOutcome createOrUpdateWorkloadBundle(OperationContext ctx, String name, String namespace,
                                                    String homeCluster, VolumeReplicationGroup vrg) {
        if (vrg == null) {
            throw new IllegalArgumentException("vrg cannot be null");
        }
        log.info("Create or update workload WorkBundle {}/{} on {}", namespace, name, homeCluster);

        WorkBundle bundle = builder.buildFromObjects(
            NameFormatter.format(name, namespace, NameFormatter.WORKLOAD_KIND),
            homeCluster,
            WORKLOAD_LABELS,
            List.of(vrg),
            owner
        );
        return synchronizer.converge(ctx, bundle);
    }

    /**
     * 네임스페이스 WorkBundle 생성 또는 갱신.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param name 소유 요청 이름
     * @param namespaceName 원격에 만들 네임스페이스 이름
     * @param clusterNamespace 대상 위치
     * @return convergence 결과
     */
    public SyncOutcome createOrUpdateNamespaceBundle(OperationContext ctx, String name, String namespaceName,
                                                     String clusterNamespace) {
        WorkBundle bundle = builder.buildFromObjects(
            NameFormatter.format(name, namespaceName, NameFormatter.NAMESPACE_KIND),
            clusterNamespace,
            Map.of(),
            List.of(Namespace.named(namespaceName)),
            owner
        );
        return synchronizer.converge(ctx, bundle);
    }

    /**
     * DR 클러스터 부트스트랩 WorkBundle 생성 또는 갱신.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param clusterName 대상 클러스터
     * @param deployment 오퍼레이터 배포 설정
     * @return convergence 결과
     * @throws com.ryuqq.workbundle.core.exception.ManifestEncodeException 내용 인코딩 실패 시 (원격 호출 없음)
     */
    public SyncOutcome createOrUpdateDrClusterBundle(OperationContext ctx, String clusterName,
                                                     DrClusterDeployment deployment) {
        List<ManifestObject> objects;
        WorkBundle bundle;
        try {
            objects = drClusterManifests.objects(deployment);
            bundle = builder.buildFromObjects(
                NameFormatter.DR_CLUSTER_BUNDLE_NAME, clusterName, Map.of(), objects, owner);
        } catch (WorkBundleException e) {
            log.error("Failed to generate DR cluster WorkBundle for {}", clusterName, e);
            throw e;
        }
        log.info("Create or update DR cluster WorkBundle on {} ({} manifests, automation={})",
            clusterName, objects.size(), deployment.deploymentAutomationEnabled());
        return synchronizer.converge(ctx, bundle);
    }

    /**
     * 대상 위치에서 소유자의 워크로드 WorkBundle 삭제.
     *
     * <p>네임스페이스 WorkBundle은 의도적으로 원격에 남겨둡니다.</p>
     *
     * @param ctx 취소/기한 컨텍스트
     * @param cluster 대상 위치
     * @return 워크로드 WorkBundle 삭제 결과
     */
    public Deleted deleteBundlesForCluster(OperationContext ctx, String cluster) {
        try {
            return deleter.deleteWorkloadBundle(ctx, owner, cluster);
        } catch (WorkBundleException e) {
            log.error("Failed to delete workload WorkBundle for {} in {}", owner, cluster, e);
            throw e;
        }
    }

    /**
     * 이름과 위치로 WorkBundle 삭제.
     *
     * @param ctx 취소/기한 컨텍스트
     * @param name WorkBundle 이름
     * @param cluster 대상 위치
     * @return 삭제 결과
     */
    public Deleted deleteBundle(OperationContext ctx, String name, String cluster) {
        return deleter.delete(ctx, name, cluster);
    }

    /**
     * 원격 WorkBundle이 적용 완료 상태인지 판정.
     *
     * @param bundle 원격에서 조회한 WorkBundle
     * @return 적용 완료 여부
     */
    public static boolean isApplied(WorkBundle bundle) {
        return StatusInterpreter.isApplied(bundle);
    }

    /**
     * 이 매니저의 소유자 조회.
     *
     * @return 소유자 (provenance 어노테이션과 이름 생성에 사용)
     */
    public OwnerRef owner() {
        return owner;
    }
}
