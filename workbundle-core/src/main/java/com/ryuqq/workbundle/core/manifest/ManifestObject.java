package com.ryuqq.workbundle.core.manifest;

/**
 * WorkBundle에 담길 수 있는 도메인 객체의 닫힌 변형 집합.
 *
 * <p>각 변형은 자신의 타입이 정해진 payload와 공통 {@link ObjectMeta}를 가지며,
 * {@link #apiVersion()}과 {@link #kind()}는 변형마다 고정되어 있습니다.
 * 인코딩 시 이 두 값이 Manifest의 타입 식별자가 됩니다.</p>
 *
 * <p><strong>변형 목록:</strong></p>
 * <ul>
 *   <li>{@link ClusterRole}, {@link ClusterRoleBinding}, {@link RoleBinding}: 권한</li>
 *   <li>{@link Namespace}: 원격 네임스페이스</li>
 *   <li>{@link OperatorGroup}, {@link Subscription}: 오퍼레이터 설치</li>
 *   <li>{@link ConfigMap}: 설정 데이터</li>
 *   <li>{@link VolumeReplicationGroup}: 워크로드 복제 상태</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public sealed interface ManifestObject
    permits ClusterRole, ClusterRoleBinding, RoleBinding, Namespace,
            OperatorGroup, Subscription, ConfigMap, VolumeReplicationGroup {

    /**
     * API 버전 (예: "v1", "rbac.authorization.k8s.io/v1").
     *
     * @return API 버전
     */
    String apiVersion();

    /**
     * 객체 종류 (예: "Namespace").
     *
     * @return 종류
     */
    String kind();

    /**
     * 공통 메타데이터.
     *
     * @return ObjectMeta
     */
    ObjectMeta metadata();
}
