package com.ryuqq.workbundle.application.drcluster;

import java.util.List;

/**
 * 오퍼레이터 관리자 설정 (불변 record).
 *
 * <p>허브 측 설정을 기반으로, 원격 DR 클러스터 오퍼레이터용 설정을
 * {@link #forDrCluster()}로 파생합니다. 파생된 설정은 YAML로 직렬화되어
 * ConfigMap에 담깁니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>ramenControllerType: 컨트롤러 종류 (허브 "dr-hub", 원격 "dr-cluster")</li>
 *   <li>leaderElection: 리더 선출 설정</li>
 *   <li>metricsBindAddress: 메트릭 노출 주소 (기본 "127.0.0.1:9289")</li>
 *   <li>healthProbeBindAddress: 헬스 체크 주소 (기본 ":8081")</li>
 *   <li>s3StoreProfiles: S3 프로파일 목록</li>
 * </ul>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 * @param ramenControllerType 컨트롤러 종류
 * @param leaderElection 리더 선출 설정
 * @param metricsBindAddress 메트릭 노출 주소
 * @param healthProbeBindAddress 헬스 체크 주소
 * @param s3StoreProfiles S3 프로파일 목록
 */
public record OperatorConfig(
    String ramenControllerType,
    LeaderElection leaderElection,
    String metricsBindAddress,
    String healthProbeBindAddress,
    List<S3StoreProfile> s3StoreProfiles
) {

    public static final String HUB_CONTROLLER_TYPE = "dr-hub";
    public static final String DR_CLUSTER_CONTROLLER_TYPE = "dr-cluster";
    public static final String HUB_LEADER_ELECTION_RESOURCE = "hub.ramendr.openshift.io";
    public static final String DR_CLUSTER_LEADER_ELECTION_RESOURCE = "dr-cluster.ramendr.openshift.io";

    /**
     * 기본 허브 설정 생성자.
     */
    public OperatorConfig() {
        this(
            HUB_CONTROLLER_TYPE,
            new LeaderElection(true, HUB_LEADER_ELECTION_RESOURCE, null),
            "127.0.0.1:9289",
            ":8081",
            List.of()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필수 값이 없는 경우
     */
    public OperatorConfig {
        if (ramenControllerType == null || ramenControllerType.isBlank()) {
            throw new IllegalArgumentException("ramenControllerType cannot be null or blank");
        }
        if (leaderElection == null) {
            throw new IllegalArgumentException("leaderElection cannot be null");
        }
        s3StoreProfiles = s3StoreProfiles == null ? List.of() : List.copyOf(s3StoreProfiles);
    }

    /**
     * 원격 DR 클러스터용 설정 파생.
     *
     * <p>리더 선출 리소스 이름과 컨트롤러 종류만 바뀌고 나머지는 그대로 유지됩니다.</p>
     *
     * @return DR 클러스터용 OperatorConfig
     */
    public OperatorConfig forDrCluster() {
        return new OperatorConfig(
            DR_CLUSTER_CONTROLLER_TYPE,
            leaderElection.withResourceName(DR_CLUSTER_LEADER_ELECTION_RESOURCE),
            metricsBindAddress,
            healthProbeBindAddress,
            s3StoreProfiles
        );
    }

    /**
     * s3StoreProfiles만 변경한 새 인스턴스 생성.
     *
     * @param s3StoreProfiles 새 S3 프로파일 목록
     * @return 새 OperatorConfig 인스턴스
     */
    public OperatorConfig withS3StoreProfiles(List<S3StoreProfile> s3StoreProfiles) {
        return new OperatorConfig(ramenControllerType, leaderElection, metricsBindAddress,
            healthProbeBindAddress, s3StoreProfiles);
    }
}
