package com.ryuqq.workbundle.application.drcluster;

/**
 * DR 클러스터 오퍼레이터 배포 설정 (불변 record).
 *
 * <p>{@code deploymentAutomationEnabled}가 false이면 부트스트랩 WorkBundle에는
 * 권한 객체만 포함되고, true이면 오퍼레이터 설치 객체까지 포함됩니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 * @param channelName 구독 채널
 * @param packageName 오퍼레이터 패키지 이름
 * @param namespaceName 오퍼레이터 설치 네임스페이스
 * @param catalogSourceName 카탈로그 소스 이름
 * @param catalogSourceNamespaceName 카탈로그 소스 네임스페이스
 * @param clusterServiceVersionName 시작 ClusterServiceVersion
 * @param deploymentAutomationEnabled 오퍼레이터 자동 배포 여부
 * @param hubConfig 허브 측 오퍼레이터 설정
 */
public record DrClusterDeployment(
    String channelName,
    String packageName,
    String namespaceName,
    String catalogSourceName,
    String catalogSourceNamespaceName,
    String clusterServiceVersionName,
    boolean deploymentAutomationEnabled,
    OperatorConfig hubConfig
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: channel=alpha, package=ramen-dr-cluster-operator, namespace=ramen-system,
     * catalogSource=ramen-catalog (openshift-marketplace), 자동 배포 비활성화</p>
     */
    public DrClusterDeployment() {
        this(
            "alpha",
            "ramen-dr-cluster-operator",
            "ramen-system",
            "ramen-catalog",
            "openshift-marketplace",
            "ramen-dr-cluster-operator.v0.0.1",
            false,
            new OperatorConfig()
        );
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 필수 값이 없는 경우
     */
    public DrClusterDeployment {
        requireText(channelName, "channelName");
        requireText(packageName, "packageName");
        requireText(namespaceName, "namespaceName");
        requireText(catalogSourceName, "catalogSourceName");
        requireText(catalogSourceNamespaceName, "catalogSourceNamespaceName");
        requireText(clusterServiceVersionName, "clusterServiceVersionName");
        if (hubConfig == null) {
            throw new IllegalArgumentException("hubConfig cannot be null");
        }
    }

    /**
     * deploymentAutomationEnabled만 변경한 새 인스턴스 생성.
     *
     * @param enabled 자동 배포 여부
     * @return 새 DrClusterDeployment 인스턴스
     */
    public DrClusterDeployment withDeploymentAutomationEnabled(boolean enabled) {
        return new DrClusterDeployment(channelName, packageName, namespaceName, catalogSourceName,
            catalogSourceNamespaceName, clusterServiceVersionName, enabled, hubConfig);
    }

    /**
     * namespaceName만 변경한 새 인스턴스 생성.
     *
     * @param namespaceName 새 설치 네임스페이스
     * @return 새 DrClusterDeployment 인스턴스
     */
    public DrClusterDeployment withNamespaceName(String namespaceName) {
        return new DrClusterDeployment(channelName, packageName, namespaceName, catalogSourceName,
            catalogSourceNamespaceName, clusterServiceVersionName, deploymentAutomationEnabled, hubConfig);
    }

    /**
     * hubConfig만 변경한 새 인스턴스 생성.
     *
     * @param hubConfig 새 허브 설정
     * @return 새 DrClusterDeployment 인스턴스
     */
    public DrClusterDeployment withHubConfig(OperatorConfig hubConfig) {
        return new DrClusterDeployment(channelName, packageName, namespaceName, catalogSourceName,
            catalogSourceNamespaceName, clusterServiceVersionName, deploymentAutomationEnabled, hubConfig);
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be null or blank");
        }
    }
}
