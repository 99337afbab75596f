package com.ryuqq.workbundle.core.manifest;

/**
 * 오퍼레이터 구독 설정.
 *
 * @param catalogSource 카탈로그 소스 이름
 * @param catalogSourceNamespace 카탈로그 소스 네임스페이스
 * @param name 설치할 패키지 이름
 * @param channel 구독 채널
 * @param startingCSV 시작 ClusterServiceVersion 이름
 * @param installPlanApproval 설치 계획 승인 방식 (예: "Automatic")
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record SubscriptionSpec(
    String catalogSource,
    String catalogSourceNamespace,
    String name,
    String channel,
    String startingCSV,
    String installPlanApproval
) {

    /**
     * 자동 승인 설치 계획.
     */
    public static final String AUTOMATIC = "Automatic";

    public SubscriptionSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("package name cannot be null or blank");
        }
    }
}
