package com.ryuqq.workbundle.application.drcluster;

/**
 * 오퍼레이터 리더 선출 설정.
 *
 * @param leaderElect 리더 선출 사용 여부
 * @param resourceName 선출에 사용할 리소스 이름
 * @param resourceNamespace 선출 리소스 네임스페이스 (null이면 오퍼레이터 네임스페이스)
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record LeaderElection(
    boolean leaderElect,
    String resourceName,
    String resourceNamespace
) {

    public LeaderElection {
        if (resourceName == null || resourceName.isBlank()) {
            throw new IllegalArgumentException("resourceName cannot be null or blank");
        }
    }

    /**
     * resourceName만 변경한 새 인스턴스 생성.
     *
     * @param resourceName 새 리소스 이름
     * @return 새 LeaderElection 인스턴스
     */
    public LeaderElection withResourceName(String resourceName) {
        return new LeaderElection(this.leaderElect, resourceName, this.resourceNamespace);
    }
}
