package com.ryuqq.workbundle.core.manifest;

/**
 * 바인딩이 참조하는 역할.
 *
 * @param apiGroup 역할의 API 그룹
 * @param kind 역할 종류 (예: "ClusterRole")
 * @param name 역할 이름
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record RoleRef(
    String apiGroup,
    String kind,
    String name
) {

    public RoleRef {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    /**
     * ClusterRole 참조 생성.
     *
     * @param name ClusterRole 이름
     * @return RoleRef
     */
    public static RoleRef clusterRole(String name) {
        return new RoleRef(ClusterRole.API_GROUP, ClusterRole.KIND, name);
    }
}
