package com.ryuqq.workbundle.core.manifest;

import java.util.List;

/**
 * 클러스터 범위 역할.
 *
 * @param metadata 메타데이터
 * @param rules 권한 규칙
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record ClusterRole(
    ObjectMeta metadata,
    List<PolicyRule> rules
) implements ManifestObject {

    static final String API_GROUP = "rbac.authorization.k8s.io";
    public static final String API_VERSION = API_GROUP + "/v1";
    public static final String KIND = "ClusterRole";

    public ClusterRole {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    @Override
    public String apiVersion() {
        return API_VERSION;
    }

    @Override
    public String kind() {
        return KIND;
    }
}
