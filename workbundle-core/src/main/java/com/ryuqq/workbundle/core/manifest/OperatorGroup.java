package com.ryuqq.workbundle.core.manifest;

/**
 * 오퍼레이터 그룹.
 *
 * @param metadata 메타데이터
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record OperatorGroup(ObjectMeta metadata) implements ManifestObject {

    public static final String API_VERSION = "operators.coreos.com/v1";
    public static final String KIND = "OperatorGroup";

    public OperatorGroup {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
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
