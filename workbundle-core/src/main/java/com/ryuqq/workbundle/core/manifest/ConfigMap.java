package com.ryuqq.workbundle.core.manifest;

import java.util.Map;

/**
 * 문자열 키/값 설정 데이터.
 *
 * @param metadata 메타데이터
 * @param data 설정 데이터
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record ConfigMap(
    ObjectMeta metadata,
    Map<String, String> data
) implements ManifestObject {

    public static final String API_VERSION = "v1";
    public static final String KIND = "ConfigMap";

    public ConfigMap {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        data = data == null ? Map.of() : Map.copyOf(data);
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
