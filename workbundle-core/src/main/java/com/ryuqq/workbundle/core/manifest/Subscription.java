package com.ryuqq.workbundle.core.manifest;

/**
 * 오퍼레이터 구독.
 *
 * @param metadata 메타데이터
 * @param spec 구독 설정
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Subscription(
    ObjectMeta metadata,
    SubscriptionSpec spec
) implements ManifestObject {

    public static final String API_VERSION = "operators.coreos.com/v1alpha1";
    public static final String KIND = "Subscription";

    public Subscription {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (spec == null) {
            throw new IllegalArgumentException("spec cannot be null");
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
