package com.ryuqq.workbundle.core.model;

import java.util.Objects;

/**
 * 도메인 객체 하나의 직렬화된 형태 (불투명 payload).
 *
 * <p>Manifest는 타입 구분자(apiVersion, kind)와 객체 전체 상태의 직렬화 텍스트(raw)로 구성되며,
 * 엔진은 payload의 필드를 해석하지 않고 blob 단위로만 비교합니다.</p>
 *
 * <p><strong>동등성:</strong> apiVersion, kind, raw가 모두 정확히 일치해야 동일합니다
 * (raw는 문자 단위 비교).</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class Manifest {

    private final String apiVersion;
    private final String kind;
    private final String raw;

    private Manifest(String apiVersion, String kind, String raw) {
        if (apiVersion == null || apiVersion.isBlank()) {
            throw new IllegalArgumentException("apiVersion cannot be null or blank");
        }
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (raw == null || raw.isEmpty()) {
            throw new IllegalArgumentException("raw cannot be null or empty");
        }
        this.apiVersion = apiVersion;
        this.kind = kind;
        this.raw = raw;
    }

    /**
     * Manifest 생성.
     *
     * @param apiVersion API 버전 (예: v1, rbac.authorization.k8s.io/v1)
     * @param kind 객체 종류 (예: Namespace, ClusterRole)
     * @param raw 직렬화된 객체 전체 (JSON)
     * @return Manifest 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static Manifest of(String apiVersion, String kind, String raw) {
        return new Manifest(apiVersion, kind, raw);
    }

    /**
     * API 버전 조회.
     *
     * @return API 버전
     */
    public String getApiVersion() {
        return apiVersion;
    }

    /**
     * 객체 종류(타입 구분자) 조회.
     *
     * @return kind
     */
    public String getKind() {
        return kind;
    }

    /**
     * 직렬화된 payload 조회.
     *
     * @return raw payload
     */
    public String getRaw() {
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Manifest manifest = (Manifest) o;
        return apiVersion.equals(manifest.apiVersion)
            && kind.equals(manifest.kind)
            && raw.equals(manifest.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, kind, raw);
    }

    @Override
    public String toString() {
        return "Manifest{" + apiVersion + "/" + kind + ", " + raw.length() + " chars}";
    }
}
