package com.ryuqq.workbundle.core.manifest;

/**
 * 권한 바인딩 대상.
 *
 * @param kind 대상 종류 (예: "ServiceAccount")
 * @param name 대상 이름
 * @param namespace 대상 네임스페이스
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Subject(
    String kind,
    String name,
    String namespace
) {

    public Subject {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    /**
     * ServiceAccount 대상 생성.
     *
     * @param name ServiceAccount 이름
     * @param namespace ServiceAccount 네임스페이스
     * @return Subject
     */
    public static Subject serviceAccount(String name, String namespace) {
        return new Subject("ServiceAccount", name, namespace);
    }
}
