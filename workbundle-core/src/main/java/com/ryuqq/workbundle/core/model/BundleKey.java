package com.ryuqq.workbundle.core.model;

import com.ryuqq.workbundle.core.exception.InvalidTargetException;

/**
 * 원격 저장소에서 WorkBundle을 찾기 위한 유일한 키 (name, location).
 *
 * <p>보조 인덱스가 없으므로 이 키가 WorkBundle을 다시 찾을 수 있는 유일한 수단입니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>name: null 또는 빈 문자열 불가 ({@link IllegalArgumentException})</li>
 *   <li>location: null 또는 빈 문자열 불가 ({@link InvalidTargetException})</li>
 * </ul>
 *
 * @param name WorkBundle 이름
 * @param location 대상 클러스터/네임스페이스 식별자
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record BundleKey(
    String name,
    String location
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 빈 문자열인 경우
     * @throws InvalidTargetException location이 null이거나 빈 문자열인 경우
     */
    public BundleKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("bundle name cannot be null or blank");
        }
        if (location == null || location.isBlank()) {
            throw new InvalidTargetException(name);
        }
    }

    /**
     * BundleKey 생성.
     *
     * @param name WorkBundle 이름
     * @param location 대상 위치
     * @return BundleKey 인스턴스
     */
    public static BundleKey of(String name, String location) {
        return new BundleKey(name, location);
    }

    @Override
    public String toString() {
        return location + "/" + name;
    }
}
