package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 조건부 갱신 시 resourceVersion이 일치하지 않는 경우.
 *
 * <p>조회 이후 다른 작성자가 WorkBundle을 변경했음을 의미합니다.
 * 엔진은 이 예외를 감싸지 않고 그대로 전파하며, 재시도 가능합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class BundleConflictException extends WorkBundleException {

    private final BundleKey key;
    private final String expectedVersion;
    private final String actualVersion;

    public BundleConflictException(BundleKey key, String expectedVersion, String actualVersion) {
        super(ErrorCode.BUNDLE_CONFLICT, String.format(
            "WorkBundle %s was modified concurrently: expected version %s but found %s",
            key, expectedVersion, actualVersion));
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public BundleKey getKey() {
        return key;
    }

    public String getExpectedVersion() {
        return expectedVersion;
    }

    public String getActualVersion() {
        return actualVersion;
    }
}
