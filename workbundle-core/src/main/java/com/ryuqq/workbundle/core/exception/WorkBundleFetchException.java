package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * WorkBundle 조회 실패.
 *
 * <p>실패한 작업 이름과 대상 WorkBundle의 이름/위치를 메시지에 포함하고,
 * 원인 예외를 보존합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class WorkBundleFetchException extends WorkBundleException {

    private final String operation;
    private final BundleKey key;

    public WorkBundleFetchException(String operation, BundleKey key, Throwable cause) {
        super(ErrorCode.BUNDLE_FETCH_FAILED, String.format(
            "%s: failed to fetch WorkBundle %s in %s", operation, key.name(), key.location()), cause);
        this.operation = operation;
        this.key = key;
    }

    public String getOperation() {
        return operation;
    }

    public BundleKey getKey() {
        return key;
    }
}
