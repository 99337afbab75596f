package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * WorkBundle 생성/갱신/삭제 실패.
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class WorkBundleWriteException extends WorkBundleException {

    private final String operation;
    private final BundleKey key;

    public WorkBundleWriteException(String operation, BundleKey key, Throwable cause) {
        super(ErrorCode.BUNDLE_WRITE_FAILED, String.format(
            "%s: failed to write WorkBundle %s in %s", operation, key.name(), key.location()), cause);
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
