package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 생성하려는 WorkBundle이 이미 존재하는 경우.
 *
 * <p>동시 생성 경쟁에서 발생하며, converge는 재조회 후 비교/갱신 분기로 이어갑니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class BundleAlreadyExistsException extends WorkBundleException {

    private final BundleKey key;

    public BundleAlreadyExistsException(BundleKey key) {
        super(ErrorCode.BUNDLE_ALREADY_EXISTS, "WorkBundle already exists: " + key);
        this.key = key;
    }

    public BundleKey getKey() {
        return key;
    }
}
