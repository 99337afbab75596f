package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 버전 토큰 없이 갱신을 시도한 경우.
 *
 * <p>조회한 WorkBundle에 resourceVersion이 없으면 조건부 갱신을 할 수 없으므로
 * 갱신 요청을 보내지 않고 실패합니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class UnconditionalWriteException extends WorkBundleException {

    private final BundleKey key;

    public UnconditionalWriteException(BundleKey key) {
        super(ErrorCode.UNCONDITIONAL_WRITE,
            "Refusing to update WorkBundle " + key + " without a resourceVersion");
        this.key = key;
    }

    public BundleKey getKey() {
        return key;
    }
}
