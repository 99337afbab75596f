package com.ryuqq.workbundle.core.exception;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 원격 저장소에 WorkBundle이 존재하지 않는 경우.
 *
 * <p>엔진 내부에서는 정상 흐름(생성 분기, 삭제 no-op)으로 처리됩니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public class BundleNotFoundException extends WorkBundleException {

    private final BundleKey key;

    public BundleNotFoundException(BundleKey key) {
        super(ErrorCode.BUNDLE_NOT_FOUND, "WorkBundle not found: " + key);
        this.key = key;
    }

    public BundleKey getKey() {
        return key;
    }
}
