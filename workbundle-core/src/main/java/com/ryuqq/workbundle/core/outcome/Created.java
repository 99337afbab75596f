package com.ryuqq.workbundle.core.outcome;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 생성 결과.
 *
 * <p>원격 저장소에 WorkBundle이 없어 새로 생성했음을 나타냅니다.</p>
 *
 * @param key 대상 WorkBundle 키
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Created(BundleKey key) implements SyncOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Created {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
