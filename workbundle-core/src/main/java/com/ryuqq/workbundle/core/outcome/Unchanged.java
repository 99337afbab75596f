package com.ryuqq.workbundle.core.outcome;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 변경 없음 결과.
 *
 * <p>원격 WorkBundle의 Manifest 목록이 원하는 목록과 순서까지 동일하여
 * 쓰기를 수행하지 않았음을 나타냅니다.</p>
 *
 * @param key 대상 WorkBundle 키
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Unchanged(BundleKey key) implements SyncOutcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Unchanged {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
