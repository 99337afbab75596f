package com.ryuqq.workbundle.core.outcome;

import com.ryuqq.workbundle.core.model.BundleKey;

/**
 * 삭제 결과.
 *
 * <p>삭제는 멱등입니다. 대상이 이미 없었다면 {@code existed}가 false이며
 * 원격 삭제 요청은 전송되지 않습니다.</p>
 *
 * @param key 대상 WorkBundle 키
 * @param existed 삭제 요청 시점에 원격에 존재했는지 여부
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record Deleted(BundleKey key, boolean existed) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException key가 null인 경우
     */
    public Deleted {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }
}
