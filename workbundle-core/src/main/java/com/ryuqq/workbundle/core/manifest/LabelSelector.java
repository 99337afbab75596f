package com.ryuqq.workbundle.core.manifest;

import java.util.Map;

/**
 * 라벨 일치 조건.
 *
 * @param matchLabels 모두 일치해야 하는 라벨
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record LabelSelector(Map<String, String> matchLabels) {

    public LabelSelector {
        matchLabels = matchLabels == null ? Map.of() : Map.copyOf(matchLabels);
    }
}
