package com.ryuqq.workbundle.core.manifest;

import java.util.List;

/**
 * 권한 규칙 한 건.
 *
 * @param apiGroups 대상 API 그룹
 * @param resources 대상 리소스
 * @param verbs 허용 동작
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public record PolicyRule(
    List<String> apiGroups,
    List<String> resources,
    List<String> verbs
) {

    public PolicyRule {
        apiGroups = apiGroups == null ? List.of() : List.copyOf(apiGroups);
        resources = resources == null ? List.of() : List.copyOf(resources);
        verbs = verbs == null ? List.of() : List.copyOf(verbs);
    }
}
