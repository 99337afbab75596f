package com.ryuqq.workbundle.application.drcluster;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.ryuqq.workbundle.core.exception.ManifestEncodeException;
import com.ryuqq.workbundle.core.manifest.ClusterRole;
import com.ryuqq.workbundle.core.manifest.ClusterRoleBinding;
import com.ryuqq.workbundle.core.manifest.ConfigMap;
import com.ryuqq.workbundle.core.manifest.ManifestObject;
import com.ryuqq.workbundle.core.manifest.Namespace;
import com.ryuqq.workbundle.core.manifest.ObjectMeta;
import com.ryuqq.workbundle.core.manifest.OperatorGroup;
import com.ryuqq.workbundle.core.manifest.PolicyRule;
import com.ryuqq.workbundle.core.manifest.RoleBinding;
import com.ryuqq.workbundle.core.manifest.RoleRef;
import com.ryuqq.workbundle.core.manifest.Subject;
import com.ryuqq.workbundle.core.manifest.Subscription;
import com.ryuqq.workbundle.core.manifest.SubscriptionSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * DR 클러스터 부트스트랩 WorkBundle 내용 생성기.
 *
 * <p>원격 클러스터의 작업 에이전트가 복제 객체와 오퍼레이터 그룹을 다룰 수 있도록
 * 권한을 부여하고, 자동 배포가 활성화된 경우 오퍼레이터 설치 객체를 추가합니다.</p>
 *
 * <p><strong>적용 순서:</strong></p>
 * <pre>
 * 1. VRG ClusterRole
 * 2. VRG ClusterRoleBinding
 * (자동 배포 활성화 시)
 * 3. 오퍼레이터 Namespace
 * 4. OLM ClusterRole
 * 5. OLM RoleBinding
 * 6. OperatorGroup
 * 7. Subscription
 * 8. 오퍼레이터 설정 ConfigMap
 * </pre>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class DrClusterManifests {

    public static final String VRG_ROLE_NAME = "open-cluster-management:klusterlet-work-sa:agent:volrepgroup-edit";
    public static final String OLM_ROLE_NAME = "open-cluster-management:klusterlet-work-sa:agent:olm-edit";
    public static final String WORK_AGENT_SERVICE_ACCOUNT = "klusterlet-work-sa";
    public static final String WORK_AGENT_NAMESPACE = "open-cluster-management-agent";
    public static final String OPERATOR_GROUP_NAME = "ramen-operator-group";
    public static final String SUBSCRIPTION_NAME = "ramen-dr-cluster-subscription";
    public static final String CONFIG_MAP_NAME = "ramen-dr-cluster-operator-config";
    public static final String CONFIG_MAP_KEY = "ramen_manager_config.yaml";

    private static final List<String> EDIT_VERBS = List.of("create", "get", "list", "update", "delete");

    private final ObjectMapper yamlMapper;

    /**
     * 기본 YAML 매퍼로 생성.
     */
    public DrClusterManifests() {
        this(defaultYamlMapper());
    }

    /**
     * 지정된 YAML 매퍼로 생성.
     *
     * @param yamlMapper 설정 직렬화에 사용할 매퍼
     */
    public DrClusterManifests(ObjectMapper yamlMapper) {
        if (yamlMapper == null) {
            throw new IllegalArgumentException("yamlMapper cannot be null");
        }
        this.yamlMapper = yamlMapper;
    }

    /**
     * 문서 시작 표시 없이 null 필드를 생략하는 YAML 매퍼.
     *
     * @return YAML ObjectMapper
     */
    public static ObjectMapper defaultYamlMapper() {
        return new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
            .findAndRegisterModules()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    /**
     * 부트스트랩 WorkBundle에 담길 객체 목록 (적용 순서).
     *
     * @param deployment 배포 설정
     * @return 자동 배포 비활성화 시 2개, 활성화 시 8개의 객체
     * @throws ManifestEncodeException 오퍼레이터 설정 YAML 직렬화 실패 시
     */
    public List<ManifestObject> objects(DrClusterDeployment deployment) {
        if (deployment == null) {
            throw new IllegalArgumentException("deployment cannot be null");
        }

        List<ManifestObject> objects = new ArrayList<>();
        objects.add(vrgClusterRole());
        objects.add(vrgClusterRoleBinding());

        if (deployment.deploymentAutomationEnabled()) {
            String namespace = deployment.namespaceName();
            ConfigMap configMap = configMap(namespace, deployment.hubConfig());

            objects.add(Namespace.named(namespace));
            objects.add(olmClusterRole());
            objects.add(olmRoleBinding(namespace));
            objects.add(operatorGroup(namespace));
            objects.add(subscription(deployment));
            objects.add(configMap);
        }
        return objects;
    }

    public ClusterRole vrgClusterRole() {
        return new ClusterRole(
            ObjectMeta.clusterScoped(VRG_ROLE_NAME),
            List.of(new PolicyRule(List.of("ramendr.openshift.io"), List.of("volumereplicationgroups"), EDIT_VERBS))
        );
    }

    public ClusterRoleBinding vrgClusterRoleBinding() {
        return new ClusterRoleBinding(
            ObjectMeta.clusterScoped(VRG_ROLE_NAME),
            List.of(Subject.serviceAccount(WORK_AGENT_SERVICE_ACCOUNT, WORK_AGENT_NAMESPACE)),
            RoleRef.clusterRole(VRG_ROLE_NAME)
        );
    }

    public ClusterRole olmClusterRole() {
        return new ClusterRole(
            ObjectMeta.clusterScoped(OLM_ROLE_NAME),
            List.of(new PolicyRule(List.of("operators.coreos.com"), List.of("operatorgroups"), EDIT_VERBS))
        );
    }

    public RoleBinding olmRoleBinding(String namespace) {
        return new RoleBinding(
            ObjectMeta.namespaced(OLM_ROLE_NAME, namespace),
            List.of(Subject.serviceAccount(WORK_AGENT_SERVICE_ACCOUNT, WORK_AGENT_NAMESPACE)),
            RoleRef.clusterRole(OLM_ROLE_NAME)
        );
    }

    public OperatorGroup operatorGroup(String namespace) {
        return new OperatorGroup(ObjectMeta.namespaced(OPERATOR_GROUP_NAME, namespace));
    }

    public Subscription subscription(DrClusterDeployment deployment) {
        return new Subscription(
            ObjectMeta.namespaced(SUBSCRIPTION_NAME, deployment.namespaceName()),
            new SubscriptionSpec(
                deployment.catalogSourceName(),
                deployment.catalogSourceNamespaceName(),
                deployment.packageName(),
                deployment.channelName(),
                deployment.clusterServiceVersionName(),
                SubscriptionSpec.AUTOMATIC
            )
        );
    }

    /**
     * DR 클러스터용 오퍼레이터 설정 ConfigMap.
     *
     * @param namespace 오퍼레이터 네임스페이스
     * @param hubConfig 허브 측 설정 (DR 클러스터용으로 파생하여 사용)
     * @return 단일 키 {@value #CONFIG_MAP_KEY}를 가진 ConfigMap
     * @throws ManifestEncodeException YAML 직렬화 실패 시
     */
    public ConfigMap configMap(String namespace, OperatorConfig hubConfig) {
        if (hubConfig == null) {
            throw new IllegalArgumentException("hubConfig cannot be null");
        }

        String yaml;
        try {
            yaml = yamlMapper.writeValueAsString(hubConfig.forDrCluster());
        } catch (JsonProcessingException e) {
            throw new ManifestEncodeException(ConfigMap.KIND, e);
        }

        return new ConfigMap(ObjectMeta.namespaced(CONFIG_MAP_NAME, namespace), Map.of(CONFIG_MAP_KEY, yaml));
    }
}
