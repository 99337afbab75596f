package com.ryuqq.workbundle.application.encoding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.workbundle.core.exception.ManifestEncodeException;
import com.ryuqq.workbundle.core.manifest.ManifestObject;
import com.ryuqq.workbundle.core.model.Manifest;
import com.ryuqq.workbundle.core.spi.ManifestEncoder;

/**
 * Jackson 기반 ManifestEncoder 구현체.
 *
 * <p>출력 형식: {@code {"apiVersion":..,"kind":..,<record fields>}}</p>
 * <ul>
 *   <li>apiVersion, kind가 항상 맨 앞에 위치</li>
 *   <li>null 필드는 생략</li>
 *   <li>Map 항목은 키 순서로 정렬</li>
 * </ul>
 *
 * <p>같은 객체는 항상 같은 텍스트로 인코딩되므로, convergence 시
 * Manifest 문자 단위 비교가 의미를 가집니다.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public final class JacksonManifestEncoder implements ManifestEncoder {

    private static final String API_VERSION_FIELD = "apiVersion";
    private static final String KIND_FIELD = "kind";

    private final ObjectMapper mapper;

    /**
     * 기본 ObjectMapper 설정으로 생성.
     */
    public JacksonManifestEncoder() {
        this(defaultMapper());
    }

    /**
     * 지정된 ObjectMapper로 생성.
     *
     * @param mapper 직렬화에 사용할 ObjectMapper
     * @throws IllegalArgumentException mapper가 null인 경우
     */
    public JacksonManifestEncoder(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 결정적 출력을 위한 기본 ObjectMapper.
     *
     * @return NON_NULL, ORDER_MAP_ENTRIES_BY_KEYS가 설정된 ObjectMapper
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
            .findAndRegisterModules()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public Manifest encode(ManifestObject object) {
        if (object == null) {
            throw new IllegalArgumentException("object cannot be null");
        }

        try {
            ObjectNode node = mapper.createObjectNode();
            node.put(API_VERSION_FIELD, object.apiVersion());
            node.put(KIND_FIELD, object.kind());

            JsonNode body = mapper.valueToTree(object);
            if (body instanceof ObjectNode fields) {
                node.setAll(fields);
            }

            return Manifest.of(object.apiVersion(), object.kind(), mapper.writeValueAsString(node));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ManifestEncodeException(object.kind(), e);
        }
    }

    @Override
    public <T extends ManifestObject> T decode(Manifest manifest, Class<T> type) {
        if (manifest == null) {
            throw new IllegalArgumentException("manifest cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }

        ObjectNode node = readObject(manifest);
        String payloadKind = node.path(KIND_FIELD).asText("");
        if (!manifest.getKind().equals(payloadKind)) {
            throw new ManifestEncodeException(manifest.getKind(),
                "Manifest kind " + manifest.getKind() + " does not match payload kind " + payloadKind);
        }
        node.remove(API_VERSION_FIELD);
        node.remove(KIND_FIELD);

        T value;
        try {
            value = mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ManifestEncodeException(manifest.getKind(), e);
        }

        if (!value.kind().equals(payloadKind)) {
            throw new ManifestEncodeException(manifest.getKind(),
                "Cannot decode " + payloadKind + " as " + type.getSimpleName());
        }
        return value;
    }

    private ObjectNode readObject(Manifest manifest) {
        JsonNode tree;
        try {
            tree = mapper.readTree(manifest.getRaw());
        } catch (JsonProcessingException e) {
            throw new ManifestEncodeException(manifest.getKind(), e);
        }
        if (!(tree instanceof ObjectNode)) {
            throw new ManifestEncodeException(manifest.getKind(), "Manifest payload is not a JSON object");
        }
        return (ObjectNode) tree;
    }
}
