package com.ryuqq.workbundle.core.spi;

import com.ryuqq.workbundle.core.exception.ManifestEncodeException;
import com.ryuqq.workbundle.core.manifest.ManifestObject;
import com.ryuqq.workbundle.core.model.Manifest;

/**
 * Serializes domain objects into opaque {@link Manifest} payloads.
 *
 * <p>Implementations must be deterministic: two equal objects always encode to the same
 * {@code raw} text, since convergence compares payloads bit-for-bit.</p>
 *
 * @author WorkBundle Team
 * @since 1.0.0
 */
public interface ManifestEncoder {

    /**
     * Encodes one object.
     *
     * @param object object to encode
     * @return manifest carrying apiVersion, kind and the full serialized state
     * @throws ManifestEncodeException if the object cannot be serialized
     * @throws IllegalArgumentException if object is null
     */
    Manifest encode(ManifestObject object);

    /**
     * Decodes a manifest back into its typed variant.
     *
     * @param manifest manifest to decode
     * @param type expected variant type
     * @param <T> variant type
     * @return decoded object
     * @throws ManifestEncodeException if the kind does not match or the payload is malformed
     */
    <T extends ManifestObject> T decode(Manifest manifest, Class<T> type);
}
