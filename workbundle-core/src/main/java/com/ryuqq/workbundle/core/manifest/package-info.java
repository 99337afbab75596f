/**
 * Closed family of domain objects that can be folded into a WorkBundle.
 *
 * <p>{@link com.ryuqq.workbundle.core.manifest.ManifestObject} is sealed; every variant is a record
 * with a fixed {@code apiVersion}/{@code kind} pair and a typed payload. A
 * {@link com.ryuqq.workbundle.core.spi.ManifestEncoder} turns a variant into an opaque
 * {@link com.ryuqq.workbundle.core.model.Manifest}.</p>
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.core.manifest;
