/**
 * Core domain model of the WorkBundle engine.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.model.Manifest} - opaque typed payload</li>
 *   <li>{@link com.ryuqq.workbundle.core.model.WorkBundle} - unit of remote delivery</li>
 *   <li>{@link com.ryuqq.workbundle.core.model.BundleKey} - remote lookup key (name, location)</li>
 *   <li>{@link com.ryuqq.workbundle.core.model.OwnerRef} - owning request identity</li>
 *   <li>{@link com.ryuqq.workbundle.core.model.Condition} - remote status report</li>
 * </ul>
 *
 * <h2>Predicates</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.model.ManifestSequences} - ordered manifest sequence equality</li>
 * </ul>
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.core.model;
