/**
 * Service Provider Interfaces of the WorkBundle engine.
 *
 * <h2>SPIs</h2>
 * <ul>
 *   <li>{@link com.ryuqq.workbundle.core.spi.RemoteStoreGateway} - conditional-write access to remote WorkBundles</li>
 *   <li>{@link com.ryuqq.workbundle.core.spi.ManifestEncoder} - deterministic object serialization</li>
 * </ul>
 *
 * <p>Reference implementations live in {@code workbundle-adapter-inmemory} and
 * {@code workbundle-application}; contract tests live in {@code workbundle-testkit}.</p>
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.core.spi;
