/**
 * Jackson-backed manifest encoding.
 *
 * @since 1.0.0
 * @author WorkBundle Team
 */
package com.ryuqq.workbundle.application.encoding;
