/**
 * 커밋된 아티클의 외부 발행 (best-effort).
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.core.publish;
