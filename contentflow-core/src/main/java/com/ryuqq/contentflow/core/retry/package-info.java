/**
 * 리서치 단계 재시도 정책과 백오프 계산.
 */
package com.ryuqq.contentflow.core.retry;
