/**
 * 스냅샷과 스테이징 디렉토리 정리 결과 타입.
 */
package com.ryuqq.contentflow.core.cleanup;
