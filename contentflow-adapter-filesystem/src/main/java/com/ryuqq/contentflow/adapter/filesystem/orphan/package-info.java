/**
 * 크래시로 남은 스냅샷과 스테이징 디렉토리 정리.
 */
package com.ryuqq.contentflow.adapter.filesystem.orphan;
