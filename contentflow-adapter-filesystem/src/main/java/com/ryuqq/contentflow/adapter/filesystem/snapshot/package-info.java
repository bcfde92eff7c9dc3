/**
 * JSON 파일 기반 스냅샷 저장소.
 *
 * <p>{@link com.ryuqq.contentflow.adapter.filesystem.snapshot.JsonSnapshotStore}는
 * {@link com.ryuqq.contentflow.core.spi.SnapshotStore}의 파일 시스템 구현입니다.</p>
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.adapter.filesystem.snapshot;
