/**
 * Jackson 트리 기반 payload 변환.
 */
package com.ryuqq.contentflow.adapter.filesystem.json;
