/**
 * 진행 상황 보고.
 */
package com.ryuqq.contentflow.application.progress;
