/**
 * Core domain model for the article pipeline.
 *
 * <p>This package contains immutable value objects and records that represent
 * the inputs and outputs of each pipeline phase.</p>
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.core.model.Keyword} - Validated target keyword (trimmed, 1-200 characters)</li>
 *   <li>{@link com.ryuqq.contentflow.core.model.SessionId} - Per-run identifier (sanitized keyword + timestamp)</li>
 * </ul>
 *
 * <h2>Phase Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.core.model.ResearchResult} - Research output (sources, findings)</li>
 *   <li>{@link com.ryuqq.contentflow.core.model.ArticleResult} - Writing output (sections, cited URLs)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All types are immutable after creation</li>
 *   <li><strong>Validation:</strong> Invalid keywords fail before any filesystem I/O</li>
 *   <li><strong>Filesystem safety:</strong> {@code Keyword.sanitized()} is the only form used in paths</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.core.model;
