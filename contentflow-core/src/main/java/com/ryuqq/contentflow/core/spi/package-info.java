/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams between the pipeline coordinator and its collaborators.
 * The orchestrator depends only on these interfaces; adapters provide the implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.core.spi.ResearchOperation} - External research service</li>
 *   <li>{@link com.ryuqq.contentflow.core.spi.WritingOperation} - External article writer</li>
 *   <li>{@link com.ryuqq.contentflow.core.spi.SnapshotStore} - Crash-recovery snapshot persistence</li>
 *   <li>{@link com.ryuqq.contentflow.core.spi.OutputCommitter} - Staging and atomic commit of outputs</li>
 *   <li>{@link com.ryuqq.contentflow.core.spi.ProgressListener} - Synchronous progress notifications</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on the filesystem layout or JSON library</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.core.spi;
