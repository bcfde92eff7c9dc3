/**
 * Workflow progress snapshot model.
 *
 * <p>Snapshots are the write-ahead record of a run: one JSON document per in-flight run,
 * rewritten after every state transition and deleted on COMPLETE or ROLLED_BACK.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.contentflow.core.snapshot.WorkflowSnapshot} - state, timestamp, data, staging directory</li>
 *   <li>{@link com.ryuqq.contentflow.core.snapshot.WorkflowData} - keyword and per-phase data</li>
 *   <li>{@link com.ryuqq.contentflow.core.snapshot.PhaseData} - sealed per-phase structs (research, writing, saving)</li>
 *   <li>{@link com.ryuqq.contentflow.core.snapshot.SnapshotLoad} - typed load result (never an exception)</li>
 *   <li>{@link com.ryuqq.contentflow.core.snapshot.PersistenceResult} - typed save/delete result (never an exception)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Contentflow Team
 */
package com.ryuqq.contentflow.core.snapshot;
