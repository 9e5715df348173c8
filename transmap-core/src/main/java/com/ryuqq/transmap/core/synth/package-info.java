/**
 * Combinatorial transition-map synthesizer.
 *
 * <p>This package walks the Cartesian product of pre-condition states in the declared
 * nesting order and drives prepare/action/check callbacks against a
 * {@link com.ryuqq.transmap.core.table.TransitionTable}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transmap.core.synth.Synthesizer} - run loop, plan size, failure resolution</li>
 *   <li>{@link com.ryuqq.transmap.core.synth.Combination} - snapshot of one visited step (iteration and effective vectors)</li>
 *   <li>{@link com.ryuqq.transmap.core.synth.ActionCallbacks} - callbacks of the action-execution collaborator</li>
 *   <li>{@link com.ryuqq.transmap.core.synth.FailureHandler} - caller-registered STOP/CONTINUE contract</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <pre>
 * for each generation index g (outermost dimension slowest):
 *   entry.skip          → SKIP
 *   skip-ahead state    → PRUNE (inner sub-product skipped in one step)
 *   otherwise           → prepare(0..n-1), action(), check(0..m-1)
 * </pre>
 *
 * <p>Ordering is part of the behavior: {@code action()} may leave residual state that
 * later combinations rely on being irrelevant only because the order is fixed.</p>
 *
 * @since 1.0.0
 * @author Transmap Team
 */
package com.ryuqq.transmap.core.synth;
