/**
 * Precomputed expected-outcome table.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transmap.core.table.TransitionEntry} - applicability, expected post-condition states and skip flag of one entry</li>
 *   <li>{@link com.ryuqq.transmap.core.table.TransitionTable} - validated entries plus the generation-order to storage-order map</li>
 *   <li>{@link com.ryuqq.transmap.core.table.TransitionRow} - raw row as delivered by the specification loader</li>
 *   <li>{@link com.ryuqq.transmap.core.table.TransitionTableCompiler} - expands NA cells and checks coverage of the rows</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TransitionTable table = new TransitionTableCompiler(model).compile(List.of(
 *     TransitionRow.of(List.of("Slow", "NA"), List.of("Ok")),
 *     TransitionRow.of(List.of("Fast", "Empty"), List.of("Ok")),
 *     TransitionRow.of(List.of("Fast", "Full"), List.of("Error"))
 * ));
 * </pre>
 *
 * @since 1.0.0
 * @author Transmap Team
 */
package com.ryuqq.transmap.core.table;
