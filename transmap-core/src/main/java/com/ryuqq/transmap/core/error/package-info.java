/**
 * Error taxonomy of the synthesizer.
 *
 * <ul>
 *   <li>{@link com.ryuqq.transmap.core.error.ConfigurationException} - setup-time failure, fatal for one test item</li>
 *   <li>{@link com.ryuqq.transmap.core.error.ContractViolationException} - caller misuse, never clamped or wrapped</li>
 *   <li>{@link com.ryuqq.transmap.core.error.StateIndexOutOfRangeException} - out-of-range state vector or index</li>
 * </ul>
 *
 * <p>Callback failures are not part of this hierarchy: they propagate verbatim.</p>
 *
 * @since 1.0.0
 * @author Transmap Team
 */
package com.ryuqq.transmap.core.error;
