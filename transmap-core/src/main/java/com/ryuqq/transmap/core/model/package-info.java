/**
 * Condition catalog.
 *
 * <p>A {@link com.ryuqq.transmap.core.model.ConditionModel} lists the pre-conditions
 * (independent input dimensions, outermost first) and the post-conditions (expected
 * outcome dimensions) of one action-requirement test item.</p>
 *
 * <h2>Dimension sizes</h2>
 * <pre>
 * pre-condition             radix = states + 1   (NA sentinel appended)
 * NA-exempt pre-condition   radix = states
 * post-condition            radix = states
 * </pre>
 *
 * @since 1.0.0
 * @author Transmap Team
 */
package com.ryuqq.transmap.core.model;
