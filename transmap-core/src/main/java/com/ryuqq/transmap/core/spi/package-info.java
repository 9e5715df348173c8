/**
 * Service Provider Interfaces towards external collaborators.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transmap.core.spi.TestFramework} - external test-execution framework (plan, scope, step results)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transmap Team
 */
package com.ryuqq.transmap.core.spi;
