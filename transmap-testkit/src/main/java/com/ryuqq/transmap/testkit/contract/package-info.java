/**
 * Contract test infrastructure: recording callbacks and the shared base class.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.testkit.contract;
