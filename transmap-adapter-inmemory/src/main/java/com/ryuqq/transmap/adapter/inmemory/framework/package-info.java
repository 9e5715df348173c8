/**
 * In-memory test framework recording runner notifications.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.adapter.inmemory.framework;
