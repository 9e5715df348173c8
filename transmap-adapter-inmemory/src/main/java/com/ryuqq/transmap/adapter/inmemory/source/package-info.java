/**
 * In-memory specification source.
 *
 * @author Transmap Team
 * @since 1.0.0
 */
package com.ryuqq.transmap.adapter.inmemory.source;
