/**
 * In-memory callback registry.
 *
 * @author MultiState Team
 * @since 1.0.0
 */
package com.ryuqq.multistate.adapter.inmemory.callback;
