/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.reactor;

import io.typedcontext.context.Context;

/**
 * The contract for turning a transport request of type {@link R} into request-scoped
 * context values at an API boundary.
 *
 * @param <R> transport-specific representation of the request, such as an HTTP request
 * @author typed-context contributors
 */
@FunctionalInterface
public interface ContextValueExtractor<R> {

	/**
	 * Given the current context, layers values extracted from the request on top of it.
	 * @param request the transport request
	 * @param context the context to extend
	 * @return {@code context} or a context derived from it with
	 * {@link io.typedcontext.ContextValues}
	 */
	Context extract(R request, Context context);

}
