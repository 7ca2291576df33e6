/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.context;

/**
 * Immutable, request-scoped carrier of key-value bindings passed down a call chain.
 *
 * <p>
 * Every {@link #withValue(Object, Object)} produces a new context layered over its
 * parent; the parent is never modified and stays valid. {@link #value(Object)} returns
 * the binding nearest to the queried context, so a later binding for an equal key
 * shadows any earlier one. There is no way to delete a binding.
 *
 * <p>
 * Implementations must be safe to read and extend from multiple threads.
 *
 * @author typed-context contributors
 */
public interface Context {

	/**
	 * Returns the root context, which binds nothing.
	 * @return the shared empty context
	 */
	static Context background() {
		return FrameContext.BACKGROUND;
	}

	/**
	 * Create a child context binding {@code key} to {@code value}.
	 * @param key the lookup key, compared with {@link Object#equals(Object)}
	 * @param value the bound value
	 * @return a new context whose lookups consult this binding before the parent's
	 * @throws IllegalArgumentException if {@code key} or {@code value} is {@code null}
	 */
	Context withValue(Object key, Object value);

	/**
	 * Find the nearest value bound to a key equal to {@code key}.
	 * @param key the lookup key
	 * @return the bound value or {@code null} if no binding exists
	 */
	Object value(Object key);

}
