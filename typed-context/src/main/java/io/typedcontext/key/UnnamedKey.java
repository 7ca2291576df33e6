/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.key;

/**
 * The single unnamed slot of a type.
 *
 * @param type the tag of the stored type
 * @param <T> the stored type
 * @author typed-context contributors
 */
record UnnamedKey<T>(TypeTag<T> type) implements ContextKey<T> {

	@Override
	public String toString() {
		return "ContextKey[" + this.type + "]";
	}

}
