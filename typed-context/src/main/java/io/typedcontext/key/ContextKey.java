/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.key;

import io.typedcontext.util.Assert;

/**
 * Lookup identity of a context value, derived from the value's type and an optional
 * name.
 *
 * <p>
 * Keys need no registration and carry no state of their own. Two call sites asking for
 * the same type (and an equal name) synthesize equal keys independently, while keys for
 * different types, different names, or named versus unnamed slots never match.
 *
 * @param <T> the type of the value bound under this key
 * @author typed-context contributors
 */
public interface ContextKey<T> {

	/**
	 * @return the tag of the type stored under this key
	 */
	TypeTag<T> type();

	/**
	 * Synthesize the key for the unnamed slot of a type.
	 * @param type the tag of the stored type
	 * @param <T> the stored type
	 * @return the key, equal to every other unnamed key for the same type
	 */
	static <T> ContextKey<T> of(TypeTag<T> type) {
		Assert.notNull(type, "type must not be null");
		return new UnnamedKey<>(type);
	}

	/**
	 * Synthesize the key for the unnamed slot of a non-generic type.
	 * @param type the class of the stored type
	 * @param <T> the stored type
	 * @return the key
	 */
	static <T> ContextKey<T> of(Class<T> type) {
		return of(TypeTag.of(type));
	}

	/**
	 * Synthesize the key for a named slot of a type. Names are compared with
	 * {@link Object#equals(Object)}, arrays by content; {@code null} is a name of its
	 * own.
	 * <p>
	 * Names must be immutable: a binding stored under a name that is modified afterwards
	 * can no longer be found with an equal name. Arrays are copied into the key, so only
	 * the name's other mutable types (collections, beans) are affected.
	 * @param type the tag of the stored type
	 * @param name distinguishes independent slots of the same type
	 * @param <T> the stored type
	 * @param <N> the name type
	 * @return the key, equal to every named key with the same type and an equal name
	 */
	static <T, N> ContextKey<T> named(TypeTag<T> type, N name) {
		Assert.notNull(type, "type must not be null");
		return new NamedKey<>(type, name);
	}

	/**
	 * Synthesize the key for a named slot of a non-generic type.
	 * @param type the class of the stored type
	 * @param name distinguishes independent slots of the same type
	 * @param <T> the stored type
	 * @param <N> the name type
	 * @return the key
	 */
	static <T, N> ContextKey<T> named(Class<T> type, N name) {
		return named(TypeTag.of(type), name);
	}

}
