/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext;

import io.typedcontext.key.TypeTag;

/**
 * What {@link ContextValues} binds in a context: either a value tagged with its type, or
 * the tombstone that hides earlier bindings of the same key.
 *
 * @author typed-context contributors
 */
interface Binding {

	/**
	 * Shadows any earlier binding of its key. It is never a {@link Value}, so no stored
	 * value, {@code null} included, can be mistaken for it.
	 */
	Binding TOMBSTONE = new Binding() {
		@Override
		public String toString() {
			return "<absent>";
		}
	};

	/**
	 * A stored value together with the type it was stored as.
	 *
	 * @param type the tag the value was stored under
	 * @param value the value, possibly {@code null}
	 */
	record Value(TypeTag<?> type, Object value) implements Binding {

		@Override
		public String toString() {
			return String.valueOf(this.value);
		}

	}

}
