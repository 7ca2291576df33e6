/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.key;

import java.util.Arrays;
import java.util.Objects;

/**
 * A slot of a type distinguished by a name. Array names are copied on creation and
 * compared by content.
 *
 * @param type the tag of the stored type
 * @param name the slot name, possibly {@code null}
 * @param <T> the stored type
 * @author typed-context contributors
 */
record NamedKey<T>(TypeTag<T> type, Object name) implements ContextKey<T> {

	NamedKey {
		name = copyIfArray(name);
	}

	private static Object copyIfArray(Object name) {
		if (name instanceof Object[] objects) {
			Object[] copy = objects.clone();
			for (int i = 0; i < copy.length; i++) {
				copy[i] = copyIfArray(copy[i]);
			}
			return copy;
		}
		if (name instanceof int[] ints) {
			return ints.clone();
		}
		if (name instanceof long[] longs) {
			return longs.clone();
		}
		if (name instanceof byte[] bytes) {
			return bytes.clone();
		}
		if (name instanceof char[] chars) {
			return chars.clone();
		}
		if (name instanceof short[] shorts) {
			return shorts.clone();
		}
		if (name instanceof boolean[] booleans) {
			return booleans.clone();
		}
		if (name instanceof double[] doubles) {
			return doubles.clone();
		}
		if (name instanceof float[] floats) {
			return floats.clone();
		}
		return name;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof NamedKey<?> other)) {
			return false;
		}
		return this.type.equals(other.type) && Objects.deepEquals(this.name, other.name);
	}

	@Override
	public int hashCode() {
		return 31 * this.type.hashCode() + Arrays.deepHashCode(new Object[] { this.name });
	}

	@Override
	public String toString() {
		String name = Arrays.deepToString(new Object[] { this.name });
		return "ContextKey[" + this.type + ", name=" + name.substring(1, name.length() - 1) + "]";
	}

}
