/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Result of reading a typed value from a context: the value and whether it was found.
 *
 * <p>
 * A found value may be {@code null} if {@code null} was stored explicitly. When nothing
 * was found the value is {@code null} as well, so callers that store {@code null} must
 * check {@link #found()} rather than the value.
 *
 * @param <T> the requested type
 * @author typed-context contributors
 */
public final class Lookup<T> {

	private static final Lookup<?> ABSENT = new Lookup<>(null, false);

	private final T value;

	private final boolean found;

	private Lookup(T value, boolean found) {
		this.value = value;
		this.found = found;
	}

	static <T> Lookup<T> of(T value) {
		return new Lookup<>(value, true);
	}

	/**
	 * @param <T> the requested type
	 * @return the shared not-found result
	 */
	@SuppressWarnings("unchecked")
	public static <T> Lookup<T> absent() {
		return (Lookup<T>) ABSENT;
	}

	public T value() {
		return this.value;
	}

	public boolean found() {
		return this.found;
	}

	/**
	 * @param other returned when nothing was found
	 * @return the found value, which may be {@code null}, or {@code other}
	 */
	public T orElse(T other) {
		return this.found ? this.value : other;
	}

	/**
	 * A found {@code null} maps to an empty {@link Optional}.
	 * @return the value as an {@link Optional}
	 */
	public Optional<T> toOptional() {
		return Optional.ofNullable(this.value);
	}

	public void ifFound(Consumer<? super T> action) {
		if (this.found) {
			action.accept(this.value);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Lookup<?> other)) {
			return false;
		}
		return this.found == other.found && Objects.equals(this.value, other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.value, this.found);
	}

	@Override
	public String toString() {
		return this.found ? "Lookup[" + this.value + "]" : "Lookup.absent";
	}

}
