/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.typedcontext.context.Context;
import io.typedcontext.key.ContextKey;
import io.typedcontext.key.TypeTag;
import io.typedcontext.util.Assert;

/**
 * Stores and retrieves values of a static type in an immutable {@link Context}, keyed by
 * the type itself and optionally a name.
 *
 * <p>
 * Callers never define keys: the key is synthesized from the requested type, so two
 * components that both store, say, an {@code Integer} use distinct slots as long as one
 * of them names its slot. Every write returns a new context and leaves the given one
 * untouched:
 *
 * <pre>{@code
 * Context ctx = ContextValues.with(Context.background(), Integer.class, 42);
 * ctx = ContextValues.withName(ctx, String.class, Color.RED, "RED");
 *
 * ContextValues.from(ctx, Integer.class);                   // Lookup[42]
 * ContextValues.fromName(ctx, String.class, Color.RED);     // Lookup[RED]
 * ContextValues.from(ContextValues.without(ctx, Integer.class), Integer.class); // absent
 * }</pre>
 *
 * <p>
 * Reads never throw. A value that was never stored, one that was hidden with
 * {@code without}, and one whose stored type does not match all come back as
 * {@link Lookup#absent()}. Storing {@code null} is legitimate and reads back as a found
 * {@code null}.
 *
 * <p>
 * Only carry request-scoped data across API boundaries this way; optional parameters
 * belong in method signatures.
 *
 * @author typed-context contributors
 */
public final class ContextValues {

	private static final Logger logger = LoggerFactory.getLogger(ContextValues.class);

	private ContextValues() {
	}

	// ---------------------------------------
	// Unnamed values
	// ---------------------------------------

	public static <T> Context with(Context context, Class<T> type, T value) {
		return with(context, ContextKey.of(type), value);
	}

	/**
	 * Store a value in the unnamed slot of its type.
	 * @param context the parent context, left unchanged
	 * @param type the tag the value is stored and later retrieved as
	 * @param value the value, possibly {@code null}
	 * @param <T> the stored type
	 * @return a child context in which {@code from(ctx, type)} finds {@code value}
	 */
	public static <T> Context with(Context context, TypeTag<T> type, T value) {
		return with(context, ContextKey.of(type), value);
	}

	public static <T> Lookup<T> from(Context context, Class<T> type) {
		return from(context, ContextKey.of(type));
	}

	/**
	 * Read the value in the unnamed slot of a type.
	 * @param context the context to search, nearest binding first
	 * @param type the tag the value was stored as
	 * @param <T> the stored type
	 * @return the value, or {@link Lookup#absent()} if it was never stored or is hidden
	 */
	public static <T> Lookup<T> from(Context context, TypeTag<T> type) {
		return from(context, ContextKey.of(type));
	}

	public static <T> Context without(Context context, Class<T> type) {
		return without(context, ContextKey.of(type));
	}

	/**
	 * Hide the unnamed slot of a type. Named slots and other types are unaffected.
	 * @param context the parent context, left unchanged
	 * @param type the tag of the slot to hide
	 * @param <T> the stored type
	 * @return a child context in which {@code from(ctx, type)} is absent
	 */
	public static <T> Context without(Context context, TypeTag<T> type) {
		return without(context, ContextKey.of(type));
	}

	// ---------------------------------------
	// Named values
	// ---------------------------------------

	public static <T, N> Context withName(Context context, Class<T> type, N name, T value) {
		return with(context, ContextKey.named(type, name), value);
	}

	/**
	 * Store a value in the slot of its type identified by {@code name}.
	 * @param context the parent context, left unchanged
	 * @param type the tag the value is stored and later retrieved as
	 * @param name the slot name, compared with {@code equals}; it must not be modified
	 * afterwards
	 * @param value the value, possibly {@code null}
	 * @param <T> the stored type
	 * @param <N> the name type
	 * @return a child context in which {@code fromName(ctx, type, name)} finds
	 * {@code value}
	 */
	public static <T, N> Context withName(Context context, TypeTag<T> type, N name, T value) {
		return with(context, ContextKey.named(type, name), value);
	}

	public static <T, N> Lookup<T> fromName(Context context, Class<T> type, N name) {
		return from(context, ContextKey.named(type, name));
	}

	public static <T, N> Lookup<T> fromName(Context context, TypeTag<T> type, N name) {
		return from(context, ContextKey.named(type, name));
	}

	public static <T, N> Context withoutName(Context context, Class<T> type, N name) {
		return without(context, ContextKey.named(type, name));
	}

	public static <T, N> Context withoutName(Context context, TypeTag<T> type, N name) {
		return without(context, ContextKey.named(type, name));
	}

	// ---------------------------------------
	// Explicit keys
	// ---------------------------------------

	/**
	 * Store a value under a previously synthesized key.
	 * @param context the parent context, left unchanged
	 * @param key the key
	 * @param value the value, possibly {@code null}
	 * @param <T> the stored type
	 * @return the child context
	 */
	public static <T> Context with(Context context, ContextKey<T> key, T value) {
		Assert.notNull(context, "context must not be null");
		Assert.notNull(key, "key must not be null");
		return context.withValue(key, new Binding.Value(key.type(), value));
	}

	/**
	 * Read the value bound under a previously synthesized key.
	 * @param context the context to search
	 * @param key the key
	 * @param <T> the stored type
	 * @return the value or {@link Lookup#absent()}
	 */
	public static <T> Lookup<T> from(Context context, ContextKey<T> key) {
		Assert.notNull(context, "context must not be null");
		Assert.notNull(key, "key must not be null");
		Object bound = context.value(key);
		if (bound == null || bound == Binding.TOMBSTONE) {
			return Lookup.absent();
		}
		TypeTag<T> type = key.type();
		if (!(bound instanceof Binding.Value stored) || !type.equals(stored.type())
				|| !type.isInstance(stored.value())) {
			logger.debug("Ignoring {} bound under {}: not a {}", bound, key, type);
			return Lookup.absent();
		}
		return Lookup.of(type.getRawClass().cast(stored.value()));
	}

	/**
	 * Hide the value bound under a previously synthesized key.
	 * @param context the parent context, left unchanged
	 * @param key the key
	 * @return the child context
	 */
	public static Context without(Context context, ContextKey<?> key) {
		Assert.notNull(context, "context must not be null");
		Assert.notNull(key, "key must not be null");
		return context.withValue(key, Binding.TOMBSTONE);
	}

}
