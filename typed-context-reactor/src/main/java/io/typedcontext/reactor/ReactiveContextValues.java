/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.reactor;

import java.util.function.Function;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.typedcontext.ContextValues;
import io.typedcontext.Lookup;
import io.typedcontext.context.Context;
import io.typedcontext.key.TypeTag;
import io.typedcontext.util.Assert;
import reactor.core.publisher.Mono;

/**
 * {@link ContextValues} for the Reactor subscriber context.
 *
 * <p>
 * Writers produce functions for {@code contextWrite}; readers defer to the subscriber
 * context at subscription time:
 *
 * <pre>{@code
 * Mono<String> greeting = ReactiveContextValues.from(User.class)
 * 	.map(user -> "Hello " + user.name())
 * 	.contextWrite(ReactiveContextValues.with(User.class, currentUser));
 * }</pre>
 *
 * <p>
 * Since Reactor cannot emit {@code null}, {@code from} completes empty both when nothing
 * is bound and when {@code null} was stored; use {@code lookup} to tell them apart.
 *
 * @author typed-context contributors
 */
public final class ReactiveContextValues {

	private static final Logger logger = LoggerFactory.getLogger(ReactiveContextValues.class);

	private ReactiveContextValues() {
	}

	// ---------------------------------------
	// Writers
	// ---------------------------------------

	public static <T> Function<reactor.util.context.Context, reactor.util.context.Context> with(Class<T> type,
			T value) {
		return with(TypeTag.of(type), value);
	}

	public static <T> Function<reactor.util.context.Context, reactor.util.context.Context> with(TypeTag<T> type,
			T value) {
		Assert.notNull(type, "type must not be null");
		return write(context -> ContextValues.with(context, type, value));
	}

	public static <T, N> Function<reactor.util.context.Context, reactor.util.context.Context> withName(
			Class<T> type, N name, T value) {
		return withName(TypeTag.of(type), name, value);
	}

	public static <T, N> Function<reactor.util.context.Context, reactor.util.context.Context> withName(
			TypeTag<T> type, N name, T value) {
		Assert.notNull(type, "type must not be null");
		return write(context -> ContextValues.withName(context, type, name, value));
	}

	public static <T> Function<reactor.util.context.Context, reactor.util.context.Context> without(Class<T> type) {
		return without(TypeTag.of(type));
	}

	public static <T> Function<reactor.util.context.Context, reactor.util.context.Context> without(
			TypeTag<T> type) {
		Assert.notNull(type, "type must not be null");
		return write(context -> ContextValues.without(context, type));
	}

	public static <T, N> Function<reactor.util.context.Context, reactor.util.context.Context> withoutName(
			Class<T> type, N name) {
		return withoutName(TypeTag.of(type), name);
	}

	public static <T, N> Function<reactor.util.context.Context, reactor.util.context.Context> withoutName(
			TypeTag<T> type, N name) {
		Assert.notNull(type, "type must not be null");
		return write(context -> ContextValues.withoutName(context, type, name));
	}

	/**
	 * Populate the subscriber context from a transport request. Entries already in the
	 * subscriber context are kept; the extractor's entries win where keys collide.
	 * @param request the request to extract values from
	 * @param extractor layers the request's values over the current context
	 * @param <R> the request type
	 * @return a function for {@code contextWrite}
	 */
	public static <R> Function<reactor.util.context.Context, reactor.util.context.Context> extracting(R request,
			ContextValueExtractor<R> extractor) {
		Assert.notNull(extractor, "extractor must not be null");
		return write(context -> {
			logger.debug("Extracting context values from {}", request);
			return extractor.extract(request, context);
		});
	}

	// ---------------------------------------
	// Readers
	// ---------------------------------------

	public static <T> Mono<T> from(Class<T> type) {
		return from(TypeTag.of(type));
	}

	/**
	 * Read the unnamed value of a type from the subscriber context.
	 * @param type the tag the value was stored as
	 * @param <T> the stored type
	 * @return a {@link Mono} emitting the value, or completing empty if it is absent or
	 * {@code null}
	 */
	public static <T> Mono<T> from(TypeTag<T> type) {
		return lookup(type).flatMap(lookup -> Mono.justOrEmpty(lookup.value()));
	}

	public static <T, N> Mono<T> fromName(Class<T> type, N name) {
		return fromName(TypeTag.of(type), name);
	}

	public static <T, N> Mono<T> fromName(TypeTag<T> type, N name) {
		return lookupName(type, name).flatMap(lookup -> Mono.justOrEmpty(lookup.value()));
	}

	public static <T> Mono<Lookup<T>> lookup(Class<T> type) {
		return lookup(TypeTag.of(type));
	}

	/**
	 * Read the unnamed value of a type from the subscriber context.
	 * @param type the tag the value was stored as
	 * @param <T> the stored type
	 * @return a {@link Mono} that always emits the {@link Lookup}
	 */
	public static <T> Mono<Lookup<T>> lookup(TypeTag<T> type) {
		Assert.notNull(type, "type must not be null");
		return Mono.deferContextual(view -> Mono.just(ContextValues.from(ReactorContext.of(view), type)));
	}

	public static <T, N> Mono<Lookup<T>> lookupName(Class<T> type, N name) {
		return lookupName(TypeTag.of(type), name);
	}

	public static <T, N> Mono<Lookup<T>> lookupName(TypeTag<T> type, N name) {
		Assert.notNull(type, "type must not be null");
		return Mono.deferContextual(view -> Mono.just(ContextValues.fromName(ReactorContext.of(view), type, name)));
	}

	private static Function<reactor.util.context.Context, reactor.util.context.Context> write(
			UnaryOperator<Context> operation) {
		return reactorContext -> {
			Context result = operation.apply(ReactorContext.of(reactorContext));
			Assert.isTrue(result instanceof ReactorContext,
					"Context values must be written to a ReactorContext, got " + result);
			// entries of the incoming context survive even if the result was built elsewhere
			return reactorContext.putAll(((ReactorContext) result).view());
		};
	}

}
