/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.reactor;

import io.typedcontext.context.Context;
import io.typedcontext.util.Assert;
import reactor.util.context.ContextView;

/**
 * {@link Context} backed by a Reactor {@link ContextView}, so typed values can travel in
 * the subscriber context of a reactive pipeline.
 *
 * <p>
 * Reactor contexts are immutable and {@code put} replaces an existing entry in the
 * returned copy, which gives the same nearest-binding-wins behaviour as a frame chain.
 *
 * @author typed-context contributors
 */
public final class ReactorContext implements Context {

	private static final ReactorContext EMPTY = new ReactorContext(reactor.util.context.Context.empty());

	private final ContextView view;

	private ReactorContext(ContextView view) {
		this.view = view;
	}

	/**
	 * Wrap a Reactor context, typically the one obtained from
	 * {@code Mono.deferContextual} or {@code contextWrite}.
	 * @param view the Reactor context
	 * @return the adapter
	 */
	public static ReactorContext of(ContextView view) {
		Assert.notNull(view, "view must not be null");
		return new ReactorContext(view);
	}

	public static ReactorContext empty() {
		return EMPTY;
	}

	@Override
	public ReactorContext withValue(Object key, Object value) {
		Assert.notNull(key, "key must not be null");
		Assert.notNull(value, "value must not be null");
		return new ReactorContext(toReactorContext().put(key, value));
	}

	@Override
	public Object value(Object key) {
		return this.view.getOrDefault(key, null);
	}

	public ContextView view() {
		return this.view;
	}

	/**
	 * @return the bindings as a Reactor {@link reactor.util.context.Context}, suitable as
	 * the result of a {@code contextWrite} function
	 */
	public reactor.util.context.Context toReactorContext() {
		return reactor.util.context.Context.of(this.view);
	}

	@Override
	public String toString() {
		return "ReactorContext" + this.view;
	}

}
