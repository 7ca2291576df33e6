/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.context;

import java.util.ArrayDeque;
import java.util.Deque;

import io.typedcontext.util.Assert;

/**
 * Default {@link Context}: a singly linked chain of frames, each holding one binding.
 *
 * @author typed-context contributors
 */
final class FrameContext implements Context {

	static final FrameContext BACKGROUND = new FrameContext(null, null, null);

	private final FrameContext parent;

	private final Object key;

	private final Object value;

	private FrameContext(FrameContext parent, Object key, Object value) {
		this.parent = parent;
		this.key = key;
		this.value = value;
	}

	@Override
	public Context withValue(Object key, Object value) {
		Assert.notNull(key, "key must not be null");
		Assert.notNull(value, "value must not be null");
		return new FrameContext(this, key, value);
	}

	@Override
	public Object value(Object key) {
		for (FrameContext frame = this; frame.parent != null; frame = frame.parent) {
			if (frame.key.equals(key)) {
				return frame.value;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		Deque<FrameContext> frames = new ArrayDeque<>();
		for (FrameContext frame = this; frame.parent != null; frame = frame.parent) {
			frames.push(frame);
		}
		StringBuilder sb = new StringBuilder("Context.background");
		for (FrameContext frame : frames) {
			sb.append(".withValue(").append(frame.key).append(", ").append(frame.value).append(')');
		}
		return sb.toString();
	}

}
