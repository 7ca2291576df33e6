/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/**
 * Tests for the default frame-chain {@link Context}.
 *
 * @author typed-context contributors
 */
class FrameContextTests {

	@Test
	void testBackgroundBindsNothing() {
		assertThat(Context.background().value("key")).isNull();
		assertThat(Context.background()).isSameAs(Context.background());
	}

	@Test
	void testNearestBindingWins() {
		Context first = Context.background().withValue("key", "first");
		Context second = first.withValue("other", "unrelated").withValue("key", "second");

		assertThat(second.value("key")).isEqualTo("second");
		assertThat(second.value("other")).isEqualTo("unrelated");
		assertThat(first.value("key")).isEqualTo("first");
		assertThat(first.value("other")).isNull();
	}

	@Test
	void testKeysCompareByEquality() {
		Context context = Context.background().withValue(new String("key"), 1);

		assertThat(context.value("key")).isEqualTo(1);
	}

	@Test
	void testSiblingsDoNotSeeEachOther() {
		Context parent = Context.background().withValue("shared", 0);
		Context left = parent.withValue("side", "left");
		Context right = parent.withValue("side", "right");

		assertThat(left.value("side")).isEqualTo("left");
		assertThat(right.value("side")).isEqualTo("right");
		assertThat(parent.value("side")).isNull();
		assertThat(left.value("shared")).isEqualTo(0);
	}

	@Test
	void testDeepChainLookup() {
		Context context = Context.background().withValue("root", "bottom");
		for (int i = 0; i < 10_000; i++) {
			context = context.withValue(i, i);
		}

		assertThat(context.value("root")).isEqualTo("bottom");
		assertThat(context.value(0)).isEqualTo(0);
		assertThat(context.toString()).startsWith("Context.background.withValue(root, bottom).withValue(0, 0)");
	}

	@Test
	void testNullKeyOrValueIsRejected() {
		assertThatThrownBy(() -> Context.background().withValue(null, "value"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("key must not be null");
		assertThatThrownBy(() -> Context.background().withValue("key", null))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessage("value must not be null");
	}

	@Test
	void testToString() {
		assertThat(Context.background()).hasToString("Context.background");
		assertThat(Context.background().withValue("a", 1).withValue("b", 2))
			.hasToString("Context.background.withValue(a, 1).withValue(b, 2)");
	}

}
