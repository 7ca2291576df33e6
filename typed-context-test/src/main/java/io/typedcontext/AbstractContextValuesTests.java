/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.typedcontext.context.Context;
import io.typedcontext.key.TypeTag;

/**
 * Behaviour every {@link Context} implementation must exhibit when used through
 * {@link ContextValues}. Subclasses supply the empty context of the implementation under
 * test.
 *
 * @author typed-context contributors
 */
public abstract class AbstractContextValuesTests {

	protected enum Color {

		RED, BLUE

	}

	abstract protected Context emptyContext();

	@Test
	void testStoreAndLoadUnnamed() {
		Context ctx1 = ContextValues.with(emptyContext(), Integer.class, 42);

		assertThat(ContextValues.from(ctx1, Integer.class).orElse(0)).isEqualTo(42);
		assertThat(ContextValues.from(ctx1, Integer.class).found()).isTrue();
		assertThat(ContextValues.from(ctx1, String.class).found()).isFalse();
		assertThat(ContextValues.from(ctx1, String.class).orElse("")).isEmpty();
	}

	@Test
	void testSameNameForDifferentTypes() {
		Context ctx1 = ContextValues.withName(emptyContext(), Integer.class, Color.RED, 11);
		Context ctx2 = ContextValues.withName(ctx1, String.class, Color.RED, "RED");

		assertThat(ContextValues.fromName(ctx2, Integer.class, Color.RED).value()).isEqualTo(11);
		assertThat(ContextValues.fromName(ctx2, String.class, Color.RED).value()).isEqualTo("RED");
	}

	@Test
	void testHideUnnamed() {
		Context ctx1 = ContextValues.with(emptyContext(), Integer.class, 42);
		Context ctx2 = ContextValues.without(ctx1, Integer.class);

		assertThat(ContextValues.from(ctx2, Integer.class).found()).isFalse();
		assertThat(ContextValues.from(ctx2, Integer.class).orElse(0)).isZero();
		assertThat(ContextValues.from(ctx1, Integer.class).value()).isEqualTo(42);
	}

	@Test
	void testHideNamed() {
		Context ctx1 = ContextValues.withName(emptyContext(), Integer.class, Color.RED, 42);
		Context ctx2 = ContextValues.withName(ctx1, Integer.class, Color.BLUE, 99);
		Context ctx3 = ContextValues.withoutName(ctx2, Integer.class, Color.RED);

		assertThat(ContextValues.fromName(ctx3, Integer.class, Color.RED).found()).isFalse();
		assertThat(ContextValues.fromName(ctx3, Integer.class, Color.BLUE).value()).isEqualTo(99);
	}

	@Test
	void testOverwriteKeepsOlderSnapshots() {
		Context first = ContextValues.with(emptyContext(), String.class, "v1");
		Context second = ContextValues.with(first, String.class, "v2");

		assertThat(ContextValues.from(second, String.class).value()).isEqualTo("v2");
		assertThat(ContextValues.from(first, String.class).value()).isEqualTo("v1");
	}

	@ParameterizedTest(name = "{0} unrelated writes : {displayName}")
	@ValueSource(ints = { 0, 1, 10, 100 })
	void testHideShadowsRegardlessOfDistance(int distance) {
		Context context = ContextValues.with(emptyContext(), String.class, "v");
		for (int i = 0; i < distance; i++) {
			context = (i % 2 == 0) ? ContextValues.withName(context, String.class, i, "n" + i)
					: ContextValues.without(context, Long.class);
		}
		context = ContextValues.without(context, String.class);

		assertThat(ContextValues.from(context, String.class).found()).isFalse();
	}

	@Test
	void testHideLeavesSiblingKeys() {
		Context context = ContextValues.with(emptyContext(), Integer.class, 1);
		context = ContextValues.withName(context, Integer.class, Color.BLUE, 2);
		context = ContextValues.with(context, Long.class, 3L);
		context = ContextValues.without(context, Integer.class);

		assertThat(ContextValues.fromName(context, Integer.class, Color.BLUE).value()).isEqualTo(2);
		assertThat(ContextValues.from(context, Long.class).value()).isEqualTo(3L);
	}

	@Test
	void testTypeIsolation() {
		Context context = ContextValues.with(emptyContext(), Long.class, 7L);

		assertThat(ContextValues.from(context, Integer.class).found()).isFalse();
		assertThat(ContextValues.from(context, Number.class).found()).isFalse();
		assertThat(ContextValues.from(context, Long.class).value()).isEqualTo(7L);
	}

	@Test
	void testPrimitiveClassSharesSlotWithWrapper() {
		Context context = ContextValues.with(emptyContext(), int.class, 5);

		assertThat(ContextValues.from(context, Integer.class).value()).isEqualTo(5);
	}

	@Test
	void testNameIsolation() {
		Context context = ContextValues.withName(emptyContext(), String.class, "first", "value");

		assertThat(ContextValues.fromName(context, String.class, "second").found()).isFalse();
		assertThat(ContextValues.fromName(context, String.class, "first").value()).isEqualTo("value");
		assertThat(ContextValues.from(context, String.class).found()).isFalse();
	}

	@Test
	void testStoreAfterHideIsFoundAgain() {
		Context hidden = ContextValues.without(ContextValues.with(emptyContext(), String.class, "old"),
				String.class);
		Context restored = ContextValues.with(hidden, String.class, "new");

		assertThat(ContextValues.from(restored, String.class).value()).isEqualTo("new");
	}

	@Test
	void testHideWithoutPriorValue() {
		Context context = ContextValues.without(emptyContext(), Integer.class);

		assertThat(ContextValues.from(context, Integer.class).found()).isFalse();
	}

	@Test
	void testZeroAndNullValuesAreFound() {
		Context context = ContextValues.with(emptyContext(), Integer.class, 0);
		context = ContextValues.with(context, Boolean.class, false);
		context = ContextValues.with(context, String.class, null);

		assertThat(ContextValues.from(context, Integer.class).found()).isTrue();
		assertThat(ContextValues.from(context, Integer.class).value()).isZero();
		assertThat(ContextValues.from(context, Boolean.class).value()).isFalse();
		assertThat(ContextValues.from(context, String.class).found()).isTrue();
		assertThat(ContextValues.from(context, String.class).value()).isNull();
		assertThat(ContextValues.from(emptyContext(), Integer.class).found()).isFalse();
	}

	@Test
	void testGenericTypesAreDistinct() {
		TypeTag<Map<String, Integer>> counts = new TypeTag<Map<String, Integer>>() {
		};
		TypeTag<Map<String, String>> labels = new TypeTag<Map<String, String>>() {
		};
		Context context = ContextValues.with(emptyContext(), counts, Map.of("a", 1));
		context = ContextValues.with(context, new TypeTag<List<Color>>() {
		}, List.of(Color.RED));

		assertThat(ContextValues.from(context, counts).value()).containsEntry("a", 1);
		assertThat(ContextValues.from(context, labels).found()).isFalse();
		assertThat(ContextValues.from(context, new TypeTag<List<Color>>() {
		}).value()).containsExactly(Color.RED);
	}

}
