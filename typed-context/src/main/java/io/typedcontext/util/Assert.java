/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.util;

/**
 * Assertion utility class that assists in validating arguments.
 *
 * <p>
 * Failed assertions are programming errors and surface as
 * {@link IllegalArgumentException}. Lookups never go through here: absence is reported
 * as a result, not as a failure.
 *
 * @author typed-context contributors
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * Assert that an object is not {@code null}.
	 * @param object the object to check
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if the object is {@code null}
	 */
	public static void notNull(Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

	/**
	 * Assert a boolean expression, throwing an {@code IllegalArgumentException} if the
	 * expression evaluates to {@code false}.
	 * @param expression a boolean expression
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if {@code expression} is {@code false}
	 */
	public static void isTrue(boolean expression, String message) {
		if (!expression) {
			throw new IllegalArgumentException(message);
		}
	}

}
