/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.typedcontext.key;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.lang.reflect.WildcardType;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.type.TypeFactory;
import com.fasterxml.jackson.databind.util.ClassUtil;

import io.typedcontext.util.Assert;

/**
 * Identity of a static type {@code T}, used as the namespace of a {@link ContextKey}.
 *
 * <p>
 * A tag is obtained either from a class, or captured from the generic superclass of an
 * anonymous subclass, which keeps type arguments that erasure would otherwise drop:
 *
 * <pre>{@code
 * TypeTag<Integer> count = TypeTag.of(Integer.class);
 * TypeTag<List<String>> names = new TypeTag<List<String>>() {};
 * }</pre>
 *
 * <p>
 * Two tags are equal iff they denote the same type as resolved by Jackson's
 * {@link TypeFactory}. Primitive classes are replaced by their wrappers, so
 * {@code int.class} and {@code Integer.class} share a tag. Types Jackson resolves to the
 * same {@link JavaType} (for instance a raw {@code List} and {@code List<Object>}) also
 * share a tag. A type that still mentions an unresolved type variable is rejected, as
 * it would otherwise collapse onto its bound.
 *
 * @param <T> the tagged type
 * @author typed-context contributors
 */
public abstract class TypeTag<T> {

	private final JavaType type;

	/**
	 * Captures the type argument given to {@code TypeTag} by the class being created or
	 * by one of its superclasses, so {@code class Ids extends TypeTag<List<Long>>} can be
	 * reused through {@code new Ids()}. An intermediate class that passes its own type
	 * variable through ({@code class Holder<X> extends TypeTag<X>}) is rejected.
	 * @throws IllegalArgumentException if no concrete type argument is available
	 */
	protected TypeTag() {
		Class<?> subclass = getClass();
		while (subclass.getSuperclass() != TypeTag.class) {
			subclass = subclass.getSuperclass();
		}
		Type superType = subclass.getGenericSuperclass();
		Assert.isTrue(superType instanceof ParameterizedType,
				"TypeTag must be created with actual type information, e.g. new TypeTag<List<String>>() {}");
		this.type = resolve(((ParameterizedType) superType).getActualTypeArguments()[0]);
	}

	private TypeTag(JavaType type) {
		this.type = type;
	}

	/**
	 * Create a tag for a non-generic type.
	 * @param type the class of the values
	 * @param <T> the tagged type
	 * @return the tag, equal to any other tag for the same class
	 */
	public static <T> TypeTag<T> of(Class<T> type) {
		Assert.notNull(type, "type must not be null");
		return new Resolved<>(resolve(type));
	}

	/**
	 * Create a tag from a Jackson {@link TypeReference}.
	 * @param reference the reference holding the captured type
	 * @param <T> the tagged type
	 * @return the tag
	 */
	public static <T> TypeTag<T> of(TypeReference<T> reference) {
		Assert.notNull(reference, "reference must not be null");
		return new Resolved<>(resolve(reference.getType()));
	}

	/**
	 * @return the resolved type this tag stands for
	 */
	public JavaType getJavaType() {
		return this.type;
	}

	/**
	 * @return the erased class of the tagged type
	 */
	@SuppressWarnings("unchecked")
	public Class<T> getRawClass() {
		return (Class<T>) this.type.getRawClass();
	}

	/**
	 * Whether the value may be returned as a {@code T}. Only the erased class can be
	 * checked at runtime; {@code null} is accepted.
	 * @param value the candidate value
	 * @return {@code true} if {@code value} is {@code null} or an instance of the raw
	 * class
	 */
	public boolean isInstance(Object value) {
		return value == null || this.type.getRawClass().isInstance(value);
	}

	private static JavaType resolve(Type type) {
		Assert.isTrue(!hasTypeVariable(type), "Type " + type.getTypeName()
				+ " contains an unresolved type variable and cannot identify context values");
		if (type instanceof Class<?> clazz && clazz.isPrimitive()) {
			type = ClassUtil.wrapperType(clazz);
		}
		return TypeFactory.defaultInstance().constructType(type);
	}

	private static boolean hasTypeVariable(Type type) {
		if (type instanceof TypeVariable<?>) {
			return true;
		}
		if (type instanceof ParameterizedType parameterized) {
			for (Type argument : parameterized.getActualTypeArguments()) {
				if (hasTypeVariable(argument)) {
					return true;
				}
			}
			return parameterized.getOwnerType() != null && hasTypeVariable(parameterized.getOwnerType());
		}
		if (type instanceof GenericArrayType array) {
			return hasTypeVariable(array.getGenericComponentType());
		}
		if (type instanceof WildcardType wildcard) {
			for (Type bound : wildcard.getUpperBounds()) {
				if (hasTypeVariable(bound)) {
					return true;
				}
			}
			for (Type bound : wildcard.getLowerBounds()) {
				if (hasTypeVariable(bound)) {
					return true;
				}
			}
		}
		return false;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof TypeTag<?> other)) {
			return false;
		}
		return this.type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return this.type.hashCode();
	}

	@Override
	public String toString() {
		return this.type.toCanonical();
	}

	private static final class Resolved<T> extends TypeTag<T> {

		Resolved(JavaType type) {
			super(type);
		}

	}

}
