package org.typeset.lite.syntax;

import java.util.Objects;
import java.util.function.Function;

/**
 * A value annotated with the span of source text it was parsed from.
 * 
 * The span is metadata only: printing never looks at it, and two spanned
 * values with equal payloads print identically.
 *
 * @param value The payload
 * @param span  The source range
 * @param <T>   The payload type
 */
public record Spanned<T>(T value, Span span) {

    public Spanned {
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(span, "Span cannot be null");
    }

    /**
     * Wraps a value that has no source position.
     */
    public static <T> Spanned<T> detached(T value) {
        return new Spanned<>(value, Span.ZERO);
    }

    /**
     * Maps the payload, keeping the span.
     */
    public <U> Spanned<U> map(Function<? super T, ? extends U> mapper) {
        return new Spanned<>(mapper.apply(value), span);
    }
}
