package com.phillippitts.surveyprogress.domain;

import java.util.Objects;

/**
 * Tri-state outcome of an asynchronous operation or derived value.
 *
 * <p>An {@code AsyncResult} is the value held by a latest-value cell, not an event in a
 * history: consumers only ever care about the most recent one.
 *
 * <ul>
 *   <li>{@link Pending} - the value has not been computed yet</li>
 *   <li>{@link Success} - the value was computed (may be {@code null} for {@code Void} results)</li>
 *   <li>{@link Failure} - computing the value failed with the carried error</li>
 * </ul>
 *
 * @param <T> type of the successful value
 */
public sealed interface AsyncResult<T> permits AsyncResult.Pending, AsyncResult.Success, AsyncResult.Failure {

    /**
     * Returns a pending result.
     */
    static <T> AsyncResult<T> pending() {
        return new Pending<>();
    }

    /**
     * Returns a successful result carrying {@code value}.
     */
    static <T> AsyncResult<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * Returns a failed result carrying {@code error}.
     *
     * @throws NullPointerException if error is null
     */
    static <T> AsyncResult<T> failure(Throwable error) {
        return new Failure<>(error);
    }

    default boolean isPending() {
        return this instanceof Pending;
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    default boolean isFailure() {
        return this instanceof Failure;
    }

    /** The value has not been computed yet. */
    record Pending<T>() implements AsyncResult<T> {
    }

    /** The value was computed successfully. */
    record Success<T>(T value) implements AsyncResult<T> {
    }

    /** Computing the value failed. */
    record Failure<T>(Throwable error) implements AsyncResult<T> {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }
    }
}
