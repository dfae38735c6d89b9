package com.baladi.common.result;

import com.baladi.common.exception.BusinessException;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a core operation: either a value or a typed {@link Failure}.
 *
 * <h3>Usage</h3>
 * <pre>
 *   return stateMachine.transition(order, OrderStatus.ACCEPTED, ActorRole.SHOP)
 *           .flatMap(accepted -> custody.verify(accepted))
 *           .map(OrderResponse::from);
 * </pre>
 *
 * <p>Callers branch with {@link #fold}. At the HTTP edge {@link #getOrThrow()}
 * converts a failure into a {@link BusinessException} for the global handler.</p>
 *
 * @param <T> success value type
 */
public sealed interface Result<T> permits Result.Success, Result.Err {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Failure failure) {
        return new Err<>(Objects.requireNonNull(failure, "failure"));
    }

    /** Success with no meaningful payload. */
    static Result<Void> ok() {
        return new Success<>(null);
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <R> Result<R> map(Function<? super T, ? extends R> mapper);

    /** Chains a step that can itself fail ("and then"). */
    <R> Result<R> flatMap(Function<? super T, Result<R>> next);

    <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super Failure, ? extends R> onFailure);

    Result<T> peek(Consumer<? super T> action);

    T getOrThrow();

    T getOrElse(Supplier<? extends T> fallback);

    /** The failure, or {@code null} on success. */
    Failure failure();

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> Result<R> flatMap(Function<? super T, Result<R>> next) {
            return next.apply(value);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess,
                          Function<? super Failure, ? extends R> onFailure) {
            return onSuccess.apply(value);
        }

        @Override
        public Result<T> peek(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public T getOrElse(Supplier<? extends T> fallback) {
            return value;
        }

        @Override
        public Failure failure() {
            return null;
        }
    }

    record Err<T>(Failure failure) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Err<>(failure);
        }

        @Override
        public <R> Result<R> flatMap(Function<? super T, Result<R>> next) {
            return new Err<>(failure);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onSuccess,
                          Function<? super Failure, ? extends R> onFailure) {
            return onFailure.apply(failure);
        }

        @Override
        public Result<T> peek(Consumer<? super T> action) {
            return this;
        }

        @Override
        public T getOrThrow() {
            throw new BusinessException(failure);
        }

        @Override
        public T getOrElse(Supplier<? extends T> fallback) {
            return fallback.get();
        }
    }
}
