package com.sailfish.retry.policy;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * What an execution produces once every allowed attempt has failed.
 *
 * @param <R> The result type the action produces.
 */
public final class ExhaustionAction<R> {

    /**
     * The available dispositions.
     */
    public enum Kind {
        /**
         * Propagate the last failure to the caller.
         */
        RERAISE,
        /**
         * Return the last failure as the execution's normal result.
         */
        RETURN_FAILURE,
        /**
         * Return the value computed by a blocking fallback function.
         */
        FALLBACK,
        /**
         * Return the value of the stage produced by an asynchronous fallback function.
         */
        ASYNC_FALLBACK
    }

    private static final ExhaustionAction<?> RERAISE = new ExhaustionAction<>(Kind.RERAISE, null, null);
    private static final ExhaustionAction<Exception> RETURN_FAILURE = new ExhaustionAction<>(Kind.RETURN_FAILURE, null, null);

    private final Kind kind;
    private final Function<? super Exception, ? extends R> fallback;
    private final Function<? super Exception, ? extends CompletionStage<? extends R>> asyncFallback;

    private ExhaustionAction(Kind kind,
                             Function<? super Exception, ? extends R> fallback,
                             Function<? super Exception, ? extends CompletionStage<? extends R>> asyncFallback) {
        this.kind = kind;
        this.fallback = fallback;
        this.asyncFallback = asyncFallback;
    }

    @SuppressWarnings("unchecked") // Carries no value of type R
    public static <R> ExhaustionAction<R> reraise() {
        return (ExhaustionAction<R>) RERAISE;
    }

    /**
     * Returns the causing failure instead of throwing it. Only accepted by policies whose
     * result type is a supertype of {@link Exception}.
     */
    public static ExhaustionAction<Exception> returnFailure() {
        return RETURN_FAILURE;
    }

    /**
     * Substitutes the value computed from the causing failure. For blocking policies only.
     */
    public static <R> ExhaustionAction<R> fallback(Function<? super Exception, ? extends R> fallback) {
        Objects.requireNonNull(fallback, "fallback cannot be null");
        return new ExhaustionAction<>(Kind.FALLBACK, fallback, null);
    }

    /**
     * Substitutes the value of the stage computed from the causing failure. For asynchronous policies only.
     */
    public static <R> ExhaustionAction<R> asyncFallback(
            Function<? super Exception, ? extends CompletionStage<? extends R>> fallback) {
        Objects.requireNonNull(fallback, "fallback cannot be null");
        return new ExhaustionAction<>(Kind.ASYNC_FALLBACK, null, fallback);
    }

    /**
     * The execution mode this action is restricted to, or {@code null} if it works in both.
     */
    public ExecutionMode requiredMode() {
        switch (kind) {
            case FALLBACK:
                return ExecutionMode.BLOCKING;
            case ASYNC_FALLBACK:
                return ExecutionMode.SUSPENDING;
            default:
                return null;
        }
    }

    public Kind getKind() { return kind; }
    public Function<? super Exception, ? extends R> getFallback() { return fallback; }
    public Function<? super Exception, ? extends CompletionStage<? extends R>> getAsyncFallback() { return asyncFallback; }

    @Override
    public String toString() {
        return "ExhaustionAction{" + kind + '}';
    }
}
