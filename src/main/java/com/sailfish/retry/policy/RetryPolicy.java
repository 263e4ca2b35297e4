package com.sailfish.retry.policy;

import com.sailfish.retry.callback.AsyncFailureCallback;
import com.sailfish.retry.callback.CallbackRegistry;
import com.sailfish.retry.callback.FailureCallback;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable description of how failed operations are retried: which exceptions qualify,
 * how many retries are allowed, the delay between attempts, the callbacks run on failure
 * and what happens once attempts are exhausted.
 * <p>
 * A policy is validated once, when built, and can be shared by any number of concurrent executions.
 *
 * @param <R> The result type of the executions it governs.
 */
public final class RetryPolicy<R> {

    /** Sentinel for {@code maxRetries}: retry until the operation succeeds. */
    public static final int UNLIMITED_RETRIES = -1;

    public static final int DEFAULT_MAX_RETRIES = 1;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ZERO;
    public static final Class<Exception> DEFAULT_RETRY_ON = Exception.class;

    private final ExecutionMode mode;
    private final List<Class<? extends Exception>> retryOn;
    private final int maxRetries;
    private final Duration baseDelay;
    private final boolean exponential;
    private final Jitter jitter;
    private final Duration maxDelay; // Optional: null when uncapped
    private final ExhaustionAction<? extends R> exhaustionAction;
    private final CallbackRegistry<?> callbacks;

    private RetryPolicy(Builder<R> builder, CallbackRegistry<?> callbacks) {
        this.mode = builder.mode;
        this.retryOn = Collections.unmodifiableList(new ArrayList<>(builder.retryOn));
        this.maxRetries = builder.maxRetries;
        this.baseDelay = builder.baseDelay;
        this.exponential = builder.exponential;
        this.jitter = builder.jitter;
        this.maxDelay = (builder.maxDelay != null && !builder.maxDelay.isZero()) ? builder.maxDelay : null;
        this.exhaustionAction = builder.exhaustionAction;
        this.callbacks = callbacks;
    }

    /**
     * Starts a policy for blocking executions.
     */
    public static <R> Builder<R> builder() {
        return new Builder<>(ExecutionMode.BLOCKING);
    }

    /**
     * Starts a policy for asynchronous executions.
     */
    public static <R> Builder<R> asyncBuilder() {
        return new Builder<>(ExecutionMode.SUSPENDING);
    }

    /**
     * True if the failure is an instance of one of the exception types this policy retries on.
     */
    public boolean qualifies(Throwable failure) {
        for (Class<? extends Exception> type : retryOn) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }

    public boolean isUnbounded() {
        return maxRetries == UNLIMITED_RETRIES;
    }

    /**
     * Total number of attempts ({@code maxRetries + 1}), or empty when unbounded.
     */
    public OptionalInt totalAttempts() {
        return isUnbounded() ? OptionalInt.empty() : OptionalInt.of(maxRetries + 1);
    }

    /**
     * True once {@code failedAttempts} failures have used up the attempt budget.
     */
    public boolean isExhausted(int failedAttempts) {
        return !isUnbounded() && failedAttempts > maxRetries;
    }

    @SuppressWarnings("unchecked") // Blocking registries are only ever built with FailureCallback
    public CallbackRegistry<FailureCallback> blockingCallbacks() {
        PolicyValidator.requireMode(this, ExecutionMode.BLOCKING);
        return (CallbackRegistry<FailureCallback>) callbacks;
    }

    @SuppressWarnings("unchecked") // Asynchronous registries are only ever built with AsyncFailureCallback
    public CallbackRegistry<AsyncFailureCallback> asyncCallbacks() {
        PolicyValidator.requireMode(this, ExecutionMode.SUSPENDING);
        return (CallbackRegistry<AsyncFailureCallback>) callbacks;
    }

    // --- Getters for configuration ---
    public ExecutionMode getMode() { return mode; }
    public List<Class<? extends Exception>> getRetryOn() { return retryOn; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getBaseDelay() { return baseDelay; }
    public boolean isExponential() { return exponential; }
    public Jitter getJitter() { return jitter; }
    public Optional<Duration> getMaxDelay() { return Optional.ofNullable(maxDelay); }
    public ExhaustionAction<? extends R> getExhaustionAction() { return exhaustionAction; }
    public CallbackRegistry<?> getCallbacks() { return callbacks; }

    @Override
    public String toString() {
        return "RetryPolicy{" +
               "mode=" + mode +
               ", retryOn=" + retryOn +
               ", maxRetries=" + maxRetries +
               ", baseDelay=" + baseDelay +
               ", exponential=" + exponential +
               ", jitter=" + jitter +
               ", maxDelay=" + maxDelay +
               ", exhaustionAction=" + exhaustionAction +
               '}';
    }

    /**
     * Collects policy parameters; {@link #build()} validates them.
     *
     * @param <R> The result type of the executions the policy governs.
     */
    public static final class Builder<R> {

        private final ExecutionMode mode;
        private Set<Class<? extends Exception>> retryOn = new LinkedHashSet<>(List.of(DEFAULT_RETRY_ON));
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration baseDelay = DEFAULT_BASE_DELAY;
        private boolean exponential;
        private Jitter jitter = Jitter.none();
        private Duration maxDelay;
        private ExhaustionAction<? extends R> exhaustionAction = ExhaustionAction.reraise();
        private CallbackRegistry<?> callbacks;

        private Builder(ExecutionMode mode) {
            this.mode = mode;
        }

        /**
         * Replaces the exception types that trigger a retry. Other exceptions propagate immediately.
         */
        @SafeVarargs
        public final Builder<R> retryOn(Class<? extends Exception>... types) {
            Objects.requireNonNull(types, "types cannot be null");
            Set<Class<? extends Exception>> replacement = new LinkedHashSet<>();
            for (Class<? extends Exception> type : Arrays.asList(types)) {
                replacement.add(Objects.requireNonNull(type, "retryOn type cannot be null"));
            }
            this.retryOn = replacement;
            return this;
        }

        /**
         * @param maxRetries Retries after the first attempt, or {@link #UNLIMITED_RETRIES}.
         */
        public Builder<R> maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder<R> unlimitedRetries() {
            return maxRetries(UNLIMITED_RETRIES);
        }

        public Builder<R> baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
            return this;
        }

        public Builder<R> exponential(boolean exponential) {
            this.exponential = exponential;
            return this;
        }

        public Builder<R> jitter(Jitter jitter) {
            this.jitter = Objects.requireNonNull(jitter, "jitter cannot be null");
            return this;
        }

        /**
         * @param maxDelay Cap for exponential delays; null or {@link Duration#ZERO} disables it.
         */
        public Builder<R> maxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
            return this;
        }

        public Builder<R> onExhaustion(ExhaustionAction<? extends R> exhaustionAction) {
            this.exhaustionAction = Objects.requireNonNull(exhaustionAction, "exhaustionAction cannot be null");
            return this;
        }

        /**
         * Sets the failure callbacks. Their mode must match the policy's.
         */
        public Builder<R> callbacks(CallbackRegistry<?> callbacks) {
            this.callbacks = Objects.requireNonNull(callbacks, "callbacks cannot be null");
            return this;
        }

        /**
         * @throws RetryConfigurationException if the parameters are inconsistent.
         */
        public RetryPolicy<R> build() {
            CallbackRegistry<?> registry = callbacks;
            if (registry == null) {
                registry = mode == ExecutionMode.BLOCKING ? CallbackRegistry.none() : CallbackRegistry.noneAsync();
            }
            PolicyValidator.validate(mode, retryOn, maxRetries, baseDelay, exponential, maxDelay, jitter,
                    exhaustionAction, registry);
            return new RetryPolicy<>(this, registry);
        }
    }
}
