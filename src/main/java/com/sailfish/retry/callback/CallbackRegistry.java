package com.sailfish.retry.callback;

import com.sailfish.retry.policy.ExecutionMode;
import com.sailfish.retry.policy.RetryConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;

/**
 * Ordered mapping from exception type to callback and options.
 * Entries are kept in registration order and scanned in that order on every qualifying failure,
 * so a supertype registered first is seen before a more specific subtype registered later.
 * <p>
 * A registry is bound to one {@link ExecutionMode}: blocking registries hold {@link FailureCallback}s,
 * asynchronous ones hold {@link AsyncFailureCallback}s. The static factories cover the supported
 * shapes: no callbacks, a single callback for any qualifying failure (optionally with options),
 * and an explicit per-type mapping built with {@link #builder()} or {@link #asyncBuilder()}.
 *
 * @param <C> The callback type.
 */
public final class CallbackRegistry<C> {

    private static final Logger log = LoggerFactory.getLogger(CallbackRegistry.class);

    private static final CallbackRegistry<FailureCallback> NONE =
            new CallbackRegistry<>(ExecutionMode.BLOCKING, Collections.emptyList());
    private static final CallbackRegistry<AsyncFailureCallback> NONE_ASYNC =
            new CallbackRegistry<>(ExecutionMode.SUSPENDING, Collections.emptyList());

    private final ExecutionMode mode;
    private final List<CallbackEntry<C>> entries;

    private CallbackRegistry(ExecutionMode mode, List<CallbackEntry<C>> entries) {
        this.mode = mode;
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public static CallbackRegistry<FailureCallback> none() {
        return NONE;
    }

    public static CallbackRegistry<AsyncFailureCallback> noneAsync() {
        return NONE_ASYNC;
    }

    /**
     * A single blocking callback invoked for any qualifying failure.
     */
    public static CallbackRegistry<FailureCallback> of(FailureCallback callback, CallbackOption... options) {
        return builder().on(Exception.class, callback, options).build();
    }

    /**
     * A single asynchronous callback invoked for any qualifying failure.
     */
    public static CallbackRegistry<AsyncFailureCallback> ofAsync(AsyncFailureCallback callback, CallbackOption... options) {
        return asyncBuilder().on(Exception.class, callback, options).build();
    }

    public static Builder<FailureCallback> builder() {
        return new Builder<>(ExecutionMode.BLOCKING);
    }

    public static Builder<AsyncFailureCallback> asyncBuilder() {
        return new Builder<>(ExecutionMode.SUSPENDING);
    }

    /**
     * Selects the entries to invoke for one caught failure, in invocation order.
     * Entries whose type does not match are ignored. A matching entry is skipped on the last
     * attempt unless it has {@link CallbackOption#RUN_ON_LAST_ATTEMPT}. Scanning stops after the
     * first selected entry that has {@link CallbackOption#BREAK_OUT}; a skipped entry never stops it.
     *
     * @param failure     The caught exception.
     * @param lastAttempt Whether the failed attempt was the final allowed one.
     * @return The entries to invoke; empty if none match.
     */
    public List<CallbackEntry<C>> select(Throwable failure, boolean lastAttempt) {
        if (entries.isEmpty()) {
            return Collections.emptyList();
        }
        List<CallbackEntry<C>> selected = new ArrayList<>();
        for (CallbackEntry<C> entry : entries) {
            if (!entry.matches(failure)) {
                continue;
            }
            if (entry.skippedOn(lastAttempt)) {
                log.debug("Skipping callback for {} on last attempt", entry.getFailureType().getSimpleName());
                continue;
            }
            selected.add(entry);
            if (entry.hasOption(CallbackOption.BREAK_OUT)) {
                break;
            }
        }
        return selected;
    }

    public ExecutionMode getMode() { return mode; }
    public List<CallbackEntry<C>> getEntries() { return entries; }
    public boolean isEmpty() { return entries.isEmpty(); }

    @Override
    public String toString() {
        return "CallbackRegistry{mode=" + mode + ", entries=" + entries + '}';
    }

    /**
     * Builds a registry entry by entry, preserving registration order.
     *
     * @param <C> The callback type.
     */
    public static final class Builder<C> {

        private final ExecutionMode mode;
        private final List<CallbackEntry<C>> entries = new ArrayList<>();

        private Builder(ExecutionMode mode) {
            this.mode = mode;
        }

        /**
         * Registers a callback for an exception type and its subtypes.
         *
         * @throws RetryConfigurationException if the type is already registered.
         */
        public Builder<C> on(Class<? extends Exception> failureType, C callback, CallbackOption... options) {
            Objects.requireNonNull(failureType, "failureType cannot be null");
            Objects.requireNonNull(callback, "callback cannot be null");
            Objects.requireNonNull(options, "options cannot be null");
            for (CallbackEntry<C> existing : entries) {
                if (existing.getFailureType().equals(failureType)) {
                    throw new RetryConfigurationException("callback already registered for " + failureType.getName());
                }
            }
            EnumSet<CallbackOption> optionSet = EnumSet.noneOf(CallbackOption.class);
            optionSet.addAll(Arrays.asList(options));
            entries.add(new CallbackEntry<>(failureType, callback, optionSet));
            return this;
        }

        public CallbackRegistry<C> build() {
            return new CallbackRegistry<>(mode, entries);
        }
    }
}
