package com.sailfish.retry.callback;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * One registry entry: an exception type, the callback for it and its options.
 *
 * @param <C> The callback type.
 */
public final class CallbackEntry<C> {

    private final Class<? extends Exception> failureType;
    private final C callback;
    private final Set<CallbackOption> options;

    CallbackEntry(Class<? extends Exception> failureType, C callback, Set<CallbackOption> options) {
        this.failureType = Objects.requireNonNull(failureType, "failureType cannot be null");
        this.callback = Objects.requireNonNull(callback, "callback cannot be null");
        EnumSet<CallbackOption> copy = EnumSet.noneOf(CallbackOption.class);
        copy.addAll(options);
        this.options = Collections.unmodifiableSet(copy);
    }

    /**
     * True if the failure is an instance of this entry's type or one of its subtypes.
     */
    public boolean matches(Throwable failure) {
        return failureType.isInstance(failure);
    }

    public boolean hasOption(CallbackOption option) {
        return options.contains(option);
    }

    boolean skippedOn(boolean lastAttempt) {
        return lastAttempt && !hasOption(CallbackOption.RUN_ON_LAST_ATTEMPT);
    }

    public Class<? extends Exception> getFailureType() { return failureType; }
    public C getCallback() { return callback; }
    public Set<CallbackOption> getOptions() { return options; }

    @Override
    public String toString() {
        return "CallbackEntry{" +
               "failureType=" + failureType.getName() +
               ", options=" + options +
               '}';
    }
}
