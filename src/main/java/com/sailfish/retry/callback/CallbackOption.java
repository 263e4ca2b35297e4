package com.sailfish.retry.callback;

/**
 * Flags modifying how a registered callback is dispatched.
 */
public enum CallbackOption {
    /**
     * Invoke the callback on the final allowed attempt as well. Without it the callback
     * is skipped once no attempts remain.
     */
    RUN_ON_LAST_ATTEMPT,
    /**
     * Stop scanning later registry entries for the current failure after this callback ran.
     */
    BREAK_OUT
}
