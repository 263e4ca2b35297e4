/**
 * Side-effect callbacks run when an attempt fails with a qualifying exception,
 * and the ordered {@link com.sailfish.retry.callback.CallbackRegistry} that decides which of them run.
 */
package com.sailfish.retry.callback;
