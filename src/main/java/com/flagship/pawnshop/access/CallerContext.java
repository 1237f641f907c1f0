package com.flagship.pawnshop.access;

import java.util.Optional;

/**
 * Thread-local holder for the caller resolved by {@link AuthenticationFilter}.
 *
 * Set at the start of each request and cleared in the filter's finally block.
 */
public final class CallerContext {

    public static final String USER_MDC_KEY = "user";

    private static final ThreadLocal<Caller> current = new ThreadLocal<>();

    private CallerContext() {
        // Utility class
    }

    public static void set(Caller caller) {
        current.set(caller);
    }

    public static Optional<Caller> get() {
        return Optional.ofNullable(current.get());
    }

    public static void clear() {
        current.remove();
    }
}
