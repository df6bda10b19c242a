package com.marketplace.realtime.throttler;

import javax.annotation.Nonnull;

/**
 * Rate limits invocations of a single target by coalescing values that arrive too close
 * together.
 *
 * @param <T> the type of value delivered to the target
 */
public interface Throttler<T> {

    /**
     * Offers a value for delivery.
     *
     * <p>If the minimum interval since the previous delivery has elapsed the value is delivered
     * on the calling thread and {@link ThrottleResult#PROCEED} is returned. Otherwise the value
     * is kept for a single trailing delivery once the interval elapses; a later offer within
     * the same window replaces it (last value wins).
     *
     * @param value the value to deliver
     * @return how the value was handled
     * @throws NullPointerException if {@code value} is {@code null}
     */
    ThrottleResult offer(@Nonnull T value);

    /**
     * Discards a parked value, if any, without delivering it. The throttler stays usable.
     *
     * @return {@code true} if a parked value was discarded
     */
    boolean cancel();

    /**
     * Discards any parked value and rejects all later offers.
     */
    void shutdown();
}
