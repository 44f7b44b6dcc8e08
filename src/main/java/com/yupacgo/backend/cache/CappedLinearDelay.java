package com.yupacgo.backend.cache;

import io.lettuce.core.resource.Delay;

import java.time.Duration;

/** Lettuce reconnect delay following the same curve as {@link CacheRetryPolicy}. */
final class CappedLinearDelay extends Delay {

    private final CacheRetryPolicy policy;

    CappedLinearDelay(CacheRetryPolicy policy) {
        this.policy = policy;
    }

    @Override
    public Duration createDelay(long attempt) {
        return policy.delayFor(attempt);
    }
}
