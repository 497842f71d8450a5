package com.di.jobcost.pricing;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Builds the {@link RetryTemplate} used around pricing-catalog calls: {@code maxAttempts} attempts with
 * exponential backoff starting at {@code initialDelayMs}. The last failure is rethrown once the attempts
 * are spent; the calling thread blocks while waiting.
 */
@Slf4j
public final class PricingRetryTemplates {

    private PricingRetryTemplates() {}

    /**
     * @param sleeper pause between attempts; {@link org.springframework.retry.backoff.ThreadWaitSleeper} in production
     */
    public static RetryTemplate from(PricingProperties.Retry retry, Sleeper sleeper) {
        if (retry.getMaxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + retry.getMaxAttempts());
        }
        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(Math.max(1L, retry.getInitialDelayMs()));
        backOff.setMultiplier(Math.max(1.0, retry.getMultiplier()));
        backOff.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(new SimpleRetryPolicy(retry.getMaxAttempts()));
        template.setBackOffPolicy(backOff);
        template.registerListener(new AttemptLogger(retry.getMaxAttempts()));
        return template;
    }

    private static final class AttemptLogger implements RetryListener {

        private final int maxAttempts;

        AttemptLogger(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        @Override
        public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                     Throwable throwable) {
            log.debug("[RETRY] Catalog call failed on attempt {}/{}: {}",
                    context.getRetryCount(), maxAttempts, throwable.getMessage());
        }
    }
}
