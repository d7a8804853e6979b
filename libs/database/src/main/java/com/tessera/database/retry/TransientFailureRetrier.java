package com.tessera.database.retry;

import com.tessera.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs a storage call with bounded, exponentially backed-off retries on transient failures.
 * <p>
 * Only Spring's {@link TransientDataAccessException} and {@link RecoverableDataAccessException}
 * are retried. Everything else, including "not found" results and constraint violations,
 * propagates on the first attempt. Once the attempts are used up, or the wait between them is
 * interrupted, the failure is wrapped in {@link StorageUnavailableException}.
 * <p>
 * Do not wrap calls that run inside an open transaction: a failed statement may have already
 * rolled the transaction back.
 */
public class TransientFailureRetrier {

    private static final Logger log = LoggerFactory.getLogger(TransientFailureRetrier.class);

    public static final String RETRY_METRIC = "tessera.storage.retries";

    private static final String OPERATION_ATTRIBUTE = "tessera.storage.operation";

    private final RetryTemplate template;
    private final SimpleRetryPolicy retryPolicy;
    private final MetricFactory metrics;

    public TransientFailureRetrier(RetryProperties properties, MetricFactory metrics) {
        this(properties, metrics, new ThreadWaitSleeper());
    }

    /**
     * @param sleeper pauses between attempts; tests pass one that records instead of waiting
     */
    public TransientFailureRetrier(RetryProperties properties, MetricFactory metrics, Sleeper sleeper) {
        this.metrics = metrics;
        Map<Class<? extends Throwable>, Boolean> retryable =
                Map.of(TransientDataAccessException.class, true, RecoverableDataAccessException.class, true);
        this.retryPolicy = new SimpleRetryPolicy(properties.maxAttempts(), retryable);

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(properties.initialBackoff().toMillis());
        backOff.setMultiplier(properties.multiplier());
        backOff.setSleeper(sleeper);

        this.template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOff);
        template.registerListener(new RetryCounter());
    }

    /**
     * Executes the action, retrying transient failures.
     *
     * @param operation short name for logs and metrics, e.g. {@code "tenant.lookup"}
     * @throws StorageUnavailableException when every attempt failed transiently
     */
    public <T> T execute(String operation, Supplier<T> action) {
        AtomicInteger attempts = new AtomicInteger();
        RetryCallback<T, RuntimeException> callback = context -> {
            context.setAttribute(OPERATION_ATTRIBUTE, operation);
            attempts.incrementAndGet();
            return action.get();
        };
        try {
            return template.execute(callback);
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            log.error("Storage operation {} failed after {} attempt(s)", operation, attempts.get(), e);
            throw new StorageUnavailableException(operation, attempts.get(), e);
        } catch (BackOffInterruptedException e) {
            log.warn("Storage operation {} interrupted while waiting to retry", operation);
            throw new StorageUnavailableException(operation, attempts.get(), e);
        }
    }

    /** Counts and logs every failed attempt that will be followed by another one. */
    private final class RetryCounter implements RetryListener {

        @Override
        public <T, E extends Throwable> void onError(
                RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
            if (!retryPolicy.canRetry(context)) {
                return;
            }
            String operation = String.valueOf(context.getAttribute(OPERATION_ATTRIBUTE));
            log.warn("Transient failure in {} (attempt {}/{}), retrying: {}",
                    operation, context.getRetryCount(), retryPolicy.getMaxAttempts(), throwable.getMessage());
            metrics.counter(RETRY_METRIC, "Retries of transient storage failures", "operation", operation)
                    .increment();
        }
    }
}
