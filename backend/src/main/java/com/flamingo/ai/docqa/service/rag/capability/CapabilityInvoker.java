package com.flamingo.ai.docqa.service.rag.capability;

import com.flamingo.ai.docqa.config.RagConfig;
import com.flamingo.ai.docqa.exception.CapabilityUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs calls into the {@link ModelCapability} under a time limit with a bounded retry.
 *
 * <p>Each attempt runs on the capability executor and is cut off by a Resilience4j {@link
 * TimeLimiter} after {@code rag.capability.timeout}. Failed or timed-out attempts are retried with
 * exponential backoff up to {@code rag.capability.max-attempts} in total; the last failure is
 * translated into the caller's typed {@link CapabilityUnavailableException}.
 */
@Component
@Slf4j
public class CapabilityInvoker {

  private final Executor executor;
  private final MeterRegistry meterRegistry;
  private final TimeLimiterConfig timeLimiterConfig;
  private final RetryConfig retryConfig;

  /** Maps the final failure to a typed exception: (message, timedOut, cause). */
  @FunctionalInterface
  public interface FailureTranslator {
    CapabilityUnavailableException translate(String message, boolean timedOut, Throwable cause);
  }

  public CapabilityInvoker(
      @Qualifier("capabilityExecutor") Executor executor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.executor = executor;
    this.meterRegistry = meterRegistry;

    RagConfig.Capability capability = ragConfig.getCapability();
    this.timeLimiterConfig =
        TimeLimiterConfig.custom()
            .timeoutDuration(capability.getTimeout())
            .cancelRunningFuture(true)
            .build();
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, capability.getMaxAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    capability.getBackoff(), capability.getBackoffMultiplier()))
            .ignoreExceptions(InterruptedException.class)
            .build();
  }

  /**
   * Invokes the call with timeout and retry.
   *
   * @param operation short name used for logging, metrics and the retry instance
   * @param call the capability call
   * @param failureTranslator builds the typed exception thrown once all attempts failed
   * @return the call's result
   */
  public <T> T invoke(String operation, Supplier<T> call, FailureTranslator failureTranslator) {
    TimeLimiter timeLimiter = TimeLimiter.of(operation, timeLimiterConfig);
    Retry retry = Retry.of(operation, retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Capability call '{}' failed (attempt {}), retrying in {} ms: {}",
                    operation,
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval().toMillis(),
                    describe(event.getLastThrowable())));

    Callable<T> timed =
        TimeLimiter.decorateFutureSupplier(
            timeLimiter, () -> CompletableFuture.supplyAsync(call, executor));
    Callable<T> guarded = Retry.decorateCallable(retry, timed);

    try {
      T result = guarded.call();
      meterRegistry
          .counter("capability.calls", "operation", operation, "outcome", "success")
          .increment();
      return result;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      meterRegistry
          .counter("capability.calls", "operation", operation, "outcome", "interrupted")
          .increment();
      String message = String.format("Capability call '%s' was interrupted", operation);
      log.warn(message);
      throw failureTranslator.translate(message, false, e);
    } catch (Exception e) {
      Throwable cause = unwrap(e);
      boolean timedOut = cause instanceof TimeoutException;
      meterRegistry
          .counter(
              "capability.calls", "operation", operation, "outcome", timedOut ? "timeout" : "error")
          .increment();
      String message =
          String.format(
              "Capability call '%s' failed after %d attempt(s): %s",
              operation, retryConfig.getMaxAttempts(), describe(cause));
      log.error(message);
      throw failureTranslator.translate(message, timedOut, cause);
    }
  }

  private static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String describe(Throwable t) {
    if (t == null) {
      return "unknown error";
    }
    Throwable cause = unwrap(t);
    return cause.getClass().getSimpleName()
        + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
  }
}
