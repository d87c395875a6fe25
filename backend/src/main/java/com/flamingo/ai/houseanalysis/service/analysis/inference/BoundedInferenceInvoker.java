package com.flamingo.ai.houseanalysis.service.analysis.inference;

import com.flamingo.ai.houseanalysis.domain.model.InferenceOutcome;
import com.flamingo.ai.houseanalysis.domain.model.InferenceRequest;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.annotation.Timed;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Submits a completion request and races it against a hard deadline.
 *
 * <p>The call runs on the inference executor while the request thread waits on a Resilience4j
 * {@link TimeLimiter}. When the deadline wins, the outcome is {@link InferenceOutcome.TimedOut} and
 * the in-flight call is abandoned: it is neither cancelled nor retried. Transport failures map to
 * {@link InferenceOutcome.UpstreamFailure}. This method never throws.
 */
@Service
@Slf4j
public class BoundedInferenceInvoker {

  private final InferenceClient inferenceClient;
  private final TimeLimiter timeLimiter;
  private final Executor inferenceExecutor;

  public BoundedInferenceInvoker(
      InferenceClient inferenceClient,
      TimeLimiter inferenceTimeLimiter,
      @Qualifier("inferenceExecutor") Executor inferenceExecutor) {
    this.inferenceClient = inferenceClient;
    this.timeLimiter = inferenceTimeLimiter;
    this.inferenceExecutor = inferenceExecutor;
  }

  @Timed(value = "analysis.inference", description = "Time waiting for the completion call")
  public InferenceOutcome invoke(InferenceRequest request) {
    Duration deadline = timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    Callable<String> bounded =
        TimeLimiter.decorateFutureSupplier(
            timeLimiter,
            () ->
                CompletableFuture.supplyAsync(
                    () -> inferenceClient.complete(request), inferenceExecutor));

    log.info(
        "Submitting completion with {} asset(s), deadline {}s",
        request.assetRefs().size(),
        deadline.toSeconds());
    try {
      String rawText = bounded.call();
      log.info("Completion received");
      log.debug("Completion text: {}", rawText);
      return InferenceOutcome.success(rawText);
    } catch (TimeoutException e) {
      log.warn("Completion exceeded the {}s deadline, abandoning the call", deadline.toSeconds());
      return InferenceOutcome.timedOut(deadline);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for completion");
      return InferenceOutcome.upstreamFailure("interrupted while waiting for completion");
    } catch (Exception e) {
      log.error("Completion call failed: {}", e.getMessage());
      return InferenceOutcome.upstreamFailure(
          e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
  }
}
