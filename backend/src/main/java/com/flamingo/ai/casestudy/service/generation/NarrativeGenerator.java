package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.config.CaseStudyProperties;
import com.flamingo.ai.casestudy.exception.ErrorCategory;
import com.flamingo.ai.casestudy.exception.LlmServiceException;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedImage;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudyDraft;
import com.flamingo.ai.casestudy.service.generation.model.GenerationMode;
import com.flamingo.ai.casestudy.service.generation.model.GenerationState;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Turns an extracted document into a case study, preferring the generative backend and always
 * ending with a result.
 *
 * <p>Runs the state machine {@code INIT -> SIZE_CHECK -> {FALLBACK_DIRECT | ATTEMPT_GENERATIVE}
 * -> {SUCCESS | RETRY_GENERATIVE | FALLBACK_AFTER_FAILURE} -> DONE}. Each attempt runs on the
 * generation executor under a Resilience4j {@link TimeLimiter} that cancels the running task on
 * timeout. Attempts are strictly sequential. Truncation only ever applies to the text sent to the
 * backend; the fallback generator always receives the original document.
 */
@Service
@Slf4j
public class NarrativeGenerator {

  private final Optional<GenerativeBackend> backend;
  private final FallbackCaseStudyGenerator fallbackGenerator;
  private final SizeGovernor sizeGovernor;
  private final ContentTruncator truncator;
  private final ImageSelector imageSelector;
  private final CaseStudyProperties properties;
  private final AsyncTaskExecutor executor;
  private final MeterRegistry meterRegistry;

  public NarrativeGenerator(
      Optional<GenerativeBackend> backend,
      FallbackCaseStudyGenerator fallbackGenerator,
      SizeGovernor sizeGovernor,
      ContentTruncator truncator,
      ImageSelector imageSelector,
      CaseStudyProperties properties,
      @Qualifier("generationExecutor") AsyncTaskExecutor executor,
      MeterRegistry meterRegistry) {
    this.backend = backend;
    this.fallbackGenerator = fallbackGenerator;
    this.sizeGovernor = sizeGovernor;
    this.truncator = truncator;
    this.imageSelector = imageSelector;
    this.properties = properties;
    this.executor = executor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Generates a case study. Never throws for a failed generative attempt.
   *
   * @param document extracted document
   * @param audience target audience, {@code general} when null or blank
   * @return the case study, written by the backend or by the heuristic generator
   */
  public CaseStudy generate(ExtractedDocument document, String audience) {
    String target = audience == null || audience.isBlank() ? "general" : audience.strip();
    GenerationState state = transition(GenerationState.INIT, GenerationState.SIZE_CHECK);

    Optional<String> rejection = sizeGovernor.generationRejection(document);
    if (rejection.isPresent() || backend.isEmpty()) {
      String reason = rejection.orElse("backend_unavailable");
      transition(state, GenerationState.FALLBACK_DIRECT);
      return fallback(document, target, reason);
    }

    boolean largeInput = sizeGovernor.isLargeInput(document.text());
    String content =
        largeInput
            ? truncator.truncateForGeneration(
                document.text(), document.structuredContent().sections())
            : document.text();
    if (largeInput) {
      log.info(
          "Truncated {} chars to {} chars before generation",
          document.text().length(),
          content.length());
    }

    Duration timeout = sizeGovernor.attemptTimeout(largeInput);
    int maxAttempts = Math.max(1, properties.getGeneration().getMaxAttempts());
    state = transition(state, GenerationState.ATTEMPT_GENERATIVE);

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        CaseStudyDraft draft = attempt(content, target, largeInput, timeout);
        transition(state, GenerationState.SUCCESS);
        meterRegistry.counter("casestudy.generation.backend.success").increment();
        CaseStudy caseStudy = toCaseStudy(draft, document, target);
        transition(GenerationState.SUCCESS, GenerationState.DONE);
        return caseStudy;
      } catch (TimeoutException e) {
        log.warn("Generation attempt {} timed out after {}s", attempt, timeout.toSeconds());
        transition(state, GenerationState.FALLBACK_AFTER_FAILURE);
        return fallback(document, target, "timeout");
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        transition(state, GenerationState.FALLBACK_AFTER_FAILURE);
        return fallback(document, target, "interrupted");
      } catch (LlmServiceException e) {
        log.warn(
            "Generation attempt {}/{} failed [{}]: {}",
            attempt,
            maxAttempts,
            e.getCategory().getCode(),
            e.getMessage());
        if (e.isRateLimited() || attempt == maxAttempts) {
          transition(state, GenerationState.FALLBACK_AFTER_FAILURE);
          return fallback(document, target, e.isRateLimited() ? "rate_limited" : "exhausted");
        }
        content = nextContent(content, e, attempt);
        state = transition(state, GenerationState.RETRY_GENERATIVE);
        meterRegistry.counter("casestudy.generation.retries").increment();
        if (!pause(backoff(e, attempt))) {
          transition(state, GenerationState.FALLBACK_AFTER_FAILURE);
          return fallback(document, target, "interrupted");
        }
      }
    }
    // unreachable: the last attempt either succeeds or falls back
    return fallback(document, target, "exhausted");
  }

  // ---- private helpers ----

  private CaseStudyDraft attempt(
      String content, String audience, boolean largeInput, Duration timeout)
      throws TimeoutException, InterruptedException {
    TimeLimiter timeLimiter =
        TimeLimiter.of(
            "casestudy-generation",
            TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
    GenerativeBackend generativeBackend = backend.orElseThrow();
    try {
      return timeLimiter.executeFutureSupplier(
          () -> executor.submit(() -> generativeBackend.generate(content, audience, largeInput)));
    } catch (TimeoutException | InterruptedException | LlmServiceException e) {
      throw e;
    } catch (Exception e) {
      throw new LlmServiceException("Generation attempt failed: " + e.getMessage(), e);
    }
  }

  private String nextContent(String content, LlmServiceException error, int failedAttempts) {
    if (error.isTransient()) {
      double ratio = 0.7 - 0.1 * failedAttempts;
      String escalated = truncator.escalate(content, ratio);
      log.info("Escalated truncation to {} chars (ratio {})", escalated.length(), ratio);
      return escalated;
    }
    if (error.getCategory() == ErrorCategory.LLM_CONTEXT_LIMIT) {
      String shrunk = truncator.shrinkForContextLimit(content);
      log.info("Context limit reached, retrying with {} chars", shrunk.length());
      return shrunk;
    }
    return content;
  }

  private Duration backoff(LlmServiceException error, int failedAttempts) {
    CaseStudyProperties.Generation generation = properties.getGeneration();
    long base = generation.getBackoffBaseMillis();
    if (base <= 0) {
      return Duration.ZERO;
    }
    if (error.isTransient()) {
      IntervalFunction exponential =
          IntervalFunction.ofExponentialBackoff(base, 2.0, generation.getBackoffMaxMillis());
      return Duration.ofMillis(exponential.apply(failedAttempts));
    }
    return Duration.ofMillis(Math.min(base * failedAttempts, generation.getBackoffMaxMillis()));
  }

  /** Sleeps for the backoff; returns {@code false} if interrupted. */
  boolean pause(Duration delay) {
    if (delay.isZero()) {
      return true;
    }
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private CaseStudy toCaseStudy(CaseStudyDraft draft, ExtractedDocument document, String audience) {
    return new CaseStudy(
        draft.title(),
        draft.challenge(),
        draft.approach(),
        draft.solution(),
        draft.outcomes(),
        draft.summary(),
        draft.keyPoints(),
        selectImages(document, draft),
        audience,
        GenerationMode.GENERATIVE);
  }

  private List<ExtractedImage> selectImages(ExtractedDocument document, CaseStudyDraft draft) {
    return imageSelector
        .select(document.images(), draft.narrativeText(), properties.getGeneration().getMaxImages())
        .stream()
        .map(image -> image.withSelectedForNarrative(true))
        .toList();
  }

  private CaseStudy fallback(ExtractedDocument document, String audience, String reason) {
    log.info("Falling back to heuristic generation: {}", reason);
    meterRegistry.counter("casestudy.generation.fallback", "reason", reason).increment();
    CaseStudy caseStudy = fallbackGenerator.generate(document, audience);
    log.debug("Generation finished with fallback ({})", reason);
    return caseStudy;
  }

  private GenerationState transition(GenerationState from, GenerationState to) {
    log.debug("Generation state {} -> {}", from, to);
    return to;
  }
}
