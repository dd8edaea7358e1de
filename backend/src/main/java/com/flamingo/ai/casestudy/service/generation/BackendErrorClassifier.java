package com.flamingo.ai.casestudy.service.generation;

import com.flamingo.ai.casestudy.exception.BackendConnectionException;
import com.flamingo.ai.casestudy.exception.BackendContextLimitException;
import com.flamingo.ai.casestudy.exception.BackendRateLimitedException;
import com.flamingo.ai.casestudy.exception.BackendTimeoutException;
import com.flamingo.ai.casestudy.exception.LlmServiceException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import org.springframework.stereotype.Component;

/**
 * Maps raw client exceptions to the backend error taxonomy by walking the cause chain.
 *
 * <p>Rate-limit and context-length wording take precedence over the transport-level type, since
 * HTTP clients wrap both in generic exceptions.
 */
@Component
public class BackendErrorClassifier {

  private static final List<String> RATE_LIMIT_HINTS =
      List.of("429", "rate limit", "rate_limit", "too many requests");

  private static final List<String> CONTEXT_LIMIT_HINTS =
      List.of("maximum context length", "context_length", "token limit", "context length");

  /**
   * Classifies a failure raised by the generative backend.
   *
   * @param error raw exception
   * @return a typed {@link LlmServiceException}
   */
  public LlmServiceException classify(Throwable error) {
    List<Throwable> chain = causeChain(error);
    for (Throwable t : chain) {
      if (t instanceof LlmServiceException typed) {
        return typed;
      }
    }

    String message = describe(error);
    for (Throwable t : chain) {
      String simpleName = t.getClass().getSimpleName();
      String text = lower(t.getMessage());
      if (simpleName.contains("RateLimit") || containsAny(text, RATE_LIMIT_HINTS)) {
        return new BackendRateLimitedException(message, error);
      }
      if (containsAny(text, CONTEXT_LIMIT_HINTS)) {
        return new BackendContextLimitException(message, error);
      }
    }
    for (Throwable t : chain) {
      if (t instanceof InterruptedIOException
          || t instanceof HttpTimeoutException
          || t instanceof TimeoutException
          || t.getClass().getSimpleName().equals("TimeoutException")) {
        return new BackendTimeoutException(message, error);
      }
    }
    for (Throwable t : chain) {
      if (t instanceof IOException) {
        return new BackendConnectionException(message, error);
      }
    }
    return new LlmServiceException(message, error);
  }

  // ---- private helpers ----

  private List<Throwable> causeChain(Throwable error) {
    List<Throwable> chain = new ArrayList<>();
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
      chain.add(t);
    }
    return chain;
  }

  private static String describe(Throwable error) {
    String msg = error.getMessage();
    return error.getClass().getSimpleName() + (msg != null ? ": " + msg : "");
  }

  private static String lower(String text) {
    return text != null ? text.toLowerCase(Locale.ROOT) : "";
  }

  private static boolean containsAny(String text, List<String> hints) {
    return hints.stream().anyMatch(text::contains);
  }
}
