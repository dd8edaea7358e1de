package com.flamingo.ai.casestudy.service.generation.model;

/** States of the narrative generation state machine. */
public enum GenerationState {
  INIT,
  SIZE_CHECK,
  FALLBACK_DIRECT,
  ATTEMPT_GENERATIVE,
  RETRY_GENERATIVE,
  FALLBACK_AFTER_FAILURE,
  SUCCESS,
  DONE
}
