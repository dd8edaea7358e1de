package com.flamingo.ai.casestudy.service.generation.model;

/** How a case study was produced. */
public enum GenerationMode {
  /** Written by the generative backend. */
  GENERATIVE,
  /** Assembled by the deterministic heuristic generator. */
  FALLBACK
}
