package com.flamingo.ai.casestudy.service.extraction.model;

import java.util.Set;

/**
 * Coarse named entities found by regular expressions. Sets keep first-seen order.
 *
 * @param organizations capitalised names followed by a legal-entity suffix
 * @param people honorific-prefixed two-word names
 * @param dates date strings in any of the recognised formats
 */
public record DocumentEntities(Set<String> organizations, Set<String> people, Set<String> dates) {

  public static DocumentEntities empty() {
    return new DocumentEntities(Set.of(), Set.of(), Set.of());
  }
}
