package com.flamingo.ai.casestudy.service.extraction.model;

/**
 * A heading-delimited slice of a document's text.
 *
 * @param title heading line (or {@code Introduction} for content before the first heading)
 * @param content raw body lines under the heading, newline-terminated
 */
public record DocumentSection(String title, String content) {}
