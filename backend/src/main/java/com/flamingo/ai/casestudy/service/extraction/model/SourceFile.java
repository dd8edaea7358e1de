package com.flamingo.ai.casestudy.service.extraction.model;

import java.nio.file.Path;

/**
 * A local file queued for extraction.
 *
 * @param path location on disk
 * @param fileName base name of the file
 * @param type resolved format
 * @param sizeBytes file size
 */
public record SourceFile(Path path, String fileName, SourceType type, long sizeBytes) {}
