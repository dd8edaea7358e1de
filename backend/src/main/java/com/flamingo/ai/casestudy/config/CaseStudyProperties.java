package com.flamingo.ai.casestudy.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for document extraction and case study generation. */
@Configuration
@ConfigurationProperties(prefix = "casestudy")
@Getter
@Setter
public class CaseStudyProperties {

  private static final long MB = 1024L * 1024L;

  private Limits limits = new Limits();
  private Pdf pdf = new Pdf();
  private Pptx pptx = new Pptx();
  private Text text = new Text();
  private Web web = new Web();
  private Generation generation = new Generation();

  @Getter
  @Setter
  public static class Limits {
    private long maxFileBytes = 100 * MB;
    private long maxTotalBytes = 200 * MB;

    /** Above this size images are skipped and generative processing is bypassed. */
    private long largeFileBytes = 15 * MB;

    /** Above this size image extraction is never attempted. */
    private long veryLargeFileBytes = 25 * MB;

    private long ingestTextCapFileBytes = 50 * MB;
    private int ingestTextCapChars = 1_000_000;
    private int ingestHeadChars = 200_000;
    private int ingestTailChars = 100_000;
  }

  @Getter
  @Setter
  public static class Pdf {
    private float renderDpi = 150f;
    private float fallbackRenderDpi = 100f;
    private int renderTimeoutSeconds = 60;
    private float jpegQuality = 0.85f;
  }

  @Getter
  @Setter
  public static class Pptx {
    private int maxImages = 100;
    private int slideBatchSize = 30;
    private int samplingThreshold = 50;
    private int sampleHead = 10;
    private int sampleTail = 10;
    private int sampleStride = 5;
    private int minImagePixels = 50;
    private int maxImageDimension = 1000;
    private float jpegQuality = 0.75f;
    private float fallbackJpegQuality = 0.70f;
    private int fillImageSlideLimit = 20;
  }

  @Getter
  @Setter
  public static class Text {
    private List<String> encodings =
        new ArrayList<>(List.of("UTF-8", "windows-1252", "ISO-8859-1"));
  }

  @Getter
  @Setter
  public static class Web {
    private int timeoutMillis = 20_000;
    private String userAgent = "Mozilla/5.0 (compatible; CaseStudyBot/1.0)";
  }

  @Getter
  @Setter
  public static class Generation {
    private int hardCapChars = 200_000;
    private int largeInputChars = 20_000;
    private long absoluteFileCapBytes = 100 * MB;
    private int maxAttempts = 3;
    private long backoffBaseMillis = 2_000;
    private long backoffMaxMillis = 16_000;
    private int timeoutSeconds = 30;
    private int largeTimeoutSeconds = 60;
    private int maxImages = 3;
  }
}
