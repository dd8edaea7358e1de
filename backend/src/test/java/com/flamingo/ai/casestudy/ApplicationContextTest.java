package com.flamingo.ai.casestudy;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.casestudy.agent.CaseStudyWriterAgent;
import com.flamingo.ai.casestudy.service.CaseStudyService;
import com.flamingo.ai.casestudy.service.extraction.FormatReaderRouter;
import com.flamingo.ai.casestudy.service.extraction.model.ExtractedDocument;
import com.flamingo.ai.casestudy.service.extraction.model.SourceType;
import com.flamingo.ai.casestudy.service.generation.GenerativeBackend;
import com.flamingo.ai.casestudy.service.generation.model.CaseStudy;
import com.flamingo.ai.casestudy.service.generation.model.GenerationMode;
import com.flamingo.ai.casestudy.service.generation.model.ImprovementMode;
import dev.langchain4j.model.chat.ChatModel;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the application wires up without an API key: no model or agent beans exist and every
 * case study comes from the heuristic generator.
 */
@SpringBootTest(properties = "langchain4j.openai.api-key=")
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Autowired private CaseStudyService caseStudyService;

  @TempDir Path tempDir;

  @Test
  @DisplayName("Application context should load without backend beans")
  void contextLoadsWithoutBackend() {
    assertThat(applicationContext.getBeansOfType(ChatModel.class)).isEmpty();
    assertThat(applicationContext.getBeansOfType(CaseStudyWriterAgent.class)).isEmpty();
    assertThat(applicationContext.getBeansOfType(GenerativeBackend.class)).isEmpty();
    assertThat(applicationContext.getBean(FormatReaderRouter.class).route(SourceType.PPTX))
        .isNotNull();
  }

  @Test
  @DisplayName("Case studies should fall back to heuristics end to end")
  void shouldGenerateFallbackCaseStudy_whenNoBackend() throws Exception {
    Path file =
        Files.writeString(
            tempDir.resolve("story.txt"),
            "WAREHOUSE MODERNISATION\nChallenge:\nOrders shipped late.\n"
                + "Solution:\nRobotic picking was introduced.\n");

    ExtractedDocument doc = caseStudyService.processDocument(file.toString());
    CaseStudy caseStudy = caseStudyService.generateCaseStudy(doc);

    assertThat(caseStudy.generationMode()).isEqualTo(GenerationMode.FALLBACK);
    assertThat(caseStudy.title()).isEqualTo("WAREHOUSE MODERNISATION");
    assertThat(caseStudy.challenge()).isEqualTo("Orders shipped late.");
    assertThat(caseStudyService.improveText("Keep me", ImprovementMode.IMPROVE))
        .isEqualTo("Keep me");
  }
}
