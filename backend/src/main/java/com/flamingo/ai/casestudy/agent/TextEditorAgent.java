package com.flamingo.ai.casestudy.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent for editing a single passage of case study text. Returns plain text. */
public interface TextEditorAgent {

  @SystemMessage("You are an expert editor who improves professional writing.")
  @UserMessage(
      """
        Improve the following text to make it more professional, impactful, and persuasive:

        {{text}}
        """)
  String improve(@V("text") String text);

  @SystemMessage(
      "You are an editor who specializes in simplifying complex language while retaining meaning.")
  @UserMessage(
      """
        Simplify the following text to make it more accessible while preserving key information:

        {{text}}
        """)
  String simplify(@V("text") String text);

  @SystemMessage("You are an editor who specializes in expanding content with relevant details.")
  @UserMessage(
      """
        Expand the following text with more details and context while maintaining the
        professional tone:

        {{text}}
        """)
  String extend(@V("text") String text);
}
