package com.flamingo.ai.casestudy.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that turns extracted document text into a case study narrative.
 *
 * <p>Both methods return the raw JSON answer so that malformed output can be classified by the
 * caller instead of failing inside the AI service proxy.
 */
public interface CaseStudyWriterAgent {

  @SystemMessage(
      "You are a professional case study writer who creates compelling business narratives.")
  @UserMessage(
      """
        Based on the following content, generate a professional case study with these sections:
        1. Challenge: Describe the key problems or challenges faced
        2. Approach: How the challenge was addressed
        3. Solution: The implemented solution
        4. Outcomes: Results and benefits achieved

        {{audienceHint}}
        Extract the most relevant information to construct a compelling narrative.
        Return ONLY valid JSON matching this structure:
        {"title": "...", "challenge": "...", "approach": "...", "solution": "...",
         "outcomes": "...", "summary": "A brief executive summary",
         "key_points": ["...", "...", "..."]}

        The content should be well-structured and professional, between 300 and 500 words in
        total, and based exclusively on the information provided.

        Here is the extracted text:
        {{content}}
        """)
  String write(@V("audienceHint") String audienceHint, @V("content") String content);

  @SystemMessage(
      "You are a professional case study writer who creates compelling business narratives.")
  @UserMessage(
      """
        Extract key information from this content to create a concise professional case study
        with Challenge, Approach, Solution and Outcomes sections.

        {{audienceHint}}
        Return ONLY valid JSON matching this structure:
        {"title": "...", "challenge": "...", "approach": "...", "solution": "...",
         "outcomes": "...", "summary": "A brief executive summary",
         "key_points": ["...", "...", "..."]}

        Keep it concise (300-400 words total).

        Here is the content:
        {{content}}
        """)
  String writeConcise(@V("audienceHint") String audienceHint, @V("content") String content);
}
