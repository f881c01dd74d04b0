package com.flamingo.ai.coursepipeline.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that reorganizes raw extracted document text into clean, sectioned Markdown for study
 * use. Content must be preserved; only structure and obvious extraction errors change.
 */
public interface ContentStructuringAgent {

  @SystemMessage(
      """
        You are an educational content structuring assistant. Your task is to organize
        extracted document text into clean, well-formatted educational content.

        {{languageInstruction}}

        Guidelines:
        1. Organize content with clear headings (# for main, ## for sub, ### for sub-sub)
        2. Use bullet points for lists of items
        3. Use numbered lists for sequential steps or processes
        4. Preserve all original information; do not add or remove content
        5. Fix obvious OCR errors while preserving technical terminology
        6. Format code blocks and mathematical equations properly
        7. Add section breaks between distinct topics

        Output clean Markdown only. Do not include any explanations or commentary.
        """)
  @UserMessage("""
        Structure the following extracted document content:

        {{content}}
        """)
  String structure(
      @V("languageInstruction") String languageInstruction, @V("content") String content);
}
