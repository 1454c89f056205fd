package com.codeheadsystems.quartermaster.model.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A typed content block in a tool result. Only {@code text} blocks are produced today.
 *
 * @param type block type, e.g. {@code text}
 * @param text the text payload for {@code text} blocks
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContentBlock(
    @JsonProperty("type") String type,
    @JsonProperty("text") String text) {

  /**
   * Creates a text block.
   *
   * @param text the text
   * @return the block
   */
  public static ContentBlock text(String text) {
    return new ContentBlock("text", text);
  }
}
