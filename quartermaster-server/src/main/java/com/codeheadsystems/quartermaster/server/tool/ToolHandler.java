package com.codeheadsystems.quartermaster.server.tool;

import com.codeheadsystems.quartermaster.model.mcp.ContentBlock;
import com.codeheadsystems.quartermaster.server.auth.AuthContext;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Executes one named tool.
 */
@FunctionalInterface
public interface ToolHandler {

  /**
   * Runs the tool.
   *
   * @param arguments the {@code arguments} object from {@code tools/call}; never null
   * @param context   the authenticated caller
   * @return the content blocks to return to the client
   * @throws ToolExecutionException for bad arguments or business-rule violations; reported to the
   *                                client as a failed tool result, not a protocol error
   */
  List<ContentBlock> call(JsonNode arguments, AuthContext context) throws ToolExecutionException;
}
