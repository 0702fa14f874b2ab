package com.openforge.storyagent.tool;

/**
 * The side-effecting part of a tool: validated arguments in, raw result out.
 * Anything it throws is turned into a TOOL_EXECUTION_ERROR outcome.
 */
@FunctionalInterface
public interface ToolCapability {

    Object invoke(ToolArguments arguments) throws Exception;
}
