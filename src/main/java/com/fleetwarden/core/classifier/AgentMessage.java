package com.fleetwarden.core.classifier;

/**
 * One entry of an agent session transcript, as seen by {@link MessageSequenceAnalyzer}.
 *
 * @param type      message kind
 * @param content   text of the message; for tool calls the rendered command or summary
 * @param toolName  tool invoked, only for {@link Type#TOOL_CALL}
 * @param toolArgs  serialized tool arguments, only for {@link Type#TOOL_CALL}
 */
public record AgentMessage(
    Type type,
    String content,
    String toolName,
    String toolArgs
) {

    public enum Type {
        TOOL_CALL,
        AGENT_MESSAGE,
        ERROR,
        SYSTEM
    }

    public static AgentMessage toolCall(String toolName, String toolArgs) {
        return new AgentMessage(Type.TOOL_CALL, toolArgs, toolName, toolArgs);
    }

    public static AgentMessage agent(String content) {
        return new AgentMessage(Type.AGENT_MESSAGE, content, null, null);
    }

    public static AgentMessage error(String content) {
        return new AgentMessage(Type.ERROR, content, null, null);
    }

    public static AgentMessage system(String content) {
        return new AgentMessage(Type.SYSTEM, content, null, null);
    }

    String contentOrEmpty() {
        return content == null ? "" : content;
    }
}
