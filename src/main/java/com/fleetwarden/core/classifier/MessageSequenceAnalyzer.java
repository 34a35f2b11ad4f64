package com.fleetwarden.core.classifier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Detects behavioural stalls across a window of recent agent messages.
 * <p>
 * Each pattern is computed independently; the primary pattern is then picked by a fixed
 * priority so that the most actionable signal wins when several co-occur.
 */
@Service
public class MessageSequenceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(MessageSequenceAnalyzer.class);

    /** Most actionable first. */
    static final List<ErrorPattern> PRIORITY = List.of(
            ErrorPattern.RATE_LIMITED,
            ErrorPattern.PLAN_STUCK,
            ErrorPattern.FALSE_COMPLETION,
            ErrorPattern.COMMITS_NO_PUSH,
            ErrorPattern.PERMISSION_WAIT,
            ErrorPattern.ERROR_LOOP,
            ErrorPattern.NEEDS_CLARIFICATION,
            ErrorPattern.TOOL_LOOP,
            ErrorPattern.ANALYSIS_PARALYSIS,
            ErrorPattern.NO_PROGRESS
    );

    private static final List<String> READ_TOOL_HINTS = List.of("read", "search", "grep", "list", "find", "cat");
    private static final List<String> WRITE_TOOL_HINTS = List.of("write", "edit", "create", "replace", "patch", "append");

    private static final List<String> PLAN_PHRASES = List.of(
            "here's the plan", "here is my plan", "i'll create a plan", "plan.md",
            "ready to start implementing", "ready to begin", "would you like me to proceed",
            "shall i start", "would you like me to implement");

    private static final List<String> CLARIFICATION_PHRASES = List.of(
            "need clarification", "need more information", "could you clarify", "unclear",
            "ambiguous", "which approach", "please specify", "i need to know", "can you provide",
            "what should i");

    private static final List<String> COMPLETION_PHRASES = List.of(
            "task complete", "task is complete", "i've completed", "all done",
            "successfully completed", "changes have been committed", "pushed to", "pr created",
            "pull request created");

    private static final List<String> PERMISSION_PHRASES = List.of(
            "do you want me to", "should i proceed", "should i continue", "waiting for your",
            "let me know if", "please confirm", "would you like", "whenever you're ready");

    private static final Pattern RATE_LIMIT_TEXT =
            Pattern.compile("rate.?limit|429|too many requests|quota", Pattern.CASE_INSENSITIVE);

    /** Error messages are compared on this many leading characters. */
    private static final int ERROR_COMPARE_LENGTH = 100;

    private final RecoveryProperties.Sequence thresholds;

    public MessageSequenceAnalyzer(RecoveryProperties properties) {
        this.thresholds = properties.getSequence();
    }

    /**
     * Analyses a window of messages. A {@code null} or empty window yields an empty analysis.
     */
    public SequenceAnalysis analyze(List<AgentMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return SequenceAnalysis.empty();
        }

        var found = new LinkedHashMap<ErrorPattern, String>();

        List<AgentMessage> toolCalls = ofType(messages, AgentMessage.Type.TOOL_CALL);
        List<AgentMessage> agentMessages = ofType(messages, AgentMessage.Type.AGENT_MESSAGE);
        List<AgentMessage> errors = ofType(messages, AgentMessage.Type.ERROR);

        int longestRun = longestIdenticalRun(toolCalls);
        if (longestRun >= thresholds.getToolLoopThreshold()) {
            found.put(ErrorPattern.TOOL_LOOP,
                    "Same tool invoked " + longestRun + "x in a row with identical arguments");
        }

        long reads = toolCalls.stream().filter(m -> nameMatches(m, READ_TOOL_HINTS)).count();
        long writes = toolCalls.stream().filter(m -> nameMatches(m, WRITE_TOOL_HINTS)).count();
        if (toolCalls.size() >= thresholds.getAnalysisParalysisThreshold()
                && reads * 5 >= toolCalls.size() * 4L && writes == 0) {
            found.put(ErrorPattern.ANALYSIS_PARALYSIS,
                    reads + " read ops, 0 write ops in " + toolCalls.size() + " tool calls");
        }

        String agentText = joinLower(agentMessages);
        boolean hasPlan = containsAny(agentText, PLAN_PHRASES);
        if (hasPlan && writes <= 1) {
            found.put(ErrorPattern.PLAN_STUCK, "Agent created a plan but did not implement it");
        }

        if (containsAny(agentText, CLARIFICATION_PHRASES)) {
            found.put(ErrorPattern.NEEDS_CLARIFICATION, "Agent expressed uncertainty or asked for input");
        }

        boolean claimsDone = containsAny(agentText, COMPLETION_PHRASES);
        boolean committed = toolCalls.stream().anyMatch(m -> commandText(m).contains("git commit"));
        boolean pushed = toolCalls.stream().anyMatch(m -> commandText(m).contains("git push"));
        if (claimsDone && !committed && !pushed) {
            found.put(ErrorPattern.FALSE_COMPLETION,
                    "Agent claims completion but no git commit/push detected in tool calls");
        }
        if (claimsDone && committed && !pushed) {
            found.put(ErrorPattern.COMMITS_NO_PUSH, "Agent committed changes but never pushed them");
        }

        long rateLimitErrors = errors.stream()
                .filter(m -> RATE_LIMIT_TEXT.matcher(m.contentOrEmpty()).find())
                .count();
        if (rateLimitErrors >= thresholds.getRateLimitThreshold()) {
            found.put(ErrorPattern.RATE_LIMITED, rateLimitErrors + " rate limit errors detected");
        }

        if (!agentMessages.isEmpty()) {
            String last = agentMessages.get(agentMessages.size() - 1).contentOrEmpty().toLowerCase();
            if (containsAny(last, PERMISSION_PHRASES)) {
                found.put(ErrorPattern.PERMISSION_WAIT,
                        "Agent's last message asks for permission or input that will never arrive");
            }
        }

        if (messages.size() >= thresholds.getNoProgressThreshold()
                && toolCalls.isEmpty() && agentMessages.size() <= 1) {
            found.put(ErrorPattern.NO_PROGRESS,
                    messages.size() + " messages but no tool calls and at most one agent message");
        }

        int loop = thresholds.getErrorLoopThreshold();
        if (errors.size() >= loop) {
            List<String> tail = errors.subList(errors.size() - loop, errors.size()).stream()
                    .map(m -> head(m.contentOrEmpty(), ERROR_COMPARE_LENGTH))
                    .toList();
            if (tail.stream().allMatch(e -> e.equals(tail.get(0)))) {
                found.put(ErrorPattern.ERROR_LOOP,
                        "Same error repeated " + errors.size() + "x: \"" + head(tail.get(0), 80) + "\"");
            }
        }

        ErrorPattern primary = PRIORITY.stream().filter(found::containsKey).findFirst().orElse(null);
        if (primary != null) {
            log.debug("Sequence analysis over {} messages found {} (primary={})",
                    messages.size(), found.keySet(), primary);
        }
        return new SequenceAnalysis(new ArrayList<>(found.keySet()), primary, found);
    }

    /** Recovery directive for the analysis' primary pattern. */
    public String recoveryPrompt(String taskTitle, SequenceAnalysis analysis) {
        return RecoveryPrompts.forAnalysis(taskTitle, analysis);
    }

    private static int longestIdenticalRun(List<AgentMessage> toolCalls) {
        int best = 0;
        int run = 0;
        String previous = null;
        for (AgentMessage call : toolCalls) {
            String signature = Objects.toString(call.toolName(), "") + "\u0000" + Objects.toString(call.toolArgs(), "");
            run = signature.equals(previous) ? run + 1 : 1;
            previous = signature;
            best = Math.max(best, run);
        }
        return best;
    }

    private static List<AgentMessage> ofType(List<AgentMessage> messages, AgentMessage.Type type) {
        return messages.stream().filter(m -> m != null && m.type() == type).toList();
    }

    private static boolean nameMatches(AgentMessage call, List<String> hints) {
        String name = call.toolName() != null ? call.toolName() : call.contentOrEmpty();
        return containsAny(name.toLowerCase(), hints);
    }

    private static String commandText(AgentMessage call) {
        return (call.contentOrEmpty() + " " + Objects.toString(call.toolArgs(), "")).toLowerCase();
    }

    private static String joinLower(List<AgentMessage> messages) {
        var sb = new StringBuilder();
        for (AgentMessage m : messages) {
            sb.append(m.contentOrEmpty()).append(' ');
        }
        return sb.toString().toLowerCase();
    }

    private static boolean containsAny(String text, List<String> phrases) {
        for (String p : phrases) {
            if (text.contains(p)) {
                return true;
            }
        }
        return false;
    }

    private static String head(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
