package com.fleetwarden.core.classifier;

import java.util.ArrayList;
import java.util.List;

/**
 * Second-person remediation prompts re-injected into an agent's context.
 */
public final class RecoveryPrompts {

    private RecoveryPrompts() {}

    /**
     * Category-specific prompt for a failed attempt, quoting the failing output when available.
     */
    public static String forFailure(ErrorPattern pattern, String rawMatch) {
        String base = switch (pattern) {
            case PUSH_FAILURE -> """
                    git push failed. Check the error output:
                    1. If pre-push hooks failed, fix the lint/test/build errors, then push again
                    2. If the remote rejected the push, run git pull --rebase origin main, resolve conflicts and push
                    Do NOT use --no-verify.""";
            case TEST_FAILURE -> "Tests are failing. Read the EXACT failure output. "
                    + "Fix the IMPLEMENTATION, not the tests (unless a test has an obvious bug). "
                    + "Run the specific failing test to verify your fix before pushing.";
            case LINT_FAILURE -> "Linting/formatting failed. Fix the specific lint errors reported. "
                    + "Common issues: unused variables, unchecked error returns, formatting. "
                    + "Apply minimal targeted fixes, then re-run the linter to verify.";
            case BUILD_FAILURE -> "The previous build step failed. Carefully read the error output, "
                    + "fix the root cause, and build again. Do NOT skip tests.";
            case GIT_CONFLICT -> "There are git merge conflicts. Run `git status` to find conflicting files, "
                    + "resolve each conflict by choosing the correct code, then `git add` and `git commit`. "
                    + "Do NOT leave conflict markers in the code.";
            case CODEX_SANDBOX -> """
                    Sandbox error detected. Check:
                    1. writable_roots includes your workspace in the executor config
                    2. Bubblewrap (bwrap) is installed if the Linux sandbox is enabled
                    3. File permissions allow the operation
                    If running in a container, ensure it has the right mounts.""";
            case TOKEN_OVERFLOW -> """
                    Your previous session exceeded context limits. This is a fresh session on the same worktree.
                    1. Run `git log --oneline -10` to see recent commits
                    2. Run `git diff --stat` to see uncommitted changes
                    3. Continue from where the previous session left off
                    Do NOT restart from scratch.""";
            case REQUEST_ERROR -> "The API returned a client error (400, 404 or 422). The request itself is malformed. "
                    + "Check the endpoint, the request body and the required parameters before retrying.";
            case PLAN_STUCK -> "You created a plan but did not implement it. Do NOT create another plan. "
                    + "Do NOT ask for permission. Implement, test, commit and push now.";
            case PERMISSION_WAIT -> "No human will answer. Make the best engineering decision and continue: "
                    + "implement, test, commit and push.";
            default -> "The previous attempt failed. Read the error output, fix the root cause and try again.";
        };
        if (rawMatch == null || rawMatch.isBlank()) {
            return base;
        }
        return base + "\n\nFailing output:\n" + rawMatch;
    }

    /**
     * Directive for the primary pattern of a message-sequence analysis. An absent or
     * unrecognised primary yields a generic "continue working" prompt.
     */
    public static String forAnalysis(String taskTitle, SequenceAnalysis analysis) {
        String title = taskTitle == null ? "" : taskTitle;
        if (analysis == null || analysis.primary() == null) {
            return "Continue working on task \"" + title + "\". Focus on implementation.";
        }
        String detail = analysis.details().get(analysis.primary());
        List<String> lines = switch (analysis.primary()) {
            case PLAN_STUCK -> List.of(
                    "# CONTINUE IMPLEMENTATION - Do Not Plan",
                    "",
                    "You wrote a plan for \"" + title + "\" but stopped before implementing it.",
                    "",
                    "DO NOT create another plan. DO NOT ask for permission.",
                    "Implement the changes NOW:",
                    "1. Edit the necessary files",
                    "2. Run tests to verify",
                    "3. Commit with a conventional commit message",
                    "4. Push to the branch");
            case TOOL_LOOP -> withDetail(detail,
                    "# BREAK THE LOOP - Change Approach",
                    "",
                    "You've been repeating the same tools without making progress on \"" + title + "\".",
                    "",
                    "STOP and take a different approach:",
                    "1. Summarize what you've learned so far",
                    "2. Identify what's blocking you",
                    "3. Try a completely different strategy",
                    "4. Make incremental progress: edit files, commit, push");
            case ANALYSIS_PARALYSIS -> withDetail(detail,
                    "# START EDITING - Stop Just Reading",
                    "",
                    "You've been reading files but not making any changes for \"" + title + "\".",
                    "",
                    "You have enough context. Start implementing:",
                    "1. Create or edit the files needed",
                    "2. Work incrementally instead of understanding everything first",
                    "3. Commit and push after each meaningful change");
            case NEEDS_CLARIFICATION -> List.of(
                    "# MAKE A DECISION - Do Not Wait for Input",
                    "",
                    "You expressed uncertainty about \"" + title + "\" but this is autonomous execution.",
                    "No one will respond to your questions.",
                    "",
                    "Choose the most reasonable approach and proceed:",
                    "1. Pick the simplest correct implementation",
                    "2. Document any assumptions in code comments",
                    "3. Implement, test, commit, and push");
            case FALSE_COMPLETION -> List.of(
                    "# ACTUALLY COMPLETE THE TASK",
                    "",
                    "You claimed \"" + title + "\" was complete, but no git commit or push was detected.",
                    "",
                    "The task is NOT complete until changes are committed and pushed:",
                    "1. Stage your changes: git add -A",
                    "2. Commit: git commit -m \"feat(scope): description\"",
                    "3. Push: git push origin <branch>",
                    "4. Verify the push succeeded");
            case RATE_LIMITED -> List.of(
                    "# RATE LIMITED - Wait and Retry",
                    "",
                    "You hit rate limits while working on \"" + title + "\".",
                    "Wait 30 seconds, then continue with smaller, focused operations.",
                    "Avoid large file reads or many parallel tool calls.");
            case COMMITS_NO_PUSH -> List.of(
                    "# PUSH YOUR COMMITS",
                    "",
                    "You committed changes for \"" + title + "\" but never pushed them.",
                    "",
                    "Run now:",
                    "  git push --set-upstream origin $(git branch --show-current)",
                    "",
                    "If the push fails due to pre-push hooks, fix the reported issues and push again.",
                    "Do NOT use --no-verify.");
            case PERMISSION_WAIT -> List.of(
                    "# DO NOT WAIT FOR INPUT",
                    "",
                    "You appear to be waiting for human input on \"" + title + "\".",
                    "This is fully autonomous execution. No human will respond.",
                    "",
                    "Make the best engineering decision and continue:",
                    "1. Choose the simplest correct approach",
                    "2. Implement it now",
                    "3. Test, commit, and push");
            case ERROR_LOOP -> withDetail(detail,
                    "# BREAK THE ERROR LOOP",
                    "",
                    "You've hit the same error multiple times on \"" + title + "\".",
                    "",
                    "The current approach is NOT working. Try something different:",
                    "1. Read the error message carefully and find the ROOT CAUSE",
                    "2. Fix the underlying issue, not just the symptom",
                    "3. If a tool keeps failing, use a different tool or approach",
                    "4. Make a small change, verify it works, commit it");
            case NO_PROGRESS -> List.of(
                    "# START WORKING",
                    "",
                    "No meaningful progress detected on \"" + title + "\".",
                    "You have sent messages but made no tool calls and no code changes.",
                    "",
                    "Start now:",
                    "1. Identify the first file to modify",
                    "2. Edit it",
                    "3. Test the change",
                    "4. Commit and push");
            default -> List.of("Continue working on task \"" + title + "\". Focus on implementation.");
        };
        return String.join("\n", lines);
    }

    /** Inserts a "Detail:" line after the third line when a detail is available. */
    private static List<String> withDetail(String detail, String... lines) {
        var out = new ArrayList<>(List.of(lines));
        if (detail != null && !detail.isBlank()) {
            out.add(3, "Detail: " + detail);
        }
        return out;
    }
}
