package com.fleetwarden.core.classifier;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Ordered rule table that maps raw agent output to an {@link ErrorPattern}.
 * <p>
 * Rules are evaluated top to bottom and the first match wins, so order is significant:
 * unrecoverable errors first, then transient infrastructure errors, then workflow
 * failures (sandbox, push, test, lint, build, conflict), then behavioural phrases.
 */
public final class PatternLibrary {

    /** Longest excerpt kept in {@link ErrorClassification#rawMatch()}. */
    static final int MAX_RAW_MATCH = 500;

    /**
     * One entry of the table.
     *
     * @param pattern  pattern produced when any matcher hits
     * @param matchers alternatives, tried in order
     */
    public record PatternRule(ErrorPattern pattern, List<Pattern> matchers) {

        Matcher firstMatch(String text) {
            for (Pattern p : matchers) {
                Matcher m = p.matcher(text);
                if (m.find()) {
                    return m;
                }
            }
            return null;
        }
    }

    static final List<PatternRule> RULES = List.of(
            rule(ErrorPattern.AUTH_ERROR,
                    ci("invalid.?api.?key|incorrect.?api.?key"),
                    ci("authentication_error|permission_error"),
                    ci("authentication.*failed|unauthenticated"),
                    ci("401 Unauthorized|403 Forbidden"),
                    ci("invalid.*credentials|bad.*credentials"),
                    ci("billing_hard_limit_reached|insufficient_quota"),
                    ci("access.?denied|not.?authorized"),
                    ci("OPENAI_API_KEY.*invalid|ANTHROPIC_API_KEY.*invalid")),
            rule(ErrorPattern.CONTENT_POLICY,
                    ci("content_policy_violation|content.?filter"),
                    ci("safety_system|safety.*filter"),
                    ci("flagged.*content|unsafe.*content"),
                    ci("output.*blocked|response.*blocked"),
                    ci("responsible.?ai|content.?management")),
            rule(ErrorPattern.MODEL_ERROR,
                    ci("model.*not.*found|model.*not.*supported"),
                    ci("invalid.*model|model.*does.*not.*exist"),
                    ci("not_found_error.*model"),
                    ci("model.*deprecated|model.*unavailable"),
                    ci("engine.*not.*found|deployment.*not.*found")),
            rule(ErrorPattern.RATE_LIMITED,
                    ci("429|rate.?limit|too many requests"),
                    ci("quota exceeded|billing.*limit"),
                    ci("tokens per minute|TPM.*limit"),
                    ci("resource exhausted"),
                    ci("please try again later")),
            rule(ErrorPattern.TOKEN_OVERFLOW,
                    ci("context.*(too long|exceeded|overflow|maximum)"),
                    ci("max.*(context|token|length).*exceeded"),
                    ci("conversation.*too.*long"),
                    ci("context_length_exceeded|prompt_too_long|string_above_max_length"),
                    ci("prompt.*(too long|too large)"),
                    ci("maximum.*context.*length"),
                    ci("413 Payload Too Large"),
                    ci("token_budget.*exceeded"),
                    ci("turn_limit_reached")),
            rule(ErrorPattern.API_ERROR,
                    ci("ECONNREFUSED|ETIMEDOUT|ENOTFOUND|ECONNRESET"),
                    ci("500 Internal Server Error"),
                    ci("502 Bad Gateway|503 Service Unavailable|504 Gateway Timeout"),
                    ci("408 Request Timeout"),
                    ci("network.*(error|failure|unreachable)"),
                    ci("fetch failed|request failed"),
                    ci("overloaded_error|server_error|engine_overloaded")),
            rule(ErrorPattern.SESSION_EXPIRED,
                    ci("session.*expired|invalid.*session"),
                    ci("thread.*not.*found|conversation.*not.*found"),
                    ci("token.*expired")),
            rule(ErrorPattern.REQUEST_ERROR,
                    ci("400 Bad Request"),
                    ci("invalid_request_error"),
                    ci("malformed.*request|malformed.*json"),
                    ci("422 Unprocessable Entity"),
                    ci("404 Not Found"),
                    ci("Failed to parse request body as json")),
            rule(ErrorPattern.OOM_KILL,
                    cs("SIGKILL"),
                    ci("killed.*out.?of.?memory|oom.?kill"),
                    ci("out of memory: kill process")),
            rule(ErrorPattern.OOM,
                    ci("heap out of memory|java heap space|OutOfMemoryError"),
                    ci("fatal error.*allocation failed|allocation failure"),
                    ci("process out of memory")),
            rule(ErrorPattern.CODEX_SANDBOX,
                    ci("sandbox.*fail|sandbox.*error"),
                    ci("bubblewrap.*error|bwrap.*error|bwrap.*fail"),
                    ci("EPERM.*operation.*not.*permitted"),
                    ci("writable_roots"),
                    ci("codex.*segfault|codex.*killed|codex.*crash"),
                    ci("namespace.*error|unshare.*fail")),
            rule(ErrorPattern.PUSH_FAILURE,
                    ci("git push.*fail|rejected.*push|push.*rejected"),
                    ci("pre-push hook.*fail"),
                    ci("remote.*rejected|remote:.*error"),
                    ci("failed to push|push.*error"),
                    ci("non-fast-forward|fetch first|stale info")),
            rule(ErrorPattern.TEST_FAILURE,
                    cs("FAIL\\s+\\S+"),
                    ci("tests? failed|test.*fail"),
                    cs("--- FAIL:"),
                    cs("✗|✘|FAILED"),
                    ci("AssertionError|assertion failed"),
                    ci("Expected.*but got|expected.*received")),
            rule(ErrorPattern.LINT_FAILURE,
                    ci("golangci-lint.*error"),
                    ci("eslint.*error|prettier.*error|checkstyle.*error"),
                    ci("lint.*failed|linting.*error"),
                    ci("gofmt.*differ|goimports.*differ")),
            rule(ErrorPattern.BUILD_FAILURE,
                    ci("go build.*failed|compilation error|compilation failed"),
                    ci("build failed|BUILD FAILURE"),
                    ci("npm ERR|pnpm.*error")),
            rule(ErrorPattern.GIT_CONFLICT,
                    ci("merge conflict|CONFLICT.*Merge"),
                    ci("rebase.*conflict"),
                    ci("cannot.*merge|unable to merge"),
                    ci("both modified"),
                    ci("cannot rebase|rebase failed")),
            rule(ErrorPattern.PLAN_STUCK,
                    ci("ready to (start|begin|implement)"),
                    ci("would you like me to (proceed|start|implement|continue)"),
                    ci("shall i (start|begin|implement|proceed)"),
                    ci("here'?s the plan"),
                    ci("I'?ve (?:created|outlined|prepared) a plan")),
            rule(ErrorPattern.PERMISSION_WAIT,
                    ci("waiting for.*input|waiting for.*response"),
                    ci("please provide|please specify|please confirm"),
                    ci("do you want me to|should I"),
                    ci("what would you prefer"),
                    ci("which option|which approach"))
    );

    private PatternLibrary() {}

    /**
     * Classifies agent output. Blank input yields {@link ErrorPattern#UNKNOWN}.
     */
    public static ErrorClassification classify(String text) {
        if (text == null || text.isBlank()) {
            return ErrorClassification.unknown();
        }
        for (PatternRule rule : RULES) {
            Matcher m = rule.firstMatch(text);
            if (m != null) {
                return ErrorClassification.of(rule.pattern(), excerpt(text, m.start(), m.end()));
            }
        }
        return ErrorClassification.unknown();
    }

    /** Classifies stdout and stderr together. */
    public static ErrorClassification classify(String output, String error) {
        var combined = new StringBuilder();
        if (output != null && !output.isEmpty()) {
            combined.append(output);
        }
        if (error != null && !error.isEmpty()) {
            if (combined.length() > 0) {
                combined.append('\n');
            }
            combined.append(error);
        }
        return classify(combined.toString());
    }

    public static List<PatternRule> rules() {
        return RULES;
    }

    /** Full line around the match so recovery prompts can quote the failure verbatim. */
    static String excerpt(String text, int start, int end) {
        int lineStart = text.lastIndexOf('\n', start - 1) + 1;
        int lineEnd = text.indexOf('\n', end);
        if (lineEnd < 0) {
            lineEnd = text.length();
        }
        String line = text.substring(lineStart, lineEnd).trim();
        if (line.length() > MAX_RAW_MATCH) {
            line = line.substring(0, MAX_RAW_MATCH) + "…";
        }
        return line;
    }

    private static PatternRule rule(ErrorPattern pattern, Pattern... matchers) {
        return new PatternRule(pattern, Arrays.asList(matchers));
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static Pattern cs(String regex) {
        return Pattern.compile(regex, Pattern.MULTILINE);
    }
}
