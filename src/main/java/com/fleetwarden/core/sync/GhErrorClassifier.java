package com.fleetwarden.core.sync;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Predicates over {@code gh} failure text.
 */
public final class GhErrorClassifier {

    private static final List<Pattern> RATE_LIMIT = compile(
            "rate limit", "secondary rate", "abuse detection", "too many requests", "retry after");

    private static final List<Pattern> TRANSIENT = compile(
            "bad gateway", "service unavailable", "gateway timeout", "internal server error",
            "ETIMEDOUT", "ECONNRESET", "ECONNREFUSED", "connection reset", "connection refused",
            "connection timeout", "timed out", "i/o timeout", "socket hang up");

    private static final List<Pattern> OWNER = compile(
            "unknown owner type", "could not resolve .*owner", "project.*not found");

    private static final String GRAPHQL_MISSING = "could not resolve to an issue or pull request";

    private GhErrorClassifier() {}

    public static boolean isRateLimited(String text) {
        return matchesAny(RATE_LIMIT, text);
    }

    public static boolean isTransient(String text) {
        return matchesAny(TRANSIENT, text);
    }

    /**
     * True when the board says the project owner is wrong, which calls for trying another owner.
     */
    public static boolean isOwnerError(String text) {
        return matchesAny(OWNER, text);
    }

    /**
     * True when the remote object is gone: an HTTP 404, or a GraphQL missing-object error scoped
     * to the issue or pull request field. Every other GraphQL error is a real failure.
     */
    public static boolean isNotFound(String text) {
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase();
        if (lower.contains("http 404") || (lower.contains("404") && lower.contains("not found"))) {
            return true;
        }
        return lower.contains(GRAPHQL_MISSING)
                && (lower.contains("(repository.issue)") || lower.contains("(repository.pullrequest)"));
    }

    /** The text every predicate is evaluated against. */
    public static String textOf(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof GhCommandException gh) {
                text.append(gh.fullText()).append('\n');
            } else if (t.getMessage() != null) {
                text.append(t.getMessage()).append('\n');
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return text.toString();
    }

    private static List<Pattern> compile(String... regexes) {
        return java.util.Arrays.stream(regexes)
                .map(r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }
}
