package com.fleetwarden.core.sync;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A pull request as seen by reconciliation: enough to find the issues it resolves.
 */
public record PullRequestRef(int number, String title, String body, String headRefName, String state) {

    private static final Pattern CLOSING_REFERENCE =
            Pattern.compile("\\b(?:close[sd]?|fix(?:e[sd])?|resolve[sd]?)\\s+#(\\d+)", Pattern.CASE_INSENSITIVE);

    /** Issue numbers named by closing keywords in the title or body. */
    public Set<String> referencedIssues() {
        Set<String> issues = new LinkedHashSet<>();
        collect(title, issues);
        collect(body, issues);
        return issues;
    }

    private static void collect(String text, Set<String> into) {
        if (text == null) {
            return;
        }
        Matcher matcher = CLOSING_REFERENCE.matcher(text);
        while (matcher.find()) {
            into.add(matcher.group(1));
        }
    }
}
