package com.fleetwarden.core.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fleetwarden.core.model.SharedState;
import com.fleetwarden.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link BoardAdapter} for GitHub issues and Projects, driven entirely through the {@code gh} CLI.
 * <p>
 * Status lives in labels ({@code inprogress}, {@code inreview}, {@code blocked}, {@code draft})
 * plus the open/closed state. Issues labelled {@code codex:ignore} are never returned, and when
 * label enforcement is on only issues carrying a task-scope label are.
 */
@Component
public class GitHubBoardAdapter implements BoardAdapter {

    private static final Logger log = LoggerFactory.getLogger(GitHubBoardAdapter.class);

    static final String IGNORE_LABEL = "codex:ignore";
    static final Map<String, String> CLAIM_LABELS = Map.of(
            "claimed", "codex:claimed",
            "working", "codex:working",
            "stale", "codex:stale");

    private static final Map<TaskStatus, String> STATUS_LABELS = Map.of(
            TaskStatus.DRAFT, "draft",
            TaskStatus.INPROGRESS, "inprogress",
            TaskStatus.INREVIEW, "inreview",
            TaskStatus.BLOCKED, "blocked");

    private static final Map<String, String> LABEL_COLOURS = Map.of(
            "inprogress", "2563eb",
            "inreview", "f59e0b",
            "blocked", "dc2626");

    private static final String ISSUE_FIELDS = "number,title,state,labels,url,body";
    private static final String PR_FIELDS = "number,title,body,headRefName,state";
    private static final Pattern ISSUE_NUMBER = Pattern.compile("^#?(\\d+)$");
    private static final Pattern ISSUE_URL = Pattern.compile("/issues/(\\d+)");

    private final ProjectCommandRunner runner;
    private final ProjectSettings settings;
    private final SyncProperties properties;
    private final PayloadWarningThrottle warnings;

    public GitHubBoardAdapter(ProjectCommandRunner runner, ProjectSettings settings, SyncProperties properties,
                              BackoffStateStore backoff, Clock clock) {
        this.runner = runner;
        this.settings = settings;
        this.properties = properties;
        this.warnings = new PayloadWarningThrottle(backoff, properties.getPayloadWarningThrottleMs(), clock);
    }

    @Override
    public List<BoardIssue> listIssues(IssueState state) {
        JsonNode payload = runner.runJson(List.of("issue", "list", "--repo", settings.repoSlug(),
                "--state", state.name().toLowerCase(),
                "--limit", String.valueOf(properties.getIssueListLimit()),
                "--json", ISSUE_FIELDS));
        List<BoardIssue> issues = new ArrayList<>();
        for (JsonNode node : items("issue", "list", payload)) {
            BoardIssue issue = toIssue(node);
            if (issue != null && isInScope(issue)) {
                issues.add(issue);
            }
        }
        return issues;
    }

    @Override
    public List<PullRequestRef> listPullRequests(PullRequestState state) {
        JsonNode payload = runner.runJson(List.of("pr", "list", "--repo", settings.repoSlug(),
                "--state", state.name().toLowerCase(),
                "--limit", String.valueOf(properties.getIssueListLimit()),
                "--json", PR_FIELDS));
        List<PullRequestRef> prs = new ArrayList<>();
        for (JsonNode node : items("pr", "list", payload)) {
            if (!node.path("number").canConvertToInt()) {
                continue;
            }
            prs.add(new PullRequestRef(node.path("number").asInt(), node.path("title").asText(""),
                    node.path("body").asText(""), node.path("headRefName").asText(""), node.path("state").asText("")));
        }
        return prs;
    }

    @Override
    public List<BoardItem> listProjectItems(String boardId) {
        JsonNode payload = runner.runProjectJson("item-list:" + boardId, owner -> {
            List<String> args = new ArrayList<>(List.of("project", "item-list", boardId));
            if (owner != null) {
                args.add("--owner");
                args.add(owner);
            }
            args.addAll(List.of("--format", "json", "--limit", String.valueOf(properties.getIssueListLimit())));
            return args;
        });

        List<BoardItem> items = new ArrayList<>();
        for (JsonNode node : items("project", "item-list", payload)) {
            JsonNode content = node.path("content");
            if ("PullRequest".equals(content.path("type").asText())) {
                continue;
            }
            String number = issueNumberOf(content);
            if (number == null) {
                continue;
            }
            String rawStatus = node.path("status").asText(null);
            if (rawStatus == null || rawStatus.isBlank()) {
                rawStatus = node.path("fieldValues").path("Status").asText(null);
            }
            if (rawStatus == null || rawStatus.isBlank()) {
                log.debug("Project item for #{} has no status column", number);
                continue;
            }
            items.add(new BoardItem(number, node.path("id").asText(null),
                    node.path("title").asText(content.path("title").asText("")),
                    TaskStatus.normalise(rawStatus), rawStatus));
        }
        return items;
    }

    @Override
    public Optional<BoardIssue> getIssue(String issueNumber) {
        String number = requireIssueNumber(issueNumber);
        try {
            JsonNode node = runner.runJson(List.of("issue", "view", number, "--repo", settings.repoSlug(),
                    "--json", ISSUE_FIELDS));
            return Optional.ofNullable(toIssue(node));
        } catch (GhCommandException e) {
            if (GhErrorClassifier.isNotFound(e.fullText())) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public void updateTaskStatus(String issueNumber, TaskStatus status) {
        String number = requireIssueNumber(issueNumber);
        BoardIssue issue = getIssue(number)
                .orElseThrow(() -> new GhCommandException("Issue #" + number + " not found", List.of(), "HTTP 404", 1));

        if (status.isTerminal()) {
            if (issue.isOpen()) {
                List<String> args = new ArrayList<>(List.of("issue", "close", number, "--repo", settings.repoSlug()));
                if (status == TaskStatus.CANCELLED) {
                    args.addAll(List.of("--reason", "not planned"));
                }
                runner.run(args);
            }
        } else if (!issue.isOpen()) {
            runner.run(List.of("issue", "reopen", number, "--repo", settings.repoSlug()));
        }

        String wanted = STATUS_LABELS.get(status);
        List<String> edit = new ArrayList<>(List.of("issue", "edit", number, "--repo", settings.repoSlug()));
        for (String label : STATUS_LABELS.values()) {
            if (!label.equals(wanted) && issue.labels().contains(label)) {
                edit.addAll(List.of("--remove-label", label));
            }
        }
        if (wanted != null && !issue.labels().contains(wanted)) {
            edit.addAll(List.of("--add-label", wanted));
        }
        if (edit.size() > 5) {
            editLabels(edit, wanted);
        }
        log.info("Board issue #{} -> {}", number, status.wireName());
    }

    @Override
    public void addComment(String issueNumber, String body) {
        runner.run(List.of("issue", "comment", requireIssueNumber(issueNumber),
                "--repo", settings.repoSlug(), "--body", body));
    }

    @Override
    public Optional<SharedState> readSharedState(String issueNumber) {
        String number = requireIssueNumber(issueNumber);
        List<String> bodies = new ArrayList<>();
        for (JsonNode comment : comments(number)) {
            bodies.add(comment.path("body").asText(""));
        }
        return SharedStateCodec.decodeLatest(bodies);
    }

    @Override
    public boolean persistSharedState(String issueNumber, SharedState state) {
        String number = requireIssueNumber(issueNumber);
        if (state == null || !state.isComplete()) {
            throw new IllegalArgumentException("Incomplete shared state for issue #" + number);
        }
        try {
            BoardIssue issue = getIssue(number)
                    .orElseThrow(() -> new GhCommandException("Issue #" + number + " not found", List.of(), "HTTP 404", 1));
            String wanted = CLAIM_LABELS.get(state.status());
            List<String> edit = new ArrayList<>(List.of("issue", "edit", number, "--repo", settings.repoSlug()));
            for (String label : CLAIM_LABELS.values()) {
                if (!label.equals(wanted) && issue.labels().contains(label)) {
                    edit.addAll(List.of("--remove-label", label));
                }
            }
            if (wanted != null && !issue.labels().contains(wanted)) {
                edit.addAll(List.of("--add-label", wanted));
            }
            if (edit.size() > 5) {
                runner.run(edit);
            }

            String body = SharedStateCodec.encode(state);
            JsonNode existing = null;
            for (JsonNode comment : comments(number)) {
                if (SharedStateCodec.isStateComment(comment.path("body").asText(""))) {
                    existing = comment;
                }
            }
            if (existing != null) {
                runner.run(List.of("api", "/repos/" + settings.repoSlug() + "/issues/comments/" + existing.path("id").asText(),
                        "-X", "PATCH", "-f", "body=" + body));
            } else {
                addComment(number, body);
            }
            return true;
        } catch (GhCommandException | BoardBackoffException e) {
            log.warn("Failed to persist shared state for #{}: {}", number, e.getMessage());
            return false;
        }
    }

    @Override
    public void markTaskIgnored(String issueNumber, String reason) {
        String number = requireIssueNumber(issueNumber);
        runner.run(List.of("issue", "edit", number, "--repo", settings.repoSlug(), "--add-label", IGNORE_LABEL));
        addComment(number, "**Fleetwarden**: This task has been marked as ignored.\n\n"
                + "**Reason**: " + reason + "\n\n"
                + "To re-enable automation for this task, remove the `" + IGNORE_LABEL + "` label.");
    }

    private void editLabels(List<String> edit, String wanted) {
        try {
            runner.run(edit);
        } catch (GhCommandException e) {
            if (wanted == null || !e.fullText().toLowerCase().contains("not found")) {
                throw e;
            }
            // Label missing from the repository: create it, then retry once
            runner.run(List.of("label", "create", wanted, "--repo", settings.repoSlug(),
                    "--color", LABEL_COLOURS.getOrDefault(wanted, "94a3b8"),
                    "--description", "fleetwarden status: " + wanted, "--force"));
            runner.run(edit);
        }
    }

    private List<JsonNode> comments(String number) {
        JsonNode payload = runner.runJson(List.of("api", "/repos/" + settings.repoSlug() + "/issues/" + number + "/comments"));
        return items("issue", "comments", payload);
    }

    private List<JsonNode> items(String role, String name, JsonNode payload) {
        ProjectPayload decoded = ProjectPayloadDecoder.decode(payload);
        if (decoded instanceof ProjectPayload.InvalidShape invalid) {
            warnings.warn(role, name, "invalid-shape", invalid.description());
        }
        return decoded.items();
    }

    private boolean isInScope(BoardIssue issue) {
        if (issue.labels().contains(IGNORE_LABEL)) {
            return false;
        }
        return !settings.enforceTaskLabel() || issue.hasAnyLabel(settings.taskScopeLabels());
    }

    private static BoardIssue toIssue(JsonNode node) {
        if (node == null || !node.isObject() || !node.has("number")) {
            return null;
        }
        List<String> labels = new ArrayList<>();
        for (JsonNode label : node.path("labels")) {
            String name = label.isTextual() ? label.asText() : label.path("name").asText(null);
            if (name != null && !name.isBlank()) {
                labels.add(name);
            }
        }
        return new BoardIssue(node.path("number").asText(), node.path("title").asText(""),
                node.path("state").asText("OPEN"), labels, node.path("url").asText(null), node.path("body").asText(""));
    }

    private static String issueNumberOf(JsonNode content) {
        if (content.path("number").canConvertToInt()) {
            return content.path("number").asText();
        }
        Matcher matcher = ISSUE_URL.matcher(content.path("url").asText(""));
        return matcher.find() ? matcher.group(1) : null;
    }

    static String requireIssueNumber(String issueNumber) {
        Matcher matcher = ISSUE_NUMBER.matcher(issueNumber == null ? "" : issueNumber.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid issue number: " + issueNumber);
        }
        return matcher.group(1);
    }
}
