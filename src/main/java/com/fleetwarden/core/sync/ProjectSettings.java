package com.fleetwarden.core.sync;

import com.fleetwarden.core.config.EnvSettings;

import java.util.Arrays;
import java.util.List;

/**
 * Resolved board configuration.
 * <p>
 * Each value is taken from the explicit option first, then the environment, then the built-in
 * default. Blank values count as unset at every level.
 *
 * @param mode              issues or kanban
 * @param boardId           project board id or number, {@code null} when none is configured
 * @param repoOwner         owner part of the repository slug
 * @param repoName          name part of the repository slug
 * @param projectOwner      preferred owner of the project board
 * @param enforceTaskLabel  only issues carrying one of {@code taskScopeLabels} are tasks
 * @param taskScopeLabels   labels that put an issue in scope
 * @param rateLimitRetryMs  backoff applied after a rate-limited call
 * @param ownerRetryMs      wait before owners rejected by the board are retried
 */
public record ProjectSettings(
    ProjectMode mode,
    String boardId,
    String repoOwner,
    String repoName,
    String projectOwner,
    boolean enforceTaskLabel,
    List<String> taskScopeLabels,
    long rateLimitRetryMs,
    long ownerRetryMs
) {

    static final String UNKNOWN = "unknown";
    static final String DEFAULT_TASK_LABEL = "fleetwarden";

    public ProjectSettings {
        taskScopeLabels = taskScopeLabels == null ? List.of() : List.copyOf(taskScopeLabels);
    }

    public static ProjectSettings resolve(SyncProperties options, EnvSettings env) {
        ProjectMode mode = ProjectMode.parse(env.resolve(options.getProjectMode(), "GITHUB_PROJECT_MODE", "issues"));

        String boardId = firstNonBlank(
                options.getProjectId(),
                options.getProjectNumber(),
                env.get("GITHUB_PROJECT_NUMBER"),
                env.get("GITHUB_PROJECT_ID"));

        String[] slug = parseSlug(firstNonBlank(
                options.getRepository(),
                env.get("GITHUB_REPOSITORY"),
                env.get("GITHUB_REPO_OWNER") != null && env.get("GITHUB_REPO_NAME") != null
                        ? env.get("GITHUB_REPO_OWNER") + "/" + env.get("GITHUB_REPO_NAME")
                        : null));
        String repoOwner = slug != null ? slug[0] : UNKNOWN;
        String repoName = slug != null ? slug[1] : UNKNOWN;

        String projectOwner = env.resolve(options.getProjectOwner(), "GITHUB_PROJECT_OWNER", repoOwner);

        boolean enforce = options.getEnforceTaskLabel() != null
                ? options.getEnforceTaskLabel()
                : env.flag("FLEETWARDEN_ENFORCE_TASK_LABEL", true);

        List<String> labels;
        if (options.getTaskLabels() != null && !options.getTaskLabels().isEmpty()) {
            labels = normaliseLabels(options.getTaskLabels());
        } else if (env.get("FLEETWARDEN_TASK_LABELS") != null) {
            labels = normaliseLabels(Arrays.asList(env.get("FLEETWARDEN_TASK_LABELS").split(",")));
        } else {
            labels = List.of(env.resolve(null, "FLEETWARDEN_TASK_LABEL", DEFAULT_TASK_LABEL).toLowerCase());
        }

        return new ProjectSettings(mode, boardId, repoOwner, repoName, projectOwner, enforce, labels,
                env.delayMs("GH_RATE_LIMIT_RETRY_MS", options.getRateLimitRetryMs(), 0),
                env.delayMs("GH_PROJECT_OWNER_RETRY_MS", options.getOwnerRetryMs(), 0));
    }

    /** {@code owner/name}. */
    public String repoSlug() {
        return repoOwner + "/" + repoName;
    }

    public boolean hasRepository() {
        return !UNKNOWN.equals(repoOwner) && !UNKNOWN.equals(repoName);
    }

    public boolean usesProjectBoard() {
        return mode == ProjectMode.KANBAN && boardId != null;
    }

    static String[] parseSlug(String raw) {
        if (raw == null) {
            return null;
        }
        String[] parts = raw.trim().split("/");
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            return null;
        }
        return new String[]{parts[0].trim(), parts[1].trim()};
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static List<String> normaliseLabels(List<String> raw) {
        return raw.stream()
                .filter(l -> l != null && !l.isBlank())
                .map(l -> l.trim().toLowerCase())
                .distinct()
                .toList();
    }
}
