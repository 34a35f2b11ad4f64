package com.fleetwarden.core.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fleetwarden.core.config.Sleeper;
import com.fleetwarden.core.metrics.FleetMetrics;
import com.fleetwarden.core.sync.GhCli.GhResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs {@code gh} commands under the board's backoff rules.
 * <p>
 * Plain commands honour the process-wide rate-limit deadline and retry transient failures on a
 * fixed schedule. Project-scoped commands additionally rotate through candidate owners, remember
 * owners the board rejected, and back off per command after repeated failures. All backoff state
 * is persisted through {@link BackoffStateStore} so sibling processes respect it too.
 */
@Service
public class ProjectCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProjectCommandRunner.class);

    private static final List<Pattern> AUTH_LOGIN = List.of(
            Pattern.compile("logged in to \\S+ as ([\\w-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("account ([\\w-]+) \\(", Pattern.CASE_INSENSITIVE));

    private final GhCli gh;
    private final BackoffStateStore backoff;
    private final ProjectSettings settings;
    private final SyncProperties properties;
    private final FleetMetrics metrics;
    private final Clock clock;
    private final Sleeper sleeper;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final ConcurrentHashMap<String, CompletableFuture<GhResult>> inFlight = new ConcurrentHashMap<>();

    private volatile boolean authLoginResolved;
    private volatile String authLogin;

    public ProjectCommandRunner(GhCli gh, BackoffStateStore backoff, ProjectSettings settings,
                                SyncProperties properties, FleetMetrics metrics, Clock clock, Sleeper sleeper) {
        this.gh = gh;
        this.backoff = backoff;
        this.settings = settings;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Runs one command.
     *
     * @throws BoardBackoffException when the rate-limit window is open or the call was rate limited
     * @throws GhCommandException    when the call fails for any other reason
     */
    public GhResult run(List<String> args) {
        long until = backoff.current().rateLimitUntil();
        if (until > clock.millis()) {
            throw new BoardBackoffException("GitHub rate limit", until);
        }

        List<Long> delays = properties.getTransientRetryDelaysMs();
        for (int attempt = 0; ; attempt++) {
            try {
                return gh.run(args);
            } catch (GhCommandException e) {
                String text = e.fullText();
                if (GhErrorClassifier.isRateLimited(text)) {
                    long deadline = clock.millis() + settings.rateLimitRetryMs();
                    backoff.update(state -> state.withRateLimitUntil(deadline));
                    metrics.recordRateLimited("gh");
                    log.warn("GitHub rate limit hit, pausing board calls for {}ms", settings.rateLimitRetryMs());
                    throw new BoardBackoffException("GitHub rate limit", deadline);
                }
                if (GhErrorClassifier.isTransient(text) && attempt < delays.size()) {
                    long delay = delays.get(attempt);
                    log.warn("Transient gh failure (attempt {}/{}), retrying in {}ms: {}",
                            attempt + 1, delays.size() + 1, delay, e.getMessage());
                    pause(delay, e);
                    continue;
                }
                throw e;
            }
        }
    }

    /** Runs a command and parses its output; empty output is a JSON null. */
    public JsonNode runJson(List<String> args) {
        return parse(run(args), args);
    }

    /**
     * Runs a project-scoped command, trying each usable owner until one is accepted.
     * Identical concurrent calls (same {@code key}) share one execution.
     *
     * @param key            identifies the command for backoff and dedup, e.g. {@code item-list:7}
     * @param argsForOwner   builds the arguments for an owner; {@code null} means "omit --owner"
     */
    public JsonNode runProjectJson(String key, Function<String, List<String>> argsForOwner) {
        CompletableFuture<GhResult> mine = new CompletableFuture<>();
        CompletableFuture<GhResult> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("Joining in-flight project command {}", key);
            return parse(await(existing), List.of(key));
        }
        try {
            GhResult result = runProjectCommand(key, argsForOwner);
            mine.complete(result);
            return parse(result, List.of(key));
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    GhResult runProjectCommand(String key, Function<String, List<String>> argsForOwner) {
        long now = clock.millis();
        BackoffState state = backoff.current();
        if (state.backoffUntil(key) > now) {
            throw new BoardBackoffException("Project command " + key + " failed repeatedly", state.backoffUntil(key));
        }
        if (state.ownerRetryUntil() > now) {
            throw new BoardBackoffException("Every project owner was rejected", state.ownerRetryUntil());
        }
        if (state.ownerRetryUntil() != 0) {
            // Retry window elapsed: give every owner another chance
            state = backoff.update(s -> s.withInvalidOwners(List.of()).withOwnerRetryUntil(0));
        }

        GhCommandException lastOwnerError = null;
        for (String owner : ownerCandidates(state)) {
            try {
                GhResult result = run(argsForOwner.apply(owner));
                if (backoff.current().failures(key) > 0) {
                    backoff.update(s -> s.withCommandCleared(key));
                }
                return result;
            } catch (GhCommandException e) {
                if (!GhErrorClassifier.isOwnerError(e.fullText())) {
                    recordFailure(key);
                    throw e;
                }
                lastOwnerError = e;
                if (owner != null) {
                    log.warn("Board rejected project owner '{}': {}", owner, e.getMessage());
                    backoff.update(s -> s.withInvalidOwner(owner));
                }
            }
        }

        long until = clock.millis() + settings.ownerRetryMs();
        backoff.update(s -> s.withOwnerRetryUntil(until));
        recordFailure(key);
        log.warn("No project owner accepted for {}, retrying owners after {}ms", key, settings.ownerRetryMs(),
                lastOwnerError);
        throw new BoardBackoffException("Every project owner was rejected", until);
    }

    /**
     * Configured owner, repository owner, authenticated login, then no owner at all; owners
     * already rejected are skipped.
     */
    List<String> ownerCandidates(BackoffState state) {
        Set<String> named = new LinkedHashSet<>();
        addIfUsable(named, settings.projectOwner());
        if (settings.hasRepository()) {
            addIfUsable(named, settings.repoOwner());
        }
        addIfUsable(named, authenticatedLogin());
        named.removeAll(state.invalidOwners());

        List<String> candidates = new ArrayList<>(named);
        candidates.add(null);
        return candidates;
    }

    /** Login reported by {@code gh auth status}, resolved once; {@code null} when unavailable. */
    String authenticatedLogin() {
        if (authLoginResolved) {
            return authLogin;
        }
        String login = null;
        try {
            GhResult status = gh.run(List.of("auth", "status"));
            login = extractLogin(status.stdout() + "\n" + status.stderr());
        } catch (GhCommandException e) {
            log.debug("gh auth status unavailable: {}", e.getMessage());
        }
        authLogin = login;
        authLoginResolved = true;
        return login;
    }

    static String extractLogin(String authStatus) {
        for (Pattern pattern : AUTH_LOGIN) {
            Matcher matcher = pattern.matcher(authStatus);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private void recordFailure(String key) {
        int threshold = properties.getCommandFailureThreshold();
        long now = clock.millis();
        BackoffState updated = backoff.update(s -> {
            int failures = s.failures(key) + 1;
            Long until = null;
            if (failures >= threshold) {
                int exponent = Math.min(failures - threshold, 20);
                long delay = Math.min(properties.getCommandBackoffBaseMs() << exponent, properties.getCommandBackoffMaxMs());
                until = now + delay;
            }
            return s.withCommandFailure(key, failures, until);
        });
        if (updated.backoffUntil(key) > now) {
            log.warn("Project command {} failed {} times in a row, backing off for {}ms",
                    key, updated.failures(key), updated.backoffUntil(key) - now);
        }
    }

    private JsonNode parse(GhResult result, List<String> args) {
        String text = result.stdout().trim();
        if (text.isEmpty()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new GhCommandException("gh CLI returned invalid JSON: " + e.getOriginalMessage(), args, "", 0);
        }
    }

    private void pause(long millis, GhCommandException cause) {
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GhCommandException("Interrupted while waiting to retry gh", cause);
        }
    }

    private static GhResult await(CompletableFuture<GhResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
    }

    private static void addIfUsable(Set<String> owners, String owner) {
        if (owner != null && !owner.isBlank() && !ProjectSettings.UNKNOWN.equals(owner)) {
            owners.add(owner.trim());
        }
    }
}
