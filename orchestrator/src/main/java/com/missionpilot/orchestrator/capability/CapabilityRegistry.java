package com.missionpilot.orchestrator.capability;

import com.missionpilot.orchestrator.config.OrchestratorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * The agent's self-model of available tools.
 *
 * <p>Key responsibilities:
 * <ol>
 *   <li>Lookup by exact name ({@link #find}) and by free-text hint ({@link #lookup}).</li>
 *   <li>Confidence bookkeeping ({@link #adjustConfidence}); updates for one tool are
 *       applied atomically via {@code computeIfPresent}, reads never block.</li>
 *   <li>Verification ({@link #verify}) through the tool's read-only self-check.</li>
 * </ol>
 *
 * <p>Two kinds of failure move confidence down, and only one of them can
 * make a tool unusable:
 * <ul>
 *   <li>{@link #penalize} is for failures with a known cause (a syntax error,
 *       a missing dependency). The tool worked; the call was wrong. Confidence
 *       decays but stops at {@code min-confidence}, so the tool stays usable and
 *       Tier 1 keeps handling the task.</li>
 *   <li>{@link #demote} is for failures nobody can explain. Confidence may fall
 *       below the minimum, which turns the next call into a capability gap and
 *       hands the task to Tier 2.</li>
 * </ul>
 * Tier 2 brings a demoted tool back with {@link #restore} once its check passes.
 *
 * Registry membership is a hard precondition for dispatch: the Tool Gateway
 * refuses any tool name that is not registered here.
 */
@Component
public class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<String, CapabilityManifestEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, BooleanSupplier>         checks  = new ConcurrentHashMap<>();
    private final OrchestratorProperties.Capability    config;

    public CapabilityRegistry(OrchestratorProperties properties) {
        this.config = properties.getCapability();
    }

    // ------------------------------------------------------------------
    // Registration
    // ------------------------------------------------------------------

    public void register(CapabilityManifestEntry entry) {
        entries.put(entry.toolName(), entry);
        log.info("Registered capability '{}' (confidence {})", entry.toolName(), entry.confidenceScore());
    }

    /** Register an entry together with the check used by {@link #verify}. */
    public void register(CapabilityManifestEntry entry, BooleanSupplier check) {
        checks.put(entry.toolName(), check);
        register(entry);
    }

    /**
     * Remove a tool and its check. The Tool Gateway refuses it from then on.
     *
     * @return true if the tool was registered
     */
    public boolean unregister(String toolName) {
        if (toolName == null) return false;
        checks.remove(toolName);
        CapabilityManifestEntry removed = entries.remove(toolName);
        if (removed == null) {
            return false;
        }
        log.info("Unregistered capability '{}' (confidence was {})", toolName, removed.confidenceScore());
        return true;
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<CapabilityManifestEntry> find(String toolName) {
        return toolName == null ? Optional.empty() : Optional.ofNullable(entries.get(toolName));
    }

    /**
     * True if the tool is registered with at least the minimum confidence.
     * Anything else is a capability gap.
     */
    public boolean isUsable(String toolName) {
        return find(toolName)
                .map(e -> e.confidenceScore() >= config.getMinConfidence())
                .orElse(false);
    }

    /** Empty if the tool is not registered. */
    public Optional<CapabilityHealth> health(String toolName) {
        return find(toolName).map(e -> CapabilityHealth.of(e.confidenceScore(),
                config.getMinConfidence(), config.getVerifyThreshold()));
    }

    public boolean needsVerification(String toolName) {
        return find(toolName)
                .map(e -> e.confidenceScore() < config.getVerifyThreshold())
                .orElse(true);
    }

    /**
     * Entries plausibly relevant to a free-text hint (e.g. a task description),
     * best match first. A blank hint returns every entry.
     */
    public List<CapabilityManifestEntry> lookup(String capabilityHint) {
        Set<String> words = tokens(capabilityHint);
        if (words.isEmpty()) {
            return all();
        }
        return entries.values().stream()
                .filter(e -> relevance(e, words) > 0)
                .sorted(Comparator.comparingInt((CapabilityManifestEntry e) -> relevance(e, words)).reversed()
                        .thenComparing(Comparator.comparingDouble(CapabilityManifestEntry::confidenceScore).reversed())
                        .thenComparing(CapabilityManifestEntry::toolName))
                .toList();
    }

    /** All entries, sorted by name. */
    public List<CapabilityManifestEntry> all() {
        return entries.values().stream()
                .sorted(Comparator.comparing(CapabilityManifestEntry::toolName))
                .toList();
    }

    // ------------------------------------------------------------------
    // Confidence + verification
    // ------------------------------------------------------------------

    /**
     * Shift a tool's confidence by {@code delta}, clamped to [0, 1].
     *
     * @return the new confidence, or empty if the tool is not registered
     */
    public Optional<Double> adjustConfidence(String toolName, double delta) {
        CapabilityManifestEntry updated = entries.computeIfPresent(toolName,
                (name, e) -> e.withConfidence(e.confidenceScore() + delta));
        if (updated == null) {
            return Optional.empty();
        }
        log.debug("Confidence of '{}' adjusted by {} to {}", toolName, delta, updated.confidenceScore());
        return Optional.of(updated.confidenceScore());
    }

    public void reinforce(String toolName) {
        adjustConfidence(toolName, config.getSuccessDelta());
    }

    /**
     * Decay after a failure with a known cause. Never takes a usable tool
     * below {@code min-confidence}; a tool already below it is not raised.
     */
    public Optional<Double> penalize(String toolName) {
        double floor = config.getMinConfidence();
        CapabilityManifestEntry updated = entries.computeIfPresent(toolName, (name, e) -> {
            double current = e.confidenceScore();
            return e.withConfidence(Math.max(current - config.getFailureDelta(), Math.min(current, floor)));
        });
        if (updated == null) {
            return Optional.empty();
        }
        log.debug("Confidence of '{}' penalized to {}", toolName, updated.confidenceScore());
        return Optional.of(updated.confidenceScore());
    }

    /** Decay after an unexplained failure; may leave the tool unusable. */
    public Optional<Double> demote(String toolName) {
        Optional<Double> now = adjustConfidence(toolName, -config.getFailureDelta());
        now.filter(c -> c < config.getMinConfidence())
           .ifPresent(c -> log.warn("Capability '{}' demoted below the minimum confidence ({})", toolName, c));
        return now;
    }

    /**
     * Bring a tool back to at least the initial confidence, typically after
     * its check passed again. Higher confidence is kept.
     *
     * @return the new confidence, or empty if the tool is not registered
     */
    public Optional<Double> restore(String toolName) {
        CapabilityManifestEntry updated = entries.computeIfPresent(toolName,
                (name, e) -> e.withConfidence(Math.max(e.confidenceScore(), config.getInitialConfidence())));
        if (updated == null) {
            return Optional.empty();
        }
        log.info("Restored capability '{}' to confidence {}", toolName, updated.confidenceScore());
        return Optional.of(updated.confidenceScore());
    }

    /**
     * Run the tool's read-only self-check. A passing check stamps {@code verifiedAt}.
     * Tools registered without a check cannot be verified.
     */
    public boolean verify(String toolName) {
        BooleanSupplier check = checks.get(toolName);
        if (check == null || !entries.containsKey(toolName)) {
            return false;
        }
        boolean ok;
        try {
            ok = check.getAsBoolean();
        } catch (RuntimeException e) {
            log.warn("Check for '{}' threw: {}", toolName, e.getMessage());
            ok = false;
        }
        if (ok) {
            entries.computeIfPresent(toolName, (name, e) -> e.withVerifiedAt(Instant.now()));
        }
        log.info("Verified capability '{}': {}", toolName, ok ? "ok" : "FAILED");
        return ok;
    }

    public double initialConfidence() {
        return config.getInitialConfidence();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static int relevance(CapabilityManifestEntry e, Set<String> words) {
        Set<String> own = tokens(e.toolName() + " " + e.description());
        int score = 0;
        for (String w : words) {
            if (own.contains(w)) score++;
        }
        return score;
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) return Set.of();
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> w.length() > 2)
                .collect(Collectors.toSet());
    }
}
