package com.aegis.governance.degradation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the system-wide degradation level and the feature flags it implies.
 * <p>
 * The active {@link DegradedModeConfig} sits behind an {@link AtomicReference}: writers build a
 * complete new config and swap it in, so readers see either the old or the new flag set, never a
 * mix. Writers are serialized so each new config is derived from the latest one.
 */
public final class DegradationController {

    private static final Logger log = LoggerFactory.getLogger(DegradationController.class);

    private final DegradationPolicy policy;
    private final Clock clock;
    private final AtomicReference<DegradedModeConfig> active;
    private final List<ModeChange> history = new CopyOnWriteArrayList<>();

    public DegradationController(DegradationPolicy policy, Clock clock) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.policy = policy;
        this.clock = clock;
        this.active = new AtomicReference<>(resolve(DegradationLevel.NORMAL, Map.of(), "initial"));
    }

    /**
     * Replaces the active mode with the rules of {@code level}. Disabled features become DISABLED,
     * reduced ones DEGRADED, preserved ones ENABLED; features the rule does not mention keep their
     * current flag.
     */
    public synchronized DegradedModeConfig setDegradationLevel(DegradationLevel level, String reason) {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        DegradedModeConfig previous = active.get();
        DegradedModeConfig next = resolve(level, previous.featureFlags(), reason);
        active.set(next);
        history.add(new ModeChange(previous.level(), level, reason, next.activatedAt()));
        if (previous.level() != level) {
            log.warn("Degradation level {} -> {}: {}", previous.level(), level, reason);
        } else {
            log.info("Degradation level re-applied at {}: {}", level, reason);
        }
        return next;
    }

    /**
     * Raises the level to {@code floor} if it is currently lower; never lowers it.
     *
     * @return the active mode after the call
     */
    public synchronized DegradedModeConfig escalateTo(DegradationLevel floor, String reason) {
        DegradedModeConfig current = active.get();
        if (current.level().isAtLeast(floor)) {
            return current;
        }
        return setDegradationLevel(floor, reason);
    }

    /** Overrides a single feature's flag, e.g. to put a feature on CANARY while recovering. */
    public synchronized DegradedModeConfig setFeatureFlag(String feature, FeatureFlag flag, String reason) {
        if (feature == null || feature.isBlank()) {
            throw new IllegalArgumentException("feature must not be null or blank");
        }
        if (flag == null) {
            throw new IllegalArgumentException("flag must not be null");
        }
        DegradedModeConfig previous = active.get();
        Map<String, FeatureFlag> flags = new HashMap<>(previous.featureFlags());
        flags.put(feature, flag);
        DegradedModeConfig next = new DegradedModeConfig(previous.level(), previous.preserved(), previous.reduced(),
                previous.disabled(), flags, reason, clock.instant());
        active.set(next);
        history.add(new ModeChange(previous.level(), previous.level(), reason, next.activatedAt()));
        log.info("Feature {} set to {}: {}", feature, flag, reason);
        return next;
    }

    /** True if the feature serves any traffic under the active mode. */
    public boolean isFeatureAvailable(String feature) {
        return active.get().flag(feature).isAvailable();
    }

    public QualityTradeoffs getQualityTradeoffs() {
        DegradedModeConfig mode = active.get();
        FeatureRule rule = policy.rule(mode.level());
        Map<String, Boolean> availability = new HashMap<>();
        mode.featureFlags().forEach((feature, flag) -> availability.put(feature, flag.isAvailable()));
        return new QualityTradeoffs(mode.level(), availability, rule.slaImpact(), rule.notifyUsers());
    }

    public DegradedModeConfig activeMode() {
        return active.get();
    }

    public DegradationLevel currentLevel() {
        return active.get().level();
    }

    /** Every level change, oldest first. */
    public List<ModeChange> modeHistory() {
        return List.copyOf(history);
    }

    private DegradedModeConfig resolve(DegradationLevel level, Map<String, FeatureFlag> prior, String reason) {
        FeatureRule rule = policy.rule(level);
        Map<String, FeatureFlag> flags = new HashMap<>(prior);
        rule.preserved().forEach(feature -> flags.put(feature, FeatureFlag.ENABLED));
        rule.reduced().forEach(feature -> flags.put(feature, FeatureFlag.DEGRADED));
        rule.disabled().forEach(feature -> flags.put(feature, FeatureFlag.DISABLED));
        return new DegradedModeConfig(level, rule.preserved(), rule.reduced(), rule.disabled(), flags,
                reason, clock.instant());
    }
}
