package com.aegis.governance.fallback;

import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.support.BoundedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps each service's position in its fallback chain and moves it between tiers.
 * <p>
 * Automatic failover only ever steps to the next tier. It is refused when auto failover is off,
 * held until the service's failure threshold is reached, reported as
 * {@link FallbackOutcome#ALREADY_AT_LOWEST_TIER} on the last tier, and turned into an
 * {@link FallbackOutcome#APPROVAL_REQUIRED} proposal when the current tier requires approval to
 * exit. Entering a gated tier automatically is allowed. An explicit target tier is an operator
 * decision and bypasses those checks.
 * <p>
 * Requests for one service are serialized by that service's lock; different services proceed
 * independently.
 */
public final class FallbackOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(FallbackOrchestrator.class);

    private final Map<String, ServiceChain> chains = new ConcurrentHashMap<>();
    private final BoundedLog<TierTransition> history;
    private final Clock clock;

    public FallbackOrchestrator(Clock clock) {
        this(clock, BoundedLog.DEFAULT_CAPACITY);
    }

    /**
     * @param historyRetention most recent transitions kept across all services
     */
    public FallbackOrchestrator(Clock clock, int historyRetention) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
        this.history = new BoundedLog<>(historyRetention);
    }

    /**
     * Installs the chain for a service, starting on tier 0. Reconfiguring a service keeps its
     * current tier if that tier still exists.
     */
    public void configure(FallbackConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        chains.compute(config.service(), (service, existing) -> {
            ServiceChain chain = new ServiceChain(config);
            if (existing != null) {
                int carried = config.indexOf(existing.current().id());
                chain.currentIndex = Math.max(carried, 0);
            }
            return chain;
        });
        log.info("Configured fallback chain for {}: {}", config.service(),
                config.tiers().stream().map(FallbackTier::id).toList());
    }

    public boolean isConfigured(String service) {
        return service != null && chains.containsKey(service);
    }

    /**
     * Moves the service down its chain in response to a failure.
     *
     * @param service    the service
     * @param trigger    failure that caused the request (may be null for operator moves)
     * @param targetTier explicit tier id chosen by an operator, or null for the next tier
     */
    public FallbackResult triggerFallback(String service, FailureEvent trigger, String targetTier) {
        ServiceChain chain = service == null ? null : chains.get(service);
        if (chain == null) {
            return FallbackResult.notConfigured(service);
        }
        String triggerId = trigger != null ? trigger.id() : TierTransition.MANUAL_TRIGGER;

        chain.lock.lock();
        try {
            FallbackConfig config = chain.config;
            FallbackTier current = chain.current();

            if (targetTier != null) {
                int target = config.indexOf(targetTier);
                if (target < 0) {
                    return FallbackResult.unchanged(FallbackOutcome.UNKNOWN_TIER, service, current.id(),
                            "Tier '" + targetTier + "' is not in the chain of " + service);
                }
                if (target == chain.currentIndex) {
                    return FallbackResult.unchanged(FallbackOutcome.NO_CHANGE, service, current.id(),
                            service + " is already on tier '" + targetTier + "'");
                }
                TierTransition transition = chain.moveTo(target, triggerId, false);
                return FallbackResult.moved(FallbackOutcome.TRANSITIONED, transition,
                        "Moved " + service + " to '" + targetTier + "' by operator decision");
            }

            if (!config.autoFailover()) {
                return FallbackResult.unchanged(FallbackOutcome.AUTO_FAILOVER_DISABLED, service, current.id(),
                        "Automatic failover is disabled for " + service);
            }
            chain.pendingFailures++;
            if (chain.pendingFailures < config.failureThreshold()) {
                return FallbackResult.unchanged(FallbackOutcome.THRESHOLD_NOT_REACHED, service, current.id(),
                        chain.pendingFailures + " of " + config.failureThreshold() + " failures before failover");
            }
            if (chain.currentIndex == config.tiers().size() - 1) {
                return FallbackResult.unchanged(FallbackOutcome.ALREADY_AT_LOWEST_TIER, service, current.id(),
                        service + " is on its last tier '" + current.id() + "'; manual intervention required");
            }
            FallbackTier next = config.tiers().get(chain.currentIndex + 1);
            if (current.approvalGated()) {
                TierTransition proposed = TierTransition.between(service, current, next, triggerId, clock.instant(), true);
                log.warn("Failover of {} from '{}' to '{}' requires approval", service, current.id(), next.id());
                return FallbackResult.approvalRequired(proposed,
                        "Moving " + service + " from '" + current.id() + "' to '" + next.id() + "' requires approval");
            }
            TierTransition transition = chain.moveTo(chain.currentIndex + 1, triggerId, true);
            return FallbackResult.moved(FallbackOutcome.TRANSITIONED, transition,
                    "Failed over " + service + " to '" + next.id() + "'");
        } finally {
            chain.lock.unlock();
        }
    }

    /** Jumps the service straight back to tier 0. Calling it on tier 0 returns ALREADY_PRIMARY. */
    public FallbackResult restoreToPrimary(String service) {
        ServiceChain chain = service == null ? null : chains.get(service);
        if (chain == null) {
            return FallbackResult.notConfigured(service);
        }
        chain.lock.lock();
        try {
            if (chain.currentIndex == 0) {
                return FallbackResult.unchanged(FallbackOutcome.ALREADY_PRIMARY, service, chain.current().id(),
                        service + " is already on primary");
            }
            TierTransition transition = chain.moveTo(0, TierTransition.RESTORE_TRIGGER, false);
            return FallbackResult.moved(FallbackOutcome.RESTORED, transition, "Restored " + service + " to primary");
        } finally {
            chain.lock.unlock();
        }
    }

    /** Ordered tiers of the service; empty if it is not configured. */
    public List<FallbackTier> getFallbackChain(String service) {
        ServiceChain chain = service == null ? null : chains.get(service);
        return chain == null ? List.of() : chain.config.tiers();
    }

    public Optional<FallbackTier> currentTier(String service) {
        ServiceChain chain = service == null ? null : chains.get(service);
        if (chain == null) {
            return Optional.empty();
        }
        chain.lock.lock();
        try {
            return Optional.of(chain.current());
        } finally {
            chain.lock.unlock();
        }
    }

    public Optional<FallbackConfig> config(String service) {
        ServiceChain chain = service == null ? null : chains.get(service);
        return chain == null ? Optional.empty() : Optional.of(chain.config);
    }

    /** Services currently below tier 0, sorted. */
    public Set<String> activeFallbacks() {
        Set<String> active = new TreeSet<>();
        chains.forEach((service, chain) -> {
            if (chain.inFallback()) {
                active.add(service);
            }
        });
        return active;
    }

    public List<TierTransition> transitionHistory() {
        return history.snapshot();
    }

    public List<TierTransition> transitionHistory(String service) {
        return history.filter(t -> t.service().equals(service));
    }

    /** Mutable position of one service, guarded by {@link #lock}. */
    private final class ServiceChain {
        final FallbackConfig config;
        final ReentrantLock lock = new ReentrantLock();
        volatile int currentIndex;
        int pendingFailures;

        ServiceChain(FallbackConfig config) {
            this.config = config;
        }

        FallbackTier current() {
            return config.tiers().get(currentIndex);
        }

        boolean inFallback() {
            return currentIndex > 0;
        }

        TierTransition moveTo(int target, String triggerId, boolean automatic) {
            FallbackTier from = current();
            FallbackTier to = config.tiers().get(target);
            TierTransition transition = TierTransition.between(config.service(), from, to, triggerId,
                    clock.instant(), automatic);
            currentIndex = target;
            pendingFailures = 0;
            history.append(transition);
            log.info("{}: tier '{}' -> '{}' (quality {}{}%, trigger {})", config.service(), from.id(), to.id(),
                    transition.qualityDelta() >= 0 ? "+" : "", transition.qualityDelta(), triggerId);
            return transition;
        }
    }
}
