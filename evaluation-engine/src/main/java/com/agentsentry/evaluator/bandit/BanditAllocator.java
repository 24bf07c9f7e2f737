package com.agentsentry.evaluator.bandit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spends the attempt budget across arms.
 *
 * <p>
 * Reward 1 means the attacker's payload evaded detection (a false negative),
 * so budget concentrates on arms that keep producing evasions. When the
 * policy cannot pick among the eligible arms the allocator falls back to a
 * uniform choice over every registered arm and counts the fallback.
 * </p>
 *
 * <p>
 * One allocator serves one run. Choices are serialized on the allocator so
 * a fixed seed reproduces the same draw sequence for a given call order.
 * </p>
 *
 * @author Naveed Gung
 */
public class BanditAllocator {

    private static final Logger log = LoggerFactory.getLogger(BanditAllocator.class);

    private final AllocationPolicy policy;
    private final AllocationPolicy fallback = new UniformRandomPolicy();
    private final Random random;
    private final Map<String, Arm> arms = new ConcurrentSkipListMap<>();
    private final AtomicInteger fallbacks = new AtomicInteger();

    public BanditAllocator(AllocationPolicy policy, long seed) {
        this.policy = policy;
        this.random = new Random(seed);
    }

    public static BanditAllocator of(PolicyType type, long seed) {
        return new BanditAllocator(type == PolicyType.UNIFORM ? new UniformRandomPolicy()
                : new ThompsonSamplingPolicy(), seed);
    }

    /** Ensure an arm exists for every key. */
    public void register(Collection<String> keys) {
        keys.forEach(this::arm);
    }

    /**
     * Choose the next arm among the eligible keys.
     *
     * @param eligible arm keys that may be chosen
     * @return chosen arm key
     * @throws AllocationException if neither the eligible set nor the
     *                             registered arms offer a choice
     */
    public synchronized String choose(Collection<String> eligible) {
        List<ArmSnapshot> candidates = new ArrayList<>();
        for (String key : eligible.stream().distinct().sorted().toList()) {
            candidates.add(arm(key).snapshot());
        }

        String chosen;
        try {
            chosen = policy.choose(candidates, random);
        } catch (AllocationException e) {
            fallbacks.incrementAndGet();
            log.warn("Allocation via {} failed ({}), falling back to uniform choice over {} arms",
                    policy.name(), e.getMessage(), arms.size());
            chosen = fallback.choose(snapshots(), random);
        }

        arm(chosen).recordAllocation();
        return chosen;
    }

    /**
     * Apply one reward observation to an arm.
     */
    public void update(String key, boolean rewarded) {
        arm(key).update(rewarded);
    }

    public List<ArmSnapshot> snapshots() {
        return arms.values().stream().map(Arm::snapshot).toList();
    }

    public int armCount() {
        return arms.size();
    }

    /** Choices that needed the uniform fallback. */
    public int getFallbacks() {
        return fallbacks.get();
    }

    public String policyName() {
        return policy.name();
    }

    private Arm arm(String key) {
        return arms.computeIfAbsent(key, Arm::new);
    }
}
