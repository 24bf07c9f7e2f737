package com.agentsentry.evaluator.bandit;

/**
 * One banditable choice with its Beta posterior parameters.
 *
 * <p>
 * All mutation goes through synchronized read-modify-write methods since
 * several exploiting workers may update the same arm concurrently.
 * </p>
 *
 * @author Naveed Gung
 */
public class Arm {

    private final String key;
    private long successes;
    private long failures;
    private long allocations;

    public Arm(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Record one reward observation.
     *
     * @param rewarded true when the attempt evaded detection
     */
    public synchronized void update(boolean rewarded) {
        if (rewarded) {
            successes++;
        } else {
            failures++;
        }
    }

    public synchronized void recordAllocation() {
        allocations++;
    }

    public synchronized ArmSnapshot snapshot() {
        return new ArmSnapshot(key, successes, failures, allocations);
    }
}
