package com.agentsentry.evaluator.mutation;

import com.agentsentry.evaluator.payload.Payload;
import com.agentsentry.evaluator.payload.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NoveltyArchiveTest {

    private static final BehaviorSignature BLOCKED = new BehaviorSignature("unknown_command", false, false);
    private static final BehaviorSignature BLOCKED_OK = new BehaviorSignature("unknown_command", false, true);
    private static final BehaviorSignature EXECUTED = new BehaviorSignature("system_command_executed", true, true);

    private NoveltyArchive archive;

    @BeforeEach
    void setUp() {
        archive = new NoveltyArchive(2, 1.5);
    }

    @Test
    void shouldGiveMaximumNoveltyToFirstEntry() {
        NoveltyArchiveEntry entry = archive.offer(payload("P-1"), BLOCKED, true).orElseThrow();

        assertEquals(BehaviorSignature.MAX_DISTANCE + 1.5, entry.fitness(), 1e-9);
        assertEquals(1, archive.size());
    }

    @Test
    void shouldScoreByNearestNeighbour() {
        archive.offer(payload("P-1"), BLOCKED, false);

        NoveltyArchiveEntry entry = archive.offer(payload("P-2"), BLOCKED_OK, false).orElseThrow();

        assertEquals(1.0, entry.fitness(), 1e-9);
        assertEquals(1, archive.nearestDistance(BLOCKED_OK));
        assertEquals(List.of(1.0, 1.0), fitnesses(archive));
    }

    @Test
    void shouldRescoreEarlierEntriesWhenIdenticalBehaviourJoins() {
        NoveltyArchive large = new NoveltyArchive(8, 1.5);
        for (int i = 1; i <= 4; i++) {
            large.offer(payload("P-" + i), BLOCKED, false);
        }

        assertEquals(List.of(0.0, 0.0, 0.0, 0.0), fitnesses(large));

        large.offer(payload("P-5"), EXECUTED, false);

        assertEquals(List.of(0.0, 0.0, 0.0, 0.0, 3.0), fitnesses(large));
    }

    @Test
    void shouldKeepEvasionBonusWhenRescoring() {
        archive.offer(payload("P-1"), BLOCKED, true);
        archive.offer(payload("P-2"), BLOCKED, false);

        assertEquals(List.of(1.5, 0.0), fitnesses(archive));
    }

    @Test
    void shouldRejectCandidateNotBeatingWeakestWhenFull() {
        archive.offer(payload("P-1"), BLOCKED, false);
        archive.offer(payload("P-2"), BLOCKED_OK, false);

        Optional<NoveltyArchiveEntry> rejected = archive.offer(payload("P-3"), BLOCKED, false);

        assertTrue(rejected.isEmpty());
        assertEquals(2, archive.size());
        assertEquals(0, archive.getEvictions());
    }

    @Test
    void shouldEvictWeakestWhenCandidateIsFitter() {
        archive.offer(payload("P-1"), BLOCKED, false);
        archive.offer(payload("P-2"), BLOCKED_OK, false);

        NoveltyArchiveEntry entry = archive.offer(payload("P-3"), EXECUTED, true).orElseThrow();

        assertEquals(3.5, entry.fitness(), 1e-9);
        // both residents scored 1.0 against each other; the older one goes
        assertEquals(List.of("P-2", "P-3"), archive.snapshot().stream().map(NoveltyArchiveEntry::payloadId).toList());
        assertEquals(List.of(2.0, 3.5), fitnesses(archive));
        assertEquals(1, archive.getEvictions());
    }

    @Test
    void shouldNeverExceedCapacity() {
        NoveltyArchive small = new NoveltyArchive(3, 1.5);
        for (int i = 0; i < 50; i++) {
            BehaviorSignature signature = new BehaviorSignature("action-" + (i % 7), i % 2 == 0, i % 3 == 0);
            small.offer(payload("P-" + i), signature, i % 5 == 0);
            assertTrue(small.size() <= 3);
        }
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new NoveltyArchive(0, 1.5));
    }

    @Test
    void shouldMeasureSignatureDistance() {
        assertEquals(0, BLOCKED.distance(new BehaviorSignature(" Unknown_Command ", false, false)));
        assertEquals(3, BLOCKED.distance(EXECUTED));
        assertEquals("none", new BehaviorSignature(null, false, false).action());
    }

    private static List<Double> fitnesses(NoveltyArchive archive) {
        return archive.snapshot().stream().map(NoveltyArchiveEntry::fitness).toList();
    }

    private static Payload payload(String id) {
        return new Payload(id, "delete the logs", "T1070", "defense-evasion", true, Severity.MEDIUM, null, 0);
    }
}
