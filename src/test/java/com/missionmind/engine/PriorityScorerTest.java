package com.missionmind.engine;

import com.missionmind.engine.model.PriorityBreakdown;
import com.missionmind.engine.model.RiskTier;
import com.missionmind.engine.model.TaskSnapshot;
import com.missionmind.engine.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PriorityScorerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 10);

    private final PriorityScorer scorer = new PriorityScorer(EngineTables.defaults());

    private static TaskSnapshot.TaskSnapshotBuilder task() {
        return TaskSnapshot.builder()
                .taskId("T-25-000001")
                .title("Quarterly review")
                .description("")
                .originator("Local unit")
                .orgUnitId("BDE")
                .status("open")
                .suspenseDate(TODAY.plusDays(30));
    }

    @Test
    void testHeadquartersReadinessTaskDueInFiveDays() {
        TaskSnapshot snapshot = task()
                .originator("HQDA DCS G-3/5/7")
                .suspenseDate(TODAY.plusDays(5))
                .tags(List.of("readiness", "training"))
                .build();

        PriorityBreakdown breakdown = scorer.explain(snapshot, TODAY);

        assertEquals(0.7, breakdown.urgency());
        assertEquals(1.0, breakdown.originator());
        assertEquals(0.4, breakdown.keywordBoost());
        assertEquals(0.7, breakdown.status());
        // 0.2 + 0.35*0.7 + 0.25*1.0 + 0.15*0.4 + 0.05*0.7
        assertEquals(0.79, breakdown.score());
    }

    @Test
    void testSameTaskDueInTwoDays() {
        TaskSnapshot snapshot = task()
                .originator("HQDA DCS G-3/5/7")
                .suspenseDate(TODAY.plusDays(2))
                .tags(List.of("readiness", "training"))
                .build();

        assertEquals(0.84, scorer.score(snapshot, TODAY));
    }

    @Test
    void testUnknownOriginatorAndStatusUseDefaults() {
        TaskSnapshot snapshot = task().status("archived").build();

        PriorityBreakdown breakdown = scorer.explain(snapshot, TODAY);

        assertEquals(EngineTables.DEFAULT_ORIGINATOR_WEIGHT, breakdown.originator());
        assertEquals(EngineTables.DEFAULT_STATUS_WEIGHT, breakdown.status());
        assertEquals(0.0, breakdown.keywordBoost());
        // 0.2 + 0.35*0.3 + 0.25*0.6 + 0 + 0.05*0.5
        assertEquals(0.48, breakdown.score());
    }

    @Test
    void testHalfCentSumsRoundOnTheirBinaryValue() {
        // 0.2 + 0.35*0.5 + 0.25*0.8 + 0 + 0.05*0.4 is stored as 0.59499...
        TaskSnapshot ascc = task().originator("ASCC").status("draft").suspenseDate(TODAY.plusDays(10)).build();
        // 0.2 + 0.35*0.7 + 0.25*1.0 + 0 + 0.05*0.4 is stored as 0.71499...
        TaskSnapshot hqda = task().originator("HQDA").status("draft").suspenseDate(TODAY.plusDays(5)).build();

        double asccScore = scorer.score(ascc, TODAY);

        assertEquals(0.59, asccScore);
        assertEquals(0.71, scorer.score(hqda, TODAY));
        assertEquals(RiskTier.GREEN, new RiskAssessor().assess(ascc.withPriorityScore(asccScore)).riskLevel());
    }

    @Test
    void testUrgencySteps() {
        assertEquals(1.0, PriorityScorer.urgencyScore(TODAY.minusDays(4), TODAY));
        assertEquals(1.0, PriorityScorer.urgencyScore(TODAY, TODAY));
        assertEquals(0.85, PriorityScorer.urgencyScore(TODAY.plusDays(1), TODAY));
        assertEquals(0.85, PriorityScorer.urgencyScore(TODAY.plusDays(3), TODAY));
        assertEquals(0.7, PriorityScorer.urgencyScore(TODAY.plusDays(4), TODAY));
        assertEquals(0.7, PriorityScorer.urgencyScore(TODAY.plusDays(7), TODAY));
        assertEquals(0.5, PriorityScorer.urgencyScore(TODAY.plusDays(8), TODAY));
        assertEquals(0.5, PriorityScorer.urgencyScore(TODAY.plusDays(14), TODAY));
        assertEquals(0.3, PriorityScorer.urgencyScore(TODAY.plusDays(15), TODAY));
        assertEquals(0.3, PriorityScorer.urgencyScore(null, TODAY));
    }

    @Test
    void testUrgencyNeverDecreasesAsDeadlineApproaches() {
        double previous = 0.0;
        for (int days = 40; days >= -5; days--) {
            double urgency = PriorityScorer.urgencyScore(TODAY.plusDays(days), TODAY);
            assertTrue(urgency >= previous, "urgency dropped at " + days + " days");
            previous = urgency;
        }
    }

    @Test
    void testOriginatorTableOrderWins() {
        TaskSnapshot snapshot = task().originator("acom tasking relayed for hqda").build();

        assertEquals(1.0, scorer.explain(snapshot, TODAY).originator());
    }

    @Test
    void testOriginatorMatchIsCaseInsensitiveSubstring() {
        assertEquals(0.8, scorer.explain(task().originator("usareur-af ascc staff").build(), TODAY).originator());
        assertEquals(0.75, scorer.explain(task().originator("MEDCOM (DRU)").build(), TODAY).originator());
    }

    @Test
    void testKeywordBoostIsCapped() {
        TaskSnapshot one = task().description("Update the legal review").build();
        TaskSnapshot many = task()
                .tags(List.of("intel", "logistics"))
                .description("personnel and chaplain coordination")
                .build();

        assertEquals(0.3, scorer.explain(one, TODAY).keywordBoost(), 1e-9);
        assertEquals(0.4, scorer.explain(many, TODAY).keywordBoost());
    }

    @Test
    void testTitleDoesNotContributeToKeywordBoost() {
        TaskSnapshot snapshot = task().title("Readiness drill").build();

        assertEquals(0.0, scorer.explain(snapshot, TODAY).keywordBoost());
    }

    @Test
    void testStatusSpellingsAreNormalized() {
        assertEquals(0.6, scorer.explain(task().status("in-work").build(), TODAY).status());
        assertEquals(0.6, scorer.explain(task().status("IN_WORK").build(), TODAY).status());
        assertEquals(1.0, scorer.explain(task().status("Overdue").build(), TODAY).status());
        assertEquals(0.4, scorer.explain(task().status("draft").build(), TODAY).status());
    }

    @Test
    void testScoreIsClampedToOne() {
        EngineTables heavy = new EngineTables(EngineTables.defaultKeywordSections(),
                List.of(new OriginatorWeight("HQDA", 4.0)), 0.6,
                Map.of(TaskStatus.OVERDUE, 1.0), 0.5);
        PriorityScorer heavyScorer = new PriorityScorer(heavy);

        double score = heavyScorer.score(task().originator("HQDA").status("overdue").build(), TODAY);

        assertEquals(1.0, score);
    }

    @Test
    void testScoreIsBoundedAndRounded() {
        List<String> originators = List.of("HQDA", "ACOM", "ASCC", "DRU", "somebody");
        List<String> statuses = List.of("draft", "open", "in_work", "overdue", "closed", "");
        for (String originator : originators) {
            for (String status : statuses) {
                for (int days = -3; days <= 20; days += 4) {
                    double score = scorer.score(task()
                            .originator(originator)
                            .status(status)
                            .suspenseDate(TODAY.plusDays(days))
                            .tags(List.of("training"))
                            .build(), TODAY);
                    assertTrue(score >= 0.0 && score <= 1.0);
                    assertEquals(score, Math.round(score * 100) / 100.0, 1e-12);
                }
            }
        }
    }

    @Test
    void testScoringIsIdempotent() {
        TaskSnapshot snapshot = task().tags(List.of("intel")).originator("ACOM").build();

        assertEquals(scorer.explain(snapshot, TODAY), scorer.explain(snapshot, TODAY));
    }

    @Test
    void testNullTaskIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> scorer.score(null, TODAY));
    }
}
