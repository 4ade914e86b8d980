package com.reservealert.common.engine;

import com.reservealert.common.config.CautionPolicy;
import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.model.AlertLevel;
import com.reservealert.common.model.AlertRow;
import com.reservealert.common.model.ReasonCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end verification of {@link AlertDecisionEngine} on SpO₂ series.
 *
 * <p>Reference reserves: 93 → 0.6597, 92 → 0.5556 (recovery), 91 → 0.4375 (caution max),
 * 90 → 0.3056, 89 → 0.1597 (critical max), 88 → 0 (floor).
 */
class AlertDecisionEngineTest {

    private static final AlertLevel ON  = AlertLevel.ON;
    private static final AlertLevel ONF = AlertLevel.ON_STAR;
    private static final AlertLevel OFF = AlertLevel.OFF;

    private final AlertDecisionEngine streakEngine = new AlertDecisionEngine(RuleConfig.spo2StreakProfile());
    private final AlertDecisionEngine windowEngine = new AlertDecisionEngine(RuleConfig.spo2FloorWindowProfile());

    private static List<AlertLevel> alerts(List<AlertRow> rows) {
        return rows.stream().map(AlertRow::alert).collect(Collectors.toList());
    }

    private static List<ReasonCode> reasons(List<AlertRow> rows) {
        return rows.stream().map(AlertRow::reason).collect(Collectors.toList());
    }

    private static List<Integer> repeat(int raw, int times) {
        return Collections.nCopies(times, raw);
    }

    // ── evaluate(): contract ─────────────────────────────────────────────

    @Nested
    @DisplayName("evaluate(): contract")
    class ContractTests {

        @Test
        @DisplayName("one row per sample, in input order, raw value preserved")
        void oneRowPerSample() {
            List<Integer> series = List.of(97, 120, 91, 40);
            List<AlertRow> rows = streakEngine.evaluate(series);

            assertEquals(4, rows.size());
            for (int i = 0; i < rows.size(); i++) {
                assertEquals(i + 1, rows.get(i).step());
                assertEquals(series.get(i), rows.get(i).raw());
            }
        }

        @Test
        @DisplayName("empty series → no rows")
        void emptySeries() {
            assertTrue(streakEngine.evaluate(List.of()).isEmpty());
        }

        @Test
        @DisplayName("first row has no delta and is annotated as the initial sample")
        void firstRow() {
            AlertRow first = streakEngine.evaluate(List.of(95)).get(0);
            assertNull(first.delta());
            assertNull(first.deterioration());
            assertTrue(first.note().startsWith("first sample"));
        }

        @Test
        @DisplayName("re-running the same series yields identical rows")
        void idempotent() {
            List<Integer> series = List.of(93, 91, 90, 89, 88, 89, 89, 91, 92, 89, 90, 91, 92, 91, 89, 90);
            assertEquals(streakEngine.evaluate(series), streakEngine.evaluate(series));
            assertEquals(streakEngine.evaluate(series),
                AlertDecisionEngine.evaluate(series, RuleConfig.spo2StreakProfile()));
        }

        @Test
        @DisplayName("state does not leak from one run into the next")
        void noStateLeak() {
            streakEngine.evaluate(List.of(89, 89));
            List<AlertRow> rows = streakEngine.evaluate(List.of(89));
            assertEquals(OFF, rows.get(0).alert());
            assertEquals("first sample; counting critical persistence (1/3)", rows.get(0).note());
        }

        @Test
        @DisplayName("reserve, delta and deterioration rounded to 4 decimals")
        void rounding() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(92, 91, 90, 89));
            assertEquals(0.5556, rows.get(0).reserve());
            assertEquals(-0.1181, rows.get(1).delta());
            assertEquals(0.1319, rows.get(2).deterioration());
            assertEquals(0.1597, rows.get(3).reserve());
        }
    }

    // ── Streak-based dual hold ────────────────────────────────────────────

    @Nested
    @DisplayName("STREAK_DUAL_HOLD")
    class StreakModeTests {

        @Test
        @DisplayName("floor episode: ON* at the floor, then a fresh critical streak of 1")
        void floorEpisode() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(93, 91, 90, 89, 88, 89, 89, 91, 92));

            assertEquals(List.of(OFF, OFF, OFF, OFF, ONF, OFF, OFF, OFF, OFF), alerts(rows));
            AlertRow floor = rows.get(4);
            assertEquals(0.0, floor.reserve());
            assertEquals(ReasonCode.FLOOR_LIMIT, floor.reason());
            assertTrue(rows.get(5).note().contains("counting critical persistence (1/3)"));
        }

        @Test
        @DisplayName("gradual decline: deterioration computed each step, below the drop threshold")
        void gradualDecline() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(92, 91, 90, 89));

            assertEquals(0.1458, rows.get(3).deterioration());
            assertEquals(List.of(OFF, OFF, OFF, OFF), alerts(rows));
        }

        @Test
        @DisplayName("deterioration above 0.30 → ON / DROP_EVENT for that step only")
        void dropEvent() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(94, 89, 89));

            assertEquals(List.of(OFF, ON, OFF), alerts(rows));
            assertEquals(ReasonCode.DROP_EVENT, rows.get(1).reason());
            assertEquals(0.5903, rows.get(1).deterioration());
        }

        @Test
        @DisplayName("sitting exactly at caution max for 5 steps fires caution once, at step 5")
        void cautionAtBoundary() {
            List<AlertRow> rows = streakEngine.evaluate(repeat(91, 8));

            assertEquals(List.of(OFF, OFF, OFF, OFF, ON, ON, ON, OFF), alerts(rows));
            assertEquals(ReasonCode.CAUTION_PERSIST, rows.get(4).reason());
            assertEquals("flat (|delta|<=p)", rows.get(4).note());
            assertEquals("flat (|delta|<=p); holding ON (2 min left)", rows.get(5).note());
            assertEquals("flat (|delta|<=p); holding ON (1 min left); hold completed -> next OFF unless retrigger",
                rows.get(6).note());
        }

        @Test
        @DisplayName("critical persistence holds for 5 steps and never re-fires while the streak climbs")
        void criticalHold() {
            List<AlertRow> rows = streakEngine.evaluate(repeat(89, 10));

            assertEquals(List.of(OFF, OFF, ON, ON, ON, ON, ON, OFF, OFF, OFF), alerts(rows));
            assertTrue(reasons(rows).subList(2, 7).stream().allMatch(r -> r == ReasonCode.CRITICAL_PERSIST));
        }

        @Test
        @DisplayName("leaving the critical band ends the critical hold; caution may then fire")
        void criticalHoldEndsEarly() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(89, 89, 89, 90, 90));

            assertEquals(List.of(OFF, OFF, ON, OFF, ON), alerts(rows));
            assertEquals(ReasonCode.CRITICAL_PERSIST, rows.get(2).reason());
            assertTrue(rows.get(3).note().contains("hold ended early (reserve>critical)"));
            assertEquals(ReasonCode.CAUTION_PERSIST, rows.get(4).reason());
        }

        @Test
        @DisplayName("recovery clears the hold in the same step")
        void recoveryClearsHold() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(91, 91, 91, 91, 91, 92, 91));

            assertEquals(List.of(OFF, OFF, OFF, OFF, ON, OFF, OFF), alerts(rows));
            assertEquals("hold cancelled (reserve>=recovery); reset (reserve>=recovery)", rows.get(5).note());
        }

        @Test
        @DisplayName("floor clears an armed critical hold")
        void floorClearsHold() {
            List<AlertRow> rows = streakEngine.evaluate(List.of(89, 89, 89, 88, 89));

            assertEquals(List.of(OFF, OFF, ON, ONF, OFF), alerts(rows));
            assertTrue(rows.get(3).note().contains("hold cleared (floor)"));
        }

        @Test
        @DisplayName("every floor step asserts ON*")
        void floorEveryStep() {
            assertEquals(List.of(ONF, ONF, ONF, ONF), alerts(streakEngine.evaluate(repeat(85, 4))));
        }

        @Test
        @DisplayName("drop step pauses an armed hold instead of using it up")
        void dropPausesHold() {
            RuleConfig lowDrop = RuleConfig.builder().dropThreshold(0.10).build();
            List<AlertRow> rows = new AlertDecisionEngine(lowDrop).evaluate(List.of(91, 91, 91, 91, 91, 90, 90, 90, 90));

            // hold armed at step 5 (3 min), drop at 6, then 2 held minutes remain
            assertEquals(List.of(OFF, OFF, OFF, OFF, ON, ON, ON, ON, OFF), alerts(rows));
            assertEquals(List.of(ReasonCode.CAUTION_PERSIST, ReasonCode.DROP_EVENT,
                    ReasonCode.CAUTION_PERSIST, ReasonCode.CAUTION_PERSIST),
                reasons(rows).subList(4, 8));
        }
    }

    // ── Caution policy flag ───────────────────────────────────────────────

    @Nested
    @DisplayName("caution policy")
    class CautionPolicyTests {

        @Test
        @DisplayName("ALWAYS lets caution fire inside the critical band and take over the hold")
        void always() {
            RuleConfig always = RuleConfig.builder().cautionPolicy(CautionPolicy.ALWAYS).build();
            List<AlertRow> rows = new AlertDecisionEngine(always).evaluate(repeat(89, 9));

            assertEquals(List.of(OFF, OFF, ON, ON, ON, ON, ON, OFF, OFF), alerts(rows));
            assertEquals(ReasonCode.CRITICAL_PERSIST, rows.get(3).reason());
            assertEquals(ReasonCode.CAUTION_PERSIST, rows.get(4).reason());
        }

        @Test
        @DisplayName("DISABLED never fires caution")
        void disabled() {
            RuleConfig disabled = RuleConfig.builder().cautionPolicy(CautionPolicy.DISABLED).build();
            List<AlertRow> rows = new AlertDecisionEngine(disabled).evaluate(repeat(90, 8));

            assertTrue(alerts(rows).stream().allMatch(a -> a == OFF));
        }
    }

    // ── Floor window with reminder ────────────────────────────────────────

    @Nested
    @DisplayName("FLOOR_WINDOW_REMINDER")
    class FloorWindowTests {

        @Test
        @DisplayName("floor window of 3, reminder after 5 minutes at the floor, recovery ends it")
        void windowAndReminder() {
            List<AlertRow> rows = windowEngine.evaluate(List.of(90, 88, 88, 88, 88, 88, 88, 88, 88, 88, 92));

            assertEquals(List.of(OFF, ONF, ONF, ONF, OFF, OFF, OFF, OFF, ONF, ONF, OFF), alerts(rows));
            assertTrue(rows.get(1).note().contains("floor window armed (3 min)"));
            assertTrue(rows.get(3).note().contains("hold completed -> reminder in 5 min"));
            assertEquals(ReasonCode.NO_TRIGGER, rows.get(4).reason());
            assertTrue(rows.get(8).note().contains("reminder armed (3 min window)"));
            assertEquals(ReasonCode.FLOOR_LIMIT, rows.get(9).reason());
        }

        @Test
        @DisplayName("leaving the critical band ends the floor window early")
        void bandExitEndsWindow() {
            List<AlertRow> rows = windowEngine.evaluate(List.of(88, 91));

            assertEquals(List.of(ONF, OFF), alerts(rows));
            assertTrue(rows.get(1).note().contains("hold ended early (reserve>critical)"));
        }

        @Test
        @DisplayName("floor window continues while reserve stays in the critical band above 0")
        void windowContinuesInBand() {
            List<AlertRow> rows = windowEngine.evaluate(List.of(88, 89, 89, 89));

            assertEquals(List.of(ONF, ONF, ONF, ON), alerts(rows));
            assertEquals(ReasonCode.FLOOR_LIMIT, rows.get(2).reason());
            assertEquals(ReasonCode.CRITICAL_PERSIST, rows.get(3).reason());
        }

        @Test
        @DisplayName("band exit cancels a pending reminder; the next floor arms a fresh window")
        void bandExitCancelsReminder() {
            List<AlertRow> rows = windowEngine.evaluate(List.of(88, 88, 88, 88, 90, 88));

            assertEquals(List.of(ONF, ONF, ONF, OFF, OFF, ONF), alerts(rows));
            assertTrue(rows.get(4).note().contains("reminder cancelled (reserve>critical)"));
            assertTrue(rows.get(5).note().contains("floor window armed (3 min)"));
        }

        @Test
        @DisplayName("drop events hold for 2 minutes")
        void dropWindow() {
            List<AlertRow> rows = windowEngine.evaluate(List.of(94, 89, 89, 89));

            assertEquals(List.of(OFF, ON, ON, ON), alerts(rows));
            assertEquals(List.of(ReasonCode.NO_TRIGGER, ReasonCode.DROP_EVENT,
                ReasonCode.DROP_EVENT, ReasonCode.CRITICAL_PERSIST), reasons(rows));
        }

        @Test
        @DisplayName("drop on a recovery step arms its window after the recovery cancel and holds the next step")
        void dropOnRecoveryStep() {
            List<AlertRow> rows = windowEngine.evaluate(List.of(100, 92, 91));

            assertEquals(List.of(OFF, ON, ON), alerts(rows));
            assertEquals(List.of(ReasonCode.NO_TRIGGER, ReasonCode.DROP_EVENT, ReasonCode.DROP_EVENT), reasons(rows));
            assertEquals("reset (reserve>=recovery); drop window armed (2 min)", rows.get(1).note());
            assertEquals("holding ON (1 min left); hold completed -> next OFF unless retrigger", rows.get(2).note());
        }

        @Test
        @DisplayName("caution persistence is off in the floor-window profile")
        void noCautionRule() {
            assertTrue(alerts(windowEngine.evaluate(repeat(91, 7))).stream().allMatch(a -> a == OFF));
        }
    }
}
