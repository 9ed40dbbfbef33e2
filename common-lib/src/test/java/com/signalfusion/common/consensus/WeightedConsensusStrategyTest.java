package com.signalfusion.common.consensus;

import com.signalfusion.common.exception.InsufficientQuorumException;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.SpecialistContribution;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link WeightedConsensusStrategy} with default weights
 * (fundamental 0.35, technical 0.25, risk 0.20, news 0.15, sentiment 0.10, macro 0.10).
 */
class WeightedConsensusStrategyTest {

    private final WeightedConsensusStrategy strategy = new WeightedConsensusStrategy();
    private static final Set<SpecialistKind> ALL = EnumSet.allOf(SpecialistKind.class);

    private static SpecialistResult signal(SpecialistKind kind, String signal, double confidence) {
        return SpecialistResult.of(kind, "AAPL", Map.of("signal", signal), confidence);
    }

    // ── weighted score ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("weighted score")
    class ScoreTests {

        @Test
        @DisplayName("unanimous BUY → score 0.5, action BUY")
        void unanimousBuy() {
            ConsensusResult r = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "BUY", 0.8),
                signal(SpecialistKind.FUNDAMENTAL, "BUY", 0.6)), ALL);

            assertEquals(0.5, r.score(), 1e-9);
            assertEquals(Action.BUY, r.action());
            assertEquals(1.0, r.agreement(), 1e-9);
        }

        @Test
        @DisplayName("STRONG_BUY technical vs SELL fundamental → 0.125 → HOLD")
        void opposingSignals() {
            ConsensusResult r = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "STRONG_BUY", 1.0),
                signal(SpecialistKind.FUNDAMENTAL, "SELL", 1.0)), ALL);

            assertEquals((0.25 - 0.175) / 0.6, r.score(), 1e-9);
            assertEquals(Action.HOLD, r.action());
        }

        @Test
        @DisplayName("zero-confidence specialist does not move the score")
        void zeroConfidenceIgnored() {
            ConsensusResult r = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "BUY", 0.9),
                signal(SpecialistKind.NEWS, "STRONG_SELL", 0.0)), ALL);

            assertEquals(0.5, r.score(), 1e-9);
        }

        @Test
        @DisplayName("sentiment words are read when no explicit signal is present")
        void sentimentWords() {
            SpecialistResult sentiment = SpecialistResult.of(SpecialistKind.SENTIMENT, "AAPL",
                Map.of("sentiment", "Very Bullish"), 1.0);
            ConsensusResult r = strategy.compute(List.of(
                sentiment, signal(SpecialistKind.TECHNICAL, "STRONG_BUY", 1.0)), ALL);

            assertEquals(Action.STRONG_BUY, r.contributions().get(SpecialistKind.SENTIMENT).signal());
            assertEquals(Action.STRONG_BUY, r.action());
        }
    }

    // ── absent redistribution ─────────────────────────────────────────────────

    @Nested
    @DisplayName("absent specialists")
    class AbsentTests {

        @Test
        @DisplayName("absent weight is redistributed proportionally among responders")
        void redistribution() {
            ConsensusResult r = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "BUY", 0.7),
                signal(SpecialistKind.FUNDAMENTAL, "BUY", 0.7)), ALL);

            SpecialistContribution tech = r.contributions().get(SpecialistKind.TECHNICAL);
            SpecialistContribution fund = r.contributions().get(SpecialistKind.FUNDAMENTAL);
            assertEquals(0.25 / 0.60, tech.effectiveWeight(), 1e-9);
            assertEquals(0.35 / 0.60, fund.effectiveWeight(), 1e-9);
            assertEquals(1.0, tech.effectiveWeight() + fund.effectiveWeight(), 1e-9);
            assertEquals(List.of(SpecialistKind.SENTIMENT, SpecialistKind.RISK,
                                 SpecialistKind.MACRO, SpecialistKind.NEWS), r.absent());
        }
    }

    // ── risk adjustment ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("risk adjustment")
    class RiskTests {

        private final SpecialistResult techBuy = signal(SpecialistKind.TECHNICAL, "STRONG_BUY", 1.0);
        private final SpecialistResult fundBuy = signal(SpecialistKind.FUNDAMENTAL, "STRONG_BUY", 1.0);

        @Test
        @DisplayName("high risk damps a positive score by 0.8")
        void highRiskDamps() {
            SpecialistResult risk = SpecialistResult.of(SpecialistKind.RISK, "AAPL",
                Map.of("risk_level", "high"), 1.0);
            ConsensusResult r = strategy.compute(List.of(techBuy, fundBuy, risk), ALL);

            assertEquals(0.625 * 0.8, r.score(), 1e-9);
            assertEquals(Action.BUY, r.action());
            assertEquals(1, r.riskAdjustments().size());
        }

        @Test
        @DisplayName("high risk with Sharpe 0.3 caps the score into HOLD")
        void lowSharpeCapsToHold() {
            SpecialistResult risk = SpecialistResult.of(SpecialistKind.RISK, "AAPL",
                Map.of("risk_level", "HIGH", "sharpe_ratio", "0.3"), 1.0);
            ConsensusResult r = strategy.compute(List.of(techBuy, fundBuy, risk), ALL);

            assertEquals(Action.HOLD, r.action());
            assertEquals(2, r.riskAdjustments().size());
        }

        @Test
        @DisplayName("low risk leaves the score untouched")
        void lowRiskUntouched() {
            SpecialistResult risk = SpecialistResult.of(SpecialistKind.RISK, "AAPL",
                Map.of("risk_level", "low", "max_drawdown", 45.0), 1.0);
            ConsensusResult r = strategy.compute(List.of(techBuy, fundBuy, risk), ALL);

            assertTrue(r.riskAdjustments().isEmpty());
            assertEquals((0.25 + 0.35 + 0.5 * 0.20) / 0.80, r.score(), 1e-9);
        }
    }

    // ── confidence and dissent ────────────────────────────────────────────────

    @Nested
    @DisplayName("confidence and dissent")
    class ConfidenceTests {

        @Test
        @DisplayName("confidence always within [0.1, 0.95]")
        void confidenceBounds() {
            ConsensusResult weak = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "BUY", 0.0),
                signal(SpecialistKind.FUNDAMENTAL, "SELL", 0.0)), ALL);
            ConsensusResult strong = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "STRONG_BUY", 1.0),
                signal(SpecialistKind.FUNDAMENTAL, "STRONG_BUY", 1.0)), ALL);

            assertTrue(weak.confidence() >= 0.1 && weak.confidence() <= 0.95);
            assertEquals(0.95, strong.confidence(), 1e-9);
        }

        @Test
        @DisplayName("specialists far from the consensus score are dissenters")
        void dissenters() {
            ConsensusResult r = strategy.compute(List.of(
                signal(SpecialistKind.TECHNICAL, "STRONG_BUY", 1.0),
                signal(SpecialistKind.FUNDAMENTAL, "STRONG_BUY", 1.0),
                signal(SpecialistKind.NEWS, "STRONG_SELL", 1.0)), ALL);

            assertEquals(List.of(SpecialistKind.NEWS), r.dissenters());
            assertTrue(r.reasoning().contains("dissent"));
        }
    }

    // ── quorum ────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("QuorumPolicy")
    class QuorumTests {

        private final QuorumPolicy quorum = QuorumPolicy.defaults();

        @Test
        @DisplayName("one non-anchor responder → InsufficientQuorum")
        void singleNonAnchorFails() {
            assertThrows(InsufficientQuorumException.class,
                () -> quorum.enforce("AAPL", List.of(SpecialistKind.SENTIMENT)));
        }

        @Test
        @DisplayName("two responders without technical/fundamental → fails")
        void noAnchorFails() {
            assertFalse(quorum.isSatisfied(List.of(SpecialistKind.NEWS, SpecialistKind.MACRO)));
        }

        @Test
        @DisplayName("fundamental plus one other → satisfied")
        void fundamentalPlusOne() {
            assertDoesNotThrow(() -> quorum.enforce("AAPL", List.of(SpecialistKind.FUNDAMENTAL, SpecialistKind.NEWS)));
        }

        @Test
        @DisplayName("technical alone → fails on count")
        void anchorAloneFails() {
            assertFalse(quorum.isSatisfied(List.of(SpecialistKind.TECHNICAL)));
        }
    }
}
