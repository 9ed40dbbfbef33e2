package com.signalfusion.common.consensus;

import com.signalfusion.common.extract.ValueExtractor;
import com.signalfusion.common.model.Action;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.model.SpecialistResult;

import java.util.List;
import java.util.Map;

/**
 * Reads the directional signal out of a specialist payload.
 *
 * <h3>Lookup order</h3>
 * <ol>
 *   <li>explicit {@code signal} / {@code recommendation} / {@code action} text</li>
 *   <li>RISK: {@code risk_level} → {@link RiskLevel#impliedSignal()}</li>
 *   <li>SENTIMENT, NEWS: {@code sentiment} word, else numeric {@code sentiment_score} in [-1, 1]</li>
 *   <li>HOLD</li>
 * </ol>
 */
public final class SignalInterpreter {

    private static final List<String> SIGNAL_KEYS = List.of("signal", "recommendation", "action");

    private static final Map<String, Action> SENTIMENT_WORDS = Map.of(
        "very_bullish", Action.STRONG_BUY,
        "bullish",      Action.BUY,
        "positive",     Action.BUY,
        "neutral",      Action.HOLD,
        "mixed",        Action.HOLD,
        "bearish",      Action.SELL,
        "negative",     Action.SELL,
        "very_bearish", Action.STRONG_SELL
    );

    private SignalInterpreter() {}

    public static Action interpret(SpecialistResult result) {
        Map<String, Object> payload = result.payload();

        for (String key : SIGNAL_KEYS) {
            Action explicit = Action.parse(ValueExtractor.text(payload, key));
            if (explicit != null) return explicit;
        }

        if (result.kind() == SpecialistKind.RISK) {
            RiskLevel level = riskLevel(result);
            if (level != null) return level.impliedSignal();
        }

        if (result.kind() == SpecialistKind.SENTIMENT || result.kind() == SpecialistKind.NEWS) {
            String word = ValueExtractor.text(payload, "sentiment");
            if (word != null) {
                Action mapped = SENTIMENT_WORDS.get(word.replace(' ', '_').replace('-', '_'));
                if (mapped != null) return mapped;
            }
            Double score = ValueExtractor.firstNumber(payload, "sentiment_score", "sentiment");
            if (score != null) return Action.fromScore(Math.max(-1.0, Math.min(1.0, score)));
        }
        return Action.HOLD;
    }

    /** Risk level reported by a RISK result, or null when absent or unparseable. */
    public static RiskLevel riskLevel(SpecialistResult result) {
        if (result == null) return null;
        return RiskLevel.parse(ValueExtractor.text(result.payload(), "risk_level"));
    }
}
