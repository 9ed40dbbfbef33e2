package com.signalfusion.orchestrator.config;

import com.signalfusion.common.consensus.ConsensusWeights;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.risk.SizingParameters;
import com.signalfusion.orchestrator.ai.ModelTier;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables of the fusion pipeline, bound from the {@code fusion.*} block of application.yml.
 * Every default here mirrors the shipped application.yml so the service also starts without it.
 */
@Validated
@ConfigurationProperties(prefix = "fusion")
public class FusionProperties {

    @Valid private final Consensus consensus = new Consensus();
    @Valid private final Quorum quorum       = new Quorum();
    @Valid private final Dispatch dispatch   = new Dispatch();
    @Valid private final Sizing sizing       = new Sizing();
    @Valid private final Cache cache         = new Cache();
    @Valid private final Router router       = new Router();

    public Consensus getConsensus() { return consensus; }
    public Quorum getQuorum()       { return quorum; }
    public Dispatch getDispatch()   { return dispatch; }
    public Sizing getSizing()       { return sizing; }
    public Cache getCache()         { return cache; }
    public Router getRouter()       { return router; }

    // ── consensus ─────────────────────────────────────────────────────────────

    public static class Consensus {

        /** Static weight per specialist, keyed by wire name ("technical", "fundamental", ...). */
        private Map<String, Double> weights = new LinkedHashMap<>(Map.of(
            "fundamental", 0.35,
            "technical",   0.25,
            "risk",        0.20,
            "news",        0.15,
            "sentiment",   0.10,
            "macro",       0.10));

        @DecimalMin("0.0") private double baseWeight = 0.7;
        @DecimalMin("0.0") private double enrichmentWeight = 0.3;

        public Map<String, Double> getWeights() { return weights; }
        public void setWeights(Map<String, Double> weights) { this.weights = weights; }
        public double getBaseWeight() { return baseWeight; }
        public void setBaseWeight(double baseWeight) { this.baseWeight = baseWeight; }
        public double getEnrichmentWeight() { return enrichmentWeight; }
        public void setEnrichmentWeight(double enrichmentWeight) { this.enrichmentWeight = enrichmentWeight; }

        /**
         * @throws IllegalArgumentException on an unknown specialist name or an invalid blend
         */
        public ConsensusWeights toConsensusWeights() {
            Map<SpecialistKind, Double> byKind = new EnumMap<>(SpecialistKind.class);
            weights.forEach((name, w) -> {
                SpecialistKind kind = SpecialistKind.fromName(name);
                if (kind == null) {
                    throw new IllegalArgumentException("Unknown specialist in fusion.consensus.weights: " + name);
                }
                byKind.put(kind, w);
            });
            return new ConsensusWeights(byKind, baseWeight, enrichmentWeight);
        }
    }

    // ── quorum ────────────────────────────────────────────────────────────────

    public static class Quorum {
        @Min(1) private int minSpecialists = 2;

        public int getMinSpecialists() { return minSpecialists; }
        public void setMinSpecialists(int minSpecialists) { this.minSpecialists = minSpecialists; }
    }

    // ── dispatch ──────────────────────────────────────────────────────────────

    public static class Dispatch {
        @NotNull private Duration timeout        = Duration.ofSeconds(60);
        @Min(0)  private int maxRetries          = 3;
        @NotNull private Duration initialBackoff = Duration.ofMillis(500);
        @NotNull private Duration maxBackoff     = Duration.ofSeconds(5);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
        public Duration getMaxBackoff() { return maxBackoff; }
        public void setMaxBackoff(Duration maxBackoff) { this.maxBackoff = maxBackoff; }
    }

    // ── sizing ────────────────────────────────────────────────────────────────

    public static class Sizing {
        @DecimalMin(value = "0.0", inclusive = false) private double accountValue = 100_000.0;
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false)
        private double riskPct = SizingParameters.DEFAULT_RISK_PCT;
        @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("1.0")
        private double maxPositionPct = SizingParameters.DEFAULT_MAX_POSITION_PCT;

        public double getAccountValue() { return accountValue; }
        public void setAccountValue(double accountValue) { this.accountValue = accountValue; }
        public double getRiskPct() { return riskPct; }
        public void setRiskPct(double riskPct) { this.riskPct = riskPct; }
        public double getMaxPositionPct() { return maxPositionPct; }
        public void setMaxPositionPct(double maxPositionPct) { this.maxPositionPct = maxPositionPct; }

        public SizingParameters toParameters() {
            return SizingParameters.defaults().withRiskPct(riskPct).withMaxPositionPct(maxPositionPct);
        }
    }

    // ── cache ─────────────────────────────────────────────────────────────────

    public static class Cache {
        @NotNull private Duration ttl = Duration.ofMinutes(60);
        @DecimalMin("0.0") private double costPerCall = 0.01;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }
        public double getCostPerCall() { return costPerCall; }
        public void setCostPerCall(double costPerCall) { this.costPerCall = costPerCall; }
    }

    // ── router ────────────────────────────────────────────────────────────────

    public static class Router {
        @NotBlank private String cheapModel     = "claude-haiku-4-5-20251001";
        @NotBlank private String expensiveModel = "claude-sonnet-4-6";
        @DecimalMin("0.0") private double cheapCostPerCall     = 0.002;
        @DecimalMin("0.0") private double expensiveCostPerCall = 0.03;
        @NotNull private ModelTier defaultTier = ModelTier.CHEAP;

        public String getCheapModel() { return cheapModel; }
        public void setCheapModel(String cheapModel) { this.cheapModel = cheapModel; }
        public String getExpensiveModel() { return expensiveModel; }
        public void setExpensiveModel(String expensiveModel) { this.expensiveModel = expensiveModel; }
        public double getCheapCostPerCall() { return cheapCostPerCall; }
        public void setCheapCostPerCall(double cheapCostPerCall) { this.cheapCostPerCall = cheapCostPerCall; }
        public double getExpensiveCostPerCall() { return expensiveCostPerCall; }
        public void setExpensiveCostPerCall(double expensiveCostPerCall) { this.expensiveCostPerCall = expensiveCostPerCall; }
        public ModelTier getDefaultTier() { return defaultTier; }
        public void setDefaultTier(ModelTier defaultTier) { this.defaultTier = defaultTier; }
    }
}
