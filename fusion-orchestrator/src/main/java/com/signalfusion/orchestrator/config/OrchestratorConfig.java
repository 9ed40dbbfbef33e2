package com.signalfusion.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalfusion.common.consensus.ConsensusEngine;
import com.signalfusion.common.consensus.QuorumPolicy;
import com.signalfusion.common.consensus.WeightedConsensusStrategy;
import com.signalfusion.common.model.SpecialistKind;
import com.signalfusion.common.validation.SynthesisValidator;
import com.signalfusion.orchestrator.ai.AnthropicLanguageModelClient;
import com.signalfusion.orchestrator.ai.LanguageModelClient;
import com.signalfusion.orchestrator.ai.ModelTierRouter;
import com.signalfusion.orchestrator.cache.ResponseCache;
import com.signalfusion.orchestrator.dispatch.SpecialistDispatcher;
import com.signalfusion.orchestrator.enrichment.EnrichmentService;
import com.signalfusion.orchestrator.market.MarketDataClient;
import com.signalfusion.orchestrator.market.RestMarketDataClient;
import com.signalfusion.orchestrator.publisher.RecommendationPublisher;
import com.signalfusion.orchestrator.publisher.RestRecommendationPublisher;
import com.signalfusion.orchestrator.search.SearchClient;
import com.signalfusion.orchestrator.specialist.RemoteSpecialist;
import com.signalfusion.orchestrator.specialist.Specialist;
import com.signalfusion.orchestrator.specialist.SpecialistRegistry;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(FusionProperties.class)
public class OrchestratorConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorConfig.class);

    @Value("${services.specialists.base-url}")
    private String specialistsUrl;

    @Value("${services.market-data.base-url}")
    private String marketDataUrl;

    @Value("${services.search.base-url}")
    private String searchUrl;

    @Value("${services.search.api-key:}")
    private String searchApiKey;

    @Value("${services.document-store.base-url}")
    private String documentStoreUrl;

    @Value("${anthropic.base-url:https://api.anthropic.com}")
    private String anthropicUrl;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.timeout:30s}")
    private Duration anthropicTimeout;

    // ── WebClients ────────────────────────────────────────────────────────────

    @Bean
    public WebClient specialistWebClient(WebClient.Builder builder, FusionProperties properties) {
        // read timeout above the dispatch timeout so the dispatcher decides when a call is absent
        int readSeconds = (int) properties.getDispatch().getTimeout().plusSeconds(5).toSeconds();
        return builder.clone()
            .baseUrl(specialistsUrl)
            .clientConnector(connector(readSeconds))
            .filter(serverErrorFilter("specialist"))
            .build();
    }

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(marketDataUrl)
            .clientConnector(connector(15))
            .filter(serverErrorFilter("market-data"))
            .build();
    }

    @Bean
    public WebClient searchWebClient(WebClient.Builder builder) {
        WebClient.Builder b = builder.clone()
            .baseUrl(searchUrl)
            .clientConnector(connector(20))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(serverErrorFilter("search"));
        if (!searchApiKey.isBlank()) {
            b.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + searchApiKey);
        }
        return b.build();
    }

    @Bean
    public WebClient documentStoreWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(documentStoreUrl)
            .clientConnector(connector(10))
            .build();
    }

    @Bean
    public WebClient anthropicWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(anthropicUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    // ── shared infrastructure ─────────────────────────────────────────────────

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResponseCache responseCache(Clock clock, FusionProperties properties) {
        return new ResponseCache(clock, properties.getCache().getTtl(), properties.getCache().getCostPerCall());
    }

    @Bean
    public ModelTierRouter modelTierRouter(FusionProperties properties) {
        FusionProperties.Router r = properties.getRouter();
        return new ModelTierRouter(r.getCheapModel(), r.getExpensiveModel(),
                                   r.getCheapCostPerCall(), r.getExpensiveCostPerCall());
    }

    @Bean
    public LanguageModelClient languageModelClient(WebClient anthropicWebClient, ObjectMapper objectMapper,
                                                   ModelTierRouter modelTierRouter, FusionProperties properties) {
        if (anthropicApiKey.isBlank()) {
            log.warn("anthropic.api-key not set; narratives fall back to rule-based reasoning");
        }
        return new AnthropicLanguageModelClient(anthropicWebClient, objectMapper, modelTierRouter,
                                                anthropicApiKey, properties.getRouter().getDefaultTier(),
                                                anthropicTimeout);
    }

    // ── fusion pipeline ───────────────────────────────────────────────────────

    @Bean
    public ConsensusEngine consensusEngine(FusionProperties properties) {
        return new WeightedConsensusStrategy(properties.getConsensus().toConsensusWeights());
    }

    @Bean
    public QuorumPolicy quorumPolicy(FusionProperties properties) {
        return new QuorumPolicy(properties.getQuorum().getMinSpecialists());
    }

    @Bean
    public SynthesisValidator synthesisValidator() {
        return new SynthesisValidator();
    }

    @Bean
    public SpecialistRegistry specialistRegistry(WebClient specialistWebClient, ObjectMapper objectMapper) {
        List<Specialist> specialists = new ArrayList<>();
        for (SpecialistKind kind : SpecialistKind.values()) {
            specialists.add(new RemoteSpecialist(kind, specialistWebClient, objectMapper));
        }
        return new SpecialistRegistry(specialists);
    }

    @Bean
    public SpecialistDispatcher specialistDispatcher(SpecialistRegistry specialistRegistry, FusionProperties properties) {
        FusionProperties.Dispatch d = properties.getDispatch();
        return new SpecialistDispatcher(specialistRegistry, d.getTimeout(), d.getMaxRetries(),
                                        d.getInitialBackoff(), d.getMaxBackoff());
    }

    @Bean
    public MarketDataClient marketDataClient(WebClient marketDataWebClient) {
        return new RestMarketDataClient(marketDataWebClient);
    }

    @Bean
    public SearchClient searchClient(WebClient searchWebClient, ResponseCache responseCache) {
        return new SearchClient(searchWebClient, responseCache);
    }

    @Bean
    public EnrichmentService enrichmentService(SearchClient searchClient) {
        return new EnrichmentService(searchClient);
    }

    @Bean
    public RecommendationPublisher recommendationPublisher(WebClient documentStoreWebClient) {
        return new RestRecommendationPublisher(documentStoreWebClient);
    }

    private static ReactorClientHttpConnector connector(int readTimeoutSeconds) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(readTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeoutSeconds, TimeUnit.SECONDS))
            );
        return new ReactorClientHttpConnector(httpClient);
    }

    private static ExchangeFilterFunction serverErrorFilter(String service) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException(
                    service + " server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }
}
