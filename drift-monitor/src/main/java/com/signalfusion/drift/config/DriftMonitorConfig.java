package com.signalfusion.drift.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.signalfusion.drift.alert.AlertSink;
import com.signalfusion.drift.alert.SlackAlertSink;
import com.signalfusion.drift.calculator.DriftCalculator;
import com.signalfusion.drift.market.MarketSnapshotClient;
import com.signalfusion.drift.market.MarketSnapshotProvider;
import com.signalfusion.drift.monitor.DriftMonitor;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
@EnableConfigurationProperties(DriftProperties.class)
public class DriftMonitorConfig {

    private static final Logger log = LoggerFactory.getLogger(DriftMonitorConfig.class);

    @Value("${services.market-data.base-url}")
    private String marketDataUrl;

    @Value("${notification.slack.webhook-url:}")
    private String slackWebhookUrl;

    @Value("${notification.slack.enabled:false}")
    private boolean slackEnabled;

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(15))
            .doOnConnected(conn -> conn.addHandlerLast(new ReadTimeoutHandler(15, TimeUnit.SECONDS)));
        return builder.clone()
            .baseUrl(marketDataUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(ExchangeFilterFunction.ofResponseProcessor(response -> {
                if (response.statusCode().is5xxServerError()) {
                    return Mono.error(new IllegalStateException(
                        "market-data server error: " + response.statusCode()));
                }
                return Mono.just(response);
            }))
            .build();
    }

    @Bean
    public WebClient slackWebClient(WebClient.Builder builder) {
        return builder.clone().build();
    }

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
    public DriftCalculator driftCalculator(DriftProperties properties) {
        return new DriftCalculator(properties.getThresholds().toDriftThresholds());
    }

    @Bean
    public MarketSnapshotProvider marketSnapshotProvider(WebClient marketDataWebClient, Clock clock) {
        return new MarketSnapshotClient(marketDataWebClient, clock);
    }

    @Bean
    public AlertSink alertSink(WebClient slackWebClient) {
        SlackAlertSink sink = new SlackAlertSink(slackWebClient, slackWebhookUrl, slackEnabled);
        if (!sink.isActive()) {
            log.info("Slack disabled or no webhook URL configured; drift alerts are logged only");
        }
        return sink;
    }

    @Bean
    public DriftMonitor driftMonitor(DriftCalculator driftCalculator, MarketSnapshotProvider marketSnapshotProvider,
                                     AlertSink alertSink, DriftProperties properties, Clock clock) {
        return new DriftMonitor(driftCalculator, marketSnapshotProvider, alertSink, properties, clock,
                                Schedulers.parallel());
    }
}
