package com.drawforecast.service.config;

import com.drawforecast.common.analysis.MarketStateAnalyzer;
import com.drawforecast.common.context.ForecastContext;
import com.drawforecast.common.context.ForecastSettings;
import com.drawforecast.common.ensemble.EnsembleAggregator;
import com.drawforecast.common.resolution.OutcomeResolver;
import com.drawforecast.common.training.ModelTrainer;
import com.drawforecast.service.client.DrawFeed;
import com.drawforecast.service.client.DrawFeedClient;
import com.drawforecast.service.client.DrawFeedUrlBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.concurrent.TimeUnit;

@Configuration
public class ForecastConfig {

    private static final Logger log = LoggerFactory.getLogger(ForecastConfig.class);

    @Value("${forecast.feed.base-url:https://wingo.oss-ap-southeast-7.aliyuncs.com}")
    private String feedBaseUrl;

    @Value("${forecast.feed.zone:UTC}")
    private String feedZone;

    @Value("${forecast.feed.timeout-seconds:15}")
    private int feedTimeoutSeconds;

    @Value("${forecast.feed.retry-attempts:3}")
    private int retryAttempts;

    @Value("${forecast.feed.retry-delay-ms:1000}")
    private long retryDelayMs;

    @Value("${forecast.buffer-capacity:200}")
    private int bufferCapacity;

    @Value("${forecast.recurrent-cell-seed:20241107}")
    private long recurrentCellSeed;

    @Bean
    public Clock forecastClock() {
        return Clock.system(ZoneId.of(feedZone));
    }

    // ── forecasting core ──────────────────────────────────────────────────────

    @Bean
    public ForecastSettings forecastSettings() {
        ForecastSettings defaults = ForecastSettings.defaults();
        return new ForecastSettings(bufferCapacity, defaults.patternLengths(), defaults.markovOrder(),
            defaults.initialWeights(), recurrentCellSeed);
    }

    @Bean
    public ForecastContext forecastContext(ForecastSettings forecastSettings) {
        return new ForecastContext(forecastSettings);
    }

    @Bean
    public MarketStateAnalyzer marketStateAnalyzer(Clock forecastClock) {
        return new MarketStateAnalyzer(forecastClock);
    }

    @Bean
    public ModelTrainer modelTrainer(ForecastContext forecastContext, MarketStateAnalyzer marketStateAnalyzer,
                                     Clock forecastClock) {
        return new ModelTrainer(forecastContext, marketStateAnalyzer, forecastClock);
    }

    @Bean
    public EnsembleAggregator ensembleAggregator(ForecastContext forecastContext) {
        return new EnsembleAggregator(forecastContext);
    }

    @Bean
    public OutcomeResolver outcomeResolver(ForecastContext forecastContext) {
        return new OutcomeResolver(forecastContext);
    }

    /** Single thread on which every ingest → train → predict cycle runs. */
    @Bean(destroyMethod = "dispose")
    public Scheduler forecastCycleScheduler() {
        return Schedulers.newSingle("forecast-cycle");
    }

    // ── draw feed ─────────────────────────────────────────────────────────────

    @Bean
    public WebClient drawFeedWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
            .responseTimeout(Duration.ofSeconds(feedTimeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(feedTimeoutSeconds, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(feedBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .filter(serverErrorFilter())
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public DrawFeedUrlBuilder drawFeedUrlBuilder(Clock forecastClock) {
        return new DrawFeedUrlBuilder(forecastClock);
    }

    @Bean
    public DrawFeed drawFeed(WebClient drawFeedWebClient, ObjectMapper objectMapper,
                             DrawFeedUrlBuilder drawFeedUrlBuilder, Clock forecastClock) {
        return new DrawFeedClient(drawFeedWebClient, objectMapper, drawFeedUrlBuilder, forecastClock,
            retryAttempts, Duration.ofMillis(retryDelayMs));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    private ExchangeFilterFunction serverErrorFilter() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new IllegalStateException("Draw feed server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("Outbound request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }
}
