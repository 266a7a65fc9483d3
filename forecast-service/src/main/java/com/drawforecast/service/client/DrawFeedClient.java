package com.drawforecast.service.client;

import com.drawforecast.common.exception.ForecastException;
import com.drawforecast.common.model.OutcomeRecord;
import com.drawforecast.common.period.PeriodSequence;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * WebClient-backed {@link DrawFeed}.
 *
 * <p>Each attempt rebuilds the document path for the current minute. Failed attempts are
 * retried {@code retryAttempts} times with a linearly growing delay (1×, 2×, 3× the base
 * delay); once exhausted the failure is logged and an empty list is returned so the caller's
 * cycle keeps running on the buffered data.
 *
 * <p>The response is a JSON array of {@code {"issueNumber": ..., "content": {"number": ...}}}
 * entries. Entries without an issue number, with a missing or non-numeric outcome, with an
 * outcome outside 0-9, or repeating an issue number are dropped.
 */
public class DrawFeedClient implements DrawFeed {

    private static final Logger log = LoggerFactory.getLogger(DrawFeedClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final DrawFeedUrlBuilder urlBuilder;
    private final Clock clock;
    private final int retryAttempts;
    private final Duration retryDelay;

    public DrawFeedClient(WebClient drawFeedWebClient, ObjectMapper objectMapper, DrawFeedUrlBuilder urlBuilder,
                          Clock clock, int retryAttempts, Duration retryDelay) {
        this.webClient     = drawFeedWebClient;
        this.objectMapper  = objectMapper;
        this.urlBuilder    = urlBuilder;
        this.clock         = clock;
        this.retryAttempts = retryAttempts;
        this.retryDelay    = retryDelay;
    }

    @Override
    public Mono<List<OutcomeRecord>> fetchLatest() {
        return Mono.defer(() -> {
                String path = urlBuilder.currentPath();
                log.info("Fetching draw history. path={}", path);
                return webClient.get()
                    .uri(path)
                    .retrieve()
                    .bodyToMono(String.class);
            })
            .switchIfEmpty(Mono.error(() -> new ForecastException("feed", "Empty draw feed response")))
            .map(this::parseDraws)
            .retryWhen(linearBackoff())
            .doOnNext(draws -> log.info("Draw history fetched. validRecords={}", draws.size()))
            .onErrorResume(e -> {
                log.error("Draw feed unavailable after retries. attempts={}", retryAttempts, e);
                return Mono.just(List.of());
            });
    }

    /**
     * Parses and validates one feed document.
     *
     * @return valid records sorted by period, oldest first
     * @throws ForecastException when the document is not a JSON array
     */
    List<OutcomeRecord> parseDraws(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ForecastException("feed", "Unparseable draw feed response", e);
        }
        if (root == null || !root.isArray()) {
            throw new ForecastException("feed", "Invalid draw feed response format");
        }

        Instant observedAt = clock.instant();
        Set<String> seen = new HashSet<>();
        List<OutcomeRecord> records = new ArrayList<>();
        int dropped = 0;
        for (JsonNode item : root) {
            String issueNumber = item.path("issueNumber").asText("");
            Integer digit = parseDigit(item.path("content").path("number"));
            if (issueNumber.isBlank() || digit == null || !seen.add(issueNumber)) {
                dropped++;
                continue;
            }
            records.add(OutcomeRecord.of(issueNumber, digit, observedAt));
        }
        if (dropped > 0) {
            log.debug("Dropped invalid draw entries. count={}", dropped);
        }
        records.sort(Comparator.comparing(OutcomeRecord::periodId, PeriodSequence::compare));
        return records;
    }

    private static Integer parseDigit(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        int value;
        if (node.isIntegralNumber()) {
            value = node.asInt();
        } else {
            try {
                value = Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return value >= 0 && value <= 9 ? value : null;
    }

    private Retry linearBackoff() {
        return Retry.from(signals -> signals.concatMap(signal -> {
            long attempt = signal.totalRetries() + 1;
            if (attempt > retryAttempts) {
                return Mono.error(signal.failure());
            }
            log.warn("Draw feed attempt failed, retrying. attempt={} delayMs={} reason={}",
                     attempt, retryDelay.multipliedBy(attempt).toMillis(), signal.failure().getMessage());
            return Mono.delay(retryDelay.multipliedBy(attempt));
        }));
    }
}
