package com.drawforecast.service.client;

import com.drawforecast.common.model.OutcomeRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of recently resolved draws.
 */
public interface DrawFeed {

    /**
     * Fetches the latest draws in arrival order (oldest first), validated and de-duplicated.
     * Transport failures are absorbed: after the configured retries the result is an empty list.
     */
    Mono<List<OutcomeRecord>> fetchLatest();
}
