package com.ragward.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ragward.cache.ResponseCacheStore;
import com.ragward.provider.AbstractWebClientProvider;
import com.ragward.resilience.RetryController;
import com.ragward.resilience.TimeoutSupervisor;
import com.ragward.service.ContextRetriever;
import com.ragward.service.InFlightTable;
import com.ragward.service.PromptingQueryExecutor;
import com.ragward.service.QueryDispatcher;
import com.ragward.service.QueryExecutor;
import com.ragward.service.embedding.EmbeddingService;
import com.ragward.service.fingerprint.RequestFingerprinter;
import com.ragward.service.selection.ModeSelector;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Wires the mediation pipeline: selector, retry, timeout, single-flight and dispatch.
 */
@Configuration
public class MediationConfiguration {

    @Bean
    public Clock mediationClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "")
    public Scheduler mediationScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    public ModeSelector modeSelector(RagwardProperties properties) {
        return new ModeSelector(properties.getSelector());
    }

    @Bean
    public RetryController retryController(Clock mediationClock, Scheduler mediationScheduler) {
        return new RetryController(mediationClock, mediationScheduler);
    }

    @Bean
    public TimeoutSupervisor timeoutSupervisor(Scheduler mediationScheduler) {
        return new TimeoutSupervisor(mediationScheduler);
    }

    @Bean
    public InFlightTable inFlightTable() {
        return new InFlightTable();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContextRetriever contextRetriever() {
        return ContextRetriever.none();
    }

    @Bean
    public QueryExecutor queryExecutor(AbstractWebClientProvider provider, ContextRetriever contextRetriever) {
        return new PromptingQueryExecutor(provider, contextRetriever);
    }

    @Bean
    public QueryDispatcher queryDispatcher(
            ModeSelector modeSelector,
            RequestFingerprinter fingerprinter,
            ResponseCacheStore responseCacheStore,
            InFlightTable inFlightTable,
            QueryExecutor queryExecutor,
            RetryController retryController,
            TimeoutSupervisor timeoutSupervisor,
            RagwardProperties properties,
            Clock mediationClock) {
        return new QueryDispatcher(modeSelector, fingerprinter, responseCacheStore, inFlightTable,
                queryExecutor, retryController, timeoutSupervisor, properties, mediationClock);
    }

    @Bean
    public EmbeddingService embeddingService(
            AbstractWebClientProvider provider,
            RequestFingerprinter fingerprinter,
            ResponseCacheStore responseCacheStore,
            RetryController retryController,
            TimeoutSupervisor timeoutSupervisor,
            ObjectMapper objectMapper,
            RagwardProperties properties,
            Clock mediationClock) {
        return new EmbeddingService(provider, fingerprinter, responseCacheStore, retryController,
                timeoutSupervisor, objectMapper, properties, mediationClock);
    }
}
