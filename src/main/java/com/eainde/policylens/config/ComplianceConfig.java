package com.eainde.policylens.config;

import com.eainde.policylens.chunk.PolicyChunker;
import com.eainde.policylens.engine.CaseMemoryRebuilder;
import com.eainde.policylens.engine.FallbackRiskEvaluator;
import com.eainde.policylens.engine.PolicyQueryService;
import com.eainde.policylens.engine.TransactionEvaluationEngine;
import com.eainde.policylens.extraction.DocumentExtractor;
import com.eainde.policylens.gateway.EmbeddingGateway;
import com.eainde.policylens.gateway.EmbeddingStoreRetrievalGateway;
import com.eainde.policylens.gateway.ReasoningGateway;
import com.eainde.policylens.metrics.ComplianceMetrics;
import com.eainde.policylens.metrics.MicrometerComplianceMetrics;
import com.eainde.policylens.policy.PolicyService;
import com.eainde.policylens.reevaluation.BatchReevaluator;
import com.eainde.policylens.risk.CompositeRiskScorer;
import com.eainde.policylens.sentinel.PolicySentinel;
import com.eainde.policylens.store.AuditRecordStore;
import com.eainde.policylens.store.DecisionStore;
import com.eainde.policylens.store.PolicyDocumentStore;
import com.eainde.policylens.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core components: chunker, engine, scorer, sentinel, re-evaluator and policy lifecycle.
 */
@Configuration
@EnableConfigurationProperties(PolicyLensProperties.class)
public class ComplianceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public ComplianceMetrics complianceMetrics(MeterRegistry meterRegistry) {
        return new MicrometerComplianceMetrics(meterRegistry);
    }

    @Bean
    public PolicyChunker policyChunker(PolicyLensProperties properties) {
        PolicyLensProperties.Chunking chunking = properties.getChunking();
        return PolicyChunker.builder()
                .chunkSize(chunking.getSize())
                .overlap(chunking.getOverlap())
                .minChunkChars(chunking.getMinChars())
                .build();
    }

    @Bean
    public FallbackRiskEvaluator fallbackRiskEvaluator(PolicyLensProperties properties) {
        return new FallbackRiskEvaluator(properties.getEvaluation());
    }

    @Bean
    public TransactionEvaluationEngine transactionEvaluationEngine(EmbeddingGateway embeddingGateway,
                                                                   EmbeddingStoreRetrievalGateway retrievalGateway,
                                                                   ReasoningGateway reasoningGateway,
                                                                   FallbackRiskEvaluator fallbackRiskEvaluator,
                                                                   DecisionStore decisionStore,
                                                                   ObjectMapper objectMapper,
                                                                   ComplianceMetrics metrics,
                                                                   PolicyLensProperties properties,
                                                                   Clock clock) {
        return new TransactionEvaluationEngine(embeddingGateway, retrievalGateway, retrievalGateway,
                reasoningGateway, fallbackRiskEvaluator, decisionStore, objectMapper, metrics,
                properties.getEvaluation(), clock);
    }

    @Bean
    public PolicyQueryService policyQueryService(EmbeddingGateway embeddingGateway,
                                                 EmbeddingStoreRetrievalGateway retrievalGateway,
                                                 ReasoningGateway reasoningGateway,
                                                 PolicyLensProperties properties) {
        return new PolicyQueryService(embeddingGateway, retrievalGateway, reasoningGateway,
                properties.getEvaluation());
    }

    @Bean
    public CompositeRiskScorer compositeRiskScorer(PolicyLensProperties properties,
                                                   FallbackRiskEvaluator fallbackRiskEvaluator,
                                                   EmbeddingGateway embeddingGateway,
                                                   EmbeddingStoreRetrievalGateway retrievalGateway) {
        return new CompositeRiskScorer(properties.getRisk(), fallbackRiskEvaluator.highRiskCountries(),
                embeddingGateway, retrievalGateway);
    }

    @Bean
    public PolicySentinel policySentinel(AuditRecordStore auditRecordStore,
                                         DecisionStore decisionStore,
                                         ComplianceMetrics metrics,
                                         PolicyLensProperties properties,
                                         Clock clock) {
        return new PolicySentinel(auditRecordStore, decisionStore, metrics, properties.getSentinel(), clock);
    }

    @Bean
    public BatchReevaluator batchReevaluator(TransactionEvaluationEngine engine,
                                             DecisionStore decisionStore,
                                             AuditRecordStore auditRecordStore,
                                             PolicySentinel sentinel,
                                             ObjectMapper objectMapper,
                                             @Qualifier("reevaluationWorkers") MdcAwareExecutor workers,
                                             @Qualifier("reevaluationJobs") MdcAwareExecutor jobs,
                                             ComplianceMetrics metrics,
                                             PolicyLensProperties properties,
                                             Clock clock) {
        return new BatchReevaluator(engine, decisionStore, auditRecordStore, sentinel, objectMapper,
                workers, jobs, metrics, properties.getBatch(), clock);
    }

    @Bean
    public PolicyService policyService(PolicyDocumentStore policyDocumentStore,
                                       PolicyChunker policyChunker,
                                       EmbeddingGateway embeddingGateway,
                                       EmbeddingStoreRetrievalGateway retrievalGateway,
                                       PolicySentinel sentinel,
                                       DocumentExtractor documentExtractor,
                                       Clock clock) {
        return new PolicyService(policyDocumentStore, policyChunker, embeddingGateway, retrievalGateway,
                sentinel, documentExtractor, clock);
    }

    @Bean
    public CaseMemoryRebuilder caseMemoryRebuilder(DecisionStore decisionStore,
                                                   EmbeddingGateway embeddingGateway,
                                                   EmbeddingStoreRetrievalGateway retrievalGateway,
                                                   ObjectMapper objectMapper,
                                                   PolicyLensProperties properties) {
        return new CaseMemoryRebuilder(decisionStore, embeddingGateway, retrievalGateway, objectMapper,
                properties.getBatch().getPageSize());
    }

    /**
     * The vector index is in memory; rebuild it from the stored chunks on startup.
     */
    @Bean
    public ApplicationRunner policyIndexInitializer(PolicyService policyService) {
        return args -> policyService.reindexActive();
    }

    /**
     * Same for the case memory, from the stored decisions.
     */
    @Bean
    public ApplicationRunner caseMemoryInitializer(CaseMemoryRebuilder caseMemoryRebuilder) {
        return args -> caseMemoryRebuilder.rebuild();
    }
}
