package com.phillippitts.swarmcouncil.config;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.config.properties.QualityProperties;
import com.phillippitts.swarmcouncil.service.council.SwarmCouncil;
import com.phillippitts.swarmcouncil.service.fallback.DegradationManager;
import com.phillippitts.swarmcouncil.service.health.ProviderHealthTracker;
import com.phillippitts.swarmcouncil.service.metrics.CouncilMetrics;
import com.phillippitts.swarmcouncil.service.provider.BoundedProviderFactory;
import com.phillippitts.swarmcouncil.service.provider.ProviderCatalog;
import com.phillippitts.swarmcouncil.service.provider.ProviderRegistry;
import com.phillippitts.swarmcouncil.service.provider.pool.DefaultProviderPool;
import com.phillippitts.swarmcouncil.service.quality.ContentScoringEngine;
import com.phillippitts.swarmcouncil.service.quality.QualityCouncil;
import com.phillippitts.swarmcouncil.service.quality.SeoStructureParser;
import com.phillippitts.swarmcouncil.service.quality.StructuredMetadataGenerator;
import com.phillippitts.swarmcouncil.service.workflow.WorkflowPipeline;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.util.concurrent.Executor;

/**
 * Wires the shared provider pool and the two councils.
 *
 * <p>Each council gets its own {@link ProviderHealthTracker}; trackers share only the scheduler.
 */
@Configuration
public class CouncilConfig {

    @Bean
    public BoundedProviderFactory boundedProviderFactory(ProviderRegistry registry,
                                                         @Qualifier("councilExecutor") Executor councilExecutor,
                                                         CouncilProperties props) {
        return new BoundedProviderFactory(registry, councilExecutor, props.getConstructionTimeout());
    }

    @Bean
    public DefaultProviderPool providerPool(ProviderCatalog catalog,
                                            BoundedProviderFactory factory,
                                            @Qualifier("councilExecutor") Executor councilExecutor) {
        return new DefaultProviderPool(catalog, factory, councilExecutor);
    }

    @Bean
    public WorkflowPipeline workflowPipeline(@Qualifier("councilExecutor") Executor councilExecutor,
                                             DegradationManager degradationManager,
                                             CouncilMetrics metrics) {
        return new WorkflowPipeline(councilExecutor, degradationManager, metrics);
    }

    @Bean(destroyMethod = "shutdown")
    public SwarmCouncil swarmCouncil(ProviderCatalog catalog,
                                     BoundedProviderFactory factory,
                                     WorkflowPipeline pipeline,
                                     CouncilProperties props,
                                     @Qualifier("healthScheduler") TaskScheduler healthScheduler,
                                     ApplicationEventPublisher publisher,
                                     CouncilMetrics metrics) {
        ProviderHealthTracker tracker = new ProviderHealthTracker(SwarmCouncil.NAME, healthScheduler,
                props.getHealthCheckInterval(), publisher, metrics);
        return new SwarmCouncil(catalog, factory, tracker, pipeline, props);
    }

    @Bean(destroyMethod = "shutdown")
    public QualityCouncil qualityCouncil(ProviderCatalog catalog,
                                         BoundedProviderFactory factory,
                                         WorkflowPipeline pipeline,
                                         CouncilProperties props,
                                         @Qualifier("healthScheduler") TaskScheduler healthScheduler,
                                         ApplicationEventPublisher publisher,
                                         CouncilMetrics metrics,
                                         SeoStructureParser parser,
                                         ContentScoringEngine scoring,
                                         StructuredMetadataGenerator metadata,
                                         QualityProperties quality) {
        ProviderHealthTracker tracker = new ProviderHealthTracker(QualityCouncil.NAME, healthScheduler,
                props.getHealthCheckInterval(), publisher, metrics);
        return new QualityCouncil(catalog, factory, tracker, pipeline, props, parser, scoring, metadata, quality);
    }
}
