/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.fireflyframework.docstore.config;

import org.fireflyframework.docstore.command.DocumentCommandService;
import org.fireflyframework.docstore.dispatch.DispatchResilience;
import org.fireflyframework.docstore.dispatch.DispatchRules;
import org.fireflyframework.docstore.dispatch.InMemoryWorkflowEngineClient;
import org.fireflyframework.docstore.dispatch.WorkflowDispatchGateway;
import org.fireflyframework.docstore.dispatch.WorkflowEngineClient;
import org.fireflyframework.docstore.domain.DocumentEventTypes;
import org.fireflyframework.docstore.domain.artifact.ArtifactRepository;
import org.fireflyframework.docstore.domain.page.PageRepository;
import org.fireflyframework.docstore.domain.service.ArtifactDeletionService;
import org.fireflyframework.docstore.eventsourcing.store.EventCodec;
import org.fireflyframework.docstore.eventsourcing.store.EventStore;
import org.fireflyframework.docstore.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.docstore.health.SubscriptionHealthIndicator;
import org.fireflyframework.docstore.metrics.DocumentStoreMetrics;
import org.fireflyframework.docstore.projection.ArtifactProjection;
import org.fireflyframework.docstore.projection.ArtifactReadModel;
import org.fireflyframework.docstore.projection.DocumentQueryService;
import org.fireflyframework.docstore.projection.InMemoryReadModelStore;
import org.fireflyframework.docstore.projection.PageProjection;
import org.fireflyframework.docstore.projection.PageReadModel;
import org.fireflyframework.docstore.projection.ProjectionEngine;
import org.fireflyframework.docstore.projection.ReadModelStore;
import org.fireflyframework.docstore.properties.DocumentStoreProperties;
import org.fireflyframework.docstore.subscription.CheckpointStore;
import org.fireflyframework.docstore.subscription.EventHandler;
import org.fireflyframework.docstore.subscription.InMemoryCheckpointStore;
import org.fireflyframework.docstore.subscription.R2dbcCheckpointStore;
import org.fireflyframework.docstore.subscription.SubscriptionConsumer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Clock;
import java.util.List;

/**
 * Auto-configuration for the Firefly Document Store.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>EventStore - in-memory event log with the JSON event codec</li>
 *   <li>ArtifactRepository / PageRepository - event-sourced aggregate repositories</li>
 *   <li>ArtifactDeletionService - cascading artifact deletion</li>
 *   <li>DocumentCommandService - the command entry point</li>
 *   <li>ProjectionEngine and DocumentQueryService - read models and their queries</li>
 *   <li>WorkflowDispatchGateway - workflow triggers with idempotency keys</li>
 *   <li>Two SubscriptionConsumers, one per consumer group, started on creation</li>
 *   <li>SubscriptionHealthIndicator - reports halted consumer groups</li>
 * </ul>
 * Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(DocumentStoreProperties.class)
@ConditionalOnProperty(prefix = "firefly.docstore", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DocumentStoreAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock documentStoreClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentStoreMetrics documentStoreMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new DocumentStoreMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    // ==================== Event Log ====================

    @Bean
    @ConditionalOnMissingBean
    public EventCodec eventCodec(ObjectProvider<ObjectMapper> objectMapper) {
        EventCodec codec = new EventCodec(objectMapper.getIfAvailable(ObjectMapper::new), DocumentEventTypes.all());
        log.info("Creating EventCodec with {} event types", codec.getRegisteredTypes().size());
        return codec;
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(EventCodec eventCodec) {
        log.info("Creating InMemoryEventStore");
        return new InMemoryEventStore(eventCodec);
    }

    // ==================== Command Side ====================

    @Bean
    @ConditionalOnMissingBean
    public ArtifactRepository artifactRepository(EventStore eventStore, Clock clock, DocumentStoreMetrics metrics) {
        return new ArtifactRepository(eventStore, clock, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public PageRepository pageRepository(EventStore eventStore, Clock clock, DocumentStoreMetrics metrics) {
        return new PageRepository(eventStore, clock, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public ArtifactDeletionService artifactDeletionService(ArtifactRepository artifactRepository,
                                                           PageRepository pageRepository,
                                                           DocumentStoreProperties properties) {
        log.info("Creating ArtifactDeletionService with childRetryAttempts={}",
                properties.getCascade().getChildRetryAttempts());
        return new ArtifactDeletionService(artifactRepository, pageRepository,
                properties.getCascade().getChildRetryAttempts());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentCommandService documentCommandService(ArtifactRepository artifactRepository,
                                                         PageRepository pageRepository,
                                                         ArtifactDeletionService deletionService,
                                                         Clock clock) {
        return new DocumentCommandService(artifactRepository, pageRepository, deletionService, clock);
    }

    // ==================== Read Side ====================

    @Bean
    @ConditionalOnMissingBean(name = "artifactReadModelStore")
    public ReadModelStore<ArtifactReadModel> artifactReadModelStore() {
        return new InMemoryReadModelStore<>();
    }

    @Bean
    @ConditionalOnMissingBean(name = "pageReadModelStore")
    public ReadModelStore<PageReadModel> pageReadModelStore() {
        return new InMemoryReadModelStore<>();
    }

    @Bean
    @ConditionalOnMissingBean
    public ProjectionEngine projectionEngine(ReadModelStore<ArtifactReadModel> artifactReadModelStore,
                                             ReadModelStore<PageReadModel> pageReadModelStore,
                                             DocumentStoreMetrics metrics) {
        return new ProjectionEngine(List.of(
                new ArtifactProjection(artifactReadModelStore, metrics),
                new PageProjection(pageReadModelStore, metrics)));
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentQueryService documentQueryService(ReadModelStore<ArtifactReadModel> artifactReadModelStore,
                                                     ReadModelStore<PageReadModel> pageReadModelStore) {
        return new DocumentQueryService(artifactReadModelStore, pageReadModelStore);
    }

    // ==================== Dispatch ====================

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEngineClient workflowEngineClient() {
        log.warn("No WorkflowEngineClient bean defined, workflow starts are only recorded in memory");
        return new InMemoryWorkflowEngineClient();
    }

    @Bean
    @ConditionalOnMissingBean
    public DispatchResilience dispatchResilience(DocumentStoreProperties properties, DocumentStoreMetrics metrics) {
        return new DispatchResilience(properties.getDispatch(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.docstore.dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WorkflowDispatchGateway workflowDispatchGateway(WorkflowEngineClient workflowEngineClient,
                                                           DispatchResilience dispatchResilience,
                                                           DocumentStoreMetrics metrics) {
        log.info("Creating WorkflowDispatchGateway with default pipeline rules");
        return new WorkflowDispatchGateway(workflowEngineClient, DispatchRules.defaults(), dispatchResilience, metrics);
    }

    // ==================== Subscriptions ====================

    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    @ConditionalOnProperty(prefix = "firefly.docstore.checkpoint", name = "store", havingValue = "memory", matchIfMissing = true)
    public CheckpointStore inMemoryCheckpointStore() {
        log.info("Creating InMemoryCheckpointStore, consumer positions will not survive a restart");
        return new InMemoryCheckpointStore();
    }

    @Bean
    @ConditionalOnMissingBean(name = "readModelConsumer")
    public SubscriptionConsumer readModelConsumer(EventStore eventStore,
                                                  CheckpointStore checkpointStore,
                                                  ProjectionEngine projectionEngine,
                                                  DocumentStoreProperties properties,
                                                  DocumentStoreMetrics metrics) {
        var config = properties.getSubscription();
        return startIfConfigured(new SubscriptionConsumer(
                config.getReadModelGroup(),
                eventStore,
                checkpointStore,
                List.<EventHandler>of(projectionEngine),
                config.getPollInterval(),
                config.getBatchSize(),
                config.getShutdownTimeout(),
                metrics), config);
    }

    @Bean
    @ConditionalOnMissingBean(name = "dispatchConsumer")
    @ConditionalOnProperty(prefix = "firefly.docstore.dispatch", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SubscriptionConsumer dispatchConsumer(EventStore eventStore,
                                                 CheckpointStore checkpointStore,
                                                 WorkflowDispatchGateway workflowDispatchGateway,
                                                 DocumentStoreProperties properties,
                                                 DocumentStoreMetrics metrics) {
        var config = properties.getSubscription();
        return startIfConfigured(new SubscriptionConsumer(
                config.getDispatchGroup(),
                eventStore,
                checkpointStore,
                List.<EventHandler>of(workflowDispatchGateway),
                config.getPollInterval(),
                config.getBatchSize(),
                config.getShutdownTimeout(),
                metrics), config);
    }

    private static SubscriptionConsumer startIfConfigured(SubscriptionConsumer consumer,
                                                          DocumentStoreProperties.SubscriptionConfig config) {
        if (config.isAutoStart()) {
            consumer.start();
            log.info("Created and started SubscriptionConsumer for group {}", consumer.getConsumerGroup());
        } else {
            log.info("Created SubscriptionConsumer for group {} (auto-start disabled)", consumer.getConsumerGroup());
        }
        return consumer;
    }

    /**
     * Durable consumer positions on R2DBC.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(DatabaseClient.class)
    @ConditionalOnProperty(prefix = "firefly.docstore.checkpoint", name = "store", havingValue = "r2dbc")
    static class R2dbcCheckpointConfiguration {

        @Bean
        @ConditionalOnMissingBean(CheckpointStore.class)
        @ConditionalOnBean(DatabaseClient.class)
        public CheckpointStore r2dbcCheckpointStore(DatabaseClient databaseClient, Clock clock) {
            log.info("Creating R2dbcCheckpointStore on table consumer_positions");
            return new R2dbcCheckpointStore(databaseClient, clock);
        }
    }

    /**
     * Health reporting for the subscription consumers.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(ReactiveHealthIndicator.class)
    static class SubscriptionHealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public SubscriptionHealthIndicator subscriptionHealthIndicator(ObjectProvider<SubscriptionConsumer> consumers,
                                                                       EventStore eventStore,
                                                                       CheckpointStore checkpointStore) {
            return new SubscriptionHealthIndicator(consumers.orderedStream().toList(), eventStore, checkpointStore);
        }
    }
}
