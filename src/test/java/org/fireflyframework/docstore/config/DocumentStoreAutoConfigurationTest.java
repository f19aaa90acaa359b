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

import org.fireflyframework.docstore.command.ArtifactView;
import org.fireflyframework.docstore.command.CommandResult;
import org.fireflyframework.docstore.command.DocumentCommandService;
import org.fireflyframework.docstore.dispatch.DispatchRules;
import org.fireflyframework.docstore.dispatch.IdempotencyKeys;
import org.fireflyframework.docstore.dispatch.InMemoryWorkflowEngineClient;
import org.fireflyframework.docstore.dispatch.WorkflowDispatchGateway;
import org.fireflyframework.docstore.domain.model.ArtifactType;
import org.fireflyframework.docstore.eventsourcing.store.EventStore;
import org.fireflyframework.docstore.eventsourcing.store.InMemoryEventStore;
import org.fireflyframework.docstore.health.SubscriptionHealthIndicator;
import org.fireflyframework.docstore.projection.DocumentQueryService;
import org.fireflyframework.docstore.properties.DocumentStoreProperties;
import org.fireflyframework.docstore.subscription.CheckpointStore;
import org.fireflyframework.docstore.subscription.ConsumerState;
import org.fireflyframework.docstore.subscription.InMemoryCheckpointStore;
import org.fireflyframework.docstore.subscription.R2dbcCheckpointStore;
import org.fireflyframework.docstore.subscription.SubscriptionConsumer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Tests for {@link DocumentStoreAutoConfiguration} wiring and an end-to-end pass
 * from command to read model and workflow start.
 */
class DocumentStoreAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DocumentStoreAutoConfiguration.class))
            .withPropertyValues("firefly.docstore.subscription.auto-start=false");

    @Test
    @DisplayName("should create the default in-memory beans")
    void shouldCreateDefaultBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(EventStore.class);
            assertThat(context.getBean(EventStore.class)).isInstanceOf(InMemoryEventStore.class);
            assertThat(context.getBean(CheckpointStore.class)).isInstanceOf(InMemoryCheckpointStore.class);
            assertThat(context).hasSingleBean(DocumentCommandService.class);
            assertThat(context).hasSingleBean(DocumentQueryService.class);
            assertThat(context).hasSingleBean(WorkflowDispatchGateway.class);
            assertThat(context).hasSingleBean(SubscriptionHealthIndicator.class);
            assertThat(context).getBeans(SubscriptionConsumer.class).hasSize(2);
            assertThat(context.getBean("readModelConsumer", SubscriptionConsumer.class).getState())
                    .isEqualTo(ConsumerState.CREATED);
        });
    }

    @Test
    @DisplayName("should bind subscription and dispatch properties")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues(
                        "firefly.docstore.subscription.batch-size=25",
                        "firefly.docstore.subscription.poll-interval=2s",
                        "firefly.docstore.dispatch.max-attempts=5",
                        "firefly.docstore.cascade.child-retry-attempts=1")
                .run(context -> {
                    DocumentStoreProperties properties = context.getBean(DocumentStoreProperties.class);
                    assertThat(properties.getSubscription().getBatchSize()).isEqualTo(25);
                    assertThat(properties.getSubscription().getPollInterval()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(properties.getDispatch().getMaxAttempts()).isEqualTo(5);
                    assertThat(properties.getCascade().getChildRetryAttempts()).isEqualTo(1);
                });
    }

    @Test
    @DisplayName("should skip dispatch beans when dispatch is disabled")
    void shouldSkipDispatchWhenDisabled() {
        contextRunner
                .withPropertyValues("firefly.docstore.dispatch.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(WorkflowDispatchGateway.class);
                    assertThat(context).doesNotHaveBean("dispatchConsumer");
                    assertThat(context).hasBean("readModelConsumer");
                });
    }

    @Test
    @DisplayName("should back off entirely when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("firefly.docstore.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(EventStore.class));
    }

    @Test
    @DisplayName("should use the R2DBC checkpoint store when configured")
    void shouldUseR2dbcCheckpointStore() {
        contextRunner
                .withBean(DatabaseClient.class, () -> mock(DatabaseClient.class))
                .withPropertyValues("firefly.docstore.checkpoint.store=r2dbc")
                .run(context -> assertThat(context.getBean(CheckpointStore.class))
                        .isInstanceOf(R2dbcCheckpointStore.class));
    }

    @Test
    @DisplayName("should project and dispatch a created artifact")
    @SuppressWarnings("unchecked")
    void shouldProjectAndDispatchCreatedArtifact() {
        contextRunner.run(context -> {
            DocumentCommandService commands = context.getBean(DocumentCommandService.class);
            CommandResult<ArtifactView> created = commands.createArtifact("file:///report.pdf", "report.pdf",
                    ArtifactType.REPORT, "application/pdf", "s3://docstore/report.pdf").block();
            ArtifactView artifact = ((CommandResult.Success<ArtifactView>) created).value();

            context.getBean("readModelConsumer", SubscriptionConsumer.class).pollOnce().block();
            context.getBean("dispatchConsumer", SubscriptionConsumer.class).pollOnce().block();

            DocumentQueryService queries = context.getBean(DocumentQueryService.class);
            assertThat(queries.findArtifact(artifact.id()).block().getStorageLocation())
                    .isEqualTo("s3://docstore/report.pdf");
            InMemoryWorkflowEngineClient engine = context.getBean(InMemoryWorkflowEngineClient.class);
            assertThat(engine.isStarted(IdempotencyKeys.of(DispatchRules.ARTIFACT_SAMPLE, artifact.id()))).isTrue();
            CheckpointStore checkpoints = context.getBean(CheckpointStore.class);
            assertThat(checkpoints.loadPosition("read-model-projector").block()).isEqualTo(1L);
            assertThat(checkpoints.loadPosition("workflow-dispatcher").block()).isEqualTo(1L);
        });
    }
}
