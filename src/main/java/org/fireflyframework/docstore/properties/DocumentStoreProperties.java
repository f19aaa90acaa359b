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

package org.fireflyframework.docstore.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the document store library.
 */
@ConfigurationProperties(prefix = "firefly.docstore")
@Validated
@Data
public class DocumentStoreProperties {

    /**
     * Whether the document store is enabled.
     */
    private boolean enabled = true;

    /**
     * Subscription consumer configuration.
     */
    @Valid
    @NotNull
    private SubscriptionConfig subscription = new SubscriptionConfig();

    /**
     * Workflow dispatch configuration.
     */
    @Valid
    @NotNull
    private DispatchConfig dispatch = new DispatchConfig();

    /**
     * Cascading deletion configuration.
     */
    @Valid
    @NotNull
    private CascadeConfig cascade = new CascadeConfig();

    /**
     * Consumer position persistence configuration.
     */
    @Valid
    @NotNull
    private CheckpointConfig checkpoint = new CheckpointConfig();

    /**
     * Subscription consumer configuration.
     */
    @Data
    public static class SubscriptionConfig {

        /**
         * Whether consumers start polling when the application starts.
         */
        private boolean autoStart = true;

        /**
         * Delay between two polls of the event store.
         */
        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);

        /**
         * Maximum number of events read per poll.
         */
        @Min(1)
        private int batchSize = 100;

        /**
         * How long a graceful stop may wait for the in-flight event.
         */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        /**
         * Consumer group that maintains the read models.
         */
        @NotBlank
        private String readModelGroup = "read-model-projector";

        /**
         * Consumer group that triggers workflows.
         */
        @NotBlank
        private String dispatchGroup = "workflow-dispatcher";
    }

    /**
     * Workflow dispatch configuration.
     */
    @Data
    public static class DispatchConfig {

        /**
         * Whether events trigger workflows at all.
         */
        private boolean enabled = true;

        /**
         * Total number of start attempts, including the first one.
         */
        @Min(1)
        private int maxAttempts = 3;

        /**
         * Wait before the first retry.
         */
        @NotNull
        private Duration initialBackoff = Duration.ofMillis(200);

        /**
         * Factor applied to the wait after every retry.
         */
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        /**
         * Timeout of a single start call.
         */
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(10);

        /**
         * Circuit breaker around the workflow engine.
         */
        @Valid
        @NotNull
        private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();
    }

    /**
     * Circuit breaker configuration.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Whether the circuit breaker is enabled.
         */
        private boolean enabled = false;

        /**
         * Failure rate threshold percentage (1-100) to open the circuit.
         */
        @Min(1)
        @Max(100)
        private int failureRateThreshold = 50;

        /**
         * Number of calls in the sliding window.
         */
        @Min(1)
        private int slidingWindowSize = 20;

        /**
         * Minimum number of calls before the failure rate is evaluated.
         */
        @Min(1)
        private int minimumNumberOfCalls = 10;

        /**
         * How long the circuit stays open before letting trial calls through.
         */
        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    /**
     * Cascading deletion configuration.
     */
    @Data
    public static class CascadeConfig {

        /**
         * Number of reload-and-retry attempts after a concurrency conflict on a page.
         */
        @Min(0)
        private int childRetryAttempts = 3;
    }

    /**
     * Consumer position persistence configuration.
     */
    @Data
    public static class CheckpointConfig {

        /**
         * Where consumer positions are stored.
         */
        @NotNull
        private CheckpointStoreType store = CheckpointStoreType.MEMORY;
    }

    /**
     * Supported consumer position stores.
     */
    public enum CheckpointStoreType {
        MEMORY,
        R2DBC
    }
}
