/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mind.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the memory engine, bound from the
 * {@code mind.*} namespace.
 */
@Component
@ConfigurationProperties(prefix = "mind")
@Data
public class MindProperties {

    private StorageProperties storage = new StorageProperties();
    private SessionProperties session = new SessionProperties();
    private ExtractionProperties extraction = new ExtractionProperties();
    private PromotionProperties promotion = new PromotionProperties();
    private ContextProperties context = new ContextProperties();
    private SearchProperties search = new SearchProperties();
    private HealthProperties health = new HealthProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/mind";
        private String directory = ".mind";
        private boolean directWriteFallback = true;
    }

    @Data
    public static class SessionProperties {
        private Duration gapThreshold = Duration.ofMinutes(30);
    }

    @Data
    public static class ExtractionProperties {
        private double lowConfidenceThreshold = 0.5;
    }

    @Data
    public static class PromotionProperties {
        private boolean promoteBlockers = false;
    }

    @Data
    public static class ContextProperties {
        private int itemsPerCategory = 5;
        private double recencyHalfLifeDays = 7.0;
        private double minConfidence = 0.5;
    }

    @Data
    public static class SearchProperties {
        private int limit = 10;
        private double minScore = 0.05;
    }

    @Data
    public static class HealthProperties {
        private long memorySizeWarningBytes = 51200;
    }
}
