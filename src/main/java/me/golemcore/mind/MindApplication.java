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

package me.golemcore.mind;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Mind.
 *
 * <p>
 * GolemCore Mind gives a stateless coding assistant continuity across work
 * sessions. Durable memory lives in plain markdown files under
 * {@code <project>/.mind/}; a small engine extracts typed facts from prose,
 * detects session boundaries, promotes working notes to permanent memory and
 * surfaces due reminders.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → CliCommandRunner, CommandRouter
 * Domain Layer       → MindService, Extractor, Similarity, Lifecycle, Promotion
 * Infrastructure     → LocalStorageAdapter
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code mind.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MindApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(MindApplication.class, args)));
    }

}
