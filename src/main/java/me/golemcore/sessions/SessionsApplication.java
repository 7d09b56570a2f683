package me.golemcore.sessions;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Sessions.
 *
 * <p>
 * A multi-session agent runtime: it supervises many concurrent, isolated work
 * sessions, each with a token-budgeted short-term memory and a session-scoped
 * long-term memory, and promotes short-term items into long-term storage.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → SessionsController, EventsController
 * Domain Layer       → SessionLifecycleService, MemoryPromotionService,
 *                      MemoryRetrievalService, short-term memory structures
 * Infrastructure     → Local storage, long-term storage backends
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code sessions.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SessionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionsApplication.class, args);
    }

}
