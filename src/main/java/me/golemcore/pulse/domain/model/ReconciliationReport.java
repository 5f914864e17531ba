package me.golemcore.pulse.domain.model;

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

/**
 * Outcome of one reconciliation pass. {@code stoppedEarly} is set when a
 * breaker rejected a call and the pass gave up on the remaining entities.
 */
public record ReconciliationReport(int pending, int synced, int failed, boolean stoppedEarly) {

    public static ReconciliationReport skipped() {
        return new ReconciliationReport(0, 0, 0, true);
    }
}
