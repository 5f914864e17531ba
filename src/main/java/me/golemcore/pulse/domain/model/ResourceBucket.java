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
 * Coarse resource mode used as part of the routing cache key. When several
 * conditions hold at once, offline wins over memory pressure, which wins over
 * CPU pressure.
 */
public enum ResourceBucket {
    NORMAL, MEMORY_CONSTRAINED, CPU_CONSTRAINED, OFFLINE;

    public static ResourceBucket of(ResourceSnapshot snapshot, double memoryThreshold, double cpuThreshold) {
        if (!snapshot.isConnectivity()) {
            return OFFLINE;
        }
        if (snapshot.getMemPercent() > memoryThreshold) {
            return MEMORY_CONSTRAINED;
        }
        if (snapshot.getCpuPercent() > cpuThreshold) {
            return CPU_CONSTRAINED;
        }
        return NORMAL;
    }
}
