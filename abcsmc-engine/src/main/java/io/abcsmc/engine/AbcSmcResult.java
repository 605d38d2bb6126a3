package io.abcsmc.engine;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.abcsmc.engine.storage.PopulationStore;

import java.util.List;

/**
 * Outcome of one {@link AbcSmc#run} call.
 *
 * @param history the store the generations were written to
 * @param stopReason why the run stopped
 * @param reports one report per generation run by this call
 */
public record AbcSmcResult(PopulationStore history, StopReason stopReason, List<GenerationReport> reports) {

    public AbcSmcResult {
        reports = List.copyOf(reports);
    }

    /**
     * @return the index of the last generation run, -1 if none was
     */
    public int lastT() {
        return reports.isEmpty() ? -1 : reports.get(reports.size() - 1).t();
    }
}
