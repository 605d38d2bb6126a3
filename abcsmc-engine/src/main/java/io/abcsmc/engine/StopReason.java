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

/**
 * Why {@link AbcSmc#run} returned.
 */
public enum StopReason {
    /** Every entry of the attempts schedule was used. */
    SCHEDULE_EXHAUSTED,
    /** The last generation stored no particle. */
    EMPTY_POPULATION,
    /** The last generation's epsilon was at or below the minimum epsilon. */
    MIN_EPSILON_REACHED,
    /** At most one model had non-zero probability in the last generation. */
    SINGLE_MODEL_ALIVE,
    /** The last generation accepted fewer particles than the configured minimum. */
    INCOMPLETE_GENERATION,
    /** {@link AbcSmc#stop()} was called; the generation it cut short is stored. */
    STOPPED
}
