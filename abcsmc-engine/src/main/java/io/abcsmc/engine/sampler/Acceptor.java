package io.abcsmc.engine.sampler;

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

import io.abcsmc.model.Evaluation;

/**
 * Decides whether an evaluation enters the sample.
 */
@FunctionalInterface
public interface Acceptor {

    /** Accepts an evaluation iff its particle has at least one accepted distance. */
    Acceptor ANY_ACCEPTED_DISTANCE = evaluation -> evaluation.getParticle().isValid();

    boolean accept(Evaluation evaluation);
}
