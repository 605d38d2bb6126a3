package io.abcsmc.engine.epsilon;

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

import com.google.gson.JsonObject;
import io.abcsmc.engine.storage.PopulationStore;
import io.abcsmc.model.WeightedDistances;
import io.abcsmc.model.json.AbcGsonConfig;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.ToDoubleFunction;

/**
 * Adaptive threshold from the previous generation's distances.
 *
 * <pre>{@code
 *   ε_0 = initial value, or median distance of the prior sample
 *   ε_t = multiplier · weighted median of the accepted distances of t-1
 * }</pre>
 *
 * <p>Values are computed once per generation and cached, so asking for the
 * same {@code t} twice returns the same value. {@link #initialize} starts a
 * fresh schedule and drops every cached value. Not thread-safe; used from the
 * engine thread only.
 */
public final class MedianEpsilon implements Epsilon {

    private static final Logger logger = LogManager.getLogger(MedianEpsilon.class);

    private final Double initialEpsilon;
    private final double multiplier;
    private final TreeMap<Integer, Double> values = new TreeMap<>();

    /** Initial value from the prior sample, multiplier 1. */
    public MedianEpsilon() {
        this(null, 1.0);
    }

    /**
     * @param initialEpsilon ε_0, or null to take the median prior-sample distance
     * @param multiplier factor applied to the weighted median, positive
     */
    public MedianEpsilon(Double initialEpsilon, double multiplier) {
        if (!(multiplier > 0.0)) {
            throw new IllegalArgumentException("Multiplier must be positive, got: " + multiplier);
        }
        this.initialEpsilon = initialEpsilon;
        this.multiplier = multiplier;
        if (initialEpsilon != null) {
            values.put(0, initialEpsilon);
        }
    }

    @Override
    public void initialize(List<Map<String, Double>> sampleFromPrior,
                           ToDoubleFunction<Map<String, Double>> distanceToObserved) {
        values.clear();
        if (initialEpsilon != null) {
            values.put(0, initialEpsilon);
            return;
        }
        if (sampleFromPrior.isEmpty()) {
            throw new IllegalArgumentException("Cannot derive an initial epsilon from an empty prior sample");
        }
        double[] distances = new double[sampleFromPrior.size()];
        for (int i = 0; i < distances.length; i++) {
            distances[i] = distanceToObserved.applyAsDouble(sampleFromPrior.get(i));
        }
        double eps0 = new Median().evaluate(distances);
        values.put(0, eps0);
        logger.debug("Initial epsilon {} from {} prior simulations", eps0, distances.length);
    }

    @Override
    public double value(int t, PopulationStore history) {
        Double cached = values.get(t);
        if (cached != null) {
            return cached;
        }
        if (t == 0) {
            throw new IllegalStateException("MedianEpsilon has no initial value; initialize it first");
        }
        WeightedDistances distances = history.getWeightedDistances(t - 1);
        if (distances.isEmpty()) {
            throw new IllegalStateException("Generation " + (t - 1) + " has no distances to take a median of");
        }
        double eps = multiplier * distances.weightedMedian();
        values.put(t, eps);
        return eps;
    }

    @Override
    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", getClass().getSimpleName());
        json.addProperty("initial_epsilon", initialEpsilon != null ? initialEpsilon.toString() : "from_sample");
        json.addProperty("multiplier", multiplier);
        return AbcGsonConfig.compactGson().toJson(json);
    }
}
