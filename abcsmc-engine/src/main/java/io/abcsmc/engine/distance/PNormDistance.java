package io.abcsmc.engine.distance;

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
import io.abcsmc.model.json.AbcGsonConfig;

import java.util.Map;

/**
 * Weighted p-norm over the observed statistics:
 *
 * <pre>{@code
 *   d(x, y) = (Σ_k w_k · |x_k - y_k|^p)^(1/p)      p ≥ 1
 *   d(x, y) = max_k w_k · |x_k - y_k|              p = ∞
 * }</pre>
 *
 * Statistics without an explicit weight have weight 1.
 */
public class PNormDistance implements DistanceFunction {

    private final double p;
    private final Map<String, Double> weights;

    /** Euclidean distance with unit weights. */
    public PNormDistance() {
        this(2.0);
    }

    public PNormDistance(double p) {
        this(p, Map.of());
    }

    /**
     * @param p norm order, at least 1 or positive infinity
     * @param weights per-statistic weights, non-negative
     * @throws IllegalArgumentException if p is below 1 or a weight is negative
     */
    public PNormDistance(double p, Map<String, Double> weights) {
        if (!(p >= 1.0)) {
            throw new IllegalArgumentException("p must be >= 1, got: " + p);
        }
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            if (!(entry.getValue() >= 0.0)) {
                throw new IllegalArgumentException("Weight of '" + entry.getKey() + "' must be >= 0");
            }
        }
        this.p = p;
        this.weights = Map.copyOf(weights);
    }

    public double getP() {
        return p;
    }

    protected double weight(String key) {
        return weights.getOrDefault(key, 1.0);
    }

    @Override
    public double distance(Map<String, Double> simulated, Map<String, Double> observed) {
        if (Double.isInfinite(p)) {
            double max = 0.0;
            for (String key : observed.keySet()) {
                max = Math.max(max, weight(key) * DistanceFunction.absoluteDifference(simulated, observed, key));
            }
            return max;
        }
        double sum = 0.0;
        for (String key : observed.keySet()) {
            sum += weight(key) * Math.pow(DistanceFunction.absoluteDifference(simulated, observed, key), p);
        }
        return Math.pow(sum, 1.0 / p);
    }

    @Override
    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", getClass().getSimpleName());
        json.addProperty("p", p);
        json.add("weights", AbcGsonConfig.compactGson().toJsonTree(weights));
        return AbcGsonConfig.compactGson().toJson(json);
    }
}
