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
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sum of absolute differences, each scaled by the median absolute deviation
 * (MAD) of that statistic over the prior sample:
 *
 * <pre>{@code
 *   d(x, y) = Σ_k |x_k - y_k| / MAD_k
 * }</pre>
 *
 * <p>A statistic with zero MAD keeps scale 1. Must be initialized before use.
 */
public final class MedianAbsoluteDeviationDistance implements DistanceFunction {

    private static final Logger logger = LogManager.getLogger(MedianAbsoluteDeviationDistance.class);

    private volatile Map<String, Double> scales;

    @Override
    public void initialize(List<Map<String, Double>> sampleFromPrior) {
        if (sampleFromPrior.isEmpty()) {
            throw new IllegalArgumentException("Cannot initialize from an empty prior sample");
        }
        Median median = new Median();
        Map<String, Double> computed = new HashMap<>();
        for (String key : sampleFromPrior.get(0).keySet()) {
            double[] values = new double[sampleFromPrior.size()];
            for (int i = 0; i < values.length; i++) {
                Double value = sampleFromPrior.get(i).get(key);
                if (value == null) {
                    throw new IllegalArgumentException("Prior sample " + i + " lacks statistic '" + key + "'");
                }
                values[i] = value;
            }
            double center = median.evaluate(values);
            double[] deviations = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                deviations[i] = Math.abs(values[i] - center);
            }
            double mad = median.evaluate(deviations);
            if (mad > 0.0) {
                computed.put(key, mad);
            } else {
                logger.warn("Statistic '{}' has zero median absolute deviation on the prior sample, using scale 1", key);
                computed.put(key, 1.0);
            }
        }
        scales = Map.copyOf(computed);
        logger.debug("Initialized MAD scales {}", scales);
    }

    /**
     * @return the scale per statistic
     * @throws IllegalStateException if not initialized
     */
    public Map<String, Double> getScales() {
        Map<String, Double> current = scales;
        if (current == null) {
            throw new IllegalStateException("MedianAbsoluteDeviationDistance is not initialized");
        }
        return current;
    }

    @Override
    public double distance(Map<String, Double> simulated, Map<String, Double> observed) {
        Map<String, Double> current = getScales();
        double sum = 0.0;
        for (String key : observed.keySet()) {
            sum += DistanceFunction.absoluteDifference(simulated, observed, key) / current.getOrDefault(key, 1.0);
        }
        return sum;
    }

    @Override
    public String toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", getClass().getSimpleName());
        Map<String, Double> current = scales;
        if (current != null) {
            json.add("scales", AbcGsonConfig.compactGson().toJsonTree(current));
        }
        return AbcGsonConfig.compactGson().toJson(json);
    }
}
