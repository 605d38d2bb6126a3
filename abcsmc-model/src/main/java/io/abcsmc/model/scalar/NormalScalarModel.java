package io.abcsmc.model.scalar;

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

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * Normal (Gaussian) prior N(μ, σ²) over the whole real line.
 *
 * <pre>{@code
 * NormalScalarModel prior = new NormalScalarModel(0.0, 1.0);
 * prior.pdf(0.0);  // 0.3989...
 * }</pre>
 */
@ModelType(NormalScalarModel.MODEL_TYPE)
public class NormalScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "normal";

    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    @SerializedName("mean")
    private final double mean;

    @SerializedName("std_dev")
    private final double stdDev;

    /**
     * @param mean the mean μ
     * @param stdDev the standard deviation σ
     * @throws IllegalArgumentException if stdDev is not positive
     */
    public NormalScalarModel(double mean, double stdDev) {
        if (!(stdDev > 0.0)) {
            throw new IllegalArgumentException("Standard deviation must be positive, got: " + stdDev);
        }
        this.mean = mean;
        this.stdDev = stdDev;
    }

    public static NormalScalarModel standardNormal() {
        return new NormalScalarModel(0.0, 1.0);
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    @Override
    public double pdf(double x) {
        double z = (x - mean) / stdDev;
        return Math.exp(-0.5 * z * z) / (stdDev * SQRT_2PI);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NormalScalarModel)) return false;
        NormalScalarModel that = (NormalScalarModel) o;
        return Double.compare(that.mean, mean) == 0 &&
               Double.compare(that.stdDev, stdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev);
    }

    @Override
    public String toString() {
        return "NormalScalarModel[mean=" + mean + ", stdDev=" + stdDev + "]";
    }
}
