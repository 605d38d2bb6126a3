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
 * Log-normal prior: X = exp(Y) with Y ~ N(logMean, logStdDev²). Support is
 * the positive half line.
 */
@ModelType(LogNormalScalarModel.MODEL_TYPE)
public class LogNormalScalarModel implements ScalarModel {

    public static final String MODEL_TYPE = "lognormal";

    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    @SerializedName("log_mean")
    private final double logMean;

    @SerializedName("log_std_dev")
    private final double logStdDev;

    /**
     * @param logMean mean of the underlying normal
     * @param logStdDev standard deviation of the underlying normal
     * @throws IllegalArgumentException if logStdDev is not positive
     */
    public LogNormalScalarModel(double logMean, double logStdDev) {
        if (!(logStdDev > 0.0)) {
            throw new IllegalArgumentException("Log standard deviation must be positive, got: " + logStdDev);
        }
        this.logMean = logMean;
        this.logStdDev = logStdDev;
    }

    @Override
    public String getModelType() {
        return MODEL_TYPE;
    }

    public double getLogMean() {
        return logMean;
    }

    public double getLogStdDev() {
        return logStdDev;
    }

    @Override
    public double pdf(double x) {
        if (x <= 0.0) {
            return 0.0;
        }
        double z = (Math.log(x) - logMean) / logStdDev;
        return Math.exp(-0.5 * z * z) / (x * logStdDev * SQRT_2PI);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogNormalScalarModel)) return false;
        LogNormalScalarModel that = (LogNormalScalarModel) o;
        return Double.compare(that.logMean, logMean) == 0 &&
               Double.compare(that.logStdDev, logStdDev) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(logMean, logStdDev);
    }

    @Override
    public String toString() {
        return "LogNormalScalarModel[logMean=" + logMean + ", logStdDev=" + logStdDev + "]";
    }
}
