package io.abcsmc.random.transition;

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

import io.abcsmc.model.Parameter;
import io.abcsmc.model.WeightedParameters;
import io.abcsmc.random.RandomSources;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Weighted Gaussian kernel density estimate over the previous generation.
 *
 * <h2>Fitting</h2>
 *
 * <p>The kernel covariance is
 * <pre>{@code
 *   Σ = scaling · h² · Cov_w(X)        h = (4 / (n_eff · (d + 2)))^(1 / (d + 4))
 * }</pre>
 * where {@code Cov_w} is the weighted sample covariance, {@code h} is
 * Silverman's rule of thumb and {@code n_eff = 1 / Σ w²} is the effective
 * sample size.
 *
 * <p>Diagonal entries below {@code varianceFloor} are raised to it, and the
 * floor is added to the whole diagonal (growing tenfold per attempt) until the
 * Cholesky decomposition succeeds. A single particle or a sample with equal
 * values therefore still yields a proper density that is positive everywhere.
 *
 * <h2>Sampling and density</h2>
 *
 * <p>{@code rvs} picks a particle with probability equal to its weight and adds
 * {@code L·z} with {@code Σ = L·Lᵀ} and {@code z} standard normal.
 * {@code pdf} is the weighted mixture {@code Σ_i w_i · N(θ; x_i, Σ)}.
 */
public final class MultivariateNormalTransition implements Transition {

    private static final Logger logger = LogManager.getLogger(MultivariateNormalTransition.class);

    public static final double DEFAULT_SCALING = 1.0;
    public static final double DEFAULT_VARIANCE_FLOOR = 1e-8;

    private static final int MAX_JITTER_ATTEMPTS = 12;

    private final double scaling;
    private final double varianceFloor;

    public MultivariateNormalTransition() {
        this(DEFAULT_SCALING, DEFAULT_VARIANCE_FLOOR);
    }

    public MultivariateNormalTransition(double scaling) {
        this(scaling, DEFAULT_VARIANCE_FLOOR);
    }

    /**
     * @param scaling multiplier on the bandwidth-scaled covariance
     * @param varianceFloor minimum kernel variance per dimension
     * @throws IllegalArgumentException if either value is not positive
     */
    public MultivariateNormalTransition(double scaling, double varianceFloor) {
        if (!(scaling > 0.0)) {
            throw new IllegalArgumentException("Scaling must be positive, got: " + scaling);
        }
        if (!(varianceFloor > 0.0)) {
            throw new IllegalArgumentException("Variance floor must be positive, got: " + varianceFloor);
        }
        this.scaling = scaling;
        this.varianceFloor = varianceFloor;
    }

    public double getScaling() {
        return scaling;
    }

    /**
     * @param nEff effective sample size
     * @param dimension number of parameters
     * @return Silverman's bandwidth factor
     */
    static double silvermanFactor(double nEff, int dimension) {
        return Math.pow(4.0 / (nEff * (dimension + 2)), 1.0 / (dimension + 4));
    }

    @Override
    public Transition.Fitted fit(WeightedParameters sample) {
        if (sample.isEmpty()) {
            throw new IllegalArgumentException("Cannot fit a transition to an empty sample");
        }
        List<String> names = sample.names();
        double[][] points = sample.toMatrix();
        double[] weights = sample.weights();
        int d = names.size();
        if (d == 0) {
            return new PointMass();
        }

        double sumSquares = 0.0;
        double[] mean = new double[d];
        for (int i = 0; i < points.length; i++) {
            sumSquares += weights[i] * weights[i];
            for (int k = 0; k < d; k++) {
                mean[k] += weights[i] * points[i][k];
            }
        }
        double nEff = 1.0 / sumSquares;
        double unbias = sumSquares < 1.0 ? 1.0 / (1.0 - sumSquares) : 1.0;

        double[][] cov = new double[d][d];
        for (int i = 0; i < points.length; i++) {
            for (int a = 0; a < d; a++) {
                double da = points[i][a] - mean[a];
                for (int b = a; b < d; b++) {
                    cov[a][b] += weights[i] * da * (points[i][b] - mean[b]);
                }
            }
        }
        double h = silvermanFactor(nEff, d);
        double factor = scaling * h * h * unbias;
        for (int a = 0; a < d; a++) {
            for (int b = a; b < d; b++) {
                cov[a][b] *= factor;
                cov[b][a] = cov[a][b];
            }
            cov[a][a] = Math.max(cov[a][a], varianceFloor);
        }

        CholeskyDecomposition cholesky = decompose(cov);
        return new Fitted(names, points, weights, cholesky);
    }

    private CholeskyDecomposition decompose(double[][] cov) {
        double jitter = varianceFloor;
        for (int attempt = 0; ; attempt++) {
            try {
                return new CholeskyDecomposition(new Array2DRowRealMatrix(cov));
            } catch (MathIllegalArgumentException e) {
                if (attempt >= MAX_JITTER_ATTEMPTS) {
                    throw new IllegalStateException("Kernel covariance is not positive definite after "
                        + attempt + " diagonal adjustments", e);
                }
                logger.debug("Covariance not positive definite, adding {} to the diagonal", jitter);
                for (int a = 0; a < cov.length; a++) {
                    cov[a][a] += jitter;
                }
                jitter *= 10.0;
            }
        }
    }

    private static final class Fitted implements Transition.Fitted {
        private final List<String> names;
        private final double[][] points;
        private final double[] weights;
        private final double[] cumulative;
        private final double[][] lower;
        private final double[][] inverse;
        private final double normalizer;

        private Fitted(List<String> names, double[][] points, double[] weights, CholeskyDecomposition cholesky) {
            this.names = names;
            this.points = points;
            this.weights = weights;
            this.cumulative = RandomSources.cumulative(weights);
            this.lower = cholesky.getL().getData();
            RealMatrix inv = cholesky.getSolver().getInverse();
            this.inverse = inv.getData();
            int d = names.size();
            this.normalizer = 1.0 / Math.sqrt(Math.pow(2.0 * Math.PI, d) * cholesky.getDeterminant());
        }

        @Override
        public Parameter rvs(UniformRandomProvider rng) {
            int index = RandomSources.sampleIndex(cumulative, rng);
            ZigguratSampler.NormalizedGaussian gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
            int d = names.size();
            double[] z = new double[d];
            for (int k = 0; k < d; k++) {
                z[k] = gaussian.sample();
            }
            double[] x = points[index].clone();
            for (int a = 0; a < d; a++) {
                for (int b = 0; b <= a; b++) {
                    x[a] += lower[a][b] * z[b];
                }
            }
            return Parameter.fromArray(names, x);
        }

        @Override
        public double pdf(Parameter parameter) {
            if (parameter.size() != names.size()) {
                return 0.0;
            }
            for (String name : names) {
                if (!parameter.has(name)) {
                    return 0.0;
                }
            }
            double[] theta = parameter.toArray(names);
            int d = theta.length;
            double[] diff = new double[d];
            double density = 0.0;
            for (int i = 0; i < points.length; i++) {
                for (int k = 0; k < d; k++) {
                    diff[k] = theta[k] - points[i][k];
                }
                double mahalanobis = 0.0;
                for (int a = 0; a < d; a++) {
                    double row = 0.0;
                    for (int b = 0; b < d; b++) {
                        row += inverse[a][b] * diff[b];
                    }
                    mahalanobis += diff[a] * row;
                }
                density += weights[i] * Math.exp(-0.5 * mahalanobis);
            }
            return density * normalizer;
        }
    }

    // models without parameters
    private static final class PointMass implements Transition.Fitted {
        @Override
        public Parameter rvs(UniformRandomProvider rng) {
            return Parameter.empty();
        }

        @Override
        public double pdf(Parameter parameter) {
            return parameter.size() == 0 ? 1.0 : 0.0;
        }
    }
}
