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

import io.abcsmc.engine.distance.DistanceFunction;
import io.abcsmc.engine.distance.PNormDistance;
import io.abcsmc.engine.epsilon.Epsilon;
import io.abcsmc.engine.epsilon.MedianEpsilon;
import io.abcsmc.engine.generation.GenerationDiagnostics;
import io.abcsmc.engine.generation.ImportanceWeight;
import io.abcsmc.engine.generation.ParticleEvaluator;
import io.abcsmc.engine.generation.PerturbedProposal;
import io.abcsmc.engine.generation.PriorProposal;
import io.abcsmc.engine.generation.PriorSummaryEvaluator;
import io.abcsmc.engine.model.Model;
import io.abcsmc.engine.sampler.Acceptor;
import io.abcsmc.engine.sampler.Proposal;
import io.abcsmc.engine.sampler.Sampler;
import io.abcsmc.engine.storage.InitialData;
import io.abcsmc.engine.storage.PopulationStore;
import io.abcsmc.model.Parameter;
import io.abcsmc.model.Particle;
import io.abcsmc.model.Sample;
import io.abcsmc.model.WeightedParameters;
import io.abcsmc.random.ModelPrior;
import io.abcsmc.random.ParameterPrior;
import io.abcsmc.random.RandomSources;
import io.abcsmc.random.transition.ModelPerturbationKernel;
import io.abcsmc.random.transition.MultivariateNormalTransition;
import io.abcsmc.random.transition.Transition;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/// Approximate Bayesian computation by sequential Monte Carlo.
///
/// Evolves a population of (model, parameter) particles over generations with a
/// decreasing acceptance threshold. Generation 0 samples from the priors; every
/// later generation perturbs the previous population and corrects with
/// importance weights.
///
/// ```
///   for t in start .. start + schedule.length - 1:
///     ε_t       = epsilon.value(t, history)
///     kernels   = fit(transition[m], history.weightedParticles(t-1, m))   null if m died out
///     proposal  = t == 0 ? prior : perturbed(P_{t-1}, model kernel, kernels)
///     sample    = sampler.sampleUntilNAccepted(n, proposal, evaluator(ε_t, schedule[t]), any accepted distance)
///     history.appendPopulation(t, ε_t, sample)
///     stop if empty, incomplete, ε_t ≤ minEpsilon, or a single model is left
/// ```
///
/// ## Usage
///
/// ```java
/// AbcSmc abc = AbcSmc.builder()
///     .models(List.of(modelA, modelB))
///     .parameterPriors(List.of(priorA, priorB))
///     .options(AbcSmcOptions.builder(200).seed(7L).build())
///     .build();
/// abc.newRun(observed, new InMemoryHistory(2));
/// AbcSmcResult result = abc.run(new int[]{1, 1, 1, 1}, 0.05);
/// ```
///
/// ## Thread Safety
///
/// The engine is single-threaded. Concurrency lives inside the [Sampler] only.
public final class AbcSmc {

    private static final Logger logger = LogManager.getLogger(AbcSmc.class);

    private final List<Model> models;
    private final ModelPrior modelPrior;
    private final List<ParameterPrior> parameterPriors;
    private final List<Transition> transitions;
    private final ModelPerturbationKernel modelPerturbationKernel;
    private final DistanceFunction distanceFunction;
    private final Epsilon epsilon;
    private final UnaryOperator<Map<String, Double>> summaryStatistics;
    private final Sampler sampler;
    private final AbcSmcOptions options;
    private final UniformRandomProvider rng;
    private final MemoCell<List<Map<String, Double>>> priorSample = new MemoCell<>();

    private PopulationStore history;
    private Map<String, Double> observed;
    private int startT = -1;
    private volatile boolean stopRequested;

    private AbcSmc(Builder builder) {
        if (builder.models.isEmpty()) {
            throw new IllegalArgumentException("At least one model is required");
        }
        int nrModels = builder.models.size();
        this.models = List.copyOf(builder.models);
        this.modelPrior = builder.modelPrior != null ? builder.modelPrior : ModelPrior.uniform(nrModels);
        this.parameterPriors = List.copyOf(builder.parameterPriors);
        List<Transition> kernels = builder.transitions;
        if (kernels == null) {
            kernels = new ArrayList<>(nrModels);
            for (int m = 0; m < nrModels; m++) {
                kernels.add(new MultivariateNormalTransition());
            }
        }
        this.transitions = List.copyOf(kernels);
        this.modelPerturbationKernel = builder.modelPerturbationKernel != null
            ? builder.modelPerturbationKernel : new ModelPerturbationKernel(nrModels);
        this.distanceFunction = builder.distanceFunction != null ? builder.distanceFunction : new PNormDistance();
        this.epsilon = builder.epsilon != null ? builder.epsilon : new MedianEpsilon();
        this.summaryStatistics = builder.summaryStatistics != null ? builder.summaryStatistics : UnaryOperator.identity();
        this.sampler = builder.sampler != null ? builder.sampler : Sampler.singleCore();
        this.options = Objects.requireNonNull(builder.options, "options");

        requireCount("model prior", modelPrior.size(), nrModels);
        requireCount("parameter priors", parameterPriors.size(), nrModels);
        requireCount("transitions", transitions.size(), nrModels);
        requireCount("model perturbation kernel", modelPerturbationKernel.getNrModels(), nrModels);

        this.rng = RandomSources.create(options.getSeed());
        this.sampler.setShowProgress(options.isShowProgress());
    }

    private static void requireCount(String what, int actual, int nrModels) {
        if (actual != nrModels) {
            throw new IllegalArgumentException("Expected " + nrModels + " " + what + " for " + nrModels
                + " models, got " + actual);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Starts a new run on an empty store.
    ///
    /// @param observed observed summary statistics
    /// @param history empty store sized for this engine's models
    public void newRun(Map<String, Double> observed, PopulationStore history) {
        newRun(observed, -1, null, Map.of(), history);
    }

    /// Starts a new run on an empty store, recording the ground truth of
    /// synthetic data.
    ///
    /// Draws (or reuses) the prior sample, initializes the distance function
    /// and the epsilon schedule on it, and records the initial data.
    ///
    /// @param observed observed summary statistics
    /// @param groundTruthModel model index that generated the data, -1 if unknown
    /// @param groundTruthParameter parameter that generated the data, null if unknown
    /// @param metadata free-form metadata, stored with the options
    /// @param history empty store sized for this engine's models
    /// @throws IllegalArgumentException if the store already holds generations or has
    ///         the wrong number of models
    public void newRun(Map<String, Double> observed, int groundTruthModel, Parameter groundTruthParameter,
                       Map<String, String> metadata, PopulationStore history) {
        requireStore(history);
        if (history.maxT() >= 0) {
            throw new IllegalArgumentException("Store already holds generations up to t=" + history.maxT()
                + ", use loadRun to continue it");
        }
        this.history = history;
        this.observed = Map.copyOf(observed);
        this.startT = 0;
        clearStop();

        List<Map<String, Double>> sample = priorSample();
        distanceFunction.initialize(sample);
        Map<String, Double> observedStats = this.observed;
        epsilon.initialize(sample, stats -> distanceFunction.distance(stats, observedStats));

        Map<String, String> allMetadata = new LinkedHashMap<>(options.toMetadata());
        allMetadata.putAll(metadata);
        List<String> names = new ArrayList<>(models.size());
        for (Model model : models) {
            names.add(model.getName());
        }
        history.storeInitialData(new InitialData(groundTruthModel, groundTruthParameter, this.observed,
            allMetadata, names, distanceFunction.toJson(), epsilon.toJson()));
        logger.info("New run with {} models, {} particles per population", models.size(), options.getNrParticles());
    }

    /// Continues a run from a store that already holds generations. The next
    /// generation is `history.maxT() + 1`. The distance function is
    /// re-initialized on the prior sample; the epsilon schedule is not, and
    /// takes its next value from the stored history.
    ///
    /// @param observed observed summary statistics
    /// @param history store holding at least one generation
    public void loadRun(Map<String, Double> observed, PopulationStore history) {
        requireStore(history);
        if (history.maxT() < 0) {
            throw new IllegalArgumentException("Store holds no generation to continue from, use newRun");
        }
        this.history = history;
        this.observed = Map.copyOf(observed);
        this.startT = history.maxT() + 1;
        clearStop();
        distanceFunction.initialize(priorSample());
        logger.info("Loaded run, continuing at t={}", startT);
    }

    private void requireStore(PopulationStore store) {
        Objects.requireNonNull(store, "history");
        if (store.getNrModels() != models.size()) {
            throw new IllegalArgumentException("Store records " + store.getNrModels() + " models, engine has "
                + models.size());
        }
    }

    /// Runs generations until a stop condition holds or the schedule is used up.
    ///
    /// A pending [#stop()] request is withdrawn when the call starts. A request
    /// made during the call ends it after the current generation is stored.
    ///
    /// @param attemptsSchedule simulations per candidate, one entry per generation to run
    /// @param minEpsilon stop once a generation's epsilon is at or below this
    /// @return the history, the stop reason and one report per generation
    /// @throws IllegalStateException if no run was started
    /// @throws IncompleteGenerationException if a generation is incomplete and the
    ///         options ask to fail on that
    public AbcSmcResult run(int[] attemptsSchedule, double minEpsilon) {
        if (history == null) {
            throw new IllegalStateException("No run started, call newRun or loadRun first");
        }
        for (int attempts : attemptsSchedule) {
            if (attempts < 1) {
                throw new IllegalArgumentException("Attempts schedule entries must be >= 1, got: " + attempts);
            }
        }
        int t0 = startT;
        List<GenerationReport> reports = new ArrayList<>();
        StopReason stopReason = StopReason.SCHEDULE_EXHAUSTED;
        IncompleteGenerationException incomplete = null;
        clearStop();

        for (int i = 0; i < attemptsSchedule.length; i++) {
            int t = t0 + i;
            if (stopRequested) {
                stopReason = StopReason.STOPPED;
                logger.info("Stop requested, not starting t={}", t);
                break;
            }
            GenerationReport report = runGeneration(t, attemptsSchedule[i]);
            reports.add(report);
            startT = t + 1;

            if (stopRequested) {
                stopReason = StopReason.STOPPED;
                logger.info("t={}: stop requested, stored {} particles, stopping", t, report.storedParticles());
                break;
            }
            if (report.storedParticles() == 0) {
                stopReason = StopReason.EMPTY_POPULATION;
                logger.info("t={}: population is empty, stopping", t);
                break;
            }
            if (report.accepted() < options.getMinNrParticlesPerPopulation()) {
                stopReason = StopReason.INCOMPLETE_GENERATION;
                logger.warn("t={}: accepted {} particles, below the minimum of {}, stopping",
                    t, report.accepted(), options.getMinNrParticlesPerPopulation());
                if (options.isFailOnIncompleteGeneration()) {
                    incomplete = new IncompleteGenerationException(report, options.getMinNrParticlesPerPopulation());
                }
                break;
            }
            if (report.epsilon() <= minEpsilon) {
                stopReason = StopReason.MIN_EPSILON_REACHED;
                logger.info("t={}: epsilon {} reached the minimum {}, stopping", t, report.epsilon(), minEpsilon);
                break;
            }
            if (options.isStopIfOnlySingleModelAlive() && history.nrModelsAlive(t) <= 1) {
                stopReason = StopReason.SINGLE_MODEL_ALIVE;
                logger.info("t={}: a single model is left, stopping", t);
                break;
            }
        }

        history.done();
        if (incomplete != null) {
            throw incomplete;
        }
        return new AbcSmcResult(history, stopReason, reports);
    }

    private GenerationReport runGeneration(int t, int attemptsBudget) {
        double eps = epsilon.value(t, history);
        Proposal proposal;
        ImportanceWeight weighting;
        if (t == 0) {
            proposal = new PriorProposal(modelPrior, parameterPriors);
            weighting = ImportanceWeight.prior();
        } else {
            List<Transition.Fitted> fitted = fitTransitions(t - 1);
            double[] probabilities = history.getModelProbabilities(t - 1);
            proposal = new PerturbedProposal(probabilities, modelPerturbationKernel, fitted, modelPrior, parameterPriors);
            weighting = ImportanceWeight.perturbed(probabilities, modelPerturbationKernel, fitted, modelPrior,
                parameterPriors);
        }
        GenerationDiagnostics diagnostics = new GenerationDiagnostics();
        ParticleEvaluator evaluator = new ParticleEvaluator(t, eps, attemptsBudget,
            options.getMaxNrAllowedSampleAttemptsPerParticle(), models, distanceFunction, observed,
            summaryStatistics, weighting, diagnostics);

        Sample sample = sampler.sampleUntilNAccepted(options.getNrParticles(), proposal, evaluator,
            Acceptor.ANY_ACCEPTED_DISTANCE, t, options.getMaxNrEvaluationsPerGeneration(), false, rng);

        List<Particle> accepted = new ArrayList<>(sample.getNrAccepted());
        for (Particle particle : sample.getAcceptedParticles()) {
            if (particle.isValid()) {
                accepted.add(particle);
            }
        }
        boolean nonEmpty = history.appendPopulation(t, eps, accepted, sample.getNrSimulations());
        int stored = nonEmpty ? history.getPopulation(t).size() : 0;

        long evaluations = sample.getNrEvaluations();
        double acceptanceRate = evaluations == 0 ? 0.0 : (double) accepted.size() / evaluations;
        GenerationReport report = new GenerationReport(t, eps, accepted.size(), stored, evaluations,
            sample.getNrSimulations(), acceptanceRate, diagnostics.getZeroNormalizationEvents(),
            diagnostics.getExhaustedEvaluations(), sample.getNrFailedEvaluations(), sample.isOk());
        logger.info("t={}: epsilon={}, accepted={}/{}, evaluations={}, acceptance rate={}",
            t, eps, accepted.size(), options.getNrParticles(), evaluations, String.format("%.4f", acceptanceRate));
        if (diagnostics.getZeroNormalizationEvents() > 0) {
            logger.warn("t={}: {} particles got weight 0 from a zero importance-weight normalization",
                t, diagnostics.getZeroNormalizationEvents());
        }
        return report;
    }

    private List<Transition.Fitted> fitTransitions(int previousT) {
        List<Transition.Fitted> fitted = new ArrayList<>(models.size());
        for (int m = 0; m < models.size(); m++) {
            WeightedParameters parameters = history.weightedParticles(previousT, m);
            if (parameters.isEmpty()) {
                logger.debug("t={}: model {} has no particles, treated as extinct", previousT + 1, m);
                fitted.add(null);
            } else {
                fitted.add(transitions.get(m).fit(parameters));
            }
        }
        return Collections.unmodifiableList(fitted);
    }

    /// Summary statistics of `nrParticles` simulations drawn from the priors.
    ///
    /// Computed on first call and cached until [#resetPriorSample()].
    ///
    /// @return the prior sample, the same list on every call
    public List<Map<String, Double>> priorSample() {
        return priorSample.get(this::drawPriorSample);
    }

    public void resetPriorSample() {
        priorSample.reset();
    }

    private List<Map<String, Double>> drawPriorSample() {
        Sample sample = sampler.sampleUntilNAccepted(options.getNrParticles(),
            new PriorProposal(modelPrior, parameterPriors),
            new PriorSummaryEvaluator(models, summaryStatistics),
            Acceptor.ANY_ACCEPTED_DISTANCE, -1, Sampler.UNBOUNDED, true, rng);
        List<Map<String, Double>> statistics = new ArrayList<>(sample.getNrAccepted());
        for (Particle particle : sample.getAcceptedParticles()) {
            statistics.addAll(particle.getSummaryStatistics());
        }
        logger.debug("Drew {} prior simulations", statistics.size());
        return Collections.unmodifiableList(statistics);
    }

    /// Ends the run. The running generation is cut short, stored, and no
    /// further generation starts. May be called from any thread, including a
    /// model's simulation.
    public void stop() {
        stopRequested = true;
        sampler.stop();
    }

    private void clearStop() {
        stopRequested = false;
        sampler.clearStop();
    }

    public PopulationStore getHistory() {
        return history;
    }

    public AbcSmcOptions getOptions() {
        return options;
    }

    public Sampler getSampler() {
        return sampler;
    }

    public List<Model> getModels() {
        return models;
    }

    /// @return the next generation index, -1 before a run is started
    public int getNextT() {
        return startT;
    }

    public static final class Builder {
        private List<Model> models = List.of();
        private ModelPrior modelPrior;
        private List<ParameterPrior> parameterPriors = List.of();
        private List<Transition> transitions;
        private ModelPerturbationKernel modelPerturbationKernel;
        private DistanceFunction distanceFunction;
        private Epsilon epsilon;
        private UnaryOperator<Map<String, Double>> summaryStatistics;
        private Sampler sampler;
        private AbcSmcOptions options;

        private Builder() {
        }

        public Builder models(List<? extends Model> models) {
            this.models = List.copyOf(models);
            return this;
        }

        public Builder modelPrior(ModelPrior modelPrior) {
            this.modelPrior = modelPrior;
            return this;
        }

        public Builder parameterPriors(List<ParameterPrior> parameterPriors) {
            this.parameterPriors = List.copyOf(parameterPriors);
            return this;
        }

        public Builder transitions(List<? extends Transition> transitions) {
            this.transitions = new ArrayList<>(transitions);
            return this;
        }

        public Builder modelPerturbationKernel(ModelPerturbationKernel kernel) {
            this.modelPerturbationKernel = kernel;
            return this;
        }

        public Builder distanceFunction(DistanceFunction distanceFunction) {
            this.distanceFunction = distanceFunction;
            return this;
        }

        public Builder epsilon(Epsilon epsilon) {
            this.epsilon = epsilon;
            return this;
        }

        public Builder summaryStatistics(UnaryOperator<Map<String, Double>> summaryStatistics) {
            this.summaryStatistics = summaryStatistics;
            return this;
        }

        public Builder sampler(Sampler sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder options(AbcSmcOptions options) {
            this.options = options;
            return this;
        }

        /// @throws IllegalArgumentException if the per-model collaborators disagree in count
        public AbcSmc build() {
            return new AbcSmc(this);
        }
    }
}
