/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.regimehopper.regime;

import com.regimehopper.RegimeHopperConfig;
import com.regimehopper.features.FeatureExtractor;
import com.regimehopper.features.FeatureType;
import com.regimehopper.hmm.ForwardResult;
import com.regimehopper.hmm.HmmModel;
import com.regimehopper.hmm.LogMath;
import com.regimehopper.hmm.MostLikelySequence;
import com.regimehopper.hmm.SmoothingResult;
import com.regimehopper.util.exceptions.DimensionMismatchException;
import com.regimehopper.util.exceptions.InvalidParameterException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.regimehopper.RegimeHopperConfig.*;

/**
 * Detects market regimes in price series with a supplied, already trained HMM. The features are
 * extracted as configured, the state sequence is decoded with Viterbi and the per-step state
 * probabilities come from the forward pass or, if 'regime.smoothing' is enabled, from the
 * forward-backward pass.
 * <p>
 * States are labeled by their mean return, the state with the lowest mean gets the first label.
 * If returns are not among the configured features the first feature is used instead.
 * <p>
 * A detector is immutable and can be used from several threads.
 *
 * @see #detectAll(Map)
 */
public class RegimeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(RegimeDetector.class);
    public static final int DEFAULT_WINDOW = 20;
    public static final int DEFAULT_THREADS = 2;

    private final HmmModel model;
    private final int window;
    private final List<FeatureType> featureTypes;
    private final List<String> stateLabels;
    private final boolean smoothing;
    private final int threads;

    public RegimeDetector(RegimeHopperConfig config, HmmModel model) {
        this.model = model;
        this.window = config.getInt(FEATURES_WINDOW, DEFAULT_WINDOW);
        if (window < 1)
            throw new IllegalArgumentException(FEATURES_WINDOW + " must be positive but was " + window);

        List<String> types = config.getList(FEATURES_TYPES, Collections.emptyList());
        if (types.isEmpty()) {
            this.featureTypes = FeatureExtractor.DEFAULT_FEATURES;
        } else {
            List<FeatureType> tmp = new ArrayList<>(types.size());
            for (String type : types) {
                tmp.add(FeatureType.find(type));
            }
            this.featureTypes = Collections.unmodifiableList(tmp);
        }
        if (featureTypes.size() != model.getNumFeatures())
            throw new DimensionMismatchException("Number of configured features does not match the model",
                    model.getNumFeatures(), featureTypes.size());

        int rankingFeature = Math.max(0, featureTypes.indexOf(FeatureType.RETURNS));
        this.stateLabels = assignLabels(config.getList(REGIME_STATE_LABELS, defaultLabels(model.getNumStates())), model, rankingFeature);
        this.smoothing = config.getBool(REGIME_SMOOTHING, false);
        this.threads = config.getInt(REGIME_THREADS, DEFAULT_THREADS);
        if (threads < 1)
            throw new IllegalArgumentException(REGIME_THREADS + " must be positive but was " + threads);

        LOGGER.info("Regime detection with {} states, features {}, window {}, labels {}, smoothing {}",
                model.getNumStates(), featureTypes, window, stateLabels, smoothing);
    }

    /**
     * @return the labels used when none are configured, ordered from the most bearish to the most
     * bullish
     */
    public static List<String> defaultLabels(int numStates) {
        switch (numStates) {
            case 2:
                return Arrays.asList("bearish", "bullish");
            case 3:
                return Arrays.asList("bearish", "neutral", "bullish");
            case 4:
                return Arrays.asList("strong_bearish", "weak_bearish", "weak_bullish", "strong_bullish");
            default:
                List<String> labels = new ArrayList<>(numStates);
                for (int i = 0; i < numStates; i++) {
                    labels.add("state_" + i);
                }
                return labels;
        }
    }

    /**
     * Maps the ordered labels to the states: the state with the k-th lowest mean of the ranking
     * feature gets the k-th label. Equal means keep the state order.
     *
     * @param rankingFeature the column of the feature matrix the states are ranked by
     * @return the label of each state, indexed by state
     */
    static List<String> assignLabels(List<String> orderedLabels, HmmModel model, int rankingFeature) {
        int numStates = model.getNumStates();
        if (orderedLabels.size() != numStates)
            throw new InvalidParameterException("Number of state labels " + orderedLabels.size()
                    + " does not match the number of states " + numStates, "stateLabels");

        List<Integer> byMean = new ArrayList<>(numStates);
        for (int i = 0; i < numStates; i++) {
            byMean.add(i);
        }
        byMean.sort(Comparator.comparingDouble(state -> model.getEmissionParams(state).getMean(rankingFeature)));

        String[] labels = new String[numStates];
        for (int rank = 0; rank < numStates; rank++) {
            labels[byMean.get(rank)] = orderedLabels.get(rank);
        }
        return Collections.unmodifiableList(Arrays.asList(labels));
    }

    public RegimeDetectionResult detect(double[] prices) {
        double[][] features = FeatureExtractor.extractFeatures(prices, featureTypes, window);
        MostLikelySequence sequence = model.viterbi(features);

        ForwardResult forward;
        double[][] stateProbabilities;
        if (smoothing) {
            SmoothingResult smoothingResult = model.smooth(features);
            forward = smoothingResult.getForwardResult();
            stateProbabilities = smoothingResult.getSmoothingProbabilities();
        } else {
            forward = model.forward(features);
            // rows of zero-scale steps become uniform
            stateProbabilities = LogMath.normalizeRows(forward.getAlpha());
        }

        int[] path = sequence.getPath();
        List<String> regimes = new ArrayList<>(path.length);
        for (int state : path) {
            regimes.add(stateLabels.get(state));
        }
        return new RegimeDetectionResult(stateLabels, path, regimes, stateProbabilities,
                forward.getLogLikelihood(), sequence.getLogProbability(), forward.getZeroScaleSteps());
    }

    /**
     * Runs {@link #detect(double[])} for every asset on a pool of 'regime.threads' threads.
     *
     * @return the results in the iteration order of the given map
     * @throws IllegalStateException if the detection of an asset failed, the remaining
     *                               detections are cancelled
     */
    public Map<String, RegimeDetectionResult> detectAll(Map<String, double[]> pricesByAsset) {
        ExecutorService threadPool = Executors.newFixedThreadPool(threads);
        ExecutorCompletionService<String> completionService = new ExecutorCompletionService<>(threadPool);
        Map<String, RegimeDetectionResult> results = new ConcurrentHashMap<>(pricesByAsset.size());
        int counter = 0;
        for (Map.Entry<String, double[]> entry : pricesByAsset.entrySet()) {
            final String asset = entry.getKey();
            final double[] prices = entry.getValue();
            LOGGER.debug("{}/{} submitting regime detection for '{}'", ++counter, pricesByAsset.size(), asset);
            completionService.submit(() -> {
                results.put(asset, detect(prices));
                LOGGER.debug("finished regime detection for '{}'", asset);
            }, asset);
        }

        threadPool.shutdown();

        try {
            for (int i = 0; i < pricesByAsset.size(); i++) {
                completionService.take().get();
            }
        } catch (InterruptedException e) {
            threadPool.shutdownNow();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for regime detection", e);
        } catch (ExecutionException e) {
            threadPool.shutdownNow();
            throw new IllegalStateException("Regime detection failed", e);
        }

        Map<String, RegimeDetectionResult> ordered = new LinkedHashMap<>(pricesByAsset.size());
        for (String asset : pricesByAsset.keySet()) {
            ordered.put(asset, results.get(asset));
        }
        return ordered;
    }

    public HmmModel getModel() {
        return model;
    }

    public List<FeatureType> getFeatureTypes() {
        return featureTypes;
    }

    public List<String> getStateLabels() {
        return stateLabels;
    }

    public int getWindow() {
        return window;
    }

    public boolean isSmoothing() {
        return smoothing;
    }
}
