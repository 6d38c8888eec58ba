/*
 *  This file is part of lindero.
 *
 *  Lindero is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Lindero is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Lindero. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.lindero.service;

import com.dedicatedcode.lindero.config.ErrorPolicy;
import com.dedicatedcode.lindero.config.LinderoConfiguration;
import com.dedicatedcode.lindero.dto.GeoJsonFeature;
import com.dedicatedcode.lindero.dto.GeoJsonFeatureCollection;
import com.dedicatedcode.lindero.exception.FeatureProcessingException;
import com.dedicatedcode.lindero.exception.MalformedGeometryException;
import com.dedicatedcode.lindero.exception.MissingRequiredPropertyException;
import com.dedicatedcode.lindero.exception.SimplificationException;
import com.dedicatedcode.lindero.model.BoundaryGeometry;
import com.dedicatedcode.lindero.model.Ring;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Simplifies every feature of a collection and reduces its properties to an identifier and a
 * label. Features are independent of each other and run in parallel; the output keeps the input
 * order.
 */
@Service
public class FeatureCollectionProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FeatureCollectionProcessor.class);

    private final GeometrySimplificationService geometrySimplificationService;
    private final GeoJsonGeometryMapper geometryMapper;
    private final LinderoConfiguration config;

    public FeatureCollectionProcessor(GeometrySimplificationService geometrySimplificationService,
                                      GeoJsonGeometryMapper geometryMapper,
                                      LinderoConfiguration config) {
        this.geometrySimplificationService = geometrySimplificationService;
        this.geometryMapper = geometryMapper;
        this.config = config;
    }

    /**
     * Process {@code collection} with the given settings.
     *
     * @throws FeatureProcessingException in strict mode, for the first failed feature observed
     * @throws SimplificationException    if the input is not a feature collection at all
     */
    public ProcessedCollection process(GeoJsonFeatureCollection collection, SimplificationSettings settings) {
        if (collection == null || !GeoJsonFeatureCollection.TYPE.equals(collection.getType()) || collection.getFeatures() == null) {
            throw new SimplificationException("Input is not a GeoJSON FeatureCollection");
        }

        List<GeoJsonFeature> features = collection.getFeatures();
        int total = features.size();
        GeoJsonFeature[] slots = new GeoJsonFeature[total];
        SimplificationMetrics metrics = SimplificationMetrics.empty();

        ExecutorService executor = createExecutorService(config.getSimplifyConfiguration().getThreads());
        ExecutorCompletionService<FeatureOutcome> ecs = new ExecutorCompletionService<>(executor);
        List<Future<FeatureOutcome>> submitted = new ArrayList<>(total);
        try {
            for (int i = 0; i < total; i++) {
                int index = i;
                GeoJsonFeature feature = features.get(i);
                submitted.add(ecs.submit(() -> processFeature(index, feature, settings)));
            }

            for (int collected = 0; collected < total; collected++) {
                FeatureOutcome outcome = take(ecs);
                if (outcome.failure() != null) {
                    if (settings.errorPolicy() == ErrorPolicy.STRICT) {
                        submitted.forEach(f -> f.cancel(true));
                        throw new FeatureProcessingException(outcome.index(), outcome.identifier(), outcome.failure());
                    }
                    logger.warn("Skipping feature #{} ({}): {}", outcome.index(),
                                outcome.identifier() == null ? "no identifier" : outcome.identifier(),
                                outcome.failure().getMessage());
                } else {
                    slots[outcome.index()] = outcome.feature();
                }
                metrics = metrics.merge(outcome.metrics());
            }
        } finally {
            executor.shutdownNow();
        }

        List<GeoJsonFeature> output = Arrays.stream(slots).filter(Objects::nonNull).toList();
        logger.info("Simplified {} of {} features: {} -> {} coordinates ({}% reduction)",
                    metrics.featuresOut(), metrics.featuresIn(),
                    metrics.coordinatesBefore(), metrics.coordinatesAfter(),
                    String.format("%.1f", metrics.reductionPercent()));
        return new ProcessedCollection(new GeoJsonFeatureCollection(new ArrayList<>(output)), metrics);
    }

    private FeatureOutcome processFeature(int index, GeoJsonFeature feature, SimplificationSettings settings) {
        String identifier = null;
        try {
            if (feature == null) {
                throw new MalformedGeometryException("Feature is null");
            }
            LinderoConfiguration.PropertiesConfiguration properties = config.getPropertiesConfiguration();
            identifier = requireProperty(feature.getProperties(), properties.getIdField());
            String label = requireProperty(feature.getProperties(), properties.getLabelField());

            BoundaryGeometry geometry = geometryMapper.toModel(feature.getGeometry());
            GeometrySimplificationService.SimplifiedGeometry simplified =
                    geometrySimplificationService.simplifyWithStatistics(geometry, settings.tolerance(), settings.precision());

            if (simplified.degenerateRings() > 0) {
                logger.warn("Feature {} has {} ring(s) that are open or shorter than {} points, passed through unchanged",
                            identifier, simplified.degenerateRings(), Ring.MIN_SIZE);
            }
            if (simplified.keptOriginalRings() > 0) {
                logger.debug("Feature {}: kept {} ring(s) unsimplified, simplification left fewer than {} points",
                             identifier, simplified.keptOriginalRings(), Ring.MIN_SIZE);
            }
            boolean invalid = settings.validateOutput() && !geometrySimplificationService.isValid(simplified.geometry());
            if (invalid) {
                logger.debug("Feature {}: simplified geometry is not valid", identifier);
            }

            Map<String, Object> reduced = new LinkedHashMap<>();
            reduced.put(properties.getIdKey(), identifier);
            reduced.put(properties.getLabelKey(), label);
            GeoJsonFeature result = new GeoJsonFeature(geometryMapper.toDto(simplified.geometry()), reduced);

            return FeatureOutcome.processed(index, identifier, result, SimplificationMetrics.processed(
                    geometry.coordinateCount(),
                    simplified.geometry().coordinateCount(),
                    simplified.degenerateRings(),
                    simplified.keptOriginalRings(),
                    invalid));
        } catch (SimplificationException e) {
            return FeatureOutcome.failed(index, identifier, e);
        }
    }

    private String requireProperty(Map<String, Object> properties, String field) {
        Object value = properties == null ? null : properties.get(field);
        if (value == null) {
            throw new MissingRequiredPropertyException(field, "Required property '" + field + "' is missing");
        }
        String text = asText(value, field);
        if (text.isBlank()) {
            throw new MissingRequiredPropertyException(field, "Required property '" + field + "' is blank");
        }
        return text;
    }

    private String asText(Object value, String field) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof BigInteger || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Number number) {
            // 5001.0 must join as "5001"
            return new BigDecimal(number.toString()).stripTrailingZeros().toPlainString();
        }
        throw new MissingRequiredPropertyException(field, "Required property '" + field + "' is not a scalar value");
    }

    private FeatureOutcome take(ExecutorCompletionService<FeatureOutcome> ecs) {
        try {
            return ecs.take().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SimplificationException("Interrupted while simplifying features", e);
        } catch (ExecutionException e) {
            throw new SimplificationException("Unexpected failure while simplifying a feature", e.getCause());
        }
    }

    private ExecutorService createExecutorService(int maxThreads) {
        if (maxThreads <= 0) {
            return Executors.newWorkStealingPool();
        } else {
            return Executors.newFixedThreadPool(maxThreads);
        }
    }

    private record FeatureOutcome(int index,
                                  String identifier,
                                  GeoJsonFeature feature,
                                  SimplificationException failure,
                                  SimplificationMetrics metrics) {

        static FeatureOutcome processed(int index, String identifier, GeoJsonFeature feature, SimplificationMetrics metrics) {
            return new FeatureOutcome(index, identifier, feature, null, metrics);
        }

        static FeatureOutcome failed(int index, String identifier, SimplificationException failure) {
            return new FeatureOutcome(index, identifier, null, failure,
                                      SimplificationMetrics.skipped(new SimplificationMetrics.SkippedFeature(index, identifier, failure.getMessage())));
        }
    }
}
