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

package com.dedicatedcode.lindero.controller;

import com.dedicatedcode.lindero.config.LinderoConfiguration;
import com.dedicatedcode.lindero.dto.GeoJsonFeatureCollection;
import com.dedicatedcode.lindero.service.FeatureCollectionProcessor;
import com.dedicatedcode.lindero.service.ProcessedCollection;
import com.dedicatedcode.lindero.service.SimplificationMetrics;
import com.dedicatedcode.lindero.service.SimplificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for simplifying boundary collections on demand.
 */
@RestController
@RequestMapping("/api/v1")
@ConditionalOnProperty(name = "lindero.batch-mode", havingValue = "false", matchIfMissing = true)
public class SimplificationController {

    private static final Logger logger = LoggerFactory.getLogger(SimplificationController.class);

    private final FeatureCollectionProcessor processor;
    private final LinderoConfiguration config;

    public SimplificationController(FeatureCollectionProcessor processor, LinderoConfiguration config) {
        this.processor = processor;
        this.config = config;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        SimplificationSettings settings = SimplificationSettings.from(config);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("tolerance", settings.tolerance());
        body.put("precision", settings.precision());
        body.put("errorPolicy", settings.errorPolicy());
        return ResponseEntity.ok(body);
    }

    /**
     * Simplify a feature collection. Tolerance and precision default to the configured values.
     *
     * @param collection GeoJSON FeatureCollection of polygons and multipolygons
     * @param tolerance  Douglas-Peucker tolerance in degrees
     * @param precision  decimal digits kept per coordinate
     * @return the simplified collection with only identifier and label properties
     */
    @PostMapping(path = "/simplify", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<GeoJsonFeatureCollection> simplify(@RequestBody GeoJsonFeatureCollection collection,
                                                             @RequestParam(required = false) Double tolerance,
                                                             @RequestParam(required = false) Integer precision) {
        SimplificationSettings settings = SimplificationSettings.from(config);
        if (tolerance != null) {
            settings = settings.withTolerance(tolerance);
        }
        if (precision != null) {
            settings = settings.withPrecision(precision);
        }
        logger.debug("Simplify request: {} features, tolerance {}, precision {}",
                     collection.getFeatures() == null ? 0 : collection.getFeatures().size(),
                     settings.tolerance(), settings.precision());

        ProcessedCollection processed = processor.process(collection, settings);
        SimplificationMetrics metrics = processed.metrics();
        return ResponseEntity.ok()
                .header("X-Feature-Count", String.valueOf(metrics.featuresOut()))
                .header("X-Coordinates-Before", String.valueOf(metrics.coordinatesBefore()))
                .header("X-Coordinates-After", String.valueOf(metrics.coordinatesAfter()))
                .header("X-Skipped-Features", String.valueOf(metrics.skippedFeatures().size()))
                .body(processed.collection());
    }
}
