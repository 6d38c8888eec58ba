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

import com.dedicatedcode.lindero.dto.GeoJsonFeatureCollection;
import com.dedicatedcode.lindero.exception.SimplificationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a GeoJSON file, simplifies it and writes the result as compact JSON for embedding
 * into the map page.
 */
@Service
public class SimplificationJob {

    private static final Logger logger = LoggerFactory.getLogger(SimplificationJob.class);

    private final FeatureCollectionProcessor processor;
    private final ObjectMapper objectMapper;

    public SimplificationJob(FeatureCollectionProcessor processor, ObjectMapper objectMapper) {
        this.processor = processor;
        this.objectMapper = objectMapper;
    }

    public SimplificationMetrics run(Path input, Path output, SimplificationSettings settings) throws IOException {
        long startTime = System.currentTimeMillis();
        SimplificationReport report = new SimplificationReport();
        report.printHeader(input, output, settings);

        try {
            GeoJsonFeatureCollection collection = read(input);
            logger.info("Loaded {} features from {}", collection.getFeatures() == null ? 0 : collection.getFeatures().size(), input);

            ProcessedCollection processed = processor.process(collection, settings);
            byte[] json = objectMapper.writeValueAsBytes(processed.collection());

            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(output, json);
            logger.info("Wrote {} ({} MB)", output, String.format("%.1f", json.length / 1e6));

            report.printFinalStatistics(processed.metrics(), json.length, System.currentTimeMillis() - startTime);
            return processed.metrics();
        } catch (SimplificationException | IOException e) {
            report.printError("SIMPLIFICATION FAILED: " + e.getMessage());
            throw e;
        }
    }

    private GeoJsonFeatureCollection read(Path input) throws IOException {
        try {
            return objectMapper.readValue(input.toFile(), GeoJsonFeatureCollection.class);
        } catch (JsonProcessingException e) {
            throw new SimplificationException("Could not parse " + input + " as GeoJSON: " + e.getOriginalMessage(), e);
        }
    }
}
