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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Counters of one run. Each feature produces its own value and the values are merged at the
 * end, so nothing is shared between worker threads.
 */
public record SimplificationMetrics(int featuresIn,
                                    int featuresOut,
                                    long coordinatesBefore,
                                    long coordinatesAfter,
                                    int degenerateRings,
                                    int keptOriginalRings,
                                    int invalidGeometries,
                                    List<SkippedFeature> skippedFeatures) {

    private static final SimplificationMetrics EMPTY = new SimplificationMetrics(0, 0, 0, 0, 0, 0, 0, List.of());

    public SimplificationMetrics {
        skippedFeatures = List.copyOf(skippedFeatures);
    }

    public static SimplificationMetrics empty() {
        return EMPTY;
    }

    public static SimplificationMetrics processed(long coordinatesBefore,
                                                  long coordinatesAfter,
                                                  int degenerateRings,
                                                  int keptOriginalRings,
                                                  boolean invalid) {
        return new SimplificationMetrics(1, 1, coordinatesBefore, coordinatesAfter,
                                         degenerateRings, keptOriginalRings, invalid ? 1 : 0, List.of());
    }

    public static SimplificationMetrics skipped(SkippedFeature feature) {
        return new SimplificationMetrics(1, 0, 0, 0, 0, 0, 0, List.of(feature));
    }

    public SimplificationMetrics merge(SimplificationMetrics other) {
        List<SkippedFeature> skipped = new ArrayList<>(skippedFeatures.size() + other.skippedFeatures.size());
        skipped.addAll(skippedFeatures);
        skipped.addAll(other.skippedFeatures);
        skipped.sort(Comparator.comparingInt(SkippedFeature::index));
        return new SimplificationMetrics(featuresIn + other.featuresIn,
                                         featuresOut + other.featuresOut,
                                         coordinatesBefore + other.coordinatesBefore,
                                         coordinatesAfter + other.coordinatesAfter,
                                         degenerateRings + other.degenerateRings,
                                         keptOriginalRings + other.keptOriginalRings,
                                         invalidGeometries + other.invalidGeometries,
                                         skipped);
    }

    /**
     * @return share of coordinates removed, 0 when there was nothing to remove
     */
    public double reductionPercent() {
        if (coordinatesBefore == 0) {
            return 0;
        }
        return (1 - (double) coordinatesAfter / coordinatesBefore) * 100;
    }

    /**
     * A feature left out of the output in lenient mode.
     *
     * @param index      position in the input collection
     * @param identifier value of the identifier field, null if it could not be read
     * @param reason     error message
     */
    public record SkippedFeature(int index, String identifier, String reason) {
    }
}
