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

import com.dedicatedcode.lindero.model.BoundaryGeometry;
import com.dedicatedcode.lindero.model.Ring;
import com.dedicatedcode.lindero.service.simplifier.CoordinateQuantizer;
import com.dedicatedcode.lindero.service.simplifier.RingNormalizer;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.stereotype.Service;

/**
 * Service for geometry simplification using Douglas-Peucker algorithm.
 * Every ring of a polygon or multipolygon is simplified on its own, then all coordinates are
 * rounded to the requested precision. Polygon and ring counts never change.
 */
@Service
public class GeometrySimplificationService {

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    private final RingNormalizer ringNormalizer;

    public GeometrySimplificationService() {
        this(new RingNormalizer());
    }

    public GeometrySimplificationService(RingNormalizer ringNormalizer) {
        this.ringNormalizer = ringNormalizer;
    }

    /**
     * Simplify geometry with the given tolerance and round the result.
     *
     * @param geometry  Input geometry to simplify, not modified
     * @param tolerance Tolerance in degrees (not meters)
     * @param precision Decimal digits kept per coordinate
     * @return Simplified geometry of the same type
     */
    public BoundaryGeometry simplify(BoundaryGeometry geometry, double tolerance, int precision) {
        return simplifyWithStatistics(geometry, tolerance, precision).geometry();
    }

    /**
     * Same as {@link #simplify(BoundaryGeometry, double, int)}, additionally counting the rings
     * that were already degenerate and the rings that kept their original points.
     */
    public SimplifiedGeometry simplifyWithStatistics(BoundaryGeometry geometry, double tolerance, int precision) {
        CoordinateQuantizer quantizer = new CoordinateQuantizer(precision);
        RingTally tally = new RingTally();

        BoundaryGeometry simplified = geometry.mapRings(ring -> {
            if (!ring.isValidBoundary()) {
                tally.degenerate++;
            }
            RingNormalizer.NormalizedRing normalized = ringNormalizer.normalizeRing(ring, tolerance);
            if (normalized.keptOriginal()) {
                tally.keptOriginal++;
            }
            return normalized.ring();
        });

        // distances are measured on the unrounded points
        BoundaryGeometry rounded = simplified.mapRings(quantizer::quantize);
        return new SimplifiedGeometry(rounded, tally.degenerate, tally.keptOriginal);
    }

    /**
     * Check the geometry with JTS. Rings that are open or shorter than {@link Ring#MIN_SIZE}
     * points make the geometry invalid without asking JTS.
     */
    public boolean isValid(BoundaryGeometry geometry) {
        return geometry.hasValidRings() && geometry.toJts(GEOMETRY_FACTORY).isValid();
    }

    /**
     * @param geometry          simplified and rounded geometry
     * @param degenerateRings   input rings that were open or had fewer than four points
     * @param keptOriginalRings rings returned unsimplified because simplification left too few points
     */
    public record SimplifiedGeometry(BoundaryGeometry geometry, int degenerateRings, int keptOriginalRings) {
    }

    private static final class RingTally {
        private int degenerate;
        private int keptOriginal;
    }
}
