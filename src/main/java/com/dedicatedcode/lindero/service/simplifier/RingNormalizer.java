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

package com.dedicatedcode.lindero.service.simplifier;

import com.dedicatedcode.lindero.model.Ring;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

/**
 * Simplifies a single ring without ever returning one below {@link Ring#MIN_SIZE} points.
 */
public class RingNormalizer {

    private final DouglasPeuckerSimplifier simplifier;

    public RingNormalizer() {
        this(new DouglasPeuckerSimplifier());
    }

    public RingNormalizer(DouglasPeuckerSimplifier simplifier) {
        this.simplifier = simplifier;
    }

    public Ring normalize(Ring ring, double tolerance) {
        return normalizeRing(ring, tolerance).ring();
    }

    /**
     * Like {@link #normalize(Ring, double)} but also tells whether the original ring was kept
     * because the simplified one would have been too short. There is no second attempt with a
     * smaller tolerance.
     */
    public NormalizedRing normalizeRing(Ring ring, double tolerance) {
        List<Coordinate> simplified = simplifier.simplify(ring.points(), tolerance);
        if (simplified.size() < Ring.MIN_SIZE) {
            return new NormalizedRing(ring, true);
        }
        return new NormalizedRing(new Ring(simplified), false);
    }

    public record NormalizedRing(Ring ring, boolean keptOriginal) {
    }
}
