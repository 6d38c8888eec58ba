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

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import static org.junit.jupiter.api.Assertions.*;

class DistanceEvaluatorTest {

    private final DistanceEvaluator evaluator = new DistanceEvaluator();

    @Test
    void testDegenerateSegmentUsesPointDistance() {
        Coordinate point = new Coordinate(3, 4);
        Coordinate a = new Coordinate(0, 0);

        assertEquals(5.0, evaluator.distance(point, a, a), 1e-12);
        assertEquals(point.distance(a), evaluator.distance(point, a, new Coordinate(0, 0)));
    }

    @Test
    void testPerpendicularDistanceInsideSegment() {
        double distance = evaluator.distance(new Coordinate(5, 3), new Coordinate(0, 0), new Coordinate(10, 0));
        assertEquals(3.0, distance, 1e-12);
    }

    @Test
    void testProjectionClampedToSegmentEnds() {
        Coordinate start = new Coordinate(0, 0);
        Coordinate end = new Coordinate(10, 0);

        // the infinite line would give 4 in both cases
        assertEquals(5.0, evaluator.distance(new Coordinate(-3, 4), start, end), 1e-12);
        assertEquals(5.0, evaluator.distance(new Coordinate(13, 4), start, end), 1e-12);
    }

    @Test
    void testPointOnSegment() {
        assertEquals(0.0, evaluator.distance(new Coordinate(2, 2), new Coordinate(0, 0), new Coordinate(4, 4)), 1e-12);
    }

    @Test
    void testIndependentOfSegmentDirection() {
        Coordinate point = new Coordinate(1.5, -2.25);
        Coordinate a = new Coordinate(-1, 0.5);
        Coordinate b = new Coordinate(4, 3);

        assertEquals(evaluator.distance(point, a, b), evaluator.distance(point, b, a), 1e-12);
        assertTrue(evaluator.distance(point, a, b) >= 0);
    }
}
