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
import com.dedicatedcode.lindero.model.BoundaryMultiPolygon;
import com.dedicatedcode.lindero.model.BoundaryPolygon;
import com.dedicatedcode.lindero.model.GeometryType;
import com.dedicatedcode.lindero.model.Ring;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeometrySimplificationServiceTest {

    private final GeometrySimplificationService service = new GeometrySimplificationService();

    @Test
    void testSimplifyWithDefaultSettings() {
        BoundaryGeometry polygon = createTestPolygon();

        BoundaryGeometry simplified = service.simplify(polygon, SimplificationSettings.DEFAULT_TOLERANCE, SimplificationSettings.DEFAULT_PRECISION);

        assertNotNull(simplified);
        assertTrue(service.isValid(simplified));
        // Simplified geometry should have same or fewer coordinates
        assertTrue(simplified.coordinateCount() <= polygon.coordinateCount());
    }

    @Test
    void testSimplifyWithCoarseTolerance() {
        BoundaryGeometry polygon = createTestPolygon();

        BoundaryGeometry simplified = service.simplify(polygon, 0.2, 3);

        assertEquals(GeometryType.POLYGON, simplified.type());
        assertTrue(service.isValid(simplified));
        assertTrue(simplified.coordinateCount() < polygon.coordinateCount());
    }

    @Test
    void testPolygonKeepsOuterRingAndHoles() {
        BoundaryPolygon polygon = BoundaryPolygon.of(
                ring(0, 0, 0, 10, 0.001, 15, 0, 20, 20, 20, 20, 0, 0, 0),
                ring(5, 5, 5, 7, 7, 7, 7, 5, 5, 5),
                ring(12, 12, 12, 14, 14, 14, 14, 12, 12, 12));

        BoundaryPolygon simplified = (BoundaryPolygon) service.simplify(polygon, 0.01, 3);

        assertEquals(3, simplified.rings().size());
        assertEquals(ring(0, 0, 0, 20, 20, 20, 20, 0, 0, 0), simplified.outer());
        assertEquals(polygon.holes(), simplified.holes());
        assertTrue(service.isValid(simplified));
    }

    @Test
    void testMultiPolygonKeepsMemberCount() {
        BoundaryPolygon mainland = BoundaryPolygon.of(ring(0, 0, 0, 5.001, 0, 10, 10, 10, 10, 0, 0, 0));
        BoundaryPolygon island = BoundaryPolygon.of(ring(20, 0, 20, 2.5001, 20, 5, 25, 5, 25, 0, 20, 0));
        BoundaryMultiPolygon multiPolygon = new BoundaryMultiPolygon(List.of(mainland, island));

        GeometrySimplificationService.SimplifiedGeometry result = service.simplifyWithStatistics(multiPolygon, 0.01, 3);

        BoundaryMultiPolygon simplified = (BoundaryMultiPolygon) result.geometry();
        assertEquals(GeometryType.MULTI_POLYGON, simplified.type());
        assertEquals(2, simplified.polygons().size());
        assertEquals(ring(0, 0, 0, 10, 10, 10, 10, 0, 0, 0), simplified.polygons().get(0).outer());
        assertEquals(ring(20, 0, 20, 5, 25, 5, 25, 0, 20, 0), simplified.polygons().get(1).outer());
        assertEquals(0, result.keptOriginalRings());
        assertEquals(0, result.degenerateRings());
    }

    @Test
    void testRoundingHappensAfterSimplification() {
        // 0.0104 away from the chord: kept at tolerance 0.01, but rounded first it would be exactly 0.01 and dropped
        BoundaryPolygon polygon = BoundaryPolygon.of(ring(0, 0, 5, 0.0104, 10, 0, 10, 10, 0, 10, 0, 0));

        BoundaryPolygon simplified = (BoundaryPolygon) service.simplify(polygon, 0.01, 2);

        assertEquals(ring(0, 0, 5, 0.01, 10, 0, 10, 10, 0, 10, 0, 0), simplified.outer());
    }

    @Test
    void testCollapsedRingKeepsOriginalPoints() {
        BoundaryPolygon polygon = BoundaryPolygon.of(
                ring(0, 0, 0, 100, 100, 100, 100, 0, 0, 0),
                ring(10.00012, 10.00049, 10.5, 11, 11, 10, 10.00012, 10.00049));

        GeometrySimplificationService.SimplifiedGeometry result = service.simplifyWithStatistics(polygon, 5, 3);

        BoundaryPolygon simplified = (BoundaryPolygon) result.geometry();
        assertEquals(1, result.keptOriginalRings());
        assertEquals(0, result.degenerateRings());
        // the original hole is kept, then rounded like everything else
        assertEquals(ring(10, 10, 10.5, 11, 11, 10, 10, 10), simplified.holes().get(0));
    }

    @Test
    void testDegenerateRingIsCountedAndPassedThrough() {
        BoundaryPolygon polygon = BoundaryPolygon.of(
                ring(0, 0, 0, 10, 10, 10, 10, 0, 0, 0),
                ring(2, 2, 3, 3, 2, 2));

        GeometrySimplificationService.SimplifiedGeometry result = service.simplifyWithStatistics(polygon, 1, 3);

        BoundaryPolygon simplified = (BoundaryPolygon) result.geometry();
        assertEquals(1, result.degenerateRings());
        assertEquals(1, result.keptOriginalRings());
        assertEquals(ring(2, 2, 3, 3, 2, 2), simplified.holes().get(0));
        assertFalse(service.isValid(simplified));
    }

    @Test
    void testInputIsNotModified() {
        BoundaryGeometry polygon = createTestPolygon();
        List<Coordinate> before = new ArrayList<>(((BoundaryPolygon) polygon).outer().points());

        service.simplify(polygon, 0.5, 0);

        assertEquals(before, ((BoundaryPolygon) polygon).outer().points());
    }

    @Test
    void testSelfIntersectingOutputIsReportedInvalid() {
        BoundaryPolygon bowTie = BoundaryPolygon.of(ring(0, 0, 10, 10, 10, 0, 0, 10, 0, 0));

        assertFalse(service.isValid(bowTie));
    }

    private BoundaryGeometry createTestPolygon() {
        // Create a simple polygon with multiple coordinates
        return BoundaryPolygon.of(ring(
                0, 0,
                1, 0,
                1.5, 0.1,
                2, 0,
                2, 1,
                1.9, 1.1,
                1, 1,
                0, 1,
                0, 0 // Close the ring
        ));
    }

    static Ring ring(double... xy) {
        List<Coordinate> points = new ArrayList<>();
        for (int i = 0; i < xy.length; i += 2) {
            points.add(new Coordinate(xy[i], xy[i + 1]));
        }
        return new Ring(points);
    }
}
