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

package com.dedicatedcode.lindero.model;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundaryGeometryTest {

    @Test
    void testRingBoundaryChecks() {
        assertTrue(ring(0, 0, 0, 1, 1, 1, 0, 0).isValidBoundary());
        assertFalse(ring(0, 0, 0, 1, 1, 1, 1, 0).isValidBoundary());
        assertFalse(ring(0, 0, 1, 1, 0, 0).isValidBoundary());
        assertTrue(ring(0, 0, 1, 1, 0, 0).isClosed());
    }

    @Test
    void testPolygonNeedsOuterRing() {
        assertThrows(IllegalArgumentException.class, () -> new BoundaryPolygon(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new BoundaryMultiPolygon(List.of()));
    }

    @Test
    void testMapRingsKeepsStructure() {
        BoundaryPolygon polygon = BoundaryPolygon.of(ring(0, 0, 0, 4, 4, 4, 4, 0, 0, 0), ring(1, 1, 1, 2, 2, 2, 1, 1));
        BoundaryMultiPolygon multiPolygon = new BoundaryMultiPolygon(List.of(polygon, polygon));

        BoundaryMultiPolygon shifted = multiPolygon.mapRings(r -> r.mapCoordinates(c -> new Coordinate(c.x + 10, c.y)));

        assertEquals(GeometryType.MULTI_POLYGON, shifted.type());
        assertEquals(18, shifted.coordinateCount());
        assertEquals(2, shifted.polygons().get(1).rings().size());
        assertEquals(new Coordinate(11, 1), shifted.polygons().get(0).holes().get(0).points().get(0));
    }

    @Test
    void testToJts() {
        BoundaryPolygon polygon = BoundaryPolygon.of(ring(0, 0, 0, 4, 4, 4, 4, 0, 0, 0), ring(1, 1, 1, 2, 2, 2, 1, 1));
        BoundaryPolygon other = BoundaryPolygon.of(ring(10, 0, 10, 1, 11, 1, 10, 0));

        MultiPolygon jts = new BoundaryMultiPolygon(List.of(polygon, other)).toJts(new GeometryFactory());

        assertEquals(2, jts.getNumGeometries());
        assertTrue(jts.isValid());
        assertEquals(15.5, jts.getArea(), 1e-9);
    }

    @Test
    void testGeoJsonNames() {
        assertEquals(GeometryType.POLYGON, GeometryType.fromGeoJsonName("Polygon").orElseThrow());
        assertEquals(GeometryType.MULTI_POLYGON, GeometryType.fromGeoJsonName("MultiPolygon").orElseThrow());
        assertTrue(GeometryType.fromGeoJsonName("polygon").isEmpty());
        assertTrue(GeometryType.fromGeoJsonName(null).isEmpty());
    }

    private static Ring ring(double... xy) {
        Coordinate[] points = new Coordinate[xy.length / 2];
        for (int i = 0; i < points.length; i++) {
            points[i] = new Coordinate(xy[2 * i], xy[2 * i + 1]);
        }
        return Ring.of(points);
    }
}
