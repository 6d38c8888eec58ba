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

import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.function.UnaryOperator;

/**
 * Geometry of an administrative boundary. Only polygons and multipolygons are supported,
 * anything else is rejected while reading.
 */
public sealed interface BoundaryGeometry permits BoundaryPolygon, BoundaryMultiPolygon {

    GeometryType type();

    /**
     * Applies {@code mapper} to every ring, keeping the ring and polygon counts.
     */
    BoundaryGeometry mapRings(UnaryOperator<Ring> mapper);

    /**
     * @return number of coordinate pairs over all rings
     */
    int coordinateCount();

    /**
     * @return true if every ring is closed and has at least {@link Ring#MIN_SIZE} points
     */
    boolean hasValidRings();

    /**
     * Nested {@code double} arrays in GeoJSON order, three levels deep for a polygon and four for
     * a multipolygon.
     */
    Object toCoordinateArray();

    /**
     * Builds the JTS representation. Callers must check {@link #hasValidRings()} first,
     * JTS refuses to build rings that are open or too short.
     */
    Geometry toJts(GeometryFactory factory);
}
