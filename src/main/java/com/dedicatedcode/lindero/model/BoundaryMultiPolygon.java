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

import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Boundary made of several disjoint parts, e.g. a municipality with islands.
 */
public record BoundaryMultiPolygon(List<BoundaryPolygon> polygons) implements BoundaryGeometry {

    public BoundaryMultiPolygon {
        if (polygons.isEmpty()) {
            throw new IllegalArgumentException("A multipolygon needs at least one member polygon");
        }
        polygons = List.copyOf(polygons);
    }

    @Override
    public GeometryType type() {
        return GeometryType.MULTI_POLYGON;
    }

    @Override
    public BoundaryMultiPolygon mapRings(UnaryOperator<Ring> mapper) {
        return new BoundaryMultiPolygon(polygons.stream().map(polygon -> polygon.mapRings(mapper)).toList());
    }

    @Override
    public int coordinateCount() {
        return polygons.stream().mapToInt(BoundaryPolygon::coordinateCount).sum();
    }

    @Override
    public boolean hasValidRings() {
        return polygons.stream().allMatch(BoundaryPolygon::hasValidRings);
    }

    @Override
    public double[][][][] toCoordinateArray() {
        return polygons.stream().map(BoundaryPolygon::toCoordinateArray).toArray(double[][][][]::new);
    }

    @Override
    public MultiPolygon toJts(GeometryFactory factory) {
        Polygon[] members = polygons.stream()
                .map(polygon -> polygon.toJts(factory))
                .toArray(Polygon[]::new);
        return factory.createMultiPolygon(members);
    }
}
