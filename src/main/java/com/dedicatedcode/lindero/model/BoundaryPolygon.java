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
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Outer boundary at index 0 followed by the holes.
 */
public record BoundaryPolygon(List<Ring> rings) implements BoundaryGeometry {

    public BoundaryPolygon {
        if (rings.isEmpty()) {
            throw new IllegalArgumentException("A polygon needs at least an outer ring");
        }
        rings = List.copyOf(rings);
    }

    public static BoundaryPolygon of(Ring outer, Ring... holes) {
        List<Ring> rings = new ArrayList<>();
        rings.add(outer);
        rings.addAll(List.of(holes));
        return new BoundaryPolygon(rings);
    }

    public Ring outer() {
        return rings.get(0);
    }

    public List<Ring> holes() {
        return rings.subList(1, rings.size());
    }

    @Override
    public GeometryType type() {
        return GeometryType.POLYGON;
    }

    @Override
    public BoundaryPolygon mapRings(UnaryOperator<Ring> mapper) {
        return new BoundaryPolygon(rings.stream().map(mapper).toList());
    }

    @Override
    public int coordinateCount() {
        return rings.stream().mapToInt(Ring::size).sum();
    }

    @Override
    public boolean hasValidRings() {
        return rings.stream().allMatch(Ring::isValidBoundary);
    }

    @Override
    public double[][][] toCoordinateArray() {
        return rings.stream().map(Ring::toCoordinateArray).toArray(double[][][]::new);
    }

    @Override
    public Polygon toJts(GeometryFactory factory) {
        LinearRing[] holes = holes().stream()
                .map(ring -> ring.toJts(factory))
                .toArray(LinearRing[]::new);
        return factory.createPolygon(outer().toJts(factory), holes);
    }
}
