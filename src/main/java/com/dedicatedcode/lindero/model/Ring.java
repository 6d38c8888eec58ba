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

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Closed sequence of coordinates bounding a polygon or one of its holes.
 * x is the longitude, y the latitude.
 */
public record Ring(List<Coordinate> points) {

    /**
     * A triangle plus the closing point.
     */
    public static final int MIN_SIZE = 4;

    public Ring {
        points = List.copyOf(points);
    }

    public static Ring of(Coordinate... points) {
        return new Ring(List.of(points));
    }

    public int size() {
        return points.size();
    }

    public boolean isClosed() {
        return !points.isEmpty() && points.get(0).equals2D(points.get(points.size() - 1));
    }

    /**
     * @return true if the ring is closed and has at least {@link #MIN_SIZE} points
     */
    public boolean isValidBoundary() {
        return CoordinateArrays.isRing(points.toArray(new Coordinate[0]));
    }

    public Ring mapCoordinates(UnaryOperator<Coordinate> mapper) {
        return new Ring(points.stream().map(mapper).toList());
    }

    /**
     * @return {@code [[x, y], ...]} in ring order
     */
    public double[][] toCoordinateArray() {
        double[][] array = new double[points.size()][];
        for (int i = 0; i < points.size(); i++) {
            array[i] = new double[]{points.get(i).x, points.get(i).y};
        }
        return array;
    }

    LinearRing toJts(GeometryFactory factory) {
        return factory.createLinearRing(points.toArray(new Coordinate[0]));
    }
}
