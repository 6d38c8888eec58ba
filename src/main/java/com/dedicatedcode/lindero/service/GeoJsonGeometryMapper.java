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

import com.dedicatedcode.lindero.dto.GeoJsonGeometry;
import com.dedicatedcode.lindero.exception.MalformedGeometryException;
import com.dedicatedcode.lindero.model.BoundaryGeometry;
import com.dedicatedcode.lindero.model.BoundaryMultiPolygon;
import com.dedicatedcode.lindero.model.BoundaryPolygon;
import com.dedicatedcode.lindero.model.GeometryType;
import com.dedicatedcode.lindero.model.Ring;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts between GeoJSON geometries and boundary geometries.
 */
@Component
public class GeoJsonGeometryMapper {

    public BoundaryGeometry toModel(GeoJsonGeometry geometry) {
        if (geometry == null) {
            throw new MalformedGeometryException("Feature has no geometry");
        }
        GeometryType type = GeometryType.fromGeoJsonName(geometry.getType())
                .orElseThrow(() -> new MalformedGeometryException("Unsupported geometry type: " + geometry.getType()));
        if (geometry.getCoordinates() == null) {
            throw new MalformedGeometryException(type.getGeoJsonName() + " has no coordinates");
        }

        return switch (type) {
            case POLYGON -> readPolygon(geometry.getCoordinates(), "coordinates");
            case MULTI_POLYGON -> readMultiPolygon(geometry.getCoordinates());
        };
    }

    public GeoJsonGeometry toDto(BoundaryGeometry geometry) {
        return new GeoJsonGeometry(geometry.type().getGeoJsonName(), geometry.toCoordinateArray());
    }

    private BoundaryMultiPolygon readMultiPolygon(Object coordinates) {
        List<?> members = asList(coordinates, "coordinates");
        if (members.isEmpty()) {
            throw new MalformedGeometryException("MultiPolygon has no member polygons");
        }
        List<BoundaryPolygon> polygons = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            polygons.add(readPolygon(members.get(i), "coordinates[" + i + "]"));
        }
        return new BoundaryMultiPolygon(polygons);
    }

    private BoundaryPolygon readPolygon(Object coordinates, String path) {
        List<?> ringNodes = asList(coordinates, path);
        if (ringNodes.isEmpty()) {
            throw new MalformedGeometryException("Polygon at " + path + " has no rings");
        }
        List<Ring> rings = new ArrayList<>(ringNodes.size());
        for (int i = 0; i < ringNodes.size(); i++) {
            rings.add(readRing(ringNodes.get(i), path + "[" + i + "]"));
        }
        return new BoundaryPolygon(rings);
    }

    private Ring readRing(Object coordinates, String path) {
        List<?> pointNodes = asList(coordinates, path);
        List<Coordinate> points = new ArrayList<>(pointNodes.size());
        for (int i = 0; i < pointNodes.size(); i++) {
            points.add(readCoordinate(pointNodes.get(i), path + "[" + i + "]"));
        }
        return new Ring(points);
    }

    private Coordinate readCoordinate(Object node, String path) {
        List<?> pair = asList(node, path);
        if (pair.size() != 2) {
            throw new MalformedGeometryException("Expected a [longitude, latitude] pair at " + path + " but found " + pair.size() + " values");
        }
        return new Coordinate(readNumber(pair.get(0), path + "[0]"), readNumber(pair.get(1), path + "[1]"));
    }

    private double readNumber(Object node, String path) {
        if (!(node instanceof Number number)) {
            throw new MalformedGeometryException("Expected a number at " + path + " but found " + describe(node));
        }
        double value = number.doubleValue();
        if (!Double.isFinite(value)) {
            throw new MalformedGeometryException("Coordinate at " + path + " is not finite");
        }
        return value;
    }

    private List<?> asList(Object node, String path) {
        if (node instanceof List<?> list) {
            return list;
        }
        throw new MalformedGeometryException("Expected an array at " + path + " but found " + describe(node));
    }

    private String describe(Object node) {
        return node == null ? "null" : node.getClass().getSimpleName();
    }
}
