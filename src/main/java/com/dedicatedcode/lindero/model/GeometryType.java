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

import java.util.Arrays;
import java.util.Optional;

/**
 * Tag of the two geometry kinds a boundary may have, with the name used on the wire.
 */
public enum GeometryType {

    POLYGON("Polygon"),
    MULTI_POLYGON("MultiPolygon");

    private final String geoJsonName;

    GeometryType(String geoJsonName) {
        this.geoJsonName = geoJsonName;
    }

    public String getGeoJsonName() {
        return geoJsonName;
    }

    public static Optional<GeometryType> fromGeoJsonName(String name) {
        return Arrays.stream(values())
                .filter(type -> type.geoJsonName.equals(name))
                .findFirst();
    }
}
