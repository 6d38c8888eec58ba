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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounds coordinates to a fixed number of decimal digits. Three digits are roughly 111 m of
 * latitude, plenty for a national choropleth map.
 */
public class CoordinateQuantizer {

    private final int precision;

    public CoordinateQuantizer(int precision) {
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must not be negative, got " + precision);
        }
        this.precision = precision;
    }

    public int getPrecision() {
        return precision;
    }

    public Ring quantize(Ring ring) {
        return ring.mapCoordinates(this::quantize);
    }

    public Coordinate quantize(Coordinate coordinate) {
        return new Coordinate(round(coordinate.x), round(coordinate.y));
    }

    /**
     * Half-even rounding of the exact binary value, so rounding an already rounded value is a no-op.
     * A value with no more than {@code precision} exact decimal digits is returned as is; a finite
     * double has at most 1074 of them.
     */
    double round(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        BigDecimal exact = new BigDecimal(value);
        if (exact.scale() <= precision) {
            return value;
        }
        return exact.setScale(precision, RoundingMode.HALF_EVEN).doubleValue();
    }
}
