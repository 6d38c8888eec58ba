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

import com.dedicatedcode.lindero.config.ErrorPolicy;
import com.dedicatedcode.lindero.config.LinderoConfiguration;

import java.util.Objects;

/**
 * Parameters of one simplification run. A single tolerance and precision are applied to every
 * ring of every feature.
 *
 * @param tolerance      Douglas-Peucker tolerance in coordinate units (degrees), must be positive
 * @param precision      decimal digits kept per coordinate, must not be negative
 * @param errorPolicy    whether a failed feature aborts the run or is skipped
 * @param validateOutput whether to count output geometries that JTS considers invalid
 */
public record SimplificationSettings(double tolerance, int precision, ErrorPolicy errorPolicy, boolean validateOutput) {

    public static final double DEFAULT_TOLERANCE = 0.008;
    public static final int DEFAULT_PRECISION = 3;

    public SimplificationSettings {
        if (!(tolerance > 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a positive number, got " + tolerance);
        }
        if (precision < 0) {
            throw new IllegalArgumentException("Precision must not be negative, got " + precision);
        }
        Objects.requireNonNull(errorPolicy, "errorPolicy");
    }

    public static SimplificationSettings defaults() {
        return new SimplificationSettings(DEFAULT_TOLERANCE, DEFAULT_PRECISION, ErrorPolicy.STRICT, true);
    }

    public static SimplificationSettings from(LinderoConfiguration config) {
        LinderoConfiguration.SimplifyConfiguration simplify = config.getSimplifyConfiguration();
        return new SimplificationSettings(simplify.getTolerance(),
                                          simplify.getPrecision(),
                                          simplify.getErrorPolicy(),
                                          simplify.isValidateOutput());
    }

    public SimplificationSettings withTolerance(double tolerance) {
        return new SimplificationSettings(tolerance, precision, errorPolicy, validateOutput);
    }

    public SimplificationSettings withPrecision(int precision) {
        return new SimplificationSettings(tolerance, precision, errorPolicy, validateOutput);
    }

    public SimplificationSettings withErrorPolicy(ErrorPolicy errorPolicy) {
        return new SimplificationSettings(tolerance, precision, errorPolicy, validateOutput);
    }
}
