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

package com.dedicatedcode.lindero.exception;

/**
 * Thrown when a geometry is not a Polygon or MultiPolygon, or its coordinate arrays do not
 * nest down to pairs of numbers.
 */
public class MalformedGeometryException extends SimplificationException {

    private static final long serialVersionUID = 1L;

    public MalformedGeometryException(String message) {
        super(message);
    }
}
