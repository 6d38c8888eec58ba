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
 * Base class of all errors raised while simplifying a feature collection. These are
 * deterministic for a given input, retrying never helps.
 */
public class SimplificationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SimplificationException(String message) {
        super(message);
    }

    public SimplificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
