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
 * Aborts a strict run. Carries the position of the failed feature in the input collection and
 * its identifier when that could be read.
 */
public class FeatureProcessingException extends SimplificationException {

    private static final long serialVersionUID = 1L;

    private final int featureIndex;
    private final String identifier;

    public FeatureProcessingException(int featureIndex, String identifier, SimplificationException cause) {
        super(String.format("Feature #%d (%s) could not be processed: %s",
                            featureIndex, identifier == null ? "no identifier" : identifier, cause.getMessage()), cause);
        this.featureIndex = featureIndex;
        this.identifier = identifier;
    }

    public int getFeatureIndex() {
        return featureIndex;
    }

    public String getIdentifier() {
        return identifier;
    }
}
