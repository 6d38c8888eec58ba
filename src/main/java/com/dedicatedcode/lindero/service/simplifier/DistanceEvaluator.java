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

import org.locationtech.jts.geom.Coordinate;

/**
 * Planar distance from a point to a line segment, in coordinate units. The projection formula is
 * kept as is rather than JTS {@code Distance.pointToSegment}, whose different arithmetic can flip
 * results for points lying exactly at the tolerance.
 */
public class DistanceEvaluator {

    /**
     * Returns the distance from {@code point} to the closest point on the segment
     * {@code [segmentStart, segmentEnd]}. A zero length segment degenerates to the
     * distance between the two points.
     *
     * @param point        the point to measure
     * @param segmentStart first end of the segment
     * @param segmentEnd   second end of the segment
     * @return non-negative distance
     */
    public double distance(Coordinate point, Coordinate segmentStart, Coordinate segmentEnd) {
        if (segmentStart.equals2D(segmentEnd)) {
            return point.distance(segmentStart);
        }

        double dx = segmentEnd.x - segmentStart.x;
        double dy = segmentEnd.y - segmentStart.y;
        double t = ((point.x - segmentStart.x) * dx + (point.y - segmentStart.y) * dy) / (dx * dx + dy * dy);
        // clamp to the segment, not the infinite line through it
        t = Math.max(0, Math.min(1, t));

        double projectedX = segmentStart.x + t * dx;
        double projectedY = segmentStart.y + t * dy;
        return Math.sqrt((point.x - projectedX) * (point.x - projectedX) + (point.y - projectedY) * (point.y - projectedY));
    }
}
