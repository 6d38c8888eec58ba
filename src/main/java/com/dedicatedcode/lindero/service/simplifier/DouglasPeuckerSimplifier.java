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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Douglas-Peucker reduction of an ordered coordinate sequence.
 * <p>
 * The divide and conquer runs on an explicit stack of index ranges, so rings with tens of
 * thousands of vertices do not exhaust the call stack. The result is always a subsequence of
 * the input that keeps the first and the last point.
 */
public class DouglasPeuckerSimplifier {

    private final DistanceEvaluator distanceEvaluator;

    public DouglasPeuckerSimplifier() {
        this(new DistanceEvaluator());
    }

    public DouglasPeuckerSimplifier(DistanceEvaluator distanceEvaluator) {
        this.distanceEvaluator = distanceEvaluator;
    }

    /**
     * Simplify {@code points} so that no discarded point lies further than {@code tolerance}
     * from the retained chord that replaced it.
     *
     * @param points    ordered input, not modified
     * @param tolerance maximum allowed deviation in coordinate units
     * @return the retained points in input order
     */
    public List<Coordinate> simplify(List<Coordinate> points, double tolerance) {
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("Tolerance must be a finite non-negative number, got " + tolerance);
        }
        int size = points.size();
        if (size <= 2) {
            return points;
        }

        boolean[] keep = new boolean[size];
        keep[0] = true;
        keep[size - 1] = true;

        Deque<int[]> ranges = new ArrayDeque<>();
        ranges.push(new int[]{0, size - 1});
        while (!ranges.isEmpty()) {
            int[] range = ranges.pop();
            int first = range[0];
            int last = range[1];
            if (last - first < 2) {
                continue;
            }

            Coordinate start = points.get(first);
            Coordinate end = points.get(last);
            double maxDistance = 0;
            int maxIndex = first;
            for (int i = first + 1; i < last; i++) {
                double distance = distanceEvaluator.distance(points.get(i), start, end);
                if (distance > maxDistance) {
                    maxIndex = i;
                    maxDistance = distance;
                }
            }

            if (maxDistance > tolerance) {
                keep[maxIndex] = true;
                ranges.push(new int[]{maxIndex, last});
                ranges.push(new int[]{first, maxIndex});
            }
        }

        List<Coordinate> result = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (keep[i]) {
                result.add(points.get(i));
            }
        }
        return result;
    }
}
