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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimplificationReportTest {

    private final SimplificationReport report = new SimplificationReport();

    @Test
    void testOutputSizeInMegabytes() {
        assertEquals("0.7 MB", report.formatMegabytes(712_345));
        assertEquals("19.0 MB", report.formatMegabytes(19_000_000));
        assertEquals("0.0 MB", report.formatMegabytes(0));
    }

    @Test
    void testCountsUseGroupingSeparators() {
        assertEquals("508,924", report.formatCount(508_924));
        assertEquals("42", report.formatCount(42));
    }

    @Test
    void testTimeInSeconds() {
        assertEquals("1.5 s", report.formatTime(1_500));
        assertEquals("0.0 s", report.formatTime(0));
    }

    @Test
    void testBannerCentersTitle() {
        String banner = report.banner("DONE", '=', "");

        String[] lines = banner.split("\n");
        assertEquals(4, lines.length);
        assertEquals("=".repeat(80), lines[1]);
        assertEquals(" ".repeat(38) + "DONE", lines[2]);
        assertTrue(lines[3].startsWith("=".repeat(80)));
    }
}
