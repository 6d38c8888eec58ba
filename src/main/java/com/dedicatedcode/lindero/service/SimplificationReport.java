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

import java.nio.file.Path;
import java.util.Locale;

/**
 * Console output of a batch run.
 */
class SimplificationReport {

    private static final int WIDTH = 80;
    private static final String HEADER = "\033[1;36m";
    private static final String FAILURE = "\033[1;31m";
    private static final String RESET = "\033[0m";

    void printHeader(Path input, Path output, SimplificationSettings settings) {
        System.out.println(banner("BOUNDARY SIMPLIFICATION", '═', HEADER));
        System.out.println("Input:        " + input.toAbsolutePath());
        System.out.println("Output:       " + output.toAbsolutePath());
        System.out.println("Tolerance:    " + settings.tolerance() + "°");
        System.out.println("Precision:    " + settings.precision() + " decimals");
        System.out.println("Error policy: " + settings.errorPolicy());
    }

    void printFinalStatistics(SimplificationMetrics metrics, long outputBytes, long totalTime) {
        System.out.println(banner("FINAL SIMPLIFICATION STATISTICS", '═', HEADER));

        System.out.printf("\n\033[1;37m⏱️  Total Time:\033[0m \033[1;33m%s\033[0m%n%n", formatTime(totalTime));

        System.out.println("\033[1;37m📊 Processing Summary:\033[0m");
        System.out.println("┌──────────────────────┬─────────────────┐");
        System.out.println("│ \033[1mMetric\033[0m               │ \033[1mValue\033[0m           │");
        System.out.println("├──────────────────────┼─────────────────┤");
        System.out.printf("│ \033[32mFeatures in\033[0m          │ %15s │%n", formatCount(metrics.featuresIn()));
        System.out.printf("│ \033[32mFeatures out\033[0m         │ %15s │%n", formatCount(metrics.featuresOut()));
        System.out.printf("│ \033[31mFeatures skipped\033[0m     │ %15s │%n", formatCount(metrics.skippedFeatures().size()));
        System.out.printf("│ \033[34mCoordinates before\033[0m   │ %15s │%n", formatCount(metrics.coordinatesBefore()));
        System.out.printf("│ \033[34mCoordinates after\033[0m    │ %15s │%n", formatCount(metrics.coordinatesAfter()));
        System.out.printf(Locale.ROOT, "│ \033[35mReduction\033[0m            │ %14.1f%% │%n", metrics.reductionPercent());
        System.out.printf("│ \033[33mRings kept original\033[0m  │ %15s │%n", formatCount(metrics.keptOriginalRings()));
        System.out.printf("│ \033[33mDegenerate rings\033[0m     │ %15s │%n", formatCount(metrics.degenerateRings()));
        System.out.printf("│ \033[33mInvalid geometries\033[0m   │ %15s │%n", formatCount(metrics.invalidGeometries()));
        System.out.println("└──────────────────────┴─────────────────┘");

        System.out.println("\n\033[1;37m📦 Output Size:\033[0m " + formatMegabytes(outputBytes));

        if (!metrics.skippedFeatures().isEmpty()) {
            System.out.println("\n\033[1;31mSkipped features:\033[0m");
            for (SimplificationMetrics.SkippedFeature skipped : metrics.skippedFeatures()) {
                System.out.printf("  • #%d %s: %s%n", skipped.index(),
                                  skipped.identifier() == null ? "(no identifier)" : skipped.identifier(),
                                  skipped.reason());
            }
        }
        System.out.println();
    }

    void printError(String message) {
        System.out.println(banner(message, '=', FAILURE));
    }

    String formatTime(long ms) {
        return String.format(Locale.ROOT, "%.1f s", ms / 1000.0);
    }

    String formatCount(long n) {
        return String.format(Locale.ROOT, "%,d", n);
    }

    String formatMegabytes(long bytes) {
        return String.format(Locale.ROOT, "%.1f MB", bytes / 1e6);
    }

    String banner(String title, char rule, String color) {
        String line = String.valueOf(rule).repeat(WIDTH);
        String indent = " ".repeat(Math.max(0, (WIDTH - title.length()) / 2));
        return "\n" + color + line + "\n" + indent + title + "\n" + line + RESET;
    }
}
