package com.dedicatedcode.lindero;

import com.dedicatedcode.lindero.config.LinderoConfiguration;
import com.dedicatedcode.lindero.service.SimplificationJob;
import com.dedicatedcode.lindero.service.SimplificationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Path;

@SpringBootApplication
public class LinderoApplication implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(LinderoApplication.class);

    @Autowired
    private SimplificationJob simplificationJob;

    @Autowired
    private LinderoConfiguration config;

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LinderoApplication.class);

        // Check if this is batch mode
        boolean isBatchMode = false;
        for (String arg : args) {
            if ("--simplify".equals(arg)) {
                isBatchMode = true;
                break;
            }
        }

        if (isBatchMode) {
            logger.info("Starting in batch mode");
            app.setWebApplicationType(WebApplicationType.NONE);
            System.setProperty("lindero.batch-mode", "true");
        } else {
            logger.info("Starting in API server mode");
            System.setProperty("lindero.batch-mode", "false");
        }
        app.run(args);
    }

    private void printApiInfo() {
        logger.info("LINDERO is now serving the following endpoints:");
        logger.info("  Health Check:  GET   /api/v1/health");
        logger.info("  Simplify:      POST  /api/v1/simplify");
        logger.info("  Simplify (with parameters): POST /api/v1/simplify?tolerance=0.01&precision=4");
        logger.info("");
        logger.info("Sample request:");
        logger.info("  curl -X POST -H 'Content-Type: application/json' --data @municipios.json 'http://localhost:8080/api/v1/simplify'");
        logger.info("");
    }

    /**
     * Configured settings with the command line overrides applied.
     *
     * @throws IllegalArgumentException if an override is not a number or out of range
     */
    static SimplificationSettings batchSettings(LinderoConfiguration config, String tolerance, String precision) {
        SimplificationSettings settings = SimplificationSettings.from(config);
        if (tolerance != null) {
            settings = settings.withTolerance(Double.parseDouble(tolerance));
        }
        if (precision != null) {
            settings = settings.withPrecision(Integer.parseInt(precision));
        }
        return settings;
    }

    @Override
    public void run(String... args) throws Exception {
        boolean isBatchMode = false;
        String input = null;
        String output = null;
        String tolerance = null;
        String precision = null;

        for (int i = 0; i < args.length; i++) {
            if ("--simplify".equals(args[i])) {
                isBatchMode = true;
            } else if ("--input".equals(args[i]) && i + 1 < args.length) {
                input = args[i + 1];
            } else if ("--output".equals(args[i]) && i + 1 < args.length) {
                output = args[i + 1];
            } else if ("--tolerance".equals(args[i]) && i + 1 < args.length) {
                tolerance = args[i + 1];
            } else if ("--precision".equals(args[i]) && i + 1 < args.length) {
                precision = args[i + 1];
            }
        }

        if (isBatchMode) {
            if (input == null || output == null) {
                logger.error("Batch mode requires --input and --output arguments");
                System.exit(1);
            }

            try {
                simplificationJob.run(Path.of(input), Path.of(output), batchSettings(config, tolerance, precision));
                System.exit(0);
            } catch (Exception e) {
                logger.error("Simplification failed", e);
                System.exit(1);
            }
        } else {
            printApiInfo();
        }
    }
}
