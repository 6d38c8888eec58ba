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

package com.dedicatedcode.lindero.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.Name;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "lindero")
public class LinderoConfiguration {

    @Name("simplify")
    private SimplifyConfiguration simplifyConfiguration = new SimplifyConfiguration();
    @Name("properties")
    private PropertiesConfiguration propertiesConfiguration = new PropertiesConfiguration();

    public SimplifyConfiguration getSimplifyConfiguration() {
        return simplifyConfiguration;
    }

    public void setSimplifyConfiguration(SimplifyConfiguration simplifyConfiguration) {
        this.simplifyConfiguration = simplifyConfiguration;
    }

    public PropertiesConfiguration getPropertiesConfiguration() {
        return propertiesConfiguration;
    }

    public void setPropertiesConfiguration(PropertiesConfiguration propertiesConfiguration) {
        this.propertiesConfiguration = propertiesConfiguration;
    }

    public static class SimplifyConfiguration {

        /**
         * Douglas-Peucker tolerance in degrees. 0.008 is about 890 m.
         */
        private double tolerance = 0.008;
        /**
         * Decimal digits kept per coordinate after simplification.
         */
        private int precision = 3;
        /**
         * Worker threads for the per-feature loop, 0 or less uses a work-stealing pool.
         */
        private int threads = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        private ErrorPolicy errorPolicy = ErrorPolicy.STRICT;
        /**
         * Count output geometries JTS considers invalid. Reporting only, nothing is repaired.
         */
        private boolean validateOutput = true;

        public double getTolerance() {
            return tolerance;
        }

        public void setTolerance(double tolerance) {
            this.tolerance = tolerance;
        }

        public int getPrecision() {
            return precision;
        }

        public void setPrecision(int precision) {
            this.precision = precision;
        }

        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public ErrorPolicy getErrorPolicy() {
            return errorPolicy;
        }

        public void setErrorPolicy(ErrorPolicy errorPolicy) {
            this.errorPolicy = errorPolicy;
        }

        public boolean isValidateOutput() {
            return validateOutput;
        }

        public void setValidateOutput(boolean validateOutput) {
            this.validateOutput = validateOutput;
        }
    }

    public static class PropertiesConfiguration {

        /**
         * Source attribute holding the join key, the DIVIPOLA code in the municipality layer.
         */
        private String idField = "DPTOMPIO";
        private String labelField = "MPIO_CNMBR";
        /**
         * Attribute names written to the output.
         */
        private String idKey = "id";
        private String labelKey = "label";

        public String getIdField() {
            return idField;
        }

        public void setIdField(String idField) {
            this.idField = idField;
        }

        public String getLabelField() {
            return labelField;
        }

        public void setLabelField(String labelField) {
            this.labelField = labelField;
        }

        public String getIdKey() {
            return idKey;
        }

        public void setIdKey(String idKey) {
            this.idKey = idKey;
        }

        public String getLabelKey() {
            return labelKey;
        }

        public void setLabelKey(String labelKey) {
            this.labelKey = labelKey;
        }
    }
}
