package com.elevation.catalog.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Processing metadata carried by a source record.
 * Every field is optional; absent values surface as nulls in catalog properties.
 */
public record ProcessingMetadata(
        String pairname,
        String sensor1,
        String sensor2,
        String catalogId1,
        String catalogId2,
        String algorithmVersion,
        String s2sVersion,
        Boolean crossTrack,
        Double rmse,
        Double avgConvergenceAngle,
        Double avgExpectedHeightAccuracy,
        Double avgSunElevation1,
        Double avgSunElevation2,
        Double maskedDensity,
        Double validDensity,
        Double validAreaSqkm,
        Double validAreaPercent,
        Double waterAreaSqkm,
        Double waterAreaPercent,
        Double cloudAreaSqkm,
        Double cloudAreaPercent,
        Instant creationDate,
        String tile,
        Double dataPercent,
        Map<String, Long> fileSizes
) {
    public ProcessingMetadata {
        fileSizes = fileSizes != null ? Map.copyOf(new TreeMap<>(fileSizes)) : Map.of();
    }

    public static ProcessingMetadata empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String pairname;
        private String sensor1;
        private String sensor2;
        private String catalogId1;
        private String catalogId2;
        private String algorithmVersion;
        private String s2sVersion;
        private Boolean crossTrack;
        private Double rmse;
        private Double avgConvergenceAngle;
        private Double avgExpectedHeightAccuracy;
        private Double avgSunElevation1;
        private Double avgSunElevation2;
        private Double maskedDensity;
        private Double validDensity;
        private Double validAreaSqkm;
        private Double validAreaPercent;
        private Double waterAreaSqkm;
        private Double waterAreaPercent;
        private Double cloudAreaSqkm;
        private Double cloudAreaPercent;
        private Instant creationDate;
        private String tile;
        private Double dataPercent;
        private Map<String, Long> fileSizes;

        public Builder pairname(String pairname) {
            this.pairname = pairname;
            return this;
        }

        public Builder sensors(String sensor1, String sensor2) {
            this.sensor1 = sensor1;
            this.sensor2 = sensor2;
            return this;
        }

        public Builder catalogIds(String catalogId1, String catalogId2) {
            this.catalogId1 = catalogId1;
            this.catalogId2 = catalogId2;
            return this;
        }

        public Builder algorithmVersion(String algorithmVersion) {
            this.algorithmVersion = algorithmVersion;
            return this;
        }

        public Builder s2sVersion(String s2sVersion) {
            this.s2sVersion = s2sVersion;
            return this;
        }

        public Builder crossTrack(Boolean crossTrack) {
            this.crossTrack = crossTrack;
            return this;
        }

        public Builder rmse(Double rmse) {
            this.rmse = rmse;
            return this;
        }

        public Builder avgConvergenceAngle(Double avgConvergenceAngle) {
            this.avgConvergenceAngle = avgConvergenceAngle;
            return this;
        }

        public Builder avgExpectedHeightAccuracy(Double avgExpectedHeightAccuracy) {
            this.avgExpectedHeightAccuracy = avgExpectedHeightAccuracy;
            return this;
        }

        public Builder avgSunElevations(Double first, Double second) {
            this.avgSunElevation1 = first;
            this.avgSunElevation2 = second;
            return this;
        }

        public Builder densities(Double maskedDensity, Double validDensity) {
            this.maskedDensity = maskedDensity;
            this.validDensity = validDensity;
            return this;
        }

        public Builder validArea(Double sqkm, Double percent) {
            this.validAreaSqkm = sqkm;
            this.validAreaPercent = percent;
            return this;
        }

        public Builder waterArea(Double sqkm, Double percent) {
            this.waterAreaSqkm = sqkm;
            this.waterAreaPercent = percent;
            return this;
        }

        public Builder cloudArea(Double sqkm, Double percent) {
            this.cloudAreaSqkm = sqkm;
            this.cloudAreaPercent = percent;
            return this;
        }

        public Builder creationDate(Instant creationDate) {
            this.creationDate = creationDate;
            return this;
        }

        public Builder tile(String tile) {
            this.tile = tile;
            return this;
        }

        public Builder dataPercent(Double dataPercent) {
            this.dataPercent = dataPercent;
            return this;
        }

        public Builder fileSizes(Map<String, Long> fileSizes) {
            this.fileSizes = fileSizes;
            return this;
        }

        public ProcessingMetadata build() {
            return new ProcessingMetadata(pairname, sensor1, sensor2, catalogId1, catalogId2,
                    algorithmVersion, s2sVersion, crossTrack, rmse, avgConvergenceAngle,
                    avgExpectedHeightAccuracy, avgSunElevation1, avgSunElevation2,
                    maskedDensity, validDensity, validAreaSqkm, validAreaPercent,
                    waterAreaSqkm, waterAreaPercent, cloudAreaSqkm, cloudAreaPercent,
                    creationDate, tile, dataPercent, fileSizes);
        }
    }
}
