package com.example.demo.reconciliation.model;

/**
 * Immutable weights and thresholds used by a single reconciliation call.
 * Built from {@code ReconciliationConfig} in the running service, or directly
 * in tests to exercise alternative thresholds.
 */
public final class MatchingSettings {

    private final double identifierWeight;
    private final double lotWeight;
    private final double quantityWeight;
    private final double priceWeight;
    private final double identifierFallbackCredit;
    private final double descriptionSimilarityThreshold;
    private final double pairFloor;
    private final double lineSimilarityWeight;
    private final double headerWeight;
    private final double coverageWeight;
    private final double acceptanceThreshold;
    private final double priceVarianceTolerance;
    private final double errorVarianceThreshold;
    private final double subtotalAbsoluteTolerance;
    private final double subtotalRelativeTolerance;
    private final int candidateWindow;
    private final double vendorSimilarityFloor;

    private MatchingSettings(Builder builder) {
        this.identifierWeight = builder.identifierWeight;
        this.lotWeight = builder.lotWeight;
        this.quantityWeight = builder.quantityWeight;
        this.priceWeight = builder.priceWeight;
        this.identifierFallbackCredit = builder.identifierFallbackCredit;
        this.descriptionSimilarityThreshold = builder.descriptionSimilarityThreshold;
        this.pairFloor = builder.pairFloor;
        this.lineSimilarityWeight = builder.lineSimilarityWeight;
        this.headerWeight = builder.headerWeight;
        this.coverageWeight = builder.coverageWeight;
        this.acceptanceThreshold = builder.acceptanceThreshold;
        this.priceVarianceTolerance = builder.priceVarianceTolerance;
        this.errorVarianceThreshold = builder.errorVarianceThreshold;
        this.subtotalAbsoluteTolerance = builder.subtotalAbsoluteTolerance;
        this.subtotalRelativeTolerance = builder.subtotalRelativeTolerance;
        this.candidateWindow = builder.candidateWindow;
        this.vendorSimilarityFloor = builder.vendorSimilarityFloor;
    }

    public static MatchingSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getIdentifierWeight() {
        return identifierWeight;
    }

    public double getLotWeight() {
        return lotWeight;
    }

    public double getQuantityWeight() {
        return quantityWeight;
    }

    public double getPriceWeight() {
        return priceWeight;
    }

    public double getIdentifierFallbackCredit() {
        return identifierFallbackCredit;
    }

    public double getDescriptionSimilarityThreshold() {
        return descriptionSimilarityThreshold;
    }

    public double getPairFloor() {
        return pairFloor;
    }

    public double getLineSimilarityWeight() {
        return lineSimilarityWeight;
    }

    public double getHeaderWeight() {
        return headerWeight;
    }

    public double getCoverageWeight() {
        return coverageWeight;
    }

    public double getAcceptanceThreshold() {
        return acceptanceThreshold;
    }

    public double getPriceVarianceTolerance() {
        return priceVarianceTolerance;
    }

    public double getErrorVarianceThreshold() {
        return errorVarianceThreshold;
    }

    public double getSubtotalAbsoluteTolerance() {
        return subtotalAbsoluteTolerance;
    }

    public double getSubtotalRelativeTolerance() {
        return subtotalRelativeTolerance;
    }

    public int getCandidateWindow() {
        return candidateWindow;
    }

    public double getVendorSimilarityFloor() {
        return vendorSimilarityFloor;
    }

    @Override
    public String toString() {
        return String.format("MatchingSettings{weights=[id=%.2f, lot=%.2f, qty=%.2f, price=%.2f], floor=%.2f, acceptance=%.2f}",
                identifierWeight, lotWeight, quantityWeight, priceWeight, pairFloor, acceptanceThreshold);
    }

    public static class Builder {
        private double identifierWeight = 0.45;
        private double lotWeight = 0.15;
        private double quantityWeight = 0.20;
        private double priceWeight = 0.20;
        private double identifierFallbackCredit = 0.5;
        private double descriptionSimilarityThreshold = 0.8;
        private double pairFloor = 0.35;
        private double lineSimilarityWeight = 0.7;
        private double headerWeight = 0.2;
        private double coverageWeight = 0.1;
        private double acceptanceThreshold = 0.5;
        private double priceVarianceTolerance = 0.02;
        private double errorVarianceThreshold = 0.10;
        private double subtotalAbsoluteTolerance = 0.01;
        private double subtotalRelativeTolerance = 0.01;
        private int candidateWindow = 10;
        private double vendorSimilarityFloor = 0.5;

        private Builder() {
        }

        public Builder identifierWeight(double identifierWeight) {
            this.identifierWeight = identifierWeight;
            return this;
        }

        public Builder lotWeight(double lotWeight) {
            this.lotWeight = lotWeight;
            return this;
        }

        public Builder quantityWeight(double quantityWeight) {
            this.quantityWeight = quantityWeight;
            return this;
        }

        public Builder priceWeight(double priceWeight) {
            this.priceWeight = priceWeight;
            return this;
        }

        public Builder identifierFallbackCredit(double identifierFallbackCredit) {
            this.identifierFallbackCredit = identifierFallbackCredit;
            return this;
        }

        public Builder descriptionSimilarityThreshold(double descriptionSimilarityThreshold) {
            this.descriptionSimilarityThreshold = descriptionSimilarityThreshold;
            return this;
        }

        public Builder pairFloor(double pairFloor) {
            this.pairFloor = pairFloor;
            return this;
        }

        public Builder lineSimilarityWeight(double lineSimilarityWeight) {
            this.lineSimilarityWeight = lineSimilarityWeight;
            return this;
        }

        public Builder headerWeight(double headerWeight) {
            this.headerWeight = headerWeight;
            return this;
        }

        public Builder coverageWeight(double coverageWeight) {
            this.coverageWeight = coverageWeight;
            return this;
        }

        public Builder acceptanceThreshold(double acceptanceThreshold) {
            this.acceptanceThreshold = acceptanceThreshold;
            return this;
        }

        public Builder priceVarianceTolerance(double priceVarianceTolerance) {
            this.priceVarianceTolerance = priceVarianceTolerance;
            return this;
        }

        public Builder errorVarianceThreshold(double errorVarianceThreshold) {
            this.errorVarianceThreshold = errorVarianceThreshold;
            return this;
        }

        public Builder subtotalAbsoluteTolerance(double subtotalAbsoluteTolerance) {
            this.subtotalAbsoluteTolerance = subtotalAbsoluteTolerance;
            return this;
        }

        public Builder subtotalRelativeTolerance(double subtotalRelativeTolerance) {
            this.subtotalRelativeTolerance = subtotalRelativeTolerance;
            return this;
        }

        public Builder candidateWindow(int candidateWindow) {
            this.candidateWindow = candidateWindow;
            return this;
        }

        public Builder vendorSimilarityFloor(double vendorSimilarityFloor) {
            this.vendorSimilarityFloor = vendorSimilarityFloor;
            return this;
        }

        public MatchingSettings build() {
            return new MatchingSettings(this);
        }
    }
}
