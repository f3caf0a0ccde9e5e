package com.causescore.scoring;

/**
 * Fixed weights of the eight score components. Must sum to 1.0 within {@link #TOLERANCE}.
 */
public record ScoringWeights(double projectInfoQuality,
                             double updateRecency,
                             double socialMediaQuality,
                             double socialMediaRecency,
                             double socialMediaFrequency,
                             double relevanceToCause,
                             double evidenceOfImpact,
                             double givPowerRank) {

    public static final double TOLERANCE = 0.001;

    public double sum() {
        return projectInfoQuality + updateRecency + socialMediaQuality + socialMediaRecency
                + socialMediaFrequency + relevanceToCause + evidenceOfImpact + givPowerRank;
    }

    /**
     * @throws IllegalStateException when a weight is outside [0,1] or the sum is not 1.0
     */
    public ScoringWeights validate() {
        double[] all = {projectInfoQuality, updateRecency, socialMediaQuality, socialMediaRecency,
                socialMediaFrequency, relevanceToCause, evidenceOfImpact, givPowerRank};
        for (double w : all) {
            if (Double.isNaN(w) || w < 0 || w > 1) {
                throw new IllegalStateException("Scoring weight out of range [0,1]: " + w + " in " + this);
            }
        }
        if (Math.abs(sum() - 1.0) > TOLERANCE) {
            throw new IllegalStateException("Scoring weights must sum to 1.0 but sum to " + sum() + ": " + this);
        }
        return this;
    }

    public static ScoringWeights defaults() {
        return new ScoringWeights(0.15, 0.10, 0.10, 0.05, 0.05, 0.20, 0.20, 0.15);
    }
}
