package com.causescore.domain;

/**
 * Social platforms tracked per project. Field names point at the per-platform columns of {@link TrackedAccount}.
 */
public enum Platform {

    TWITTER("twitterHandle", "latestTwitterPostTimestamp", "lastTwitterFetch"),
    FARCASTER("farcasterHandle", "latestFarcasterPostTimestamp", "lastFarcasterFetch");

    private final String handleField;
    private final String watermarkField;
    private final String lastFetchField;

    Platform(String handleField, String watermarkField, String lastFetchField) {
        this.handleField = handleField;
        this.watermarkField = watermarkField;
        this.lastFetchField = lastFetchField;
    }

    public String handleField() {
        return handleField;
    }

    public String watermarkField() {
        return watermarkField;
    }

    public String lastFetchField() {
        return lastFetchField;
    }

    /** Key under TrackedAccount.metadata holding the last fetch outcome for this platform. */
    public String lastFetchResultKey() {
        return name().toLowerCase() + "LastFetchResult";
    }
}
