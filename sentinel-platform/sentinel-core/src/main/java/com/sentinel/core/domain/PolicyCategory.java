package com.sentinel.core.domain;

/**
 * Policy categories shared by violations, strikes, reports, review items and penalties.
 * Each category carries the severity (1-3) a user report in that category is filed with.
 */
public enum PolicyCategory {
    TOXICITY(1),
    HARASSMENT(2),
    HATE_SPEECH(3),
    SEXUAL_CONTENT(2),
    THREAT(3),
    SPAM(1),
    SEXUAL_CONTENT_MINORS(3),
    IMPERSONATION(2),
    RACISM(2),
    ILLEGAL_CONTENT(3),
    SELF_HARM(3),
    OTHER(1);

    private final int reportSeverity;

    PolicyCategory(int reportSeverity) {
        this.reportSeverity = reportSeverity;
    }

    public int reportSeverity() {
        return reportSeverity;
    }

    /**
     * Categories where repeated offences accumulate strikes.
     */
    public boolean isRepeatOffence() {
        return this == HATE_SPEECH || this == HARASSMENT;
    }
}
