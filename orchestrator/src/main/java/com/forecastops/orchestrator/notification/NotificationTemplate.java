package com.forecastops.orchestrator.notification;

public enum NotificationTemplate {
    /** The deployed model is within the threshold. */
    MODEL_ADEQUATE,
    /** The model was retrained but the best candidate still misses the threshold. */
    MANUAL_INTERVENTION,
    /** The retrained candidate meets the threshold and can be promoted. */
    REVIEW_CANDIDATE
}
