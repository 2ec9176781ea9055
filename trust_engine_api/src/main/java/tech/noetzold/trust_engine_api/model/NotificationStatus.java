package tech.noetzold.trust_engine_api.model;

public enum NotificationStatus {
    NOT_REQUIRED,
    PENDING,
    DELIVERED,
    NOTIFICATION_FAILED
}
