package net.releasewatch.model;

/**
 * Downstream delivery channels. EMAIL is the primary channel and gates the notified flag.
 */
public enum NotificationChannel {
    EMAIL,
    CALENDAR
}
