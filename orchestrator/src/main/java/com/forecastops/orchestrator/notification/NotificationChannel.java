package com.forecastops.orchestrator.notification;

/**
 * Broadcast channel the reviewers subscribe to.
 *
 * @throws com.forecastops.orchestrator.task.TaskException NOTIFICATION on delivery failure
 */
public interface NotificationChannel {

    void publish(Notification notification);
}
