package com.forecastops.orchestrator.notification;

public record Notification(NotificationTemplate template, String subject, String body) {}
