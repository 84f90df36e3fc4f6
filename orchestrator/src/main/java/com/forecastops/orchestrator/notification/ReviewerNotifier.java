package com.forecastops.orchestrator.notification;

import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.task.ErrorKind;
import com.forecastops.orchestrator.task.Notifier;
import com.forecastops.orchestrator.task.TaskException;
import org.springframework.stereotype.Component;

@Component
public class ReviewerNotifier implements Notifier {

    private final NotificationComposer composer;
    private final NotificationChannel  channel;

    public ReviewerNotifier(NotificationComposer composer, NotificationChannel channel) {
        this.composer = composer;
        this.channel  = channel;
    }

    @Override
    public void report(ExecutionContext context) {
        Notification notification;
        try {
            notification = composer.compose(context);
        } catch (IllegalStateException e) {
            throw new TaskException(ErrorKind.INTERNAL, e.getMessage(), e);
        }
        channel.publish(notification);
    }
}
