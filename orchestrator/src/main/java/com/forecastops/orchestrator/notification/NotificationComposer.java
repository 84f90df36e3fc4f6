package com.forecastops.orchestrator.notification;

import com.forecastops.orchestrator.model.EvalResult;
import com.forecastops.orchestrator.model.ExecutionContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns a finished execution context into the reviewer message.
 */
@Component
public class NotificationComposer {

    private final String subject;
    private final String modelName;

    public NotificationComposer(
            @Value("${retrain.notification.subject:Solar Power Model Daily Report}") String subject,
            @Value("${retrain.notification.model-name:solar power forecasting model}") String modelName) {
        this.subject   = subject;
        this.modelName = modelName;
    }

    /**
     * PASS → MODEL_ADEQUATE. On FAIL the retrained candidate decides:
     * a score at or above the threshold still misses it (MANUAL_INTERVENTION),
     * a lower score meets it (REVIEW_CANDIDATE).
     */
    public static NotificationTemplate select(ExecutionContext ctx) {
        if (ctx.evalResult() == EvalResult.PASS) {
            return NotificationTemplate.MODEL_ADEQUATE;
        }
        if (ctx.evalResult() == null || ctx.bestCandidateScore() == null) {
            throw new IllegalStateException("Cannot report a failed evaluation without a retrained candidate");
        }
        return ctx.bestCandidateScore() >= ctx.threshold()
                ? NotificationTemplate.MANUAL_INTERVENTION
                : NotificationTemplate.REVIEW_CANDIDATE;
    }

    public Notification compose(ExecutionContext ctx) {
        NotificationTemplate template = select(ctx);
        String metric = ctx.metric().name();
        StringBuilder body = new StringBuilder()
                .append("Hello, today is ").append(ctx.date()).append("\n");

        if (template == NotificationTemplate.MODEL_ADEQUATE) {
            body.append("The current ").append(modelName).append(" performs adequately with ")
                .append(metric).append(": ").append(ctx.averageScore())
                .append(" (threshold: ").append(ctx.threshold()).append(").");
            return new Notification(template, subject, body.toString());
        }

        body.append("The current ").append(modelName).append(" performs with ")
            .append(metric).append(": ").append(ctx.averageScore())
            .append(", which does not meet the threshold: ").append(ctx.threshold()).append("\n\n")
            .append("The model has been retrained (job ").append(ctx.jobId()).append(").\n\n")
            .append("The best retrained candidate ").append(ctx.bestCandidateName())
            .append(" performs with ").append(metric).append(": ").append(ctx.bestCandidateScore());

        if (template == NotificationTemplate.MANUAL_INTERVENTION) {
            body.append(", which still does not meet the threshold.\n\n")
                .append("Manual intervention is required: please retrain the model by hand.");
        } else {
            body.append(", which meets the threshold.\n\n")
                .append("Please review the new model and decide whether to promote it.");
        }
        return new Notification(template, subject, body.toString());
    }
}
