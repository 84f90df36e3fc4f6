package com.forecastops.orchestrator.aws;

import com.forecastops.orchestrator.trigger.ThresholdSource;
import com.forecastops.orchestrator.trigger.TriggerException;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

/**
 * Reads the acceptance threshold from SSM Parameter Store.
 */
@Component
public class SsmThresholdSource implements ThresholdSource {

    private final SsmClient ssm;

    public SsmThresholdSource(SsmClient ssm) {
        this.ssm = ssm;
    }

    @Override
    public double threshold(String parameterName) {
        String raw;
        try {
            raw = ssm.getParameter(GetParameterRequest.builder().name(parameterName).build())
                    .parameter()
                    .value();
        } catch (SdkException e) {
            throw new TriggerException(TriggerException.Kind.CONFIGURATION,
                    "Could not read parameter '" + parameterName + "': " + e.getMessage(), e);
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new TriggerException(TriggerException.Kind.CONFIGURATION,
                    "Parameter '" + parameterName + "' is not a number: " + raw, e);
        }
    }
}
