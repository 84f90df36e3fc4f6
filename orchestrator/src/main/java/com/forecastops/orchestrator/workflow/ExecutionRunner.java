package com.forecastops.orchestrator.workflow;

import com.forecastops.orchestrator.model.Execution;
import com.forecastops.orchestrator.model.ExecutionContext;
import com.forecastops.orchestrator.model.ExecutionState;
import com.forecastops.orchestrator.service.ExecutionService;
import com.forecastops.orchestrator.task.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Drives one claimed execution forward.
 *
 * Starting from the persisted state, the runner asks the engine for one
 * state at a time and persists each {@link Advance} before taking the
 * next. It stops when the execution reaches a terminal state or enters
 * WAITING, at which point the row is parked until the poll interval has
 * passed and a later scheduler tick claims it again. Every write carries
 * the claiming worker's id; once the claim has moved on (stall recovery
 * handed the row to another worker) the runner stops.
 */
@Component
public class ExecutionRunner {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRunner.class);

    private final WorkflowEngine   engine;
    private final ExecutionService executionService;

    public ExecutionRunner(WorkflowEngine engine, ExecutionService executionService) {
        this.engine           = engine;
        this.executionService = executionService;
    }

    public void run(Execution execution) {
        UUID   id       = execution.getId();
        String workerId = execution.getWorkerId();
        MDC.put("executionId", id.toString());
        try {
            ExecutionState   state = execution.getState();
            ExecutionContext ctx   = executionService.contextOf(execution);
            log.info("Resuming execution {} at {}", id, state);

            while (!state.isTerminal()) {
                MDC.put("state", state.name());

                if (executionService.isCancelRequested(id)) {
                    log.info("Execution {} cancelled at {}", id, state);
                    executionService.abort(id, workerId, ErrorKind.CANCELLED, "Cancelled by request");
                    return;
                }

                Advance advance = engine.advance(state, ctx);
                if (!executionService.applyAdvance(id, workerId, advance)) {
                    return;
                }
                log.debug("Execution {}: {} → {}", id, advance.from(), advance.to());

                if (advance.suspends()) {
                    return;
                }
                state = advance.to();
                ctx   = advance.context();
            }
        } finally {
            // Pool threads are reused; don't leak this execution's keys.
            MDC.clear();
        }
    }
}
