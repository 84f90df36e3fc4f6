package com.forecastops.orchestrator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionContextTest {

    static final DatasetLocation LOCATION = new DatasetLocation(
            "solar-forecasts", "data/hist/2024-05-01/hist-solar.csv", "data/pred/2024-05-01/pred-solar.csv");

    final ObjectMapper json = new ObjectMapper().findAndRegisterModules();

    @Test
    void initial_hasOnlyCreationFields() {
        ExecutionContext ctx = initial();

        assertThat(ctx.metric()).isEqualTo(Metric.RMSE);
        assertThat(ctx.evalResult()).isNull();
        assertThat(ctx.jobId()).isNull();
        assertThat(ctx.bestCandidateScore()).isNull();
    }

    @Test
    void withEvaluation_keepsEarlierFields() {
        ExecutionContext ctx = initial().withEvaluation(EvalResult.FAIL, 62.5);

        assertThat(ctx.datasetLocation()).isEqualTo(LOCATION);
        assertThat(ctx.threshold()).isEqualTo(50.0);
        assertThat(ctx.evalResult()).isEqualTo(EvalResult.FAIL);
        assertThat(ctx.averageScore()).isEqualTo(62.5);
    }

    @Test
    void setOnceFields_refuseOverwrite() {
        ExecutionContext ctx = initial()
                .withEvaluation(EvalResult.FAIL, 62.5)
                .withJobId("ts-20240501-000000-abcd");

        assertThatThrownBy(() -> ctx.withEvaluation(EvalResult.PASS, 1.0))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("eval_result");
        assertThatThrownBy(() -> ctx.withJobId("other"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("job_id");
    }

    @Test
    void jobStatus_isRefreshedByEveryPoll() {
        ExecutionContext ctx = initial().withJobId("job-1")
                .withJobStatus(JobStatus.SUBMITTED)
                .withJobStatus(JobStatus.IN_PROGRESS)
                .withJobStatus(JobStatus.COMPLETED);

        assertThat(ctx.jobStatus()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    void json_usesSnakeCaseAndWireStatusNames() throws Exception {
        ExecutionContext ctx = initial()
                .withEvaluation(EvalResult.FAIL, 62.5)
                .withJobId("job-1")
                .withJobStatus(JobStatus.IN_PROGRESS);

        String text = json.writeValueAsString(ctx);

        assertThat(text)
                .contains("\"dataset_location\"")
                .contains("\"hist_key\":\"data/hist/2024-05-01/hist-solar.csv\"")
                .contains("\"date\":\"2024-05-01\"")
                .contains("\"job_status\":\"InProgress\"")
                .doesNotContain("best_candidate_name");
        assertThat(json.readValue(text, ExecutionContext.class)).isEqualTo(ctx);
    }

    @Test
    void json_unknownFieldsIgnored() throws Exception {
        String text = """
                {"dataset_location":{"bucket":"b","hist_key":"h","pred_key":"p"},
                 "date":"2024-05-01","threshold":50.0,"metric":"RMSE","legacy":"x"}
                """;

        ExecutionContext ctx = json.readValue(text, ExecutionContext.class);

        assertThat(ctx.date()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(ctx.datasetLocation().predKey()).isEqualTo("p");
    }

    private static ExecutionContext initial() {
        return ExecutionContext.initial(LOCATION, LocalDate.of(2024, 5, 1), 50.0, Metric.RMSE);
    }
}
