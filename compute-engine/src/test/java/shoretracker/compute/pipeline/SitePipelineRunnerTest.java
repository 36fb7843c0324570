package shoretracker.compute.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import shoretracker.domain.exception.AlignmentFailureException;
import shoretracker.domain.exception.MissingInputException;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SitePipelineRunnerTest {

    @Test
    @DisplayName("Un sitio que falla no detiene a los demás y cada error se clasifica")
    void run_shouldIsolateSiteFailures() {
        // ARRANGE
        SitePipelineRunner runner = new SitePipelineRunner(3);
        SiteTask task = siteId -> switch (siteId) {
            case "nzd0002" -> throw new MissingInputException(siteId, "Sin serie corregida");
            case "nzd0003" -> throw new AlignmentFailureException(siteId, "Sin instantes comunes");
            default -> "ok " + siteId;
        };

        // ACT
        List<SiteOutcome> outcomes = runner.run(Stage.TRENDS, List.of("nzd0001", "nzd0002", "nzd0003", "nzd0004"), task);

        // ASSERT
        assertThat(outcomes).extracting(SiteOutcome::siteId)
                .containsExactly("nzd0001", "nzd0002", "nzd0003", "nzd0004");
        assertThat(outcomes).extracting(SiteOutcome::status).containsExactly(
                SiteOutcome.Status.SUCCEEDED, SiteOutcome.Status.SKIPPED,
                SiteOutcome.Status.FAILED, SiteOutcome.Status.SUCCEEDED);
        assertThat(outcomes.get(2).detail()).contains("AlignmentFailureException").contains("Sin instantes comunes");

        Instant startedAt = Instant.parse("2024-05-01T08:00:00Z");
        RunSummary summary = RunSummary.of(Stage.TRENDS, startedAt, outcomes, 7);
        assertThat(summary.succeeded()).containsExactly("nzd0001", "nzd0004");
        assertThat(summary.skipped()).containsOnlyKeys("nzd0002");
        assertThat(summary.failed()).containsOnlyKeys("nzd0003");
        assertThat(summary.total()).isEqualTo(4);
        assertThat(summary.transectsUpdated()).isEqualTo(7);
        assertThat(summary.startedAt()).isEqualTo(startedAt);
        assertThat(summary.finishedAt()).isAfterOrEqualTo(startedAt);
    }

    @Test
    @DisplayName("Sin sitios no se arranca el pool")
    void run_shouldReturnEmptyWithoutSites() {
        assertThat(new SitePipelineRunner(2).run(Stage.SLOPE, List.of(), siteId -> "x")).isEmpty();
    }
}
