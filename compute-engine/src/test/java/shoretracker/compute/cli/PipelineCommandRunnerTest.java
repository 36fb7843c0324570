package shoretracker.compute.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import shoretracker.compute.pipeline.PipelineRequest;
import shoretracker.compute.pipeline.PipelineService;
import shoretracker.compute.pipeline.RunSummary;
import shoretracker.compute.pipeline.Stage;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineCommandRunnerTest {

    @Mock
    private PipelineService pipeline;

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    private ByteArrayOutputStream stdout;
    private PipelineCommandRunner runner;

    @BeforeEach
    void setUp() {
        stdout = new ByteArrayOutputStream();
        runner = new PipelineCommandRunner(pipeline, objectMapper, new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Ejecuta la etapa pedida e imprime el resumen JSON en stdout")
    void run_shouldPrintSummaryAndExitZero() throws Exception {
        // ARRANGE
        RunSummary summary = new RunSummary("slope", Instant.parse("2024-05-01T08:00:00Z"),
                Instant.parse("2024-05-01T08:03:30Z"), List.of("nzd0001"), Map.of("nzd0002", "AlignmentFailureException: x"),
                Map.of(), 12);
        when(pipeline.run(any())).thenReturn(summary);

        // ACT
        runner.run(new DefaultApplicationArguments("--stage=slope", "--sites=nzd0001,nzd0002", "--recompute-slopes",
                "--output=out.geojson"));

        // ASSERT
        ArgumentCaptor<PipelineRequest> request = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(pipeline).run(request.capture());
        assertThat(request.getValue().stage()).isEqualTo(Stage.SLOPE);
        assertThat(request.getValue().sites()).containsExactly("nzd0001", "nzd0002");
        assertThat(request.getValue().recomputeSlopes()).isTrue();
        assertThat(request.getValue().output()).isEqualTo(Path.of("out.geojson"));

        JsonNode json = objectMapper.readTree(stdout.toString(StandardCharsets.UTF_8));
        assertThat(json.path("stage").asText()).isEqualTo("slope");
        assertThat(json.path("failed").path("nzd0002").asText()).startsWith("AlignmentFailureException");
        assertThat(json.path("transectsUpdated").asInt()).isEqualTo(12);
        assertThat(json.path("startedAt").asText()).isEqualTo("2024-05-01T08:00:00Z");
        assertThat(json.path("finishedAt").asText()).isEqualTo("2024-05-01T08:03:30Z");
        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_OK);
    }

    @Test
    @DisplayName("Agregación: fragmentos y columnas admiten comas y repetición")
    void parse_shouldCollectAggregateOptions() {
        PipelineRequest request = PipelineCommandRunner.parse(new DefaultApplicationArguments(
                "--stage=aggregate", "--base=base.geojson", "--fragments=a.geojson,b.geojson",
                "--fragments=c.geojson", "--update-columns=trend,r2_score"));

        assertThat(request.base()).isEqualTo(Path.of("base.geojson"));
        assertThat(request.fragments()).containsExactly(Path.of("a.geojson"), Path.of("b.geojson"), Path.of("c.geojson"));
        assertThat(request.updateColumns()).containsExactlyInAnyOrder("trend", "r2_score");
    }

    @Test
    @DisplayName("Etapa desconocida o ausente: código 2 sin ejecutar nada")
    void run_shouldRejectInvalidArguments() {
        runner.run(new DefaultApplicationArguments("--stage=tides"));
        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_USAGE);

        runner.run(new DefaultApplicationArguments("--sites=nzd0001"));
        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_USAGE);

        runner.run(new DefaultApplicationArguments("--stage=slope", "--fragments=a.geojson"));
        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_USAGE);

        verifyNoInteractions(pipeline);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    @DisplayName("Un error de la tabla compartida termina con código 1")
    void run_shouldExitOneOnUnrecoverableError() throws Exception {
        when(pipeline.run(any())).thenThrow(new IOException("tabla ilegible"));

        runner.run(new DefaultApplicationArguments("--stage=trends"));

        assertThat(runner.getExitCode()).isEqualTo(PipelineCommandRunner.EXIT_FAILURE);
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }
}
