package shoretracker.compute.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import shoretracker.config.AcquisitionConfig;
import shoretracker.config.RetryPolicy;
import shoretracker.config.SlopeEstimationConfig;
import shoretracker.config.TidalCorrectionConfig;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuración del motor enlazada desde {@code application.yml} (prefijo {@code shoretracker}).
 * Las fechas se escriben en ISO (yyyy-MM-dd) y se convierten a los records de configuración
 * del dominio con los métodos {@code to*Config}.
 */
@Data
@ConfigurationProperties(prefix = "shoretracker")
public class EngineProperties {

    private String dataDir = "data";
    private String transectsFile = "inputs/transects_extended.geojson";
    private String polygonsFile = "inputs/polygons.geojson";
    private String sitePrefix = "nzd";
    private int workers = 4;
    private boolean validation = false;

    private final Acquisition acquisition = new Acquisition();
    private final Tide tide = new Tide();
    private final Correction correction = new Correction();
    private final Slope slope = new Slope();
    private final Observations observations = new Observations();

    /**
     * En modo validación los sitios se procesan de uno en uno.
     */
    public int effectiveWorkers() {
        return validation ? 1 : Math.max(workers, 1);
    }

    public AcquisitionConfig toAcquisitionConfig() {
        AcquisitionConfig base = validation
                ? AcquisitionConfig.validation(LocalDate.parse(acquisition.validationStart), LocalDate.parse(acquisition.validationEnd))
                .withSatellites(acquisition.validationSatellites)
                : AcquisitionConfig.defaults()
                .withGlobalStartDate(LocalDate.parse(acquisition.globalStart))
                .withEndDate(LocalDate.parse(acquisition.end))
                .withSatellites(acquisition.satellites);
        return blank(acquisition.forceStart) ? base : base.withForceStartDate(LocalDate.parse(acquisition.forceStart));
    }

    public RetryPolicy toRetryPolicy() {
        return new RetryPolicy(tide.maxAttempts, tide.rateLimitDelay, tide.errorDelay);
    }

    public TidalCorrectionConfig toCorrectionConfig() {
        return new TidalCorrectionConfig(correction.despikeThreshold, correction.alignmentResolution);
    }

    public SlopeEstimationConfig toSlopeConfig(boolean recompute) {
        return SlopeEstimationConfig.defaults()
                .withSlopeMin(slope.min)
                .withSlopeMax(slope.max)
                .withDeltaSlope(slope.delta)
                .withSamplingPeriodDays(slope.samplingPeriodDays)
                .withNyquistFactor(slope.nyquistFactor)
                .withFrequencyCutoff(1.0 / (SlopeEstimationConfig.SECONDS_IN_DAY * slope.cutoffPeriodDays))
                .withPeakBandwidth(slope.peakBandwidth)
                .withConfidencePercent(slope.confidencePercent)
                .withAnalysisStart(startOfDay(slope.analysisStart))
                .withAnalysisEnd(startOfDay(slope.analysisEnd))
                .withRecompute(recompute || slope.recompute);
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }

    private static Instant startOfDay(String date) {
        return blank(date) ? null : LocalDate.parse(date).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    @Data
    public static class Acquisition {
        private String globalStart = "1984-01-01";
        private String end = "2030-12-30";
        private List<String> satellites = new ArrayList<>(List.of("L5", "L7", "L8", "L9"));
        /** Equivale a FORCE_START_DATE: ignora el histórico y empieza en esta fecha. */
        private String forceStart;
        private String validationStart = "2022-01-01";
        private String validationEnd = "2023-12-31";
        private List<String> validationSatellites = new ArrayList<>(List.of("L8", "L9"));
    }

    @Data
    public static class Tide {
        private String baseUrl = "https://api.niwa.co.nz/tides/data";
        private String apiKey;
        private Duration connectTimeout = Duration.ofSeconds(30);
        private Duration readTimeout = Duration.ofSeconds(30);
        private int maxAttempts = 5;
        private Duration rateLimitDelay = Duration.ofSeconds(30);
        private Duration errorDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Correction {
        private double despikeThreshold = 40.0;
        private Duration alignmentResolution = Duration.ofMinutes(10);
    }

    @Data
    public static class Slope {
        private double min = 0.01;
        private double max = 0.2;
        private double delta = 0.005;
        private double samplingPeriodDays = 7;
        private int nyquistFactor = 50;
        private double cutoffPeriodDays = 30;
        private double peakBandwidth = 1e-8;
        private double confidencePercent = 0.05;
        private String analysisStart;
        private String analysisEnd;
        private boolean recompute = false;
    }

    @Data
    public static class Observations {
        /** Directorio con las exportaciones de la herramienta de extracción ({@code <sitio>.csv}). */
        private String inbox = "inbox";
    }
}
