package shoretracker.compute.config;

import io.netty.channel.ChannelOption;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import shoretracker.analysis.despike.Despiker;
import shoretracker.analysis.merge.TransectMerger;
import shoretracker.analysis.slope.LombScargleSlopeFitter;
import shoretracker.analysis.slope.SlopeEstimator;
import shoretracker.analysis.slope.SlopeFitter;
import shoretracker.analysis.store.ObservationLog;
import shoretracker.analysis.tide.TidalCorrector;
import shoretracker.analysis.trend.TrendFitter;
import shoretracker.compute.client.ExportedObservationSource;
import shoretracker.compute.client.NiwaTideClient;
import shoretracker.compute.client.ObservationSource;
import shoretracker.compute.client.RetryingTideProvider;
import shoretracker.compute.client.TideProvider;
import shoretracker.compute.io.CsvTableHandler;
import shoretracker.compute.io.GeoJsonFileHandler;
import shoretracker.config.AcquisitionConfig;
import shoretracker.config.TidalCorrectionConfig;

import java.nio.file.Path;

/**
 * Cableado del motor: algoritmos del dominio, adaptadores de ficheros y clientes externos.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public WebClient tideWebClient(WebClient.Builder builder, EngineProperties properties) {
        EngineProperties.Tide tide = properties.getTide();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) tide.getConnectTimeout().toMillis())
                .responseTimeout(tide.getReadTimeout());
        return builder
                .baseUrl(tide.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public TideProvider tideProvider(WebClient tideWebClient, EngineProperties properties, Sleeper retrySleeper) {
        EngineProperties.Tide tide = properties.getTide();
        NiwaTideClient niwa = new NiwaTideClient(tideWebClient, tide.getApiKey(), tide.getReadTimeout().multipliedBy(2));
        return new RetryingTideProvider(niwa, properties.toRetryPolicy(), retrySleeper);
    }

    @Bean
    public ObservationSource observationSource(CsvTableHandler csv, EngineProperties properties) {
        return new ExportedObservationSource(csv, Path.of(properties.getObservations().getInbox()));
    }

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }

    @Bean
    public GeoJsonFileHandler geoJsonFileHandler(GeometryFactory geometryFactory) {
        return new GeoJsonFileHandler(geometryFactory);
    }

    @Bean
    public CsvTableHandler csvTableHandler() {
        return new CsvTableHandler();
    }

    @Bean
    public AcquisitionConfig acquisitionConfig(EngineProperties properties) {
        return properties.toAcquisitionConfig();
    }

    @Bean
    public TidalCorrectionConfig tidalCorrectionConfig(EngineProperties properties) {
        return properties.toCorrectionConfig();
    }

    @Bean
    public ObservationLog observationLog() {
        return new ObservationLog();
    }

    @Bean
    public Despiker despiker() {
        return new Despiker();
    }

    @Bean
    public TidalCorrector tidalCorrector(Despiker despiker, TidalCorrectionConfig tidalCorrectionConfig) {
        return new TidalCorrector(despiker, tidalCorrectionConfig);
    }

    @Bean
    public SlopeFitter slopeFitter() {
        return new LombScargleSlopeFitter();
    }

    @Bean
    public SlopeEstimator slopeEstimator(SlopeFitter slopeFitter, TidalCorrectionConfig tidalCorrectionConfig) {
        return new SlopeEstimator(slopeFitter, tidalCorrectionConfig.alignmentResolution());
    }

    @Bean
    public TrendFitter trendFitter() {
        return new TrendFitter();
    }

    @Bean
    public TransectMerger transectMerger() {
        return new TransectMerger();
    }
}
