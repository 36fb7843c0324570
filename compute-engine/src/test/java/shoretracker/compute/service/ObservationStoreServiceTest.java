package shoretracker.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import shoretracker.analysis.store.ObservationLog;
import shoretracker.compute.client.ObservationSource;
import shoretracker.compute.io.CsvTableHandler;
import shoretracker.compute.repository.SiteDataRepository;
import shoretracker.config.AcquisitionConfig;
import shoretracker.domain.observation.AcquisitionPlan;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ObservationStoreServiceTest {

    private static final String SITE = "nzd0001";

    @TempDir
    Path dataDir;

    @Mock
    private ObservationSource source;

    private SiteDataRepository siteData;

    @BeforeEach
    void setUp() {
        siteData = new SiteDataRepository(dataDir, new CsvTableHandler());
    }

    private ObservationStoreService service(AcquisitionConfig config) {
        return new ObservationStoreService(siteData, source, new ObservationLog(), config);
    }

    private static Observation obs(String date, double value) {
        return new Observation(Instant.parse(date), "L8", Map.of("t1", value));
    }

    @Test
    @DisplayName("Pide desde el día siguiente a la marca de agua y añade lo nuevo al histórico")
    void download_shouldAppendAfterWatermark() throws IOException {
        // ARRANGE
        siteData.writeRaw(ChainageTable.of(SITE, List.of(obs("2020-06-30T22:00:00Z", 100.0))));
        when(source.fetch(eq(SITE), any())).thenReturn(List.of(obs("2020-07-16T22:00:00Z", 97.5)));

        // ACT
        int added = service(AcquisitionConfig.defaults()).download(SITE);

        // ASSERT
        ArgumentCaptor<AcquisitionPlan> plan = ArgumentCaptor.forClass(AcquisitionPlan.class);
        verify(source).fetch(eq(SITE), plan.capture());
        assertThat(plan.getValue().startDate()).isEqualTo(LocalDate.of(2020, 7, 1));
        assertThat(added).isEqualTo(1);
        ChainageTable stored = siteData.readRaw(SITE).orElseThrow();
        assertThat(stored.size()).isEqualTo(2);
        assertThat(stored.maxDate()).contains(Instant.parse("2020-07-16T22:00:00Z"));
    }

    @Test
    @DisplayName("Sin datos nuevos no se escribe nada")
    void download_shouldNotWriteWhenNothingNew() throws IOException {
        when(source.fetch(eq(SITE), any())).thenReturn(List.of());

        int added = service(AcquisitionConfig.defaults()).download(SITE);

        assertThat(added).isZero();
        assertThat(siteData.hasRaw(SITE)).isFalse();
    }

    @Test
    @DisplayName("Un arranque forzado descarta el histórico previo")
    void download_shouldReplaceHistoryOnForcedStart() throws IOException {
        // ARRANGE
        siteData.writeRaw(ChainageTable.of(SITE, List.of(obs("2020-06-30T22:00:00Z", 100.0))));
        when(source.fetch(eq(SITE), any())).thenReturn(List.of(obs("2019-01-05T22:00:00Z", 90.0)));
        AcquisitionConfig forced = AcquisitionConfig.defaults().withForceStartDate(LocalDate.of(2019, 1, 1));

        // ACT
        service(forced).download(SITE);

        // ASSERT
        ChainageTable stored = siteData.readRaw(SITE).orElseThrow();
        assertThat(stored.size()).isEqualTo(1);
        assertThat(stored.rows().get(0).chainage("t1")).isEqualTo(90.0);
    }
}
