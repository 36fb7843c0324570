package shoretracker.compute.client;

import lombok.extern.slf4j.Slf4j;
import shoretracker.compute.io.CsvTableHandler;
import shoretracker.domain.observation.AcquisitionPlan;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Lee las exportaciones de la herramienta de extracción: {@code <inbox>/<sitio>.csv} con el mismo
 * formato que el histórico. Sólo devuelve las filas dentro de la ventana del plan (fechas UTC,
 * ambos extremos incluidos) y de los satélites pedidos.
 */
@Slf4j
public class ExportedObservationSource implements ObservationSource {

    private final CsvTableHandler csv;
    private final Path inbox;

    public ExportedObservationSource(CsvTableHandler csv, Path inbox) {
        this.csv = csv;
        this.inbox = inbox;
    }

    @Override
    public List<Observation> fetch(String siteId, AcquisitionPlan plan) {
        Path export = inbox.resolve(siteId + ".csv");
        if (!Files.isRegularFile(export)) {
            log.info("[{}] Sin exportación en {}.", siteId, export);
            return List.of();
        }
        ChainageTable table;
        try {
            table = csv.readChainage(export, siteId);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer la exportación " + export, e);
        }

        List<Observation> selected = new ArrayList<>();
        for (Observation o : table.rows()) {
            LocalDate day = o.date().atZone(ZoneOffset.UTC).toLocalDate();
            boolean inWindow = !day.isBefore(plan.startDate()) && !day.isAfter(plan.endDate());
            boolean satellite = plan.satellites().isEmpty() || plan.satellites().contains(o.satellite());
            if (inWindow && satellite) {
                selected.add(o);
            }
        }
        log.info("[{}] {} observaciones entre {} y {} ({} en la exportación).",
                siteId, selected.size(), plan.startDate(), plan.endDate(), table.size());
        return selected;
    }
}
