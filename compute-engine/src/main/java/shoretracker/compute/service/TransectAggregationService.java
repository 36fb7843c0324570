package shoretracker.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import shoretracker.analysis.merge.MergeMode;
import shoretracker.analysis.merge.MergeReport;
import shoretracker.analysis.merge.TransectMerger;
import shoretracker.compute.repository.TransectRepository;
import shoretracker.domain.transect.ResultFragment;
import shoretracker.domain.transect.Transect;
import shoretracker.domain.transect.TransectAttributes;
import shoretracker.domain.transect.TransectTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Dueño de la tabla compartida de transectos durante una ejecución.
 * <p>
 * Los trabajadores de cada sitio leen copias y entregan {@link ResultFragment}s; sólo este
 * servicio escribe en la tabla, siempre bajo el cerrojo.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TransectAggregationService {

    private final TransectRepository transectRepository;
    private final TransectMerger merger;

    private final ReentrantLock lock = new ReentrantLock();
    private TransectTable table;

    public void load(Path path) throws IOException {
        TransectTable loaded = transectRepository.load(path);
        lock.lock();
        try {
            table = loaded;
        } finally {
            lock.unlock();
        }
        log.info("Tabla de transectos cargada: {} transectos.", loaded.size());
    }

    public List<Transect> siteTransects(String siteId) {
        lock.lock();
        try {
            List<Transect> copies = new ArrayList<>();
            for (Transect t : requireTable().forSite(siteId)) {
                copies.add(t.copy());
            }
            return copies;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pendiente actual de cada transecto del sitio, en el orden de la tabla. Los valores
     * ausentes quedan como {@code null}.
     */
    public Map<String, Double> siteSlopes(String siteId) {
        lock.lock();
        try {
            Map<String, Double> slopes = new LinkedHashMap<>();
            for (Transect t : requireTable().forSite(siteId)) {
                slopes.put(t.getId(), t.getAttribute(TransectAttributes.BEACH_SLOPE));
            }
            return slopes;
        } finally {
            lock.unlock();
        }
    }

    public MergeReport apply(ResultFragment fragment) {
        lock.lock();
        try {
            MergeReport report = merger.merge(requireTable(), fragment);
            log.debug("[{}] Fragmento '{}' aplicado: {} transectos.", fragment.siteId(), fragment.stage(),
                    report.updatedIds().size());
            return report;
        } finally {
            lock.unlock();
        }
    }

    public void save(Path path) throws IOException {
        lock.lock();
        try {
            transectRepository.save(requireTable(), path);
        } finally {
            lock.unlock();
        }
        log.info("Tabla de transectos guardada en {}", path);
    }

    /**
     * Fusiona fragmentos en fichero sobre una tabla base y escribe el resultado.
     *
     * @param updateColumns Columnas a tomar de los fragmentos; {@code null} para todas.
     */
    public MergeReport aggregateFiles(Path base, List<Path> fragments, Path output, Set<String> updateColumns)
            throws IOException {
        TransectTable baseTable = transectRepository.load(base);
        log.info("Base {}: {} transectos.", base, baseTable.size());

        List<ResultFragment> loaded = new ArrayList<>();
        for (Path p : fragments) {
            if (!Files.exists(p)) {
                log.warn("Fragmento no encontrado, se omite: {}", p);
                continue;
            }
            loaded.add(transectRepository.loadFragment(p));
        }

        MergeReport report;
        if (loaded.isEmpty()) {
            log.warn("Sin fragmentos que fusionar; se copia la base.");
            report = MergeReport.empty();
        } else {
            report = merger.mergeAll(baseTable, loaded, MergeMode.SKIP_NULLS, updateColumns);
        }
        log.info("Transectos actualizados: {}", report.updatedIds().size());
        transectRepository.save(baseTable, output);
        return report;
    }

    private TransectTable requireTable() {
        if (table == null) {
            throw new IllegalStateException("Tabla de transectos no cargada");
        }
        return table;
    }
}
