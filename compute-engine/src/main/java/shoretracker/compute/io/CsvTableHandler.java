package shoretracker.compute.io;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import shoretracker.domain.observation.ChainageTable;
import shoretracker.domain.observation.Observation;
import shoretracker.domain.tide.TideSample;
import shoretracker.domain.tide.TideSeries;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lectura y escritura de las tablas CSV por sitio.
 * <ul>
 *   <li>Chainage (bruta y corregida): {@code dates,satname,<transectos...>}, dos decimales,
 *   celda vacía = hueco.</li>
 *   <li>Mareas: {@code dates,tide}.</li>
 * </ul>
 * Las escrituras van a un temporal que luego se mueve sobre el destino, de modo que un fallo a
 * mitad no deja el fichero anterior truncado.
 */
@Slf4j
public class CsvTableHandler {

    public static final String DATES = "dates";
    public static final String SATNAME = "satname";
    public static final String TIDE = "tide";

    /** Columnas de índice que dejan otras herramientas al exportar. */
    private static final Set<String> IGNORED_COLUMNS = Set.of("", "Unnamed: 0", "index");
    private static final Pattern OFFSET_SUFFIX = Pattern.compile(".*(Z|[+-]\\d{2}:?\\d{2})$");

    static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .appendOffset("+HH:MM", "+00:00")
            .toFormatter(Locale.ROOT);

    // Comillas sólo cuando el valor lleva separador, comillas o salto de línea.
    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public ChainageTable readChainage(Path path, String siteId) throws IOException {
        log.debug("Leyendo tabla de chainage {}", path.toAbsolutePath());
        List<String> header = new ArrayList<>();
        List<Map<String, String>> records = readRecords(path, header);

        List<String> transectIds = new ArrayList<>();
        for (String column : header) {
            if (!DATES.equals(column) && !SATNAME.equals(column) && !IGNORED_COLUMNS.contains(column)) {
                transectIds.add(column);
            }
        }
        if (!header.contains(DATES)) {
            throw new IOException("La tabla " + path + " no tiene columna '" + DATES + "'");
        }

        List<Observation> rows = new ArrayList<>(records.size());
        for (Map<String, String> record : records) {
            Map<String, Double> values = new LinkedHashMap<>();
            for (String id : transectIds) {
                values.put(id, parseValue(record.get(id)));
            }
            rows.add(new Observation(parseTimestamp(record.get(DATES)), emptyToNull(record.get(SATNAME)), values));
        }
        return new ChainageTable(siteId, transectIds, rows);
    }

    public void writeChainage(Path path, ChainageTable table) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder().addColumn(DATES).addColumn(SATNAME);
        table.transectIds().forEach(builder::addColumn);
        CsvSchema schema = builder.build().withHeader();

        List<String[]> lines = new ArrayList<>(table.size());
        for (Observation o : table.rows()) {
            String[] line = new String[table.transectIds().size() + 2];
            line[0] = formatTimestamp(o.date());
            line[1] = o.satellite() == null ? "" : o.satellite();
            for (int i = 0; i < table.transectIds().size(); i++) {
                Double v = o.chainage(table.transectIds().get(i));
                line[i + 2] = v == null || v.isNaN() ? "" : String.format(Locale.ROOT, "%.2f", v);
            }
            lines.add(line);
        }
        write(path, schema, lines);
        log.info("[{}] {} filas escritas en {}", table.siteId(), table.size(), path);
    }

    public TideSeries readTides(Path path, String siteId) throws IOException {
        log.debug("Leyendo mareas {}", path.toAbsolutePath());
        List<String> header = new ArrayList<>();
        List<Map<String, String>> records = readRecords(path, header);
        if (!header.contains(DATES) || !header.contains(TIDE)) {
            throw new IOException("La tabla de mareas " + path + " necesita columnas '" + DATES + "' y '" + TIDE + "'");
        }
        List<TideSample> samples = new ArrayList<>(records.size());
        for (Map<String, String> record : records) {
            Double height = parseValue(record.get(TIDE));
            if (height != null) {
                samples.add(new TideSample(parseTimestamp(record.get(DATES)), height));
            }
        }
        return TideSeries.of(siteId, samples);
    }

    public void writeTides(Path path, TideSeries tides) throws IOException {
        CsvSchema schema = CsvSchema.builder().addColumn(DATES).addColumn(TIDE).build().withHeader();
        List<String[]> lines = new ArrayList<>(tides.size());
        for (TideSample s : tides.samples()) {
            lines.add(new String[]{formatTimestamp(s.timestamp()), Double.toString(s.height())});
        }
        write(path, schema, lines);
        log.info("[{}] {} mareas escritas en {}", tides.siteId(), tides.size(), path);
    }

    public static Instant parseTimestamp(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Fecha vacía");
        }
        String s = text.trim().replace(' ', 'T');
        if (s.length() == 10) {
            return LocalDate.parse(s).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (OFFSET_SUFFIX.matcher(s).matches()) {
            return OffsetDateTime.parse(s).toInstant();
        }
        return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
    }

    public static String formatTimestamp(Instant instant) {
        return TIMESTAMP.format(instant.atOffset(ZoneOffset.UTC));
    }

    private List<Map<String, String>> readRecords(Path path, List<String> header) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = CSV.readerFor(Map.class).with(schema).readValues(path.toFile())) {
            List<Map<String, String>> records = it.readAll();
            if (it.getParserSchema() instanceof CsvSchema parsed) {
                for (CsvSchema.Column column : parsed) {
                    header.add(column.getName());
                }
            }
            return records;
        } catch (IOException e) {
            log.error("Error al leer el CSV {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    private void write(Path path, CsvSchema schema, List<String[]> lines) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path tmp = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
        try {
            try (SequenceWriter writer = CSV.writer(schema).writeValues(tmp.toFile())) {
                for (String[] line : lines) {
                    writer.write(line);
                }
            }
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.error("Error al escribir el CSV {}", path.toAbsolutePath(), e);
            Files.deleteIfExists(tmp);
            throw e;
        }
    }

    private static Double parseValue(String text) {
        if (text == null) {
            return null;
        }
        String s = text.trim();
        if (s.isEmpty() || s.equalsIgnoreCase("nan") || s.equalsIgnoreCase("null")) {
            return null;
        }
        return Double.parseDouble(s);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
