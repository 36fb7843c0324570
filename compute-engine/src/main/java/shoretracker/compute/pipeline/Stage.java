package shoretracker.compute.pipeline;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Etapas invocables desde la línea de comandos.
 */
public enum Stage {

    DOWNLOAD("download", false, false),
    TIDES_FETCH("tides-fetch", false, false),
    TIDES_APPLY("tides-apply", true, false),
    SLOPE("slope", true, true),
    TRENDS("trends", true, true),
    AGGREGATE("aggregate", false, false),
    /** download → mareas → pendiente → corrección → tendencias, sitio a sitio. */
    ALL("all", true, true);

    private final String cliName;
    private final boolean readsTransectTable;
    private final boolean writesTransectTable;

    Stage(String cliName, boolean readsTransectTable, boolean writesTransectTable) {
        this.cliName = cliName;
        this.readsTransectTable = readsTransectTable;
        this.writesTransectTable = writesTransectTable;
    }

    public String cliName() {
        return cliName;
    }

    public boolean readsTransectTable() {
        return readsTransectTable;
    }

    public boolean writesTransectTable() {
        return writesTransectTable;
    }

    public static Stage fromCli(String name) {
        for (Stage s : values()) {
            if (s.cliName.equalsIgnoreCase(name)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Etapa desconocida '" + name + "'. Valores: "
                + Arrays.stream(values()).map(Stage::cliName).collect(Collectors.joining(", ")));
    }
}
