package shoretracker.config;

import lombok.Builder;
import lombok.With;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Ventana de adquisición de observaciones de satélite.
 *
 * @param globalStartDate Fecha mínima absoluta; ninguna petición empieza antes.
 * @param endDate         Fecha final solicitada al origen de observaciones.
 * @param satellites      Misiones a consultar (L5, L7, L8, L9...).
 * @param forceStartDate  Si no es null, se ignora el histórico del sitio y se empieza aquí
 *                        (ejecuciones de validación reproducibles).
 * @param validationMode  Modo validación: ventana reducida y procesado secuencial.
 */
@Builder
@With
public record AcquisitionConfig(
        LocalDate globalStartDate,
        LocalDate endDate,
        List<String> satellites,
        LocalDate forceStartDate,
        boolean validationMode
) {
    public AcquisitionConfig {
        satellites = satellites == null ? List.of() : List.copyOf(satellites);
        if (globalStartDate == null || endDate == null) {
            throw new IllegalArgumentException("La ventana de adquisición necesita fecha inicial y final");
        }
    }

    public Optional<LocalDate> forceStart() {
        return Optional.ofNullable(forceStartDate);
    }

    public static AcquisitionConfig defaults() {
        return AcquisitionConfig.builder()
                .globalStartDate(LocalDate.of(1984, 1, 1))
                .endDate(LocalDate.of(2030, 12, 30))
                .satellites(List.of("L5", "L7", "L8", "L9"))
                .validationMode(false)
                .build();
    }

    /**
     * Ventana reducida para validaciones: dos años de Landsat 8/9.
     */
    public static AcquisitionConfig validation(LocalDate start, LocalDate end) {
        return AcquisitionConfig.builder()
                .globalStartDate(start)
                .endDate(end)
                .satellites(List.of("L8", "L9"))
                .validationMode(true)
                .build();
    }
}
