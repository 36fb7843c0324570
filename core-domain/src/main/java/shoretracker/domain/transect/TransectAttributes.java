package shoretracker.domain.transect;

import java.util.List;

/**
 * Nombres de los atributos numéricos conocidos de un transecto.
 * <p>
 * Las columnas de la tabla compartida se descubren en tiempo de ejecución; estas constantes
 * sólo nombran las que producen las etapas de pendiente y tendencia.
 */
public final class TransectAttributes {

    public static final String BEACH_SLOPE = "beach_slope";
    /** Límite inferior del intervalo de confianza de la pendiente. */
    public static final String CIL = "cil";
    /** Límite superior del intervalo de confianza de la pendiente. */
    public static final String CIU = "ciu";

    public static final String TREND = "trend";
    public static final String INTERCEPT = "intercept";
    public static final String N_POINTS = "n_points";
    public static final String N_POINTS_NONAN = "n_points_nonan";
    public static final String R2_SCORE = "r2_score";
    public static final String MAE = "mae";
    public static final String MSE = "mse";
    public static final String RMSE = "rmse";

    public static final List<String> SLOPE_COLUMNS = List.of(BEACH_SLOPE, CIL, CIU);
    public static final List<String> TREND_COLUMNS =
            List.of(TREND, INTERCEPT, N_POINTS, N_POINTS_NONAN, R2_SCORE, MAE, MSE, RMSE);

    private TransectAttributes() {
    }

    public static boolean isMissing(Double value) {
        return value == null || value.isNaN();
    }
}
