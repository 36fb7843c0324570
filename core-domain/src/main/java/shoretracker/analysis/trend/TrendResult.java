package shoretracker.analysis.trend;

/**
 * Ajuste lineal de un transecto: chainage (m) frente a años desde la primera observación del sitio.
 *
 * @param trend        Pendiente del ajuste (m/año).
 * @param intercept    Ordenada en el origen (m).
 * @param nPoints      Filas de la tabla del sitio, con o sin valor en este transecto.
 * @param nPointsNonan Filas con valor en este transecto (las usadas en el ajuste).
 * @param r2           Coeficiente de determinación; NaN con menos de dos puntos.
 */
public record TrendResult(
        String transectId,
        double trend,
        double intercept,
        int nPoints,
        int nPointsNonan,
        double r2,
        double mae,
        double mse,
        double rmse
) {
}
