package shoretracker.analysis.despike;

/**
 * Test de desviación local que decide qué muestras de una serie son atípicas.
 * <p>
 * Recibe valores sin huecos en orden temporal y devuelve las posiciones conservadas en orden
 * creciente. Nunca modifica valores: sólo elimina.
 */
public interface OutlierDetector {

    int[] retainedPositions(double[] values, double threshold);
}
