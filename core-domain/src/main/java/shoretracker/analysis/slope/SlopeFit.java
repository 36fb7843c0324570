package shoretracker.analysis.slope;

/**
 * Pendiente estimada de un transecto con su banda de confianza ({@code ciLow <= slope <= ciHigh}
 * salvo redondeo de la malla fina).
 */
public record SlopeFit(double slope, double ciLow, double ciHigh) {
}
