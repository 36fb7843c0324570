package shoretracker.analysis.merge;

public enum MergeMode {
    /** Un valor nulo o NaN del fragmento no pisa el valor existente. */
    SKIP_NULLS,
    /** El fragmento se copia tal cual, nulos incluidos. */
    OVERWRITE
}
