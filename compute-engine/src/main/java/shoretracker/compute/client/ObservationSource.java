package shoretracker.compute.client;

import shoretracker.domain.observation.AcquisitionPlan;
import shoretracker.domain.observation.Observation;

import java.util.List;

/**
 * Origen de observaciones nuevas de un sitio (la extracción de líneas de costa desde imágenes
 * queda fuera del motor). Una lista vacía significa "sin datos nuevos".
 */
public interface ObservationSource {

    List<Observation> fetch(String siteId, AcquisitionPlan plan);
}
