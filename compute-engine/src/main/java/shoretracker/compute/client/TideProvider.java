package shoretracker.compute.client;

import org.locationtech.jts.geom.Coordinate;

import java.time.Instant;

/**
 * Proveedor de alturas de marea para un punto (lon = x, lat = y) y un instante de la malla de 10 min.
 */
public interface TideProvider {

    /**
     * @throws shoretracker.domain.exception.TideProviderException si la consulta falla.
     */
    double tideAt(String siteId, Coordinate point, Instant timestamp);
}
