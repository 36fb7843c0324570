package shoretracker.compute.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import shoretracker.domain.exception.TideProviderException;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Cliente del servicio de mareas de NIWA.
 * <p>
 * Cada consulta pide dos días de predicción a 10 minutos sobre el nivel medio del mar a partir
 * de la fecha (UTC) del instante, y se queda con la altura del instante exacto.
 * Un 429 se traduce en {@link TideProviderException} marcada como límite de tasa.
 */
@Slf4j
public class NiwaTideClient implements TideProvider {

    static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final WebClient webClient;
    private final String apiKey;
    private final Duration blockTimeout;

    public NiwaTideClient(WebClient webClient, String apiKey, Duration blockTimeout) {
        this.webClient = webClient;
        this.apiKey = apiKey;
        this.blockTimeout = blockTimeout;
    }

    @Override
    public double tideAt(String siteId, Coordinate point, Instant timestamp) {
        String startDate = timestamp.atZone(ZoneOffset.UTC).toLocalDate().toString();
        log.debug("[{}] Consulta de marea {} en ({}, {}).", siteId, timestamp, point.getY(), point.getX());
        NiwaTideResponse response;
        try {
            response = webClient.get()
                    .uri(uri -> uri
                            .queryParam("lat", point.getY())
                            .queryParam("long", point.getX())
                            .queryParam("numberOfDays", 2)
                            .queryParam("startDate", startDate)
                            .queryParam("datum", "MSL")
                            .queryParam("interval", 10)
                            .queryParam("apikey", apiKey)
                            .build())
                    .retrieve()
                    .onStatus(status -> status.value() == HTTP_TOO_MANY_REQUESTS,
                            r -> Mono.error(TideProviderException.rateLimited(siteId, "Límite de peticiones superado")))
                    .onStatus(HttpStatusCode::isError, r -> r.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> new TideProviderException(siteId,
                                    "HTTP " + r.statusCode().value() + ": " + body, false)))
                    .bodyToMono(NiwaTideResponse.class)
                    .block(blockTimeout);
        } catch (TideProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TideProviderException(siteId, "Error consultando marea para " + timestamp + ": " + e.getMessage(), e);
        }

        if (response == null || response.values() == null) {
            throw new TideProviderException(siteId, "Respuesta de marea vacía para " + startDate, false);
        }
        for (TideValue v : response.values()) {
            if (v.time() != null && v.value() != null && parseTime(v.time()).equals(timestamp)) {
                return v.value();
            }
        }
        throw new TideProviderException(siteId, "La respuesta no contiene el instante " + timestamp, false);
    }

    private static Instant parseTime(String time) {
        return OffsetDateTime.parse(time).toInstant();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record NiwaTideResponse(List<TideValue> values) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TideValue(String time, Double value) {
    }
}
