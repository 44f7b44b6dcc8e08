package com.yupacgo.backend.market.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yupacgo.backend.market.dto.StockQuote;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Optional;

@Component
public class FinnhubQuoteClient {

    static final String PROVIDER = "finnhub";
    private static final int MAX_ERROR_SNIPPET_BYTES = 1024;

    private final RestClient http;
    private final ObjectMapper om;
    private final String apiKey;

    public FinnhubQuoteClient(
            @Qualifier("finnhubRestClient") RestClient http,
            ObjectMapper om,
            @Value("${app.market.finnhub.api-key:}") String apiKey
    ) {
        this.http = http;
        this.om = om;
        this.apiKey = apiKey;
    }

    /**
     * @return empty when the provider does not know the symbol (it reports a current price of 0)
     * @throws QuoteUpstreamException on a 4xx/5xx, an unreachable provider or an unreadable body
     */
    public Optional<StockQuote> fetchQuote(String symbol) {
        final String body;
        try {
            body = http.get()
                    .uri(b -> b.path("/quote")
                            .queryParam("symbol", symbol)
                            .queryParam("token", apiKey)
                            .build())
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        int status = res.getStatusCode().value();
                        throw new QuoteUpstreamException(status, "FINNHUB_HTTP_" + status,
                                readBodySnippetQuietly(res));
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new QuoteUpstreamException("FINNHUB_UNREACHABLE", e);
        }

        if (body == null || body.isBlank()) return Optional.empty();

        final JsonNode n;
        try {
            n = om.readTree(body);
        } catch (IOException e) {
            throw new QuoteUpstreamException("FINNHUB_JSON_PARSE_FAILED", e);
        }

        BigDecimal current = decimal(n, "c");
        if (current == null || current.signum() == 0) return Optional.empty();

        long t = n.path("t").asLong(0);
        return Optional.of(new StockQuote(
                symbol,
                current,
                decimal(n, "h"),
                decimal(n, "l"),
                decimal(n, "o"),
                decimal(n, "pc"),
                decimal(n, "d"),
                decimal(n, "dp"),
                t > 0 ? Instant.ofEpochSecond(t) : null,
                PROVIDER
        ));
    }

    private static BigDecimal decimal(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull() || !v.isNumber()) return null;
        return v.decimalValue();
    }

    private static String readBodySnippetQuietly(ClientHttpResponse res) {
        try (InputStream in = res.getBody()) {
            byte[] bytes = in.readNBytes(MAX_ERROR_SNIPPET_BYTES);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return null;
        }
    }
}
