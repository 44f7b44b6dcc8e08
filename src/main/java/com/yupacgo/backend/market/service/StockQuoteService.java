package com.yupacgo.backend.market.service;

import com.yupacgo.backend.cache.CacheClient;
import com.yupacgo.backend.common.web.ValidationException;
import com.yupacgo.backend.market.client.FinnhubQuoteClient;
import com.yupacgo.backend.market.dto.StockQuote;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.regex.Pattern;

/** Cache-aside quote lookup. The cache is an optimisation only; a cold or dead cache still answers. */
@Slf4j
@Service
public class StockQuoteService {

    public static final String KEY_PREFIX = "quote:";
    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9.\\-]{1,15}");

    private final CacheClient cache;
    private final FinnhubQuoteClient finnhub;
    private final long ttlSeconds;

    public StockQuoteService(CacheClient cache,
                             FinnhubQuoteClient finnhub,
                             @Value("${app.market.quote-ttl-sec:60}") long ttlSeconds) {
        this.cache = cache;
        this.finnhub = finnhub;
        this.ttlSeconds = ttlSeconds;
    }

    public StockQuote quote(String rawSymbol) {
        String symbol = normalize(rawSymbol);
        String key = KEY_PREFIX + symbol;

        Optional<StockQuote> cached = cache.get(key, StockQuote.class);
        if (cached.isPresent()) {
            log.debug("quote cache hit symbol={}", symbol);
            return cached.get();
        }

        StockQuote fresh = finnhub.fetchQuote(symbol)
                .orElseThrow(() -> new NoSuchElementException("Stock not found: " + symbol));
        cache.set(key, fresh, ttlSeconds);
        return fresh;
    }

    static String normalize(String raw) {
        String s = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        if (!SYMBOL.matcher(s).matches()) {
            throw new ValidationException("Invalid stock symbol");
        }
        return s;
    }
}
