package com.yupacgo.backend.market.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record StockQuote(
        String symbol,
        BigDecimal current,
        BigDecimal high,
        BigDecimal low,
        BigDecimal open,
        BigDecimal previousClose,
        BigDecimal change,
        BigDecimal changePercent,
        Instant timestamp,
        String provider
) {}
