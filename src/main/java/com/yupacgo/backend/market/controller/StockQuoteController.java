package com.yupacgo.backend.market.controller;

import com.yupacgo.backend.common.web.ApiResponse;
import com.yupacgo.backend.market.dto.StockQuote;
import com.yupacgo.backend.market.service.StockQuoteService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stocks")
public class StockQuoteController {

    private final StockQuoteService quotes;

    public StockQuoteController(StockQuoteService quotes) {
        this.quotes = quotes;
    }

    @GetMapping("/quote/{symbol}")
    public ApiResponse<StockQuote> quote(@PathVariable String symbol) {
        return ApiResponse.ok(quotes.quote(symbol));
    }
}
