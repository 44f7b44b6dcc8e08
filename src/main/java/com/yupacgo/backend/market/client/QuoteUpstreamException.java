package com.yupacgo.backend.market.client;

import lombok.Getter;

/** The quote provider answered with an error status, or with a body we could not read. */
@Getter
public class QuoteUpstreamException extends RuntimeException {

    private final int status;
    private final String bodySnippet;

    public QuoteUpstreamException(int status, String message, String bodySnippet) {
        super(message);
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public QuoteUpstreamException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.bodySnippet = null;
    }
}
