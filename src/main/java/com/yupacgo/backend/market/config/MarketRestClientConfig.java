package com.yupacgo.backend.market.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class MarketRestClientConfig {

    @Bean("finnhubRestClient")
    public RestClient finnhubRestClient(
            @Value("${app.market.finnhub.base-url:https://finnhub.io/api/v1}") String baseUrl,
            @Value("${app.market.finnhub.connect-timeout:PT3S}") Duration connectTimeout,
            @Value("${app.market.finnhub.read-timeout:PT5S}") Duration readTimeout
    ) {
        HttpClient hc = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();

        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(hc);
        rf.setReadTimeout(readTimeout);

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(rf)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
