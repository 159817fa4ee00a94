package com.updownbot.hft.polymarket.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.updownbot.hft.config.HftProperties;
import com.updownbot.hft.market.MarketResolver;
import com.updownbot.hft.market.UpDown15mMarketResolver;
import com.updownbot.hft.outcome.GammaOutcomeResolver;
import com.updownbot.hft.outcome.OutcomeResolver;
import com.updownbot.hft.polymarket.clob.PolymarketClobClient;
import com.updownbot.hft.polymarket.gamma.PolymarketGammaClient;
import com.updownbot.hft.polymarket.http.PolymarketHttpTransport;
import com.updownbot.hft.polymarket.http.RetryPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class PolymarketConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public HttpClient httpClient(HftProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(properties.polymarket().httpTimeoutMillis()))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public PolymarketHttpTransport polymarketHttpTransport(
      HftProperties properties,
      HttpClient httpClient,
      ObjectMapper objectMapper
  ) {
    RetryPolicy retry = buildRetryPolicy(properties.polymarket().retry());
    return new PolymarketHttpTransport(httpClient, objectMapper, retry);
  }

  @Bean
  public PolymarketGammaClient polymarketGammaClient(HftProperties properties, PolymarketHttpTransport transport) {
    HftProperties.Polymarket polymarket = properties.polymarket();
    return new PolymarketGammaClient(
        URI.create(polymarket.gammaUrl()),
        transport,
        Duration.ofMillis(polymarket.httpTimeoutMillis())
    );
  }

  @Bean
  public PolymarketClobClient polymarketClobClient(HftProperties properties, PolymarketHttpTransport transport) {
    HftProperties.Polymarket polymarket = properties.polymarket();
    return new PolymarketClobClient(
        URI.create(polymarket.clobRestUrl()),
        transport,
        Duration.ofMillis(polymarket.httpTimeoutMillis())
    );
  }

  @Bean
  @ConditionalOnMissingBean(MarketResolver.class)
  public MarketResolver marketResolver(
      PolymarketGammaClient gammaClient,
      PolymarketClobClient clobClient,
      ObjectMapper objectMapper
  ) {
    return new UpDown15mMarketResolver(gammaClient, clobClient, objectMapper);
  }

  @Bean
  @ConditionalOnMissingBean(OutcomeResolver.class)
  public OutcomeResolver outcomeResolver(PolymarketGammaClient gammaClient, ObjectMapper objectMapper) {
    return new GammaOutcomeResolver(gammaClient, objectMapper);
  }

  static RetryPolicy buildRetryPolicy(HftProperties.Retry cfg) {
    if (cfg == null) {
      return RetryPolicy.none();
    }
    return new RetryPolicy(
        cfg.enabled(),
        Math.max(1, cfg.maxAttempts()),
        Math.max(0, cfg.initialBackoffMillis()),
        Math.max(0, cfg.maxBackoffMillis())
    );
  }
}
