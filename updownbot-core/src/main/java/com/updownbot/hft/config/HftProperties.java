package com.updownbot.hft.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix="hft")
public record HftProperties(
    TradingMode mode,
    @Valid Polymarket polymarket,
    @Valid Feed feed,
    @Valid Controller controller
) {

  public HftProperties {
    if (mode == null) {
      mode = TradingMode.SHADOW;
    }
    if (polymarket == null) {
      polymarket = defaultPolymarket();
    }
    if (feed == null) {
      feed = defaultFeed();
    }
    if (controller == null) {
      controller = defaultController();
    }
  }

  public static HftProperties defaults() {
    return new HftProperties(null, null, null, null);
  }

  private static Map<String, String> sanitizeSymbols(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      Map<String, String> symbols = new LinkedHashMap<>();
      symbols.put("BTC", "btcusdt");
      symbols.put("ETH", "ethusdt");
      symbols.put("SOL", "solusdt");
      symbols.put("XRP", "xrpusdt");
      return Collections.unmodifiableMap(symbols);
    }
    Map<String, String> out = new LinkedHashMap<>();
    values.forEach((symbol, stream) -> {
      if (symbol == null || symbol.isBlank() || stream == null || stream.isBlank()) {
        return;
      }
      out.put(symbol.trim().toUpperCase(Locale.ROOT), stream.trim().toLowerCase(Locale.ROOT));
    });
    return Collections.unmodifiableMap(out);
  }

  private static Polymarket defaultPolymarket() {
    return new Polymarket(null, null, null, null);
  }

  private static Retry defaultRetry() {
    return new Retry(null, null, null, null);
  }

  private static Feed defaultFeed() {
    return new Feed(null, null, null, null, null, null, null, null, null, null, null);
  }

  private static Controller defaultController() {
    return new Controller(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  public enum TradingMode {
    /**
     * Decisions and shadow tracking only. The only supported mode.
     */
    SHADOW,
    /**
     * Reserved. Order placement is not implemented and the controller refuses to start in this mode.
     */
    LIVE,
  }

  public record Polymarket(
      String gammaUrl,
      String clobRestUrl,
      /**
       * Upper bound for a single Gamma/CLOB request.
       */
      @NotNull @Positive Long httpTimeoutMillis,
      @Valid Retry retry
  ) {
    public Polymarket {
      if (gammaUrl == null || gammaUrl.isBlank()) {
        gammaUrl = "https://gamma-api.polymarket.com";
      }
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (httpTimeoutMillis == null) {
        httpTimeoutMillis = 10_000L;
      }
      if (retry == null) {
        retry = defaultRetry();
      }
    }
  }

  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 2;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 1_000L;
      }
    }
  }

  /**
   * Reference-price stream settings (exchange spot trades).
   */
  public record Feed(
      String streamUrl,
      /**
       * Tracked symbol to exchange stream name, e.g. {@code BTC -> btcusdt}.
       */
      Map<String, String> symbols,
      @NotNull @Min(10) Integer bufferSeconds,
      @NotNull @Min(5) Integer windowSeconds,
      @NotNull @Min(2) Integer minBuckets,
      @NotNull @Positive Long initialReconnectDelayMillis,
      /**
       * Ceiling for the exponential reconnect backoff.
       */
      @NotNull @Positive Long maxReconnectDelayMillis,
      @NotNull @Positive Long healthCheckIntervalMillis,
      /**
       * Force a reconnect when no message arrived for this long.
       */
      @NotNull @Positive Long staleThresholdMillis,
      /**
       * Time to let the buffer fill after the feed starts, before the first cycle.
       */
      @NotNull @PositiveOrZero Long warmupMillis,
      @NotNull @Positive Long connectTimeoutMillis
  ) {
    public Feed {
      if (streamUrl == null || streamUrl.isBlank()) {
        streamUrl = "wss://stream.binance.com:9443/stream";
      }
      symbols = sanitizeSymbols(symbols);
      if (windowSeconds == null) {
        windowSeconds = 60;
      }
      if (bufferSeconds == null) {
        bufferSeconds = 120;
      }
      if (bufferSeconds < windowSeconds * 2) {
        bufferSeconds = windowSeconds * 2;
      }
      if (minBuckets == null) {
        minBuckets = 10;
      }
      if (initialReconnectDelayMillis == null) {
        initialReconnectDelayMillis = 1_000L;
      }
      if (maxReconnectDelayMillis == null) {
        maxReconnectDelayMillis = 30_000L;
      }
      if (healthCheckIntervalMillis == null) {
        healthCheckIntervalMillis = 30_000L;
      }
      if (staleThresholdMillis == null) {
        staleThresholdMillis = 60_000L;
      }
      if (warmupMillis == null) {
        warmupMillis = 12_000L;
      }
      if (connectTimeoutMillis == null) {
        connectTimeoutMillis = 10_000L;
      }
    }
  }

  public record Controller(
      @NotNull @Min(1_000) Long intervalMillis,
      @NotNull @PositiveOrZero Long durationMillis,
      String outputDir,
      String decisionLogFile,
      String shadowLogFile,
      String snapshotFile,
      @NotNull @Min(1) Integer ringBufferSize,
      @Valid Signal signal,
      @Valid Edge edge,
      @Valid Cost cost,
      @Valid Gates gates,
      @Valid Persistence persistence,
      @Valid Counterfactual counterfactual,
      @Valid Shadow shadow
  ) {
    public Controller {
      if (intervalMillis == null) {
        intervalMillis = 60_000L;
      }
      if (durationMillis == null) {
        durationMillis = 3_600_000L;
      }
      if (outputDir == null || outputDir.isBlank()) {
        outputDir = ".";
      }
      if (decisionLogFile == null || decisionLogFile.isBlank()) {
        decisionLogFile = "crypto15m_decisions.jsonl";
      }
      if (shadowLogFile == null || shadowLogFile.isBlank()) {
        shadowLogFile = "crypto15m_shadow.jsonl";
      }
      if (snapshotFile == null || snapshotFile.isBlank()) {
        snapshotFile = "controller_state.json";
      }
      if (ringBufferSize == null) {
        ringBufferSize = 500;
      }
      if (signal == null) {
        signal = new Signal(null, null, null, null, null, null, null);
      }
      if (edge == null) {
        edge = new Edge(null, null, null, null);
      }
      if (cost == null) {
        cost = new Cost(null, null, null, null, null);
      }
      if (gates == null) {
        gates = new Gates(null, null, null, null);
      }
      if (persistence == null) {
        persistence = new Persistence(null);
      }
      if (counterfactual == null) {
        counterfactual = new Counterfactual(null, null);
      }
      if (shadow == null) {
        shadow = new Shadow(null, null);
      }
    }
  }

  /**
   * Probability model: {@code p = clamp(sigmoid(clamp(k * ret / (max(vol, volFloor * volMultiplier) + eps))))}.
   */
  public record Signal(
      @NotNull @PositiveOrZero Double volFloor,
      /**
       * Scales the floor used as the effective-volatility minimum. No documented derivation; tune freely.
       */
      @NotNull @Positive Double volMultiplier,
      @NotNull @Positive Double sigmoidK,
      @NotNull @Positive Double epsilon,
      @NotNull @Positive Double zClamp,
      @NotNull @PositiveOrZero @DecimalMax("0.5") Double probabilityMin,
      @NotNull @DecimalMax("1.0") Double probabilityMax
  ) {
    public Signal {
      if (volFloor == null) {
        volFloor = 0.0002;
      }
      if (volMultiplier == null) {
        volMultiplier = 1.0;
      }
      if (sigmoidK == null) {
        sigmoidK = 1.0;
      }
      if (epsilon == null) {
        epsilon = 1e-6;
      }
      if (zClamp == null) {
        zClamp = 6.0;
      }
      if (probabilityMin == null) {
        probabilityMin = 0.01;
      }
      if (probabilityMax == null) {
        probabilityMax = 0.99;
      }
    }
  }

  public record Edge(
      /**
       * Minimum {@code |p - upMid|} before a side is proposed.
       */
      @NotNull @PositiveOrZero Double proposalThreshold,
      /**
       * Fixed safety buffer subtracted from the edge together with fees and slippage.
       */
      @NotNull @PositiveOrZero Double buffer,
      @NotNull Double minNetEdge,
      /**
       * Below this many seconds to window close a persisted, gated proposal becomes EXIT.
       */
      @NotNull @PositiveOrZero Long exitSecondsRemaining
  ) {
    public Edge {
      if (proposalThreshold == null) {
        proposalThreshold = 0.02;
      }
      if (buffer == null) {
        buffer = 0.005;
      }
      if (minNetEdge == null) {
        minNetEdge = 0.03;
      }
      if (exitSecondsRemaining == null) {
        exitSecondsRemaining = 120L;
      }
    }
  }

  /**
   * Taker fee curve {@code feeRate * (p * (1 - p))^feeExponent} and touch-size slippage.
   */
  public record Cost(
      @NotNull @PositiveOrZero Double feeRate,
      @NotNull @Positive Double feeExponent,
      @NotNull @Positive Double notionalUsdc,
      @NotNull @Positive Double slippageCoefficient,
      @NotNull @PositiveOrZero Double maxSlippage
  ) {
    public Cost {
      if (feeRate == null) {
        feeRate = 0.25;
      }
      if (feeExponent == null) {
        feeExponent = 2.0;
      }
      if (notionalUsdc == null) {
        notionalUsdc = 100.0;
      }
      if (slippageCoefficient == null) {
        slippageCoefficient = 2.0;
      }
      if (maxSlippage == null) {
        maxSlippage = 0.05;
      }
    }
  }

  public record Gates(
      @NotNull @PositiveOrZero Double sanityTolerance,
      @NotNull @PositiveOrZero Double maxSpread,
      @NotNull @PositiveOrZero Double minDepth,
      @NotNull @PositiveOrZero Long minSecondsRemaining
  ) {
    public Gates {
      if (sanityTolerance == null) {
        sanityTolerance = 0.05;
      }
      if (maxSpread == null) {
        maxSpread = 0.03;
      }
      if (minDepth == null) {
        minDepth = 50.0;
      }
      if (minSecondsRemaining == null) {
        minSecondsRemaining = 240L;
      }
    }
  }

  public record Persistence(@NotNull @Min(1) Integer requiredCount) {
    public Persistence {
      if (requiredCount == null) {
        requiredCount = 2;
      }
    }
  }

  /**
   * Single-constraint relaxations used for "what if" diagnostics.
   */
  public record Counterfactual(
      @NotNull Double relaxedMinNetEdge,
      @NotNull @PositiveOrZero Double relaxedMaxSpread
  ) {
    public Counterfactual {
      if (relaxedMinNetEdge == null) {
        relaxedMinNetEdge = 0.0;
      }
      if (relaxedMaxSpread == null) {
        relaxedMaxSpread = 0.10;
      }
    }
  }

  public record Shadow(
      @NotNull Boolean enabled,
      /**
       * After this many UNRESOLVED/FETCH_ERROR lookups the proposal is closed as "could not resolve".
       */
      @NotNull @Min(1) Integer maxResolutionAttempts
  ) {
    public Shadow {
      if (enabled == null) {
        enabled = true;
      }
      if (maxResolutionAttempts == null) {
        maxResolutionAttempts = 30;
      }
    }
  }
}
