package com.updownbot.hft.polymarket.http;

public class PolymarketHttpException extends RuntimeException {

  private final int statusCode;

  public PolymarketHttpException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public PolymarketHttpException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public PolymarketHttpException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * HTTP status, or -1 when the request never produced a response.
   */
  public int statusCode() {
    return statusCode;
  }

  public boolean isRetryable() {
    return statusCode < 0 || statusCode == 429 || statusCode >= 500;
  }
}
