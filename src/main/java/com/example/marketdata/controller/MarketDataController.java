package com.example.marketdata.controller;

import com.example.marketdata.model.MarketData;
import com.example.marketdata.model.OptionsQuote;
import com.example.marketdata.model.Timeframe;
import com.example.marketdata.quality.QualityReport;
import com.example.marketdata.service.MarketDataQueryService;
import com.example.marketdata.service.TradeFeedService;
import com.example.marketdata.stream.TradeStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for market data queries and the live trade feed.
 *
 * Endpoints:
 * - GET /api/market-data/capabilities - Provider name and capabilities
 * - GET /api/market-data/bars/{symbol}?start&end&timeframe - Historical bars
 * - GET /api/market-data/quote/{symbol} - Latest quote (midpoint close)
 * - GET /api/market-data/options/{symbol}?expiration - Options chain
 * - GET /api/market-data/quality/{symbol}?start&end&timeframe - Bar quality report
 * - POST /api/market-data/stream - Start streaming trades
 * - DELETE /api/market-data/stream - Stop streaming
 * - GET /api/market-data/stream - Stream status
 * - GET /api/market-data/trades/{symbol}/latest - Latest streamed trade
 */
@Slf4j
@RestController
@RequestMapping("/api/market-data")
@RequiredArgsConstructor
public class MarketDataController {

  private final MarketDataQueryService queryService;
  private final TradeFeedService tradeFeedService;

  @GetMapping("/capabilities")
  public ResponseEntity<Map<String, Object>> getCapabilities() {
    return ResponseEntity.ok(Map.of(
        "provider", queryService.getProviderName(),
        "capabilities", queryService.getCapabilities()
    ));
  }

  /**
   * Historical bars in ascending time order.
   *
   * @param start ISO-8601 instant, e.g. 2024-01-01T00:00:00Z
   * @param end ISO-8601 instant
   * @param timeframe 1Min, 5Min, 15Min, 30Min, 1H, 4H, 1D, 1W or 1M (default 1D)
   */
  @GetMapping("/bars/{symbol}")
  public ResponseEntity<Map<String, Object>> getBars(
      @PathVariable String symbol,
      @RequestParam("start") String start,
      @RequestParam("end") String end,
      @RequestParam(value = "timeframe", defaultValue = "1D") String timeframe) {

    Timeframe tf = Timeframe.parse(timeframe);
    log.debug("Bars request: {} {} {}..{}", symbol, tf, start, end);

    long startTime = System.currentTimeMillis();
    List<MarketData> bars = queryService.getBars(symbol, parseInstant(start), parseInstant(end), tf);
    long elapsed = System.currentTimeMillis() - startTime;

    return ResponseEntity.ok(Map.of(
        "symbol", symbol.toUpperCase(Locale.ROOT),
        "timeframe", tf.code(),
        "count", bars.size(),
        "bars", bars,
        "elapsedMs", elapsed
    ));
  }

  @GetMapping("/quote/{symbol}")
  public ResponseEntity<MarketData> getLatestQuote(@PathVariable String symbol) {
    return ResponseEntity.ok(queryService.getLatestQuote(symbol));
  }

  @GetMapping("/options/{symbol}")
  public ResponseEntity<Map<String, Object>> getOptionsChain(
      @PathVariable String symbol,
      @RequestParam(value = "expiration", required = false) String expiration) {

    LocalDate expirationDate = expiration != null && !expiration.isBlank()
        ? parseDate(expiration)
        : null;
    List<OptionsQuote> options = queryService.getOptionsChain(symbol, expirationDate);

    return ResponseEntity.ok(Map.of(
        "symbol", symbol.toUpperCase(Locale.ROOT),
        "expiration", expirationDate != null ? expirationDate.toString() : "",
        "count", options.size(),
        "options", options
    ));
  }

  @GetMapping("/quality/{symbol}")
  public ResponseEntity<Map<String, Object>> checkQuality(
      @PathVariable String symbol,
      @RequestParam("start") String start,
      @RequestParam("end") String end,
      @RequestParam(value = "timeframe", defaultValue = "1D") String timeframe) {

    QualityReport report = queryService.checkQuality(
        symbol, parseInstant(start), parseInstant(end), Timeframe.parse(timeframe));

    return ResponseEntity.ok(Map.of(
        "symbol", symbol.toUpperCase(Locale.ROOT),
        "clean", report.isClean(),
        "summary", report.countBySeverity(),
        "issues", report.getIssues(),
        "report", report.render()
    ));
  }

  /**
   * Start streaming trades. Body: {"symbols": ["AAPL", "TSLA"]}
   */
  @PostMapping("/stream")
  public ResponseEntity<Map<String, Object>> startStream(
      @RequestBody Map<String, List<String>> request) {

    List<String> symbols = request.get("symbols");

    if (symbols == null || symbols.isEmpty()) {
      return ResponseEntity.badRequest().body(Map.of(
          "error", "Missing 'symbols' array in request body"
      ));
    }

    TradeStream stream = tradeFeedService.start(symbols);
    return ResponseEntity.ok(Map.of(
        "state", stream.state(),
        "symbols", stream.symbols()
    ));
  }

  @DeleteMapping("/stream")
  public ResponseEntity<Map<String, Object>> stopStream() {
    boolean stopped = tradeFeedService.stop();
    return ResponseEntity.ok(Map.of(
        "stopped", stopped,
        "state", tradeFeedService.getState()
    ));
  }

  @GetMapping("/stream")
  public ResponseEntity<Map<String, Object>> getStreamStatus() {
    return ResponseEntity.ok(tradeFeedService.getStatus());
  }

  @GetMapping("/trades/{symbol}/latest")
  public ResponseEntity<MarketData> getLatestTrade(@PathVariable String symbol) {
    Optional<MarketData> trade = tradeFeedService.getLatestTrade(symbol);
    return trade.map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  private static Instant parseInstant(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid timestamp '" + value + "', expected ISO-8601 like 2024-01-01T00:00:00Z");
    }
  }

  private static LocalDate parseDate(String value) {
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid date '" + value + "', expected yyyy-MM-dd");
    }
  }
}
