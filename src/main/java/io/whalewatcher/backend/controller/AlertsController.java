package io.whalewatcher.backend.controller;

import io.whalewatcher.backend.model.AlertsSummary;
import io.whalewatcher.backend.model.ChatRequest;
import io.whalewatcher.backend.model.ChatResponse;
import io.whalewatcher.backend.model.TransferRecord;
import io.whalewatcher.backend.model.WhaleTransferList;
import io.whalewatcher.backend.service.WhaleInsightService;
import io.whalewatcher.backend.service.WhaleQueryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/alerts", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class AlertsController {
  static final String EMPTY_SUMMARY = "No whale transfers found (or provider returned nothing).";

  private final WhaleQueryService whales;
  private final WhaleInsightService insights;

  public AlertsController(WhaleQueryService whales, WhaleInsightService insights) {
    this.whales = whales;
    this.insights = insights;
  }

  @GetMapping("/latest")
  public Mono<WhaleTransferList> latest(
      @RequestParam(value = "limit", required = false, defaultValue = "200") @Min(1) @Max(1000)
          int limit,
      @RequestParam(value = "min_amount", required = false, defaultValue = "100.0")
          @DecimalMin("0.0")
          double minAmount) {
    requireFinite(minAmount);
    return Mono.fromCallable(() -> toTransferList(whales.fetchWhales(limit, minAmount), minAmount))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping("/summary")
  public Mono<AlertsSummary> summary(
      @RequestParam(value = "limit", required = false, defaultValue = "20") @Min(1) @Max(1000)
          int limit,
      @RequestParam(value = "min_amount", required = false, defaultValue = "100.0")
          @DecimalMin("0.0")
          double minAmount) {
    requireFinite(minAmount);
    return Mono.fromCallable(() -> insights.summarize(limit, minAmount))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @PostMapping(path = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ChatResponse> chat(
      @RequestBody @Valid ChatRequest request,
      @RequestParam(value = "limit", required = false, defaultValue = "20") @Min(1) @Max(1000)
          int limit,
      @RequestParam(value = "min_amount", required = false, defaultValue = "100.0")
          @DecimalMin("0.0")
          double minAmount) {
    requireFinite(minAmount);
    return Mono.fromCallable(() -> insights.chat(request.question(), limit, minAmount))
        .subscribeOn(Schedulers.boundedElastic());
  }

  // @DecimalMin lets "Infinity" through.
  private static void requireFinite(double minAmount) {
    if (!Double.isFinite(minAmount)) {
      throw new IllegalArgumentException("min_amount must be a finite number");
    }
  }

  private static WhaleTransferList toTransferList(List<TransferRecord> transfers, double minAmount) {
    if (transfers.isEmpty()) {
      return new WhaleTransferList(List.of(), 0, EMPTY_SUMMARY);
    }
    String threshold = BigDecimal.valueOf(minAmount).stripTrailingZeros().toPlainString();
    return new WhaleTransferList(
        transfers,
        transfers.size(),
        "Showing up to " + transfers.size() + " whale transfers with amount >= " + threshold + ".");
  }
}
