package com.updownbot.hft.controller.web;

import com.updownbot.hft.config.HftProperties;
import com.updownbot.hft.controller.feed.ReferencePriceFeed;
import com.updownbot.hft.controller.runner.ControllerContext;
import com.updownbot.hft.controller.runner.ControllerSnapshot;
import com.updownbot.hft.controller.shadow.ShadowStats;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/controller")
@RequiredArgsConstructor
public class ControllerStatusController {

  private final @NonNull HftProperties properties;
  private final @NonNull ReferencePriceFeed feed;
  private final @NonNull ControllerContext context;

  @GetMapping("/status")
  public ResponseEntity<ControllerStatusResponse> status() {
    ControllerSnapshot snapshot = context.latestSnapshot();
    return ResponseEntity.ok(new ControllerStatusResponse(
        properties.mode().name(),
        feed.isConnected(),
        feed.lastMessageAtMillis(),
        context.pendingShadowProposals(),
        snapshot
    ));
  }

  @GetMapping("/shadow/stats")
  public ResponseEntity<ShadowStats> shadowStats() {
    ControllerSnapshot snapshot = context.latestSnapshot();
    if (snapshot == null || snapshot.shadowStats() == null) {
      return ResponseEntity.noContent().build();
    }
    return ResponseEntity.ok(snapshot.shadowStats());
  }

  public record ControllerStatusResponse(
      String mode,
      boolean feedConnected,
      long feedLastMessageAtMillis,
      int pendingShadowProposals,
      ControllerSnapshot lastSnapshot
  ) {
  }
}
