package com.inviteledger.reconciler.service;

import java.time.Instant;
import java.util.List;

public record ExpiryPassSummary(Instant passAt, List<ExpiryNoticeLine> lines) {

  public ExpiryPassSummary {
    lines = List.copyOf(lines);
  }

  public int scanned() {
    return lines.size();
  }

  public int notified() {
    return count(ExpiryNoticeLine.Result.NOTIFIED);
  }

  public int failed() {
    return count(ExpiryNoticeLine.Result.FAILED);
  }

  public int notDue() {
    return count(ExpiryNoticeLine.Result.NOT_DUE);
  }

  public int deduplicated() {
    return count(ExpiryNoticeLine.Result.DEDUPLICATED);
  }

  private int count(ExpiryNoticeLine.Result result) {
    return (int) lines.stream().filter(line -> line.result() == result).count();
  }
}
