package com.inviteledger.reconciler.service;

import com.inviteledger.reconciler.model.InviteRecord;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

@Component
public class ExpiryMessageFormatter {

  private static final DateTimeFormatter EXPIRY_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

  public String format(InviteRecord record, long daysRemaining) {
    final String when = EXPIRY_FORMAT.format(record.accountExpiresAt());
    final String plan = record.plan() == null ? "" : record.plan() + " ";
    if (daysRemaining <= 0) {
      return "Your " + plan + "account expires today (" + when + "). Ask an admin to extend it.";
    }
    final String unit = daysRemaining == 1 ? "day" : "days";
    return "Your "
        + plan
        + "account expires in "
        + daysRemaining
        + " "
        + unit
        + " ("
        + when
        + "). Ask an admin to extend it.";
  }
}
