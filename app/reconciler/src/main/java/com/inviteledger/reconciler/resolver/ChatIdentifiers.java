package com.inviteledger.reconciler.resolver;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Recognises identifiers that already are chat-platform ids: plain digits or a mention. */
public final class ChatIdentifiers {

  private static final Pattern NUMERIC = Pattern.compile("\\d+");
  private static final Pattern MENTION = Pattern.compile("<@!?(\\d+)>");

  private ChatIdentifiers() {}

  public static Optional<String> parse(String raw) {
    if (raw == null) {
      return Optional.empty();
    }
    final String trimmed = raw.trim();
    if (NUMERIC.matcher(trimmed).matches()) {
      return Optional.of(trimmed);
    }
    final Matcher mention = MENTION.matcher(trimmed);
    if (mention.matches()) {
      return Optional.of(mention.group(1));
    }
    return Optional.empty();
  }
}
