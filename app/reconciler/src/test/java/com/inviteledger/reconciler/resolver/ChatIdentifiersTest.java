package com.inviteledger.reconciler.resolver;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChatIdentifiersTest {

  @Test
  void acceptsDigitsAndMentions() {
    assertThat(ChatIdentifiers.parse("123456789")).contains("123456789");
    assertThat(ChatIdentifiers.parse(" 42 ")).contains("42");
    assertThat(ChatIdentifiers.parse("<@123>")).contains("123");
    assertThat(ChatIdentifiers.parse("<@!123>")).contains("123");
  }

  @Test
  void rejectsNamesAndMalformedMentions() {
    assertThat(ChatIdentifiers.parse("alice")).isEmpty();
    assertThat(ChatIdentifiers.parse("12a")).isEmpty();
    assertThat(ChatIdentifiers.parse("<@alice>")).isEmpty();
    assertThat(ChatIdentifiers.parse("<@123")).isEmpty();
    assertThat(ChatIdentifiers.parse(null)).isEmpty();
  }
}
