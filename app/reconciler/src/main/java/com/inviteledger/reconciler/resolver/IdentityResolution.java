package com.inviteledger.reconciler.resolver;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Ranked candidates for one raw identifier, most confident first. */
public record IdentityResolution(String raw, List<IdentityCandidate> candidates) {

  public IdentityResolution {
    candidates = List.copyOf(candidates);
  }

  public Optional<IdentityCandidate> best() {
    return candidates.stream().findFirst();
  }

  /**
   * The chat id carried by the most confident candidates that have one. Empty when no candidate
   * has a chat id or when candidates of that confidence disagree.
   */
  public Optional<String> chatId() {
    final Optional<MatchConfidence> level =
        candidates.stream()
            .filter(candidate -> candidate.chatId() != null)
            .map(IdentityCandidate::confidence)
            .findFirst();
    if (level.isEmpty()) {
      return Optional.empty();
    }
    final Set<String> ids = new LinkedHashSet<>();
    for (IdentityCandidate candidate : candidates) {
      if (candidate.chatId() != null && candidate.confidence() == level.get()) {
        ids.add(candidate.chatId());
      }
    }
    return ids.size() == 1 ? Optional.of(ids.iterator().next()) : Optional.empty();
  }

  /** True when candidates carry chat ids but no single one wins. */
  public boolean ambiguousChatId() {
    return chatId().isEmpty() && candidates.stream().anyMatch(c -> c.chatId() != null);
  }

  /** Distinct remote usernames in confidence order. */
  public List<String> remoteUsernames() {
    final Set<String> names = new LinkedHashSet<>();
    for (IdentityCandidate candidate : candidates) {
      if (candidate.remoteUsername() != null) {
        names.add(candidate.remoteUsername());
      }
    }
    return List.copyOf(names);
  }
}
