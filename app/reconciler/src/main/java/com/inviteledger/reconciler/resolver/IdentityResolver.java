/*
 * Where: reconciler identity resolution
 * What: turns a raw admin-supplied identifier into ranked (chat id, remote username) pairings
 * Why: the two directories share no key, so every lifecycle action starts from fuzzy evidence
 */
package com.inviteledger.reconciler.resolver;

import com.inviteledger.reconciler.config.DirectorySyncProperties;
import com.inviteledger.reconciler.model.DirectoryEntry;
import com.inviteledger.reconciler.model.InviteRecord;
import com.inviteledger.reconciler.repository.DirectoryCacheRepository;
import com.inviteledger.reconciler.repository.InviteRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdentityResolver {

  private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

  private final InviteRepository inviteRepository;
  private final DirectoryCacheRepository directoryCacheRepository;
  private final ObjectProvider<ChatProfileLookup> chatProfileLookup;
  private final DirectorySyncProperties syncProperties;
  private final Clock clock;

  public IdentityResolution resolve(String rawIdentifier) {
    if (rawIdentifier == null || rawIdentifier.isBlank()) {
      throw new IllegalArgumentException("identifier is required");
    }
    final String raw = rawIdentifier.trim();
    final Resolution resolution = new Resolution(raw, Instant.now(clock));
    final Optional<String> parsed = ChatIdentifiers.parse(raw).or(() -> storedChatId(raw));

    parsed.ifPresent(resolution::resolveChatIdForm);
    if (!resolution.remoteConfirmed) {
      resolution.matchNames(parsed.isEmpty());
    }
    if (resolution.chatId == null) {
      resolution.reverseLookupLocal();
    }
    if (!resolution.remoteConfirmed) {
      resolution.force(parsed.isEmpty());
    }
    final IdentityResolution result = new IdentityResolution(raw, resolution.ranked());
    logger.debug(
        "identity resolved raw={} candidates={} chatId={}",
        raw,
        result.candidates().size(),
        result.chatId().orElse(null));
    return result;
  }

  private final class Resolution {

    private final String raw;
    private final Instant now;
    private final List<IdentityCandidate> candidates = new ArrayList<>();
    private String chatId;
    private boolean remoteConfirmed;

    private Resolution(String raw, Instant now) {
      this.raw = raw;
      this.now = now;
    }

    void resolveChatIdForm(String parsedChatId) {
      chatId = parsedChatId;
      add(parsedChatId, null, MatchConfidence.CONFIRMED_DIRECT, "chat-id");
      lookupOne("cache-by-chat-id", () -> directoryCacheRepository.findByChatId(parsedChatId))
          .ifPresent(
              entry -> {
                if (stale(entry)) {
                  add(parsedChatId, entry.remoteUsername(), MatchConfidence.FORCED, "stale-cache-link");
                  return;
                }
                add(parsedChatId, entry.remoteUsername(), MatchConfidence.CONFIRMED_DIRECT, "cache-link");
                remoteConfirmed = true;
              });
    }

    void matchNames(boolean includeRaw) {
      final Set<String> names = new LinkedHashSet<>();
      if (includeRaw) {
        names.add(raw);
      }
      names.addAll(knownHandles());
      for (String name : names) {
        final Optional<DirectoryEntry> hit =
            lookupOne("cache-by-name", () -> directoryCacheRepository.findByRemoteUsername(name));
        if (hit.isEmpty()) {
          continue;
        }
        final DirectoryEntry entry = hit.get();
        if (chatId != null && entry.linkedChatId() != null && !chatId.equals(entry.linkedChatId())) {
          logger.info(
              "name match skipped because remote account is linked elsewhere name={} chatId={} linkedChatId={}",
              name,
              chatId,
              entry.linkedChatId());
          continue;
        }
        final String pairedChatId = chatId != null ? chatId : entry.linkedChatId();
        if (stale(entry)) {
          add(pairedChatId, entry.remoteUsername(), MatchConfidence.FORCED, "stale-name-match");
          continue;
        }
        add(pairedChatId, entry.remoteUsername(), MatchConfidence.NAME_MATCH, "name-match");
        remoteConfirmed = true;
        if (chatId == null && entry.linkedChatId() != null) {
          chatId = entry.linkedChatId();
        }
      }
    }

    void reverseLookupLocal() {
      final Set<String> labels = new LinkedHashSet<>();
      for (IdentityCandidate candidate : candidates) {
        if (candidate.remoteUsername() != null && candidate.confidence() != MatchConfidence.FORCED) {
          labels.add(candidate.remoteUsername());
        }
      }
      labels.add(raw);
      final Set<String> matchedChatIds = new LinkedHashSet<>();
      for (String label : labels) {
        List<InviteRecord> records =
            lookupAll("local-by-name", () -> inviteRepository.findByDisplayName(label));
        if (records.isEmpty()) {
          records = lookupAll("local-by-pattern", () -> inviteRepository.findByDisplayNamePattern(label));
        }
        final String pairedRemote = label.equals(raw) ? remoteFor(raw) : label;
        for (InviteRecord record : records) {
          matchedChatIds.add(record.chatId());
          if (pairedRemote != null) {
            add(record.chatId(), pairedRemote, MatchConfidence.LOCAL_REVERSE, "local-display-name");
            continue;
          }
          final Optional<DirectoryEntry> linked =
              lookupOne("cache-by-chat-id", () -> directoryCacheRepository.findByChatId(record.chatId()));
          if (linked.isPresent() && !stale(linked.get())) {
            add(record.chatId(), linked.get().remoteUsername(), MatchConfidence.LOCAL_REVERSE, "local-display-name");
            remoteConfirmed = true;
          } else {
            add(record.chatId(), null, MatchConfidence.LOCAL_REVERSE, "local-display-name");
          }
        }
      }
      if (matchedChatIds.size() == 1) {
        chatId = matchedChatIds.iterator().next();
      }
    }

    /** A name-form identifier is always tried verbatim, ahead of the handles known for the chat id. */
    void force(boolean rawIsName) {
      final Set<String> names = new LinkedHashSet<>();
      if (rawIsName) {
        names.add(raw);
      }
      names.addAll(knownHandles());
      for (String name : names) {
        add(chatId, name, MatchConfidence.FORCED, "forced");
      }
    }

    List<IdentityCandidate> ranked() {
      final List<IdentityCandidate> sorted = new ArrayList<>(candidates);
      sorted.sort(Comparator.comparing(IdentityCandidate::confidence));
      final Set<String> pairedChatIds = new HashSet<>();
      for (IdentityCandidate candidate : sorted) {
        if (candidate.chatId() != null && candidate.remoteUsername() != null) {
          pairedChatIds.add(candidate.chatId());
        }
      }
      final Set<List<String>> seen = new HashSet<>();
      final List<IdentityCandidate> result = new ArrayList<>();
      for (IdentityCandidate candidate : sorted) {
        if (candidate.remoteUsername() == null && pairedChatIds.contains(candidate.chatId())) {
          continue;
        }
        if (seen.add(Arrays.asList(candidate.chatId(), candidate.remoteUsername()))) {
          result.add(candidate);
        }
      }
      return result;
    }

    private String remoteFor(String label) {
      for (IdentityCandidate candidate : candidates) {
        if (label.equals(candidate.remoteUsername())
            && candidate.confidence() != MatchConfidence.FORCED) {
          return label;
        }
      }
      return null;
    }

    private List<String> knownHandles() {
      if (chatId == null) {
        return List.of();
      }
      final Set<String> handles = new LinkedHashSet<>();
      final ChatProfileLookup profiles = chatProfileLookup.getIfAvailable();
      if (profiles != null) {
        try {
          profiles
              .lookup(chatId)
              .ifPresent(
                  profile -> {
                    addIfText(handles, profile.handle());
                    addIfText(handles, profile.displayName());
                  });
        } catch (RuntimeException ex) {
          logger.warn("chat profile lookup failed chatId={}", chatId, ex);
        }
      }
      final String id = chatId;
      lookupOne("local-by-chat-id", () -> inviteRepository.get(id))
          .ifPresent(record -> addIfText(handles, record.chatUsername()));
      return List.copyOf(handles);
    }

    private boolean stale(DirectoryEntry entry) {
      return entry.isStale(now, syncProperties.staleAfter());
    }

    private void add(
        String candidateChatId, String remoteUsername, MatchConfidence confidence, String source) {
      if (candidateChatId == null && remoteUsername == null) {
        return;
      }
      candidates.add(new IdentityCandidate(candidateChatId, remoteUsername, confidence, source));
    }
  }

  /** An identifier that is itself a key of the local store counts as a chat id. */
  private Optional<String> storedChatId(String raw) {
    return lookupOne("local-by-chat-id", () -> inviteRepository.get(raw)).map(InviteRecord::chatId);
  }

  private static void addIfText(Set<String> target, String value) {
    if (value != null && !value.isBlank()) {
      target.add(value.trim());
    }
  }

  private static <T> Optional<T> lookupOne(String strategy, Supplier<Optional<T>> query) {
    try {
      return query.get();
    } catch (DataAccessException ex) {
      logger.warn("identity lookup skipped strategy={}", strategy, ex);
      return Optional.empty();
    }
  }

  private static <T> List<T> lookupAll(String strategy, Supplier<List<T>> query) {
    try {
      return query.get();
    } catch (DataAccessException ex) {
      logger.warn("identity lookup skipped strategy={}", strategy, ex);
      return List.of();
    }
  }
}
