/*
 * Where: reconciler service layer
 * What: refreshes the directory cache from the provisioning service and links claimed invites
 * Why: the resolver trusts only cache entries refreshed within two sync intervals
 */
package com.inviteledger.reconciler.service;

import com.google.common.annotations.VisibleForTesting;
import com.inviteledger.common.schedule.SingleFlightGuard;
import com.inviteledger.reconciler.model.DirectoryEntry;
import com.inviteledger.reconciler.remote.DirectoryFetcher;
import com.inviteledger.reconciler.remote.ProvisioningTransportException;
import com.inviteledger.reconciler.remote.RemoteCallExecutor;
import com.inviteledger.reconciler.remote.RemoteUser;
import com.inviteledger.reconciler.repository.DirectoryCacheRepository;
import com.inviteledger.reconciler.repository.InviteRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DirectorySyncService {

  public static final String TASK_NAME = "directory-sync";

  private static final Logger logger = LoggerFactory.getLogger(DirectorySyncService.class);

  private final DirectoryFetcher directoryFetcher;
  private final RemoteCallExecutor remoteCallExecutor;
  private final DirectoryCacheRepository directoryCacheRepository;
  private final InviteRepository inviteRepository;
  private final SingleFlightGuard singleFlightGuard;
  private final ReconcilerMetrics metrics;
  private final Clock clock;

  /** Runs a sync unless one is already in progress; empty when skipped. */
  public Optional<SyncResult> syncOnce() {
    final Optional<SyncResult> result =
        singleFlightGuard.tryRun(TASK_NAME, () -> syncAt(Instant.now(clock)));
    if (result.isEmpty()) {
      logger.info("directory sync skipped because a previous sync is still running");
      metrics.recordSync("skipped");
    }
    return result;
  }

  @VisibleForTesting
  SyncResult syncAt(Instant passTime) {
    final long startedNanos = System.nanoTime();
    final Instant now = passTime.truncatedTo(ChronoUnit.SECONDS);
    try {
      return doSync(now);
    } finally {
      metrics.recordTaskDuration(TASK_NAME, Duration.ofNanos(System.nanoTime() - startedNanos));
    }
  }

  private SyncResult doSync(Instant now) {
    final List<RemoteUser> users;
    try {
      users = remoteCallExecutor.call("listRemoteUsers", directoryFetcher::listRemoteUsers);
    } catch (ProvisioningTransportException ex) {
      logger.warn("directory sync fetch failed reason={}; cache left untouched", ex.reason(), ex);
      metrics.recordSync("failure");
      return SyncResult.failed(now, "fetch failed: " + ex.reason());
    }

    final List<DirectoryEntry> entries =
        users.stream()
            .map(
                user ->
                    new DirectoryEntry(
                        user.id(),
                        user.username(),
                        user.linkedChatId(),
                        user.email(),
                        user.expiresAt(),
                        user.disabled(),
                        user.admin(),
                        now))
            .toList();
    final int written;
    try {
      written = directoryCacheRepository.replaceAll(entries, now);
    } catch (DataAccessException ex) {
      logger.warn("directory sync cache write failed fetched={}", users.size(), ex);
      metrics.recordSync("failure");
      return SyncResult.failed(now, "cache write failed");
    }

    final int linked = linkClaimedInvites(users, now);
    final long cacheSize = directoryCacheRepository.count();
    metrics.updateCacheSize(cacheSize);
    metrics.recordSync("success");
    logger.info(
        "directory sync finished fetched={} written={} linked={} cacheSize={}",
        users.size(),
        written,
        linked,
        cacheSize);
    return new SyncResult(now, users.size(), written, linked, cacheSize, null);
  }

  private int linkClaimedInvites(List<RemoteUser> users, Instant now) {
    int linked = 0;
    for (RemoteUser user : users) {
      if (user.linkedChatId() == null) {
        continue;
      }
      try {
        linked += inviteRepository.linkRemoteAccount(user.linkedChatId(), user.id(), now);
      } catch (DataAccessException ex) {
        logger.warn(
            "invite link update failed chatId={} remoteUserId={}", user.linkedChatId(), user.id(), ex);
      }
    }
    return linked;
  }
}
