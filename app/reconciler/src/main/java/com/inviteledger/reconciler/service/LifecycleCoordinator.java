/*
 * Where: reconciler service layer
 * What: issues, extends and removes accounts across the provisioning service and the local store
 * Why: there is no shared transaction, so each sub-action is isolated and reported on its own
 */
package com.inviteledger.reconciler.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.inviteledger.reconciler.config.InviteIssueProperties;
import com.inviteledger.reconciler.model.AdminActionKind;
import com.inviteledger.reconciler.model.AdminActionRecord;
import com.inviteledger.reconciler.model.InviteRecord;
import com.inviteledger.reconciler.model.InviteStatus;
import com.inviteledger.reconciler.remote.InviteSpec;
import com.inviteledger.reconciler.remote.ProvisioningTransportException;
import com.inviteledger.reconciler.remote.RemoteAccountGateway;
import com.inviteledger.reconciler.remote.RemoteCallExecutor;
import com.inviteledger.reconciler.remote.RemoteOutcome;
import com.inviteledger.reconciler.repository.AdminActionRepository;
import com.inviteledger.reconciler.repository.InviteRepository;
import com.inviteledger.reconciler.resolver.IdentityResolution;
import com.inviteledger.reconciler.resolver.IdentityResolver;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LifecycleCoordinator {

  static final String STEP_PROFILE_CHECK = "remote-profile-check";
  static final String STEP_CREATE_INVITE = "remote-invite-create";
  static final String STEP_RECORD_INVITE = "local-invite-record";
  static final String STEP_REVOKE_SUPERSEDED = "remote-superseded-invite-delete";
  static final String STEP_REMOTE_EXTEND = "remote-account-extend";
  static final String STEP_LOCAL_EXTEND = "local-expiry-update";
  static final String STEP_REMOTE_DELETE = "remote-account-delete";
  static final String STEP_INVITE_DELETE = "remote-invite-delete";
  static final String STEP_LOCAL_DISABLE = "local-status-disable";

  private static final Logger logger = LoggerFactory.getLogger(LifecycleCoordinator.class);
  private static final DateTimeFormatter LABEL_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

  private final InviteRepository inviteRepository;
  private final AdminActionRepository adminActionRepository;
  private final IdentityResolver identityResolver;
  private final RemoteAccountGateway remoteAccountGateway;
  private final RemoteCallExecutor remoteCallExecutor;
  private final InviteIssueProperties issueProperties;
  private final ReconcilerMetrics metrics;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Creates a remote invite and records it. A still-live unclaimed invite is superseded; nothing is
   * written locally when the remote invite could not be created.
   */
  public IssueResult issue(IssueCommand command) {
    requireText(command.actorId(), "actorId");
    requireText(command.chatId(), "chatId");
    requireText(command.plan(), "plan");
    requirePositiveOrNull(command.accountDuration(), "accountDuration");
    requirePositiveOrNull(command.linkValidity(), "linkValidity");

    final Instant now = now();
    final Optional<InviteRecord> existing = inviteRepository.get(command.chatId());
    final PriorInviteState prior = classify(existing, now);
    final String supersededCode =
        prior == PriorInviteState.UNCLAIMED_SUPERSEDED ? existing.get().inviteCode() : null;

    final InviteStatus status = InviteStatus.forPlan(command.plan());
    final boolean trial = status == InviteStatus.TRIAL;
    final Duration accountDuration =
        command.accountDuration() != null
            ? command.accountDuration()
            : trial ? issueProperties.trialAccountDuration() : null;
    final Duration linkValidity =
        command.linkValidity() != null ? command.linkValidity() : issueProperties.linkValidity();
    final String label = inviteLabel(command, now);

    final List<StepOutcome> steps = new ArrayList<>();
    String profile = issueProperties.trialProfile();
    if (!trial) {
      final StepOutcome profileCheck = checkProfile(command.plan());
      steps.add(profileCheck);
      if (!profileCheck.succeeded()) {
        steps.add(StepOutcome.notAttempted(STEP_CREATE_INVITE, "plan profile was not confirmed"));
        steps.add(StepOutcome.notAttempted(STEP_RECORD_INVITE, "remote invite was not created"));
        return finishIssue(command, null, status, null, null, prior, supersededCode, steps);
      }
      profile = profileCheck.target();
    }
    final InviteSpec spec = new InviteSpec(label, profile, linkValidity, accountDuration);
    final String inviteCode;
    try {
      inviteCode =
          remoteCallExecutor.call("createInvite", () -> remoteAccountGateway.createInvite(spec));
    } catch (ProvisioningTransportException ex) {
      logger.warn(
          "invite creation failed chatId={} plan={} reason={}",
          command.chatId(),
          command.plan(),
          ex.reason(),
          ex);
      steps.add(StepOutcome.failed(STEP_CREATE_INVITE, label, causeOf(ex), ex.getMessage()));
      steps.add(StepOutcome.notAttempted(STEP_RECORD_INVITE, "remote invite was not created"));
      return finishIssue(command, null, status, null, null, prior, supersededCode, steps);
    }
    steps.add(StepOutcome.succeeded(STEP_CREATE_INVITE, label));

    final Instant accountExpiresAt = accountDuration == null ? null : now.plus(accountDuration);
    final Instant inviteExpiresAt = now.plus(linkValidity);
    final InviteRecord record =
        new InviteRecord(
            command.chatId(),
            command.chatUsername(),
            inviteCode,
            null,
            command.plan(),
            accountExpiresAt,
            inviteExpiresAt,
            null,
            status,
            now,
            now);
    try {
      inviteRepository.upsert(record);
      steps.add(StepOutcome.succeeded(STEP_RECORD_INVITE, command.chatId()));
    } catch (DataAccessException ex) {
      // The remote invite exists but is untracked; the code is logged so it can be revoked by hand.
      logger.error(
          "invite created remotely but local record failed chatId={} inviteCode={}",
          command.chatId(),
          inviteCode,
          ex);
      steps.add(
          StepOutcome.failed(
              STEP_RECORD_INVITE, command.chatId(), FailureCause.STORE, ex.getMessage()));
      return finishIssue(
          command, inviteCode, status, accountExpiresAt, inviteExpiresAt, prior, supersededCode, steps);
    }

    if (supersededCode != null && !supersededCode.equals(inviteCode)) {
      steps.add(
          remoteStep(
              STEP_REVOKE_SUPERSEDED,
              supersededCode,
              "deleteInvite",
              () -> remoteAccountGateway.deleteInvite(supersededCode)));
    }
    logger.info(
        "invite issued chatId={} plan={} previousState={} accountExpiresAt={}",
        command.chatId(),
        command.plan(),
        prior,
        accountExpiresAt);
    return finishIssue(
        command, inviteCode, status, accountExpiresAt, inviteExpiresAt, prior, supersededCode, steps);
  }

  /**
   * Extends the remote account, then moves the local expiry forward from {@code max(expiry, now)}
   * and clears the notification marker.
   */
  public ExtendResult extend(ExtendCommand command) {
    requireText(command.actorId(), "actorId");
    if (isBlank(command.chatId()) && isBlank(command.remoteUsername())) {
      throw new IllegalArgumentException("chatId or remoteUsername is required");
    }
    if (command.duration() == null || command.duration().isNegative() || command.duration().isZero()) {
      throw new IllegalArgumentException("duration must be positive");
    }
    final Instant now = now();

    String chatId = isBlank(command.chatId()) ? null : command.chatId().trim();
    String remoteUsername = isBlank(command.remoteUsername()) ? null : command.remoteUsername().trim();
    if (remoteUsername == null) {
      remoteUsername = identityResolver.resolve(chatId).remoteUsernames().stream().findFirst().orElse(null);
    } else if (chatId == null) {
      chatId = identityResolver.resolve(remoteUsername).chatId().orElse(null);
    }

    final StepOutcome remote;
    if (remoteUsername == null) {
      remote = StepOutcome.notAttempted(STEP_REMOTE_EXTEND, "no remote account resolved");
    } else {
      final String username = remoteUsername;
      remote =
          remoteStep(
              STEP_REMOTE_EXTEND,
              username,
              "extendAccount",
              () -> remoteAccountGateway.extendAccount(username, command.duration()));
    }

    Instant newExpiry = null;
    final StepOutcome local;
    if (!remote.succeeded()) {
      local = StepOutcome.notAttempted(STEP_LOCAL_EXTEND, "remote extension did not succeed");
    } else if (chatId == null) {
      local = StepOutcome.notAttempted(STEP_LOCAL_EXTEND, "no chat identity resolved");
    } else {
      final LocalExtension extension = extendLocal(chatId, command.duration(), now);
      local = extension.outcome();
      newExpiry = extension.newExpiry();
    }
    metrics.recordLifecycleStep("extend", remote);
    metrics.recordLifecycleStep("extend", local);

    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("duration_seconds", command.duration().toSeconds());
    detail.put("new_account_expires_at", newExpiry == null ? null : newExpiry.getEpochSecond());
    detail.put("steps", stepDetails(List.of(remote, local)));
    final boolean audited =
        audit(command.actorId(), AdminActionKind.EXTEND_ACCOUNT, chatId, remoteUsername, detail, now);
    logger.info(
        "account extension finished chatId={} remoteUsername={} remote={} local={}",
        chatId,
        remoteUsername,
        remote.status(),
        local.status());
    return new ExtendResult(chatId, remoteUsername, newExpiry, remote, local, audited);
  }

  /**
   * Resolves the identifier, then deletes the remote account, deletes the stored invite code and
   * disables the local record, in that order. A failing step never prevents the next one.
   */
  public RemovalReport remove(RemovalCommand command) {
    requireText(command.actorId(), "actorId");
    requireText(command.identifier(), "identifier");
    final Instant now = now();
    final IdentityResolution resolution = identityResolver.resolve(command.identifier());

    final StepOutcome remoteDelete = deleteRemoteAccount(resolution.remoteUsernames());

    final Optional<String> chatId = resolution.chatId();
    Optional<InviteRecord> record = Optional.empty();
    StepOutcome inviteDelete = null;
    if (chatId.isPresent()) {
      try {
        record = inviteRepository.get(chatId.get());
      } catch (DataAccessException ex) {
        logger.warn("invite record lookup failed during removal chatId={}", chatId.get(), ex);
        inviteDelete =
            StepOutcome.failed(STEP_INVITE_DELETE, chatId.get(), FailureCause.STORE, ex.getMessage());
      }
    }
    if (inviteDelete == null) {
      inviteDelete = deleteStoredInvite(resolution, record);
    }

    final StepOutcome localDisable = disableLocal(resolution, chatId, record, now);

    for (StepOutcome step : List.of(remoteDelete, inviteDelete, localDisable)) {
      metrics.recordLifecycleStep("remove", step);
    }
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("identifier", command.identifier());
    detail.put("reason", command.reason() == null ? "" : command.reason());
    detail.put("candidates", resolution.candidates().size());
    detail.put("steps", stepDetails(List.of(remoteDelete, inviteDelete, localDisable)));
    final String remoteTarget =
        remoteDelete.target() != null
            ? remoteDelete.target()
            : resolution.remoteUsernames().stream().findFirst().orElse(null);
    final boolean audited =
        audit(
            command.actorId(),
            AdminActionKind.REMOVE_ACCOUNT,
            chatId.orElse(null),
            remoteTarget,
            detail,
            now);
    logger.info(
        "account removal finished identifier={} chatId={} remoteDelete={} inviteDelete={} localDisable={}",
        command.identifier(),
        chatId.orElse(null),
        remoteDelete.status(),
        inviteDelete.status(),
        localDisable.status());
    return new RemovalReport(resolution, remoteDelete, inviteDelete, localDisable, audited);
  }

  @VisibleForTesting
  static PriorInviteState classify(Optional<InviteRecord> existing, Instant now) {
    if (existing.isEmpty()) {
      return PriorInviteState.NONE;
    }
    final InviteRecord record = existing.get();
    if (record.disabled()) {
      return PriorInviteState.DISABLED;
    }
    if (record.claimed()) {
      return PriorInviteState.CLAIMED;
    }
    return record.linkLive(now) ? PriorInviteState.UNCLAIMED_SUPERSEDED : PriorInviteState.LINK_EXPIRED;
  }

  /** Paid plans name a remote profile; the target of a successful check is the remote spelling. */
  private StepOutcome checkProfile(String plan) {
    final List<String> profiles;
    try {
      profiles = remoteCallExecutor.call("listProfiles", remoteAccountGateway::listProfiles);
    } catch (ProvisioningTransportException ex) {
      logger.warn("profile lookup failed plan={} reason={}", plan, ex.reason(), ex);
      return StepOutcome.failed(STEP_PROFILE_CHECK, plan, causeOf(ex), ex.getMessage());
    }
    final String wanted = plan.trim();
    for (String profile : profiles) {
      if (profile != null && profile.equalsIgnoreCase(wanted)) {
        return StepOutcome.succeeded(STEP_PROFILE_CHECK, profile);
      }
    }
    logger.warn("invite plan rejected plan={} availableProfiles={}", plan, profiles);
    return StepOutcome.failed(
        STEP_PROFILE_CHECK,
        plan,
        FailureCause.NOT_FOUND,
        profiles.isEmpty()
            ? "unknown profile, none available remotely"
            : "unknown profile, available: " + String.join(", ", profiles));
  }

  private StepOutcome deleteRemoteAccount(List<String> remoteUsernames) {
    if (remoteUsernames.isEmpty()) {
      return StepOutcome.notAttempted(STEP_REMOTE_DELETE, "no remote username resolved");
    }
    // Stop at the first answer that is not NotFound so a wrong guess never deletes twice.
    for (String username : remoteUsernames) {
      final StepOutcome outcome =
          remoteStep(
              STEP_REMOTE_DELETE,
              username,
              "deleteAccount",
              () -> remoteAccountGateway.deleteAccount(username));
      if (outcome.cause() != FailureCause.NOT_FOUND) {
        return outcome;
      }
    }
    return StepOutcome.failed(
        STEP_REMOTE_DELETE,
        String.join(",", remoteUsernames),
        FailureCause.NOT_FOUND,
        "no candidate remote account exists");
  }

  private StepOutcome deleteStoredInvite(
      IdentityResolution resolution, Optional<InviteRecord> record) {
    if (resolution.ambiguousChatId()) {
      return StepOutcome.notAttempted(STEP_INVITE_DELETE, "chat identity is ambiguous");
    }
    if (record.isEmpty()) {
      return StepOutcome.notAttempted(STEP_INVITE_DELETE, "no local record");
    }
    final String code = record.get().inviteCode();
    if (isBlank(code)) {
      return StepOutcome.notAttempted(STEP_INVITE_DELETE, "no stored invite code");
    }
    return remoteStep(STEP_INVITE_DELETE, code, "deleteInvite", () -> remoteAccountGateway.deleteInvite(code));
  }

  private StepOutcome disableLocal(
      IdentityResolution resolution,
      Optional<String> chatId,
      Optional<InviteRecord> record,
      Instant now) {
    if (resolution.ambiguousChatId()) {
      return StepOutcome.notAttempted(STEP_LOCAL_DISABLE, "chat identity is ambiguous");
    }
    if (chatId.isEmpty()) {
      return StepOutcome.notAttempted(STEP_LOCAL_DISABLE, "no chat identity resolved");
    }
    try {
      final int updated = inviteRepository.setStatus(chatId.get(), InviteStatus.DISABLED, now);
      if (updated == 0) {
        return record.isEmpty()
            ? StepOutcome.notAttempted(STEP_LOCAL_DISABLE, "no local record")
            : StepOutcome.failed(STEP_LOCAL_DISABLE, chatId.get(), FailureCause.NOT_FOUND, "record vanished");
      }
      return StepOutcome.succeeded(STEP_LOCAL_DISABLE, chatId.get());
    } catch (DataAccessException ex) {
      logger.warn("local disable failed chatId={}", chatId.get(), ex);
      return StepOutcome.failed(STEP_LOCAL_DISABLE, chatId.get(), FailureCause.STORE, ex.getMessage());
    }
  }

  private LocalExtension extendLocal(String chatId, Duration duration, Instant now) {
    try {
      final Optional<InviteRecord> existing = inviteRepository.get(chatId);
      if (existing.isEmpty()) {
        return new LocalExtension(StepOutcome.notAttempted(STEP_LOCAL_EXTEND, "no local record"), null);
      }
      final InviteRecord record = existing.get();
      if (record.disabled()) {
        return new LocalExtension(StepOutcome.notAttempted(STEP_LOCAL_EXTEND, "record is disabled"), null);
      }
      final Instant base =
          record.accountExpiresAt() == null || record.accountExpiresAt().isBefore(now)
              ? now
              : record.accountExpiresAt();
      final Instant newExpiry = base.plus(duration);
      inviteRepository.upsert(
          new InviteRecord(
              record.chatId(),
              record.chatUsername(),
              record.inviteCode(),
              record.remoteUserId(),
              record.plan(),
              newExpiry,
              record.inviteExpiresAt(),
              null,
              record.status(),
              record.createdAt(),
              now));
      return new LocalExtension(StepOutcome.succeeded(STEP_LOCAL_EXTEND, chatId), newExpiry);
    } catch (DataAccessException ex) {
      logger.warn("local expiry update failed chatId={}", chatId, ex);
      return new LocalExtension(
          StepOutcome.failed(STEP_LOCAL_EXTEND, chatId, FailureCause.STORE, ex.getMessage()), null);
    }
  }

  private StepOutcome remoteStep(
      String step, String target, String operation, Supplier<RemoteOutcome> call) {
    try {
      final RemoteOutcome outcome = remoteCallExecutor.call(operation, call);
      return switch (outcome) {
        case SUCCESS -> StepOutcome.succeeded(step, target);
        case NOT_FOUND -> StepOutcome.failed(step, target, FailureCause.NOT_FOUND, "not found remotely");
        case FAILED -> StepOutcome.failed(step, target, FailureCause.REMOTE_REJECTED, "rejected remotely");
      };
    } catch (ProvisioningTransportException ex) {
      logger.warn("{} failed target={} reason={}", operation, target, ex.reason(), ex);
      return StepOutcome.failed(step, target, causeOf(ex), ex.getMessage());
    }
  }

  private IssueResult finishIssue(
      IssueCommand command,
      String inviteCode,
      InviteStatus status,
      Instant accountExpiresAt,
      Instant inviteExpiresAt,
      PriorInviteState prior,
      String supersededCode,
      List<StepOutcome> steps) {
    steps.forEach(step -> metrics.recordLifecycleStep("issue", step));
    final Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("plan", command.plan());
    detail.put("chat_username", command.chatUsername());
    detail.put("invite_code", inviteCode);
    detail.put("previous_state", prior.name());
    detail.put("superseded_invite_code", supersededCode);
    detail.put("account_expires_at", accountExpiresAt == null ? null : accountExpiresAt.getEpochSecond());
    detail.put("steps", stepDetails(steps));
    final boolean audited =
        audit(command.actorId(), AdminActionKind.ISSUE_INVITE, command.chatId(), null, detail, now());
    return new IssueResult(
        command.chatId(),
        inviteCode,
        status,
        accountExpiresAt,
        inviteExpiresAt,
        prior,
        supersededCode,
        steps,
        audited);
  }

  private boolean audit(
      String actorId,
      AdminActionKind kind,
      String chatId,
      String remoteUsername,
      Map<String, Object> detail,
      Instant now) {
    try {
      adminActionRepository.insert(
          new AdminActionRecord(
              UUID.randomUUID(),
              actorId,
              kind,
              chatId,
              remoteUsername,
              objectMapper.writeValueAsString(detail),
              now));
      return true;
    } catch (JsonProcessingException | DataAccessException ex) {
      logger.warn("admin action audit failed kind={} chatId={}", kind, chatId, ex);
      return false;
    }
  }

  private static List<Map<String, Object>> stepDetails(List<StepOutcome> steps) {
    final List<Map<String, Object>> details = new ArrayList<>();
    for (StepOutcome step : steps) {
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("step", step.step());
      entry.put("status", step.status().name());
      entry.put("target", step.target());
      entry.put("cause", step.cause() == null ? null : step.cause().name());
      entry.put("detail", step.detail());
      details.add(entry);
    }
    return details;
  }

  private String inviteLabel(IssueCommand command, Instant now) {
    final String base = isBlank(command.chatUsername()) ? command.chatId() : command.chatUsername().trim();
    return base + "-" + LABEL_TIME.format(now.atZone(issueProperties.labelDateZone()));
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
  }

  private static FailureCause causeOf(ProvisioningTransportException ex) {
    return switch (ex.reason()) {
      case TIMEOUT -> FailureCause.TIMEOUT;
      case BAD_RESPONSE -> FailureCause.REMOTE_REJECTED;
      case CONNECTION -> FailureCause.TRANSPORT;
    };
  }

  private static void requireText(String value, String name) {
    if (isBlank(value)) {
      throw new IllegalArgumentException(name + " is required");
    }
  }

  private static void requirePositiveOrNull(Duration value, String name) {
    if (value != null && (value.isNegative() || value.isZero())) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private record LocalExtension(StepOutcome outcome, Instant newExpiry) {}
}
