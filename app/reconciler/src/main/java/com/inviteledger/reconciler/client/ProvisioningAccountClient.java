/*
 * Where: reconciler provisioning adapter
 * What: lists profiles, creates invites, extends and deletes accounts, deletes invite codes over REST
 * Why: the lifecycle coordinator needs typed outcomes instead of raw HTTP statuses
 */
package com.inviteledger.reconciler.client;

import com.inviteledger.reconciler.client.dto.CreateInviteRequest;
import com.inviteledger.reconciler.client.dto.DeleteInviteRequest;
import com.inviteledger.reconciler.client.dto.DeleteUsersRequest;
import com.inviteledger.reconciler.client.dto.ExtendUsersRequest;
import com.inviteledger.reconciler.client.dto.InviteListResponse;
import com.inviteledger.reconciler.client.dto.InvitePayload;
import com.inviteledger.reconciler.client.dto.ProfilesResponse;
import com.inviteledger.reconciler.remote.InviteSpec;
import com.inviteledger.reconciler.remote.ProvisioningTransportException;
import com.inviteledger.reconciler.remote.RemoteAccountGateway;
import com.inviteledger.reconciler.remote.RemoteOutcome;
import com.inviteledger.reconciler.remote.RemoteUser;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class ProvisioningAccountClient implements RemoteAccountGateway {

  private static final Logger logger = LoggerFactory.getLogger(ProvisioningAccountClient.class);

  private final RestClient provisioningRestClient;
  private final ProvisioningDirectoryClient directoryClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ProvisioningAccountClient(
      RestClient provisioningRestClient, ProvisioningDirectoryClient directoryClient) {
    this.provisioningRestClient = provisioningRestClient;
    this.directoryClient = directoryClient;
  }

  @Override
  public String createInvite(InviteSpec spec) {
    requireText(spec.label(), "label");
    final Duration link = spec.linkValidity();
    final Duration account = spec.accountDuration();
    final CreateInviteRequest request =
        new CreateInviteRequest(
            link.toDays(),
            link.toHoursPart(),
            spec.label(),
            false,
            false,
            spec.profile(),
            1,
            "",
            account == null ? 0 : account.toDays(),
            account == null ? 0 : account.toHoursPart(),
            account != null);
    try {
      provisioningRestClient
          .post()
          .uri("/invites")
          .contentType(MediaType.APPLICATION_JSON)
          .body(request)
          .retrieve()
          .toBodilessEntity();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "provisioning createInvite rejected label={} status={}",
          spec.label(),
          ex.getStatusCode().value());
      throw new ProvisioningTransportException(
          ProvisioningTransportException.Reason.BAD_RESPONSE,
          "provisioning createInvite rejected with status " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      throw ProvisioningErrors.fromResourceAccess("createInvite", ex);
    }
    return findInviteCode(spec.label())
        .orElseThrow(() -> ProvisioningErrors.badResponse("createInvite", null));
  }

  @Override
  public RemoteOutcome extendAccount(String remoteUsername, Duration duration) {
    requireText(remoteUsername, "remoteUsername");
    if (duration == null || duration.isNegative() || duration.isZero()) {
      throw new IllegalArgumentException("duration must be positive");
    }
    final ExtendUsersRequest request =
        new ExtendUsersRequest(
            List.of(remoteUsername),
            0,
            duration.toDays(),
            duration.toHoursPart(),
            duration.toMinutesPart(),
            false,
            "");
    return mutate(
        "extendAccount",
        remoteUsername,
        false,
        () ->
            provisioningRestClient
                .post()
                .uri("/users/extend")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public RemoteOutcome deleteAccount(String remoteUsername) {
    requireText(remoteUsername, "remoteUsername");
    final Optional<RemoteUser> user = directoryClient.findByUsername(remoteUsername);
    if (user.isEmpty()) {
      logger.info("provisioning deleteAccount user not found username={}", remoteUsername);
      return RemoteOutcome.NOT_FOUND;
    }
    final DeleteUsersRequest request = new DeleteUsersRequest(List.of(user.get().id()), false, "");
    return mutate(
        "deleteAccount",
        remoteUsername,
        false,
        () ->
            provisioningRestClient
                .method(HttpMethod.DELETE)
                .uri("/users")
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public RemoteOutcome deleteInvite(String inviteCode) {
    requireText(inviteCode, "inviteCode");
    return mutate(
        "deleteInvite",
        inviteCode,
        true,
        () ->
            provisioningRestClient
                .method(HttpMethod.DELETE)
                .uri("/invites")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new DeleteInviteRequest(inviteCode))
                .retrieve()
                .toBodilessEntity());
  }

  @Override
  public List<String> listProfiles() {
    final ProfilesResponse response;
    try {
      response = provisioningRestClient.get().uri("/profiles").retrieve().body(ProfilesResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn("provisioning listProfiles failed status={}", ex.getStatusCode().value());
      throw ProvisioningErrors.badResponse("listProfiles", ex);
    } catch (ResourceAccessException ex) {
      throw ProvisioningErrors.fromResourceAccess("listProfiles", ex);
    } catch (RestClientException ex) {
      throw ProvisioningErrors.badResponse("listProfiles", ex);
    }
    if (response == null || response.profiles() == null) {
      throw ProvisioningErrors.badResponse("listProfiles", null);
    }
    return List.copyOf(response.profiles().keySet());
  }

  private Optional<String> findInviteCode(String label) {
    final InviteListResponse response;
    try {
      response =
          provisioningRestClient
              .get()
              .uri(uri -> uri.path("/invites").queryParam("label", label).build())
              .retrieve()
              .body(InviteListResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "provisioning listInvites failed label={} status={}", label, ex.getStatusCode().value());
      throw ProvisioningErrors.badResponse("listInvites", ex);
    } catch (ResourceAccessException ex) {
      throw ProvisioningErrors.fromResourceAccess("listInvites", ex);
    } catch (RestClientException ex) {
      throw ProvisioningErrors.badResponse("listInvites", ex);
    }
    if (response == null || response.invites() == null) {
      return Optional.empty();
    }
    return response.invites().stream()
        .filter(invite -> invite != null && label.equals(invite.label()))
        .map(InvitePayload::code)
        .filter(code -> code != null && !code.isBlank())
        .findFirst();
  }

  private RemoteOutcome mutate(
      String operation, String target, boolean badRequestMeansMissing, Supplier<?> call) {
    try {
      call.get();
      return RemoteOutcome.SUCCESS;
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      if (status == 404 || (badRequestMeansMissing && status == 400)) {
        logger.info("provisioning {} target not found target={} status={}", operation, target, status);
        return RemoteOutcome.NOT_FOUND;
      }
      logger.warn(
          "provisioning {} failed target={} status={} statusText={}",
          operation,
          target,
          status,
          ex.getStatusText());
      return RemoteOutcome.FAILED;
    } catch (ResourceAccessException ex) {
      throw ProvisioningErrors.fromResourceAccess(operation, ex);
    }
  }

  private static void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
