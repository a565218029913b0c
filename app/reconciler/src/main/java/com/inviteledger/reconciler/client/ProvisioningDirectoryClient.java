/*
 * Where: reconciler provisioning adapter
 * What: reads the full user directory from the provisioning REST API
 * Why: feeds the directory sync pass and name-to-id lookups for account deletion
 */
package com.inviteledger.reconciler.client;

import com.inviteledger.reconciler.client.dto.RemoteUserPayload;
import com.inviteledger.reconciler.client.dto.RemoteUsersResponse;
import com.inviteledger.reconciler.remote.DirectoryFetcher;
import com.inviteledger.reconciler.remote.ProvisioningTransportException;
import com.inviteledger.reconciler.remote.RemoteUser;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Service
public class ProvisioningDirectoryClient implements DirectoryFetcher {

  private static final Logger logger = LoggerFactory.getLogger(ProvisioningDirectoryClient.class);

  private final RestClient provisioningRestClient;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient is a shared Spring-managed component and cannot be copied")
  public ProvisioningDirectoryClient(RestClient provisioningRestClient) {
    this.provisioningRestClient = provisioningRestClient;
  }

  @Override
  public List<RemoteUser> listRemoteUsers() {
    final RemoteUsersResponse response;
    try {
      response = provisioningRestClient.get().uri("/users").retrieve().body(RemoteUsersResponse.class);
    } catch (RestClientResponseException ex) {
      logger.warn(
          "provisioning listUsers failed with http status={} statusText={}",
          ex.getStatusCode().value(),
          ex.getStatusText());
      throw new ProvisioningTransportException(
          ProvisioningTransportException.Reason.BAD_RESPONSE,
          "provisioning listUsers failed with status " + ex.getStatusCode().value(),
          ex);
    } catch (ResourceAccessException ex) {
      throw ProvisioningErrors.fromResourceAccess("listUsers", ex);
    } catch (RestClientException ex) {
      logger.warn("provisioning listUsers response parse failed", ex);
      throw ProvisioningErrors.badResponse("listUsers", ex);
    }
    if (response == null || response.users() == null) {
      throw ProvisioningErrors.badResponse("listUsers", null);
    }
    return response.users().stream()
        .filter(Objects::nonNull)
        .filter(user -> user.id() != null && user.name() != null)
        .map(ProvisioningDirectoryClient::toRemoteUser)
        .toList();
  }

  /** Case-insensitive lookup by username, the way the provisioning UI matches names. */
  public Optional<RemoteUser> findByUsername(String username) {
    final String wanted = username.toLowerCase(Locale.ROOT);
    return listRemoteUsers().stream()
        .filter(user -> user.username().toLowerCase(Locale.ROOT).equals(wanted))
        .findFirst();
  }

  private static RemoteUser toRemoteUser(RemoteUserPayload payload) {
    final Instant expiresAt =
        payload.expiry() == null || payload.expiry() <= 0
            ? null
            : Instant.ofEpochSecond(payload.expiry());
    final String linkedChatId =
        payload.discordId() == null || payload.discordId().isBlank() ? null : payload.discordId();
    return new RemoteUser(
        payload.id(),
        payload.name(),
        payload.email(),
        expiresAt,
        Boolean.TRUE.equals(payload.disabled()),
        Boolean.TRUE.equals(payload.admin()),
        linkedChatId);
  }
}
