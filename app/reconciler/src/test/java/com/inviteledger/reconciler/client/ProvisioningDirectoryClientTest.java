package com.inviteledger.reconciler.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.inviteledger.reconciler.remote.ProvisioningTransportException;
import com.inviteledger.reconciler.remote.RemoteUser;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class ProvisioningDirectoryClientTest {

  private static final String USERS_URL = "http://provisioning.test/users";

  @Test
  void listRemoteUsersMapsPayloadsAndDropsIncompleteEntries() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(USERS_URL))
        .andExpect(method(GET))
        .andRespond(
            withSuccess(
                """
                {"users":[
                {"id":"r-1","name":"alice","email":"alice@example.com","expiry":1773835200,
                 "disabled":false,"admin":true,"discord_id":"100","last_active":17},
                {"id":"r-2","name":"bob","expiry":0,"discord_id":""},
                {"id":null,"name":"ghost"}]}
                """,
                MediaType.APPLICATION_JSON));

    final List<RemoteUser> users = fixture.client.listRemoteUsers();

    assertThat(users)
        .containsExactly(
            new RemoteUser(
                "r-1",
                "alice",
                "alice@example.com",
                Instant.ofEpochSecond(1773835200L),
                false,
                true,
                "100"),
            new RemoteUser("r-2", "bob", null, null, false, false, null));
    fixture.server.verify();
  }

  @Test
  void listRemoteUsersMapsServerErrorToBadResponse() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(USERS_URL)).andRespond(withServerError());

    assertThatThrownBy(() -> fixture.client.listRemoteUsers())
        .isInstanceOf(ProvisioningTransportException.class)
        .extracting(ex -> ((ProvisioningTransportException) ex).reason())
        .isEqualTo(ProvisioningTransportException.Reason.BAD_RESPONSE);
  }

  @Test
  void listRemoteUsersMapsMissingUserListToBadResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(USERS_URL))
        .andRespond(withSuccess("{\"foo\":\"bar\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.listRemoteUsers())
        .isInstanceOf(ProvisioningTransportException.class)
        .extracting(ex -> ((ProvisioningTransportException) ex).reason())
        .isEqualTo(ProvisioningTransportException.Reason.BAD_RESPONSE);
  }

  @Test
  void listRemoteUsersMapsUnparseableBodyToBadResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(USERS_URL))
        .andRespond(withSuccess("{\"users\":\"nope\"}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> fixture.client.listRemoteUsers())
        .isInstanceOf(ProvisioningTransportException.class)
        .extracting(ex -> ((ProvisioningTransportException) ex).reason())
        .isEqualTo(ProvisioningTransportException.Reason.BAD_RESPONSE);
  }

  @Test
  void listRemoteUsersMapsReadTimeoutToTimeout() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(USERS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertThatThrownBy(() -> fixture.client.listRemoteUsers())
        .isInstanceOf(ProvisioningTransportException.class)
        .extracting(ex -> ((ProvisioningTransportException) ex).reason())
        .isEqualTo(ProvisioningTransportException.Reason.TIMEOUT);
  }

  @Test
  void findByUsernameIgnoresCase() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(USERS_URL))
        .andRespond(
            withSuccess(
                "{\"users\":[{\"id\":\"r-1\",\"name\":\"Alice\"}]}", MediaType.APPLICATION_JSON));

    assertThat(fixture.client.findByUsername("alice")).map(RemoteUser::id).contains("r-1");
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://provisioning.test").build();
    return new ClientFixture(new ProvisioningDirectoryClient(restClient), server);
  }

  private record ClientFixture(ProvisioningDirectoryClient client, MockRestServiceServer server) {}
}
