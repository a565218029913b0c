/*
 * Where: reconciler configuration
 * What: base URL, API token and socket timeouts of the provisioning service
 * Why: the provisioning endpoint differs per deployment
 */
package com.inviteledger.reconciler.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "provisioning")
public record ProvisioningClientProperties(
    String baseUrl, String apiToken, Duration connectTimeout, Duration readTimeout) {

  public ProvisioningClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://provisioning:8056" : baseUrl;
    apiToken = apiToken == null ? "" : apiToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
  }
}
