package com.inviteledger.reconciler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class ProvisioningClientConfig {

  @Bean
  RestClient provisioningRestClient(
      RestClient.Builder builder, ProvisioningClientProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    RestClient.Builder configured = builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory);
    if (!properties.apiToken().isBlank()) {
      configured =
          configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken());
    }
    return configured.build();
  }
}
