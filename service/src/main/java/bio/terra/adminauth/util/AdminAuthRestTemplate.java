package bio.terra.adminauth.util;

import bio.terra.adminauth.config.HttpConfiguration;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.DefaultResponseErrorHandler;
import org.springframework.web.client.RestTemplate;

/**
 * RestTemplate on Apache HttpClient 5 that never throws for an error status. Callers inspect the
 * status code and turn error bodies into {@link bio.terra.adminauth.AdminAuthException}s.
 */
public class AdminAuthRestTemplate extends RestTemplate {

  public AdminAuthRestTemplate(HttpConfiguration httpConfiguration) {
    var connectionManager =
        PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(
                ConnectionConfig.custom()
                    .setConnectTimeout(Timeout.of(httpConfiguration.getConnectTimeout()))
                    .setSocketTimeout(Timeout.of(httpConfiguration.getReadTimeout()))
                    .build())
            .build();
    // retries are handled by AdminAuthHttpClient
    var httpClient =
        HttpClients.custom()
            .setConnectionManager(connectionManager)
            .disableAutomaticRetries()
            .build();
    this.setRequestFactory(new HttpComponentsClientHttpRequestFactory(httpClient));
    this.setErrorHandler(
        new DefaultResponseErrorHandler() {
          @Override
          public boolean hasError(ClientHttpResponse response) {
            return false;
          }
        });
  }
}
