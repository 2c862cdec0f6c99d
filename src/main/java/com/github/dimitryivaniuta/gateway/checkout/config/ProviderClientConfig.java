package com.github.dimitryivaniuta.gateway.checkout.config;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * HTTP client wiring for the invoice provider.
 *
 * <p>Timeouts are enforced here; the client itself never retries.</p>
 */
@Configuration
public class ProviderClientConfig {

    /**
     * Rest client bound to the provider base URL, authenticated with HTTP Basic (secret key as user, empty password).
     *
     * @param builder boot-configured builder
     * @param props application properties
     * @return rest client
     */
    @Bean
    public RestClient providerRestClient(RestClient.Builder builder, AppProperties props) {
        AppProperties.Provider provider = props.getProvider();

        var settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(provider.getConnectTimeout())
                .withReadTimeout(provider.getReadTimeout());

        return builder
                .baseUrl(provider.getBaseUrl())
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .defaultHeader(HttpHeaders.AUTHORIZATION, basicAuth(provider.getApiKey()))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    static String basicAuth(String apiKey) {
        String raw = (apiKey == null ? "" : apiKey) + ":";
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
