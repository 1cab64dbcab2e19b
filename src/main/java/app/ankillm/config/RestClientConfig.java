package app.ankillm.config;

import app.ankillm.provider.openai.OpenAiProps;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class RestClientConfig {

    private static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 120;

    @Bean
    public RestClientCustomizer timeoutRestClientCustomizer(OpenAiProps openAiProps) {
        int timeoutSeconds = openAiProps.requestTimeoutSeconds() == null || openAiProps.requestTimeoutSeconds() <= 0
                ? DEFAULT_REQUEST_TIMEOUT_SECONDS
                : openAiProps.requestTimeoutSeconds();
        return builder -> {
            // AnkiConnect answers plain HTTP/1.1 only
            HttpClient httpClient = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .connectTimeout(Duration.ofSeconds(10))
                    .build();
            JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
            requestFactory.setReadTimeout(Duration.ofSeconds(timeoutSeconds));
            builder.requestFactory(requestFactory);
        };
    }
}
