package app.ankillm.client.anki;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.anki")
public record AnkiConnectProps(
        String baseUrl
) {
}
