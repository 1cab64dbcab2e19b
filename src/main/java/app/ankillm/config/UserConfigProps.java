package app.ankillm.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.user-config")
public record UserConfigProps(
        String directory
) {
}
