package ai.authtrail.service;

import ai.authtrail.service.config.PropagationConfig;
import io.micronaut.context.annotation.ConfigurationBuilder;
import io.micronaut.context.annotation.ConfigurationProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties("auth-service")
public class AppConfig {
    private String address;

    @ConfigurationBuilder("propagation")
    private final PropagationConfig propagation = new PropagationConfig();
}
