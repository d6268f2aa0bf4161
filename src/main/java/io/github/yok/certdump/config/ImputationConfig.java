package io.github.yok.certdump.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Settings of the null imputation policy.
 *
 * <ul>
 * <li>{@code imputation.identifier-column}: column never imputed (case-insensitive)</li>
 * <li>{@code imputation.sentinel-date}: ISO date used for missing temporal cells</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "imputation")
@Getter
@Setter
@NoArgsConstructor
public class ImputationConfig {

    private String identifierColumn = "id";

    private String sentinelDate = "1900-01-01";
}
