package uk.gegc.officeconverter.shared.rate_limit;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    /**
     * Requests a single client may make inside one window.
     */
    @Min(1)
    private int requestsPerWindow = 10;

    /**
     * Length of the fixed accounting window.
     */
    @NotNull
    private Duration window = Duration.ofSeconds(60);

    /**
     * Delay between sweeps that drop expired client windows.
     */
    @NotNull
    private Duration sweepInterval = Duration.ofMinutes(5);
}
