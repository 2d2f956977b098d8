package uk.gegc.officeconverter.features.conversion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.conversion")
public class ConversionProperties {

    /**
     * Directory under which per-request work directories are created.
     */
    @NotBlank
    private String tempDir = System.getProperty("java.io.tmpdir") + "/office-converter";

    @Valid
    private Office office = new Office();

    @Data
    public static class Office {

        /**
         * LibreOffice executable, resolved through PATH when not absolute.
         */
        @NotBlank
        private String command = "soffice";

        /**
         * Upper bound for a single soffice run; the process is killed afterwards.
         */
        @NotNull
        private Duration timeout = Duration.ofSeconds(120);

        /**
         * How long a request may wait for a free office worker before the run timeout applies.
         */
        @NotNull
        private Duration queueWait = Duration.ofSeconds(60);

        @Valid
        private Executor executor = new Executor();
    }

    @Data
    public static class Executor {
        @Min(1)
        private int corePoolSize = 2;
        @Min(1)
        private int maxPoolSize = 4;
        @Min(0)
        private int queueCapacity = 25;
        @Min(0)
        private int keepAliveSeconds = 60;
    }
}
