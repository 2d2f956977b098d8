package uk.gegc.officeconverter.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.officeconverter.features.conversion.config.ConversionProperties;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for LibreOffice conversions. Kept apart from the servlet request pool
 * so a slow soffice run only occupies one of these workers.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    public static final String OFFICE_TASK_EXECUTOR = "officeTaskExecutor";

    @Bean(name = OFFICE_TASK_EXECUTOR)
    public ThreadPoolTaskExecutor officeTaskExecutor(ConversionProperties conversionProperties) {
        ConversionProperties.Executor settings = conversionProperties.getOffice().getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setKeepAliveSeconds(settings.getKeepAliveSeconds());
        executor.setThreadNamePrefix("office-");

        // Full queue: reject instead of running soffice on the request thread
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("Office Task Executor configured - Core: {}, Max: {}, Queue: {}, KeepAlive: {}s",
                settings.getCorePoolSize(), settings.getMaxPoolSize(),
                settings.getQueueCapacity(), settings.getKeepAliveSeconds());

        return executor;
    }
}
