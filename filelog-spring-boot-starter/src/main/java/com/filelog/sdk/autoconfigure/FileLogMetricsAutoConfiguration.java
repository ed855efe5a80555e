package com.filelog.sdk.autoconfigure;

import com.filelog.sdk.client.FileLogger;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = FileLogAutoConfiguration.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean({FileLogger.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "filelog.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
class FileLogMetricsAutoConfiguration {

    @Bean
    FileLogMetricsBinder fileLogMetricsBinder(FileLogger logger, MeterRegistry registry) {
        return new FileLogMetricsBinder(logger, registry);
    }
}
