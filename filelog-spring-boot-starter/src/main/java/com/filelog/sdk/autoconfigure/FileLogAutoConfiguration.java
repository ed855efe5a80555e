package com.filelog.sdk.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.filelog.sdk.client.FileLogger;
import com.filelog.sdk.client.LineLossCallback;
import com.filelog.sdk.console.ConsoleSink;
import com.filelog.sdk.format.DefaultMessageFormatter;
import com.filelog.sdk.format.MessageFormatter;
import com.filelog.sdk.model.LogLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

@AutoConfiguration
@EnableConfigurationProperties(FileLogProperties.class)
@ConditionalOnClass(FileLogger.class)
@ConditionalOnProperty(prefix = "filelog", name = "enabled", havingValue = "true")
public class FileLogAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FileLogAutoConfiguration.class);
    private static final Set<String> DEV_PROFILES = new HashSet<>(Arrays.asList("dev", "local", "test"));

    private static final LogLevel DEV_LEVEL = LogLevel.DEBUG;
    private static final long DEV_RETRY_DELAY_MS = 1_000;

    private final Environment environment;

    public FileLogAutoConfiguration(Environment environment) {
        this.environment = environment;
    }

    @Bean
    @ConditionalOnMissingBean
    public FileLogger fileLogger(
            FileLogProperties properties,
            ObjectProvider<ObjectMapper> objectMapperProvider,
            ObjectProvider<MessageFormatter> messageFormatterProvider,
            ObjectProvider<ConsoleSink> consoleSinkProvider,
            ObjectProvider<LineLossCallback> lineLossCallbackProvider) {
        long retryDelayMs = resolveLong(
                properties.getRetryDelayMs(),
                "filelog.retry-delay-ms",
                DEV_RETRY_DELAY_MS);

        FileLogger.Builder builder = FileLogger.builder()
                .options(properties.toOptions())
                .bufferCapacity(properties.getBufferCapacity())
                .retryDelayMs(retryDelayMs)
                .registerShutdownHook(false);

        MessageFormatter messageFormatter = messageFormatterProvider.getIfUnique();
        ObjectMapper objectMapper = objectMapperProvider.getIfUnique();
        if (messageFormatter != null) {
            builder.messageFormatter(messageFormatter);
        } else if (objectMapper != null) {
            builder.messageFormatter(new DefaultMessageFormatter(objectMapper));
        }

        ConsoleSink consoleSink = consoleSinkProvider.getIfUnique();
        if (consoleSink != null) {
            builder.consoleSink(consoleSink);
        }

        LineLossCallback lineLossCallback = lineLossCallbackProvider.getIfUnique();
        if (lineLossCallback != null) {
            builder.onLineLoss(lineLossCallback);
        }

        FileLogger logger = builder.build();

        if (properties.getLevel() == null && isDevProfile()) {
            logger.setLevel(DEV_LEVEL);
        }

        logger.open();
        log.info("FileLogger opened - level: {}, file: {}", logger.getLevel().getValue(),
                properties.getFilename() != null ? properties.getFilename() : "<console only>");
        return logger;
    }

    @Bean
    @ConditionalOnBean(FileLogger.class)
    public FileLogShutdown fileLogShutdown(FileLogger fileLogger) {
        return new FileLogShutdown(fileLogger);
    }

    private long resolveLong(long currentValue, String propertyKey, long devDefault) {
        if (environment.containsProperty(propertyKey)) {
            return currentValue;
        }
        return isDevProfile() ? devDefault : currentValue;
    }

    private boolean isDevProfile() {
        String[] activeProfiles = environment.getActiveProfiles();
        if (activeProfiles.length == 0) {
            activeProfiles = environment.getDefaultProfiles();
        }
        for (String profile : activeProfiles) {
            if (DEV_PROFILES.contains(profile.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
