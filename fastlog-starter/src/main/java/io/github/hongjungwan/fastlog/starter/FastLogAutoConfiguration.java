package io.github.hongjungwan.fastlog.starter;

import io.github.hongjungwan.fastlog.api.FastLog;
import io.github.hongjungwan.fastlog.api.FastLogger;
import io.github.hongjungwan.fastlog.api.FileLogger;
import io.github.hongjungwan.fastlog.api.FileLoggers;
import io.github.hongjungwan.fastlog.api.config.FileLoggerConfig;
import io.github.hongjungwan.fastlog.api.config.FileLoggerConfigs;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * FastLog Spring Boot 자동 설정.
 */
@AutoConfiguration
@EnableConfigurationProperties(FastLogProperties.class)
@ConditionalOnProperty(prefix = "fastlog", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class FastLogAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FileLoggerConfig fileLoggerConfig(FastLogProperties properties) {
        String configFile = properties.getConfigFile();
        if (configFile != null && !configFile.isBlank()) {
            log.info("Loading FastLog config from: {}", configFile);
            return FileLoggerConfigs.fromJson(Paths.get(configFile));
        }
        return FileLoggerConfig.builder()
                .file(properties.getFile())
                .level(properties.getLevel())
                .rotateBytes(properties.getRotateBytes())
                .rotateCycle(properties.getRotateCycle())
                .bufferLength(properties.getBufferLength())
                .bufferPeriod(properties.getBufferPeriod())
                .recordLength(properties.getRecordLength())
                .recordFactor(properties.getRecordFactor())
                .discardThreshold(properties.getDiscardThreshold())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public FileLogger fileLogger(FileLoggerConfig config) throws IOException {
        FileLogger logger = FileLoggers.create(config);
        log.info("FastLog logger created: file={}, level={}", config.getFile(), config.getLevel());
        return logger;
    }

    @Bean
    public FastLogLifecycle fastLogLifecycle(FileLogger logger, FastLogProperties properties) {
        return new FastLogLifecycle(logger, properties.isInstallDefault());
    }

    /**
     * 컨텍스트 시작 시 로거를 FastLog 기본 로거로 설치하고, 종료 시 이전 로거를 되돌린다.
     * 로거는 이 단계 이후 빈 소멸 시점에 닫힌다.
     */
    static class FastLogLifecycle implements SmartLifecycle {

        private final FileLogger logger;
        private final boolean installDefault;
        private FastLogger previous;
        private volatile boolean running = false;

        FastLogLifecycle(FileLogger logger, boolean installDefault) {
            this.logger = logger;
            this.installDefault = installDefault;
        }

        @Override
        public void start() {
            if (installDefault) {
                previous = FastLog.install(logger);
                log.info("FastLog default logger installed");
            }
            running = true;
        }

        @Override
        public void stop() {
            if (previous != null) {
                FastLog.install(previous);
                previous = null;
                log.info("FastLog default logger restored");
            }
            logger.flush();
            running = false;
        }

        @Override
        public boolean isRunning() {
            return running;
        }

        @Override
        public int getPhase() {
            return Integer.MIN_VALUE + 100;
        }
    }
}
