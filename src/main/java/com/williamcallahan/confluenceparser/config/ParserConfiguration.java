package com.williamcallahan.confluenceparser.config;

import com.williamcallahan.confluenceparser.service.StorageFormatParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers a shared {@link StorageFormatParser} configured from {@link ParserProperties}.
 */
@AutoConfiguration
@EnableConfigurationProperties(ParserProperties.class)
public class ParserConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ParserConfiguration.class);

    /**
     * Creates the parser bean unless the application defines its own.
     *
     * @param properties bound parser settings
     * @return storage-format parser
     */
    @Bean
    @ConditionalOnMissingBean
    public StorageFormatParser storageFormatParser(ParserProperties properties) {
        logger.info("Storage-format parser configured (raiseOnFinish={})", properties.isRaiseOnFinish());
        return new StorageFormatParser(properties.isRaiseOnFinish());
    }
}
