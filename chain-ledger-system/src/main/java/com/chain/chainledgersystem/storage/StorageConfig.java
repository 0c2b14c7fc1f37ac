package com.chain.chainledgersystem.storage;

import com.chain.chainledgersystem.config.SystemConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public StorageService storageService(SystemConfig systemConfig) {
        return new StorageService(systemConfig.getDbPath());
    }
}
