package com.pickshot.config;

import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Points the H2 data source at the located ratings database.
 */
@Configuration
public class DataSourceConfig {

    @Bean
    public DataSource dataSource(AppConfig appConfig) throws IOException {
        Path dbPath = RatingStoreLocator.from(appConfig).resolve();
        Files.createDirectories(dbPath.getParent());
        return DataSourceBuilder.create()
                .driverClassName("org.h2.Driver")
                .url("jdbc:h2:file:" + dbPath)
                .username("sa")
                .password("")
                .build();
    }
}
