package com.example.storefront.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Raw connection settings as supplied by the environment. The Mongo client itself is configured
 * through {@code spring.data.mongodb.*}; these values only tell diagnostics whether they were set.
 */
@Component
@ConfigurationProperties(prefix = "app.store")
public class StoreProperties {

    private String url;
    private String database;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public boolean isUrlSet() {
        return StringUtils.hasText(url);
    }

    public boolean isDatabaseSet() {
        return StringUtils.hasText(database);
    }
}
