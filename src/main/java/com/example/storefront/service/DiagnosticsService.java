package com.example.storefront.service;

import com.example.storefront.config.StoreProperties;
import com.example.storefront.model.DiagnosticsReport;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reports store connectivity for the diagnostic route. Store failures end up in the report and are
 * never rethrown.
 */
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsService.class);
    private static final int MAX_COLLECTIONS = 10;
    private static final int MAX_REASON_LENGTH = 50;

    private final MongoTemplate mongoTemplate;
    private final StoreProperties storeProperties;

    public DiagnosticsReport report() {
        DiagnosticsReport.DiagnosticsReportBuilder report = DiagnosticsReport.builder()
            .backend("Running")
            .databaseUrl(storeProperties.isUrlSet() ? "Set" : "Not Set")
            .databaseName(storeProperties.isDatabaseSet() ? "Set" : "Not Set");

        try {
            List<String> collections = mongoTemplate.getCollectionNames().stream()
                .sorted()
                .limit(MAX_COLLECTIONS)
                .toList();
            return report
                .database("Connected & Working")
                .connectionStatus("Connected")
                .collections(collections)
                .build();
        } catch (DataAccessException ex) {
            log.warn("Store unavailable: {}", ex.getMessage());
            return report
                .database("Unavailable: " + abbreviate(ex.getMessage()))
                .connectionStatus("Not Connected")
                .collections(List.of())
                .build();
        }
    }

    private static String abbreviate(String message) {
        if (message == null) {
            return "unknown error";
        }
        return message.length() <= MAX_REASON_LENGTH ? message : message.substring(0, MAX_REASON_LENGTH);
    }
}
