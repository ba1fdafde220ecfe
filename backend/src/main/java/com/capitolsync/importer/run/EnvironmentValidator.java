package com.capitolsync.importer.run;

import com.capitolsync.ingestion.config.CongressApiProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks the settings an import needs before any work starts.
 */
@Component
@RequiredArgsConstructor
public class EnvironmentValidator {

    static final String MONGODB_URI = "spring.data.mongodb.uri";

    private final CongressApiProperties apiProperties;
    private final Environment environment;

    /** Problems found; empty when the import can start. */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(apiProperties.getApiKey())) {
            errors.add("CONGRESS_API_KEY is not set (capitolsync.congress-api.api-key)");
        }
        if (!StringUtils.hasText(apiProperties.getBaseUrl())) {
            errors.add("capitolsync.congress-api.base-url is not set");
        }
        if (!StringUtils.hasText(environment.getProperty(MONGODB_URI))) {
            errors.add("MONGODB_URI is not set (" + MONGODB_URI + ")");
        }
        return errors;
    }
}
