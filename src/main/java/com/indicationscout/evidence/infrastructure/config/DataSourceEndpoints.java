package com.indicationscout.evidence.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Base URLs of the external sources. Each must end with a slash.
 */
@Component
@ConfigurationProperties(prefix = "scout.sources")
public class DataSourceEndpoints {

    private String openTargetsBaseUrl = "https://api.platform.opentargets.org/api/v4/";
    private String clinicalTrialsBaseUrl = "https://clinicaltrials.gov/api/v2/";

    public String getOpenTargetsBaseUrl() {
        return openTargetsBaseUrl;
    }

    public void setOpenTargetsBaseUrl(String openTargetsBaseUrl) {
        this.openTargetsBaseUrl = openTargetsBaseUrl;
    }

    public String getClinicalTrialsBaseUrl() {
        return clinicalTrialsBaseUrl;
    }

    public void setClinicalTrialsBaseUrl(String clinicalTrialsBaseUrl) {
        this.clinicalTrialsBaseUrl = clinicalTrialsBaseUrl;
    }
}
