package com.epiccharts.twitter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * OAuth 1.0a user-context credentials and endpoints for the social platform API.
 */
@Component
@ConfigurationProperties(prefix = "epiccharts.twitter")
public class TwitterProperties {

    private String apiKey = "";
    private String apiSecret = "";
    private String accessToken = "";
    private String accessSecret = "";
    private String apiBaseUrl = "https://api.twitter.com";
    private String uploadBaseUrl = "https://upload.twitter.com";
    private int requestTimeoutSeconds = 30;

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public String getApiSecret() { return apiSecret; }
    public void setApiSecret(String apiSecret) { this.apiSecret = apiSecret; }
    public String getAccessToken() { return accessToken; }
    public void setAccessToken(String accessToken) { this.accessToken = accessToken; }
    public String getAccessSecret() { return accessSecret; }
    public void setAccessSecret(String accessSecret) { this.accessSecret = accessSecret; }
    public String getApiBaseUrl() { return apiBaseUrl; }
    public void setApiBaseUrl(String apiBaseUrl) { this.apiBaseUrl = apiBaseUrl; }
    public String getUploadBaseUrl() { return uploadBaseUrl; }
    public void setUploadBaseUrl(String uploadBaseUrl) { this.uploadBaseUrl = uploadBaseUrl; }
    public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }

    public boolean hasCredentials() {
        return notBlank(apiKey) && notBlank(apiSecret) && notBlank(accessToken) && notBlank(accessSecret);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
