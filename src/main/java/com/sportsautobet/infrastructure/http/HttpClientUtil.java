package com.sportsautobet.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.util.Map;

/**
 * JSON over HTTP for the sports-data and messaging collaborators.
 */
public class HttpClientUtil {

    private static final Logger logger = LoggerFactory.getLogger(HttpClientUtil.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    /**
     * GET with query parameters, response parsed as JSON.
     */
    public static JsonNode getJson(String baseUrl, Map<String, String> params, Map<String, String> headers)
            throws IOException {
        String url;
        try {
            URIBuilder builder = new URIBuilder(baseUrl);
            if (params != null) {
                params.forEach(builder::addParameter);
            }
            url = builder.build().toString();
        } catch (URISyntaxException e) {
            throw new IOException("Invalid URL: " + baseUrl, e);
        }
        return execute(new HttpGet(url), headers);
    }

    /**
     * POST of a JSON body, response parsed as JSON.
     */
    public static JsonNode postJson(String url, Object body, Map<String, String> headers) throws IOException {
        HttpPost request = new HttpPost(url);
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IOException("Failed to serialize request body", e);
        }
        request.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));
        return execute(request, headers);
    }

    private static JsonNode execute(HttpUriRequestBase request, Map<String, String> headers) throws IOException {
        if (headers != null) {
            headers.forEach(request::addHeader);
        }
        String url = request.getRequestUri();

        try (CloseableHttpClient httpClient = HttpClients.createDefault();
             CloseableHttpResponse response = httpClient.execute(request)) {
            int statusCode = response.getCode();
            HttpEntity entity = response.getEntity();
            String contentType = entity != null ? entity.getContentType() : null;

            String responseBody;
            try {
                responseBody = entity != null ? EntityUtils.toString(entity) : "";
            } catch (ParseException e) {
                throw new IOException("Failed to read response", e);
            }

            if (statusCode < 200 || statusCode >= 300) {
                logger.error("HTTP {} failed with status {}", url, statusCode);
                logResponseBodyPreview(responseBody);
                throw new IOException("HTTP request failed with status " + statusCode);
            }

            // A missing content type is still parsed as JSON
            if (contentType != null && !contentType.isEmpty()
                && !contentType.toLowerCase().startsWith("application/json")) {
                logger.error("Expected JSON but received content-type: {}. URL: {}", contentType, url);
                logResponseBodyPreview(responseBody);
                throw new IOException("Expected JSON response but received: " + contentType);
            }

            try {
                return objectMapper.readTree(responseBody);
            } catch (JsonProcessingException e) {
                logger.error("Failed to parse JSON. URL: {}", url);
                logResponseBodyPreview(responseBody);
                throw new IOException("Failed to parse JSON response: " + e.getOriginalMessage(), e);
            }
        }
    }
}
