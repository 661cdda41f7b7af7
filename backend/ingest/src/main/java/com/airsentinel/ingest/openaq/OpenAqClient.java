package com.airsentinel.ingest.openaq;

import com.airsentinel.ingest.api.MeasurementPage;
import com.airsentinel.ingest.api.MeasurementProvider;
import com.airsentinel.ingest.api.PageRequest;
import com.airsentinel.ingest.error.TransientProviderException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Reads hourly PM2.5 averages for one sensor from the OpenAQ v3 API, and finds the PM2.5
 * sensors of a city through the locations listing of the configured country.
 */
public final class OpenAqClient implements MeasurementProvider {
    public static final String DEFAULT_BASE_URL = "https://api.openaq.org";
    static final int PM25_PARAMETER_ID = 2;
    static final int LOCATIONS_LIMIT = 1000;

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final String apiKey;
    private final int countryId;

    public OpenAqClient(HttpClient httpClient, String baseUrl, Duration timeout, String apiKey, int countryId) {
        this.httpClient = httpClient;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl.trim());
        this.timeout = timeout;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.countryId = countryId;
    }

    @Override
    public MeasurementPage fetchPage(PageRequest request) {
        return MeasurementPageParser.parse(get(uriFor(request)));
    }

    @Override
    public List<String> discoverSensors(String city) {
        return LocationDirectoryParser.pm25SensorsFor(get(locationsUri()), city);
    }

    URI uriFor(PageRequest request) {
        String query = "datetime_from=" + URLEncoder.encode(request.from().toString(), StandardCharsets.UTF_8)
                + "&datetime_to=" + URLEncoder.encode(request.to().toString(), StandardCharsets.UTF_8)
                + "&limit=" + request.limit()
                + "&page=1";
        return URI.create(baseUrl + "/v3/sensors/"
                + URLEncoder.encode(request.sensorId(), StandardCharsets.UTF_8)
                + "/hours?" + query);
    }

    URI locationsUri() {
        return URI.create(baseUrl + "/v3/locations?countries_id=" + countryId
                + "&parameters_id=" + PM25_PARAMETER_ID
                + "&limit=" + LOCATIONS_LIMIT);
    }

    private String get(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/json");
        if (!apiKey.isBlank()) {
            builder.header("X-API-Key", apiKey);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientProviderException("OpenAQ request timed out: " + uri, e);
        } catch (IOException e) {
            throw new TransientProviderException("OpenAQ request failed: " + uri, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("OpenAQ request interrupted", e);
        }

        int status = response.statusCode();
        if (status == 429 || status / 100 == 5) {
            throw new TransientProviderException("OpenAQ request failed with status " + status);
        }
        if (status / 100 != 2) {
            throw new IllegalStateException("OpenAQ request failed with status " + status);
        }
        return response.body();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
