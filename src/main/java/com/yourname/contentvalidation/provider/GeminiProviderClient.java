package com.yourname.contentvalidation.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.yourname.contentvalidation.exception.ProviderErrorKind;
import com.yourname.contentvalidation.exception.ProviderException;
import com.yourname.contentvalidation.model.ProviderId;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class GeminiProviderClient implements ProviderClient {

    private final RestClient restClient;
    private final String apiKey;
    private final String apiUrl;
    private final String model;

    public GeminiProviderClient(
        @Qualifier("llmRestClient") RestClient restClient,
        @Value("${gemini.api.key:}") String apiKey,
        @Value("${gemini.api.url}") String apiUrl,
        @Value("${gemini.api.model}") String model
    ) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.apiUrl = apiUrl;
        this.model = model;
    }

    @Override
    public ProviderId id() {
        return ProviderId.GEMINI;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank() && apiUrl != null && !apiUrl.isBlank();
    }

    @Override
    public String complete(String prompt) {
        if (!isConfigured()) {
            throw new ProviderException(id(), ProviderErrorKind.CONFIGURATION, "GEMINI_API_KEY missing");
        }

        // Gemini has no system role on this endpoint; the guard text goes in front of the prompt.
        String securePrompt = OpenAiProviderClient.SYSTEM_MESSAGE + "\n\n" + prompt;
        Map<String, Object> body = Map.of(
            "contents", List.of(Map.of("parts", List.of(Map.of("text", securePrompt)))),
            "generationConfig", Map.of("temperature", 0, "responseMimeType", "application/json")
        );

        GeminiResponse response;
        try {
            response = restClient.post()
                .uri(apiUrl + "/{model}:generateContent?key={key}", model, apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(GeminiResponse.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            ProviderErrorKind kind = status == 401 || status == 403
                ? ProviderErrorKind.CONFIGURATION
                : ProviderErrorKind.TRANSPORT;
            throw new ProviderException(id(), kind, "Gemini returned HTTP " + status, e);
        } catch (ResourceAccessException e) {
            ProviderErrorKind kind = e.getCause() instanceof SocketTimeoutException
                ? ProviderErrorKind.TIMEOUT
                : ProviderErrorKind.TRANSPORT;
            throw new ProviderException(id(), kind, "Gemini unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ProviderException(id(), ProviderErrorKind.TRANSPORT, "Gemini call failed: " + e.getMessage(), e);
        }

        return extractText(response);
    }

    private String extractText(GeminiResponse response) {
        if (response == null || response.candidates() == null || response.candidates().isEmpty()) {
            throw parseError("Gemini response missing candidates");
        }
        Candidate first = response.candidates().get(0);
        if (first.content() == null || first.content().parts() == null || first.content().parts().isEmpty()) {
            throw parseError("Gemini candidate has no content parts");
        }
        String text = first.content().parts().get(0).text();
        if (text == null) {
            throw parseError("Gemini response text is missing");
        }
        return text;
    }

    private ProviderException parseError(String message) {
        return new ProviderException(id(), ProviderErrorKind.PARSE, message);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Part(String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Content(List<Part> parts) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Candidate(Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GeminiResponse(List<Candidate> candidates) {}
}
