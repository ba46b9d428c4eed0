package io.llmgate.core.provider;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmgate.core.error.ProviderInvocationException;
import io.llmgate.core.model.LlmRequest;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;

/**
 * Provider speaking the OpenAI chat-completions protocol. The OkHttp client is built on the
 * first call and shared by every request to this provider afterwards.
 */
public final class OpenAiCompatProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 300;

    private final String name;
    private final String apiKey;
    private final String apiBase;
    private final String model;
    private final Map<String, String> extraHeaders;
    private final ObjectMapper mapper;
    private volatile OkHttpClient client;

    public OpenAiCompatProvider(String name, String apiKey, String apiBase, String model) {
        this(name, apiKey, apiBase, model, Map.of());
    }

    public OpenAiCompatProvider(
        String name,
        String apiKey,
        String apiBase,
        String model,
        Map<String, String> extraHeaders
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = apiBase == null ? "" : apiBase.trim();
        this.model = model == null ? "" : model;
        this.extraHeaders = extraHeaders == null ? Map.of() : Map.copyOf(extraHeaders);
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public CompletableFuture<String> generate(LlmRequest request) {
        Request httpRequest;
        try {
            httpRequest = buildRequest(request);
        } catch (IOException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                new ProviderInvocationException(name, "cannot build request: " + e.getMessage(), e)
            );
        }

        Call call = client().newCall(httpRequest);
        CompletableFuture<String> result = new CompletableFuture<>();
        result.whenComplete((content, error) -> {
            if (result.isCancelled()) {
                call.cancel();
            }
        });
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                result.completeExceptionally(
                    new ProviderInvocationException(name, "transport error: " + e.getMessage(), e)
                );
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    result.complete(readContent(response));
                } catch (ProviderInvocationException e) {
                    result.completeExceptionally(e);
                } catch (JsonProcessingException e) {
                    result.completeExceptionally(
                        new ProviderInvocationException(name, "unreadable response: malformed JSON" + location(e))
                    );
                } catch (IOException | RuntimeException e) {
                    result.completeExceptionally(
                        new ProviderInvocationException(name, "unreadable response: " + e.getMessage(), e)
                    );
                }
            }
        });
        return result;
    }

    boolean clientInitialized() {
        return client != null;
    }

    private OkHttpClient client() {
        OkHttpClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    // Read and call deadlines belong to the gateway, so nothing may wait in the
                    // dispatcher queue before it is sent.
                    Dispatcher dispatcher = new Dispatcher();
                    dispatcher.setMaxRequests(Integer.MAX_VALUE);
                    dispatcher.setMaxRequestsPerHost(Integer.MAX_VALUE);
                    current = new OkHttpClient.Builder()
                        .dispatcher(dispatcher)
                        .connectTimeout(Duration.ofSeconds(20))
                        .writeTimeout(Duration.ofSeconds(20))
                        .readTimeout(Duration.ZERO)
                        .callTimeout(Duration.ZERO)
                        .build();
                    client = current;
                }
            }
        }
        return current;
    }

    private Request buildRequest(LlmRequest request) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", List.of(
            Map.of("role", "system", "content", request.systemPrompt()),
            Map.of("role", "user", "content", request.userPrompt())
        ));
        payload.put("temperature", request.temperature());
        if (request.jsonMode()) {
            payload.put("response_format", Map.of("type", "json_object"));
        }

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);

        Request.Builder builder = new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json, text/event-stream");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        for (Map.Entry<String, String> header : extraHeaders.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder.build();
    }

    private HttpUrl completionsUrl() {
        if (apiBase.isBlank()) {
            throw new IllegalArgumentException("no base address configured for provider " + name);
        }
        return HttpUrl.get(apiBase).newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private String readContent(Response response) throws IOException {
        ResponseBody body = response.body();
        if (!response.isSuccessful()) {
            String errorBody = body == null ? "" : truncate(body.string());
            throw new ProviderInvocationException(
                name,
                "HTTP " + response.code() + " " + errorBody,
                response.code(),
                null
            );
        }
        if (body == null) {
            throw new ProviderInvocationException(name, "empty response body");
        }

        String contentType = response.header("Content-Type", "");
        if (contentType.contains("text/event-stream")) {
            return parseSse(body.source());
        }
        return parseJson(body.string());
    }

    private String parseJson(String body) throws IOException {
        JsonNode root = mapper.readTree(body);
        JsonNode choices = root == null ? null : root.path("choices");
        if (choices == null || !choices.isArray() || choices.isEmpty()) {
            throw new ProviderInvocationException(name, "response carries no choices");
        }
        JsonNode content = choices.path(0).path("message").path("content");
        return content.isNull() || content.isMissingNode() ? "" : content.asText("");
    }

    private String parseSse(BufferedSource source) throws IOException {
        StringBuilder content = new StringBuilder();
        while (!source.exhausted()) {
            String line = source.readUtf8Line();
            if (line == null || line.isBlank() || !line.startsWith("data:")) {
                continue;
            }

            String payload = line.substring(5).trim();
            if (payload.isEmpty()) {
                continue;
            }
            if ("[DONE]".equals(payload)) {
                break;
            }

            JsonNode event = mapper.readTree(payload);
            for (JsonNode choice : event.path("choices")) {
                JsonNode delta = choice.path("delta");
                if (delta.has("content") && !delta.path("content").isNull()) {
                    content.append(delta.path("content").asText(""));
                }
            }
        }
        return content.toString();
    }

    private static String location(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        return location == null ? "" : " at line " + location.getLineNr() + " column " + location.getColumnNr();
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        if (value.length() <= MAX_ERROR_BODY) {
            return value;
        }
        return value.substring(0, MAX_ERROR_BODY) + "...";
    }
}
