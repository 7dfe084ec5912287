package it.aw.textingest.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import it.aw.textingest.exception.ConnectivityException;
import it.aw.textingest.exception.EmbeddingException;
import it.aw.textingest.exception.IngestionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Client HTTP per l'endpoint embeddings di Ollama.
 * <p>
 * Una richiesta per testo: {@code POST /api/embeddings} con {@code {model, prompt}},
 * risposta {@code {embedding: [...]}}. Errori di rete, status non 2xx, body non
 * valido o vettore vuoto fanno fallire il tentativo.
 * <p>
 * Dopo il primo fallimento si ritenta fino a {@code maxRetries} volte, attendendo
 * {@code backoff * 2^(n-1)} prima del tentativo n. L'interruzione del thread,
 * durante l'attesa o durante la chiamata, termina subito con
 * {@link IngestionCancelledException}.
 * <p>
 * Implementa {@link EmbeddingModel} così da poter essere usato come un qualsiasi
 * modello LangChain4j.
 */
public class OllamaEmbeddingClient implements EmbeddingModel {

    private static final Logger log = LoggerFactory.getLogger(OllamaEmbeddingClient.class);

    public static final String   DEFAULT_BASE_URL    = "http://localhost:11434";
    public static final Duration DEFAULT_TIMEOUT     = Duration.ofSeconds(30);
    public static final int      DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_BACKOFF     = Duration.ofSeconds(1);

    private static final String EMBEDDINGS_PATH = "/api/embeddings";
    private static final String HEALTH_PATH     = "/api/tags";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoff;

    private OllamaEmbeddingClient(Builder builder) {
        if (builder.model == null || builder.model.isBlank()) {
            throw new IllegalArgumentException("model non può essere vuoto");
        }
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries deve essere >= 0 (ricevuto: " + builder.maxRetries + ")");
        }
        this.timeout = builder.timeout;
        this.httpClient = builder.httpClient != null
                ? builder.httpClient
                : HttpClient.newBuilder().connectTimeout(timeout).build();
        this.objectMapper = builder.objectMapper != null ? builder.objectMapper : new ObjectMapper();
        this.baseUrl = stripTrailingSlash(builder.baseUrl);
        this.model = builder.model;
        this.maxRetries = builder.maxRetries;
        this.backoff = builder.backoff;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String baseUrl() {
        return baseUrl;
    }

    public String model() {
        return model;
    }

    /**
     * Restituisce l'embedding del testo, ritentando secondo la policy di backoff.
     *
     * @throws EmbeddingException          se tutti i tentativi falliscono (causa = ultimo errore)
     * @throws IngestionCancelledException se il thread viene interrotto
     */
    public float[] getEmbedding(String text) {
        EmbeddingException lastError = null;

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new IngestionCancelledException("Richiesta embedding annullata", null);
            }
            if (attempt > 0) {
                Duration wait = backoff.multipliedBy(1L << (attempt - 1));
                log.debug("Nuovo tentativo embedding: tentativo={}, attesa={} ms, lunghezza testo={}",
                        attempt, wait.toMillis(), text.length());
                pause(wait);
            }
            try {
                return requestEmbedding(text);
            } catch (EmbeddingException e) {
                lastError = e;
                log.warn("Richiesta embedding fallita: tentativo={}, errore={}, lunghezza testo={}",
                        attempt + 1, e.getMessage(), text.length());
            }
        }

        int attempts = maxRetries + 1;
        throw new EmbeddingException(
                "Embedding non ottenuto dopo " + attempts + " tentativi: " + lastError.getMessage(),
                attempts, lastError);
    }

    @Override
    public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
        List<Embedding> embeddings = new ArrayList<>(textSegments.size());
        for (TextSegment segment : textSegments) {
            embeddings.add(Embedding.from(getEmbedding(segment.text())));
        }
        return Response.from(embeddings);
    }

    /**
     * Verifica che il servizio risponda su {@code /api/tags}.
     *
     * @throws ConnectivityException       per errori di rete o status non 2xx
     * @throws IngestionCancelledException se il thread viene interrotto
     */
    public void healthCheck() {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(baseUrl + HEALTH_PATH))
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConnectivityException("URL del servizio di embedding non valido: " + baseUrl, e);
        }

        HttpResponse<Void> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException | IllegalArgumentException e) {
            throw new ConnectivityException("Servizio di embedding non raggiungibile su " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException("Health check interrotto", e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new ConnectivityException("Health check fallito con status " + response.statusCode());
        }
    }

    /** Un singolo tentativo, senza retry. */
    private float[] requestEmbedding(String text) {
        String body;
        try {
            body = objectMapper.writeValueAsString(new EmbeddingRequest(model, text));
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Serializzazione della richiesta fallita", e);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(baseUrl + EMBEDDINGS_PATH))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new EmbeddingException("URL del servizio di embedding non valido: " + baseUrl, e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException | IllegalArgumentException e) {
            throw new EmbeddingException("Richiesta HTTP fallita: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException("Richiesta embedding interrotta", e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new EmbeddingException("Status " + response.statusCode() + ": " + response.body());
        }

        return parseEmbedding(response.body());
    }

    /**
     * Estrae il vettore dal body. Ogni elemento deve essere un numero JSON:
     * null, stringhe o altri tipi rendono la risposta non valida.
     */
    private float[] parseEmbedding(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new EmbeddingException("Risposta non valida: " + e.getOriginalMessage(), e);
        }
        JsonNode values = root == null ? null : root.get("embedding");
        if (values == null || values.isNull()) {
            throw new EmbeddingException("Campo embedding assente nella risposta");
        }
        if (!values.isArray()) {
            throw new EmbeddingException("Campo embedding non è un array: " + values.getNodeType());
        }
        if (values.isEmpty()) {
            throw new EmbeddingException("Embedding vuoto nella risposta");
        }
        float[] embedding = new float[values.size()];
        for (int i = 0; i < embedding.length; i++) {
            JsonNode value = values.get(i);
            if (!value.isNumber()) {
                throw new EmbeddingException("Valore non numerico in posizione " + i + ": " + value);
            }
            embedding[i] = value.floatValue();
        }
        return embedding;
    }

    private void pause(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException("Attesa tra i tentativi interrotta", e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String stripTrailingSlash(String url) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    record EmbeddingRequest(String model, String prompt) {}


    public static class Builder {

        private HttpClient httpClient;
        private ObjectMapper objectMapper;
        private String baseUrl = DEFAULT_BASE_URL;
        private String model;
        private Duration timeout = DEFAULT_TIMEOUT;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration backoff = DEFAULT_BACKOFF;

        private Builder() {}

        public Builder httpClient(HttpClient httpClient)       { this.httpClient = httpClient; return this; }
        public Builder objectMapper(ObjectMapper objectMapper) { this.objectMapper = objectMapper; return this; }
        public Builder baseUrl(String baseUrl)                 { this.baseUrl = baseUrl; return this; }
        public Builder model(String model)                     { this.model = model; return this; }
        public Builder timeout(Duration timeout)               { this.timeout = timeout; return this; }
        public Builder maxRetries(int maxRetries)              { this.maxRetries = maxRetries; return this; }
        public Builder backoff(Duration backoff)               { this.backoff = backoff; return this; }

        public OllamaEmbeddingClient build() {
            return new OllamaEmbeddingClient(this);
        }
    }
}
