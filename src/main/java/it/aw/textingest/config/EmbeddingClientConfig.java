package it.aw.textingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.textingest.service.OllamaEmbeddingClient;
import it.aw.textingest.store.JsonlRecordWriter;
import it.aw.textingest.store.RecordSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Configura il client di embedding e la destinazione dei record.
 *
 * EmbeddingClient: endpoint Ollama, URL di default preso da OLLAMA_HOST se impostata.
 *                  Timeout per richiesta indipendente dalla policy di retry.
 * RecordSink:      file JSONL in append, serializzato con l'ObjectMapper di Spring.
 */
@Configuration
public class EmbeddingClientConfig {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingClientConfig.class);

    @Value("${ingest.ollama.base-url}")
    private String baseUrl;

    @Value("${ingest.model}")
    private String model;

    @Value("${ingest.ollama.timeout}")
    private Duration timeout;

    @Value("${ingest.ollama.max-retries}")
    private int maxRetries;

    @Value("${ingest.ollama.backoff}")
    private Duration backoff;

    @Bean
    public OllamaEmbeddingClient embeddingClient(ObjectMapper objectMapper) {
        log.info("Inizializzazione EmbeddingClient: {} (modello {}, timeout {}, retry {}, backoff {})",
                baseUrl, model, timeout, maxRetries, backoff);
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        return OllamaEmbeddingClient.builder()
                .httpClient(httpClient)
                .objectMapper(objectMapper)
                .baseUrl(baseUrl)
                .model(model)
                .timeout(timeout)
                .maxRetries(maxRetries)
                .backoff(backoff)
                .build();
    }

    @Bean
    public RecordSinkFactory recordSinkFactory(ObjectMapper objectMapper) {
        return output -> JsonlRecordWriter.open(output, objectMapper);
    }
}
