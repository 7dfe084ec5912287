package it.aw.textingest.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Riga dell'output JSONL: un chunk con il suo embedding.
 * <p>
 * Tutti i campi sono obbligatori. {@code created_at} è in UTC con precisione
 * al secondo (es. {@code 2024-01-15T10:30:45Z}).
 */
@JsonPropertyOrder({"id", "source_file", "chunk_index", "text", "embedding", "word_count", "created_at"})
public record VectorRecord(
        @JsonProperty("id")          String  id,
        @JsonProperty("source_file") String  sourceFile,    // path relativo alla directory di input
        @JsonProperty("chunk_index") int     chunkIndex,
        @JsonProperty("text")        String  text,
        @JsonProperty("embedding")   float[] embedding,
        @JsonProperty("word_count")  int     wordCount,
        @JsonProperty("created_at")  String  createdAt
) {

    public static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ISO_INSTANT;

    /** Costruisce un record con un nuovo id casuale e il timestamp indicato. */
    public static VectorRecord of(String sourceFile, Chunk chunk, float[] embedding, Instant createdAt) {
        return new VectorRecord(
                UUID.randomUUID().toString(),
                sourceFile,
                chunk.index(),
                chunk.text(),
                embedding,
                chunk.wordCount(),
                CREATED_AT_FORMAT.format(createdAt.truncatedTo(ChronoUnit.SECONDS)));
    }
}
