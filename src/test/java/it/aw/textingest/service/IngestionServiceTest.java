package it.aw.textingest.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.output.Response;
import it.aw.textingest.config.IngestConfig;
import it.aw.textingest.exception.ConnectivityException;
import it.aw.textingest.exception.EmbeddingException;
import it.aw.textingest.exception.IngestionAbortedException;
import it.aw.textingest.exception.IngestionCancelledException;
import it.aw.textingest.model.RunState;
import it.aw.textingest.model.RunStats;
import it.aw.textingest.store.JsonlRecordWriter;
import it.aw.textingest.store.RecordSink;
import it.aw.textingest.store.RecordSinkFactory;
import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionService Tests")
class IngestionServiceTest {

    private static final Response<Embedding> EMBEDDING = Response.from(Embedding.from(new float[]{0.1f, 0.2f, 0.3f}));

    @Mock
    private OllamaEmbeddingClient embeddingClient;

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path workDir;

    private Path input;
    private Path output;

    @BeforeEach
    void setUp() throws IOException {
        input = Files.createDirectories(workDir.resolve("docs"));
        output = workDir.resolve("storage/vectors.jsonl");
        lenient().when(embeddingClient.baseUrl()).thenReturn("http://localhost:11434");
        lenient().when(embeddingClient.embed(anyString())).thenReturn(EMBEDDING);
    }

    @Test
    @DisplayName("should process every text file and write one record per chunk")
    void shouldProcessAllFiles() throws IOException {
        write("a.txt", "alpha beta gamma");
        write("b.txt", "one two three four five");

        RunStats stats = service().run(config(2));

        assertThat(stats.getFilesProcessed()).isEqualTo(2);
        assertThat(stats.getFilesSkipped()).isZero();
        assertThat(stats.getChunksCreated()).isEqualTo(5);
        assertThat(stats.getTotalErrors()).isZero();
        assertThat(stats.getEndTime()).isNotNull();
        assertThat(records()).extracting(r -> r.get("source_file").asText() + "#" + r.get("chunk_index").asInt())
                .containsExactly("a.txt#0", "a.txt#1", "b.txt#0", "b.txt#1", "b.txt#2");
    }

    @Test
    @DisplayName("should abort without opening the output when the health check fails")
    void shouldAbort_whenHealthCheckFails() {
        RecordSinkFactory sinkFactory = mock(RecordSinkFactory.class);
        doThrow(new ConnectivityException("connection refused")).when(embeddingClient).healthCheck();
        IngestionService service = new IngestionService(embeddingClient, sinkFactory);

        assertThatThrownBy(() -> service.run(config(300)))
                .isInstanceOf(IngestionAbortedException.class)
                .hasCauseInstanceOf(ConnectivityException.class);
        assertThat(service.state()).isEqualTo(RunState.ABORTED);
        verifyNoInteractions(sinkFactory);
        verify(embeddingClient, never()).embed(anyString());
    }

    @Test
    @DisplayName("should abort when the output cannot be opened")
    void shouldAbort_whenOutputCannotBeOpened() throws IOException {
        write("a.txt", "some words");
        RecordSinkFactory sinkFactory = mock(RecordSinkFactory.class);
        when(sinkFactory.open(any())).thenThrow(new IOException("read-only file system"));
        IngestionService service = new IngestionService(embeddingClient, sinkFactory);

        assertThatThrownBy(() -> service.run(config(300)))
                .isInstanceOf(IngestionAbortedException.class)
                .hasMessageContaining("read-only file system");
        assertThat(service.state()).isEqualTo(RunState.ABORTED);
        verify(embeddingClient, never()).embed(anyString());
    }

    @Test
    @DisplayName("should skip an unreadable file and keep going")
    void shouldSkipUnreadableFile() throws IOException {
        write("a.txt", "first file");
        write("c.txt", "third file");
        Files.createSymbolicLink(input.resolve("b.txt"), input.resolve("does-not-exist"));

        IngestionService service = service();
        RunStats stats = service.run(config(300));

        assertThat(stats.getFilesProcessed()).isEqualTo(2);
        assertThat(stats.getFilesSkipped()).isEqualTo(1);
        assertThat(stats.getTotalErrors()).isGreaterThanOrEqualTo(1);
        assertThat(service.state()).isEqualTo(RunState.DONE);
        assertThat(records()).extracting(r -> r.get("source_file").asText()).containsExactly("a.txt", "c.txt");
    }

    @Test
    @DisplayName("should abandon the rest of a file after a failed chunk but keep earlier records")
    void shouldAbandonFile_afterChunkFailure() throws IOException {
        write("a.txt", "one two three four five six");
        write("b.txt", "seven eight");
        when(embeddingClient.embed(anyString()))
                .thenReturn(EMBEDDING)
                .thenThrow(new EmbeddingException("Embedding non ottenuto dopo 4 tentativi", 4, null))
                .thenReturn(EMBEDDING);

        RunStats stats = service().run(config(2));

        assertThat(stats.getFilesProcessed()).isEqualTo(1);
        assertThat(stats.getFilesSkipped()).isEqualTo(1);
        assertThat(stats.getChunksCreated()).isEqualTo(2);
        assertThat(stats.getTotalErrors()).isEqualTo(1);
        assertThat(records()).extracting(r -> r.get("text").asText()).containsExactly("one two", "seven eight");
    }

    @Test
    @DisplayName("should complete with zero counts for an empty directory")
    void shouldComplete_forEmptyDirectory() throws IOException {
        RunStats stats = service().run(config(300));

        assertThat(stats.getFilesProcessed()).isZero();
        assertThat(stats.getChunksCreated()).isZero();
        assertThat(stats.getTotalErrors()).isZero();
        assertThat(output).exists();
        assertThat(Files.size(output)).isZero();
    }

    @Test
    @DisplayName("should count a file without words as processed and write nothing for it")
    void shouldCountEmptyFileAsProcessed() throws IOException {
        write("blank.txt", "  ... --- !!!  \n");

        RunStats stats = service().run(config(300));

        assertThat(stats.getFilesProcessed()).isEqualTo(1);
        assertThat(stats.getChunksCreated()).isZero();
        assertThat(records()).isEmpty();
    }

    @Test
    @DisplayName("should match the .txt extension case-insensitively and ignore other files")
    void shouldFilterByExtension() throws IOException {
        write("upper.TXT", "upper case");
        write("notes.md", "markdown file");
        write("data.txt.bak", "backup file");
        write("sub/deep/c.txt", "nested file");

        RunStats stats = service().run(config(300));

        assertThat(stats.getFilesProcessed()).isEqualTo(2);
        assertThat(records()).extracting(r -> r.get("source_file").asText())
                .containsExactlyInAnyOrder("upper.TXT", "sub/deep/c.txt");
    }

    @Test
    @DisplayName("should stop with a cancelled state and keep what was already written")
    void shouldPropagateCancellation() throws IOException {
        write("a.txt", "one two three four");
        when(embeddingClient.embed(anyString()))
                .thenReturn(EMBEDDING)
                .thenThrow(new IngestionCancelledException("Attesa tra i tentativi interrotta", new InterruptedException()));

        IngestionService service = service();

        assertThatThrownBy(() -> service.run(config(2))).isInstanceOf(IngestionCancelledException.class);
        assertThat(service.state()).isEqualTo(RunState.CANCELLED);
        assertThat(service.lastStats().getChunksCreated()).isEqualTo(1);
        assertThat(service.lastStats().getEndTime()).isNotNull();
        assertThat(records()).hasSize(1);
    }

    @Test
    @DisplayName("should cancel the whole run when the thread is interrupted before the files")
    void shouldCancel_whenInterruptedBeforeFiles() throws IOException {
        write("a.txt", "first file");
        write("b.txt", "second file");
        doAnswer(invocation -> {
            Thread.currentThread().interrupt();
            return null;
        }).when(embeddingClient).healthCheck();

        IngestionService service = service();
        try {
            assertThatThrownBy(() -> service.run(config(300))).isInstanceOf(IngestionCancelledException.class);
        } finally {
            Thread.interrupted();
        }

        assertThat(service.state()).isEqualTo(RunState.CANCELLED);
        assertThat(service.lastStats().getFilesSkipped()).isZero();
        assertThat(service.lastStats().getTotalErrors()).isZero();
        verify(embeddingClient, never()).embed(anyString());
    }

    @Test
    @DisplayName("should report cancellation when the health check is interrupted")
    void shouldCancel_whenHealthCheckInterrupted() {
        RecordSinkFactory sinkFactory = mock(RecordSinkFactory.class);
        doThrow(new IngestionCancelledException("Health check interrotto", new InterruptedException()))
                .when(embeddingClient).healthCheck();
        IngestionService service = new IngestionService(embeddingClient, sinkFactory);

        assertThatThrownBy(() -> service.run(config(300))).isInstanceOf(IngestionCancelledException.class);
        assertThat(service.state()).isEqualTo(RunState.CANCELLED);
        verifyNoInteractions(sinkFactory);
    }

    @Test
    @DisplayName("should cancel instead of skipping when a write is interrupted")
    void shouldCancel_whenWriteClosedByInterrupt() throws IOException {
        write("a.txt", "first file");
        write("b.txt", "second file");
        RecordSink sink = mock(RecordSink.class);
        when(sink.write(anyString(), any(), any())).thenThrow(new ClosedByInterruptException());
        IngestionService service = new IngestionService(embeddingClient, out -> sink);

        try {
            assertThatThrownBy(() -> service.run(config(300)))
                    .isInstanceOf(IngestionCancelledException.class)
                    .hasCauseInstanceOf(ClosedByInterruptException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }

        assertThat(service.state()).isEqualTo(RunState.CANCELLED);
        assertThat(service.lastStats().getFilesSkipped()).isZero();
        verify(embeddingClient).embed("first file");
        verify(sink).close();
    }

    @Test
    @DisplayName("should complete with no files when the input directory vanishes before discovery")
    void shouldComplete_whenDirectoryVanishes() throws IOException {
        IngestConfig config = config(300);
        Files.delete(input);

        IngestionService service = service();
        RunStats stats = service.run(config);

        assertThat(service.state()).isEqualTo(RunState.DONE);
        assertThat(stats.getFilesProcessed()).isZero();
        assertThat(stats.getFilesSkipped()).isZero();
    }

    @Test
    @DisplayName("relative names always use forward slashes")
    void relativeNameUsesForwardSlashes() {
        Path root = Path.of("docs");

        assertThat(IngestionService.relativeName(root, root.resolve("sub").resolve("c.txt"))).isEqualTo("sub/c.txt");
        assertThat(IngestionService.relativeName(root, root.resolve("a.txt"))).isEqualTo("a.txt");
    }

    private IngestionService service() {
        return new IngestionService(embeddingClient, out -> JsonlRecordWriter.open(out, mapper));
    }

    private IngestConfig config(int chunkSize) {
        return new IngestConfig(input, "nomic-embed-text", output, chunkSize);
    }

    private void write(String relative, String content) throws IOException {
        Path file = input.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    private List<JsonNode> records() throws IOException {
        List<JsonNode> nodes = new ArrayList<>();
        if (!Files.exists(output)) {
            return nodes;
        }
        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            nodes.add(mapper.readTree(line));
        }
        return nodes;
    }
}
