package it.aw.textingest.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import it.aw.textingest.model.VectorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Scrive i record su file JSONL: un oggetto JSON per riga, UTF-8.
 * <p>
 * Il file è aperto in append (creato se assente, mai troncato), quindi esecuzioni
 * successive sullo stesso path accumulano record. Ogni riga, terminatore
 * compreso, viene passata al canale in un'unica scrittura senza buffer
 * intermedi tra una chiamata e l'altra.
 */
public class JsonlRecordWriter implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(JsonlRecordWriter.class);

    private final Path outputPath;
    private final FileChannel channel;
    private final ObjectWriter jsonWriter;

    private JsonlRecordWriter(Path outputPath, FileChannel channel, ObjectMapper objectMapper) {
        this.outputPath = outputPath;
        this.channel = channel;
        this.jsonWriter = objectMapper.writerFor(VectorRecord.class)
                .without(SerializationFeature.INDENT_OUTPUT);
    }

    /** Crea la directory padre se serve e apre il file in append. */
    public static JsonlRecordWriter open(Path outputPath, ObjectMapper objectMapper) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(outputPath,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        log.debug("Output JSONL aperto in append: {}", outputPath.toAbsolutePath());
        return new JsonlRecordWriter(outputPath, channel, objectMapper);
    }

    @Override
    public void append(VectorRecord record) throws IOException {
        if (!channel.isOpen()) {
            throw new IOException("Writer chiuso: impossibile scrivere su " + outputPath);
        }
        String line = jsonWriter.writeValueAsString(record) + "\n";
        ByteBuffer buffer = ByteBuffer.wrap(line.getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    /** Forza su disco i dati già scritti. */
    public void flush() throws IOException {
        channel.force(false);
    }

    /** Dimensione corrente del file in byte. */
    public long size() throws IOException {
        return channel.size();
    }

    public Path outputPath() {
        return outputPath;
    }

    /** Idempotente. */
    @Override
    public void close() throws IOException {
        if (channel.isOpen()) {
            channel.close();
        }
    }
}
