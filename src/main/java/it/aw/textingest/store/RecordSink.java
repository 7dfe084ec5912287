package it.aw.textingest.store;

import it.aw.textingest.model.Chunk;
import it.aw.textingest.model.VectorRecord;

import java.io.Closeable;
import java.io.IOException;
import java.time.Instant;

/**
 * Destinazione sequenziale e append-only dei record.
 * <p>
 * Ogni {@link #append} lascia lo store in uno stato valido: un record è scritto
 * per intero oppure non è scritto. Dopo {@link #close()} ogni scrittura fallisce
 * con {@link IOException}. Non thread-safe.
 */
public interface RecordSink extends Closeable {

    void append(VectorRecord record) throws IOException;

    /** Assembla il record (id nuovo, timestamp UTC corrente) e lo accoda. */
    default VectorRecord write(String sourceFile, Chunk chunk, float[] embedding) throws IOException {
        VectorRecord record = VectorRecord.of(sourceFile, chunk, embedding, Instant.now());
        append(record);
        return record;
    }
}
