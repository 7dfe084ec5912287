package it.aw.textingest.model;

/**
 * Parametri di chunking per un'esecuzione di ingestione.
 * <p>
 * La dimensione è espressa in parole: ogni chunk contiene esattamente
 * {@code chunkSize} parole valide, tranne l'ultimo che può essere più corto.
 */
public record ChunkingParams(int chunkSize) {

    public static final int DEFAULT_CHUNK_SIZE = 300;

    /** Costruttore compatto con validazione. */
    public ChunkingParams {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize deve essere > 0 (ricevuto: " + chunkSize + ")");
        }
    }

    public static ChunkingParams defaults() {
        return new ChunkingParams(DEFAULT_CHUNK_SIZE);
    }
}
