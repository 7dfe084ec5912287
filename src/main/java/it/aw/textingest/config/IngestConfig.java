package it.aw.textingest.config;

import it.aw.textingest.model.ChunkingParams;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Configurazione validata di un'esecuzione di ingestione.
 * <p>
 * Il costruttore compatto rifiuta valori non validi con
 * {@link IllegalArgumentException}: a valle nessuno ricontrolla.
 */
public record IngestConfig(Path directory, String model, Path output, int chunkSize) {

    /** Costruttore compatto con validazione. */
    public IngestConfig {
        if (directory == null) {
            throw new IllegalArgumentException("directory di input non specificata");
        }
        if (!Files.exists(directory)) {
            throw new IllegalArgumentException("la directory non esiste: " + directory);
        }
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("il path non è una directory: " + directory);
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("il nome del modello non può essere vuoto");
        }
        if (output == null) {
            throw new IllegalArgumentException("path di output non specificato");
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize deve essere > 0 (ricevuto: " + chunkSize + ")");
        }
    }

    /** Costruisce la configurazione a partire dai valori testuali delle property. */
    public static IngestConfig of(String directory, String model, String output, int chunkSize) {
        if (directory == null || directory.isBlank()) {
            throw new IllegalArgumentException("directory di input non specificata");
        }
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("path di output non specificato");
        }
        return new IngestConfig(Path.of(directory), model, Path.of(output), chunkSize);
    }

    public ChunkingParams chunkingParams() {
        return new ChunkingParams(chunkSize);
    }
}
