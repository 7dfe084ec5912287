package it.aw.textingest.service;

import it.aw.textingest.config.IngestConfig;
import it.aw.textingest.exception.ConnectivityException;
import it.aw.textingest.exception.EmbeddingException;
import it.aw.textingest.exception.IngestionAbortedException;
import it.aw.textingest.exception.IngestionCancelledException;
import it.aw.textingest.model.Chunk;
import it.aw.textingest.model.RunState;
import it.aw.textingest.model.RunStats;
import it.aw.textingest.store.RecordSink;
import it.aw.textingest.store.RecordSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Orchestra un'esecuzione di ingestione.
 * <p>
 * Pipeline:
 * <ol>
 *   <li>Health check del servizio di embedding (fallimento = run abortito)</li>
 *   <li>Apertura dell'output in append (fallimento = run abortito)</li>
 *   <li>Ricerca ricorsiva dei file .txt</li>
 *   <li>Per ogni file: chunking, poi embedding + scrittura chunk per chunk</li>
 *   <li>Chiusura dell'output e riepilogo</li>
 * </ol>
 * Un file illeggibile viene saltato; il primo chunk che fallisce (embedding o
 * scrittura) abbandona i chunk restanti del file, quelli già scritti restano.
 * In entrambi i casi il file conta come saltato e l'esecuzione prosegue.
 * L'interruzione del thread, rilevata prima di ogni file e di ogni chunk o
 * segnalata da un canale chiuso per interrupt, annulla l'intera esecuzione.
 * Tutto è sequenziale: un file e un chunk alla volta.
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final OllamaEmbeddingClient embeddingClient;
    private final RecordSinkFactory sinkFactory;

    private RunState state = RunState.IDLE;
    private RunStats lastStats;

    public IngestionService(OllamaEmbeddingClient embeddingClient, RecordSinkFactory sinkFactory) {
        this.embeddingClient = embeddingClient;
        this.sinkFactory = sinkFactory;
    }

    /**
     * Esegue l'intera pipeline.
     *
     * @return statistiche dell'esecuzione completata (anche con errori per file)
     * @throws IngestionAbortedException se il servizio non risponde o l'output non si apre
     */
    public RunStats run(IngestConfig config) {
        RunStats stats = new RunStats(Instant.now());
        lastStats = stats;

        log.info("Inizio ingestione: directory={}, modello={}, output={}, chunkSize={}",
                config.directory(), config.model(), config.output(), config.chunkSize());

        try {
            state = RunState.HEALTH_CHECKING;
            log.info("Verifica connettività del servizio di embedding ({})...", embeddingClient.baseUrl());
            try {
                embeddingClient.healthCheck();
            } catch (ConnectivityException e) {
                state = RunState.ABORTED;
                throw new IngestionAbortedException("Health check del servizio di embedding fallito: " + e.getMessage(), e);
            }
            log.info("Servizio di embedding raggiungibile");

            RecordSink sink;
            try {
                sink = sinkFactory.open(config.output());
            } catch (IOException e) {
                state = RunState.ABORTED;
                throw new IngestionAbortedException("Impossibile aprire l'output " + config.output() + ": " + e.getMessage(), e);
            }

            try {
                state = RunState.DISCOVERING;
                List<Path> files = discover(config.directory(), stats);
                if (files.isEmpty()) {
                    log.warn("Nessun file .txt trovato in {}", config.directory());
                } else {
                    log.info("Trovati {} file di testo da elaborare", files.size());
                    state = RunState.PROCESSING;
                    processFiles(config, files, sink, stats);
                }
                state = RunState.FINALIZING;
            } finally {
                stats.finish(Instant.now());
                closeSink(sink, config.output(), stats);
            }
        } catch (IngestionCancelledException e) {
            state = RunState.CANCELLED;
            log.warn("Ingestione annullata: {}", e.getMessage());
            throw e;
        }

        logSummary(config, stats);
        state = RunState.DONE;
        return stats;
    }

    public RunState state() {
        return state;
    }

    /** Statistiche dell'ultima esecuzione avviata, {@code null} se nessuna. */
    public RunStats lastStats() {
        return lastStats;
    }

    /** Un errore sulla radice viene contato e l'esecuzione termina senza file. */
    private List<Path> discover(Path directory, RunStats stats) {
        try {
            return TextFileFinder.find(directory);
        } catch (IOException e) {
            log.error("Ricerca dei file fallita in {}: {}", directory, e.getMessage());
            stats.error();
            return List.of();
        }
    }

    private void processFiles(IngestConfig config, List<Path> files, RecordSink sink, RunStats stats) {
        WordChunker chunker = new WordChunker(config.chunkingParams());
        Path root = config.directory();

        for (int i = 0; i < files.size(); i++) {
            checkCancelled();
            Path file = files.get(i);
            String sourceFile = relativeName(root, file);
            log.info("Elaborazione file {} ({}/{})", sourceFile, i + 1, files.size());

            List<Chunk> chunks;
            try {
                chunks = chunker.chunkFile(file);
            } catch (ClosedByInterruptException e) {
                throw cancelled("Lettura di " + sourceFile + " interrotta", e);
            } catch (IOException e) {
                log.error("File {} illeggibile, saltato: {}", sourceFile, e.getMessage());
                stats.fileSkipped();
                continue;
            }

            if (processChunks(sourceFile, chunks, sink, stats)) {
                stats.fileProcessed();
            } else {
                stats.fileSkipped();
            }
        }
    }

    /** @return false se un chunk è fallito e i restanti sono stati abbandonati */
    private boolean processChunks(String sourceFile, List<Chunk> chunks, RecordSink sink, RunStats stats) {
        if (chunks.isEmpty()) {
            log.warn("Il file {} non ha prodotto chunk", sourceFile);
            return true;
        }
        log.debug("File {} suddiviso in {} chunk", sourceFile, chunks.size());

        for (Chunk chunk : chunks) {
            checkCancelled();
            try {
                float[] vector = embeddingClient.embed(chunk.text()).content().vector();
                sink.write(sourceFile, chunk, vector);
            } catch (ClosedByInterruptException e) {
                throw cancelled("Scrittura del chunk " + chunk.index() + " di " + sourceFile + " interrotta", e);
            } catch (EmbeddingException | IOException e) {
                log.error("Chunk {} di {} fallito, {} chunk restanti abbandonati: {}",
                        chunk.index(), sourceFile, chunks.size() - chunk.index() - 1, e.getMessage());
                return false;
            }
            stats.chunkCreated();
            log.debug("Chunk {} di {} scritto ({} parole)", chunk.index(), sourceFile, chunk.wordCount());
        }
        return true;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new IngestionCancelledException("Thread di ingestione interrotto", null);
        }
    }

    private static IngestionCancelledException cancelled(String message, ClosedByInterruptException cause) {
        Thread.currentThread().interrupt();
        return new IngestionCancelledException(message, cause);
    }

    private void closeSink(RecordSink sink, Path output, RunStats stats) {
        try {
            sink.close();
        } catch (IOException e) {
            log.error("Errore chiusura output {}: {}", output, e.getMessage());
            stats.error();
        }
    }

    private void logSummary(IngestConfig config, RunStats stats) {
        log.info("Ingestione completata: file elaborati={}, file saltati={}, chunk creati={}, errori={}, durata={}, output={}",
                stats.getFilesProcessed(), stats.getFilesSkipped(), stats.getChunksCreated(),
                stats.getTotalErrors(), stats.duration(), config.output());
        if (stats.getTotalErrors() > 0) {
            log.warn("Ingestione completata con {} errori", stats.getTotalErrors());
        }
    }

    /** Path relativo alla directory di input, sempre con separatore '/'. */
    static String relativeName(Path root, Path file) {
        Path relative;
        try {
            relative = root.relativize(file);
        } catch (IllegalArgumentException e) {
            relative = file;
        }
        return relative.toString().replace(file.getFileSystem().getSeparator(), "/");
    }
}
