package it.aw.textingest.runner;

import it.aw.textingest.config.IngestConfig;
import it.aw.textingest.exception.IngestionAbortedException;
import it.aw.textingest.exception.IngestionCancelledException;
import it.aw.textingest.model.RunStats;
import it.aw.textingest.service.IngestionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.info.BuildProperties;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Avvia l'ingestione all'avvio dell'applicazione e ne traduce l'esito in exit code.
 *
 * Exit code:
 *   0   : esecuzione completata, anche con errori sui singoli file
 *   1   : configurazione non valida o errore fatale (servizio non raggiungibile, output non apribile)
 *   130 : esecuzione annullata (thread interrotto)
 *
 * La directory di input si legge da {@code ingest.directory}; se presente,
 * il primo argomento posizionale la sostituisce:
 *   java -jar text-ingest.jar ./docs --ingest.chunk-size=200
 *
 * Con {@code --version} stampa versione e data di build ed esce con 0.
 */
@Component
public class IngestionRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    static final int EXIT_OK        = 0;
    static final int EXIT_FAILURE   = 1;
    static final int EXIT_CANCELLED = 130;

    private final IngestionService ingestionService;
    private final Optional<BuildProperties> buildProperties;
    private final String directory;
    private final String model;
    private final String output;
    private final int chunkSize;

    private int exitCode = EXIT_OK;

    public IngestionRunner(IngestionService ingestionService,
                           Optional<BuildProperties> buildProperties,
                           @Value("${ingest.directory:}") String directory,
                           @Value("${ingest.model}") String model,
                           @Value("${ingest.output}") String output,
                           @Value("${ingest.chunk-size}") int chunkSize) {
        this.ingestionService = ingestionService;
        this.buildProperties = buildProperties;
        this.directory = directory;
        this.model = model;
        this.output = output;
        this.chunkSize = chunkSize;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption("version")) {
            System.out.println(versionLine());
            exitCode = EXIT_OK;
            return;
        }

        List<String> positional = args.getNonOptionArgs();
        String inputDirectory = positional.isEmpty() ? directory : positional.get(0);

        IngestConfig config;
        try {
            config = IngestConfig.of(inputDirectory, model, output, chunkSize);
        } catch (IllegalArgumentException e) {
            log.error("Configurazione non valida: {}", e.getMessage());
            exitCode = EXIT_FAILURE;
            return;
        }

        try {
            RunStats stats = ingestionService.run(config);
            log.info("Ingestione terminata: {} file elaborati, {} saltati, {} chunk, {} errori",
                    stats.getFilesProcessed(), stats.getFilesSkipped(),
                    stats.getChunksCreated(), stats.getTotalErrors());
            exitCode = EXIT_OK;
        } catch (IngestionAbortedException e) {
            log.error("Ingestione fallita: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        } catch (IngestionCancelledException e) {
            log.warn("Ingestione annullata: {}", e.getMessage());
            exitCode = EXIT_CANCELLED;
        }
    }

    /** Es. {@code text-ingest v0.1.0 (built 2024-01-15T10:30:45Z)}; "dev" senza build-info. */
    String versionLine() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("dev");
        String built = buildProperties.map(BuildProperties::getTime).map(Instant::toString).orElse("unknown");
        return "text-ingest v" + version + " (built " + built + ")";
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
