package it.aw.textingest.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Contatori di un'esecuzione. Accumulatore mutabile usato da un solo thread.
 */
public class RunStats {

    private final Instant startTime;
    private Instant endTime;
    private int filesProcessed;
    private int filesSkipped;
    private int chunksCreated;
    private int totalErrors;

    public RunStats(Instant startTime) {
        this.startTime = startTime;
    }

    public void fileProcessed() {
        filesProcessed++;
    }

    /** Un file saltato conta sempre anche come errore. */
    public void fileSkipped() {
        filesSkipped++;
        totalErrors++;
    }

    public void chunkCreated() {
        chunksCreated++;
    }

    public void error() {
        totalErrors++;
    }

    public void finish(Instant endTime) {
        this.endTime = endTime;
    }

    public Instant getStartTime()   { return startTime; }
    public Instant getEndTime()     { return endTime; }
    public int getFilesProcessed()  { return filesProcessed; }
    public int getFilesSkipped()    { return filesSkipped; }
    public int getChunksCreated()   { return chunksCreated; }
    public int getTotalErrors()     { return totalErrors; }

    /** Durata dell'esecuzione; zero finché non è terminata. */
    public Duration duration() {
        return endTime == null ? Duration.ZERO : Duration.between(startTime, endTime);
    }
}
