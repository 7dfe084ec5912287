package it.aw.textingest.model;

/**
 * Porzione di testo prodotta dal chunker per un singolo file.
 */
public record Chunk(
        String text,
        int    wordCount,   // parole valide (con almeno una lettera o cifra)
        int    index        // posizione 0-based del chunk nel file
) {}
