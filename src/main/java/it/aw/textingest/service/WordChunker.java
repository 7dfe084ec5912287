package it.aw.textingest.service;

import it.aw.textingest.model.Chunk;
import it.aw.textingest.model.ChunkingParams;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Suddivide un testo in chunk di un numero fisso di parole.
 * <p>
 * Regole:
 * <ul>
 *   <li>le parole sono sequenze separate da whitespace (Unicode);</li>
 *   <li>i token senza lettere né cifre (punteggiatura pura) vengono scartati,
 *       quelli misti restano invariati;</li>
 *   <li>se le parole valide sono al massimo {@code chunkSize} si produce un solo
 *       chunk con il testo originale (solo trim), punteggiatura isolata inclusa;</li>
 *   <li>altrimenti gruppi consecutivi di {@code chunkSize} parole unite da uno
 *       spazio; l'ultimo gruppo può essere più corto.</li>
 * </ul>
 * In tutti i casi {@code wordCount} conta solo le parole valide.
 */
public class WordChunker {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final int chunkSize;

    public WordChunker(ChunkingParams params) {
        this.chunkSize = params.chunkSize();
    }

    /**
     * Legge il file come UTF-8 e lo suddivide in chunk.
     * Sequenze di byte non valide vengono sostituite, non causano errore.
     */
    public List<Chunk> chunkFile(Path file) throws IOException {
        byte[] content = Files.readAllBytes(file);
        return chunk(new String(content, StandardCharsets.UTF_8));
    }

    public List<Chunk> chunk(String text) {
        String trimmed = trimWhitespace(text);
        if (trimmed.isEmpty()) {
            return List.of();
        }

        List<String> words = tokenize(trimmed);
        if (words.isEmpty()) {
            return List.of();
        }

        if (words.size() <= chunkSize) {
            return List.of(new Chunk(trimmed, words.size(), 0));
        }

        List<Chunk> chunks = new ArrayList<>((words.size() + chunkSize - 1) / chunkSize);
        int index = 0;
        for (int start = 0; start < words.size(); start += chunkSize) {
            List<String> group = words.subList(start, Math.min(start + chunkSize, words.size()));
            String chunkText = String.join(" ", group).strip();
            if (chunkText.isEmpty()) continue;
            chunks.add(new Chunk(chunkText, group.size(), index++));
        }
        return chunks;
    }

    private List<String> tokenize(String text) {
        List<String> words = new ArrayList<>();
        for (String token : WHITESPACE.split(text)) {
            if (isWord(token)) words.add(token);
        }
        return words;
    }

    /** Rimuove il whitespace Unicode ai due estremi con una scansione lineare. */
    static String trimWhitespace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end) {
            int cp = text.codePointAt(start);
            if (!isWhitespace(cp)) break;
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = text.codePointBefore(end);
            if (!isWhitespace(cp)) break;
            end -= Character.charCount(cp);
        }
        return text.substring(start, end);
    }

    /** Proprietà Unicode White_Space, la stessa di {@code \s} con UNICODE_CHARACTER_CLASS. */
    static boolean isWhitespace(int codePoint) {
        return Character.isSpaceChar(codePoint)
                || (codePoint >= 0x09 && codePoint <= 0x0D)
                || codePoint == 0x85;
    }

    /** Vero se il token contiene almeno una lettera o una cifra. */
    static boolean isWord(String token) {
        return token.codePoints().anyMatch(Character::isLetterOrDigit);
    }
}
