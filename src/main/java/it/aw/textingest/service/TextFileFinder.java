package it.aw.textingest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Trova ricorsivamente i file {@code .txt} (estensione case-insensitive) sotto una directory.
 * <p>
 * Sono inclusi i file regolari e i link simbolici (che non vengono seguiti
 * durante la visita: se il target manca, l'errore emerge in lettura).
 * Un path non accessibile viene loggato e saltato, la visita prosegue.
 * Il risultato è ordinato per path.
 */
public class TextFileFinder {

    private static final Logger log = LoggerFactory.getLogger(TextFileFinder.class);

    static final String TEXT_EXTENSION = ".txt";

    private TextFileFinder() {}

    public static List<Path> find(Path root) throws IOException {
        List<Path> found = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if ((attrs.isRegularFile() || attrs.isSymbolicLink()) && hasTextExtension(file)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Path non accessibile, saltato: {} ({})", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException e) {
                if (e != null) {
                    log.warn("Errore durante la visita di {}: {}", dir, e.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }
        });

        found.sort(Comparator.comparing(Path::toString));
        return found;
    }

    static boolean hasTextExtension(Path file) {
        Path name = file.getFileName();
        return name != null && name.toString().toLowerCase(Locale.ROOT).endsWith(TEXT_EXTENSION);
    }
}
