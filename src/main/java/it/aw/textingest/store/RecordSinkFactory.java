package it.aw.textingest.store;

import java.io.IOException;
import java.nio.file.Path;

/** Apre un {@link RecordSink} sulla destinazione indicata. */
@FunctionalInterface
public interface RecordSinkFactory {

    RecordSink open(Path output) throws IOException;
}
