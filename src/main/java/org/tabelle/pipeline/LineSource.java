package org.tabelle.pipeline;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * SORGENTE DELLE RIGHE - Acquisizione delle formule da file o standard input
 *
 * Le sorgenti sono lette nell'ordine di configurazione, una formula per riga.
 * Senza file configurati si legge lo standard input. La lettura è incrementale:
 * ogni riga è restituita appena letta, senza attendere la fine della sorgente.
 * Le righe vuote o di soli spazi sono saltate, mantenendo la numerazione
 * originale per i messaggi.
 */
public final class LineSource {

    private static final Logger LOGGER = Logger.getLogger(LineSource.class.getName());

    public static final String STANDARD_INPUT_NAME = "<stdin>";
    private static final String STANDARD_INPUT_BASE_NAME = "stdin";
    private static final String FORMULA_EXTENSION = ".txt";

    /**
     * Singola sorgente: un file oppure lo standard input (path null).
     */
    public static final class Input {

        private final String name;
        private final Path path;

        private Input(String name, Path path) {
            this.name = name;
            this.path = path;
        }

        public String getName() {
            return name;
        }

        public Path getPath() {
            return path;
        }

        public boolean isStandardInput() {
            return path == null;
        }

        /**
         * @return nome del file senza estensione, "stdin" per lo standard input
         */
        public String getBaseName() {
            return path == null ? STANDARD_INPUT_BASE_NAME : baseName(path);
        }
    }

    /**
     * Lettore incrementale delle righe di una sorgente.
     *
     * Chiudere il lettore dello standard input non chiude il flusso sottostante.
     */
    public static final class LineReader implements Closeable {

        private final String sourceName;
        private final BufferedReader reader;
        private final boolean ownsReader;
        private int lineNumber = 0;

        private LineReader(String sourceName, BufferedReader reader, boolean ownsReader) {
            this.sourceName = sourceName;
            this.reader = reader;
            this.ownsReader = ownsReader;
        }

        /**
         * @return prossima riga non vuota, null a fine sorgente
         * @throws IOException se la sorgente non è leggibile
         */
        public SourceLine nextLine() throws IOException {
            String text;
            while ((text = reader.readLine()) != null) {
                lineNumber++;
                if (!text.isBlank()) {
                    return new SourceLine(sourceName, lineNumber, text);
                }
                LOGGER.warning("Riga vuota ignorata: " + sourceName + ":" + lineNumber);
            }
            LOGGER.fine(() -> "Fine di " + sourceName + " dopo " + lineNumber + " righe");
            return null;
        }

        @Override
        public void close() throws IOException {
            if (ownsReader) {
                reader.close();
            }
        }
    }

    private final List<Input> inputs;
    private final InputStream standardInput;

    private LineSource(List<Input> inputs, InputStream standardInput) {
        this.inputs = Collections.unmodifiableList(inputs);
        this.standardInput = standardInput;
    }

    /**
     * @param files file da leggere in ordine; se vuota si legge lo standard input
     * @param standardInput flusso usato in assenza di file
     */
    public static LineSource of(List<Path> files, InputStream standardInput) {
        Objects.requireNonNull(files, "Lista file non può essere null");
        List<Input> inputs = new ArrayList<>();
        if (files.isEmpty()) {
            Objects.requireNonNull(standardInput, "Standard input non disponibile");
            inputs.add(new Input(STANDARD_INPUT_NAME, null));
        } else {
            for (Path file : files) {
                inputs.add(new Input(file.toString(), file));
            }
        }
        return new LineSource(inputs, standardInput);
    }

    /**
     * Trova tutti i file .txt della directory, ordinati per nome.
     *
     * @param directory directory da scansionare (non ricorsivamente)
     * @return file trovati, eventualmente nessuno
     * @throws IOException se la directory non è leggibile
     */
    public static List<Path> listFormulaFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            List<Path> files = entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(FORMULA_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
            LOGGER.fine(() -> "Trovati " + files.size() + " file " + FORMULA_EXTENSION + " in " + directory);
            return files;
        }
    }

    /**
     * @return nome del file senza l'ultima estensione
     */
    public static String baseName(Path file) {
        String fileName = file.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    public List<Input> getInputs() {
        return inputs;
    }

    /**
     * Apre una sorgente per la lettura riga per riga.
     *
     * @throws IOException se il file non è apribile
     */
    public LineReader open(Input input) throws IOException {
        if (input.isStandardInput()) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(standardInput, StandardCharsets.UTF_8));
            return new LineReader(input.getName(), reader, false);
        }
        return new LineReader(input.getName(), Files.newBufferedReader(input.getPath(), StandardCharsets.UTF_8), true);
    }
}
