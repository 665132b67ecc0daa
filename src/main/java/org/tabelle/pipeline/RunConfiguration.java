package org.tabelle.pipeline;

import org.tabelle.render.OutputFormat;

import java.nio.file.Path;
import java.util.List;

/**
 * Configurazione validata di un'esecuzione.
 *
 * Contiene tutti i parametri in forma immutabile per garantire consistenza
 * durante l'elaborazione.
 */
public final class RunConfiguration {

    /** File di input nell'ordine di elaborazione; vuota per lo standard input */
    private final List<Path> inputFiles;

    /** Directory dei file di output; null per lo standard output */
    private final Path outputDirectory;

    private final OutputFormat format;

    /** Rifiuta i caratteri non riconosciuti invece di ignorarli */
    private final boolean strictLexing;

    /** Prosegue con la riga successiva dopo un errore */
    private final boolean keepGoing;

    /** Numero di thread di elaborazione, 1 per l'elaborazione sequenziale */
    private final int threads;

    private final boolean verbose;

    public RunConfiguration(List<Path> inputFiles, Path outputDirectory, OutputFormat format,
                            boolean strictLexing, boolean keepGoing, int threads, boolean verbose) {
        if (format == null) {
            throw new IllegalArgumentException("Formato di output non può essere null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Numero di thread deve essere almeno 1, ricevuto: " + threads);
        }
        this.inputFiles = List.copyOf(inputFiles);
        this.outputDirectory = outputDirectory;
        this.format = format;
        this.strictLexing = strictLexing;
        this.keepGoing = keepGoing;
        this.threads = threads;
        this.verbose = verbose;
    }

    public List<Path> getInputFiles() {
        return inputFiles;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public boolean writesToFiles() {
        return outputDirectory != null;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public boolean isStrictLexing() {
        return strictLexing;
    }

    public boolean isKeepGoing() {
        return keepGoing;
    }

    public int getThreads() {
        return threads;
    }

    public boolean isVerbose() {
        return verbose;
    }
}
