package org.tabelle.pipeline;

import org.tabelle.render.TableRenderer;
import org.tabelle.support.FormulaException;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ESECUZIONE - Elaborazione di tutte le righe configurate
 *
 * Per ogni sorgente, riga per riga: lettura -> generazione della tabella ->
 * formattazione -> emissione su standard output o nel file della sorgente
 * nella directory di output. Ogni tabella è emessa prima di leggere la riga
 * successiva, quindi un errore di lettura non perde le tabelle già prodotte.
 *
 * POLITICA DEGLI ERRORI:
 * - Default: il primo errore su una riga interrompe l'intera esecuzione
 * - keepGoing: la riga errata viene segnalata e saltata, l'esecuzione prosegue
 * - Errori di I/O: interrompono sempre l'esecuzione
 *
 * ELABORAZIONE PARALLELA:
 * Con più thread le righe sono affidate a un pool fisso mantenendo una finestra
 * limitata di righe in corso; le tabelle sono emesse nell'ordine di input.
 */
public final class TruthTableRunner {

    private static final Logger LOGGER = Logger.getLogger(TruthTableRunner.class.getName());

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;

    private static final String TABLE_SEPARATOR = "\n\n";

    /** Righe in corso per thread nella modalità parallela */
    private static final int LINES_IN_FLIGHT_PER_THREAD = 4;

    private final RunConfiguration config;
    private final TruthTableGenerator generator;
    private final TableRenderer renderer;
    private final PrintStream out;
    private final PrintStream err;
    private final RunSummary summary = new RunSummary();

    /**
     * @param config configurazione validata
     * @param out destinazione delle tabelle
     * @param err destinazione dei messaggi di stato, di errore e di riepilogo
     */
    public TruthTableRunner(RunConfiguration config, PrintStream out, PrintStream err) {
        this.config = config;
        this.generator = new TruthTableGenerator(config.isStrictLexing());
        this.renderer = config.getFormat().createRenderer();
        this.out = out;
        this.err = err;
    }

    //region PUNTO PRINCIPALE

    /**
     * Elabora tutte le sorgenti nell'ordine.
     *
     * @param source sorgente delle righe
     * @return {@link #EXIT_SUCCESS} se tutte le righe sono state elaborate, {@link #EXIT_FAILURE} altrimenti
     */
    public int run(LineSource source) {
        ExecutorService executor = config.getThreads() > 1
                ? Executors.newFixedThreadPool(config.getThreads())
                : null;

        try {
            for (LineSource.Input input : source.getInputs()) {
                if (!processInput(source, input, executor)) {
                    return EXIT_FAILURE;
                }
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        if (config.isKeepGoing() || config.writesToFiles()) {
            displaySummary();
        }
        return summary.hasFailures() ? EXIT_FAILURE : EXIT_SUCCESS;
    }

    public RunSummary getSummary() {
        return summary;
    }

    //endregion

    //region ELABORAZIONE DELLE SORGENTI

    /**
     * @return false se l'esecuzione deve interrompersi
     */
    private boolean processInput(LineSource source, LineSource.Input input, ExecutorService executor) {
        boolean completed;
        try (LineSource.LineReader reader = source.open(input);
             TableOutput output = new TableOutput(input)) {
            completed = executor == null
                    ? processSequentially(reader, output)
                    : processInParallel(reader, output, executor);
        } catch (IOException e) {
            err.println("[E] Errore di I/O su " + input.getName() + ": " + e.getMessage());
            LOGGER.log(Level.SEVERE, "Errore di I/O su " + input.getName(), e);
            return false;
        }

        if (!completed) {
            err.println("[E] Esecuzione interrotta al primo errore (usare -k per proseguire).");
        }
        return completed;
    }

    private boolean processSequentially(LineSource.LineReader reader, TableOutput output) throws IOException {
        SourceLine line;
        while ((line = reader.nextLine()) != null) {
            summary.incrementProcessed();
            try {
                output.write(renderLine(line));
            } catch (FormulaException e) {
                if (!handleLineFailure(line, e)) {
                    return false;
                }
            }
        }
        return true;
    }

    private boolean processInParallel(LineSource.LineReader reader, TableOutput output,
                                      ExecutorService executor) throws IOException {
        int capacity = config.getThreads() * LINES_IN_FLIGHT_PER_THREAD;
        Deque<PendingLine> window = new ArrayDeque<>(capacity);

        try {
            while (true) {
                SourceLine line;
                try {
                    line = reader.nextLine();
                } catch (IOException e) {
                    // Le righe già lette vengono emesse prima di propagare l'errore
                    drainAll(window, output);
                    throw e;
                }
                if (line == null) {
                    return drainAll(window, output);
                }

                window.addLast(new PendingLine(line, executor.submit(() -> renderLine(line))));
                if (window.size() >= capacity && !drainOldest(window, output)) {
                    return false;
                }
            }
        } finally {
            for (PendingLine pending : window) {
                pending.future.cancel(true);
            }
        }
    }

    private boolean drainAll(Deque<PendingLine> window, TableOutput output) throws IOException {
        while (!window.isEmpty()) {
            if (!drainOldest(window, output)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Attende la riga più vecchia della finestra ed emette la sua tabella.
     *
     * @return false se l'esecuzione deve interrompersi
     */
    private boolean drainOldest(Deque<PendingLine> window, TableOutput output) throws IOException {
        PendingLine pending = window.removeFirst();
        summary.incrementProcessed();
        try {
            output.write(pending.future.get());
            return true;
        } catch (ExecutionException e) {
            if (!(e.getCause() instanceof FormulaException)) {
                throw new IllegalStateException("Errore inatteso elaborando " + pending.line.location(), e.getCause());
            }
            return handleLineFailure(pending.line, (FormulaException) e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Elaborazione interrotta su " + pending.line.location(), e);
        }
    }

    private String renderLine(SourceLine line) {
        return renderer.render(generator.generate(line.getText()));
    }

    /**
     * Segnala l'errore di una riga.
     *
     * @return true se l'esecuzione può proseguire
     */
    private boolean handleLineFailure(SourceLine line, FormulaException e) {
        summary.incrementFailed();
        err.println("[E] " + line.location() + ": " + e.getMessage());
        LOGGER.log(Level.FINE, "Errore sulla formula '" + line.getText() + "'", e);
        return config.isKeepGoing();
    }

    /**
     * Riga affidata al pool, in attesa di emissione.
     */
    private static final class PendingLine {
        private final SourceLine line;
        private final Future<String> future;

        PendingLine(SourceLine line, Future<String> future) {
            this.line = line;
            this.future = future;
        }
    }

    //endregion

    //region OUTPUT

    /**
     * Destinazione delle tabelle di una sorgente: standard output oppure il file
     * {@code <nome base><estensione>} nella directory di output, separando le
     * tabelle con una riga vuota.
     */
    private final class TableOutput implements Closeable {

        /** Writer del file di output; null per lo standard output */
        private final BufferedWriter writer;
        private final Path target;
        private int tables = 0;

        TableOutput(LineSource.Input input) throws IOException {
            if (config.writesToFiles()) {
                Files.createDirectories(config.getOutputDirectory());
                target = config.getOutputDirectory().resolve(input.getBaseName() + config.getFormat().getExtension());
                writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
            } else {
                target = null;
                writer = null;
            }
        }

        void write(String table) throws IOException {
            if (writer == null) {
                out.println(table);
            } else {
                if (tables > 0) {
                    writer.write(TABLE_SEPARATOR);
                }
                writer.write(table);
            }
            tables++;
        }

        @Override
        public void close() throws IOException {
            if (writer == null) {
                out.flush();
                return;
            }
            try {
                if (tables > 0) {
                    writer.write("\n");
                }
            } finally {
                writer.close();
            }
            summary.incrementWrittenFiles();
            err.println("[I] " + tables + " tabelle salvate: " + target);
        }
    }

    private void displaySummary() {
        StringBuilder line = new StringBuilder("[I] Formule elaborate: ").append(summary.getProcessedLines())
                .append(", riuscite: ").append(summary.getSucceededLines())
                .append(", con errori: ").append(summary.getFailedLines());
        if (config.writesToFiles()) {
            line.append(", file scritti: ").append(summary.getWrittenFiles());
        }
        err.println(line);
    }

    //endregion
}
