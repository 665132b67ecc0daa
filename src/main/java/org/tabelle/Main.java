package org.tabelle;

import org.tabelle.pipeline.LineSource;
import org.tabelle.pipeline.RunConfiguration;
import org.tabelle.pipeline.TruthTableRunner;
import org.tabelle.render.OutputFormat;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * GENERATORE DI TABELLE DI VERITÀ
 *
 * PIPELINE DI ELABORAZIONE (per ogni riga di input):
 * 1. INPUT: una formula proposizionale per riga, da file, directory o standard input
 * 2. TOKENIZZAZIONE: lexer ANTLR, caratteri estranei ignorati o rifiutati (-strict)
 * 3. PARSING: discesa ricorsiva con precedenze fisse
 * 4. NORMALIZZAZIONE: appiattimento delle catene di OR e AND
 * 5. TABELLA: una colonna per variabile e per sottoformula distinta, una riga per assegnamento
 * 6. OUTPUT: tabella LaTeX (booktabs) o testo semplice, su standard output o su file (-o)
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - Standard input (nessun -f/-d)
 * - File (-f, ripetibile): elaborati nell'ordine indicato
 * - Directory (-d): tutti i file .txt della directory in ordine di nome
 *
 * CODICI DI USCITA: 0 successo, 1 errore di formula o di I/O, 2 parametri non validi.
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String OUTPUT_PARAM = "-o";
    private static final String FORMAT_PARAM = "-fmt=";
    private static final String STRICT_PARAM = "-strict";
    private static final String KEEP_GOING_PARAM = "-k";
    private static final String THREADS_PARAM = "-j";
    private static final String VERBOSE_PARAM = "-v";

    private static final OutputFormat DEFAULT_FORMAT = OutputFormat.LATEX;

    /**
     * Limiti per il numero di thread di elaborazione
     * */
    private static final int MIN_THREADS = 1;
    private static final int MAX_THREADS = 64;

    static final int EXIT_INVALID_ARGUMENTS = 2;

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.in, System.out, System.err);
        if (exitCode != TruthTableRunner.EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione con flussi espliciti.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Configurazione del logging
     * 3. Costruzione della sorgente delle righe
     * 4. Elaborazione e restituzione del codice di uscita
     *
     * @return codice di uscita del processo
     */
    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        RunConfiguration config;
        try {
            config = new ArgumentParser(out).parse(args);
        } catch (IllegalArgumentException e) {
            err.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            err.println("Usa -h per visualizzare l'help completo.");
            return EXIT_INVALID_ARGUMENTS;
        }
        if (config == null) {
            return TruthTableRunner.EXIT_SUCCESS; // Help mostrato
        }

        configureLogging(config.isVerbose());

        LineSource source = LineSource.of(config.getInputFiles(), in);
        return new TruthTableRunner(config, out, err).run(source);
    }

    //endregion

    //region CONFIGURAZIONE LOGGING

    /**
     * Carica logging.properties dal classpath; con -v abbassa il livello a FINE.
     */
    private static void configureLogging(boolean verbose) {
        try (InputStream configuration = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (configuration != null) {
                LogManager.getLogManager().readConfiguration(configuration);
            }
        } catch (IOException e) {
            Logger.getLogger(Main.class.getName()).log(Level.WARNING,
                    "Configurazione logging non leggibile, uso i valori di default", e);
        }

        if (verbose) {
            Logger root = Logger.getLogger("");
            root.setLevel(Level.FINE);
            for (Handler handler : root.getHandlers()) {
                handler.setLevel(Level.FINE);
            }
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    /**
     * Visualizza l'help completo dell'applicazione.
     */
    private static void printApplicationHelp(PrintStream out) {
        out.println("\n::>> GENERATORE DI TABELLE DI VERITÀ <<::");
        out.println("Una tabella per ogni formula: una colonna per variabile e per sottoformula\n");

        out.println("UTILIZZO:");
        out.println("  java -jar tabelle_verita.jar [opzioni] < formule.txt");
        out.println("  java -jar tabelle_verita.jar [opzioni] -f <file> [-f <file> ...]\n");

        out.println("OPZIONI:");
        out.println("  -f <file>       Elabora un file di formule, una per riga (ripetibile)");
        out.println("  -d <directory>  Elabora tutti i file .txt della directory");
        out.println("  -o <directory>  Scrive un file per sorgente invece dello standard output");
        out.println("  -fmt=<formato>  Formato di output: latex (default), text");
        out.println("  -strict         Rifiuta i caratteri non riconosciuti invece di ignorarli");
        out.println("  -k              Prosegue dopo una formula errata invece di interrompere");
        out.println("  -j <thread>     Elabora le formule in parallelo (" + MIN_THREADS + "-" + MAX_THREADS + ")");
        out.println("  -v              Log dettagliato su standard error");
        out.println("  -h              Mostra questa guida\n");

        out.println("SINTASSI DELLE FORMULE:");
        out.println("  NOT: ! ~    OR: v |    AND: ^ &    IMPLIES: ->    IFF: <->");
        out.println("  Variabili: sequenze di lettere, esclusa la 'v' minuscola (riservata a OR)");
        out.println("  Precedenza crescente: ->, <->, OR, AND, NOT\n");

        out.println("ESEMPI DI UTILIZZO:");
        out.println("  echo 'p -> q' | java -jar tabelle_verita.jar");
        out.println("  java -jar tabelle_verita.jar -d ./formule/ -o ./tabelle/ -k");
        out.println("  java -jar tabelle_verita.jar -f esercizi.txt -fmt=text\n");

        out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Parser dei parametri linea di comando.
     *
     * Gestisce la validazione completa di tutti i parametri con
     * messaggi di errore informativi per l'utente.
     */
    static final class ArgumentParser {

        private final PrintStream out;

        ArgumentParser(PrintStream out) {
            this.out = out;
        }

        /**
         * Processa sequenzialmente tutti i parametri e costruisce la configurazione.
         *
         * @param args parametri da linea comando forniti dall'utente
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        RunConfiguration parse(String[] args) {
            List<Path> inputFiles = new ArrayList<>();
            String directory = null;
            Path outputDirectory = null;
            OutputFormat format = DEFAULT_FORMAT;
            boolean strictLexing = false;
            boolean keepGoing = false;
            boolean verbose = false;
            int threads = MIN_THREADS;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp(out);
                        return null;
                    }

                    // Input da file (ripetibile, esclusivo con directory)
                    case FILE_PARAM -> {
                        validateExclusiveMode(directory != null, "file");
                        String file = getNextArgument(args, ++i, "file");
                        validateFileExists(file);
                        inputFiles.add(Paths.get(file));
                    }

                    case DIR_PARAM -> {
                        validateExclusiveMode(!inputFiles.isEmpty() || directory != null, "directory");
                        directory = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(directory);
                    }

                    case OUTPUT_PARAM -> {
                        String output = getNextArgument(args, ++i, "directory output");
                        validateOutputDirectory(output);
                        outputDirectory = Paths.get(output);
                    }

                    case THREADS_PARAM -> threads = parseAndValidateThreads(args, ++i);

                    case STRICT_PARAM -> strictLexing = true;

                    case KEEP_GOING_PARAM -> keepGoing = true;

                    case VERBOSE_PARAM -> verbose = true;

                    default -> {
                        if (args[i].startsWith(FORMAT_PARAM)) {
                            format = OutputFormat.fromFlag(args[i].substring(FORMAT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (directory != null) {
                inputFiles.addAll(listDirectory(directory));
            }
            if (outputDirectory != null) {
                validateDistinctOutputNames(inputFiles, format);
            }

            return new RunConfiguration(inputFiles, outputDirectory, format, strictLexing, keepGoing, threads, verbose);
        }

        private void validateExclusiveMode(boolean conflicting, String currentMode) {
            if (conflicting) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre sorgenti (-f e -d sono mutualmente esclusivi, -d ammesso una volta)");
            }
        }

        /**
         * Verifica che esista effettivamente un argomento successivo nell'array prima
         * di restituirlo, prevenendo IndexOutOfBoundsException durante il parsing.
         */
        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        /**
         * Con -o ogni sorgente scrive {@code <nome base><estensione>}: due sorgenti con lo
         * stesso nome base, anche solo per maiuscole e minuscole, scriverebbero lo stesso file.
         */
        private void validateDistinctOutputNames(List<Path> inputFiles, OutputFormat format) {
            Map<String, Path> sourcesByOutput = new HashMap<>();
            for (Path file : inputFiles) {
                String outputName = LineSource.baseName(file) + format.getExtension();
                Path previous = sourcesByOutput.putIfAbsent(outputName.toLowerCase(Locale.ROOT), file);
                if (previous != null) {
                    throw new IllegalArgumentException("I file " + previous + " e " + file
                            + " producono lo stesso file di output " + outputName);
                }
            }
        }

        private int parseAndValidateThreads(String[] args, int currentIndex) {
            String threadsStr = getNextArgument(args, currentIndex, "numero di thread");

            int threads;
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Numero di thread non valido: " + threadsStr);
            }
            if (threads < MIN_THREADS || threads > MAX_THREADS) {
                throw new IllegalArgumentException("Numero di thread deve essere tra " + MIN_THREADS
                        + " e " + MAX_THREADS + ", ricevuto: " + threads);
            }
            return threads;
        }

        private List<Path> listDirectory(String directory) {
            try {
                List<Path> files = LineSource.listFormulaFiles(Paths.get(directory));
                if (files.isEmpty()) {
                    throw new IllegalArgumentException("Nessun file .txt trovato nella directory: " + directory);
                }
                return files;
            } catch (IOException e) {
                throw new IllegalArgumentException("Directory non leggibile: " + directory + " (" + e.getMessage() + ")");
            }
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
            if (!dir.canRead()) {
                throw new IllegalArgumentException("Directory non leggibile: " + dirPath);
            }
        }

        /**
         * La directory di output può non esistere ancora: viene creata alla prima scrittura.
         */
        private void validateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (dir.exists() && !dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
            if (dir.exists() && !dir.canWrite()) {
                throw new IllegalArgumentException("Directory non scrivibile: " + dirPath);
            }
        }
    }

    //endregion
}
