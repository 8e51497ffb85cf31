package org.formalities;

import org.formalities.error.ErrorReport;
import org.formalities.fall.interpreter.FallRuntime;
import org.formalities.fall.interpreter.InterpreterOptions;
import org.formalities.fall.interpreter.ProofState;
import org.formalities.fall.interpreter.RunReport;
import org.formalities.fall.interpreter.StatementResult;
import org.formalities.framework.StandardFrameworks;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * INTERPRETE FALL (Formal Assertion and Logic Language)
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: programma FALL da file .fall
 * 2. LESSICO E PARSING: token e AST tramite grammatica ANTLR
 * 3. ESECUZIONE: definizioni, asserzioni, blocchi di prova verificati passo per passo
 * 4. OUTPUT: esito per istruzione, catene di derivazione, statistiche
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f): esecuzione di un programma .fall
 * - Directory batch (-d): esecuzione di tutti i file .fall di una cartella
 * - Timeout dei collaboratori esterni (-t secondi)
 * - Framework iniziale (-fw id) ed equivalenza semantica (-eq on|off)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String FRAMEWORK_PARAM = "-fw";
    private static final String EQUIVALENCE_PARAM = "-eq";

    private static final String FALL_EXTENSION = ".fall";

    private static final int DEFAULT_TIMEOUT_SECONDS = 10;
    private static final int MIN_TIMEOUT_SECONDS = 1;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * FLUSSO ESECUZIONE:
     * 1. parsing e validazione dei parametri
     * 2. costruzione delle opzioni dell'interprete
     * 3. esecuzione su file singolo o directory
     */
    public static void main(String[] args) {
        configureLogging();
        System.out.println("---> AVVIO INTERPRETE FALL <---");

        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            RunnerConfiguration config = parseAndValidateArguments(args);
            if (config == null) return;

            displayConfigurationSummary(config);
            executeMainPipeline(config);

        } catch (Exception e) {
            handleGlobalError(e);
        } finally {
            System.out.println("---> FINE ESECUZIONE INTERPRETE FALL <---");
        }
    }

    private static void executeMainPipeline(RunnerConfiguration config) {
        FallRuntime runtime = new FallRuntime(buildOptions(config));
        if (config.isFileMode) {
            System.out.println("[I] Modalità: Esecuzione file singolo");
            processSingleFile(runtime, config.inputPath);
        } else {
            System.out.println("[I] Modalità: Esecuzione della directory");
            processDirectoryBatch(runtime, config.inputPath);
        }
    }

    private static InterpreterOptions buildOptions(RunnerConfiguration config) {
        return InterpreterOptions.builder()
                .collaboratorTimeout(Duration.ofSeconds(config.timeoutSeconds))
                .initialFrameworks(config.frameworkId)
                .equivalenceMatching(config.equivalenceMatching)
                .build();
    }

    private static void handleGlobalError(Exception e) {
        LOGGER.log(Level.SEVERE, "Errore critico", e);
        System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
        System.out.println("Controllare i log per dettagli completi.");
        System.exit(1);
    }

    /**
     * Carica logging.properties dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream("/logging.properties")) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static RunnerConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    private static void displayConfigurationSummary(RunnerConfiguration config) {
        System.out.println("\n-->> CONFIGURAZIONE INTERPRETE FALL <<--");
        System.out.println("Input:        " + config.inputPath);
        System.out.println("Timeout:      " + config.timeoutSeconds + "s");
        System.out.println("Framework:    " + config.frameworkId);
        System.out.println("Equivalenza:  " + (config.equivalenceMatching ? "attiva" : "disattiva"));
        System.out.println("=======================================\n");
    }

    //endregion

    //region ELABORAZIONE DEL SINGOLO FILE

    /**
     * @return true se il programma è stato eseguito senza errori
     */
    private static boolean processSingleFile(FallRuntime runtime, String filePath) {
        System.out.println("-->> ESECUZIONE FILE <<--");
        System.out.println("File: " + Paths.get(filePath).getFileName());
        System.out.println("=========================\n");

        String source;
        try {
            source = Files.readString(Paths.get(filePath), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.out.println("[E] Impossibile leggere " + filePath + ": " + e.getMessage());
            return false;
        }

        RunReport report = runtime.execute(source);
        displayReport(report);
        return report.isSuccessful();
    }

    private static void displayReport(RunReport report) {
        if (report.isHalted()) {
            ErrorReport halt = report.haltReport();
            System.out.println("[E] Programma interrotto: " + halt.describe());
            System.out.print(report.statistics());
            return;
        }

        for (StatementResult result : report.results()) {
            String prefix = !result.isSuccess() ? "[E] " : result.isFlagged() ? "[W] " : "[I] ";
            System.out.println(prefix + result.describe());
            if (result.proof() != null) {
                ProofState state = result.proof().state();
                for (String line : state.derivation()) {
                    System.out.println("      " + line);
                }
            }
        }
        System.out.println();
        System.out.print(report.statistics());
    }

    //endregion

    //region ELABORAZIONE DELLA DIRECTORY

    private static void processDirectoryBatch(FallRuntime runtime, String dirPath) {
        System.out.println("[I] Inizio elaborazione directory: " + dirPath);

        try {
            List<File> programs = findAllFallFiles(dirPath);
            if (programs.isEmpty()) {
                System.out.println("[W] Nessun file " + FALL_EXTENSION + " trovato nella directory specificata.");
                return;
            }

            BatchResult result = new BatchResult(programs.size());
            for (File program : programs) {
                System.out.println("Elaborazione: " + program.getName());
                if (processSingleFile(runtime, program.getPath())) {
                    result.incrementSuccess();
                } else {
                    result.incrementError();
                }
                System.out.println();
            }
            displayBatchSummary(result);

        } catch (IOException e) {
            System.out.println("[E] Errore durante l'accesso alla directory: " + e.getMessage());
        }
    }

    private static List<File> findAllFallFiles(String dirPath) throws IOException {
        try (Stream<Path> paths = Files.list(Paths.get(dirPath))) {
            List<File> programs = paths
                    .filter(path -> path.toString().toLowerCase(Locale.ROOT).endsWith(FALL_EXTENSION))
                    .map(Path::toFile)
                    .sorted(Comparator.comparing(File::getName))
                    .toList();
            System.out.println("Trovati " + programs.size() + " programmi da eseguire.");
            return programs;
        }
    }

    private static void displayBatchSummary(BatchResult result) {
        System.out.println("\n-->> RIEPILOGO ELABORAZIONE DIRECTORY <<--");
        System.out.println("Programmi trovati: " + result.totalFiles);
        System.out.println("Programmi senza errori: " + result.successCount);
        System.out.println("Programmi con errori: " + result.errorCount);

        if (result.totalFiles > 0) {
            double successRate = (double) result.successCount / result.totalFiles * 100;
            System.out.printf("Tasso di successo: %.1f%%\n", successRate);
        }
        System.out.println("=========================================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> INTERPRETE FALL <<::");
        System.out.println("Verifica meccanica di prove passo per passo sotto framework logici selezionabili\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar formalities-fall.jar [opzioni]\n");

        System.out.println("OPZIONI:");
        System.out.println("  -f <file.fall>    Esegue un singolo programma");
        System.out.println("  -d <directory>    Esegue tutti i file .fall di una directory");
        System.out.println("  -t <secondi>      Timeout dei collaboratori esterni (min: 1, default: 10)");
        System.out.println("  -fw <id>          Framework iniziale (default: classical)");
        System.out.println("  -eq on|off        Equivalenza semantica su goal e query (default: on)");
        System.out.println("  -h                Mostra questa guida\n");

        System.out.println("FRAMEWORK DISPONIBILI:");
        StandardFrameworks.registry().all().forEach(framework ->
                System.out.println("  " + framework.id() + " - " + framework.description()));
        System.out.println();

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar formalities-fall.jar -f socrate.fall");
        System.out.println("  java -jar formalities-fall.jar -d ./prove/ -fw paraconsistent -eq off\n");

        System.out.println("NOTE OPERATIVE:");
        System.out.println("  - Ogni istruzione termina con //, i commenti iniziano con !-");
        System.out.println("  - Errori lessicali e sintattici interrompono l'intero programma");
        System.out.println("  - Gli altri errori interessano solo l'istruzione che li produce\n");

        System.out.println("===============================================\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'esecuzione, in forma immutabile.
     */
    private static class RunnerConfiguration {
        final String inputPath;
        final boolean isFileMode;
        final int timeoutSeconds;
        final String frameworkId;
        final boolean equivalenceMatching;

        RunnerConfiguration(String inputPath, boolean isFileMode, int timeoutSeconds, String frameworkId,
                            boolean equivalenceMatching) {
            this.inputPath = inputPath;
            this.isFileMode = isFileMode;
            this.timeoutSeconds = timeoutSeconds;
            this.frameworkId = frameworkId;
            this.equivalenceMatching = equivalenceMatching;
        }
    }

    private static class ArgumentParser {

        /**
         * PARAMETRI SUPPORTATI:
         * -h: mostra help e termina
         * -f <file>: programma singolo (esclusivo con -d)
         * -d <dir>: directory di programmi (esclusivo con -f)
         * -t <sec>: timeout collaboratori
         * -fw <id>: framework iniziale
         * -eq on|off: equivalenza semantica
         *
         * @return configurazione validata, null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        public RunnerConfiguration parse(String[] args) {
            String inputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            String frameworkId = StandardFrameworks.CLASSICAL;
            boolean equivalenceMatching = true;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parseAndValidateTimeout(args, ++i);
                    case FRAMEWORK_PARAM -> frameworkId = parseFramework(args, ++i);
                    case EQUIVALENCE_PARAM -> equivalenceMatching = parseToggle(args, ++i);
                    default -> throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare input con -f (file) o -d (directory)");
            }
            return new RunnerConfiguration(inputPath, isFileMode, timeoutSeconds, frameworkId, equivalenceMatching);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parseAndValidateTimeout(String[] args, int currentIndex) {
            String timeoutStr = getNextArgument(args, currentIndex, "numero secondi");
            try {
                int timeout = Integer.parseInt(timeoutStr);
                if (timeout < MIN_TIMEOUT_SECONDS) {
                    throw new IllegalArgumentException("Timeout minimo: " + MIN_TIMEOUT_SECONDS + " secondi");
                }
                return timeout;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore timeout non valido: " + timeoutStr);
            }
        }

        private String parseFramework(String[] args, int currentIndex) {
            String id = getNextArgument(args, currentIndex, "identificatore framework");
            if (StandardFrameworks.registry().find(id).isEmpty()) {
                throw new IllegalArgumentException("Framework sconosciuto: " + id);
            }
            return id;
        }

        private boolean parseToggle(String[] args, int currentIndex) {
            String value = getNextArgument(args, currentIndex, "on|off");
            return switch (value.toLowerCase(Locale.ROOT)) {
                case "on" -> true;
                case "off" -> false;
                default -> throw new IllegalArgumentException("Valore -eq non valido: " + value + " (atteso on|off)");
            };
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
    }

    /**
     * Risultato elaborazione batch.
     */
    private static class BatchResult {
        final int totalFiles;
        int successCount = 0;
        int errorCount = 0;

        BatchResult(int totalFiles) {
            this.totalFiles = totalFiles;
        }

        void incrementSuccess() { successCount++; }
        void incrementError() { errorCount++; }
    }

    //endregion
}
