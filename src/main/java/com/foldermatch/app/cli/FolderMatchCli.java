package com.foldermatch.app.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

import com.foldermatch.app.cache.PathKeys;
import com.foldermatch.app.model.AnalysisPhase;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.ErrorSummary;
import com.foldermatch.app.model.FileDetail;
import com.foldermatch.app.model.FileSide;
import com.foldermatch.app.model.FilterCriteria;
import com.foldermatch.app.model.FolderMatch;
import com.foldermatch.app.session.AnalysisSession;
import com.foldermatch.app.session.Outcome;

public final class FolderMatchCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_CANCELLED = 130;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final PrintStream out;
    private final PrintStream err;
    private final Supplier<AnalysisSession> sessions;

    FolderMatchCli(PrintStream out, PrintStream err, Supplier<AnalysisSession> sessions) {
        this.out = out;
        this.err = err;
        this.sessions = sessions;
    }

    public static void main(String[] args) {
        int exitCode = new FolderMatchCli(System.out, System.err, AnalysisSession::create).execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return EXIT_OK;
        }

        String cmd = args[0].toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "analyze" -> runAnalyze(rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield EXIT_OK;
                }
                default -> {
                    err.println("Comando invalido: " + args[0]);
                    printUsage();
                    yield EXIT_USAGE;
                }
            };
        } catch (RuntimeException e) {
            err.println("Erro fatal: " + safeMsg(e));
            return EXIT_FAILURE;
        }
    }

    // ----------------- analyze -----------------

    private int runAnalyze(String[] args) {
        ParseResult<AnalyzeArgs> parsed = AnalyzeArgs.parse(args);
        if (parsed.help()) {
            printUsage();
            return EXIT_OK;
        }
        if (parsed.error() != null) {
            err.println(parsed.error());
            printUsage();
            return EXIT_USAGE;
        }
        AnalyzeArgs a = parsed.value();
        AnalysisSession session = sessions.get();

        // Ctrl+C / kill cancela a operacao em andamento
        Thread cancelHook = new Thread(() -> {
            session.cancel();
            err.println("Cancelamento solicitado (shutdown hook) em " + Instant.now());
        }, "foldermatch-cli-cancel");
        boolean hooked = addHook(cancelHook);

        try {
            if (a.project() != null) {
                List<String> dropped = session.loadProject(a.project());
                for (String d : dropped) err.println("Aviso: pasta nao existe mais: " + d);
            }

            Consumer<AnalysisProgress> progress = new ProgressPrinter(err);
            for (String root : a.roots()) {
                if (session.roots().stream().anyMatch(r -> PathKeys.normalize(r).equals(PathKeys.normalize(root)))) continue;
                Outcome<Integer> added = session.addFolder(root, progress);
                if (isInterrupted(added)) {
                    err.println(added.message());
                    return EXIT_CANCELLED;
                }
                if (!added.isCompleted()) {
                    err.println(added.message());
                    return EXIT_FAILURE;
                }
                err.println(root + ": " + added.message());
            }

            session.applyFilters(a.criteria(session.criteria()));
            Outcome<List<FolderMatch>> compared = session.runComparison(progress);
            if (isInterrupted(compared)) {
                err.println(compared.message());
                return EXIT_CANCELLED;
            }
            if (!compared.isCompleted()) {
                err.println(compared.message());
                return EXIT_FAILURE;
            }

            List<FolderMatch> matches = compared.result().orElse(List.of());
            printMatches(matches, session.allMatches().size());
            if (a.details()) {
                for (FolderMatch m : matches) printDetails(m, session.fileDetails(m, true));
            }

            if (a.save() != null) {
                session.saveProject(a.save());
                err.println("Projeto salvo: " + a.save());
            }
            printErrorSummary(session.errorSummary());
            return EXIT_OK;
        } catch (IOException e) {
            err.println("Falha: " + safeMsg(e));
            return EXIT_FAILURE;
        } finally {
            if (hooked) removeHook(cancelHook);
        }
    }

    private static boolean isInterrupted(Outcome<?> outcome) {
        return outcome.status() == Outcome.Status.CANCELLED || outcome.status() == Outcome.Status.TIMED_OUT;
    }

    // ----------------- saida -----------------

    private void printMatches(List<FolderMatch> matches, int total) {
        if (matches.isEmpty()) {
            out.println("Nenhuma pasta correspondente (" + total + " antes do filtro).");
            return;
        }
        out.println("similaridade | duplicados | tamanho | modificado | esquerda | direita");
        for (FolderMatch m : matches) {
            out.printf(Locale.ROOT, "%6.2f%% | %d | %s | %s | %s | %s%n",
                    m.similarityPercentage(),
                    m.duplicateFiles().size(),
                    formatSize(m.folderSizeBytes()),
                    m.latestModificationDate().map(FolderMatchCli::formatDate).orElse("-"),
                    m.leftFolder(),
                    m.rightFolder());
        }
        out.println(matches.size() + " de " + total + " pastas correspondentes exibidas.");
    }

    private void printDetails(FolderMatch match, List<FileDetail> details) {
        out.println();
        out.println(match.leftFolder() + " <-> " + match.rightFolder());
        for (FileDetail d : details) {
            out.printf("  %s %s | %s | %s%n",
                    d.duplicate() ? "=" : " ",
                    d.fileName(),
                    describe(d.left()),
                    describe(d.right()));
        }
    }

    private void printErrorSummary(ErrorSummary summary) {
        if (!summary.hasErrors()) return;
        err.printf("Ignorados: %d, erros de permissao: %d, erros de rede: %d, erros de recurso: %d%n",
                summary.skippedFiles(), summary.permissionErrors(), summary.networkErrors(), summary.resourceErrors());
    }

    private static String describe(FileSide side) {
        if (side == null) return "-";
        if (!side.available()) return "N/D";
        return formatSize(side.sizeBytes()) + " " + side.lastWrite().map(FolderMatchCli::formatDate).orElse("");
    }

    static String formatSize(long bytes) {
        if (bytes >= 1L << 30) return String.format(Locale.ROOT, "%.1f GB", bytes / (double) (1L << 30));
        if (bytes >= 1L << 20) return String.format(Locale.ROOT, "%.1f MB", bytes / (double) (1L << 20));
        if (bytes >= 1L << 10) return String.format(Locale.ROOT, "%.1f KB", bytes / (double) (1L << 10));
        return bytes + " B";
    }

    static String formatDate(Instant instant) {
        return DATE_FORMAT.format(instant.atZone(ZoneId.systemDefault()));
    }

    private void printUsage() {
        out.println("""
                FolderMatch CLI
                Comandos:
                  analyze <raiz>... [--min-similarity <percentual>] [--min-size-mb <mb>]
                          [--since aaaa-MM-dd] [--until aaaa-MM-dd]
                          [--project <arquivo.fmp|arquivo.fmpz>] [--save <arquivo.fmp|arquivo.fmpz>] [--details]
                  help

                Exemplos:
                  analyze /mnt/backup-2019 /mnt/backup-2021 --min-similarity 80
                  analyze --project old.fmp D:\\Photos --save new.fmpz
                """);
    }

    private static final class ProgressPrinter implements Consumer<AnalysisProgress> {
        private final PrintStream err;
        private AnalysisPhase lastPhase;

        ProgressPrinter(PrintStream err) {
            this.err = err;
        }

        @Override
        public synchronized void accept(AnalysisProgress p) {
            if (p.phase() != lastPhase || p.isComplete()) {
                err.println("[" + p.phase() + "] " + p.message());
                lastPhase = p.phase();
            }
        }
    }

    private static boolean addHook(Thread hook) {
        try {
            Runtime.getRuntime().addShutdownHook(hook);
            return true;
        } catch (IllegalStateException | SecurityException e) {
            // JVM ja encerrando ou hooks nao permitidos
            return false;
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException | SecurityException e) {
            // JVM ja encerrando: o hook roda de qualquer forma
        }
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    record AnalyzeArgs(List<String> roots,
                       Double minSimilarity,
                       Long minSizeMb,
                       LocalDate since,
                       LocalDate until,
                       Path project,
                       Path save,
                       boolean details) {

        /**
         * Sobrescreve {@code base} com o que veio na linha de comando. Datas cobrem dias inteiros
         * no fuso local.
         */
        FilterCriteria criteria(FilterCriteria base) {
            ZoneId zone = ZoneId.systemDefault();
            return new FilterCriteria(
                    minSimilarity == null ? base.minimumSimilarityPercent() : minSimilarity,
                    minSizeMb == null ? base.minimumSizeBytes() : minSizeMb * 1024L * 1024L,
                    since == null ? base.minimumDate() : since.atStartOfDay(zone).toInstant(),
                    until == null ? base.maximumDate() : until.plusDays(1).atStartOfDay(zone).toInstant().minusNanos(1)
            );
        }

        static ParseResult<AnalyzeArgs> parse(String[] args) {
            List<String> roots = new ArrayList<>();
            Double minSimilarity = null;
            Long minSizeMb = null;
            LocalDate since = null;
            LocalDate until = null;
            Path project = null;
            Path save = null;
            boolean details = false;

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--min-similarity" -> {
                            String v = c.requireNext(t);
                            double d = NumberUtils.toDouble(v, Double.NaN);
                            if (Double.isNaN(d) || d < 0 || d > 100) {
                                return ParseResult.errorResult("--min-similarity deve estar entre 0 e 100: " + v);
                            }
                            minSimilarity = d;
                        }
                        case "--min-size-mb" -> {
                            String v = c.requireNext(t);
                            long mb = NumberUtils.toLong(v, -1);
                            if (mb < 0) return ParseResult.errorResult("--min-size-mb deve ser >= 0: " + v);
                            minSizeMb = mb;
                        }
                        case "--since" -> since = LocalDate.parse(c.requireNext(t));
                        case "--until" -> until = LocalDate.parse(c.requireNext(t));
                        case "--project" -> project = Path.of(c.requireNext(t));
                        case "--save" -> save = Path.of(c.requireNext(t));
                        case "--details" -> details = true;
                        default -> {
                            if (t.startsWith("--")) return ParseResult.errorResult("Opcao invalida: " + t);
                            roots.add(t);
                        }
                    }
                }
            } catch (IllegalArgumentException | DateTimeParseException e) {
                // InvalidPathException e uma IllegalArgumentException
                return ParseResult.errorResult(safeMsg(e));
            }

            if (roots.isEmpty() && project == null) {
                return ParseResult.errorResult("Informe ao menos uma pasta raiz ou --project");
            }
            if (since != null && until != null && since.isAfter(until)) {
                return ParseResult.errorResult("--since e posterior a --until");
            }
            return ParseResult.okResult(new AnalyzeArgs(List.copyOf(roots), minSimilarity, minSizeMb, since, until,
                    project, save, details));
        }
    }

    private static String safeMsg(Throwable e) {
        String msg = e.getMessage();
        return StringUtils.isBlank(msg) ? e.getClass().getSimpleName() : msg;
    }
}
