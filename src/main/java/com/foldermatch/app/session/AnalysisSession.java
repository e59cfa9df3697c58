package com.foldermatch.app.session;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.analysis.DuplicateFinder;
import com.foldermatch.app.analysis.FileHasher;
import com.foldermatch.app.analysis.FolderAggregator;
import com.foldermatch.app.cache.CacheStore;
import com.foldermatch.app.cache.PathKeys;
import com.foldermatch.app.concurrent.AnalysisAbortedException;
import com.foldermatch.app.concurrent.CancellationToken;
import com.foldermatch.app.config.AnalysisSettings;
import com.foldermatch.app.config.Config;
import com.foldermatch.app.detail.FileDetailBuilder;
import com.foldermatch.app.fs.FileAccess;
import com.foldermatch.app.fs.LocalFileAccess;
import com.foldermatch.app.model.AnalysisProgress;
import com.foldermatch.app.model.ErrorSummary;
import com.foldermatch.app.model.FileDetail;
import com.foldermatch.app.model.FileMatch;
import com.foldermatch.app.model.FilterCriteria;
import com.foldermatch.app.model.FolderMatch;
import com.foldermatch.app.model.ProjectData;
import com.foldermatch.app.project.ProjectStore;
import com.foldermatch.app.recovery.DefaultNetworkProbe;
import com.foldermatch.app.recovery.ErrorRecoveryService;
import com.foldermatch.app.recovery.NetworkProbe;
import com.foldermatch.app.scan.FolderScanner;

/**
 * Uma analise interativa: as pastas raiz, o cache delas, o ultimo resultado da comparacao e o
 * filtro ativo. Executa uma operacao longa por vez.
 */
public class AnalysisSession {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSession.class);

    private final AnalysisSettings settings;
    private final FileAccess fileAccess;
    private final CacheStore cache;
    private final ErrorRecoveryService recovery;
    private final FolderScanner scanner;
    private final DuplicateFinder finder;
    private final FolderAggregator aggregator;
    private final FileDetailBuilder detailBuilder;
    private final ProjectStore projectStore;

    private final Set<String> roots = new LinkedHashSet<>();
    private final AtomicBoolean busy = new AtomicBoolean(false);

    private volatile CancellationToken current = CancellationToken.none();
    private volatile List<FolderMatch> allMatches = List.of();
    private volatile FilterCriteria criteria;

    public AnalysisSession(AnalysisSettings settings, FileAccess fileAccess, NetworkProbe networkProbe,
                           ProjectStore projectStore) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.fileAccess = Objects.requireNonNull(fileAccess, "fileAccess");
        this.projectStore = Objects.requireNonNull(projectStore, "projectStore");
        this.cache = new CacheStore(fileAccess);
        this.recovery = new ErrorRecoveryService(networkProbe);
        this.scanner = new FolderScanner(cache, recovery, fileAccess, settings);
        this.finder = new DuplicateFinder(cache, recovery, new FileHasher(fileAccess), settings);
        this.aggregator = new FolderAggregator();
        this.detailBuilder = new FileDetailBuilder(fileAccess);
        this.criteria = settings.defaultCriteria();
    }

    /**
     * Sessao sobre o sistema de arquivos local, configurada pelo ambiente.
     */
    public static AnalysisSession create() {
        AnalysisSettings settings = Config.analysisSettings();
        return new AnalysisSession(settings, LocalFileAccess.instance(),
                new DefaultNetworkProbe(settings.networkProbeTimeout()), new ProjectStore());
    }

    // --- raizes --------------------------------------------------------------

    public Outcome<Integer> addFolder(String path, Consumer<AnalysisProgress> progress) {
        return addFolder(path, progress, CancellationToken.none());
    }

    /**
     * Varre {@code path} para o cache e o adiciona as raizes. A varredura para quando {@code cancel}
     * dispara, quando {@link #cancel()} e chamado ou quando o timeout de varredura expira.
     *
     * @throws IllegalStateException outra operacao em andamento
     */
    public Outcome<Integer> addFolder(String path, Consumer<AnalysisProgress> progress, CancellationToken cancel) {
        if (path == null || path.isBlank()) return Outcome.failed("Caminho da pasta vazio");
        String folder = PathKeys.stripTrailingSeparators(path.trim());
        if (containsRoot(folder)) return Outcome.failed("Pasta ja adicionada: " + folder);

        CancellationToken token = begin(cancel, settings.scanTimeout());
        try {
            List<String> folders = scanner.scanHierarchy(folder, progress, token);
            synchronized (roots) {
                roots.add(folder);
            }
            logger.info("Raiz adicionada {} ({} pastas)", folder, folders.size());
            return Outcome.completed("Pasta adicionada com " + folders.size() + " subpastas", folders.size());
        } catch (CancellationException e) {
            return interrupted(token, "Varredura de " + folder);
        } catch (NoSuchFileException | NotDirectoryException e) {
            return Outcome.failed("Pasta nao encontrada: " + folder);
        } catch (AnalysisAbortedException e) {
            logger.error("Varredura de {} abortada: {}", folder, e.getMessage());
            return Outcome.failed("Varredura abortada: " + e.getMessage());
        } catch (IOException | RuntimeException e) {
            logger.error("Falha na varredura de {}", folder, e);
            return Outcome.failed("Erro ao adicionar pasta: " + e.getMessage());
        } finally {
            end();
        }
    }

    /**
     * Esquece uma raiz e todas as entradas de cache abaixo dela.
     *
     * @return false quando a pasta nao era raiz
     */
    public boolean removeFolder(String path) {
        if (path == null) return false;
        requireIdle();
        String removed = null;
        synchronized (roots) {
            for (String r : roots) {
                if (PathKeys.normalize(r).equals(PathKeys.normalize(path))) {
                    removed = r;
                    break;
                }
            }
            if (removed == null) return false;
            roots.remove(removed);
        }
        int folders = cache.removeSubtree(removed);
        logger.info("Raiz removida {} ({} pastas descartadas do cache)", removed, folders);
        return true;
    }

    public List<String> roots() {
        synchronized (roots) {
            return List.copyOf(roots);
        }
    }

    // --- comparacao ----------------------------------------------------------

    public Outcome<List<FolderMatch>> runComparison(Consumer<AnalysisProgress> progress) {
        return runComparison(progress, CancellationToken.none());
    }

    /**
     * Compara todas as pastas em cache abaixo das raizes. Guarda o resultado completo e o devolve
     * filtrado pelos criterios atuais.
     *
     * @throws IllegalStateException outra operacao em andamento
     */
    public Outcome<List<FolderMatch>> runComparison(Consumer<AnalysisProgress> progress, CancellationToken cancel) {
        CancellationToken token = begin(cancel, null);
        try {
            token.throwIfCancellationRequested();
            List<String> rootList = roots();
            List<String> folders = new ArrayList<>();
            for (String f : cache.cachedFolders()) {
                for (String r : rootList) {
                    if (PathKeys.isSameOrDescendant(f, r)) {
                        folders.add(f);
                        break;
                    }
                }
            }
            if (folders.size() < 2) {
                return Outcome.failed("Sao necessarias ao menos 2 pastas para comparar");
            }

            List<FileMatch> fileMatches = finder.findDuplicates(folders, progress, token);
            List<FolderMatch> matches = aggregator.aggregate(fileMatches, cache, progress, token);
            allMatches = matches;

            List<FolderMatch> filtered = FolderAggregator.applyFilters(matches, criteria);
            return Outcome.completed("Analise concluida: " + matches.size() + " pastas correspondentes encontradas", filtered);
        } catch (CancellationException e) {
            return interrupted(token, "Comparacao");
        } catch (AnalysisAbortedException e) {
            logger.error("Comparacao abortada: {}", e.getMessage());
            return Outcome.failed("Comparacao abortada: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Falha na comparacao", e);
            return Outcome.failed("Erro durante a comparacao: " + e.getMessage());
        } finally {
            end();
        }
    }

    /**
     * Guarda {@code newCriteria} e devolve o ultimo resultado filtrado por ele.
     */
    public List<FolderMatch> applyFilters(FilterCriteria newCriteria) {
        this.criteria = Objects.requireNonNull(newCriteria, "criteria");
        return FolderAggregator.applyFilters(allMatches, newCriteria);
    }

    public FilterCriteria criteria() {
        return criteria;
    }

    /**
     * Todas as correspondencias da ultima comparacao, sem filtro.
     */
    public List<FolderMatch> allMatches() {
        return allMatches;
    }

    public List<FolderMatch> filteredMatches() {
        return FolderAggregator.applyFilters(allMatches, criteria);
    }

    public List<FileDetail> fileDetails(FolderMatch match, boolean includeUnique) {
        Objects.requireNonNull(match, "match");
        List<FileDetail> details = detailBuilder.build(match.leftFolder(), match.rightFolder(),
                match.duplicateFiles(), cache);
        return FileDetailBuilder.filter(details, includeUnique);
    }

    // --- ciclo de vida -----------------------------------------------------------

    /**
     * Cancela a operacao em andamento, se houver.
     */
    public void cancel() {
        current.cancel();
    }

    public boolean isBusy() {
        return busy.get();
    }

    public ErrorSummary errorSummary() {
        return recovery.getSummary();
    }

    public void clearErrorSummary() {
        recovery.clearSummary();
    }

    // --- arquivos de projeto -------------------------------------------------------

    public void saveProject(Path file) throws IOException {
        requireIdle();
        projectStore.save(file, cache.exportSnapshot(roots()));
    }

    /**
     * Substitui o cache e as raizes pelos do projeto. Raizes que nao existem mais sao descartadas.
     *
     * @return as raizes descartadas
     */
    public List<String> loadProject(Path file) throws IOException {
        requireIdle();
        ProjectData data = projectStore.load(file);
        cache.importSnapshot(data);
        allMatches = List.of();
        recovery.clearSummary();

        List<String> dropped = new ArrayList<>();
        synchronized (roots) {
            roots.clear();
            for (String folder : data.scanFolders()) {
                if (isExistingDirectory(folder)) {
                    roots.add(folder);
                } else {
                    logger.warn("Pasta nao existe mais: {}", folder);
                    dropped.add(folder);
                }
            }
        }
        logger.info("Projeto carregado: {} pastas disponiveis", roots().size());
        return dropped;
    }

    CacheStore cache() {
        return cache;
    }

    private boolean containsRoot(String folder) {
        synchronized (roots) {
            for (String r : roots) {
                if (PathKeys.normalize(r).equals(PathKeys.normalize(folder))) return true;
            }
            return false;
        }
    }

    private boolean isExistingDirectory(String folder) {
        try {
            return fileAccess.isDirectory(Path.of(folder));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private CancellationToken begin(CancellationToken caller, Duration timeout) {
        if (!busy.compareAndSet(false, true)) {
            throw new IllegalStateException("Outra operacao ja esta em andamento");
        }
        CancellationToken token = CancellationToken.linked(
                caller == null ? List.of() : List.of(caller), timeout);
        current = token;
        return token;
    }

    private void end() {
        current = CancellationToken.none();
        busy.set(false);
    }

    private void requireIdle() {
        if (busy.get()) throw new IllegalStateException("Outra operacao ja esta em andamento");
    }

    private static <T> Outcome<T> interrupted(CancellationToken token, String what) {
        if (token.isTimedOut()) {
            logger.warn("{}: tempo limite excedido", what);
            return Outcome.timedOut(what + ": tempo limite excedido");
        }
        logger.info("{}: cancelada", what);
        return Outcome.cancelled(what + ": cancelada");
    }
}
