package com.foldermatch.app.recovery;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.fs.ErrorKind;
import com.foldermatch.app.fs.FsError;
import com.foldermatch.app.model.ErrorSummary;
import com.foldermatch.app.model.RecoveryAction;
import com.foldermatch.app.model.RecoveryActionType;
import com.foldermatch.app.model.ResourceConstraintType;

/**
 * Transforma falhas do sistema de arquivos em orientacoes de recuperacao e mantem o resumo de erros da sessao.
 *
 * Compartilhado por todos os workers; os contadores ficam atras de um unico lock. Nenhum metodo lanca.
 */
public class ErrorRecoveryService {

    private static final Logger logger = LoggerFactory.getLogger(ErrorRecoveryService.class);

    private final NetworkProbe networkProbe;
    private final Duration memoryPause;

    private final Object lock = new Object();
    private int skippedFiles;
    private int permissionErrors;
    private int networkErrors;
    private int resourceErrors;
    private final List<String> skippedPaths = new ArrayList<>();
    private final List<String> errorMessages = new ArrayList<>();
    private Instant lastErrorTime;

    public ErrorRecoveryService(NetworkProbe networkProbe) {
        this(networkProbe, Duration.ofSeconds(1));
    }

    /**
     * @param memoryPause quanto esperar depois de um GC sob pressao de memoria
     */
    public ErrorRecoveryService(NetworkProbe networkProbe, Duration memoryPause) {
        this.networkProbe = Objects.requireNonNull(networkProbe, "networkProbe");
        this.memoryPause = memoryPause == null ? Duration.ZERO : memoryPause;
    }

    public RecoveryAction handleFileAccessError(String path, Throwable error) {
        return handleFileAccessError(FsError.classify(path, error));
    }

    public RecoveryAction handleFileAccessError(FsError error) {
        String path = error.path();
        record(error.kind() == ErrorKind.ACCESS_DENIED, "Erro de acesso a arquivo: " + path + " - " + error.message());

        RecoveryAction action = switch (error.kind()) {
            case ACCESS_DENIED -> new RecoveryAction(RecoveryActionType.RETRY_WITH_ELEVATION,
                    "Acesso negado a '" + path + "'",
                    "Execute com permissoes elevadas ou verifique as permissoes. O item foi ignorado por enquanto.",
                    false, Duration.ZERO);
            case NOT_FOUND -> RecoveryAction.skip("Nao encontrado: '" + path + "'",
                    "O item pode ter sido movido ou apagado durante a analise. Ignorando.");
            case LOCKED -> RecoveryAction.retry("Arquivo bloqueado ou em uso: '" + path + "'",
                    "Outro processo esta usando o arquivo. Tentando de novo apos uma pausa curta.", Duration.ofSeconds(2));
            case PATH_TOO_LONG -> RecoveryAction.skip("Caminho longo demais: '" + path + "'",
                    "O caminho excede o limite da plataforma. Considere mover os arquivos para caminhos mais curtos.");
            case NETWORK_UNREACHABLE -> handleNetworkError(path, error.cause());
            case RESOURCE_CONSTRAINED -> handleResourceConstraintError(error.constraint(), error.cause());
            case CANCELLED -> RecoveryAction.skip("Operacao cancelada acessando '" + path + "'", "");
            case UNKNOWN -> error.isIoError() && networkProbe.isNetworkPath(path)
                    ? handleNetworkError(path, error.cause())
                    : RecoveryAction.skip("Erro de arquivo: '" + path + "' - " + error.message(),
                            "Erro inesperado do sistema de arquivos. O item foi ignorado.");
        };
        logger.debug("{} -> {}", error, action.type());
        return action;
    }

    public RecoveryAction handleNetworkError(String path, Throwable error) {
        synchronized (lock) {
            networkErrors++;
            lastErrorTime = Instant.now();
            errorMessages.add("Erro de rede: " + path + " - " + messageOf(error));
        }

        boolean unreachable;
        try {
            unreachable = networkProbe.isNetworkPath(path) && !networkProbe.isReachable(path);
        } catch (RuntimeException e) {
            logger.debug("Sonda de rede falhou para {}: {}", path, e.toString());
            unreachable = true;
        }
        if (unreachable) {
            logger.warn("Caminho de rede inacessivel: {}", path);
            return new RecoveryAction(RecoveryActionType.PAUSE_AND_WAIT,
                    "Caminho de rede '" + path + "' inacessivel",
                    "Verifique a conexao de rede e o acesso ao compartilhamento. A operacao vai tentar de novo.",
                    true, Duration.ofSeconds(30));
        }
        return RecoveryAction.retry("Erro de rede acessando '" + path + "'",
                "A conexao de rede pode estar temporariamente indisponivel. Tentando de novo.", Duration.ofSeconds(5));
    }

    public RecoveryAction handleResourceConstraintError(ResourceConstraintType type, Throwable error) {
        ResourceConstraintType kind = type == null ? ResourceConstraintType.CPU_USAGE : type;
        synchronized (lock) {
            resourceErrors++;
            lastErrorTime = Instant.now();
            errorMessages.add("Restricao de recurso (" + kind + "): " + messageOf(error));
        }
        logger.warn("Restricao de recurso {}: {}", kind, messageOf(error));

        return switch (kind) {
            case MEMORY -> relieveMemory();
            case DISK_SPACE -> new RecoveryAction(RecoveryActionType.ABORT, "Espaco em disco insuficiente",
                    "Libere espaco em disco e reinicie a analise. A operacao nao pode continuar.", false, Duration.ZERO);
            case FILE_HANDLES -> new RecoveryAction(RecoveryActionType.REDUCE_PARALLELISM, "Arquivos abertos demais",
                    "Reduzindo o paralelismo para limitar operacoes simultaneas.", true, Duration.ofSeconds(1));
            case CPU_USAGE -> new RecoveryAction(RecoveryActionType.REDUCE_PARALLELISM, "Uso alto de CPU",
                    "Reduzindo o paralelismo para nao sobrecarregar o sistema.", true, Duration.ofSeconds(1));
            case NETWORK_BANDWIDTH -> new RecoveryAction(RecoveryActionType.PAUSE_AND_WAIT, "Banda de rede limitada",
                    "Pausando ate o congestionamento da rede passar.", true, Duration.ofSeconds(10));
        };
    }

    public void logSkippedItem(String path, String reason) {
        synchronized (lock) {
            skippedFiles++;
            skippedPaths.add(path);
            errorMessages.add("Ignorado: " + path + " - " + reason);
            lastErrorTime = Instant.now();
        }
        logger.debug("Ignorado {}: {}", path, reason);
    }

    public ErrorSummary getSummary() {
        synchronized (lock) {
            return new ErrorSummary(skippedFiles, permissionErrors, networkErrors, resourceErrors,
                    new ArrayList<>(skippedPaths), new ArrayList<>(errorMessages), lastErrorTime);
        }
    }

    public void clearSummary() {
        synchronized (lock) {
            skippedFiles = 0;
            permissionErrors = 0;
            networkErrors = 0;
            resourceErrors = 0;
            skippedPaths.clear();
            errorMessages.clear();
            lastErrorTime = null;
        }
    }

    private void record(boolean permission, String message) {
        synchronized (lock) {
            if (permission) permissionErrors++;
            lastErrorTime = Instant.now();
            errorMessages.add(message);
        }
    }

    private RecoveryAction relieveMemory() {
        System.gc();
        if (!memoryPause.isZero()) {
            try {
                Thread.sleep(memoryPause.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return new RecoveryAction(RecoveryActionType.REDUCE_PARALLELISM, "Uso de memoria alto",
                "Reduzindo o paralelismo para poupar memoria. Considere fechar outros aplicativos.",
                true, Duration.ofSeconds(2));
    }

    private static String messageOf(Throwable error) {
        if (error == null) return "erro desconhecido";
        String msg = error.getMessage();
        return msg == null || msg.isBlank() ? error.getClass().getSimpleName() : msg;
    }
}
