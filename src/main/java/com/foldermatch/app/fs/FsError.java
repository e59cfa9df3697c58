package com.foldermatch.app.fs;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;

import com.foldermatch.app.model.ResourceConstraintType;

/**
 * Falha de sistema de arquivos ja classificada: caminho, tipo de falha e causa original.
 *
 * A classificacao acontece uma vez, aqui, para que a politica de recuperacao trabalhe com valores
 * simples e sem tocar num sistema de arquivos real.
 */
public record FsError(String path, ErrorKind kind, ResourceConstraintType constraint, Throwable cause) {

    public FsError {
        Objects.requireNonNull(kind, "kind");
        path = path == null ? "" : path;
    }

    public static FsError of(String path, ErrorKind kind, Throwable cause) {
        return new FsError(path, kind, null, cause);
    }

    public static FsError resource(String path, ResourceConstraintType type, Throwable cause) {
        return new FsError(path, ErrorKind.RESOURCE_CONSTRAINED, Objects.requireNonNull(type, "type"), cause);
    }

    public static FsError classify(String path, Throwable error) {
        if (error == null) return of(path, ErrorKind.UNKNOWN, null);

        if (error instanceof CancellationException
                || error instanceof InterruptedException
                || error instanceof ClosedByInterruptException
                || (error instanceof InterruptedIOException && !(error instanceof SocketTimeoutException))) {
            return of(path, ErrorKind.CANCELLED, error);
        }
        if (error instanceof OutOfMemoryError) {
            return resource(path, ResourceConstraintType.MEMORY, error);
        }
        if (error instanceof AccessDeniedException || error instanceof SecurityException) {
            return of(path, ErrorKind.ACCESS_DENIED, error);
        }
        if (error instanceof NoSuchFileException || error instanceof NotDirectoryException) {
            return of(path, ErrorKind.NOT_FOUND, error);
        }
        if (error instanceof InvalidPathException) {
            return of(path, ErrorKind.PATH_TOO_LONG, error);
        }
        if (error instanceof UnknownHostException
                || error instanceof NoRouteToHostException
                || error instanceof ConnectException
                || error instanceof SocketTimeoutException) {
            return of(path, ErrorKind.NETWORK_UNREACHABLE, error);
        }

        String reason = reasonOf(error);
        if (reason.contains("no space left") || reason.contains("not enough space") || reason.contains("disk quota")) {
            return resource(path, ResourceConstraintType.DISK_SPACE, error);
        }
        if (reason.contains("too many open files")) {
            return resource(path, ResourceConstraintType.FILE_HANDLES, error);
        }
        if (reason.contains("file name too long") || reason.contains("path too long")
                || reason.contains("filename or extension is too long")) {
            return of(path, ErrorKind.PATH_TOO_LONG, error);
        }
        if (reason.contains("being used by another process") || reason.contains("lock violation")
                || reason.contains("sharing violation") || reason.contains("locked")) {
            return of(path, ErrorKind.LOCKED, error);
        }
        if (error instanceof FileNotFoundException) {
            if (reason.contains("permission denied") || reason.contains("access is denied")) {
                return of(path, ErrorKind.ACCESS_DENIED, error);
            }
            return of(path, ErrorKind.NOT_FOUND, error);
        }
        if (reason.contains("permission denied") || reason.contains("access is denied")) {
            return of(path, ErrorKind.ACCESS_DENIED, error);
        }
        if (reason.contains("network path was not found") || reason.contains("network name is no longer available")
                || reason.contains("host is down")) {
            return of(path, ErrorKind.NETWORK_UNREACHABLE, error);
        }
        return of(path, ErrorKind.UNKNOWN, error);
    }

    /**
     * True para falhas de I/O (e nao erros de programacao que aparecem como runtime exceptions).
     */
    public boolean isIoError() {
        return cause instanceof IOException;
    }

    public String message() {
        if (cause == null) return kind.name();
        String msg = cause.getMessage();
        return msg == null || msg.isBlank() ? cause.getClass().getSimpleName() : msg;
    }

    private static String reasonOf(Throwable error) {
        // so a parte do motivo: o nome do arquivo nunca decide a classificacao
        String text;
        if (error instanceof FileSystemException fse) {
            text = fse.getReason() != null ? fse.getReason() : "";
        } else if (error instanceof FileNotFoundException) {
            String msg = String.valueOf(error.getMessage());
            int open = msg.lastIndexOf(" (");
            text = open >= 0 && msg.endsWith(")") ? msg.substring(open + 2, msg.length() - 1) : msg;
        } else {
            text = String.valueOf(error.getMessage());
        }
        return text.toLowerCase(Locale.ROOT);
    }
}
