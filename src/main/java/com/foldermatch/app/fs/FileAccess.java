package com.foldermatch.app.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;

import com.foldermatch.app.model.FileMetadata;

/**
 * Acesso cru ao sistema de arquivos usado pelo scanner, pelo buscador de duplicados e pelo cache.
 *
 * Os metodos podem falhar por permissao, arquivo inexistente, bloqueio, caminho longo ou I/O
 * generico. Quem chama converte em {@link FsError} e entrega para a politica de recuperacao.
 */
public interface FileAccess {

    boolean isDirectory(Path path);

    boolean exists(Path path);

    /**
     * Subdiretorios imediatos, sem links simbolicos.
     */
    List<Path> listDirectories(Path dir) throws IOException;

    /**
     * Arquivos regulares imediatos (sem recursao).
     */
    List<Path> listFiles(Path dir) throws IOException;

    FileMetadata stat(Path file) throws IOException;

    InputStream openRead(Path file) throws IOException;
}
