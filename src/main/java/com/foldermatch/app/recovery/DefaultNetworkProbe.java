package com.foldermatch.app.recovery;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.foldermatch.app.cache.PathKeys;

import oshi.SystemInfo;
import oshi.software.os.OSFileStore;

/**
 * Deteccao de rede via file stores do OSHI; alcance por echo ICMP/TCP para servidores UNC e
 * checagem de existencia para unidades de rede montadas.
 */
public final class DefaultNetworkProbe implements NetworkProbe {

    private static final Logger logger = LoggerFactory.getLogger(DefaultNetworkProbe.class);

    private static final Set<String> NETWORK_TYPES = Set.of(
            "cifs", "smbfs", "smb", "smb2", "smb3", "nfs", "nfs4", "afpfs", "webdav", "davfs", "fuse.sshfs", "9p"
    );

    private final Duration timeout;
    private volatile List<String> networkMounts;

    public DefaultNetworkProbe(Duration timeout) {
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
    }

    @Override
    public boolean isNetworkPath(String path) {
        if (path == null || path.isBlank()) return false;
        if (NetworkProbe.isUncPath(path)) return true;
        for (String mount : networkMounts()) {
            if (PathKeys.isSameOrDescendant(path, mount)) return true;
        }
        return false;
    }

    @Override
    public boolean isReachable(String path) {
        try {
            String server = NetworkProbe.uncServer(path);
            if (server != null) {
                return InetAddress.getByName(server).isReachable((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            }
            return Files.exists(Path.of(path));
        } catch (IOException | InvalidPathException | SecurityException e) {
            logger.debug("Checagem de alcance falhou para {}: {}", path, e.toString());
            return false;
        }
    }

    private List<String> networkMounts() {
        List<String> mounts = networkMounts;
        if (mounts != null) return mounts;
        synchronized (this) {
            if (networkMounts == null) networkMounts = loadNetworkMounts();
            return networkMounts;
        }
    }

    private static List<String> loadNetworkMounts() {
        try {
            List<OSFileStore> stores = new SystemInfo().getOperatingSystem().getFileSystem().getFileStores(false);
            List<String> out = stores.stream()
                    .filter(DefaultNetworkProbe::isNetworkStore)
                    .map(OSFileStore::getMount)
                    .filter(m -> m != null && !m.isBlank())
                    .toList();
            logger.debug("Montagens de rede: {}", out);
            return out;
        } catch (RuntimeException | LinkageError e) {
            // OSHI sem suporte nesta plataforma: so caminhos UNC contam como rede
            logger.warn("Nao foi possivel listar file stores: {}", e.toString());
            return List.of();
        }
    }

    static boolean isNetworkStore(OSFileStore store) {
        String type = store.getType() == null ? "" : store.getType().toLowerCase(Locale.ROOT);
        String description = store.getDescription() == null ? "" : store.getDescription().toLowerCase(Locale.ROOT);
        return NETWORK_TYPES.contains(type) || description.contains("network");
    }
}
