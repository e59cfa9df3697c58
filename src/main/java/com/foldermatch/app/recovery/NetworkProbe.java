package com.foldermatch.app.recovery;

/**
 * Diz a politica de recuperacao se um caminho fica em local de rede e se ele responde.
 */
public interface NetworkProbe {

    /**
     * Caminho UNC ({@code \\server\share} ou {@code //server/share}) ou caminho numa montagem de rede.
     */
    boolean isNetworkPath(String path);

    /**
     * Checagem de alcance com tempo limitado. Nunca lanca; erro conta como inacessivel.
     */
    boolean isReachable(String path);

    static boolean isUncPath(String path) {
        return path != null && (path.startsWith("\\\\") || path.startsWith("//"));
    }

    /**
     * Servidor de um caminho UNC, ou {@code null}.
     */
    static String uncServer(String path) {
        if (!isUncPath(path)) return null;
        String rest = path.substring(2);
        int end = 0;
        while (end < rest.length() && rest.charAt(end) != '\\' && rest.charAt(end) != '/') end++;
        return end == 0 ? null : rest.substring(0, end);
    }
}
