package com.foldermatch.app.cache;

import java.util.Locale;

import org.apache.commons.lang3.StringUtils;

/**
 * Utilitarios de caminho compartilhados pelo cache e pelas etapas de analise.
 *
 * Tanto '/' quanto '\' contam como separador, para que chaves de caminhos estilo Windows se
 * comportem igual em qualquer host. A comparacao nao diferencia maiusculas.
 */
public final class PathKeys {

    private PathKeys() {}

    /**
     * Caminho em minusculas sem separadores finais. Uma raiz pura ("/" ou "C:\") mantem o separador.
     */
    public static String normalize(String path) {
        if (path == null) return "";
        String trimmed = stripTrailingSeparators(path.trim());
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static String stripTrailingSeparators(String path) {
        if (path == null) return "";
        int end = path.length();
        while (end > 1 && isSeparator(path.charAt(end - 1))) {
            if (end == 3 && path.charAt(1) == ':') break; // C:\
            end--;
        }
        return path.substring(0, end);
    }

    /**
     * True quando {@code candidate} e igual a {@code root} ou fica abaixo dela. "C:\A" nao e
     * ancestral de "C:\AB".
     */
    public static boolean isSameOrDescendant(String candidate, String root) {
        String c = normalize(candidate);
        String r = normalize(root);
        if (r.isEmpty()) return false;
        if (c.equals(r)) return true;
        if (!c.startsWith(r)) return false;
        if (isSeparator(r.charAt(r.length() - 1))) return true;
        return isSeparator(c.charAt(r.length()));
    }

    /**
     * Pasta pai de um caminho, ou "" quando nao ha separador.
     */
    public static String parentOf(String path) {
        if (StringUtils.isEmpty(path)) return "";
        String p = stripTrailingSeparators(path);
        int idx = lastSeparator(p);
        if (idx < 0) return "";
        if (idx == 0) return p.substring(0, 1);
        if (idx == 2 && p.charAt(1) == ':') return p.substring(0, 3);
        return p.substring(0, idx);
    }

    /**
     * Ultimo segmento de um caminho (nome de arquivo ou pasta).
     */
    public static String fileNameOf(String path) {
        if (StringUtils.isEmpty(path)) return "";
        String p = stripTrailingSeparators(path);
        int idx = lastSeparator(p);
        return idx < 0 ? p : p.substring(idx + 1);
    }

    public static boolean sameFolder(String fileA, String fileB) {
        return normalize(parentOf(fileA)).equals(normalize(parentOf(fileB)));
    }

    private static int lastSeparator(String p) {
        return Math.max(p.lastIndexOf('/'), p.lastIndexOf('\\'));
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }
}
