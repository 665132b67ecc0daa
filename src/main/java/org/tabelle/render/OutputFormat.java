package org.tabelle.render;

import java.util.Locale;

/**
 * Formati di output disponibili da linea di comando (-fmt=...).
 */
public enum OutputFormat {
    LATEX("latex", ".tex"),
    TEXT("text", ".txt");

    private final String flag;
    private final String extension;

    OutputFormat(String flag, String extension) {
        this.flag = flag;
        this.extension = extension;
    }

    /**
     * @return estensione dei file scritti con -o
     */
    public String getExtension() {
        return extension;
    }

    public TableRenderer createRenderer() {
        return switch (this) {
            case LATEX -> new LatexTableRenderer();
            case TEXT -> new PlainTextTableRenderer();
        };
    }

    /**
     * @throws IllegalArgumentException se il valore non corrisponde a nessun formato
     */
    public static OutputFormat fromFlag(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.flag.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Formato di output non supportato: " + value
                + ". Supportati: latex, text");
    }
}
