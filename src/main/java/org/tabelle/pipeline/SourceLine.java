package org.tabelle.pipeline;

import java.util.Objects;

/**
 * Riga di input non vuota con la sua provenienza, per i messaggi di errore.
 */
public final class SourceLine {

    private final String sourceName;
    private final int lineNumber;
    private final String text;

    /**
     * @param sourceName nome del file o {@link LineSource#STANDARD_INPUT_NAME}
     * @param lineNumber numero di riga 1-based, righe vuote comprese
     * @param text testo della formula
     */
    public SourceLine(String sourceName, int lineNumber, String text) {
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
        this.text = text;
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getText() {
        return text;
    }

    /**
     * @return posizione nel formato nome:riga
     */
    public String location() {
        return sourceName + ":" + lineNumber;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SourceLine other = (SourceLine) obj;
        return lineNumber == other.lineNumber
                && Objects.equals(sourceName, other.sourceName)
                && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, lineNumber, text);
    }

    @Override
    public String toString() {
        return location() + " '" + text + "'";
    }
}
