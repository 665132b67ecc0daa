package org.tabelle.pipeline;

/**
 * Conteggi di un'esecuzione, per il riepilogo finale.
 */
public final class RunSummary {

    private int processedLines = 0;
    private int failedLines = 0;
    private int writtenFiles = 0;

    void incrementProcessed() { processedLines++; }
    void incrementFailed() { failedLines++; }
    void incrementWrittenFiles() { writtenFiles++; }

    public int getProcessedLines() {
        return processedLines;
    }

    public int getFailedLines() {
        return failedLines;
    }

    public int getWrittenFiles() {
        return writtenFiles;
    }

    public int getSucceededLines() {
        return processedLines - failedLines;
    }

    public boolean hasFailures() {
        return failedLines > 0;
    }
}
