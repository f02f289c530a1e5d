package org.e2immu.analyzer.shape.common.report;

import java.io.IOException;
import java.io.Writer;

/**
 * Destination of named debug artifacts. The producer only writes the content; where and how it is stored is up to
 * the implementation.
 */
public interface ReportSink {

    @FunctionalInterface
    interface WriterAction {
        void write(Writer writer) throws IOException;
    }

    ReportSink NO_REPORTS = (category, name, writerAction) -> {
    };

    /**
     * @param category     the kind of artifact
     * @param name         the artifact's name, typically <code>source-file.procedure.dot</code>
     * @param writerAction writes the content
     */
    void report(ReportCategory category, String name, WriterAction writerAction);

    static String reportName(String sourceFileName, String procedureName, String extension) {
        return sourceFileName + "." + procedureName + "." + extension;
    }
}
