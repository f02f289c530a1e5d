package org.e2immu.analyzer.shape.common.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/*
writes every artifact to <logDirectory>/<category namespace>/<legal file name>
 */
public class LogDirectoryReportSink implements ReportSink {
    private static final Logger LOGGER = LoggerFactory.getLogger(LogDirectoryReportSink.class);
    private static final int MAX_FILE_NAME_LENGTH = 200;

    private final Path logDirectory;

    public LogDirectoryReportSink(Path logDirectory) {
        this.logDirectory = logDirectory;
    }

    @Override
    public void report(ReportCategory category, String name, WriterAction writerAction) {
        Path directory = logDirectory.resolve(category.namespace);
        Path file = directory.resolve(toLegalFileName(name));
        try {
            Files.createDirectories(directory);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                writerAction.write(writer);
            }
        } catch (IOException ioe) {
            LOGGER.error("Cannot write report {}", file, ioe);
            throw new UncheckedIOException(ioe);
        }
        LOGGER.debug("Wrote {} report to {}", category, file);
    }

    public static String toLegalFileName(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        for (char c : name.toCharArray()) {
            if (Character.isLetterOrDigit(c) || c == '.' || c == '_' || c == '-') {
                sb.append(c);
            } else {
                sb.append('_');
            }
        }
        String legal = sb.toString();
        return legal.length() > MAX_FILE_NAME_LENGTH ? legal.substring(0, MAX_FILE_NAME_LENGTH) : legal;
    }
}
