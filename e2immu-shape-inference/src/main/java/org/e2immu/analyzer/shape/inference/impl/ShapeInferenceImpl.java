package org.e2immu.analyzer.shape.inference.impl;

import org.e2immu.analyzer.shape.cfg.Procedure;
import org.e2immu.analyzer.shape.cfg.ProcedureGraphviz;
import org.e2immu.analyzer.shape.cfg.type.TypeDeclarations;
import org.e2immu.analyzer.shape.common.InferenceException;
import org.e2immu.analyzer.shape.common.report.ReportCategory;
import org.e2immu.analyzer.shape.common.report.ReportSink;
import org.e2immu.analyzer.shape.inference.ShapeInference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class ShapeInferenceImpl implements ShapeInference {
    private static final Logger LOGGER = LoggerFactory.getLogger(ShapeInferenceImpl.class);

    private final TypeDeclarations typeDeclarations;
    private final Configuration configuration;
    private final ReportSink reportSink;

    public ShapeInferenceImpl(TypeDeclarations typeDeclarations) {
        this(typeDeclarations, new ConfigurationBuilder().build(), ReportSink.NO_REPORTS);
    }

    public ShapeInferenceImpl(TypeDeclarations typeDeclarations, Configuration configuration, ReportSink reportSink) {
        this.typeDeclarations = typeDeclarations;
        this.configuration = configuration;
        this.reportSink = reportSink;
    }

    public record ConfigurationImpl(int maxIterations,
                                    boolean storeErrors,
                                    boolean dumpDebugInfo,
                                    boolean graphvizOnCrash,
                                    String sourceFileName) implements Configuration {
    }

    public static class ConfigurationBuilder {
        private int maxIterations = 100;
        private boolean storeErrors;
        private boolean dumpDebugInfo;
        private boolean graphvizOnCrash;
        private String sourceFileName = "unknown";

        public ConfigurationBuilder setMaxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public ConfigurationBuilder setStoreErrors(boolean storeErrors) {
            this.storeErrors = storeErrors;
            return this;
        }

        public ConfigurationBuilder setDumpDebugInfo(boolean dumpDebugInfo) {
            this.dumpDebugInfo = dumpDebugInfo;
            return this;
        }

        public ConfigurationBuilder setGraphvizOnCrash(boolean graphvizOnCrash) {
            this.graphvizOnCrash = graphvizOnCrash;
            return this;
        }

        public ConfigurationBuilder setSourceFileName(String sourceFileName) {
            this.sourceFileName = sourceFileName;
            return this;
        }

        public Configuration build() {
            return new ConfigurationImpl(maxIterations, storeErrors, dumpDebugInfo, graphvizOnCrash, sourceFileName);
        }
    }

    public record OutputImpl(List<Procedure> procedures,
                             List<InferenceException> inferenceExceptions) implements Output {
    }

    @Override
    public Procedure infer(Procedure procedure) {
        LOGGER.debug("Start inference of {}", procedure.signature());
        String reportName = ReportSink.reportName(configuration.sourceFileName(), procedure.name(), "dot");
        if (configuration.dumpDebugInfo()) {
            reportSink.report(ReportCategory.BEFORE, reportName, ProcedureGraphviz.toGraph(procedure)::write);
        }
        TraversalContext context = new TraversalContext(procedure);
        Procedure result;
        try (CrashReport crashReport = new CrashReport(context, reportSink, configuration.sourceFileName(),
                configuration.graphvizOnCrash())) {
            result = new Visitor(procedure, typeDeclarations, configuration.maxIterations(), context).visit();
            crashReport.cancel();
        }
        if (configuration.dumpDebugInfo()) {
            reportSink.report(ReportCategory.AFTER, reportName, ProcedureGraphviz.toGraph(result)::write);
        }
        return result;
    }

    @Override
    public Output go(List<Procedure> procedures) {
        List<Procedure> results = new ArrayList<>(procedures.size());
        List<InferenceException> inferenceExceptions = new ArrayList<>();
        for (Procedure procedure : procedures) {
            try {
                results.add(infer(procedure));
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception inferring shapes of {}", procedure.name());
                if (configuration.storeErrors()) {
                    inferenceExceptions.add(re instanceof InferenceException ie ? ie
                            : new InferenceException(procedure.name(), null, re));
                } else {
                    throw re;
                }
            }
        }
        LOGGER.info("Inferred shapes of {} procedures, {} errors", results.size(), inferenceExceptions.size());
        return new OutputImpl(List.copyOf(results), List.copyOf(inferenceExceptions));
    }
}
