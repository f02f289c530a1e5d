package org.e2immu.analyzer.shape.common.report;

public enum ReportCategory {
    BEFORE("graphviz_method_before_foldunfold"),
    AFTER("graphviz_method_after_foldunfold"),
    CRASHING("graphviz_method_crashing_foldunfold");

    public final String namespace;

    ReportCategory(String namespace) {
        this.namespace = namespace;
    }

    @Override
    public String toString() {
        return namespace;
    }
}
