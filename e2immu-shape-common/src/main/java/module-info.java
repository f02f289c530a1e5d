module org.e2immu.analyzer.shape.common {
    requires static org.jetbrains.annotations;
    requires org.slf4j;

    exports org.e2immu.analyzer.shape.common;
    exports org.e2immu.analyzer.shape.common.graph;
    exports org.e2immu.analyzer.shape.common.report;
}
