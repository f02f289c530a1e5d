module org.e2immu.analyzer.shape.inference {
    requires static org.jetbrains.annotations;
    requires org.e2immu.analyzer.shape.common;
    requires org.e2immu.analyzer.shape.cfg;
    requires org.slf4j;

    exports org.e2immu.analyzer.shape.inference;
    exports org.e2immu.analyzer.shape.inference.impl;
    exports org.e2immu.analyzer.shape.inference.state;
}
