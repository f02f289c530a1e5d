module org.e2immu.analyzer.shape.io {
    requires static org.jetbrains.annotations;
    requires org.e2immu.analyzer.shape.cfg;
    requires org.slf4j;

    exports org.e2immu.analyzer.shape.io;
}
