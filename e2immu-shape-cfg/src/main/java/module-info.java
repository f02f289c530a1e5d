module org.e2immu.analyzer.shape.cfg {
    requires static org.jetbrains.annotations;
    requires transitive org.e2immu.analyzer.shape.common;

    exports org.e2immu.analyzer.shape.cfg;
    exports org.e2immu.analyzer.shape.cfg.place;
    exports org.e2immu.analyzer.shape.cfg.statement;
    exports org.e2immu.analyzer.shape.cfg.type;
}
