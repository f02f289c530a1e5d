package org.e2immu.analyzer.shape.inference.impl;

public enum BlockStatus {
    UNVISITED, PROCESSING, DONE
}
