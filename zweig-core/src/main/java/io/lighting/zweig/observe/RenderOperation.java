package io.lighting.zweig.observe;

public enum RenderOperation {
    UNPARSE,
    DUMP
}
