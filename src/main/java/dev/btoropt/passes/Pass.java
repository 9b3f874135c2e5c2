package dev.btoropt.passes;

public sealed interface Pass permits Transform, Validation {
    String name();
}
