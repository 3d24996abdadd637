package com.cashflow.simulator.exception;

import java.nio.file.Path;

public class UserDataNotFoundException extends RuntimeException {

    private final Path path;

    public UserDataNotFoundException(String kind, Path path) {
        super(kind + " file not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
