package com.forcetree.symbols;

public class SymbolResolutionException extends RuntimeException {

    public SymbolResolutionException(String message) {
        super(message);
    }
}
