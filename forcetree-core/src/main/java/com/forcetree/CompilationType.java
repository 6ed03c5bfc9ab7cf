package com.forcetree;

/**
 * The kind of Apex source file, which selects the parser entry rule.
 */
public enum CompilationType {
    CLASS,
    TRIGGER
}
