package com.forcetree.ast;

/**
 * Marks a node standing in for source the translator does not model.
 */
public interface Untranslated {
}
