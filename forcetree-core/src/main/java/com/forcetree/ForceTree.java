package com.forcetree;

import com.forcetree.ast.CompilationUnit;
import com.forcetree.parser.ApexLexer;
import com.forcetree.parser.ApexParser;
import com.forcetree.translation.TranslationException;
import com.forcetree.translation.Translator;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Entry point for parsing Apex source into an AST.
 *
 * <pre>{@code
 * CompilationUnit unit = ForceTree.parseAndTranslate(Path.of("Account.cls"));
 * }</pre>
 */
public final class ForceTree {

    private static final Logger logger = LoggerFactory.getLogger(ForceTree.class);

    /** File name recorded for source given as a string. */
    public static final String STRING_INPUT = "<str>";

    private ForceTree() {
    }

    /**
     * Parses and translates a file. The compilation type comes from the extension:
     * {@code .cls} for classes and {@code .trigger} for triggers.
     *
     * @throws IllegalArgumentException if the file is not an Apex source file
     */
    public static CompilationUnit parseAndTranslate(Path path) throws ParseException, IOException {
        CompilationType type = compilationTypeOf(path);
        if (type == null) {
            throw new IllegalArgumentException("Not an Apex source file: " + path);
        }
        return parseAndTranslate(path.toString(), CharStreams.fromPath(path), type);
    }

    /**
     * Parses and translates source text. A null type is detected from the text.
     */
    public static CompilationUnit parseAndTranslate(String source, CompilationType type) throws ParseException {
        return parseAndTranslate(STRING_INPUT, source, type);
    }

    public static CompilationUnit parseAndTranslate(String name, String source, CompilationType type)
            throws ParseException {
        return parseAndTranslate(name, CharStreams.fromString(source, name), type);
    }

    private static CompilationUnit parseAndTranslate(String name, CharStream input, CompilationType type)
            throws ParseException {
        CompilationType resolved = type != null ? type : determineCompilationType(input);
        input.seek(0);

        SyntaxErrorListener errors = new SyntaxErrorListener();
        ApexLexer lexer = new ApexLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        ApexParser parser = new ApexParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        ParserRuleContext tree = resolved == CompilationType.TRIGGER ? parser.triggerUnit() : parser.compilationUnit();

        if (!errors.getErrors().isEmpty()) {
            for (String error : errors.getErrors()) {
                logger.info("{}: {}", name, error);
            }
            throw new ParseException(
                "Failed to parse " + name + ": " + String.join("; ", errors.getErrors()), errors.getErrors());
        }

        try {
            return new Translator(name, tokens).translate(tree);
        } catch (TranslationException e) {
            logger.warn("Failed to translate {} at '{}'", name, e.getContextText(), e);
            throw new ParseException("Failed to translate " + name, e);
        }
    }

    /**
     * Guesses the compilation type by lexing up to the first opening brace.
     */
    static CompilationType determineCompilationType(CharStream input) {
        ApexLexer lexer = new ApexLexer(input);
        lexer.removeErrorListeners();
        for (Token token = lexer.nextToken(); token.getType() != Token.EOF; token = lexer.nextToken()) {
            switch (token.getType()) {
                case ApexLexer.TRIGGER:
                    return CompilationType.TRIGGER;
                case ApexLexer.CLASS:
                case ApexLexer.ENUM:
                case ApexLexer.INTERFACE:
                case ApexLexer.LBRACE:
                    return CompilationType.CLASS;
                default:
                    break;
            }
        }
        return CompilationType.CLASS;
    }

    public static boolean isApexSourceFile(Path path) {
        return compilationTypeOf(path) != null;
    }

    private static CompilationType compilationTypeOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return null;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".cls")) {
            return CompilationType.CLASS;
        } else if (name.endsWith(".trigger")) {
            return CompilationType.TRIGGER;
        }
        return null;
    }
}
