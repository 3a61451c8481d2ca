package org.sprig.compiler.frontend.scanner;

import org.sprig.compiler.api.ScanError;
import org.sprig.compiler.api.ScanResult;
import org.sprig.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs complete scan passes: drives a fresh {@link Scanner} over the whole source and collects
 * the tokens a parser cares about. Whitespace and comment tokens are dropped, and the end of
 * input token ends the pass without being included.
 * <p>
 * A pass is all-or-nothing. The first scan error aborts it, and no partial token list is
 * returned.
 */
public final class Tokenizer {

    private static final Logger LOG = LoggerFactory.getLogger(Tokenizer.class);

    private Tokenizer() {}

    public static ScanResult<List<Token>> tokenize(String source) {
        return tokenize(source, ScannerOptions.defaults());
    }

    /**
     * Performs the tokenization of the entire source code.
     *
     * @param source The source code as a single string.
     * @param options The options of this pass.
     * @return An unmodifiable list of tokens in source order, or the first scan error.
     */
    public static ScanResult<List<Token>> tokenize(String source, ScannerOptions options) {
        Scanner scanner = new Scanner(source);
        List<Token> tokens = new ArrayList<>();
        while (true) {
            ScanResult<Token> next = scanner.scanToken();
            if (next instanceof ScanResult.Failure<Token> failure) {
                LOG.debug("Scan of {} aborted: {}", options.sourceName(), failure.error().message());
                return ScanResult.failure(failure.error());
            }
            Token token = next.getOrThrow();
            switch (token.type()) {
                case WHITESPACE, COMMENT -> {
                }
                case EOF -> {
                    LOG.debug("Scanned {} tokens from {}", tokens.size(), options.sourceName());
                    return ScanResult.success(Collections.unmodifiableList(tokens));
                }
                default -> tokens.add(token);
            }
        }
    }

    /**
     * Tokenizes the source and wraps the tokens in a {@link TokenStream} for a parser.
     *
     * @param source The source code as a single string.
     * @return The token stream, or the first scan error.
     */
    public static ScanResult<TokenStream> tokenizeToStream(String source) {
        return tokenize(source).map(TokenStream::new);
    }

    /**
     * Tokenizes the source and reports a failure to the given diagnostics engine instead of
     * returning it.
     *
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param options The options of this pass; the source name is used as the file name.
     * @return The tokens, or an empty list if the pass failed.
     */
    public static List<Token> tokenize(String source, DiagnosticsEngine diagnostics, ScannerOptions options) {
        ScanResult<List<Token>> result = tokenize(source, options);
        if (result.failure().isPresent()) {
            ScanError error = result.failure().get();
            diagnostics.reportError(error, options.sourceName());
            return List.of();
        }
        return result.getOrThrow();
    }
}
