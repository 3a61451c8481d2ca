package org.sprig.compiler.frontend.scanner;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * A peekable, restartable cursor over the tokens of a completed scan pass.
 * Not thread-safe.
 */
public class TokenStream {

    private final List<Token> tokens;
    private int current = 0;

    public TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public boolean hasNext() {
        return current < tokens.size();
    }

    /**
     * Consumes the next token.
     * @return The token.
     * @throws NoSuchElementException if all tokens have been consumed.
     */
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens after " + tokens.size() + " tokens");
        }
        return tokens.get(current++);
    }

    public Optional<Token> peek() {
        return peek(0);
    }

    /**
     * Looks at a token ahead of the cursor without consuming anything.
     *
     * @param distance 0 for the next token, 1 for the one after it, and so on.
     * @return The token, or empty if the stream is shorter.
     */
    public Optional<Token> peek(int distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("Lookahead distance must not be negative: " + distance);
        }
        int index = current + distance;
        return index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
    }

    /**
     * Moves the cursor back to the first token.
     */
    public void rewind() {
        current = 0;
    }

    public int size() {
        return tokens.size();
    }

    /**
     * @return All tokens of the stream, independent of the cursor.
     */
    public List<Token> tokens() {
        return tokens;
    }
}
