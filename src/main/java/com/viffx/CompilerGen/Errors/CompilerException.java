package com.viffx.CompilerGen.Errors;

/**
 * Root of the checked exceptions raised by the generator stages.
 * <p>
 * Every stage either returns its result or fails with exactly one subclass:
 * <ul>
 *   <li>{@link PatternException} while compiling lexical rules</li>
 *   <li>{@link LexicalException} while scanning</li>
 *   <li>{@link GrammarConflictException} while normalizing a grammar</li>
 *   <li>{@link SyntaxException} while translating a token stream</li>
 *   <li>{@link SemanticException} at the end of a translation run</li>
 * </ul>
 */
public abstract class CompilerException extends Exception {
    protected CompilerException(String message) {
        super(message);
    }
}
