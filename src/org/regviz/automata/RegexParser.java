/*
 * @LICENSE@
 */

package org.regviz.automata;

import static org.regviz.automata.AST.alt;
import static org.regviz.automata.AST.cat;
import static org.regviz.automata.AST.epsilon;
import static org.regviz.automata.AST.literal;
import static org.regviz.automata.AST.plus;
import static org.regviz.automata.AST.question;
import static org.regviz.automata.AST.star;

import java.util.List;

import org.regviz.automata.AST.Node;
import org.regviz.automata.ParseException.Kind;

/**
 * Pratt (top down operator precedence) parser from {@link Token}s to an
 * {@link AST}. Binding powers, loosest first: alternation, concatenation
 * (explicit <code>.</code> or implied before a literal or a left paren), then
 * the postfix operators <code>* + ?</code>. Binary operators are left
 * associative.
 */
final class RegexParser {

    private static final int BP_NONE = 0;
    private static final int BP_ALTERNATION = 10;
    private static final int BP_CONCATENATION = 20;
    private static final int BP_POSTFIX = 30;

    private final String regex;
    private final List<Token> tokens;
    private int iCurrent = 0;
    private int depth = 0;  // open groups

    private RegexParser(String regex, List<Token> tokens) {
        assert !tokens.isEmpty()
            && tokens.get(tokens.size() - 1).kind() == Token.Kind.END;
        this.regex = regex;
        this.tokens = tokens;
    }

    /**
     * @param regex
     *            the source text, for diagnostics.
     * @param tokens
     *            the lexer output, terminated by an END token.
     * @return the root of the tree; {@link AST.Epsilon} if there is nothing
     *         before END.
     * @throws ParseException
     *             at the first syntax error.
     */
    static Node parse(String regex, List<Token> tokens) {
        return new RegexParser(regex, tokens).parse();
    }

    static Node parse(String regex) {
        return parse(regex, Lexer.lex(regex));
    }

    private Node parse() {
        if (peek().kind() == Token.Kind.END) {
            return epsilon();
        }
        final Node root = expression(BP_NONE);
        final Token rest = peek();
        if (rest.kind() == Token.Kind.RIGHT_PAREN) {
            syntaxError(Kind.RIGHT_PAREN_WITHOUT_LEFT, rest);
        }
        assert rest.kind() == Token.Kind.END : rest;
        return root;
    }

    private Token peek() {
        return tokens.get(iCurrent);
    }

    private Token next() {
        final Token token = tokens.get(iCurrent);
        if (token.kind() != Token.Kind.END) {
            ++iCurrent;
        }
        return token;
    }

    private Node expression(int rbp) {
        Node left = nud(next());
        while (rbp < lbp(peek())) {
            left = led(left);
        }
        return left;
    }

    private static int lbp(Token token) {
        switch (token.kind()) {
        case ALTERNATION:
            return BP_ALTERNATION;
        case CONCATENATION:
        case LITERAL:
        case LEFT_PAREN:
            return BP_CONCATENATION;
        case STAR:
        case PLUS:
        case QUESTION:
            return BP_POSTFIX;
        default:
            return BP_NONE;
        }
    }

    /*
     * null denotation: a token in operand position
     */
    private Node nud(Token token) {
        switch (token.kind()) {
        case LITERAL:
            return symbol(token.codePoint());
        case LEFT_PAREN:
            return group(token);
        case END:
            return syntaxError(Kind.UNEXPECTED_EOF, token);
        case RIGHT_PAREN:
            return syntaxError(depth > 0
                    ? Kind.UNEXPECTED_PREFIX_OPERATOR
                    : Kind.RIGHT_PAREN_WITHOUT_LEFT, token);
        default:
            return syntaxError(Kind.UNEXPECTED_PREFIX_OPERATOR, token);
        }
    }

    /*
     * left denotation: a token following a complete operand
     */
    private Node led(Node left) {
        final Token token = peek();
        switch (token.kind()) {
        case ALTERNATION:
            next();
            return alt(left, expression(BP_ALTERNATION));
        case CONCATENATION:
            next();
            return cat(left, expression(BP_CONCATENATION));
        case LITERAL:
        case LEFT_PAREN:
            return cat(left, expression(BP_CONCATENATION)); // implied
        case STAR:
            next();
            return star(left);
        case PLUS:
            next();
            return plus(left);
        case QUESTION:
            next();
            return question(left);
        default:
            throw new AssertionError("no left denotation: " + token);
        }
    }

    /*
     * A supplementary code point is matched as its surrogate pair: one operand,
     * so postfix operators apply to the pair.
     */
    private static Node symbol(int codePoint) {
        if (Character.isBmpCodePoint(codePoint)) {
            return literal((char) codePoint);
        }
        return cat(literal(Character.highSurrogate(codePoint)),
            literal(Character.lowSurrogate(codePoint)));
    }

    private Node group(Token open) {
        if (peek().kind() == Token.Kind.RIGHT_PAREN) {
            syntaxError(Kind.EMPTY_PARENTHESES, open);
        }
        ++depth;
        final Node inner = expression(BP_NONE);
        final Token close = peek();
        if (close.kind() != Token.Kind.RIGHT_PAREN) {
            assert close.kind() == Token.Kind.END : close;
            syntaxError(Kind.MISMATCHED_LEFT_PAREN, close);
        }
        next();
        --depth;
        return inner;
    }

    private Node syntaxError(Kind kind, Token token) {
        throw new ParseException(kind, regex, token.position());
    }
}
