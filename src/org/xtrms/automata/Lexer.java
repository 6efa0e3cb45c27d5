/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.Token.Kind;

/**
 * Turns the text of a machine description into a flat sequence of
 * {@link Token}s. Brackets, parenthesis, comma and colon are single character
 * tokens, <code>=&gt;</code> is the only two character token, whitespace is
 * skipped and <code>#</code> starts a comment running to the end of the line.
 * Anything else starts an identifier, which continues while characters are
 * alphabetic, numeric or <code>_</code>; identifiers spelled like one of the
 * keywords <code>PUSH POP NOOP WRITE LEFT RIGHT</code> become keyword tokens.
 * <p>
 * The returned list always ends with a zero length {@link Kind#EOF} token
 * positioned at the end of the buffer.
 */
public final class Lexer {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINEST;

    private static final int EOX = -1;  // end of text

    private final Source source;
    private final String text;
    private final List<Token> tokens = new ArrayList<Token>();

    /*
     * state for nextChar() and peekChar()
     */
    private int c;              // current code point
    private int iNext = 0;      // char index of the next code point
    private int byteCurrent;    // byte offset of c
    private int byteNext = 0;   // byte offset of the next code point

    private Lexer(Source source) {
        this.source = source;
        this.text = source.toString();
    }

    /**
     * Scans the whole source.
     *
     * @return the tokens, terminated by an EOF token.
     * @throws LexException
     *             on a character which cannot start or complete a token.
     */
    public static List<Token> lex(Source source) {
        return new Lexer(source).lex();
    }

    private List<Token> lex() {
        while (nextChar()) {
            switch (c) {
            case '[':
                add(Kind.LEFT_BRACKET);
                break;
            case ']':
                add(Kind.RIGHT_BRACKET);
                break;
            case '(':
                add(Kind.LEFT_PAREN);
                break;
            case ')':
                add(Kind.RIGHT_PAREN);
                break;
            case ',':
                add(Kind.COMMA);
                break;
            case ':':
                add(Kind.COLON);
                break;
            case '=':
                scanArrow();
                break;
            case ' ': case '\t': case '\n': case '\r':
                break;
            case '#':
                while (peekChar() != EOX && peekChar() != '\n') nextChar();
                break;
            default:
                scanIdentifier();
                break;
            }
        }
        assert byteNext == source.length();
        tokens.add(new Token(Kind.EOF, new Span(source.length(), 0)));
        if (logger.isLoggable(level)) {
            logger.log(level, "tokens: " + tokens.size());
        }
        return Collections.unmodifiableList(tokens);
    }

    private void scanArrow() {
        Span equals = new Span(byteCurrent, 1);
        if (!nextChar()) {
            throw LexException.unexpectedEOF(equals, "'>'");
        }
        if (c != '>') {
            throw LexException.unexpectedCharacter(equals, "'>'");
        }
        tokens.add(new Token(Kind.ARROW, new Span(equals.offset(), 2)));
    }

    private void scanIdentifier() {
        final int begin = iNext - Character.charCount(c);
        final int byteBegin = byteCurrent;
        for (int p = peekChar(); isIdentifierPart(p); p = peekChar()) {
            nextChar();
        }
        Kind keyword = Kind.keyword(text.substring(begin, iNext));
        tokens.add(new Token(keyword != null ? keyword : Kind.IDENTIFIER,
            new Span(byteBegin, byteNext - byteBegin)));
    }

    /*
     * Unicode alphabetic (combining vowel signs included) or any numeric
     * category, or '_'
     */
    private static boolean isIdentifierPart(int cp) {
        if (cp == '_' || Character.isAlphabetic(cp)) return true;
        switch (Character.getType(cp)) {
        case Character.DECIMAL_DIGIT_NUMBER:
        case Character.LETTER_NUMBER:
        case Character.OTHER_NUMBER:
            return true;
        default:
            return false;
        }
    }

    private void add(Kind kind) {
        tokens.add(new Token(kind, new Span(byteCurrent, byteNext - byteCurrent)));
    }

    /*
     * char scanner stuff
     */

    private boolean nextChar() {
        if (iNext >= text.length()) {
            return false;
        }
        c = text.codePointAt(iNext);
        iNext += Character.charCount(c);
        byteCurrent = byteNext;
        byteNext += utf8Length(c);
        return true;
    }

    private int peekChar() {
        return iNext < text.length() ? text.codePointAt(iNext) : EOX;
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE) {
            return 1;   // unpaired, encoded as '?'
        }
        if (cp < 0x10000) return 3;
        return 4;
    }
}
