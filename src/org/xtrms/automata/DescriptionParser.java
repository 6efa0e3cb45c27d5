/*
 * @LICENSE@
 */

package org.xtrms.automata;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtrms.automata.MachineDescription.Operation;
import org.xtrms.automata.MachineDescription.Transition;
import org.xtrms.automata.Token.Kind;

/**
 * Parses the token sequence of a machine description into a
 * {@link MachineDescription}. A description is a sequence of sections, each
 * introduced by a bracketed name, in any order and each at most once:
 *
 * <pre>
 * [states]         q0, q1
 * [alphabet]       a, b
 * [initial]        q0
 * [final]          q1
 * [stack_alphabet] Z, A          # PDA only
 * [start_stack]    Z             # PDA only
 * [tape_alphabet]  0, 1, B       # TM only
 * [blank_symbol]   B             # TM only
 * [transitions]
 * q0(a)   =&gt; q1
 * q0(a,Z) =&gt; q1(PUSH:A)
 * q0(0)   =&gt; q1(WRITE:1, RIGHT)
 * </pre>
 *
 * The <code>states</code>, <code>alphabet</code>, <code>transitions</code>,
 * <code>initial</code> and <code>final</code> sections are mandatory. The
 * parser stops at the first error.
 */
public final class DescriptionParser {

    private static final Logger logger = Logger.getLogger("org.xtrms.automata");
    private static final Level level = Level.FINER;

    static final String STATES = "states";
    static final String ALPHABET = "alphabet";
    static final String TRANSITIONS = "transitions";
    static final String INITIAL = "initial";
    static final String FINAL = "final";
    static final String STACK_ALPHABET = "stack_alphabet";
    static final String START_STACK = "start_stack";
    static final String TAPE_ALPHABET = "tape_alphabet";
    static final String BLANK_SYMBOL = "blank_symbol";

    private static final String OPERATION = "a stack operation or a direction";
    private static final String DIRECTION = "LEFT or RIGHT";

    private final Source source;
    private final List<Token> tokens;
    private int iNext = 0;

    private DescriptionParser(Source source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    /**
     * @param source
     *            the buffer the tokens were scanned from.
     * @param tokens
     *            the output of {@link Lexer#lex(Source)}.
     * @return the description, with all mandatory sections present.
     * @throws ParseException
     *             on the first syntax error, unknown or duplicate section, or
     *             missing mandatory section.
     */
    public static MachineDescription parse(Source source, List<Token> tokens) {
        return new DescriptionParser(source, tokens).parse();
    }

    private MachineDescription parse() {

        List<Token> states = null;
        List<Token> alphabet = null;
        List<Transition> transitions = null;
        Token startState = null;
        List<Token> finalStates = null;
        List<Token> stackAlphabet = null;
        Token startStack = null;
        List<Token> tapeAlphabet = null;
        Token blankSymbol = null;

        final Map<String, Token> seen = new HashMap<String, Token>();

        while (peekKind() != Kind.EOF) {
            Token name = parseSectionHeader();
            String section = name.text(source);
            Token first = seen.get(section);
            if (first != null) {
                throw ParseException.duplicateSection(name, first);
            }
            if (section.equals(INITIAL)) {
                startState = expect(Kind.IDENTIFIER);
            } else if (section.equals(FINAL)) {
                finalStates = parseList();
            } else if (section.equals(STATES)) {
                states = parseList();
            } else if (section.equals(ALPHABET)) {
                alphabet = parseList();
            } else if (section.equals(TRANSITIONS)) {
                transitions = parseTransitions();
            } else if (section.equals(STACK_ALPHABET)) {
                stackAlphabet = parseList();
            } else if (section.equals(START_STACK)) {
                startStack = expect(Kind.IDENTIFIER);
            } else if (section.equals(TAPE_ALPHABET)) {
                tapeAlphabet = parseList();
            } else if (section.equals(BLANK_SYMBOL)) {
                blankSymbol = expect(Kind.IDENTIFIER);
            } else {
                throw ParseException.unknownSectionName(name);
            }
            seen.put(section, name);
            logger.log(level, "section: " + section);
        }

        if (states == null) throw ParseException.missingSection(STATES);
        if (alphabet == null) throw ParseException.missingSection(ALPHABET);
        if (transitions == null) throw ParseException.missingSection(TRANSITIONS);
        if (startState == null) throw ParseException.missingSection(INITIAL);
        if (finalStates == null) throw ParseException.missingSection(FINAL);

        return new MachineDescription(states, alphabet, transitions, startState,
            finalStates, stackAlphabet, startStack, tapeAlphabet, blankSymbol);
    }

    /*
     * '[' name ']'
     */
    private Token parseSectionHeader() {
        expect(Kind.LEFT_BRACKET);
        Token name = expect(Kind.IDENTIFIER);
        expect(Kind.RIGHT_BRACKET);
        return name;
    }

    /*
     * identifier (',' identifier)*  ...up to the next section or the end
     */
    private List<Token> parseList() {
        List<Token> ret = new ArrayList<Token>();
        while (true) {
            ret.add(expect(Kind.IDENTIFIER));
            switch (peekKind()) {
            case COMMA:
                next(Kind.IDENTIFIER.toString());
                break;
            case LEFT_BRACKET:
            case EOF:
                return ret;
            default:
                throw ParseException.unexpectedToken(peek(), Kind.COMMA.toString());
            }
        }
    }

    private List<Transition> parseTransitions() {
        List<Transition> ret = new ArrayList<Transition>();
        while (true) {
            switch (peekKind()) {
            case LEFT_BRACKET:
            case EOF:
                return ret;
            case IDENTIFIER:
                ret.add(parseTransition());
                break;
            default:
                throw ParseException.unexpectedToken(
                    peek(), Kind.LEFT_BRACKET.toString());
            }
        }
    }

    /*
     * from '(' symbol [',' stackTop] ')' '=>' to [ '(' action ')' ]
     */
    private Transition parseTransition() {
        Token from = expect(Kind.IDENTIFIER);
        expect(Kind.LEFT_PAREN);
        Token symbol = expect(Kind.IDENTIFIER);
        Token stackTop = null;
        if (peekKind() == Kind.COMMA) {
            next(Kind.IDENTIFIER.toString());
            stackTop = expect(Kind.IDENTIFIER);
        }
        expect(Kind.RIGHT_PAREN);
        expect(Kind.ARROW);
        Token to = expect(Kind.IDENTIFIER);

        Operation operation = null;
        Token direction = null;
        if (peekKind() == Kind.LEFT_PAREN) {
            next(OPERATION);
            Token token = next(OPERATION);
            switch (token.kind()) {
            case PUSH:
            case WRITE:
                expect(Kind.COLON);
                operation = new Operation(token, expect(Kind.IDENTIFIER));
                direction = maybeParseDirection();
                break;
            case POP:
            case NOOP:
                operation = new Operation(token, null);
                direction = maybeParseDirection();
                break;
            case LEFT:
            case RIGHT:
                direction = token;
                break;
            default:
                throw ParseException.unexpectedToken(token, OPERATION);
            }
            expect(Kind.RIGHT_PAREN);
        }
        return new Transition(from, symbol, stackTop, to, operation, direction);
    }

    private Token maybeParseDirection() {
        if (peekKind() != Kind.COMMA) return null;
        next(DIRECTION);
        Token token = next(DIRECTION);
        if (token.kind() != Kind.LEFT && token.kind() != Kind.RIGHT) {
            throw ParseException.unexpectedToken(token, DIRECTION);
        }
        return token;
    }

    /*
     * token stream stuff: every access is checked, running out of tokens is
     * reported the same as reaching the EOF token.
     */

    private Token next(String expected) {
        if (iNext >= tokens.size()) {
            throw ParseException.unexpectedEOF(
                new Span(source.length(), 0), expected);
        }
        Token token = tokens.get(iNext++);
        if (token.kind() == Kind.EOF) {
            throw ParseException.unexpectedEOF(token.span(), expected);
        }
        return token;
    }

    private Token expect(Kind kind) {
        Token token = next(kind.toString());
        if (token.kind() != kind) {
            throw ParseException.unexpectedToken(token, kind.toString());
        }
        return token;
    }

    private Token peek() {
        return iNext < tokens.size() ? tokens.get(iNext) : null;
    }

    private Kind peekKind() {
        Token token = peek();
        return token == null ? Kind.EOF : token.kind();
    }
}
