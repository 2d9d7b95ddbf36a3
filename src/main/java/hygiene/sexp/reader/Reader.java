// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hygiene.sexp.reader;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.regex.Pattern;
import hygiene.sexp.Sexp;
import hygiene.sexp.Sexps;
import hygiene.sexp.SourceLocation;
import hygiene.sexp.SourceNode;
import hygiene.sexp.SymbolTable;
import hygiene.sexp.Syntax;
import hygiene.util.UnreachableCodeReachedError;
import hygiene.util.condition.ConditionContext;
import hygiene.util.condition.UnhandledErrorError;
import hygiene.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The S-expression reader: the primary means of converting a stream of bytes into syntax objects.
 * <p>
 * Every datum read, including every element of a list, vector or box, is wrapped in a {@link SourceNode} holding the
 * location of its first byte. The supported notation is:
 * <ul>
 * <li>lists {@code (a b c)} and dotted lists {@code (a . b)};
 * <li>vectors {@code #(a b)} and boxes {@code #&a};
 * <li>strings {@code "..."} with the escapes {@code \n}, {@code \t}, {@code \\} and {@code \"};
 * <li>exact integers, and reals such as {@code 1.5} or {@code 2e10};
 * <li>booleans {@code #t}, {@code #f}, {@code #true}, {@code #false}, and the unspecified value {@code #!void};
 * <li>characters {@code #\a}, {@code #\space}, {@code #\newline}, {@code #\tab}, {@code #\nul};
 * <li>keywords {@code :name}, and symbols;
 * <li>the abbreviations {@code 'x}, {@code `x}, {@code ,x}, {@code ,@x} and their syntax counterparts {@code #'x},
 * {@code #`x}, {@code #,x}, {@code #,@x};
 * <li>line comments starting with {@code ;}.
 * </ul>
 */
public final class Reader {
    /**
     * Initializes a new S-expression reader that will read bytes from the given byte stream.
     * <p>
     * All symbols and keywords read will be interned into the given symbol table. Source locations will name
     * {@code origin} as their origin.
     */
    public Reader(final ByteStream stream, final SymbolTable symbolTable, final String origin) {
        this.stream = stream;
        this.symbolTable = symbolTable;
        this.origin = origin;
    }

    /**
     * Attempts to parse the next top-level S-expression.
     *
     * <ul>
     * <li>If an S-expression was correctly parsed, its syntax object is returned.
     * <li>If the end of input is reached, {@code null} is returned.
     * <li>If a parse error occurs, a fatal {@link ReadErrorCondition} condition is signaled.
     * <li>If an I/O error occurs, the {@link IOException} is caught and signaled as a fatal
     * {@link IOExceptionCondition}.
     * </ul>
     */
    public @Nullable Syntax readTopLevelForm() {
        if (skipSkippables().hitEof()) {
            return null;
        }
        currentDepth = 0;
        return readForm();
    }

    private HitEof skipSkippables() {
        while (true) {
            if (stream.reachedEnd()) {
                return HitEof.YES;
            }
            final var b = stream.peek();
            if (ByteClass.of(b) != ByteClass.SKIPPABLE) {
                return HitEof.NO;
            }
            stream.discardPeek();
            if (b == ';' && stream.skipToLineFeed().hitEof()) {
                return HitEof.YES;
            }
        }
    }

    private Syntax readForm() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalReadError("Recursion limit reached, try to limit nesting");
            }
            if (stream.reachedEnd()) {
                throw signalReadError("Expected a form, but found end of input instead");
            }
            final var location = currentLocation();
            final var b = stream.peek();
            switch (ByteClass.of(b)) {
                case RESERVED -> throw signalReservedCharacterError(b);
                case SKIPPABLE -> throw new UnreachableCodeReachedError(
                    "readForm called without preceding skipSkippables");
                default -> {
                }
            }
            stream.discardPeek();

            final Sexp datum = switch (b) {
                case ')' -> throw signalReadError("Expected a form, but found ')' instead");
                case '(' -> readList();
                case '"' -> readString();
                case '\'' -> readAbbreviation(Sexp.KnownSymbol.QUOTE);
                case '`' -> readAbbreviation(Sexp.KnownSymbol.QUASIQUOTE);
                case ',' -> readUnquote(Sexp.KnownSymbol.UNQUOTE, Sexp.KnownSymbol.UNQUOTE_SPLICING);
                case '#' -> readHashDispatch();
                default -> readAtom(b);
            };
            return SourceNode.of(datum, location);
        } finally {
            currentDepth -= 1;
        }
    }

    private Sexp readList() {
        final var elements = new ArrayList<Sexp>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalUnterminatedListError();
            }
            if (stream.peek() == ')') {
                stream.discardPeek();
                return Sexps.list(elements);
            }
            final var form = readForm();
            if (isDot(form)) {
                if (elements.isEmpty()) {
                    throw signalReadError("Expected a form before '.' in a dotted list");
                }
                return Sexps.listWithTail(readDottedTail(), elements.toArray(new Sexp[0]));
            }
            elements.add(form);
        }
    }

    private Sexp readDottedTail() {
        if (skipSkippables().hitEof()) {
            throw signalUnterminatedListError();
        }
        final var tail = readForm();
        if (skipSkippables().hitEof()) {
            throw signalUnterminatedListError();
        }
        if (stream.peek() != ')') {
            throw signalReadError("Expected ')' after the tail of a dotted list");
        }
        stream.discardPeek();
        return tail;
    }

    private Sexp.Vector readVector() {
        final var elements = new ArrayList<Sexp>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalUnterminatedListError();
            }
            if (stream.peek() == ')') {
                stream.discardPeek();
                return new Sexp.Vector(elements.toArray(new Sexp[0]));
            }
            final var form = readForm();
            if (isDot(form)) {
                throw signalReadError("Unexpected '.' in a vector");
            }
            elements.add(form);
        }
    }

    private Sexp readAbbreviation(final Sexp.Symbol symbol) {
        if (skipSkippables().hitEof()) {
            throw signalReadError("Expected a form after '" + symbol.symbolName() + "' abbreviation");
        }
        return Sexps.list(symbol, readForm());
    }

    private Sexp readUnquote(final Sexp.Symbol plain, final Sexp.Symbol splicing) {
        if (!stream.reachedEnd() && stream.peek() == '@') {
            stream.discardPeek();
            return readAbbreviation(splicing);
        }
        return readAbbreviation(plain);
    }

    private Sexp readHashDispatch() {
        if (stream.reachedEnd()) {
            throw signalReadError("Expected a character after '#' but found end of input instead");
        }
        final var b = stream.peek();
        switch (b) {
            case '(' -> {
                stream.discardPeek();
                return readVector();
            }
            case '&' -> {
                stream.discardPeek();
                if (skipSkippables().hitEof()) {
                    throw signalReadError("Expected a form after '#&'");
                }
                return new Sexp.Box(readForm());
            }
            case '\\' -> {
                stream.discardPeek();
                return readCharacter();
            }
            case '\'' -> {
                stream.discardPeek();
                return readAbbreviation(Sexp.KnownSymbol.SYNTAX);
            }
            case '`' -> {
                stream.discardPeek();
                return readAbbreviation(Sexp.KnownSymbol.QUASISYNTAX);
            }
            case ',' -> {
                stream.discardPeek();
                return readUnquote(Sexp.KnownSymbol.UNSYNTAX, Sexp.KnownSymbol.UNSYNTAX_SPLICING);
            }
            default -> {
                final var token = readToken(new ByteArrayOutputStream(initialSymbolCapacity));
                return switch (token) {
                    case "t", "true" -> Sexp.Boolean.TRUE;
                    case "f", "false" -> Sexp.Boolean.FALSE;
                    case "!void" -> Sexp.Void.INSTANCE;
                    default -> throw signalReadError("Unknown '#' syntax: #" + token);
                };
            }
        }
    }

    private Sexp.Character readCharacter() {
        if (stream.reachedEnd()) {
            throw signalReadError("Expected a character after '#\\' but found end of input instead");
        }
        final var bytes = new ByteArrayOutputStream(initialSymbolCapacity);
        // The first byte is taken even if it would otherwise end a token, so that #\( and #\space both work.
        bytes.write(stream.peek());
        stream.discardPeek();
        final var name = readToken(bytes);
        if (name.codePointCount(0, name.length()) == 1) {
            return new Sexp.Character(name.codePointAt(0));
        }
        return switch (name) {
            case "space" -> new Sexp.Character(' ');
            case "newline" -> new Sexp.Character('\n');
            case "tab" -> new Sexp.Character('\t');
            case "return" -> new Sexp.Character('\r');
            case "nul" -> new Sexp.Character(0);
            default -> throw signalReadError("Unknown character name: #\\" + name);
        };
    }

    private Sexp.String readString() {
        final var contentsBytes = new ByteArrayOutputStream(initialStringCapacity);
        var inEscapeSequence = false;
        outerLoop:
        while (true) {
            if (stream.reachedEnd()) {
                throw signalReadError("Expected closing '\"' but found end of input instead");
            }
            final var b = stream.peek();
            stream.discardPeek();
            if (inEscapeSequence) {
                inEscapeSequence = false;
                switch (b) {
                    case 'n' -> contentsBytes.write('\n');
                    case 't' -> contentsBytes.write('\t');
                    default -> contentsBytes.write(b);
                }
            } else {
                switch (b) {
                    case '"' -> {
                        break outerLoop;
                    }
                    case '\\' -> inEscapeSequence = true;
                    default -> contentsBytes.write(b);
                }
            }
        }

        return new Sexp.String(convertUtf8(contentsBytes.toByteArray()));
    }

    private Sexp readAtom(final byte firstByte) {
        final var bytes = new ByteArrayOutputStream(initialSymbolCapacity);
        bytes.write(firstByte);
        final var token = readToken(bytes);
        if (isInteger(token)) {
            return new Sexp.Integer(new BigInteger(token));
        } else if (realPattern.matcher(token).matches()) {
            return new Sexp.Real(Double.parseDouble(token));
        } else if (token.length() > 1 && token.charAt(0) == ':') {
            return symbolTable.internKeyword(token.substring(1));
        } else {
            return symbolTable.intern(token);
        }
    }

    private String readToken(final ByteArrayOutputStream bytes) {
        while (!stream.reachedEnd()) {
            final var b = stream.peek();
            final var byteClass = ByteClass.of(b);
            if (byteClass == ByteClass.RESERVED) {
                throw signalReservedCharacterError(b);
            }
            if (byteClass != ByteClass.REGULAR) {
                break;
            }
            stream.discardPeek();
            bytes.write(b);
        }
        return convertUtf8(bytes.toByteArray());
    }

    private String convertUtf8(final byte[] bytes) {
        try {
            return utf8Decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (final CharacterCodingException e) {
            throw signalReadError("Invalid UTF-8 byte sequence detected");
        }
    }

    private SourceLocation currentLocation() {
        return new SourceLocation(origin, stream.line(), stream.column());
    }

    private UnhandledErrorError signalUnterminatedListError() {
        throw signalReadError("Expected closing ')' but found end of input instead");
    }

    private UnhandledErrorError signalReservedCharacterError(final byte b) {
        final var message = (b >= 0 && b <= lastControlByte)
            ? String.format("Reserved control character U+%04X found", b)
            : ("Reserved character '" + (char) b + "' found");
        throw signalReadError(message);
    }

    private UnhandledErrorError signalReadError(final String message) {
        throw ConditionContext.error(new ReadErrorCondition(message, currentLocation()));
    }

    private static boolean isDot(final Syntax form) {
        return form.content() instanceof Sexp.Symbol symbol && ".".equals(symbol.symbolName());
    }

    private static boolean isInteger(final String token) {
        final var startIndex = (token.startsWith("+") || token.startsWith("-")) ? 1 : 0;
        final var length = token.length();
        if (length == startIndex) {
            return false;
        }
        for (int i = startIndex; i < length; i += 1) {
            final var ch = token.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    private static CharsetDecoder newUtf8Decoder() {
        final var decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder;
    }

    private static final Pattern realPattern = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][+-]?\\d+)?");
    private static final byte lastControlByte = 0x1F;
    private static final int initialStringCapacity = 256;
    private static final int initialSymbolCapacity = 16;
    private static final int maxDepth = 500;

    private final ByteStream stream;
    private final SymbolTable symbolTable;
    private final String origin;
    private final CharsetDecoder utf8Decoder = newUtf8Decoder();
    private int currentDepth = 0;

    private enum ByteClass {
        REGULAR,
        SKIPPABLE,
        SEPARATOR,
        RESERVED;

        private static ByteClass of(final byte b) {
            return byteClasses[Byte.toUnsignedInt(b)];
        }

        private static final ByteClass[] byteClasses;

        static {
            final var classes = new ByteClass[256];
            Arrays.fill(classes, REGULAR);
            classes[' '] = SKIPPABLE;
            classes['\r'] = SKIPPABLE;
            classes['\n'] = SKIPPABLE;
            classes['\t'] = SKIPPABLE;
            classes['\u000B'] = SKIPPABLE;
            classes['\u000C'] = SKIPPABLE;
            classes[';'] = SKIPPABLE;
            classes['('] = SEPARATOR;
            classes[')'] = SEPARATOR;
            classes['"'] = SEPARATOR;
            classes['\''] = SEPARATOR;
            classes['`'] = SEPARATOR;
            classes[','] = SEPARATOR;
            classes['|'] = RESERVED;
            classes['\\'] = RESERVED;
            classes['\0'] = RESERVED;
            byteClasses = classes;
        }
    }
}
