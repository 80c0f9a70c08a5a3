package agentic.lexer;

import agentic.diag.SourceLocation;

import java.nio.file.Path;
import java.util.*;

/**
 * Tokenizer for the TSX subset. JSX needs context the token stream alone does not have,
 * so the lexer keeps a stack of modes: plain code, the inside of a tag, element children
 * and template literals. Braces opened from JSX or a template push a code frame that is
 * popped by the matching '}'.
 */
public class Lexer {

    private enum Mode { CODE, TAG, CHILDREN, TEMPLATE }

    private static final class Frame {
        final Mode mode;
        final boolean closingTag;
        int braceDepth = 0;
        int typeArgDepth = 0;

        Frame(Mode mode, boolean closingTag) {
            this.mode = mode;
            this.closingTag = closingTag;
        }
    }

    private final String source;
    private final Path file;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Frame> frames = new ArrayDeque<>();

    private int pos = 0;
    private int line = 1;
    private int col = 1;

    private static final Map<String, TokenType> keywords = Map.ofEntries(
            Map.entry("import", TokenType.IMPORT),
            Map.entry("export", TokenType.EXPORT),
            Map.entry("interface", TokenType.INTERFACE),
            Map.entry("extends", TokenType.EXTENDS),
            Map.entry("const", TokenType.CONST),
            Map.entry("let", TokenType.LET),
            Map.entry("function", TokenType.FUNCTION),
            Map.entry("return", TokenType.RETURN),
            Map.entry("default", TokenType.DEFAULT),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("null", TokenType.NULL),
            Map.entry("undefined", TokenType.UNDEFINED)
    );

    // tokens after which '<' starts an expression rather than a comparison or type argument
    private static final Set<TokenType> EXPRESSION_START = EnumSet.of(
            TokenType.LPAREN, TokenType.COMMA, TokenType.ASSIGN, TokenType.RETURN,
            TokenType.ARROW, TokenType.QUESTION, TokenType.COLON, TokenType.LBRACE,
            TokenType.LBRACKET, TokenType.AND, TokenType.OR, TokenType.NOT,
            TokenType.DEFAULT, TokenType.TEMPLATE_EXPR_START
    );

    public Lexer(String source) {
        this(source, null);
    }

    public Lexer(String source, Path file) {
        this.source = source;
        this.file = file;
        frames.push(new Frame(Mode.CODE, false));
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            switch (frames.peek().mode) {
                case CODE -> lexCode();
                case TAG -> lexTag();
                case CHILDREN -> lexChildren();
                case TEMPLATE -> lexTemplate();
            }
        }
        if (frames.size() > 1) {
            throw error(switch (frames.peek().mode) {
                case TEMPLATE -> "Unterminated template literal";
                case TAG -> "Unterminated JSX tag";
                case CHILDREN -> "Unclosed JSX element";
                case CODE -> "Unbalanced '{'";
            });
        }
        tokens.add(new Token(TokenType.EOF, "", line, col));
        return tokens;
    }

    // ================= modes =================

    private void lexCode() {
        skipWhitespaceAndComments();
        if (isAtEnd()) return;

        int startLine = line;
        int startCol = col;
        char c = advance();
        Frame frame = frames.peek();

        switch (c) {
            case '(' -> add(TokenType.LPAREN, "(", startLine, startCol);
            case ')' -> add(TokenType.RPAREN, ")", startLine, startCol);
            case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
            case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
            case ':' -> add(TokenType.COLON, ":", startLine, startCol);
            case ';' -> add(TokenType.SEMICOLON, ";", startLine, startCol);
            case ',' -> add(TokenType.COMMA, ",", startLine, startCol);
            case '?' -> add(TokenType.QUESTION, "?", startLine, startCol);
            case '*' -> add(TokenType.STAR, "*", startLine, startCol);
            case '-' -> add(TokenType.MINUS, "-", startLine, startCol);
            case '/' -> add(TokenType.SLASH, "/", startLine, startCol);

            case '{' -> {
                frame.braceDepth++;
                add(TokenType.LBRACE, "{", startLine, startCol);
            }
            case '}' -> {
                add(TokenType.RBRACE, "}", startLine, startCol);
                if (frame.braceDepth == 0) {
                    if (frames.size() == 1) throw error("Unexpected '}'", startLine, startCol);
                    frames.pop();
                } else {
                    frame.braceDepth--;
                }
            }

            case '.' -> {
                if (peek() == '.' && peekNext() == '.') {
                    advance();
                    advance();
                    add(TokenType.SPREAD, "...", startLine, startCol);
                } else if (isDigit(peek())) {
                    numberLiteral(c, startLine, startCol);
                } else {
                    add(TokenType.DOT, ".", startLine, startCol);
                }
            }

            case '=' -> {
                if (match('>')) add(TokenType.ARROW, "=>", startLine, startCol);
                else if (match('=')) {
                    boolean strict = match('=');
                    add(strict ? TokenType.STRICT_EQ : TokenType.EQ, strict ? "===" : "==", startLine, startCol);
                } else add(TokenType.ASSIGN, "=", startLine, startCol);
            }
            case '!' -> {
                if (match('=')) {
                    boolean strict = match('=');
                    add(strict ? TokenType.STRICT_NEQ : TokenType.NEQ, strict ? "!==" : "!=", startLine, startCol);
                } else add(TokenType.NOT, "!", startLine, startCol);
            }
            case '&' -> {
                if (match('&')) add(TokenType.AND, "&&", startLine, startCol);
                else throw error("Unexpected '&'", startLine, startCol);
            }
            case '|' -> {
                boolean or = match('|');
                add(or ? TokenType.OR : TokenType.PIPE, or ? "||" : "|", startLine, startCol);
            }
            case '>' -> {
                boolean ge = match('=');
                add(ge ? TokenType.GE : TokenType.GT, ge ? ">=" : ">", startLine, startCol);
            }
            case '<' -> {
                if (startsJsx()) {
                    add(TokenType.JSX_TAG_OPEN, "<", startLine, startCol);
                    frames.push(new Frame(Mode.TAG, false));
                } else {
                    boolean le = match('=');
                    add(le ? TokenType.LE : TokenType.LT, le ? "<=" : "<", startLine, startCol);
                }
            }

            case '"', '\'' -> stringLiteral(c, startLine, startCol);
            case '`' -> {
                add(TokenType.TEMPLATE_START, "`", startLine, startCol);
                frames.push(new Frame(Mode.TEMPLATE, false));
            }

            default -> {
                if (isDigit(c)) numberLiteral(c, startLine, startCol);
                else if (isIdentStart(c)) identifier(c, startLine, startCol, false);
                else throw error("Unexpected character: " + c, startLine, startCol);
            }
        }
    }

    private void lexTag() {
        skipWhitespaceAndComments();
        if (isAtEnd()) return;

        int startLine = line;
        int startCol = col;
        char c = advance();
        Frame frame = frames.peek();

        switch (c) {
            case '>' -> {
                if (frame.typeArgDepth > 0) {
                    frame.typeArgDepth--;
                    add(TokenType.GT, ">", startLine, startCol);
                    return;
                }
                add(TokenType.JSX_TAG_END, ">", startLine, startCol);
                frames.pop();
                if (frame.closingTag) {
                    if (frames.peek().mode != Mode.CHILDREN) {
                        throw error("Closing tag without an open element", startLine, startCol);
                    }
                    frames.pop();
                } else {
                    frames.push(new Frame(Mode.CHILDREN, false));
                }
            }
            case '/' -> {
                if (!match('>')) throw error("Expected '>' after '/' in tag", startLine, startCol);
                add(TokenType.JSX_SELF_CLOSE, "/>", startLine, startCol);
                frames.pop();
            }
            case '<' -> {
                frame.typeArgDepth++;
                add(TokenType.LT, "<", startLine, startCol);
            }
            case '{' -> {
                add(TokenType.LBRACE, "{", startLine, startCol);
                frames.push(new Frame(Mode.CODE, false));
            }
            case '=' -> add(TokenType.ASSIGN, "=", startLine, startCol);
            case '.' -> add(TokenType.DOT, ".", startLine, startCol);
            case ',' -> add(TokenType.COMMA, ",", startLine, startCol);
            case '[' -> add(TokenType.LBRACKET, "[", startLine, startCol);
            case ']' -> add(TokenType.RBRACKET, "]", startLine, startCol);
            case '|' -> add(TokenType.PIPE, "|", startLine, startCol);
            case '"', '\'' -> stringLiteral(c, startLine, startCol);
            default -> {
                if (isIdentStart(c)) identifier(c, startLine, startCol, true);
                else throw error("Unexpected character in JSX tag: " + c, startLine, startCol);
            }
        }
    }

    private void lexChildren() {
        int startLine = line;
        int startCol = col;
        char c = peek();

        if (c == '<') {
            advance();
            if (match('/')) {
                add(TokenType.JSX_CLOSE_TAG_OPEN, "</", startLine, startCol);
                frames.push(new Frame(Mode.TAG, true));
            } else {
                add(TokenType.JSX_TAG_OPEN, "<", startLine, startCol);
                frames.push(new Frame(Mode.TAG, false));
            }
            return;
        }
        if (c == '{') {
            advance();
            add(TokenType.LBRACE, "{", startLine, startCol);
            frames.push(new Frame(Mode.CODE, false));
            return;
        }

        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '<' && peek() != '{') {
            sb.append(advance());
        }
        add(TokenType.JSX_TEXT, sb.toString(), startLine, startCol);
    }

    private void lexTemplate() {
        int startLine = line;
        int startCol = col;

        if (peek() == '`') {
            advance();
            add(TokenType.TEMPLATE_END, "`", startLine, startCol);
            frames.pop();
            return;
        }
        if (peek() == '$' && peekNext() == '{') {
            advance();
            advance();
            add(TokenType.TEMPLATE_EXPR_START, "${", startLine, startCol);
            frames.push(new Frame(Mode.CODE, false));
            return;
        }

        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != '`' && !(peek() == '$' && peekNext() == '{')) {
            char ch = advance();
            if (ch == '\\') sb.append(escape());
            else sb.append(ch);
        }
        add(TokenType.TEMPLATE_CHUNK, sb.toString(), startLine, startCol);
    }

    // ================= helpers =================

    private boolean startsJsx() {
        char next = peek();
        if (!(isIdentStart(next) || next == '>')) return false;
        if (tokens.isEmpty()) return true;
        TokenType prev = tokens.get(tokens.size() - 1).type();
        return EXPRESSION_START.contains(prev);
    }

    private void numberLiteral(char first, int line, int col) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!isAtEnd() && (isDigit(peek()) || peek() == '_')) {
            char d = advance();
            if (d != '_') sb.append(d);
        }
        if (first != '.' && !isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            sb.append(advance());
            while (!isAtEnd() && isDigit(peek())) sb.append(advance());
        }
        if (peek() == 'e' || peek() == 'E') {
            sb.append(advance());
            if (peek() == '+' || peek() == '-') sb.append(advance());
            if (!isDigit(peek())) throw error("Malformed number exponent", line, col);
            while (!isAtEnd() && isDigit(peek())) sb.append(advance());
        }
        add(TokenType.NUMBER_LITERAL, sb.toString(), line, col);
    }

    private void stringLiteral(char quote, int line, int col) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\n') throw error("Unterminated string", line, col);
            if (c == '\\') sb.append(escape());
            else sb.append(c);
        }
        if (isAtEnd()) throw error("Unterminated string", line, col);
        advance(); // closing quote
        add(TokenType.STRING_LITERAL, sb.toString(), line, col);
    }

    private String escape() {
        if (isAtEnd()) throw error("Unterminated escape sequence");
        char e = advance();
        return switch (e) {
            case 'n' -> "\n";
            case 't' -> "\t";
            case 'r' -> "\r";
            case '0' -> "\0";
            case 'u' -> unicodeEscape();
            case '\n' -> "";
            default -> String.valueOf(e);
        };
    }

    private String unicodeEscape() {
        if (pos + 4 > source.length()) throw error("Invalid unicode escape");
        String hex = source.substring(pos, pos + 4);
        try {
            int cp = Integer.parseInt(hex, 16);
            for (int i = 0; i < 4; i++) advance();
            return String.valueOf((char) cp);
        } catch (NumberFormatException e) {
            throw error("Invalid unicode escape: \\u" + hex);
        }
    }

    private void identifier(char first, int line, int col, boolean inTag) {
        StringBuilder sb = new StringBuilder();
        sb.append(first);
        while (!isAtEnd() && (isIdentPart(peek()) || (inTag && peek() == '-'))) {
            sb.append(advance());
        }
        String text = sb.toString();
        TokenType type = inTag ? TokenType.IDENTIFIER : keywords.getOrDefault(text, TokenType.IDENTIFIER);
        add(type, text, line, col);
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '/' && peekNext() == '/') {
                while (!isAtEnd() && peek() != '\n') advance();
            } else if (c == '/' && peekNext() == '*') {
                int startLine = line;
                int startCol = col;
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();
                if (isAtEnd()) throw error("Unterminated comment", startLine, startCol);
                advance();
                advance();
            } else {
                return;
            }
        }
    }

    private void add(TokenType type, String lexeme, int line, int col) {
        tokens.add(new Token(type, lexeme, line, col));
    }

    private boolean isAtEnd() {
        return pos >= source.length();
    }

    private char advance() {
        char c = source.charAt(pos++);
        if (c == '\n') {
            line++;
            col = 1;
        } else {
            col++;
        }
        return c;
    }

    private char peek() {
        return isAtEnd() ? '\0' : source.charAt(pos);
    }

    private char peekNext() {
        return (pos + 1 >= source.length()) ? '\0' : source.charAt(pos + 1);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(pos) != expected) return false;
        advance();
        return true;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    private LexerException error(String message) {
        return error(message, line, col);
    }

    private LexerException error(String message, int line, int col) {
        return new LexerException(message, SourceLocation.of(file, line, col));
    }
}
