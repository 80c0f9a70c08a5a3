package agentic.lexer;

public enum TokenType {
    // keywords
    IMPORT, EXPORT, INTERFACE, EXTENDS, CONST, LET, FUNCTION, RETURN, DEFAULT,

    // literals
    IDENTIFIER,
    STRING_LITERAL,
    NUMBER_LITERAL,
    TRUE, FALSE, NULL, UNDEFINED,

    // template literal pieces: `chunk ${expr} chunk`
    TEMPLATE_START,
    TEMPLATE_CHUNK,
    TEMPLATE_EXPR_START,
    TEMPLATE_END,

    // punctuation
    LPAREN, RPAREN,
    LBRACE, RBRACE,
    LBRACKET, RBRACKET,
    COLON, SEMICOLON, COMMA, DOT,
    SPREAD,          // ...
    QUESTION,        // ?
    ARROW,           // =>
    ASSIGN,          // =
    PIPE,            // |
    STAR,            // *
    SLASH,           // /
    MINUS,           // -

    // operators
    NOT,             // !
    AND,             // &&
    OR,              // ||
    STRICT_EQ,       // ===
    STRICT_NEQ,      // !==
    EQ,              // ==
    NEQ,             // !=
    LT, LE, GT, GE,

    // jsx
    JSX_TAG_OPEN,        // '<' that starts an element or fragment
    JSX_CLOSE_TAG_OPEN,  // '</'
    JSX_TAG_END,         // '>' that ends a tag
    JSX_SELF_CLOSE,      // '/>'
    JSX_TEXT,

    EOF
}
