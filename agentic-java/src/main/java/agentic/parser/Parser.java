package agentic.parser;

import agentic.ast.Module;
import agentic.ast.decl.*;
import agentic.ast.expr.*;
import agentic.ast.stmt.BlockStmt;
import agentic.ast.stmt.ExprStmt;
import agentic.ast.stmt.ReturnStmt;
import agentic.ast.stmt.Stmt;
import agentic.ast.stmt.VarDeclStmt;
import agentic.ast.type.*;
import agentic.diag.SourceLocation;
import agentic.lexer.Token;
import agentic.lexer.TokenType;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

public final class Parser {
    private final List<Token> tokens;
    private final Path file;
    private int pos = 0;

    // tokens that may appear between '<' and '>' of a type argument list in expression position
    private static final Set<TokenType> TYPE_ARG_TOKENS = EnumSet.of(
            TokenType.IDENTIFIER, TokenType.DOT, TokenType.COMMA, TokenType.LBRACKET, TokenType.RBRACKET,
            TokenType.PIPE, TokenType.STRING_LITERAL, TokenType.NUMBER_LITERAL, TokenType.LBRACE,
            TokenType.RBRACE, TokenType.COLON, TokenType.SEMICOLON, TokenType.QUESTION,
            TokenType.NULL, TokenType.UNDEFINED, TokenType.TRUE, TokenType.FALSE
    );

    private static final Set<TokenType> KEYWORDS = EnumSet.of(
            TokenType.IMPORT, TokenType.EXPORT, TokenType.INTERFACE, TokenType.EXTENDS, TokenType.CONST,
            TokenType.LET, TokenType.FUNCTION, TokenType.RETURN, TokenType.DEFAULT,
            TokenType.TRUE, TokenType.FALSE, TokenType.NULL, TokenType.UNDEFINED
    );

    public Parser(List<Token> tokens) {
        this(tokens, null);
    }

    public Parser(List<Token> tokens, Path file) {
        this.tokens = tokens;
        this.file = file;
    }

    // ---------- entry ----------
    public Module parseModule() {
        List<Decl> decls = new ArrayList<>();
        while (!check(TokenType.EOF)) {
            if (match(TokenType.SEMICOLON)) continue;
            decls.add(parseTopLevel());
        }
        consume(TokenType.EOF, "Expected EOF");
        return new Module(file, decls);
    }

    private Decl parseTopLevel() {
        if (match(TokenType.IMPORT)) return parseImport();
        if (match(TokenType.EXPORT)) return parseExport();
        if (check(TokenType.INTERFACE)) return parseInterface(false);
        if (checkContextual("type") && checkNext(TokenType.IDENTIFIER)) return parseTypeAlias(false);
        if (check(TokenType.CONST) || check(TokenType.LET)) return parseVarDecl(false);
        if (check(TokenType.FUNCTION)) return parseFunctionDecl(false, false);
        throw error(peek(), "Unsupported top-level statement");
    }

    // ---------- import / export ----------
    private ImportDecl parseImport() {
        SourceLocation loc = loc(previous());

        // side-effect import: import './x'
        if (check(TokenType.STRING_LITERAL)) {
            String source = advance().lexeme();
            match(TokenType.SEMICOLON);
            return new ImportDecl(source, null, null, List.of(), false, loc);
        }

        boolean typeOnly = false;
        if (checkContextual("type") && (checkNext(TokenType.LBRACE) || checkNext(TokenType.IDENTIFIER)
                && !"from".equals(tokens.get(pos + 1).lexeme()))) {
            advance();
            typeOnly = true;
        }

        String defaultBinding = null;
        String namespaceBinding = null;
        List<Specifier> specifiers = List.of();

        if (check(TokenType.IDENTIFIER)) {
            defaultBinding = advance().lexeme();
            if (!match(TokenType.COMMA)) {
                return finishImport(defaultBinding, null, specifiers, typeOnly, loc);
            }
        }
        if (match(TokenType.STAR)) {
            expectContextual("as", "Expected 'as' after '*'");
            namespaceBinding = consume(TokenType.IDENTIFIER, "Expected namespace name").lexeme();
        } else if (check(TokenType.LBRACE)) {
            specifiers = parseSpecifiers();
        } else if (defaultBinding != null || typeOnly) {
            throw error(peek(), "Expected import specifiers");
        }
        return finishImport(defaultBinding, namespaceBinding, specifiers, typeOnly, loc);
    }

    private ImportDecl finishImport(String defaultBinding, String namespaceBinding, List<Specifier> specifiers,
                                    boolean typeOnly, SourceLocation loc) {
        expectContextual("from", "Expected 'from'");
        String source = consume(TokenType.STRING_LITERAL, "Expected module path").lexeme();
        match(TokenType.SEMICOLON);
        return new ImportDecl(source, defaultBinding, namespaceBinding, specifiers, typeOnly, loc);
    }

    private List<Specifier> parseSpecifiers() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<Specifier> specs = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            boolean typeOnly = false;
            if (checkContextual("type") && checkNext(TokenType.IDENTIFIER)) {
                advance();
                typeOnly = true;
            }
            String name = consumeName("Expected specifier name");
            String alias = name;
            if (checkContextual("as")) {
                advance();
                alias = consumeName("Expected alias after 'as'");
            }
            specs.add(new Specifier(name, alias, typeOnly));
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RBRACE, "Expected '}' after specifiers");
        return specs;
    }

    private Decl parseExport() {
        SourceLocation loc = loc(previous());

        if (match(TokenType.DEFAULT)) {
            if (check(TokenType.FUNCTION)) return parseFunctionDecl(true, true);
            Expr value = parseExpr();
            match(TokenType.SEMICOLON);
            return new ExportDefaultDecl(value, loc);
        }
        if (match(TokenType.STAR)) {
            if (checkContextual("as")) {
                throw error(peek(), "'export * as' is not supported");
            }
            expectContextual("from", "Expected 'from' after 'export *'");
            String source = consume(TokenType.STRING_LITERAL, "Expected module path").lexeme();
            match(TokenType.SEMICOLON);
            return new ExportFromDecl(source, List.of(), true, loc);
        }
        if (checkContextual("type") && checkNext(TokenType.LBRACE)) {
            advance();
        }
        if (check(TokenType.LBRACE)) {
            List<Specifier> specs = parseSpecifiers();
            if (checkContextual("from")) {
                advance();
                String source = consume(TokenType.STRING_LITERAL, "Expected module path").lexeme();
                match(TokenType.SEMICOLON);
                return new ExportFromDecl(source, specs, false, loc);
            }
            match(TokenType.SEMICOLON);
            return new ExportListDecl(specs, loc);
        }
        if (check(TokenType.INTERFACE)) return parseInterface(true);
        if (checkContextual("type")) return parseTypeAlias(true);
        if (check(TokenType.CONST) || check(TokenType.LET)) return parseVarDecl(true);
        if (check(TokenType.FUNCTION)) return parseFunctionDecl(true, false);
        throw error(peek(), "Unsupported export");
    }

    // ---------- types ----------
    private InterfaceDecl parseInterface(boolean exported) {
        Token kw = consume(TokenType.INTERFACE, "Expected 'interface'");
        String name = consume(TokenType.IDENTIFIER, "Expected interface name").lexeme();
        skipTypeParameters();

        List<String> parents = new ArrayList<>();
        if (match(TokenType.EXTENDS)) {
            do {
                parents.add(parseType().text());
            } while (match(TokenType.COMMA));
        }
        List<FieldDecl> fields = parseTypeMembers();
        return new InterfaceDecl(name, exported, parents, fields, loc(kw));
    }

    private TypeAliasDecl parseTypeAlias(boolean exported) {
        Token kw = advance(); // 'type'
        String name = consume(TokenType.IDENTIFIER, "Expected type name").lexeme();
        skipTypeParameters();
        consume(TokenType.ASSIGN, "Expected '=' in type alias");
        TypeRef type = parseType();
        match(TokenType.SEMICOLON);
        return new TypeAliasDecl(name, exported, type, loc(kw));
    }

    private List<FieldDecl> parseTypeMembers() {
        consume(TokenType.LBRACE, "Expected '{'");
        List<FieldDecl> fields = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (checkContextual("readonly") && !checkNext(TokenType.COLON) && !checkNext(TokenType.QUESTION)) {
                advance();
            }
            if (match(TokenType.LBRACKET)) {
                // index signature: [key: string]: T
                while (!check(TokenType.RBRACKET) && !check(TokenType.EOF)) advance();
                consume(TokenType.RBRACKET, "Expected ']'");
                consume(TokenType.COLON, "Expected ':' after index signature");
                parseType();
            } else {
                Token nameTok = peek();
                String name = nameTok.type() == TokenType.STRING_LITERAL ? advance().lexeme()
                        : consumeName("Expected property name");
                boolean optional = match(TokenType.QUESTION);
                consume(TokenType.COLON, "Expected ':' after property name");
                fields.add(new FieldDecl(name, parseType(), optional, loc(nameTok)));
            }
            if (!match(TokenType.SEMICOLON)) match(TokenType.COMMA);
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return fields;
    }

    private TypeRef parseType() {
        match(TokenType.PIPE); // leading '|'
        List<TypeRef> options = new ArrayList<>();
        options.add(parseArrayType());
        while (match(TokenType.PIPE)) {
            options.add(parseArrayType());
        }
        return options.size() == 1 ? options.get(0) : new UnionTypeRef(options);
    }

    private TypeRef parseArrayType() {
        TypeRef base = parsePrimaryType();
        while (check(TokenType.LBRACKET) && checkNext(TokenType.RBRACKET)) {
            advance();
            advance();
            base = new ArrayTypeRef(base);
        }
        return base;
    }

    private TypeRef parsePrimaryType() {
        if (match(TokenType.STRING_LITERAL)) return new LiteralTypeRef(previous().lexeme(), true);
        if (match(TokenType.NUMBER_LITERAL)) return new LiteralTypeRef(previous().lexeme(), false);
        if (match(TokenType.TRUE, TokenType.FALSE)) return new LiteralTypeRef(previous().lexeme(), false);
        if (match(TokenType.NULL, TokenType.UNDEFINED)) return new NamedTypeRef(previous().lexeme());
        if (check(TokenType.LBRACE)) return new ObjectTypeRef(parseTypeMembers());
        if (match(TokenType.LPAREN)) {
            if (isFunctionTypeAhead()) {
                skipBalanced(TokenType.LPAREN, TokenType.RPAREN);
                consume(TokenType.ARROW, "Expected '=>' in function type");
                parseType();
                return new NamedTypeRef("Function");
            }
            TypeRef inner = parseType();
            consume(TokenType.RPAREN, "Expected ')'");
            return inner;
        }
        if (match(TokenType.LBRACKET)) {
            List<TypeRef> elems = new ArrayList<>();
            while (!check(TokenType.RBRACKET)) {
                elems.add(parseType());
                if (!match(TokenType.COMMA)) break;
            }
            consume(TokenType.RBRACKET, "Expected ']'");
            return new NamedTypeRef("tuple", elems);
        }
        if (checkContextual("typeof") || checkContextual("keyof")) {
            String op = advance().lexeme();
            return new NamedTypeRef(op + " " + parsePrimaryType().text());
        }

        StringBuilder name = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected type").lexeme());
        while (match(TokenType.DOT)) {
            name.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.'").lexeme());
        }
        List<TypeRef> args = List.of();
        if (match(TokenType.LT)) {
            args = new ArrayList<>();
            do {
                args.add(parseType());
            } while (match(TokenType.COMMA));
            consume(TokenType.GT, "Expected '>' after type arguments");
        }
        return new NamedTypeRef(name.toString(), args);
    }

    // '(' already consumed
    private boolean isFunctionTypeAhead() {
        if (check(TokenType.RPAREN)) return true;
        return check(TokenType.IDENTIFIER) && (checkNext(TokenType.COLON) || checkNext(TokenType.QUESTION));
    }

    private void skipTypeParameters() {
        if (match(TokenType.LT)) {
            int depth = 1;
            while (depth > 0 && !check(TokenType.EOF)) {
                if (match(TokenType.LT)) depth++;
                else if (match(TokenType.GT)) depth--;
                else advance();
            }
        }
    }

    // called after the opening token was consumed
    private void skipBalanced(TokenType open, TokenType close) {
        int depth = 1;
        while (depth > 0 && !check(TokenType.EOF)) {
            if (match(open)) depth++;
            else if (match(close)) depth--;
            else advance();
        }
    }

    // ---------- declarations ----------
    private VarDecl parseVarDecl(boolean exported) {
        Token kw = advance(); // const / let
        if (check(TokenType.LBRACE) || check(TokenType.LBRACKET)) {
            throw error(peek(), "Destructuring declarations are not supported");
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        TypeRef type = null;
        if (match(TokenType.COLON)) {
            type = parseType();
        }
        Expr init = null;
        if (match(TokenType.ASSIGN)) {
            init = parseExpr();
        }
        if (check(TokenType.COMMA)) {
            throw error(peek(), "Multiple declarators are not supported");
        }
        match(TokenType.SEMICOLON);
        return new VarDecl(name.lexeme(), exported, kw.type() == TokenType.CONST, type, init, loc(name));
    }

    private FunctionDecl parseFunctionDecl(boolean exported, boolean isDefault) {
        Token kw = consume(TokenType.FUNCTION, "Expected 'function'");
        String name = check(TokenType.IDENTIFIER) ? advance().lexeme() : "default";
        skipTypeParameters();
        consume(TokenType.LPAREN, "Expected '(' after function name");
        List<FunctionDecl.Param> params = parseParamsOpt();
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        if (match(TokenType.COLON)) {
            parseType();
        }
        BlockStmt body = parseBlock();
        return new FunctionDecl(name, exported, isDefault, params, body, loc(kw));
    }

    private List<FunctionDecl.Param> parseParamsOpt() {
        if (check(TokenType.RPAREN)) return List.of();
        List<FunctionDecl.Param> ps = new ArrayList<>();
        do {
            if (check(TokenType.LBRACE) || check(TokenType.LBRACKET)) {
                throw error(peek(), "Destructured parameters are not supported");
            }
            Token n = consume(TokenType.IDENTIFIER, "Expected parameter name");
            match(TokenType.QUESTION);
            TypeRef t = null;
            if (match(TokenType.COLON)) {
                t = parseType();
            }
            if (match(TokenType.ASSIGN)) {
                parseExpr(); // default values are not evaluated
            }
            ps.add(new FunctionDecl.Param(n.lexeme(), t));
        } while (match(TokenType.COMMA));
        return ps;
    }

    // ---------- block / statements ----------
    private BlockStmt parseBlock() {
        Token open = consume(TokenType.LBRACE, "Expected '{'");
        List<Stmt> stmts = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            if (match(TokenType.SEMICOLON)) continue;
            stmts.add(parseStmt());
        }
        consume(TokenType.RBRACE, "Expected '}'");
        return new BlockStmt(stmts, loc(open));
    }

    private Stmt parseStmt() {
        if (check(TokenType.LBRACE)) return parseBlock();
        if (check(TokenType.CONST) || check(TokenType.LET)) return new VarDeclStmt(parseVarDecl(false));
        if (match(TokenType.RETURN)) return parseReturn();

        Token start = peek();
        Expr e = parseExpr();
        match(TokenType.SEMICOLON);
        return new ExprStmt(e, loc(start));
    }

    private ReturnStmt parseReturn() {
        SourceLocation loc = loc(previous());
        if (match(TokenType.SEMICOLON) || check(TokenType.RBRACE)) {
            return new ReturnStmt(null, loc);
        }
        Expr value = parseExpr();
        match(TokenType.SEMICOLON);
        return new ReturnStmt(value, loc);
    }

    // ---------- expressions (precedence climbing) ----------
    private Expr parseExpr() {
        Expr e = parseOr();
        // type assertions are erased
        while (checkContextual("as") || checkContextual("satisfies")) {
            advance();
            parseType();
        }
        return e;
    }

    private Expr parseOr() {
        Expr e = parseAnd();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr r = parseAnd();
            e = new BinaryExpr(e, BinaryExpr.Operator.OR, r, loc(op));
        }
        return e;
    }

    private Expr parseAnd() {
        Expr e = parseEquality();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr r = parseEquality();
            e = new BinaryExpr(e, BinaryExpr.Operator.AND, r, loc(op));
        }
        return e;
    }

    private Expr parseEquality() {
        Expr e = parseCompare();
        while (match(TokenType.STRICT_EQ, TokenType.STRICT_NEQ, TokenType.EQ, TokenType.NEQ)) {
            Token op = previous();
            Expr r = parseCompare();
            e = new BinaryExpr(e, toBinOp(op.type()), r, loc(op));
        }
        return e;
    }

    private Expr parseCompare() {
        Expr e = parseUnary();
        while (match(TokenType.LT, TokenType.LE, TokenType.GT, TokenType.GE)) {
            Token op = previous();
            Expr r = parseUnary();
            e = new BinaryExpr(e, toBinOp(op.type()), r, loc(op));
        }
        return e;
    }

    private Expr parseUnary() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            return new UnaryExpr(UnaryExpr.Operator.NOT, parseUnary(), loc(op));
        }
        if (match(TokenType.MINUS)) {
            Token op = previous();
            Expr operand = parseUnary();
            if (operand instanceof NumberLiteral n) {
                return new NumberLiteral(-n.value(), loc(op));
            }
            return new UnaryExpr(UnaryExpr.Operator.NEG, operand, loc(op));
        }
        return parsePostfix();
    }

    private Expr parsePostfix() {
        Expr e = parsePrimary();
        while (true) {
            if (check(TokenType.LT) && typeArgumentsThenCallAhead()) {
                Token lt = advance();
                List<TypeRef> typeArgs = new ArrayList<>();
                do {
                    typeArgs.add(parseType());
                } while (match(TokenType.COMMA));
                consume(TokenType.GT, "Expected '>' after type arguments");
                consume(TokenType.LPAREN, "Expected '(' after type arguments");
                e = new CallExpr(e, typeArgs, parseArguments(), loc(lt));
                continue;
            }
            if (match(TokenType.LPAREN)) {
                Token open = previous();
                e = new CallExpr(e, List.of(), parseArguments(), loc(open));
                continue;
            }
            if (match(TokenType.LBRACKET)) {
                Token open = previous();
                Expr idx = parseExpr();
                consume(TokenType.RBRACKET, "Expected ']'");
                e = new IndexExpr(e, idx, loc(open));
                continue;
            }
            if (match(TokenType.DOT)) {
                Token dot = previous();
                String name = consumeName("Expected property name after '.'");
                e = new MemberExpr(e, name, loc(dot));
                continue;
            }
            if (check(TokenType.NOT) && !checkNext(TokenType.ASSIGN) && isNonNullAssertion()) {
                advance(); // x! non-null assertion is erased
                continue;
            }
            break;
        }
        return e;
    }

    // '(' already consumed
    private List<Expr> parseArguments() {
        List<Expr> args = new ArrayList<>();
        while (!check(TokenType.RPAREN)) {
            args.add(parseExpr());
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RPAREN, "Expected ')'");
        return args;
    }

    private boolean isNonNullAssertion() {
        if (pos + 1 >= tokens.size()) return false;
        TokenType next = tokens.get(pos + 1).type();
        return next == TokenType.DOT || next == TokenType.RPAREN || next == TokenType.SEMICOLON
                || next == TokenType.COMMA || next == TokenType.RBRACE || next == TokenType.RBRACKET;
    }

    /** Scans ahead from '<' for a balanced type argument list directly followed by '('. */
    private boolean typeArgumentsThenCallAhead() {
        int depth = 0;
        for (int i = pos; i < tokens.size(); i++) {
            TokenType t = tokens.get(i).type();
            if (t == TokenType.LT) {
                depth++;
            } else if (t == TokenType.GT) {
                depth--;
                if (depth == 0) {
                    return i + 1 < tokens.size() && tokens.get(i + 1).type() == TokenType.LPAREN;
                }
            } else if (!TYPE_ARG_TOKENS.contains(t)) {
                return false;
            }
        }
        return false;
    }

    private Expr parsePrimary() {
        if (match(TokenType.STRING_LITERAL)) return new StringLiteral(previous().lexeme(), loc(previous()));
        if (match(TokenType.NUMBER_LITERAL)) {
            Token t = previous();
            return new NumberLiteral(Double.parseDouble(t.lexeme()), loc(t));
        }
        if (match(TokenType.TRUE)) return new BoolLiteral(true, loc(previous()));
        if (match(TokenType.FALSE)) return new BoolLiteral(false, loc(previous()));
        if (match(TokenType.NULL, TokenType.UNDEFINED)) return new NullLiteral(loc(previous()));
        if (check(TokenType.TEMPLATE_START)) return parseTemplate();
        if (check(TokenType.LBRACE)) return parseObjectLiteral();
        if (check(TokenType.LBRACKET)) return parseArrayLiteral();
        if (check(TokenType.JSX_TAG_OPEN)) return parseJsx();

        if (check(TokenType.IDENTIFIER) && checkNext(TokenType.ARROW)) {
            Token p = advance();
            advance(); // =>
            return finishArrow(List.of(new FunctionDecl.Param(p.lexeme(), null)), loc(p));
        }
        if (match(TokenType.IDENTIFIER)) return new Identifier(previous().lexeme(), loc(previous()));

        if (check(TokenType.LPAREN)) {
            Token open = advance();
            if (isArrowAhead()) {
                List<FunctionDecl.Param> params = parseParamsOpt();
                consume(TokenType.RPAREN, "Expected ')' after parameters");
                if (match(TokenType.COLON)) {
                    parseType();
                }
                consume(TokenType.ARROW, "Expected '=>'");
                return finishArrow(params, loc(open));
            }
            Expr e = parseExpr();
            consume(TokenType.RPAREN, "Expected ')'");
            return e;
        }
        throw error(peek(), "Expected expression");
    }

    // '(' already consumed; looks past the matching ')' for '=>' or a return type annotation
    private boolean isArrowAhead() {
        int depth = 1;
        for (int i = pos; i < tokens.size(); i++) {
            TokenType t = tokens.get(i).type();
            if (t == TokenType.LPAREN) depth++;
            else if (t == TokenType.RPAREN) {
                depth--;
                if (depth == 0) {
                    if (i + 1 >= tokens.size()) return false;
                    TokenType next = tokens.get(i + 1).type();
                    return next == TokenType.ARROW || next == TokenType.COLON;
                }
            } else if (t == TokenType.EOF) {
                return false;
            }
        }
        return false;
    }

    private ArrowFunction finishArrow(List<FunctionDecl.Param> params, SourceLocation loc) {
        if (check(TokenType.LBRACE)) {
            return new ArrowFunction(params, null, parseBlock(), loc);
        }
        return new ArrowFunction(params, parseExpr(), null, loc);
    }

    private TemplateLiteral parseTemplate() {
        Token start = consume(TokenType.TEMPLATE_START, "Expected '`'");
        List<String> quasis = new ArrayList<>();
        List<Expr> exprs = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        while (!match(TokenType.TEMPLATE_END)) {
            if (match(TokenType.TEMPLATE_CHUNK)) {
                current.append(previous().lexeme());
            } else if (match(TokenType.TEMPLATE_EXPR_START)) {
                quasis.add(current.toString());
                current.setLength(0);
                exprs.add(parseExpr());
                consume(TokenType.RBRACE, "Expected '}' to close template expression");
            } else {
                throw error(peek(), "Unterminated template literal");
            }
        }
        quasis.add(current.toString());
        return new TemplateLiteral(quasis, exprs, loc(start));
    }

    private ObjectLiteral parseObjectLiteral() {
        Token open = consume(TokenType.LBRACE, "Expected '{'");
        List<ObjectLiteral.Member> members = new ArrayList<>();
        while (!check(TokenType.RBRACE)) {
            if (match(TokenType.SPREAD)) {
                Token spread = previous();
                members.add(new ObjectLiteral.Spread(parseExpr(), loc(spread)));
            } else {
                Token keyTok = peek();
                String key;
                if (match(TokenType.STRING_LITERAL, TokenType.NUMBER_LITERAL)) {
                    key = previous().lexeme();
                } else if (check(TokenType.LBRACKET)) {
                    throw error(peek(), "Computed property names are not supported");
                } else {
                    key = consumeName("Expected property name");
                }
                if (match(TokenType.COLON)) {
                    members.add(new ObjectLiteral.KeyValue(key, parseExpr(), loc(keyTok)));
                } else if (keyTok.type() == TokenType.IDENTIFIER) {
                    members.add(new ObjectLiteral.KeyValue(key, new Identifier(key, loc(keyTok)), loc(keyTok)));
                } else {
                    throw error(peek(), "Expected ':' after property name");
                }
            }
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RBRACE, "Expected '}' after object literal");
        return new ObjectLiteral(members, loc(open));
    }

    private ArrayLiteral parseArrayLiteral() {
        Token open = consume(TokenType.LBRACKET, "Expected '['");
        List<Expr> elems = new ArrayList<>();
        while (!check(TokenType.RBRACKET)) {
            elems.add(parseExpr());
            if (!match(TokenType.COMMA)) break;
        }
        consume(TokenType.RBRACKET, "Expected ']'");
        return new ArrayLiteral(elems, loc(open));
    }

    // ---------- jsx ----------
    private Expr parseJsx() {
        Token open = consume(TokenType.JSX_TAG_OPEN, "Expected '<'");
        if (match(TokenType.JSX_TAG_END)) {
            List<Expr> children = parseJsxChildren();
            consume(TokenType.JSX_CLOSE_TAG_OPEN, "Expected '</>'");
            consume(TokenType.JSX_TAG_END, "Expected '>' to close fragment");
            return new JsxFragment(children, loc(open));
        }

        String name = parseJsxName();
        List<TypeRef> typeArgs = new ArrayList<>();
        if (match(TokenType.LT)) {
            do {
                typeArgs.add(parseType());
            } while (match(TokenType.COMMA));
            consume(TokenType.GT, "Expected '>' after type arguments");
        }

        List<JsxAttribute> attributes = new ArrayList<>();
        while (!check(TokenType.JSX_TAG_END) && !check(TokenType.JSX_SELF_CLOSE)) {
            attributes.add(parseJsxAttribute());
        }

        if (match(TokenType.JSX_SELF_CLOSE)) {
            return new JsxElement(name, typeArgs, attributes, List.of(), true, loc(open));
        }
        consume(TokenType.JSX_TAG_END, "Expected '>'");

        List<Expr> children = parseJsxChildren();
        Token close = consume(TokenType.JSX_CLOSE_TAG_OPEN, "Expected closing tag for <" + name + ">");
        String closeName = check(TokenType.JSX_TAG_END) ? "" : parseJsxName();
        if (!closeName.equals(name)) {
            throw error(close, "Mismatched closing tag: expected </" + name + ">");
        }
        consume(TokenType.JSX_TAG_END, "Expected '>'");
        return new JsxElement(name, typeArgs, attributes, children, false, loc(open));
    }

    private String parseJsxName() {
        StringBuilder sb = new StringBuilder(consume(TokenType.IDENTIFIER, "Expected element name").lexeme());
        while (match(TokenType.DOT)) {
            sb.append('.').append(consume(TokenType.IDENTIFIER, "Expected name after '.'").lexeme());
        }
        return sb.toString();
    }

    private JsxAttribute parseJsxAttribute() {
        if (match(TokenType.LBRACE)) {
            Token open = previous();
            consume(TokenType.SPREAD, "Expected '...' in spread attribute");
            Expr arg = parseExpr();
            consume(TokenType.RBRACE, "Expected '}' after spread attribute");
            return new JsxAttribute.Spread(arg, loc(open));
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected attribute name");
        if (!match(TokenType.ASSIGN)) {
            return new JsxAttribute.Named(name.lexeme(), null, loc(name));
        }
        if (match(TokenType.STRING_LITERAL)) {
            return new JsxAttribute.Named(name.lexeme(), new StringLiteral(previous().lexeme(), loc(previous())), loc(name));
        }
        consume(TokenType.LBRACE, "Expected string or '{' for attribute value");
        Expr value = parseExpr();
        consume(TokenType.RBRACE, "Expected '}' after attribute value");
        return new JsxAttribute.Named(name.lexeme(), value, loc(name));
    }

    private List<Expr> parseJsxChildren() {
        List<Expr> children = new ArrayList<>();
        while (!check(TokenType.JSX_CLOSE_TAG_OPEN) && !check(TokenType.EOF)) {
            if (match(TokenType.JSX_TEXT)) {
                children.add(new JsxText(previous().lexeme(), loc(previous())));
            } else if (match(TokenType.LBRACE)) {
                Token open = previous();
                if (match(TokenType.RBRACE)) {
                    children.add(new JsxExpressionContainer(null, loc(open)));
                    continue;
                }
                Expr e = parseExpr();
                consume(TokenType.RBRACE, "Expected '}' after JSX expression");
                children.add(new JsxExpressionContainer(e, loc(open)));
            } else if (check(TokenType.JSX_TAG_OPEN)) {
                children.add(parseJsx());
            } else {
                throw error(peek(), "Unexpected token in JSX children");
            }
        }
        return children;
    }

    // ---------- helpers ----------
    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw error(peek(), msg);
    }

    /** Identifier or keyword used as a name (property keys, member access, specifiers). */
    private String consumeName(String msg) {
        Token t = peek();
        if (t.type() == TokenType.IDENTIFIER || KEYWORDS.contains(t.type())) {
            return advance().lexeme();
        }
        throw error(t, msg);
    }

    private boolean checkContextual(String word) {
        return check(TokenType.IDENTIFIER) && peek().lexeme().equals(word);
    }

    private void expectContextual(String word, String msg) {
        if (!checkContextual(word)) throw error(peek(), msg);
        advance();
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private boolean checkNext(TokenType t) {
        if (pos + 1 >= tokens.size()) return false;
        return tokens.get(pos + 1).type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }

    private SourceLocation loc(Token t) {
        return SourceLocation.of(file, t.line(), t.column());
    }

    private ParseException error(Token at, String msg) {
        return new ParseException(msg + " (got " + at.type() + " '" + at.lexeme() + "')", loc(at));
    }

    private static BinaryExpr.Operator toBinOp(TokenType t) {
        return switch (t) {
            case STRICT_EQ, EQ -> BinaryExpr.Operator.EQ;
            case STRICT_NEQ, NEQ -> BinaryExpr.Operator.NE;
            case LT -> BinaryExpr.Operator.LT;
            case GT -> BinaryExpr.Operator.GT;
            case LE -> BinaryExpr.Operator.LE;
            case GE -> BinaryExpr.Operator.GE;
            case AND -> BinaryExpr.Operator.AND;
            case OR -> BinaryExpr.Operator.OR;
            default -> throw new IllegalArgumentException("Not a binary operator: " + t);
        };
    }
}
