package org.pragmatica.tinyc.parser;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.tinyc.ast.Node.ClassDecl;
import org.pragmatica.tinyc.ast.Node.Declaration;
import org.pragmatica.tinyc.ast.Node.Expression;
import org.pragmatica.tinyc.ast.Node.ExpressionStatement;
import org.pragmatica.tinyc.ast.Node.FunctionDecl;
import org.pragmatica.tinyc.ast.Node.Member;
import org.pragmatica.tinyc.ast.Node.Param;
import org.pragmatica.tinyc.ast.Node.Program;
import org.pragmatica.tinyc.ast.Node.Statement;
import org.pragmatica.tinyc.ast.Node.VarDecl;
import org.pragmatica.tinyc.error.CompileError;
import org.pragmatica.tinyc.error.ParseError;
import org.pragmatica.tinyc.lexer.Token;
import org.pragmatica.tinyc.lexer.TokenKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for tinyc.
 *
 * <p>One method per production, at most three tokens of lookahead, no
 * backtracking. Every production returns an {@link Either}; the first
 * failure is handed straight back to the caller and parsing stops there.
 */
public final class Parser {
    private static final String CLASS_KEYWORD = "class";
    private static final String ASSIGN = "=";

    private final List<Token> tokens;
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse a token list produced by the lexer into a program.
     *
     * @param tokens non-empty token list ending with {@link TokenKind#EOF}
     */
    public static Either<CompileError, Program> parse(List<Token> tokens) {
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token list must end with an EOF token");
        }
        return new Parser(tokens).parseProgram();
    }

    private Either<CompileError, Program> parseProgram() {
        var declarations = new ArrayList<Declaration>();

        while (!isAtEnd()) {
            var result = current().hasText(CLASS_KEYWORD)
                         ? parseClass().<Declaration>map(cls -> cls)
                         : parseFunction().<Declaration>map(fn -> fn);
            if (result.isLeft()) {
                return failed(result);
            }
            declarations.add(result.get());
        }
        return Either.right(new Program(declarations));
    }

    // FunctionDecl := ID ID '(' Params? ')' Block
    private Either<CompileError, FunctionDecl> parseFunction() {
        var returnType = expect(TokenKind.ID, "return type");
        if (returnType.isLeft()) {
            return failed(returnType);
        }
        var name = expect(TokenKind.ID, "function name");
        if (name.isLeft()) {
            return failed(name);
        }
        var open = expect(TokenKind.LPAREN);
        if (open.isLeft()) {
            return failed(open);
        }
        var params = parseParams();
        if (params.isLeft()) {
            return failed(params);
        }
        var close = expect(TokenKind.RPAREN);
        if (close.isLeft()) {
            return failed(close);
        }
        var body = parseBlock();
        if (body.isLeft()) {
            return failed(body);
        }
        return Either.right(new FunctionDecl(returnType.get().text(),
                                             name.get().text(),
                                             params.get(),
                                             body.get()));
    }

    // Params := Param (',' Param)*
    private Either<CompileError, List<Param>> parseParams() {
        var params = new ArrayList<Param>();
        if (current().is(TokenKind.RPAREN)) {
            return Either.right(params);
        }

        while (true) {
            var param = parseParam();
            if (param.isLeft()) {
                return failed(param);
            }
            params.add(param.get());

            if (!current().is(TokenKind.COMMA)) {
                break;
            }
            advance();
        }
        return Either.right(params);
    }

    // Param := ID ID
    private Either<CompileError, Param> parseParam() {
        var type = expect(TokenKind.ID, "parameter type");
        if (type.isLeft()) {
            return failed(type);
        }
        var name = expect(TokenKind.ID, "parameter name");
        if (name.isLeft()) {
            return failed(name);
        }
        return Either.right(new Param(type.get().text(), name.get().text()));
    }

    // Block := '{' Statement* '}'
    private Either<CompileError, List<Statement>> parseBlock() {
        var open = expect(TokenKind.LBRACE);
        if (open.isLeft()) {
            return failed(open);
        }

        var statements = new ArrayList<Statement>();
        while (!current().is(TokenKind.RBRACE) && !isAtEnd()) {
            var statement = parseStatement();
            if (statement.isLeft()) {
                return failed(statement);
            }
            statements.add(statement.get());
        }

        var close = expect(TokenKind.RBRACE);
        if (close.isLeft()) {
            return failed(close);
        }
        return Either.right(statements);
    }

    // Statement := VarDecl | Expression ';'
    private Either<CompileError, Statement> parseStatement() {
        if (startsDeclaration()) {
            return parseVarDecl().map(variable -> variable);
        }

        var expression = parseExpression();
        if (expression.isLeft()) {
            return failed(expression);
        }
        var end = expect(TokenKind.SEMICOLON);
        if (end.isLeft()) {
            return failed(end);
        }
        return Either.right(new ExpressionStatement(expression.get()));
    }

    // VarDecl := ID ID ('=' Expression)? ';'
    private Either<CompileError, VarDecl> parseVarDecl() {
        var type = expect(TokenKind.ID, "type");
        if (type.isLeft()) {
            return failed(type);
        }
        var name = expect(TokenKind.ID, "variable name");
        if (name.isLeft()) {
            return failed(name);
        }

        Option<Expression> defaultValue = Option.none();
        if (current().is(TokenKind.OP) && current().hasText(ASSIGN)) {
            advance();
            var expression = parseExpression();
            if (expression.isLeft()) {
                return failed(expression);
            }
            defaultValue = Option.some(expression.get());
        }

        var end = expect(TokenKind.SEMICOLON);
        if (end.isLeft()) {
            return failed(end);
        }
        return Either.right(new VarDecl(type.get().text(), name.get().text(), defaultValue));
    }

    // Expression := NUMBER | STRING | ID
    private Either<CompileError, Expression> parseExpression() {
        var token = current();
        if (token.is(TokenKind.NUMBER) || token.is(TokenKind.STRING) || token.is(TokenKind.ID)) {
            advance();
            return Either.right(new Expression(token.text()));
        }
        return Either.left(unexpected(token, "expression"));
    }

    // ClassDecl := 'class' ID (':' ID)? '{' Member* '}'
    private Either<CompileError, ClassDecl> parseClass() {
        var keyword = expectKeyword(CLASS_KEYWORD);
        if (keyword.isLeft()) {
            return failed(keyword);
        }
        var name = expect(TokenKind.ID, "class name");
        if (name.isLeft()) {
            return failed(name);
        }

        Option<String> parent = Option.none();
        if (current().is(TokenKind.COLON)) {
            advance();
            var parentName = expect(TokenKind.ID, "parent class name");
            if (parentName.isLeft()) {
                return failed(parentName);
            }
            parent = Option.some(parentName.get().text());
        }

        var open = expect(TokenKind.LBRACE);
        if (open.isLeft()) {
            return failed(open);
        }

        var members = new ArrayList<Member>();
        while (!current().is(TokenKind.RBRACE) && !isAtEnd()) {
            var member = parseMember();
            if (member.isLeft()) {
                return failed(member);
            }
            members.add(member.get());
        }

        var close = expect(TokenKind.RBRACE);
        if (close.isLeft()) {
            return failed(close);
        }
        return Either.right(new ClassDecl(name.get().text(), parent, members));
    }

    // Member := ID ID '(' ... (method) | ID ID ... (field)
    private Either<CompileError, Member> parseMember() {
        if (!startsDeclaration()) {
            return Either.left(unexpected(current(), "field or method declaration"));
        }
        if (peek(2).is(TokenKind.LPAREN)) {
            return parseFunction().map(method -> method);
        }
        return parseVarDecl().map(field -> field);
    }

    private boolean startsDeclaration() {
        return current().is(TokenKind.ID) && peek(1).is(TokenKind.ID);
    }

    // === Token access ===

    private boolean isAtEnd() {
        return current().is(TokenKind.EOF);
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token peek(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private Either<CompileError, Token> expect(TokenKind kind) {
        return expect(kind, kind.description());
    }

    private Either<CompileError, Token> expect(TokenKind kind, String expected) {
        var token = current();
        if (token.is(kind)) {
            advance();
            return Either.right(token);
        }
        return Either.left(unexpected(token, expected));
    }

    private Either<CompileError, Token> expectKeyword(String keyword) {
        var token = current();
        if (token.is(TokenKind.ID) && token.hasText(keyword)) {
            advance();
            return Either.right(token);
        }
        return Either.left(unexpected(token, "'" + keyword + "'"));
    }

    private static ParseError unexpected(Token token, String expected) {
        if (token.is(TokenKind.EOF)) {
            return new ParseError.UnexpectedEof(token.location(), expected);
        }
        return new ParseError.UnexpectedInput(token.location(), token.text().length(), token.describe(), expected);
    }

    private static <T> Either<CompileError, T> failed(Either<CompileError, ?> failure) {
        return Either.left(failure.getLeft());
    }
}
