package com.rlang.script.parser;

import java.util.ArrayList;
import java.util.List;

import com.rlang.script.parser.Expr.Assign;
import com.rlang.script.parser.Expr.Binary;
import com.rlang.script.parser.Expr.Call;
import com.rlang.script.parser.Expr.Grouping;
import com.rlang.script.parser.Expr.Literal;
import com.rlang.script.parser.Expr.Logical;
import com.rlang.script.parser.Expr.Unary;
import com.rlang.script.parser.Expr.Variable;
import com.rlang.script.parser.Statement.Block;
import com.rlang.script.parser.Statement.ExprStmt;
import com.rlang.script.parser.Statement.FunctionStmt;
import com.rlang.script.parser.Statement.Stmt;
import com.rlang.script.parser.Statement.While;

public class Parser {
    static final int MAX_PARAMS = 255;

    private final List<Token> tokens;
    private int current = 0;
    private int functionDepth = 0;

    public Parser(List<Token> tokens) { this.tokens = tokens; }

    public List<Stmt> parse() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!isAtEnd()) {
            statements.add(declaration());
        }
        return statements;
    }

    private Stmt declaration() {
        if (check(TokenType.FN) && checkNext(TokenType.IDENTIFIER)) {
            advance();
            return functionDeclaration();
        }
        if (match(TokenType.VAR)) return varDeclaration();
        return statement();
    }

    private Stmt functionDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect function name.");
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name.");
        List<Token> params = parameters();
        consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
        return new FunctionStmt(name, params, functionBody());
    }

    private List<Token> parameters() {
        List<Token> params = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (params.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many parameters (max " + MAX_PARAMS + ").");
                }
                params.add(consume(TokenType.IDENTIFIER, "Expect parameter name."));
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after parameters.");
        return params;
    }

    private List<Stmt> functionBody() {
        functionDepth++;
        try {
            return block();
        } finally {
            functionDepth--;
        }
    }

    private Stmt varDeclaration() {
        Token name = consume(TokenType.IDENTIFIER, "Expect variable name.");
        Expr.ExprInterface initializer = null;
        if (match(TokenType.EQUAL)) {
            initializer = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after variable declaration.");
        return new Statement.VarStmt(name, initializer);
    }

    private Stmt statement() {
        if (match(TokenType.PRINT)) return printStatement();
        if (match(TokenType.IF)) return ifStatement();
        if (match(TokenType.WHILE)) return whileStatement();
        if (match(TokenType.FOR)) return forStatement();
        if (match(TokenType.RETURN)) return returnStatement();
        if (match(TokenType.LEFT_BRACE)) return new Block(block());
        return exprStatement();
    }

    private Stmt printStatement() {
        Expr.ExprInterface value = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after value.");
        return new Statement.PrintStmt(value);
    }

    private Stmt returnStatement() {
        Token keyword = previous();
        if (functionDepth <= 0) {
            throw error(keyword, "Can't return from top-level code.");
        }
        Expr.ExprInterface value = null;
        if (!check(TokenType.SEMICOLON)) {
            value = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after return value.");
        return new Statement.ReturnStmt(keyword, value);
    }

    private Stmt ifStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'if'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after if condition.");
        Stmt thenBranch = statement();
        Stmt elseBranch = null;
        if (match(TokenType.ELSE)) elseBranch = statement();
        return new Statement.If(condition, thenBranch, elseBranch);
    }

    private Stmt whileStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'while'.");
        Expr.ExprInterface condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expect ')' after condition.");
        return new While(condition, statement());
    }

    // for (init; cond; inc) body
    // => { init; while (cond) { body; inc; } }
    private Stmt forStatement() {
        consume(TokenType.LEFT_PAREN, "Expect '(' after 'for'.");

        Stmt initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (match(TokenType.VAR)) {
            initializer = varDeclaration();
        } else {
            initializer = exprStatement();
        }

        Expr.ExprInterface condition = null;
        if (!check(TokenType.SEMICOLON)) {
            condition = expression();
        }
        consume(TokenType.SEMICOLON, "Expect ';' after loop condition.");

        Expr.ExprInterface increment = null;
        if (!check(TokenType.RIGHT_PAREN)) {
            increment = expression();
        }
        consume(TokenType.RIGHT_PAREN, "Expect ')' after for clauses.");

        Stmt body = statement();

        if (increment != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(body);
            list.add(new ExprStmt(increment));
            body = new Block(list);
        }

        if (condition == null) condition = new Literal(Boolean.TRUE);
        body = new While(condition, body);

        if (initializer != null) {
            List<Stmt> list = new ArrayList<>();
            list.add(initializer);
            list.add(body);
            body = new Block(list);
        }

        return body;
    }

    private List<Stmt> block() {
        List<Stmt> statements = new ArrayList<Stmt>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        consume(TokenType.RIGHT_BRACE, "Expect '}' after block.");
        return statements;
    }

    private Stmt exprStatement() {
        Expr.ExprInterface expr = expression();
        consume(TokenType.SEMICOLON, "Expect ';' after expression.");
        return new ExprStmt(expr);
    }

    private Expr.ExprInterface expression() { return assignment(); }

    private Expr.ExprInterface assignment() {
        Expr.ExprInterface expr = or();
        if (match(TokenType.EQUAL)) {
            Token equals = previous();
            Expr.ExprInterface value = assignment();
            if (expr instanceof Variable) {
                Token name = ((Variable) expr).name;
                return new Assign(name, value);
            }
            throw error(equals, "Invalid assignment target.");
        }
        return expr;
    }

    private Expr.ExprInterface or() {
        Expr.ExprInterface expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            Expr.ExprInterface right = and();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface and() {
        Expr.ExprInterface expr = equality();
        while (match(TokenType.AND)) {
            Token op = previous();
            Expr.ExprInterface right = equality();
            expr = new Logical(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface equality() {
        Expr.ExprInterface expr = comparison();
        while (match(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = comparison();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface comparison() {
        Expr.ExprInterface expr = term();
        while (match(TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL)) {
            Token op = previous();
            Expr.ExprInterface right = term();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (match(TokenType.BANG, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            return new Unary(op, right);
        }
        return call();
    }

    private Expr.ExprInterface call() {
        Expr.ExprInterface expr = primary();
        while (match(TokenType.LEFT_PAREN)) {
            expr = finishCall(expr);
        }
        return expr;
    }

    private Expr.ExprInterface finishCall(Expr.ExprInterface callee) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();
        if (!check(TokenType.RIGHT_PAREN)) {
            do {
                if (arguments.size() >= MAX_PARAMS) {
                    throw error(peek(), "Too many arguments (max " + MAX_PARAMS + ").");
                }
                arguments.add(expression());
            } while (match(TokenType.COMMA));
        }
        Token paren = consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");
        return new Call(callee, paren, arguments);
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.FALSE)) return new Literal(Boolean.FALSE);
        if (match(TokenType.TRUE)) return new Literal(Boolean.TRUE);
        if (match(TokenType.NIL)) return new Literal(null);
        if (match(TokenType.NUMBER, TokenType.STRING)) return new Literal(previous().literal);
        if (match(TokenType.IDENTIFIER)) return new Variable(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return new Grouping(expr);
        }

        if (match(TokenType.FN)) {
            Token keyword = previous();
            consume(TokenType.LEFT_PAREN, "Expect '(' after 'fn'.");
            List<Token> params = parameters();
            consume(TokenType.LEFT_BRACE, "Expect '{' before function body.");
            return new Expr.Function(keyword, params, functionBody());
        }

        throw error(peek(), "Expect expression.");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private boolean checkNext(TokenType type) {
        if (current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ParseError error(Token token, String message) {
        String where = (token.type == TokenType.EOF) ? " at end" : " at '" + token.lexeme + "'";
        return new ParseError(token.line, "Error" + where + ": " + message);
    }
}
