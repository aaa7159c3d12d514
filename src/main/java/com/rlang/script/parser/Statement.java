package com.rlang.script.parser;

import java.util.List;

public class Statement {

    public interface Stmt {
        void accept(StmtVisitor visitor);
    }

    public interface StmtVisitor {
        void visitExprStmt(ExprStmt stmt);
        void visitPrintStmt(PrintStmt stmt);
        void visitVarStmt(VarStmt stmt);
        void visitBlockStmt(Block stmt);
        void visitIfStmt(If stmt);
        void visitWhileStmt(While stmt);
        void visitFunctionStmt(FunctionStmt stmt);
        void visitReturnStmt(ReturnStmt stmt);
    }

    public static final class ExprStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public ExprStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitExprStmt(this); }
    }

    public static final class PrintStmt implements Stmt {
        public final Expr.ExprInterface expression;
        public PrintStmt(Expr.ExprInterface expression) { this.expression = expression; }
        public void accept(StmtVisitor visitor) { visitor.visitPrintStmt(this); }
    }

    public static final class VarStmt implements Stmt {
        public final Token name;
        public final Expr.ExprInterface initializer; // may be null
        public VarStmt(Token name, Expr.ExprInterface initializer) { this.name = name; this.initializer = initializer; }
        public void accept(StmtVisitor visitor) { visitor.visitVarStmt(this); }
    }

    public static final class Block implements Stmt {
        public final List<Stmt> statements;
        public Block(List<Stmt> statements) { this.statements = List.copyOf(statements); }
        public void accept(StmtVisitor visitor) { visitor.visitBlockStmt(this); }
    }

    public static final class If implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt thenBranch;
        public final Stmt elseBranch; // may be null
        public If(Expr.ExprInterface condition, Stmt thenBranch, Stmt elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }
        public void accept(StmtVisitor visitor) { visitor.visitIfStmt(this); }
    }

    public static final class While implements Stmt {
        public final Expr.ExprInterface condition;
        public final Stmt body;
        public While(Expr.ExprInterface condition, Stmt body) {
            this.condition = condition;
            this.body = body;
        }
        public void accept(StmtVisitor visitor) { visitor.visitWhileStmt(this); }
    }

    public static final class FunctionStmt implements Stmt {
        public final Token name;
        public final List<Token> params;
        public final List<Stmt> body;

        public FunctionStmt(Token name, List<Token> params, List<Stmt> body) {
            this.name = name;
            this.params = List.copyOf(params);
            this.body = List.copyOf(body);
        }

        public void accept(StmtVisitor visitor) { visitor.visitFunctionStmt(this); }
    }

    public static final class ReturnStmt implements Stmt {
        public final Token keyword;
        public final Expr.ExprInterface value; // may be null

        public ReturnStmt(Token keyword, Expr.ExprInterface value) {
            this.keyword = keyword;
            this.value = value;
        }

        public void accept(StmtVisitor visitor) { visitor.visitReturnStmt(this); }
    }
}
