package org.pragmatica.tinyc.ast;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Abstract syntax tree of a tinyc compilation unit.
 *
 * <p>The node set is closed. The three sums the grammar needs ({@link Declaration},
 * {@link Member} and {@link Statement}) each offer an exhaustive fold, so a new
 * variant breaks every consumer at compile time instead of falling through.
 * Lists are copied on construction; a tree never changes after parsing.
 */
public sealed interface Node {

    // === Sums ===

    /**
     * Top-level declaration: a function or a class.
     */
    sealed interface Declaration extends Node {
        <R> R foldDeclaration(Function<? super FunctionDecl, ? extends R> onFunction,
                              Function<? super ClassDecl, ? extends R> onClass);
    }

    /**
     * Class member: a field or a method.
     */
    sealed interface Member extends Node {
        <R> R foldMember(Function<? super VarDecl, ? extends R> onField,
                         Function<? super FunctionDecl, ? extends R> onMethod);
    }

    /**
     * Statement inside a function body.
     */
    sealed interface Statement extends Node {
        <R> R foldStatement(Function<? super VarDecl, ? extends R> onVariable,
                            Function<? super ExpressionStatement, ? extends R> onExpression);
    }

    // === Nodes ===

    /**
     * Root of the tree: all top-level declarations in source order.
     */
    record Program(List<Declaration> declarations) implements Node {
        public Program {
            declarations = List.copyOf(declarations);
        }
    }

    /**
     * Function, at top level or as a class method.
     */
    record FunctionDecl(String returnType, String name, List<Param> parameters, List<Statement> body)
    implements Declaration, Member {
        public FunctionDecl {
            Node.requireIdentifier(name, "function name");
            Objects.requireNonNull(returnType, "returnType");
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        @Override
        public <R> R foldDeclaration(Function<? super FunctionDecl, ? extends R> onFunction,
                                     Function<? super ClassDecl, ? extends R> onClass) {
            return onFunction.apply(this);
        }

        @Override
        public <R> R foldMember(Function<? super VarDecl, ? extends R> onField,
                                Function<? super FunctionDecl, ? extends R> onMethod) {
            return onMethod.apply(this);
        }
    }

    record Param(String type, String name) implements Node {
        public Param {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
        }
    }

    /**
     * Class with an optional single parent.
     */
    record ClassDecl(String name, Option<String> parentName, List<Member> members) implements Declaration {
        public ClassDecl {
            Node.requireIdentifier(name, "class name");
            Objects.requireNonNull(parentName, "parentName");
            members = List.copyOf(members);
        }

        public List<VarDecl> fields() {
            var fields = new ArrayList<VarDecl>();
            for (var member : members) {
                member.foldMember(fields::add, method -> false);
            }
            return List.copyOf(fields);
        }

        public List<FunctionDecl> methods() {
            var methods = new ArrayList<FunctionDecl>();
            for (var member : members) {
                member.foldMember(field -> false, methods::add);
            }
            return List.copyOf(methods);
        }

        @Override
        public <R> R foldDeclaration(Function<? super FunctionDecl, ? extends R> onFunction,
                                     Function<? super ClassDecl, ? extends R> onClass) {
            return onClass.apply(this);
        }
    }

    /**
     * Typed variable, in a body or as a class field.
     */
    record VarDecl(String type, String name, Option<Expression> defaultValue) implements Statement, Member {
        public VarDecl {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(defaultValue, "defaultValue");
        }

        @Override
        public <R> R foldStatement(Function<? super VarDecl, ? extends R> onVariable,
                                   Function<? super ExpressionStatement, ? extends R> onExpression) {
            return onVariable.apply(this);
        }

        @Override
        public <R> R foldMember(Function<? super VarDecl, ? extends R> onField,
                                Function<? super FunctionDecl, ? extends R> onMethod) {
            return onField.apply(this);
        }
    }

    /**
     * Expression used as a statement.
     */
    record ExpressionStatement(Expression expression) implements Statement {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public <R> R foldStatement(Function<? super VarDecl, ? extends R> onVariable,
                                   Function<? super ExpressionStatement, ? extends R> onExpression) {
            return onExpression.apply(this);
        }
    }

    /**
     * Text of a single number, string or identifier token.
     */
    record Expression(String literalText) implements Node {
        public Expression {
            Objects.requireNonNull(literalText, "literalText");
        }
    }

    private static void requireIdentifier(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(what + " must be a non-empty identifier");
        }
    }
}
