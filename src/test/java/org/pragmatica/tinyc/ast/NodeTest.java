package org.pragmatica.tinyc.ast;

import io.vavr.control.Option;
import org.junit.jupiter.api.Test;
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

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class NodeTest {
    private static final VarDecl FIELD = new VarDecl("int", "x", Option.none());
    private static final FunctionDecl METHOD = new FunctionDecl("int", "get", List.of(),
                                                                List.of(new ExpressionStatement(new Expression("x"))));

    @Test
    void foldDeclaration_selectsBranchByVariant() {
        Declaration function = new FunctionDecl("void", "f", List.of(), List.of());
        Declaration cls = new ClassDecl("C", Option.none(), List.of());

        assertEquals("function f", function.foldDeclaration(fn -> "function " + fn.name(), c -> "class " + c.name()));
        assertEquals("class C", cls.foldDeclaration(fn -> "function " + fn.name(), c -> "class " + c.name()));
    }

    @Test
    void foldMember_selectsFieldOrMethod() {
        Member field = FIELD;
        Member method = METHOD;

        assertEquals("field", field.foldMember(f -> "field", m -> "method"));
        assertEquals("method", method.foldMember(f -> "field", m -> "method"));
    }

    @Test
    void foldStatement_selectsVariableOrExpression() {
        Statement variable = new VarDecl("int", "y", Option.some(new Expression("1")));
        Statement expression = new ExpressionStatement(new Expression("y"));

        assertEquals("y", variable.foldStatement(VarDecl::name, e -> "?"));
        assertEquals("y", expression.foldStatement(v -> "?", e -> e.expression().literalText()));
    }

    @Test
    void classDecl_fieldsAndMethods_preserveMemberOrder() {
        var second = new VarDecl("float", "y", Option.none());
        var cls = new ClassDecl("P", Option.some("Base"), List.of(FIELD, METHOD, second));

        assertThat(cls.fields()).containsExactly(FIELD, second);
        assertThat(cls.methods()).containsExactly(METHOD);
    }

    @Test
    void constructors_copyLists_treeIsImmutable() {
        var params = new ArrayList<Param>();
        params.add(new Param("int", "a"));
        var function = new FunctionDecl("int", "f", params, List.of());

        params.add(new Param("int", "b"));

        assertEquals(1, function.parameters().size());
        assertThrows(UnsupportedOperationException.class,
                     () -> function.parameters().add(new Param("int", "c")));
        assertThrows(UnsupportedOperationException.class,
                     () -> new Program(List.of(function)).declarations().clear());
    }

    @Test
    void functionDecl_emptyName_rejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new FunctionDecl("int", "", List.of(), List.of()));
    }

    @Test
    void classDecl_emptyName_rejected() {
        assertThrows(IllegalArgumentException.class,
                     () -> new ClassDecl("", Option.none(), List.of()));
    }

    @Test
    void varDecl_nullDefault_rejected() {
        assertThrows(NullPointerException.class, () -> new VarDecl("int", "x", null));
    }
}
