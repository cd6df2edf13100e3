package org.pragmatica.tinyc.codegen;

import org.pragmatica.tinyc.TinyCConfig;
import org.pragmatica.tinyc.ast.Node.ClassDecl;
import org.pragmatica.tinyc.ast.Node.ExpressionStatement;
import org.pragmatica.tinyc.ast.Node.FunctionDecl;
import org.pragmatica.tinyc.ast.Node.Param;
import org.pragmatica.tinyc.ast.Node.Program;
import org.pragmatica.tinyc.ast.Node.Statement;
import org.pragmatica.tinyc.ast.Node.VarDecl;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates C source from a parsed program.
 *
 * <p>Functions are emitted as they are. A class becomes a {@code typedef struct}
 * holding its fields, followed by one free function per method named
 * {@code Class_method} that takes the instance pointer as first parameter.
 * The generator keeps no state between calls; all output goes through an
 * {@link Emitter} created for each run.
 */
public final class CGenerator {
    private final TinyCConfig config;

    private CGenerator(TinyCConfig config) {
        this.config = config;
    }

    public static CGenerator create() {
        return new CGenerator(TinyCConfig.DEFAULT);
    }

    public static CGenerator create(TinyCConfig config) {
        return new CGenerator(config);
    }

    public String generate(Program program) {
        var out = new Emitter(config.indentUnit());

        generateIncludes(out);
        for (var declaration : program.declarations()) {
            declaration.foldDeclaration(function -> generateFunction(function, out),
                                        cls -> generateClass(cls, out));
        }
        return out.text();
    }

    private Emitter generateIncludes(Emitter out) {
        if (config.includes().isEmpty()) {
            return out;
        }
        for (var header : config.includes()) {
            out.line("#include <" + header + ">");
        }
        return out.blankLine();
    }

    private Emitter generateFunction(FunctionDecl function, Emitter out) {
        return generateFunction(function.name(), function, List.of(), out);
    }

    private Emitter generateFunction(String emittedName, FunctionDecl function, List<String> leadingParams, Emitter out) {
        var params = new ArrayList<>(leadingParams);
        for (var param : function.parameters()) {
            params.add(paramText(param));
        }

        out.line(function.returnType() + " " + emittedName + "(" + String.join(", ", params) + ") {");
        out.indent();
        for (var statement : function.body()) {
            out.line(statementText(statement));
        }
        return out.dedent()
                  .line("}")
                  .blankLine();
    }

    private Emitter generateClass(ClassDecl cls, Emitter out) {
        out.line("typedef struct " + cls.name() + " {");
        out.indent();
        for (var field : cls.fields()) {
            out.line(field.type() + " " + field.name() + ";");
        }
        out.dedent()
           .line("} " + cls.name() + ";")
           .blankLine();

        var receiver = cls.name() + "* " + config.receiverName();
        for (var method : cls.methods()) {
            generateFunction(cls.name() + "_" + method.name(), method, List.of(receiver), out);
        }
        return out;
    }

    private static String statementText(Statement statement) {
        return statement.foldStatement(CGenerator::variableText, CGenerator::expressionText);
    }

    private static String variableText(VarDecl variable) {
        var text = variable.type() + " " + variable.name();
        return variable.defaultValue()
                       .map(value -> text + " = " + value.literalText())
                       .getOrElse(text) + ";";
    }

    private static String expressionText(ExpressionStatement statement) {
        return statement.expression().literalText() + ";";
    }

    private static String paramText(Param param) {
        return param.type() + " " + param.name();
    }
}
