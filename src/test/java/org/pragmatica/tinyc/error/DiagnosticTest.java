package org.pragmatica.tinyc.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.tinyc.TinyC;
import org.pragmatica.tinyc.tree.SourceLocation;
import org.pragmatica.tinyc.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_lexError_underlinesCharacterWithHelp() {
        var source = "int @x;";
        var error = TinyC.compile(source).getLeft();

        assertEquals("""
            error[E0001]: unexpected character '@'
              --> input.tc:1:5
              |
            1 | int @x;
              |     ^ not a valid token
              |
              = help: tokens are numbers, strings, identifiers, operators + - * / = < > ! and ( ) { } : ; ,
            """, error.toDiagnostic().format(source, "input.tc"));
    }

    @Test
    void format_unexpectedToken_underlinesWholeToken() {
        var source = "void f() {\n    int y count;\n}\n";
        var error = TinyC.compile(source).getLeft();

        assertEquals("""
            error[E0002]: unexpected identifier 'count'
              --> shapes.tc:2:11
              |
            2 |     int y count;
              |           ^^^^^ expected ';'
              |
            """, error.toDiagnostic().format(source, "shapes.tc"));
    }

    @Test
    void format_unexpectedEof_pointsPastLastCharacter() {
        var source = "void f() {";
        var error = TinyC.compile(source).getLeft();

        assertInstanceOf(ParseError.UnexpectedEof.class, error);
        assertEquals("""
            error[E0003]: unexpected end of input
              --> 1:11
              |
            1 | void f() {
              |           ^ expected '}'
              |
            """, error.toDiagnostic().format(source, null));
    }

    @Test
    void format_wideLineNumber_widensGutter() {
        var source = "\n".repeat(11) + "void f() { ! }";
        var error = TinyC.compile(source).getLeft();

        var text = error.toDiagnostic().format(source, "big.tc");

        assertThat(text).contains("   |\n12 | void f() { ! }\n   |            ^ expected expression\n");
    }

    @Test
    void format_crlfSource_dropsCarriageReturnFromExcerpt() {
        var source = "void f() {\r\n  ?\r\n}\r\n";
        var error = TinyC.compile(source).getLeft();

        assertThat(error.toDiagnostic().format(source, "w.tc")).contains("2 |   ?\n  |   ^ not a valid token\n");
    }

    @Test
    void formatSimple_singleLine() {
        var error = TinyC.compile("int @x;").getLeft();

        assertEquals("input.tc:1:5: error[E0001]: unexpected character '@'",
                     error.toDiagnostic().formatSimple("input.tc"));
        assertThat(error.toDiagnostic().formatSimple(null)).startsWith("input:1:5:");
    }

    @Test
    void withNote_appendsWithoutTouchingOriginal() {
        var span = SourceSpan.at(SourceLocation.at(1, 0, 0));
        var base = Diagnostic.error("E0002", "oops", span);

        var noted = base.withNote("first").withHelp("second");

        assertThat(base.notes()).isEmpty();
        assertThat(noted.notes()).containsExactly("first", "help: second");
    }
}
