package com.dslforge.core.parser;

import com.dslforge.core.model.Defect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DslPrinter}.
 */
class DslPrinterTest {

    private final DslParser parser = new DslParser();
    private final DslPrinter printer = new DslPrinter();

    @Test
    void print_canonicalText_isReproduced() {
        String dsl = """
            DEFINE {{items}}: List = [1, 2]
            DEFINE {{total}}: Integer = 0
            FOR {{item}} IN {{items}}
                IF {{item}} > 1
                    {{total}} = {{total}} + {{item}}
                ELIF {{item}} == 1
                    CALL log({{item}})
                ELSE
                    {{report}} = CALL summarize({{item}}, style="short")
                ENDIF
            ENDFOR
            RETURN {{total}}
            """;

        assertThat(printer.print(parser.parse(dsl).statements())).isEqualTo(dsl);
    }

    @Test
    void print_normalizesColonsAndSpacedCloseKeywords() {
        String printed = printer.print(parser.parse("""
            IF {{x}} > 1:
              CALL f()
            END IF
            """).statements());

        assertThat(printed).isEqualTo("IF {{x}} > 1\n    CALL f()\nENDIF\n");
    }

    @Test
    void print_unclosedBlock_omitsCloseSoReparseKeepsDefect() {
        String dsl = """
            IF {{x}} > 5
                CALL f()
            """;
        ParseResult first = parser.parse(dsl);

        String printed = printer.print(first.statements());
        ParseResult second = parser.parse(printed);

        assertThat(printed).doesNotContain("ENDIF");
        assertThat(second.defects()).extracting(Defect::kind)
            .containsExactlyElementsOf(first.defects().stream().map(Defect::kind).toList());
    }

    @Test
    void print_bareReturnAndDefineWithoutValue() {
        String printed = printer.print(parser.parse("DEFINE {{x}}: Any\nRETURN").statements());

        assertThat(printed).isEqualTo("DEFINE {{x}}: Any\nRETURN\n");
    }

    @Test
    void print_noStatements_returnsEmpty() {
        assertThat(printer.print(List.of())).isEmpty();
    }
}
