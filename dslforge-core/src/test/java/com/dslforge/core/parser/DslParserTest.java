package com.dslforge.core.parser;

import com.dslforge.core.model.Assign;
import com.dslforge.core.model.CallExpression;
import com.dslforge.core.model.CallStatement;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.Define;
import com.dslforge.core.model.ForStatement;
import com.dslforge.core.model.IfStatement;
import com.dslforge.core.model.RawExpression;
import com.dslforge.core.model.ReturnStatement;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.VarType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DslParser}.
 */
class DslParserTest {

    private DslParser parser;

    @BeforeEach
    void setUp() {
        parser = new DslParser();
    }

    @Test
    void parse_nullOrBlank_returnsEmptyResult() {
        assertThat(parser.parse(null).statements()).isEmpty();
        assertThat(parser.parse("  \n\n").statements()).isEmpty();
        assertThat(parser.parse("").hasDefects()).isFalse();
    }

    @Test
    void parse_defineWithTypeAndValue_returnsDefine() {
        ParseResult result = parser.parse("DEFINE {{limit}}: Integer = 10");

        assertThat(result.defects()).isEmpty();
        assertThat(result.statements()).hasSize(1);
        Define define = (Define) result.statements().get(0);
        assertThat(define.name()).isEqualTo("limit");
        assertThat(define.type()).isEqualTo(VarType.INTEGER);
        assertThat(define.initialValue().sourceText()).isEqualTo("10");
        assertThat(define.span()).isEqualTo(SourceSpan.of(1, 1));
    }

    @Test
    void parse_defineWithoutValue_hasNoInitialValue() {
        Define define = (Define) parser.parse("DEFINE {{items}}: List").statements().get(0);

        assertThat(define.type()).isEqualTo(VarType.LIST);
        assertThat(define.initialValue()).isNull();
    }

    @Test
    void parse_defineWithUnknownType_reportsTypeMismatchAndFallsBackToAny() {
        ParseResult result = parser.parse("DEFINE {{x}}: Number = 3");

        assertThat(result.defects()).extracting(Defect::kind).containsExactly(DefectKind.TYPE_MISMATCH);
        assertThat(result.defects().get(0).subject()).isEqualTo("x");
        assertThat(((Define) result.statements().get(0)).type()).isEqualTo(VarType.ANY);
    }

    @Test
    void parse_assignmentOfCall_returnsBoundCallStatement() {
        ParseResult result = parser.parse("{{report}} = CALL summarize({{data}}, style=\"short\")");

        CallStatement call = (CallStatement) result.statements().get(0);
        assertThat(call.resultBinding()).isEqualTo("report");
        assertThat(call.call().functionName()).isEqualTo("summarize");
        assertThat(call.call().arguments()).hasSize(2);
        assertThat(call.call().arguments().get(1).name()).isEqualTo("style");
    }

    @Test
    void parse_plainAssignment_returnsAssign() {
        Assign assign = (Assign) parser.parse("{{total}} = {{a}} + {{b}}").statements().get(0);

        assertThat(assign.target()).isEqualTo("total");
        assertThat(assign.expression().references()).containsExactly("a", "b");
    }

    @Test
    void parse_ifWithElifAndElse_buildsSingleClosedBlock() {
        ParseResult result = parser.parse("""
            IF {{score}} > 90:
                CALL grade("A")
            ELIF {{score}} > 80
                CALL grade("B")
            ELSE
                CALL grade("C")
            ENDIF
            """);

        assertThat(result.defects()).isEmpty();
        assertThat(result.statements()).hasSize(1);
        IfStatement ifStatement = (IfStatement) result.statements().get(0);
        assertThat(ifStatement.closed()).isTrue();
        assertThat(ifStatement.condition().sourceText()).isEqualTo("{{score}} > 90");
        assertThat(ifStatement.thenBranch()).hasSize(1);
        assertThat(ifStatement.elifBranches()).hasSize(1);
        assertThat(ifStatement.elifBranches().get(0).span().line()).isEqualTo(3);
        assertThat(ifStatement.elseBranch()).hasSize(1);
    }

    @Test
    void parse_ifCall_conditionIsCallExpression() {
        IfStatement ifStatement = (IfStatement) parser.parse("""
            IF CALL is_ready({{job}})
                CALL run({{job}})
            END IF
            """).statements().get(0);

        assertThat(ifStatement.condition()).isInstanceOf(CallExpression.class);
        assertThat(ifStatement.closed()).isTrue();
    }

    @Test
    void parse_forLoop_bindsLoopVariable() {
        ParseResult result = parser.parse("""
            FOR {{item}} IN {{items}}
                CALL process({{item}})
            ENDFOR
            """);

        ForStatement loop = (ForStatement) result.statements().get(0);
        assertThat(loop.loopVar()).isEqualTo("item");
        assertThat(loop.iterable().sourceText()).isEqualTo("{{items}}");
        assertThat(loop.body()).hasSize(1);
        assertThat(loop.closed()).isTrue();
    }

    @Test
    void parse_returnCall_returnsReturnWithCallExpression() {
        ReturnStatement ret = (ReturnStatement) parser.parse("RETURN CALL finish({{x}})").statements().get(0);

        assertThat(ret.expression()).isInstanceOf(CallExpression.class);
    }

    @Test
    void parse_bareReturn_hasNoValue() {
        ReturnStatement ret = (ReturnStatement) parser.parse("RETURN").statements().get(0);

        assertThat(ret.hasValue()).isFalse();
    }

    @Test
    void parse_missingEndif_reportsUnclosedBlockAtOpeningLine() {
        // Given
        String dsl = """
            DEFINE {{x}}: Integer = 7
            IF {{x}} > 5
                CALL f()
            """;

        // When
        ParseResult result = parser.parse(dsl);

        // Then
        assertThat(result.defects()).hasSize(1);
        Defect defect = result.defects().get(0);
        assertThat(defect.kind()).isEqualTo(DefectKind.UNCLOSED_BLOCK);
        assertThat(defect.span().line()).isEqualTo(2);
        assertThat(((IfStatement) result.statements().get(1)).closed()).isFalse();
        assertThat(result.carriedDefects()).isEmpty();
    }

    @Test
    void parse_closeOfOuterBlock_reportsInnerBlockUnclosed() {
        ParseResult result = parser.parse("""
            FOR {{i}} IN {{items}}
                IF {{i}} > 1
                    CALL f({{i}})
            ENDFOR
            """);

        assertThat(result.defects()).extracting(Defect::kind).containsExactly(DefectKind.UNCLOSED_BLOCK);
        assertThat(result.defects().get(0).span().line()).isEqualTo(2);
        ForStatement loop = (ForStatement) result.statements().get(0);
        assertThat(loop.closed()).isTrue();
        assertThat(((IfStatement) loop.body().get(0)).closed()).isFalse();
    }

    @Test
    void parse_strayEndif_reportsUnexpectedClose() {
        ParseResult result = parser.parse("""
            CALL f()
            ENDIF
            """);

        assertThat(result.defects()).hasSize(1);
        assertThat(result.defects().get(0).kind()).isEqualTo(DefectKind.UNEXPECTED_CLOSE);
        assertThat(result.defects().get(0).subject()).isEqualTo("ENDIF");
        assertThat(result.carriedDefects()).hasSize(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"PRINT {{x}}", "just some prose", "ELSE IF {{x}}"})
    void parse_unknownLine_reportsMalformedStatement(String line) {
        ParseResult result = parser.parse(line);

        assertThat(result.defects()).extracting(Defect::kind).contains(DefectKind.MALFORMED_STATEMENT);
    }

    @Test
    void parse_elseWithoutIf_reportsMalformedStatement() {
        ParseResult result = parser.parse("ELSE");

        assertThat(result.defects()).extracting(Defect::kind).containsExactly(DefectKind.MALFORMED_STATEMENT);
        assertThat(result.defects().get(0).message()).contains("ELSE without a matching IF");
    }

    @Test
    void parse_unparsableExpression_reportsDefectWithRawSubject() {
        ParseResult result = parser.parse("{{x}} = CALL f({{a}}, CALL g())x");

        assertThat(result.defects()).extracting(Defect::kind).containsExactly(DefectKind.UNPARSABLE_CALL_EXPRESSION);
        assertThat(result.defects().get(0).subject()).isEqualTo("CALL f({{a}}, CALL g())x");
        assertThat(((Assign) result.statements().get(0)).expression()).isInstanceOf(RawExpression.class);
    }

    @Test
    void parse_commentsAndBlankLines_areSkippedButLineNumbersKept() {
        ParseResult result = parser.parse("""
            # setup
            // another comment

            CALL f()
            """);

        assertThat(result.statements()).hasSize(1);
        assertThat(result.statements().get(0).span().line()).isEqualTo(4);
    }

    @Test
    void parse_tabIndentation_countsFourColumns() {
        ParseResult result = parser.parse("IF {{x}} > 1\n\tCALL f()\nENDIF");

        IfStatement ifStatement = (IfStatement) result.statements().get(0);
        assertThat(ifStatement.thenBranch().get(0).span()).isEqualTo(SourceSpan.of(2, 5));
    }

    @Test
    void parse_defectsAreSortedByPosition() {
        ParseResult result = parser.parse("""
            ENDFOR
            DEFINE {{x}}: Nothing
            IF {{x}}
            """);

        assertThat(result.defects()).extracting(defect -> defect.span().line()).containsExactly(1, 2, 3);
    }
}
