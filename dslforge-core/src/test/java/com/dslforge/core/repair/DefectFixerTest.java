package com.dslforge.core.repair;

import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.SourceSpan;
import com.dslforge.core.model.Statement;
import com.dslforge.core.parser.DslParser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link DefectFixer.FixOutcome}.
 */
class DefectFixerTest {

    @Test
    void fixOutcome_copiesItsInputs() {
        List<Statement> statements = new ArrayList<>(new DslParser().parse("CALL f()").statements());
        List<Defect> resolved = new ArrayList<>(List.of(
            Defect.of(DefectKind.UNDEFINED_VARIABLE, SourceSpan.of(1, 1), "x", "Variable 'x' is used but never defined")));
        Map<String, String> mapping = new HashMap<>(Map.of("_x", "x"));

        DefectFixer.FixOutcome outcome = new DefectFixer.FixOutcome(statements, resolved, mapping);
        statements.clear();
        resolved.clear();
        mapping.clear();

        assertThat(outcome.statements()).hasSize(1);
        assertThat(outcome.resolved()).hasSize(1);
        assertThat(outcome.identifierMapping()).containsEntry("_x", "x");
        assertThatThrownBy(() -> outcome.identifierMapping().put("y", "z"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fixOutcome_withoutMapping_hasEmptyMapping() {
        DefectFixer.FixOutcome outcome = DefectFixer.FixOutcome.of(List.of(), List.of());

        assertThat(outcome.identifierMapping()).isEmpty();
        assertThat(new DefectFixer.FixOutcome(List.of(), List.of(), null).identifierMapping()).isEmpty();
    }
}
