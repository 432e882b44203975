package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.ProgramFixtures;
import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.ErrorHandler;
import com.tpanalyzer.core.model.Program;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ErrorHandlerInventory}.
 */
class ErrorHandlerInventoryTest {

    private final ControlFlowExtractor extractor = new ControlFlowExtractor(AnalyzerConfig.defaults());

    @Test
    void inventory_mainFixture_recognisesRecoveryActions() {
        Program program = ProgramFixtures.load("A_1PA005.LS");

        List<ErrorHandler> handlers = new ErrorHandlerInventory(AnalyzerConfig.defaults())
            .inventory(program, extractor.extract(program));

        assertThat(handlers).singleElement().satisfies(handler -> {
            assertThat(handler.program()).isEqualTo("A_1PA005");
            assertThat(handler.label()).isEqualTo(500);
            assertThat(handler.name()).isEqualTo("STORING");
            assertThat(handler.firstLine()).isEqualTo(38);
            assertThat(handler.actions()).containsExactly(
                "Display error message",
                "Open gripper",
                "Move to safe position",
                "Wait for operator confirmation",
                "Abort program");
            assertThat(handler.callers()).containsExactly(10, 20);
        });
    }

    @Test
    void inventory_customActionRules_replaceDefaults() {
        AnalyzerConfig config = new AnalyzerConfig(null, null, null, null, null,
            List.of(new AnalyzerConfig.ErrorActionRule("RESET", "Reset alarms")),
            null, null);
        Program program = ProgramFixtures.assemble("E", "LBL[600]", "RESET", "CALL TEKST(1)", "JMP LBL[600]");

        List<ErrorHandler> handlers = new ErrorHandlerInventory(config).inventory(program, extractor.extract(program));

        assertThat(handlers).singleElement().satisfies(handler -> {
            assertThat(handler.actions()).containsExactly("Reset alarms");
            assertThat(handler.callers()).isEmpty();
        });
    }

    @Test
    void inventory_noErrorLabels_returnsEmptyList() {
        Program program = ProgramFixtures.load("TEKST.LS");

        assertThat(new ErrorHandlerInventory(AnalyzerConfig.defaults()).inventory(program, extractor.extract(program)))
            .isEmpty();
    }
}
