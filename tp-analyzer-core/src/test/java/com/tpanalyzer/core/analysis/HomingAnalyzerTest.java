package com.tpanalyzer.core.analysis;

import com.tpanalyzer.core.ProgramFixtures;
import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.HomingProcedure;
import com.tpanalyzer.core.model.Program;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link HomingAnalyzer}.
 */
class HomingAnalyzerTest {

    private ControlFlowExtractor extractor;
    private HomingAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        extractor = new ControlFlowExtractor(AnalyzerConfig.defaults());
        analyzer = new HomingAnalyzer(AnalyzerConfig.defaults());
    }

    private List<HomingProcedure> analyze(Program program) {
        return analyzer.analyze(program, extractor.extract(program));
    }

    @Test
    void analyze_mainFixture_collectsChecksAndZones() {
        List<HomingProcedure> procedures = analyze(ProgramFixtures.load("A_1PA005.LS"));

        assertThat(procedures).extracting(HomingProcedure::label).containsExactly(1000, 1010);
        HomingProcedure home = procedures.get(0);
        assertThat(home.name()).isEqualTo("HOME ZOEKEN");
        assertThat(home.checks()).containsExactly(
            "IF R[200:Zone vorm]=1,JMP LBL[1010]",
            "WAIT R[199:Zone buffer]=0");
        assertThat(home.zones()).containsExactly("buffer", "vorm");
        assertThat(procedures.get(1).checks()).isEmpty();
    }

    @Test
    void analyze_labelNamedHome_outsideHomingRange_isIncluded() {
        Program program = ProgramFixtures.assemble("H",
            "LBL[50:Go home]", "IF DI[12:Tafel vrij]=ON,JMP LBL[60]", "JMP LBL[60]", "LBL[60]", "END");

        List<HomingProcedure> procedures = analyze(program);

        assertThat(procedures).singleElement().satisfies(procedure -> {
            assertThat(procedure.label()).isEqualTo(50);
            assertThat(procedure.checks()).hasSize(1);
            assertThat(procedure.zones()).containsExactly("tafel");
        });
    }

    @Test
    void analyze_unconditionalStatements_areNotChecks() {
        Program program = ProgramFixtures.assemble("H", "LBL[1000]", "R[200]=0", "JMP LBL[1000]");

        assertThat(analyze(program)).singleElement()
            .satisfies(procedure -> assertThat(procedure.checks()).isEmpty());
    }
}
