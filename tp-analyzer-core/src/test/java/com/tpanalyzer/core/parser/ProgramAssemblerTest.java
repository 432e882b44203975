package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.ProgramFixtures;
import com.tpanalyzer.core.config.AnalyzerConfig;
import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.PositionKind;
import com.tpanalyzer.core.model.Program;
import com.tpanalyzer.core.model.ProgramType;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProgramAssembler}.
 */
class ProgramAssemblerTest {

    private ProgramAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ProgramAssembler(AnalyzerConfig.defaults());
    }

    @Test
    void assemble_mainProgram_buildsCompleteProgram() {
        Program program = assembler.assemble("A_1PA005.LS", ProgramFixtures.read("A_1PA005.LS"));

        assertThat(program.name()).isEqualTo("A_1PA005");
        assertThat(program.fileName()).isEqualTo("A_1PA005.LS");
        assertThat(program.type()).isEqualTo(ProgramType.MAIN);
        assertThat(program.iml()).isTrue();
        assertThat(program.productCode()).isNull();
        assertThat(program.attributes().comment()).isEqualTo("Hoofdprogramma 005");
        assertThat(program.instructions()).hasSize(30);
        assertThat(program.labelTable()).containsOnlyKeys(10, 20, 500, 1000, 1010);
        assertThat(program.labelTable()).containsEntry(10, 3);
        assertThat(program.positions()).containsOnlyKeys("P[1]", "P[2]", "P[3]");
        assertThat(program.positions().get("P[2]").kind()).isEqualTo(PositionKind.JOINT);
        assertThat(program.isMalformed()).isFalse();
    }

    @Test
    void assemble_mainProgram_reportsLineNumbersOfTheFile() {
        Program program = assembler.assemble("A_1PA005.LS", ProgramFixtures.read("A_1PA005.LS"));

        Instruction label = program.labelDefinition(10).orElseThrow();
        assertThat(label.lineNumber()).isEqualTo(28);
        assertThat(label.statementNumber()).isEqualTo(4);
        assertThat(program.labelName(10)).isEqualTo("NAAR INDUIK");
    }

    @Test
    void assemble_mainProgram_computesStatistics() {
        Program program = assembler.assemble("A_1PA005.LS", ProgramFixtures.read("A_1PA005.LS"));

        assertThat(program.statistics().statements()).isEqualTo(30);
        assertThat(program.statistics().labels()).isEqualTo(5);
        assertThat(program.statistics().calls()).isEqualTo(2);
        assertThat(program.statistics().jumps()).isEqualTo(6);
        assertThat(program.statistics().positions()).isEqualTo(3);
        assertThat(program.statistics().registers()).isEqualTo(4);
        assertThat(program.statistics().ioSignals()).isEqualTo(3);
        assertThat(program.statistics().errorLabels()).isEqualTo(1);
        assertThat(program.statistics().unrecognized()).isEqualTo(2);
    }

    @Test
    void assemble_subprogram_extractsProductCode() {
        Program program = assembler.assemble("KER1_384.LS", ProgramFixtures.read("KER1_384.LS"));

        assertThat(program.type()).isEqualTo(ProgramType.SUBPROGRAM);
        assertThat(program.productCode()).isEqualTo("384");
        assertThat(program.productCodeIfPresent()).contains("384");
        assertThat(program.iml()).isFalse();
        assertThat(program.calls()).extracting(call -> call.payload(Instruction.Call.class).target())
            .containsExactly("PRINTEN_384", "TEKST");
    }

    @Test
    void assemble_missingTerminator_yieldsMalformedProgram() {
        Program program = assembler.assemble("HOMEN_BROKEN.LS", ProgramFixtures.read("HOMEN_BROKEN.LS"));

        assertThat(program.name()).isEqualTo("HOMEN_BROKEN");
        assertThat(program.isMalformed()).isTrue();
        assertThat(program.warnings()).extracting(ProgramWarning::message)
            .contains("Missing /END terminator");
        assertThat(program.instructions()).extracting(Instruction::kind)
            .containsExactly(InstructionKind.LABEL, InstructionKind.JUMP, InstructionKind.OTHER);
    }

    @Test
    void assemble_missingHeader_fallsBackToFileStem() {
        String text = "/ATTR\n/MN\n   1:  END ;\n/POS\n/END\n";

        Program program = assembler.assemble("backup/RUST.LS", text);

        assertThat(program.name()).isEqualTo("RUST");
        assertThat(program.type()).isEqualTo(ProgramType.UTILITY);
        assertThat(program.warnings()).extracting(ProgramWarning::type).contains(WarningType.MALFORMED_PROGRAM);
    }

    @Test
    void assemble_duplicateLabel_keepsFirstDefinition() {
        Program program = ProgramFixtures.assemble("DUP", "LBL[10]", "JMP LBL[10]", "LBL[10]", "END");

        assertThat(program.labelTable()).containsEntry(10, 0);
        assertThat(program.warnings()).extracting(ProgramWarning::type).containsOnlyOnce(WarningType.DUPLICATE_LABEL);
    }

    @Test
    void assemble_jumpToUndefinedLabel_warns() {
        Program program = ProgramFixtures.assemble("UNDEF", "LBL[10]", "JMP LBL[99]", "WAIT DI[1]=ON TIMEOUT,LBL[98]");

        assertThat(program.warnings()).filteredOn(warning -> warning.type() == WarningType.UNDEFINED_LABEL)
            .extracting(ProgramWarning::message)
            .containsExactly("Jump to undefined LBL[99]", "Jump to undefined LBL[98]");
    }

    @Test
    void classify_namingRules_firstMatchWins() {
        assertThat(assembler.classify("A_1PA017")).isEqualTo(ProgramType.MAIN);
        assertThat(assembler.classify("AFLG_096")).isEqualTo(ProgramType.SUBPROGRAM);
        assertThat(assembler.classify("HOMING")).isEqualTo(ProgramType.UTILITY);
        assertThat(assembler.classify("FOLIE")).isEqualTo(ProgramType.UTILITY);
        assertThat(assembler.classify("FOLIE_PAK")).isEqualTo(ProgramType.SUBPROGRAM);
        assertThat(assembler.classify("ERR_HANDLER")).isEqualTo(ProgramType.SYSTEM);
        assertThat(assembler.classify("ROBOT_INTERFACE")).isEqualTo(ProgramType.SYSTEM);
        assertThat(assembler.classify("MISC")).isEqualTo(ProgramType.UNKNOWN);
    }

    @Test
    void assemble_customNamingRules_overrideDefaults() {
        AnalyzerConfig config = new AnalyzerConfig(null,
            List.of(new AnalyzerConfig.NamingRule(ProgramType.MAIN, "PNS\\d{4}")),
            null, null, null, null, null, null);

        Program program = new ProgramAssembler(config).assemble("PNS0001.LS", ProgramFixtures.program("PNS0001", "END"));

        assertThat(program.type()).isEqualTo(ProgramType.MAIN);
    }

    @Test
    void assemble_emptyText_throwsEmptyFileException() {
        assertThatThrownBy(() -> assembler.assemble("EMPTY.LS", ProgramFixtures.read("EMPTY.LS")))
            .isInstanceOf(EmptyFileException.class);
    }
}
