package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.Instruction;
import com.tpanalyzer.core.model.InstructionKind;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.Severity;
import com.tpanalyzer.core.model.SymbolKind;
import com.tpanalyzer.core.model.SymbolRef;
import com.tpanalyzer.core.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link InstructionParser}.
 */
class InstructionParserTest {

    private InstructionParser parser;

    @BeforeEach
    void setUp() {
        parser = new InstructionParser();
    }

    @Test
    void parse_everyStatement_yieldsExactlyOneInstruction() {
        String body = """
               1:  !Start ;
               2:  LBL[10:NAAR INDUIK] ;
               3:  R[90:Program gestart]=1    ;
               4:  MESSAGE[Hallo] ;
               5:  ;
               6:  UFRAME_NUM=1 ;
               7:  CALL TEKST(500) ;
            """;

        ParseOutcome<List<Instruction>> outcome = parser.parse(body, 25);

        assertThat(outcome.value()).hasSize(7);
        assertThat(outcome.value()).extracting(Instruction::lineNumber)
            .containsExactly(25, 26, 27, 28, 29, 30, 31);
        assertThat(outcome.value()).extracting(Instruction::statementNumber)
            .containsExactly(1, 2, 3, 4, 5, 6, 7);
    }

    @Test
    void parseStatement_comment_hasNoSymbolReferences() {
        Instruction instruction = parser.parseStatement(1, "   1:  !Set R[90:Program gestart] here ;");

        assertThat(instruction.kind()).isEqualTo(InstructionKind.COMMENT);
        assertThat(instruction.payload(Instruction.Comment.class).text()).isEqualTo("Set R[90:Program gestart] here");
        assertThat(instruction.symbolRefs()).isEmpty();
    }

    @Test
    void parseStatement_otherCommentStyles_areComments() {
        assertThat(parser.parseStatement(1, "//old code").kind()).isEqualTo(InstructionKind.COMMENT);
        assertThat(parser.parseStatement(1, "--eg:easy macro").kind()).isEqualTo(InstructionKind.COMMENT);
    }

    @Test
    void parseStatement_label_extractsNumberAndName() {
        Instruction instruction = parser.parseStatement(1, "  4:  LBL[10:NAAR INDUIK] ;");

        Instruction.LabelDef label = instruction.payload(Instruction.LabelDef.class);
        assertThat(label.number()).isEqualTo(10);
        assertThat(label.name()).isEqualTo("NAAR INDUIK");
    }

    @Test
    void parseStatement_unnamedLabel_hasEmptyName() {
        Instruction.LabelDef label = parser.parseStatement(1, "LBL[1000]").payload(Instruction.LabelDef.class);

        assertThat(label.number()).isEqualTo(1000);
        assertThat(label.name()).isEmpty();
    }

    @Test
    void parseStatement_unconditionalJump_hasNoCondition() {
        Instruction.Jump jump = parser.parseStatement(1, "  13:  JMP LBL[10] ;").payload(Instruction.Jump.class);

        assertThat(jump.targetLabel()).isEqualTo(10);
        assertThat(jump.conditional()).isFalse();
    }

    @Test
    void parseStatement_conditionalJump_extractsCondition() {
        Instruction instruction = parser.parseStatement(1, "  12:  IF R[1:Teller]>100,JMP LBL[500:STORING] ;");

        Instruction.Jump jump = instruction.payload(Instruction.Jump.class);
        assertThat(jump.targetLabel()).isEqualTo(500);
        assertThat(jump.condition()).isEqualTo("R[1:Teller]>100");
        assertThat(instruction.symbolRefs()).singleElement()
            .isEqualTo(new SymbolRef(SymbolKind.REGISTER, 1, "Teller", false));
    }

    @Test
    void parseStatement_call_extractsTargetAndArgument() {
        Instruction.Call call = parser.parseStatement(1, "CALL TEKST(500) ;").payload(Instruction.Call.class);
        Instruction.Call plain = parser.parseStatement(1, "CALL KER1_384    ;").payload(Instruction.Call.class);
        Instruction.Call guarded = parser.parseStatement(1, "IF DI[5]=ON,CALL HOMING ;").payload(Instruction.Call.class);

        assertThat(call.target()).isEqualTo("TEKST");
        assertThat(call.argument()).isEqualTo("500");
        assertThat(plain.target()).isEqualTo("KER1_384");
        assertThat(plain.argument()).isNull();
        assertThat(guarded.target()).isEqualTo("HOMING");
        assertThat(guarded.condition()).isEqualTo("DI[5]=ON");
    }

    @Test
    void parseStatement_registerAssignment_marksTargetAssigned() {
        Instruction instruction = parser.parseStatement(1, "R[1:Teller]=R[1:Teller]+1    ;");

        Instruction.RegisterAssign assign = instruction.payload(Instruction.RegisterAssign.class);
        assertThat(assign.index()).isEqualTo(1);
        assertThat(assign.name()).isEqualTo("Teller");
        assertThat(assign.expression()).isEqualTo("R[1:Teller]+1");
        assertThat(instruction.symbolRefs()).extracting(SymbolRef::assigned).containsExactly(true, false);
    }

    @Test
    void parseStatement_ioAssignment_extractsSignal() {
        Instruction.IoAssign assign = parser.parseStatement(1, "DO[120:Vacuum aan]=ON ;")
            .payload(Instruction.IoAssign.class);

        assertThat(assign.signal()).isEqualTo(SymbolKind.DO);
        assertThat(assign.index()).isEqualTo(120);
        assertThat(assign.name()).isEqualTo("Vacuum aan");
        assertThat(assign.value()).isEqualTo("ON");
    }

    @Test
    void parseStatement_waitWithTimeout_extractsTimeoutLabel() {
        Instruction.Wait wait = parser.parseStatement(1, "WAIT DI[101:Matrijs open]=ON TIMEOUT,LBL[500] ;")
            .payload(Instruction.Wait.class);
        Instruction.Wait plain = parser.parseStatement(1, "WAIT   1.00(sec) ;").payload(Instruction.Wait.class);

        assertThat(wait.condition()).isEqualTo("DI[101:Matrijs open]=ON");
        assertThat(wait.timeoutLabel()).isEqualTo(500);
        assertThat(plain.condition()).isEqualTo("1.00(sec)");
        assertThat(plain.timeoutLabel()).isNull();
    }

    @Test
    void parseStatement_jointMotion_extractsSpeedAndTermination() {
        Instruction instruction = parser.parseStatement(1, "   6:J P[1:rust positie] 100% FINE    ;");

        Instruction.Motion motion = instruction.payload(Instruction.Motion.class);
        assertThat(instruction.statementNumber()).isEqualTo(6);
        assertThat(motion.motionType()).isEqualTo('J');
        assertThat(motion.positionId()).isEqualTo("P[1]");
        assertThat(motion.positionRegister()).isFalse();
        assertThat(motion.speedPercent()).isEqualTo(100);
        assertThat(motion.termination()).isEqualTo("FINE");
        assertThat(motion.options()).isEmpty();
    }

    @Test
    void parseStatement_linearMotionToPositionRegister_keepsOptions() {
        Instruction instruction = parser.parseStatement(1, "L PR[5:Keer positie] 2000mm/sec CNT50 ACC80 ;");

        Instruction.Motion motion = instruction.payload(Instruction.Motion.class);
        assertThat(motion.positionId()).isEqualTo("PR[5]");
        assertThat(motion.positionRegister()).isTrue();
        assertThat(motion.speed()).isEqualTo("2000mm/sec");
        assertThat(motion.speedPercent()).isNull();
        assertThat(motion.termination()).isEqualTo("CNT50");
        assertThat(motion.options()).isEqualTo("ACC80");
        assertThat(instruction.symbolRefs()).extracting(SymbolRef::kind).containsExactly(SymbolKind.POSITION_REGISTER);
    }

    @Test
    void parseStatement_unknownStatement_keepsTextAndKeyword() {
        Instruction instruction = parser.parseStatement(1, "  2:  MESSAGE[Melding] ;");

        assertThat(instruction.kind()).isEqualTo(InstructionKind.OTHER);
        assertThat(instruction.text()).isEqualTo("MESSAGE[Melding]");
        assertThat(instruction.payload(Instruction.Other.class).keyword()).isEqualTo("MESSAGE");
    }

    @Test
    void parse_continuationLines_joinIntoOneStatement() {
        String body = """
               1:  IF R[1]=1 AND
               :  DI[5]=ON,JMP LBL[20] ;
               2:  LBL[20] ;
            """;

        List<Instruction> instructions = parser.parse(body, 1).value();

        assertThat(instructions).hasSize(2);
        assertThat(instructions.get(0).lineNumber()).isEqualTo(1);
        assertThat(instructions.get(0).payload(Instruction.Jump.class).condition()).isEqualTo("R[1]=1 AND DI[5]=ON");
    }

    @Test
    void parse_unterminatedStatement_warnsMalformed() {
        String body = """
               1:  LBL[10] ;
               2:  JMP LBL[10]
            """;

        ParseOutcome<List<Instruction>> outcome = parser.parse(body, 1);

        assertThat(outcome.value()).hasSize(2);
        assertThat(outcome.value().get(1).kind()).isEqualTo(InstructionKind.JUMP);
        assertThat(outcome.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.type()).isEqualTo(WarningType.MALFORMED_PROGRAM);
                assertThat(warning.lineNumber()).isEqualTo(2);
            });
    }

    @Test
    void parse_unrecognizedStatements_addsSingleInfoSummary() {
        String body = """
               1:  MESSAGE[A] ;
               2:  UFRAME_NUM=1 ;
               3:  MESSAGE[B] ;
            """;

        List<ProgramWarning> warnings = parser.parse(body, 1).warnings();

        assertThat(warnings).singleElement()
            .satisfies(warning -> {
                assertThat(warning.type()).isEqualTo(WarningType.UNRECOGNIZED_INSTRUCTION);
                assertThat(warning.severity()).isEqualTo(Severity.INFO);
                assertThat(warning.message()).contains("3 statement(s)").contains("MESSAGE").contains("UFRAME_NUM");
            });
    }

    @Test
    void parse_customMatchers_areTriedInOrder() {
        LineMatcher pause = statement -> "PAUSE".equals(statement) ? new Instruction.Other("PAUSE") : null;
        InstructionParser custom = new InstructionParser(List.of(pause));

        List<Instruction> instructions = custom.parse("   1:  PAUSE ;\n   2:  JMP LBL[1] ;\n", 1).value();

        assertThat(instructions).extracting(Instruction::kind)
            .containsExactly(InstructionKind.OTHER, InstructionKind.OTHER);
        assertThat(instructions.get(1).payload(Instruction.Other.class).keyword()).isEqualTo("JMP");
    }

    @Test
    void parseStatement_labelNumberBeyondIntRange_keptAsOther() {
        Instruction instruction = parser.parseStatement(3, "   3:  LBL[99999999999] ;");

        assertThat(instruction.kind()).isEqualTo(InstructionKind.OTHER);
        assertThat(instruction.text()).isEqualTo("LBL[99999999999]");
        assertThat(instruction.statementNumber()).isEqualTo(3);
    }

    @Test
    void parseStatement_jumpTargetBeyondIntRange_keptAsOther() {
        Instruction instruction = parser.parseStatement(1, "JMP LBL[4294967296]");

        assertThat(instruction.kind()).isEqualTo(InstructionKind.OTHER);
        assertThat(instruction.text()).isEqualTo("JMP LBL[4294967296]");
    }

    @Test
    void parseStatement_registerIndexBeyondIntRange_skipsReference() {
        Instruction instruction = parser.parseStatement(1, "R[99999999999]=R[2:Teller]");

        assertThat(instruction.kind()).isEqualTo(InstructionKind.OTHER);
        assertThat(instruction.symbolRefs()).extracting(SymbolRef::kind, SymbolRef::index)
            .containsExactly(tuple(SymbolKind.REGISTER, 2));
    }

    @Test
    void parseStatement_waitOnOversizedSignal_keepsWaitWithoutReference() {
        Instruction instruction = parser.parseStatement(1, "WAIT DI[99999999999]=ON");

        assertThat(instruction.kind()).isEqualTo(InstructionKind.WAIT);
        assertThat(instruction.payload(Instruction.Wait.class).condition()).isEqualTo("DI[99999999999]=ON");
        assertThat(instruction.symbolRefs()).isEmpty();
    }

    @Test
    void parseStatement_oversizedStatementNumber_defaultsToZero() {
        Instruction instruction = parser.parseStatement(1, "99999999999:  CALL TEKST ;");

        assertThat(instruction.statementNumber()).isZero();
        assertThat(instruction.kind()).isEqualTo(InstructionKind.CALL);
        assertThat(instruction.text()).isEqualTo("CALL TEKST");
    }

    @Test
    void parse_oversizedLabel_reportedAsUnrecognized() {
        ParseOutcome<List<Instruction>> outcome = parser.parse("   1:  LBL[99999999999] ;\n   2:  CALL TEKST ;\n", 1);

        assertThat(outcome.value()).hasSize(2);
        assertThat(outcome.warnings()).extracting(ProgramWarning::type)
            .containsExactly(WarningType.UNRECOGNIZED_INSTRUCTION);
    }
}
