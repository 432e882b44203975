package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.Position;
import com.tpanalyzer.core.model.PositionKind;
import com.tpanalyzer.core.model.PositionValue;
import com.tpanalyzer.core.model.ProgramWarning;
import com.tpanalyzer.core.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PositionParser}.
 */
class PositionParserTest {

    private PositionParser parser;

    @BeforeEach
    void setUp() {
        parser = new PositionParser();
    }

    @Test
    void parse_cartesianBlock_extractsFrameAndAxes() {
        String body = """
            P[1:"rust positie"]{
               GP1:
            	UF : 0, UT : 1,		CONFIG : 'N U T, 0, 0, 0',
            	X =   850.000  mm,	Y =     0.000  mm,	Z =   600.000  mm,
            	W =   180.000 deg,	P =     0.000 deg,	R =     0.000 deg
            };
            """;

        ParseOutcome<Map<String, Position>> outcome = parser.parse(body, 56);

        assertThat(outcome.warnings()).isEmpty();
        Position position = outcome.value().get("P[1]");
        assertThat(position.index()).isEqualTo(1);
        assertThat(position.comment()).isEqualTo("rust positie");
        assertThat(position.kind()).isEqualTo(PositionKind.CARTESIAN);
        assertThat(position.lineNumber()).isEqualTo(56);
        assertThat(position.frame())
            .containsEntry("UF", "0")
            .containsEntry("UT", "1")
            .containsEntry("CONFIG", "N U T, 0, 0, 0");
        assertThat(position.values()).extracting(PositionValue::axis)
            .containsExactly("X", "Y", "Z", "W", "P", "R");
        assertThat(position.values().get(0).value()).isEqualTo(850.0);
        assertThat(position.values().get(0).unit()).isEqualTo("mm");
    }

    @Test
    void parse_jointBlock_isJointKind() {
        String body = """
            P[2]{
               GP1:
            	UF : 0, UT : 1,
            	J1=     0.000 deg,	J2=   -10.500 deg,	J3=    20.000 deg,
            	J4=     0.000 deg,	J5=   -90.000 deg,	J6=     0.000 deg
            };
            """;

        Position position = parser.parse(body, 1).value().get("P[2]");

        assertThat(position.kind()).isEqualTo(PositionKind.JOINT);
        assertThat(position.comment()).isEmpty();
        assertThat(position.values()).hasSize(6);
        assertThat(position.values().get(1).value()).isEqualTo(-10.5);
    }

    @Test
    void parse_secondMotionGroup_prefixesFrameKeys() {
        String body = """
            P[3]{
               GP1:
            	UF : 1, UT : 2,
            	X = 1.0 mm, Y = 2.0 mm, Z = 3.0 mm
               GP2:
            	UF : 0, UT : 3,
            	J1 = 45.0 deg
            };
            """;

        Position position = parser.parse(body, 1).value().get("P[3]");

        assertThat(position.kind()).isEqualTo(PositionKind.CARTESIAN);
        assertThat(position.frame())
            .containsEntry("UF", "1")
            .containsEntry("GP2.UF", "0")
            .containsEntry("GP2.UT", "3");
        assertThat(position.values()).filteredOn(value -> value.group().equals("GP2"))
            .extracting(PositionValue::axis)
            .containsExactly("J1");
    }

    @Test
    void parse_nonNumericValue_keepsRawAndWarns() {
        String body = """
            P[4]{
               GP1:
            	X = ******** mm, Y = 0.0 mm, Z = 0.0 mm
            };
            """;

        ParseOutcome<Map<String, Position>> outcome = parser.parse(body, 1);

        Position position = outcome.value().get("P[4]");
        assertThat(position.hasParseWarning()).isTrue();
        assertThat(position.values().get(0).raw()).isEqualTo("********");
        assertThat(position.values().get(0).parsed()).isFalse();
        assertThat(outcome.warnings()).extracting(ProgramWarning::type)
            .containsExactly(WarningType.UNPARSED_POSITION);
    }

    @Test
    void parse_unclosedBlock_keepsPositionAndWarnsMalformed() {
        String body = """
            P[1]{
               GP1:
            	X = 1.0 mm, Y = 2.0 mm, Z = 3.0 mm
            P[2]{
               GP1:
            	X = 4.0 mm, Y = 5.0 mm, Z = 6.0 mm
            };
            """;

        ParseOutcome<Map<String, Position>> outcome = parser.parse(body, 10);

        assertThat(outcome.value()).containsOnlyKeys("P[1]", "P[2]");
        assertThat(outcome.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.type()).isEqualTo(WarningType.MALFORMED_PROGRAM);
                assertThat(warning.lineNumber()).isEqualTo(10);
            });
    }

    @Test
    void parse_duplicateBlock_keepsFirstDefinition() {
        String body = """
            P[1:"eerste"]{
               GP1:
            	X = 1.0 mm, Y = 2.0 mm, Z = 3.0 mm
            };
            P[1:"tweede"]{
               GP1:
            	X = 9.0 mm, Y = 9.0 mm, Z = 9.0 mm
            };
            """;

        ParseOutcome<Map<String, Position>> outcome = parser.parse(body, 1);

        assertThat(outcome.value().get("P[1]").comment()).isEqualTo("eerste");
        assertThat(outcome.warnings()).extracting(ProgramWarning::type)
            .containsExactly(WarningType.DUPLICATE_POSITION);
    }

    @Test
    void parse_textOutsideBlock_warnsUnparsed() {
        ParseOutcome<Map<String, Position>> outcome = parser.parse("stray text\n", 7);

        assertThat(outcome.value()).isEmpty();
        assertThat(outcome.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.type()).isEqualTo(WarningType.UNPARSED_POSITION);
                assertThat(warning.lineNumber()).isEqualTo(7);
            });
    }

    @Test
    void parse_indexBeyondIntRange_keepsRawIdAndWarns() {
        String body = """
            P[99999999999]{
               GP1:
            	UF : 0, UT : 1,
            	J1=     0.000 deg,	J2=   -10.500 deg
            };
            """;

        ParseOutcome<Map<String, Position>> outcome = parser.parse(body, 20);

        assertThat(outcome.value()).containsOnlyKeys("P[99999999999]");
        Position position = outcome.value().get("P[99999999999]");
        assertThat(position.index()).isEqualTo(-1);
        assertThat(position.values()).hasSize(2);
        assertThat(outcome.warnings()).extracting(ProgramWarning::type, ProgramWarning::lineNumber)
            .containsExactly(tuple(WarningType.UNPARSED_POSITION, 20));
    }
}
