package com.tpanalyzer.core.parser;

import com.tpanalyzer.core.model.ProgramAttributes;
import com.tpanalyzer.core.model.WarningType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AttributeParser}.
 */
class AttributeParserTest {

    private AttributeParser parser;

    @BeforeEach
    void setUp() {
        parser = new AttributeParser();
    }

    @Test
    void parse_typicalAttributes_extractsTypedFields() {
        String body = """
            OWNER		= MNEDITOR;
            COMMENT		= "Hoofdprogramma";
            PROG_SIZE	= 2418;
            CREATE		= DATE 19-04-02  TIME 09:15:40;
            MODIFIED	= DATE 23-11-17  TIME 14:02:06;
            LINE_COUNT	= 30;
            MEMORY_SIZE	= 2874;
            PROTECT		= READ_WRITE;
            """;

        ParseOutcome<ProgramAttributes> outcome = parser.parse(body, 3);

        ProgramAttributes attributes = outcome.value();
        assertThat(outcome.warnings()).isEmpty();
        assertThat(attributes.owner()).isEqualTo("MNEDITOR");
        assertThat(attributes.comment()).isEqualTo("Hoofdprogramma");
        assertThat(attributes.programSize()).isEqualTo(2418);
        assertThat(attributes.lineCount()).isEqualTo(30);
        assertThat(attributes.memorySize()).isEqualTo(2874);
        assertThat(attributes.protection()).isEqualTo("READ_WRITE");
        assertThat(attributes.created()).isEqualTo(LocalDateTime.of(2019, 4, 2, 9, 15, 40));
        assertThat(attributes.modified()).isEqualTo(LocalDateTime.of(2023, 11, 17, 14, 2, 6));
    }

    @Test
    void parse_blockAndKeyOnlyStatements_keepsRawEntries() {
        String body = """
            TCD:  STACK_SIZE	= 0,
                  TASK_PRIORITY	= 50,
                  TIME_SLICE	= 0;
            DEFAULT_GROUP	= 1,*,*,*,*;
            FILE_NAME	= ;
            /APPL
              AUTO_SINGULARITY_HEADER;
                ENABLE_SINGULARITY_AVOIDANCE   : TRUE;
            """;

        ParseOutcome<ProgramAttributes> outcome = parser.parse(body, 3);

        assertThat(outcome.warnings()).isEmpty();
        assertThat(outcome.value().raw())
            .containsEntry("TCD.STACK_SIZE", "0")
            .containsEntry("TCD.TASK_PRIORITY", "50")
            .containsEntry("TCD.TIME_SLICE", "0")
            .containsEntry("DEFAULT_GROUP", "1,*,*,*,*")
            .containsEntry("FILE_NAME", "")
            .containsEntry("APPL.AUTO_SINGULARITY_HEADER", "")
            .containsEntry("APPL.ENABLE_SINGULARITY_AVOIDANCE", "TRUE");
    }

    @Test
    void parse_invalidValues_keepsRawAndWarns() {
        String body = """
            PROG_SIZE	= many;
            CREATE		= yesterday;
            """;

        ParseOutcome<ProgramAttributes> outcome = parser.parse(body, 3);

        assertThat(outcome.value().programSize()).isNull();
        assertThat(outcome.value().created()).isNull();
        assertThat(outcome.value().raw()).containsEntry("PROG_SIZE", "many");
        assertThat(outcome.warnings())
            .extracting(warning -> warning.type())
            .containsExactly(WarningType.UNPARSED_ATTRIBUTE, WarningType.UNPARSED_ATTRIBUTE);
    }

    @Test
    void parse_unrecognizedStatement_warnsWithLineNumber() {
        String body = """
            OWNER		= MNEDITOR;
            ??? nonsense;
            """;

        ParseOutcome<ProgramAttributes> outcome = parser.parse(body, 3);

        assertThat(outcome.value().owner()).isEqualTo("MNEDITOR");
        assertThat(outcome.warnings()).singleElement()
            .satisfies(warning -> {
                assertThat(warning.type()).isEqualTo(WarningType.UNPARSED_ATTRIBUTE);
                assertThat(warning.lineNumber()).isEqualTo(4);
            });
    }

    @Test
    void parse_emptyBody_returnsEmptyAttributes() {
        ParseOutcome<ProgramAttributes> outcome = parser.parse("", 3);

        assertThat(outcome.value().raw()).isEmpty();
        assertThat(outcome.value().owner()).isNull();
        assertThat(outcome.warnings()).isEmpty();
    }
}
