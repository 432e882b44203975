package com.tpanalyzer.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One parsed statement of the instruction block.
 *
 * <p>The statement is a tagged variant: {@link #kind()} selects which nested payload record
 * {@link #payload()} holds. Consumers switch over {@link InstructionKind} and use
 * {@link #payload(Class)} to obtain the typed payload.
 *
 * @param lineNumber 1-based line in the source file where the statement starts
 * @param statementNumber the pendant's own statement number, or 0 if the line had none
 * @param kind statement kind
 * @param text statement text without the number prefix and trailing semicolon
 * @param payload kind-specific data
 * @param symbolRefs every register and I/O reference in the statement, in source order
 */
public record Instruction(
    int lineNumber,
    int statementNumber,
    InstructionKind kind,
    String text,
    Payload payload,
    List<SymbolRef> symbolRefs
) {
    /**
     * Compact constructor with validation.
     */
    public Instruction {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        if (payload.kind() != kind) {
            throw new IllegalArgumentException(
                "payload " + payload.getClass().getSimpleName() + " does not match kind " + kind);
        }
        text = text == null ? "" : text;
        symbolRefs = symbolRefs == null ? List.of() : List.copyOf(symbolRefs);
    }

    /**
     * Returns the payload cast to the expected record type.
     *
     * @param type payload record class
     * @param <T> payload type
     * @return typed payload
     * @throws IllegalStateException if the payload is of another type
     */
    public <T extends Payload> T payload(Class<T> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(
                "Instruction at line " + lineNumber + " is " + kind + ", not " + type.getSimpleName());
        }
        return type.cast(payload);
    }

    public boolean is(InstructionKind other) {
        return kind == other;
    }

    /**
     * Kind-specific data carried by an instruction.
     */
    public interface Payload {
        InstructionKind kind();
    }

    /**
     * Label definition.
     *
     * @param number label number
     * @param name inline comment (empty if none)
     */
    public record LabelDef(int number, String name) implements Payload {
        public LabelDef {
            name = name == null ? "" : name.trim();
        }

        @Override
        public InstructionKind kind() {
            return InstructionKind.LABEL;
        }
    }

    /**
     * Jump to a label.
     *
     * @param targetLabel label number jumped to
     * @param condition guard condition, or null for an unconditional jump
     */
    public record Jump(int targetLabel, String condition) implements Payload {
        public boolean conditional() {
            return condition != null;
        }

        @Override
        public InstructionKind kind() {
            return InstructionKind.JUMP;
        }
    }

    /**
     * Subroutine call.
     *
     * @param target called program name
     * @param argument raw argument text inside the parentheses, or null
     * @param condition guard condition, or null
     */
    public record Call(String target, String argument, String condition) implements Payload {
        public Call {
            Objects.requireNonNull(target, "target must not be null");
        }

        @Override
        public InstructionKind kind() {
            return InstructionKind.CALL;
        }
    }

    /**
     * Register assignment.
     *
     * @param index register index
     * @param name inline comment name (empty if none)
     * @param expression right-hand side as written
     */
    public record RegisterAssign(int index, String name, String expression) implements Payload {
        public RegisterAssign {
            name = name == null ? "" : name.trim();
        }

        @Override
        public InstructionKind kind() {
            return InstructionKind.REGISTER_ASSIGN;
        }
    }

    /**
     * I/O signal assignment.
     *
     * @param signal signal kind (DO, RO, GO, ...)
     * @param index signal index
     * @param name inline comment name (empty if none)
     * @param value right-hand side as written (ON, OFF, PULSE,0.5sec, R[3], ...)
     */
    public record IoAssign(SymbolKind signal, int index, String name, String value) implements Payload {
        public IoAssign {
            Objects.requireNonNull(signal, "signal must not be null");
            name = name == null ? "" : name.trim();
        }

        @Override
        public InstructionKind kind() {
            return InstructionKind.IO_ASSIGN;
        }
    }

    /**
     * Wait on a condition or a fixed delay.
     *
     * @param condition condition or delay text
     * @param timeoutLabel label jumped to on timeout, or null
     */
    public record Wait(String condition, Integer timeoutLabel) implements Payload {
        @Override
        public InstructionKind kind() {
            return InstructionKind.WAIT;
        }
    }

    /**
     * Motion statement.
     *
     * @param motionType J (joint), L (linear), C (circular) or A (circle arc)
     * @param positionId referenced position, e.g. {@code P[3]} or {@code PR[1]}
     * @param positionRegister true if the target is a position register
     * @param speed speed as written, e.g. {@code 100%} or {@code 2000mm/sec}
     * @param speedPercent speed percentage when the speed is a plain percentage, otherwise null
     * @param termination FINE or CNTn
     * @param options remaining motion options as written
     */
    public record Motion(
        char motionType,
        String positionId,
        boolean positionRegister,
        String speed,
        Integer speedPercent,
        String termination,
        String options
    ) implements Payload {
        @Override
        public InstructionKind kind() {
            return InstructionKind.MOTION;
        }
    }

    /**
     * Comment line.
     *
     * @param text comment text without the leading marker
     */
    public record Comment(String text) implements Payload {
        @Override
        public InstructionKind kind() {
            return InstructionKind.COMMENT;
        }
    }

    /**
     * Statement that matched no known shape. The raw text is kept in {@link Instruction#text()}.
     *
     * @param keyword first word of the statement, useful for grouping in reports
     */
    public record Other(String keyword) implements Payload {
        public Other {
            keyword = keyword == null ? "" : keyword;
        }

        @Override
        public InstructionKind kind() {
            return InstructionKind.OTHER;
        }
    }
}
