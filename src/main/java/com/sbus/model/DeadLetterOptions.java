package com.sbus.model;

import com.sbus.protocol.v10.transport.ErrorCondition;
import com.sbus.protocol.v10.types.Symbol;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reason and description recorded on a dead-lettered message.
 */
public class DeadLetterOptions {

    public static final Symbol DEAD_LETTER_REASON = Symbol.valueOf("DeadLetterReason");
    public static final Symbol DEAD_LETTER_ERROR_DESCRIPTION = Symbol.valueOf("DeadLetterErrorDescription");

    private String deadLetterReason;
    private String deadLetterErrorDescription;

    public String getDeadLetterReason() {
        return deadLetterReason;
    }

    public DeadLetterOptions setDeadLetterReason(String deadLetterReason) {
        this.deadLetterReason = deadLetterReason;
        return this;
    }

    public String getDeadLetterErrorDescription() {
        return deadLetterErrorDescription;
    }

    public DeadLetterOptions setDeadLetterErrorDescription(String deadLetterErrorDescription) {
        this.deadLetterErrorDescription = deadLetterErrorDescription;
        return this;
    }

    /**
     * The error written into the rejected outcome.
     */
    public ErrorCondition toErrorCondition() {
        Map<Symbol, Object> info = new LinkedHashMap<>();
        if (deadLetterReason != null) {
            info.put(DEAD_LETTER_REASON, deadLetterReason);
        }
        if (deadLetterErrorDescription != null) {
            info.put(DEAD_LETTER_ERROR_DESCRIPTION, deadLetterErrorDescription);
        }
        return new ErrorCondition(ErrorCondition.DEAD_LETTER).setInfo(info);
    }
}
