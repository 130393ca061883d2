package com.sbus.errors;

import com.sbus.protocol.v10.transport.AmqpErrorException;
import com.sbus.protocol.v10.transport.ErrorCondition;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Translates raw transport failures into {@link MessagingException}.
 */
public final class ErrorTranslator {

    private ErrorTranslator() {
    }

    public static MessagingException translate(ErrorCondition error) {
        MessagingErrorCode code = MessagingErrorCode.fromCondition(error.getCondition());
        String description = error.getDescription() != null ? error.getDescription() : error.getCondition().toString();
        return new MessagingException(code, error.getCondition(), description, code.isRetryable(),
                error.getInfo(), null);
    }

    public static MessagingException translate(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof MessagingException) {
            return (MessagingException) cause;
        }
        if (cause instanceof AmqpErrorException) {
            ErrorCondition condition = ((AmqpErrorException) cause).getError();
            MessagingErrorCode code = MessagingErrorCode.fromCondition(condition.getCondition());
            return new MessagingException(code, condition.getCondition(), cause.getMessage(),
                    code.isRetryable(), condition.getInfo(), cause);
        }
        if (cause instanceof TimeoutException) {
            return new MessagingException(MessagingErrorCode.OPERATION_TIMEOUT, describe(cause), cause);
        }
        if (cause instanceof IOException) {
            return new MessagingException(MessagingErrorCode.SERVICE_COMMUNICATION_ERROR, describe(cause), cause);
        }
        return new MessagingException(MessagingErrorCode.CLIENT_ERROR, describe(cause), cause);
    }

    /**
     * Strip the wrappers added by future composition.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
