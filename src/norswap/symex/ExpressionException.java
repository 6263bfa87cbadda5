package norswap.symex;

import norswap.utils.exceptions.NoStackException;

/**
 * Base class of the errors reported by the engine operations.
 *
 * <p>These exceptions carry their error as data (a kind and its payload, exposed by each
 * subclass) and record no stack trace: they describe bad input, not a bug. They propagate
 * unchanged from the nested call that detects them to the caller of the operation.
 */
public abstract class ExpressionException extends NoStackException
{
    private final String message;

    protected ExpressionException (String message) {
        this.message = message;
    }

    @Override public String getMessage () {
        return message;
    }
}
