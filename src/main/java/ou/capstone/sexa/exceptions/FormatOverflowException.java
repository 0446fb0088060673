package ou.capstone.sexa.exceptions;

/**
 * Thrown when a value cannot be represented at the requested precision or
 * width. Carries the {@link FormatError} describing why.
 */
public class FormatOverflowException extends SexaException
{
    private final FormatError error;

    public FormatOverflowException( final FormatError error )
    {
        super( error.message() );
        this.error = error;
    }

    public FormatError getError()
    {
        return error;
    }
}
