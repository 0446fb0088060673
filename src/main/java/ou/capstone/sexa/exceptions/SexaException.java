package ou.capstone.sexa.exceptions;

public class SexaException extends Exception
{
    public SexaException( final Exception e )
    {
        super( e );
    }

    public SexaException( final String msg )
    {
        super( msg );
    }

    public SexaException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
