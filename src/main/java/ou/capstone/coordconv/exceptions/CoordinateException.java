package ou.capstone.coordconv.exceptions;

public class CoordinateException extends Exception
{
    public CoordinateException( final Exception e )
    {
        super( e );
    }

    public CoordinateException( final String msg )
    {
        super( msg );
    }

    public CoordinateException( final String msg, final Exception e )
    {
        super( msg, e );
    }
}
