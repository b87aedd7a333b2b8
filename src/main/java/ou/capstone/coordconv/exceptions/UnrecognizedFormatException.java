package ou.capstone.coordconv.exceptions;

/**
 * Thrown when no converter in the registry accepts an input string.
 * Carries the rejected input and no partial result.
 */
public class UnrecognizedFormatException extends CoordinateException
{
    private final String input;

    public UnrecognizedFormatException( final String input )
    {
        super( "Coordinate format not recognized: '" + input + "'" );
        this.input = input;
    }

    public String getInput()
    {
        return input;
    }
}
