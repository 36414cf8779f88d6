package stylekit.css;

/**
 * Thrown when text that is assigned to a rule, condition or media list does not parse.
 */
public class CssSyntaxException extends RuntimeException {

    public CssSyntaxException(String message) {
        super(message);
    }
}
