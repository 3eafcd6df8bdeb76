package onto.number;

/**
 * 试图让值离开其所属的定义域，例如把自然数强制设为负数，或求 0/0 这样的不定式。
 */
public class DomainViolationException extends OntoException {

    public DomainViolationException(String message) {
        super(message);
    }

    public DomainViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
