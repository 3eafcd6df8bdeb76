package onto.number;

/**
 * 构造参数非法：缺失的成员、负的自然数、负的底数或指数等。
 */
public class InvalidArgumentException extends OntoException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
