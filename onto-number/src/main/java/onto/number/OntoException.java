package onto.number;

/**
 * Onto 数值库的基础运行时异常。
 *
 * <p>{@link InvalidArgumentException} 与 {@link DomainViolationException} 继承此类，
 * 调用方可以统一捕获。</p>
 */
public class OntoException extends RuntimeException {

    public OntoException(String message) {
        super(message);
    }

    public OntoException(String message, Throwable cause) {
        super(message, cause);
    }
}
