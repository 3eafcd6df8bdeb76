package onto.number;

import java.util.Objects;
import java.util.function.Function;

/**
 * 转换结果
 *
 * <p>三种变体：</p>
 * <ul>
 *   <li>Ok(value)：转换精确成功</li>
 *   <li>Err(message)：转换会丢失信息或超出目标定义域</li>
 *   <li>Absent：输入缺失（null），缺失原样向后传播，不会用默认值顶替</li>
 * </ul>
 */
public final class ConversionResult<T> {

    private enum State { OK, ERR, ABSENT }

    private static final ConversionResult<?> ABSENT = new ConversionResult<>(State.ABSENT, null, null);

    private final State state;
    private final T value;
    private final String error;

    private ConversionResult(State state, T value, String error) {
        this.state = state;
        this.value = value;
        this.error = error;
    }

    public static <T> ConversionResult<T> ok(T value) {
        if (value == null) {
            throw new InvalidArgumentException("ok value must not be null");
        }
        return new ConversionResult<>(State.OK, value, null);
    }

    public static <T> ConversionResult<T> err(String error) {
        return new ConversionResult<>(State.ERR, null, error);
    }

    @SuppressWarnings("unchecked")
    public static <T> ConversionResult<T> absent() {
        return (ConversionResult<T>) ABSENT;
    }

    public boolean isOk() {
        return state == State.OK;
    }

    public boolean isErr() {
        return state == State.ERR;
    }

    public boolean isAbsent() {
        return state == State.ABSENT;
    }

    /** Ok 时返回值，其余返回 null */
    public T getValue() {
        return value;
    }

    /** Err 时返回错误描述，其余返回 null */
    public String getError() {
        return error;
    }

    /**
     * unwrap：Ok 返回值，Err 抛出 {@link DomainViolationException}，Absent 抛出 {@link InvalidArgumentException}
     */
    public T unwrap() {
        switch (state) {
            case OK: return value;
            case ERR: throw new DomainViolationException("Called unwrap() on Err: " + error);
            default: throw new InvalidArgumentException("Called unwrap() on Absent");
        }
    }

    /** unwrapOr：Ok 返回值，其余返回 defaultValue */
    public T unwrapOr(T defaultValue) {
        return isOk() ? value : defaultValue;
    }

    /**
     * Ok 时映射值；Err 与 Absent 原样传播
     */
    @SuppressWarnings("unchecked")
    public <R> ConversionResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!isOk()) return (ConversionResult<R>) this;
        return ok(mapper.apply(value));
    }

    /**
     * Ok 时继续下一步转换；Err 与 Absent 原样传播
     */
    @SuppressWarnings("unchecked")
    public <R> ConversionResult<R> flatMap(Function<? super T, ConversionResult<R>> mapper) {
        if (!isOk()) return (ConversionResult<R>) this;
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        switch (state) {
            case OK: return "Ok(" + value + ")";
            case ERR: return "Err(" + error + ")";
            default: return "Absent";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionResult)) return false;
        ConversionResult<?> other = (ConversionResult<?>) o;
        return state == other.state && Objects.equals(value, other.value) && Objects.equals(error, other.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, value, error);
    }
}
