package docguard.core.model.security;

/**
 * Base type for the typed errors raised by each pipeline layer.
 *
 * <p>Every subclass carries a stable {@link ErrorCode} and the {@link SecurityLayer}
 * that raised it. Messages are safe to show to callers: they never contain field
 * values, file system locations or internal buffer state.
 */
public abstract class SecurityLayerException extends RuntimeException {

    private final ErrorCode code;
    private final SecurityLayer layer;

    protected SecurityLayerException(String message, ErrorCode code, SecurityLayer layer) {
        super(message);
        this.code = code;
        this.layer = layer;
    }

    public ErrorCode code() {
        return code;
    }

    public SecurityLayer layer() {
        return layer;
    }
}
