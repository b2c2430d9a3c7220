package aquabase.app.error;

public abstract class AutomationException extends RuntimeException {

    public enum Kind {
        NOT_FOUND(404),
        VALIDATION(400),
        CONFLICT(409),
        DEPENDENCY(400),
        TRANSPORT(502);

        private final int httpStatus;

        Kind(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int getHttpStatus() {
            return httpStatus;
        }
    }

    private final Kind kind;

    protected AutomationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AutomationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
