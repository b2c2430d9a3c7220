package aquabase.app.error;

public class ValidationException extends AutomationException {

    public ValidationException(String message) {
        super(Kind.VALIDATION, message);
    }
}
