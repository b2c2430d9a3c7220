package aquabase.app.error;

public class NotFoundException extends AutomationException {

    public NotFoundException(String message) {
        super(Kind.NOT_FOUND, message);
    }

    public static NotFoundException of(String what, String id) {
        return new NotFoundException(String.format("%s '%s' not found", what, id));
    }
}
