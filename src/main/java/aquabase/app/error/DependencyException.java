package aquabase.app.error;

import java.util.List;

public class DependencyException extends AutomationException {

    private final List<String> dependents;

    public DependencyException(String deviceId, List<String> dependents) {
        super(Kind.DEPENDENCY, String.format("Device '%s' still has attached devices %s", deviceId, dependents));
        this.dependents = List.copyOf(dependents);
    }

    public List<String> getDependents() {
        return dependents;
    }
}
