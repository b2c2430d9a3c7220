package aquabase.app.setup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A stored condition to actions automation entry.
 */
public class Setup {
    @JsonProperty
    protected String id;
    @JsonProperty
    protected String name;
    @JsonProperty
    protected String description;
    @JsonProperty
    protected Condition condition;
    @JsonProperty
    protected List<Action> actions;
    @JsonProperty
    protected Boolean active;
    @JsonProperty("created_at")
    protected Instant createdAt;
    @JsonProperty("updated_at")
    protected Instant updatedAt;
    @JsonProperty("last_triggered")
    protected Instant lastTriggered;

    public Setup() {
        this.actions = new ArrayList<>();
    }
    public Setup(String name, Condition condition, List<Action> actions) {
        this.name = name;
        this.condition = condition;
        this.actions = new ArrayList<>(actions);
        this.active = Boolean.TRUE;
    }
    @JsonIgnore
    public String getId() {
        return id;
    }
    public void setId(String id) {
        this.id = id;
    }
    @JsonIgnore
    public String getName() {
        return name;
    }
    public void setName(String name) {
        this.name = name;
    }
    @JsonIgnore
    public String getDescription() {
        if (description == null) {
            return "";
        }
        return description;
    }
    public void setDescription(String description) {
        this.description = description;
    }
    @JsonIgnore
    public Condition getCondition() {
        return condition;
    }
    public void setCondition(Condition condition) {
        this.condition = condition;
    }
    @JsonIgnore
    public List<Action> getActions() {
        if (actions == null) {
            actions = new ArrayList<>();
        }
        return actions;
    }
    public void setActions(List<Action> actions) {
        this.actions = new ArrayList<>(actions);
    }
    /**
     * Setups are active unless switched off explicitly.
     */
    @JsonIgnore
    public boolean isActive() {
        if (active == null) {
            return true;
        }
        return active.booleanValue();
    }
    @JsonIgnore
    public Boolean getActiveFlag() {
        return active;
    }
    public void setActive(Boolean active) {
        this.active = active;
    }
    @JsonIgnore
    public Instant getCreatedAt() {
        return createdAt;
    }
    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
    @JsonIgnore
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
    @JsonIgnore
    public Instant getLastTriggered() {
        return lastTriggered;
    }
    public void setLastTriggered(Instant lastTriggered) {
        this.lastTriggered = lastTriggered;
    }
    @JsonIgnore
    public boolean watches(String deviceId) {
        return condition != null && deviceId.equals(condition.deviceId());
    }
    @Override
    public String toString() {
        return "Setup [id=" + id + ", name=" + name + ", condition=" + condition + ", actions=" + actions
                + ", active=" + active + ", last_triggered=" + lastTriggered + "]";
    }
}
