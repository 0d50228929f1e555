package io.pipe.core.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.pipe.core.turn.Turn;
import io.pipe.core.turn.TurnCollection;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Full persisted state of one conversation, stored as {@code sessions/<id>.json}.
 *
 * <p>Instances are process-local copies: load one, change it, write it back through {@link SessionStore}.
 * A {@code /} in the id marks a child session under its parent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Session {
    @JsonProperty("session_id")
    private String sessionId;
    @JsonProperty("created_at")
    private OffsetDateTime createdAt;
    @JsonProperty("purpose")
    private String purpose;
    @JsonProperty("background")
    private String background;
    @JsonProperty("roles")
    private List<String> roles = new ArrayList<>();
    @JsonProperty("multi_step_reasoning_enabled")
    private boolean multiStepReasoningEnabled;
    @JsonProperty("token_count")
    private int tokenCount;
    @JsonProperty("hyperparameters")
    private Hyperparameters hyperparameters;
    @JsonProperty("references")
    private List<Reference> references = new ArrayList<>();
    @JsonProperty("artifacts")
    private List<String> artifacts = new ArrayList<>();
    @JsonProperty("procedure")
    private String procedure;
    @JsonProperty("todos")
    private List<TodoItem> todos;
    @JsonProperty("cached_turn_count")
    private int cachedTurnCount;

    private TurnCollection turns = new TurnCollection();
    private TurnCollection pools = new TurnCollection();

    Session() {
    }

    public Session(String sessionId, OffsetDateTime createdAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public String sessionId() {
        return sessionId;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
    }

    public String purpose() {
        return purpose;
    }

    public void setPurpose(String purpose) {
        this.purpose = purpose;
    }

    public String background() {
        return background;
    }

    public void setBackground(String background) {
        this.background = background;
    }

    public List<String> roles() {
        return roles;
    }

    public void setRoles(List<String> roles) {
        this.roles = roles == null ? new ArrayList<>() : new ArrayList<>(roles);
    }

    public boolean multiStepReasoningEnabled() {
        return multiStepReasoningEnabled;
    }

    public void setMultiStepReasoningEnabled(boolean multiStepReasoningEnabled) {
        this.multiStepReasoningEnabled = multiStepReasoningEnabled;
    }

    public int tokenCount() {
        return tokenCount;
    }

    public void setTokenCount(int tokenCount) {
        this.tokenCount = tokenCount;
    }

    public Hyperparameters hyperparameters() {
        return hyperparameters;
    }

    public void setHyperparameters(Hyperparameters hyperparameters) {
        this.hyperparameters = hyperparameters;
    }

    public List<Reference> references() {
        return references;
    }

    public void setReferences(List<Reference> references) {
        this.references = references == null ? new ArrayList<>() : new ArrayList<>(references);
    }

    public List<String> artifacts() {
        return artifacts;
    }

    public void setArtifacts(List<String> artifacts) {
        this.artifacts = artifacts == null ? new ArrayList<>() : new ArrayList<>(artifacts);
    }

    public String procedure() {
        return procedure;
    }

    public void setProcedure(String procedure) {
        this.procedure = procedure;
    }

    public List<TodoItem> todos() {
        return todos;
    }

    public void setTodos(List<TodoItem> todos) {
        this.todos = todos == null ? null : new ArrayList<>(todos);
    }

    public int cachedTurnCount() {
        return cachedTurnCount;
    }

    public void setCachedTurnCount(int cachedTurnCount) {
        if (cachedTurnCount < 0) {
            throw new IllegalArgumentException("cachedTurnCount must be >= 0");
        }
        this.cachedTurnCount = cachedTurnCount;
    }

    public TurnCollection turns() {
        return turns;
    }

    public void replaceTurns(TurnCollection turns) {
        this.turns = turns == null ? new TurnCollection() : turns;
    }

    public TurnCollection pools() {
        return pools;
    }

    public void replacePools(TurnCollection pools) {
        this.pools = pools == null ? new TurnCollection() : pools;
    }

    /** Appends the pooled turns to the history and empties the pool. */
    public boolean mergePool() {
        if (pools.isEmpty()) {
            return false;
        }
        turns.addAll(pools);
        pools = new TurnCollection();
        return true;
    }

    @JsonProperty("turns")
    private List<Turn> turnList() {
        return turns.asList();
    }

    @JsonProperty("turns")
    private void turnList(List<Turn> values) {
        this.turns = new TurnCollection(values);
    }

    @JsonProperty("pools")
    private List<Turn> poolList() {
        return pools.asList();
    }

    @JsonProperty("pools")
    private void poolList(List<Turn> values) {
        this.pools = new TurnCollection(values);
    }
}
