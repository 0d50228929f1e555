package io.pipe.core.turn;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Ordered history of turns. Position is chronology: the collection never re-sorts on timestamps.
 * The last element, when present, is the current task and is left out of prompt views.
 */
public final class TurnCollection implements Iterable<Turn> {
    public static final int DEFAULT_TOOL_RESPONSE_LIMIT = 3;
    public static final int DEFAULT_EXPIRATION_THRESHOLD = 3;

    private List<Turn> turns;

    public TurnCollection() {
        this.turns = new ArrayList<>();
    }

    public TurnCollection(List<? extends Turn> turns) {
        this.turns = new ArrayList<>(turns == null ? List.of() : turns);
    }

    public int size() {
        return turns.size();
    }

    public boolean isEmpty() {
        return turns.isEmpty();
    }

    public Turn get(int index) {
        checkIndex(index);
        return turns.get(index);
    }

    /** Read-only view in chronological order. */
    public List<Turn> asList() {
        return Collections.unmodifiableList(turns);
    }

    @Override
    public Iterator<Turn> iterator() {
        return asList().iterator();
    }

    public void add(Turn turn) {
        turns.add(Objects.requireNonNull(turn, "turn must not be null"));
    }

    public void addAll(TurnCollection other) {
        turns.addAll(other.turns);
    }

    public void delete(int index) {
        checkIndex(index);
        turns.remove(index);
    }

    /** Deletes several positions at once; indices refer to the collection before any removal. */
    public void deleteAll(List<Integer> indices) {
        TreeSet<Integer> ordered = new TreeSet<>(Collections.reverseOrder());
        for (Integer index : indices) {
            checkIndex(index);
            ordered.add(index);
        }
        for (int index : ordered) {
            turns.remove(index);
        }
    }

    public void edit(int index, TurnEdit edit) {
        checkIndex(index);
        Objects.requireNonNull(edit, "edit must not be null");
        turns.set(index, edit.applyTo(turns.get(index)));
    }

    /** Turns {@code [0, lastIndex]} as a new, independent collection. */
    public TurnCollection prefix(int lastIndex) {
        checkIndex(lastIndex);
        return new TurnCollection(turns.subList(0, lastIndex + 1));
    }

    /**
     * Replaces the inclusive range {@code [start, end]} with one compressed-history turn placed at {@code start}.
     */
    public CompressedHistoryTurn replaceRangeWithSummary(String summary, int start, int end, OffsetDateTime timestamp) {
        if (start < 0 || end >= turns.size() || start > end) {
            throw new IllegalArgumentException(
                "Invalid turn range [" + start + ", " + end + "] for " + turns.size() + " turns");
        }
        CompressedHistoryTurn compressed = new CompressedHistoryTurn(summary, List.of(start + 1, end + 1), timestamp);
        List<Turn> rebuilt = new ArrayList<>(turns.size() - (end - start));
        rebuilt.addAll(turns.subList(0, start));
        rebuilt.add(compressed);
        rebuilt.addAll(turns.subList(end + 1, turns.size()));
        turns = rebuilt;
        return compressed;
    }

    /**
     * Lazily walks the history backwards, newest first, skipping the current task. Once more than
     * {@code toolResponseLimit} tool responses have been seen, older tool responses are dropped;
     * every other turn is always yielded. The iterator is single-use.
     */
    public Iterator<Turn> forPrompt(int toolResponseLimit) {
        return new PromptIterator(turns, toolResponseLimit);
    }

    public Iterator<Turn> forPrompt() {
        return forPrompt(DEFAULT_TOOL_RESPONSE_LIMIT);
    }

    /** {@link #forPrompt(int)} restored to chronological order. */
    public List<Turn> promptHistory(int toolResponseLimit) {
        List<Turn> history = new ArrayList<>();
        forPrompt(toolResponseLimit).forEachRemaining(history::add);
        Collections.reverse(history);
        return history;
    }

    /**
     * Blanks the message of every succeeded tool response older than the user task that sits
     * {@code expirationThreshold} tasks from the end. Status and all other fields are kept.
     *
     * @return whether any turn changed
     * @throws IllegalArgumentException if {@code expirationThreshold} is below 1
     */
    public boolean expireOldToolResponses(int expirationThreshold) {
        if (expirationThreshold < 1) {
            throw new IllegalArgumentException("expirationThreshold must be >= 1");
        }
        List<UserTaskTurn> userTasks = new ArrayList<>();
        for (Turn turn : turns) {
            if (turn instanceof UserTaskTurn userTask) {
                userTasks.add(userTask);
            }
        }
        if (userTasks.size() <= expirationThreshold) {
            return false;
        }
        OffsetDateTime cutoff = userTasks.get(userTasks.size() - expirationThreshold).timestamp();

        boolean modified = false;
        List<Turn> rebuilt = new ArrayList<>(turns.size());
        for (Turn turn : turns) {
            if (turn instanceof ToolResponseTurn toolTurn
                && toolTurn.timestamp().isBefore(cutoff)
                && toolTurn.response().succeeded()
                && !ToolResponse.EXPIRED_MESSAGE.equals(toolTurn.response().message())) {
                rebuilt.add(toolTurn.withResponse(toolTurn.response().expired()));
                modified = true;
            } else {
                rebuilt.add(turn);
            }
        }
        if (modified) {
            turns = rebuilt;
        }
        return modified;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= turns.size()) {
            throw new IndexOutOfBoundsException("Turn index " + index + " out of range for " + turns.size() + " turns");
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof TurnCollection that && turns.equals(that.turns);
    }

    @Override
    public int hashCode() {
        return turns.hashCode();
    }

    @Override
    public String toString() {
        return "TurnCollection" + turns;
    }

    private static final class PromptIterator implements Iterator<Turn> {
        private final List<Turn> source;
        private final int toolResponseLimit;
        private int cursor;
        private int toolResponsesSeen;
        private Turn next;

        PromptIterator(List<Turn> source, int toolResponseLimit) {
            this.source = List.copyOf(source);
            this.toolResponseLimit = toolResponseLimit;
            this.cursor = this.source.size() - 2;
        }

        @Override
        public boolean hasNext() {
            while (next == null && cursor >= 0) {
                Turn candidate = source.get(cursor--);
                if (candidate instanceof ToolResponseTurn) {
                    toolResponsesSeen++;
                    if (toolResponsesSeen > toolResponseLimit) {
                        continue;
                    }
                }
                next = candidate;
            }
            return next != null;
        }

        @Override
        public Turn next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Turn result = next;
            next = null;
            return result;
        }
    }
}
