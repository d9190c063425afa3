package org.example.formula.resolver;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Immutable linked stack of goals. Pushing allocates one node and shares the tail with
 * the stack it was pushed onto.
 */
final class GoalStack implements Iterable<Goal> {

    private static final GoalStack EMPTY = new GoalStack(null, null, 0);

    private final Goal head;
    private final GoalStack tail;
    private final int size;

    private GoalStack(Goal head, GoalStack tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    static GoalStack empty() {
        return EMPTY;
    }

    GoalStack push(Goal goal) {
        return new GoalStack(goal, this, size + 1);
    }

    Goal peek() {
        if (isEmpty()) {
            throw new NoSuchElementException("Goal stack is empty");
        }
        return head;
    }

    GoalStack pop() {
        if (isEmpty()) {
            throw new NoSuchElementException("Goal stack is empty");
        }
        return tail;
    }

    boolean isEmpty() {
        return size == 0;
    }

    int size() {
        return size;
    }

    @Override
    public Iterator<Goal> iterator() {
        return new Iterator<>() {
            private GoalStack current = GoalStack.this;

            @Override
            public boolean hasNext() {
                return !current.isEmpty();
            }

            @Override
            public Goal next() {
                if (current.isEmpty()) {
                    throw new NoSuchElementException();
                }
                Goal goal = current.head;
                current = current.tail;
                return goal;
            }
        };
    }
}
