package org.example.formula.resolver;

/**
 * Snapshot of one branch of the search: the releases committed so far, the goals still
 * open and the negations deferred until the selection is complete. All three parts are
 * persistent lists, so a snapshot kept at a choice point shares its structure with every
 * state derived from it.
 */
record SearchState(ReleaseChain trail, GoalStack goals, GoalStack negations) {

    static SearchState initial(Goal root) {
        return new SearchState(ReleaseChain.empty(), GoalStack.empty().push(root), GoalStack.empty());
    }

    SearchState withGoals(GoalStack newGoals) {
        return new SearchState(trail, newGoals, negations);
    }

    SearchState withNegation(Goal negation) {
        return new SearchState(trail, goals, negations.push(negation));
    }

    SearchState withCommit(ReleaseChain newTrail, GoalStack newGoals) {
        return new SearchState(newTrail, newGoals, negations);
    }
}
