package org.example.formula.resolver;

import org.example.formula.config.ResolverConfiguration;
import org.example.formula.model.Formula;
import org.example.formula.model.PackageVersion;
import org.example.formula.model.ResolvedDependency;
import org.example.formula.model.ResolvedGraph;
import org.example.formula.model.Selection;
import org.example.formula.universe.PackageRelease;
import org.example.formula.universe.PackageUniverse;
import org.example.formula.version.Constraint;
import org.example.formula.version.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Depth-first backtracking resolver.
 *
 * <p>The search works through a stack of open goals (formulas still to satisfy) and a
 * stack of choice points, never through recursion:</p>
 * <ul>
 *   <li>{@code AND} replaces itself with its operands, left on top</li>
 *   <li>{@code OR} opens a choice point; the right branch is tried only after everything
 *       below the left branch has failed</li>
 *   <li>a package leaf for an already selected package checks the selected version;
 *       otherwise it opens a choice point over the matching versions, newest first, and
 *       committing one pushes that release's own formula</li>
 *   <li>{@code NOT} is deferred and checked against the complete selection</li>
 * </ul>
 *
 * <p>Because a selected package is never chosen again on the same branch, cyclic formulas
 * terminate. The first complete selection in which every selected release's formula holds
 * is returned. All search state lives in the call, so one instance can serve concurrent
 * requests.</p>
 */
public class BacktrackingResolver implements DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(BacktrackingResolver.class);

    private final ResolverConfiguration config;

    public BacktrackingResolver() {
        this(ResolverConfiguration.defaults());
    }

    public BacktrackingResolver(ResolverConfiguration config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    @Override
    public ResolutionResult resolve(PackageUniverse universe, String rootName, List<Constraint> rootConstraints,
                                    CancellationToken cancellation) {
        Objects.requireNonNull(universe, "universe cannot be null");
        Objects.requireNonNull(cancellation, "cancellation cannot be null");
        Formula root = Formula.pkg(rootName, rootConstraints != null ? rootConstraints : List.of());

        log.info("Resolving {} against {}", root.toText(), universe);
        return new Search(universe, cancellation).run(root);
    }

    /**
     * State of one resolution run.
     *
     * <p>{@code selected} mirrors the trail of the current branch. Choice points are
     * revisited strictly last in, first out, so moving to an alternative only ever
     * removes the newest commits before adding one.</p>
     */
    private final class Search {

        private final PackageUniverse universe;
        private final CancellationToken cancellation;
        private final Deque<ChoicePoint> choicePoints = new ArrayDeque<>();
        private final Map<String, Version> selected = new HashMap<>();
        private ReleaseChain trail = ReleaseChain.empty();
        private final long startNanos = System.nanoTime();
        private long steps;
        private long backtracks;
        private Conflict deepestConflict;
        private String stopReason;

        Search(PackageUniverse universe, CancellationToken cancellation) {
            this.universe = universe;
            this.cancellation = cancellation;
        }

        ResolutionResult run(Formula root) {
            SearchState state = SearchState.initial(Goal.root(root));

            while (true) {
                if (state == null) {
                    state = backtrack();
                    if (state == null) {
                        return stopReason != null ? cancelled() : exhausted(root);
                    }
                    continue;
                }

                if (state.goals().isEmpty()) {
                    Selection selection = toSelection(state.trail());
                    Conflict conflict = verify(state, selection);
                    if (conflict == null) {
                        return solved(root, selection);
                    }
                    record(conflict);
                    state = null;
                    continue;
                }

                Goal goal = state.goals().peek();
                SearchState rest = state.withGoals(state.goals().pop());
                Formula formula = goal.formula();

                state = switch (formula.getKind()) {
                    case AND -> rest.withGoals(rest.goals()
                            .push(goal.child(formula.getRight()))
                            .push(goal.child(formula.getLeft())));
                    case OR -> open(ChoicePoint.branches(rest, goal));
                    case NOT -> rest.withNegation(goal);
                    case PACKAGE -> choose(goal, rest);
                };
            }
        }

        /**
         * Handles a package leaf: checks an existing selection or opens a choice over candidates.
         */
        private SearchState choose(Goal goal, SearchState rest) {
            Formula leaf = goal.formula();
            String name = leaf.getName();

            Version current = selected.get(name);
            if (current != null) {
                if (leaf.accepts(current)) {
                    return rest;
                }
                record(Conflict.Reason.VERSION_MISMATCH, goal, rest, name);
                return null;
            }

            if (!universe.contains(name)) {
                record(Conflict.Reason.UNKNOWN_PACKAGE, goal, rest, name);
                return null;
            }

            List<Constraint> constraints = new ArrayList<>(leaf.getConstraints());
            for (Goal pending : rest.goals()) {
                for (Formula other : pending.formula().mandatoryLeaves()) {
                    if (other.getName().equals(name)) {
                        constraints.addAll(other.getConstraints());
                    }
                }
            }

            List<PackageRelease> candidates = new ArrayList<>();
            for (PackageRelease release : universe.candidates(name, constraints)) {
                if (!isExcludedByNegation(release, rest)) {
                    candidates.add(release);
                }
            }

            log.debug("Choosing {}: {} of {} versions match {}",
                    name, candidates.size(), universe.getReleases(name).size(), constraints);

            if (candidates.isEmpty()) {
                record(Conflict.Reason.NO_MATCHING_VERSION, goal, rest, name);
                return null;
            }
            return open(ChoicePoint.candidates(rest, goal, candidates));
        }

        /**
         * A deferred {@code ! "pkg" {...}} rules out every version the leaf accepts.
         */
        private boolean isExcludedByNegation(PackageRelease release, SearchState state) {
            for (Goal negation : state.negations()) {
                Formula operand = negation.formula().getOperand();
                if (operand.isPackage() && operand.getName().equals(release.getName())
                        && operand.accepts(release.getVersion())) {
                    return true;
                }
            }
            return false;
        }

        private SearchState open(ChoicePoint choicePoint) {
            choicePoints.push(choicePoint);
            return take(choicePoint);
        }

        /**
         * Takes the next alternative of a choice point, or null when the run must stop.
         */
        private SearchState take(ChoicePoint choicePoint) {
            if (cancellation.isCancelled()) {
                stopReason = "cancelled by caller";
                choicePoints.clear();
                return null;
            }
            if (config.isStepLimited() && steps >= config.getMaxSteps()) {
                stopReason = "step limit of " + config.getMaxSteps() + " reached";
                choicePoints.clear();
                return null;
            }
            steps++;
            rewind(choicePoint.getBase().trail());
            SearchState next = choicePoint.next();
            if (next.trail() != trail) {
                PackageVersion committed = next.trail().head();
                selected.put(committed.getName(), committed.getVersion());
                trail = next.trail();
                log.debug("Committed {}", committed);
            }
            return next;
        }

        /**
         * Drops the commits made after {@code target}, which is always a prefix of the current trail.
         */
        private void rewind(ReleaseChain target) {
            while (trail != target) {
                selected.remove(trail.head().getName());
                trail = trail.parent();
            }
        }

        /**
         * Unwinds to the newest choice point with an untried alternative.
         */
        private SearchState backtrack() {
            while (!choicePoints.isEmpty()) {
                ChoicePoint top = choicePoints.peek();
                if (top.hasNext()) {
                    backtracks++;
                    log.debug("Backtrack to {}", top);
                    return take(top);
                }
                choicePoints.pop();
            }
            return null;
        }

        /**
         * Checks deferred negations and every selected formula against the complete selection.
         */
        private Conflict verify(SearchState state, Selection selection) {
            for (Goal negation : state.negations()) {
                if (!negation.formula().evaluate(selection)) {
                    Formula operand = negation.formula().getOperand();
                    return conflict(Conflict.Reason.NEGATION_VIOLATED, negation, selection,
                            operand.leaves().get(0).getName());
                }
            }
            // Every taken leaf already held when it was popped; this is the acceptance check
            // of the whole selection.
            for (PackageVersion pv : selection.getPackageVersions()) {
                Optional<Formula> depends = universe.getRelease(pv).flatMap(PackageRelease::getDepends);
                if (depends.isPresent() && !depends.get().evaluate(selection)) {
                    return Conflict.builder()
                            .reason(Conflict.Reason.INCONSISTENT_SELECTION)
                            .packageName(pv.getName())
                            .requirement(depends.get())
                            .dependent(pv)
                            .path(List.of(pv))
                            .partialSelection(selection)
                            .build();
                }
            }
            return null;
        }

        /**
         * Records a dead end. The conflict is only materialised when it is the deepest so far.
         */
        private void record(Conflict.Reason reason, Goal goal, SearchState state, String packageName) {
            if (deepestConflict != null && goal.depth() <= deepestConflict.getDepth()) {
                log.debug("Dead end: {} on {} at depth {}", reason, packageName, goal.depth());
                return;
            }
            record(conflict(reason, goal, toSelection(state.trail()), packageName));
        }

        private Conflict conflict(Conflict.Reason reason, Goal goal, Selection selection, String packageName) {
            return Conflict.builder()
                    .reason(reason)
                    .packageName(packageName)
                    .requirement(goal.formula())
                    .dependent(goal.origin())
                    .path(goal.pathFromRoot())
                    .partialSelection(selection)
                    .availableVersions(universe.getVersions(packageName))
                    .build();
        }

        private void record(Conflict conflict) {
            log.debug("Dead end: {}", conflict.getDescription());
            if (deepestConflict == null || conflict.getDepth() > deepestConflict.getDepth()) {
                deepestConflict = conflict;
            }
        }

        private Selection toSelection(ReleaseChain commits) {
            Selection.Builder builder = Selection.builder();
            for (PackageVersion pv : commits.toList()) {
                builder.select(pv.getName(), pv.getVersion());
            }
            return builder.build();
        }

        private ResolutionResult solved(Formula root, Selection selection) {
            long elapsed = elapsedMs();
            log.info("Solved {} with {} packages in {} steps ({} backtracks, {}ms)",
                    root.getName(), selection.size(), steps, backtracks, elapsed);
            return ResolutionResult.builder()
                    .status(ResolutionStatus.SOLVED)
                    .selection(selection)
                    .graph(buildGraph(root.getName(), selection))
                    .message("solved")
                    .steps(steps)
                    .backtracks(backtracks)
                    .executionTimeMs(elapsed)
                    .build();
        }

        private ResolutionResult exhausted(Formula root) {
            long elapsed = elapsedMs();
            String message = deepestConflict != null
                    ? deepestConflict.getDescription()
                    : "no solution for " + root.toText();
            log.info("Resolution of {} exhausted after {} steps: {}", root.getName(), steps, message);
            return ResolutionResult.builder()
                    .status(ResolutionStatus.EXHAUSTED)
                    .conflict(deepestConflict)
                    .message(message)
                    .steps(steps)
                    .backtracks(backtracks)
                    .executionTimeMs(elapsed)
                    .build();
        }

        private ResolutionResult cancelled() {
            long elapsed = elapsedMs();
            log.warn("Resolution stopped after {} steps: {}", steps, stopReason);
            return ResolutionResult.builder()
                    .status(ResolutionStatus.CANCELLED)
                    .conflict(deepestConflict)
                    .message(stopReason)
                    .steps(steps)
                    .backtracks(backtracks)
                    .executionTimeMs(elapsed)
                    .build();
        }

        /**
         * Builds the graph of selected releases, breadth first from the root.
         */
        private ResolvedGraph buildGraph(String rootName, Selection selection) {
            PackageVersion root = new PackageVersion(rootName, selection.getVersion(rootName).orElseThrow());
            ResolvedGraph graph = new ResolvedGraph(root);
            Map<PackageVersion, Integer> depths = new HashMap<>();
            Deque<PackageVersion> queue = new ArrayDeque<>();
            depths.put(root, 0);
            queue.add(root);

            while (!queue.isEmpty()) {
                PackageVersion source = queue.poll();
                int depth = depths.get(source);
                Optional<Formula> depends = universe.getRelease(source).flatMap(PackageRelease::getDepends);
                if (depends.isEmpty()) {
                    continue;
                }
                Set<String> names = new LinkedHashSet<>();
                for (Formula leaf : depends.get().positiveLeaves()) {
                    names.add(leaf.getName());
                }
                for (String name : names) {
                    Optional<Version> version = selection.getVersion(name);
                    if (version.isEmpty() || name.equals(source.getName())) {
                        continue;
                    }
                    PackageVersion target = new PackageVersion(name, version.get());
                    graph.addDependency(new ResolvedDependency(source, target, depth));
                    if (!depths.containsKey(target)) {
                        depths.put(target, depth + 1);
                        queue.add(target);
                    }
                }
            }
            return graph;
        }

        private long elapsedMs() {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }
    }
}
