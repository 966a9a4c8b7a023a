package io.github.manjago.gtm.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Specializes a program into a flat table of concrete states.
 * <p>
 * Starting from the start reference, every reachable reference is concretized: placeholders are
 * replaced by the instance keys bound to them and generic arguments are resolved recursively,
 * giving a structural {@link InstanceKey}. Keys already seen are reused, so loops in the state
 * graph cost nothing; new keys are queued and their rows built one by one (breadth first, so the
 * output order is stable).
 * <p>
 * Two shapes can never produce a usable table and are rejected with
 * {@link InstantiationCycleException}:
 * <ul>
 *   <li>expansion that keeps wrapping an instance into its own arguments
 *       ({@code r<x>} going to {@code r<r<x>>}), caught once a key nests more than the limit
 *       past the deepest reference written in the program;</li>
 *   <li>an instance that re-enters itself with identical arguments, writing and reading in place
 *       until it sees a symbol again.</li>
 * </ul>
 * Nested references that shrink or stay bounded, like {@code r<r<r<f>>>} unwrapping down to
 * {@code f}, are distinct finite instances and resolve normally.
 */
public final class Monomorphizer {

    private static final Logger log = LoggerFactory.getLogger(Monomorphizer.class);

    public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

    private final int maxNestingDepth;

    public Monomorphizer() {
        this(DEFAULT_MAX_NESTING_DEPTH);
    }

    /**
     * @param maxNestingDepth how far {@link InstanceKey#depth()} may grow past the deepest
     *                        reference written in the program
     */
    public Monomorphizer(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("Nesting depth must be positive: " + maxNestingDepth);
        }
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Specialize every state reachable from the program's start reference.
     *
     * @throws UndefinedStateException      a reachable reference names no state
     * @throws ArityMismatchException       a reference has the wrong number of arguments
     * @throws InstantiationCycleException  specialization cannot terminate
     */
    public SpecializedTable resolve(Program program) throws ProgramException {
        return new Expansion(program).run();
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    /**
     * State of one resolve() call.
     */
    private final class Expansion {
        private final Program program;

        /** Discovered keys and the key they were first reached from (null for start) */
        private final Map<InstanceKey, InstanceKey> parents = new HashMap<>();
        private final Deque<InstanceKey> queue = new ArrayDeque<>();
        private final Map<InstanceKey, Map<Symbol, Transition>> rows = new LinkedHashMap<>();
        private final int depthLimit;

        Expansion(Program program) {
            this.program = program;
            this.depthLimit = writtenDepth() + maxNestingDepth;
        }

        SpecializedTable run() throws ProgramException {
            int startLine = program.getStartLine();
            InstanceKey start = concretize(program.getStart(), Map.of(), startLine, null);
            discover(start, null, startLine);

            while (!queue.isEmpty()) {
                InstanceKey key = queue.poll();
                rows.put(key, buildRow(key));
            }

            List<StateDefinition> unreachable = findUnreachable();
            SpecializedTable table = new SpecializedTable(start, rows, unreachable);
            log.info("Specialized {} instances with {} transitions (start: {})",
                    table.size(), table.transitionCount(), start);
            return table;
        }

        private Map<Symbol, Transition> buildRow(InstanceKey key) throws ProgramException {
            if (key.isFinish()) {
                return Map.of();
            }

            StateDefinition def = program.definition(key.definition());
            Map<String, InstanceKey> env = new HashMap<>();
            for (int i = 0; i < def.arity(); i++) {
                env.put(def.getParameters().get(i), key.arguments().get(i));
            }

            Map<Symbol, Transition> row = new LinkedHashMap<>();
            for (TransitionRule rule : def.getRules().values()) {
                InstanceKey target = concretize(rule.target(), env, rule.line(), key);
                discover(target, key, rule.line());
                row.put(rule.input(), new Transition(rule.output(), target, rule.movement(), rule.line()));
            }

            checkInPlaceReentry(key, row);
            log.debug("Specialized {} ({} transitions)", key, row.size());
            return row;
        }

        /**
         * Resolve a reference to a concrete key under a placeholder binding.
         *
         * @param from instance whose rule holds the reference (null for start), for error chains
         */
        private InstanceKey concretize(StateReference ref, Map<String, InstanceKey> env, int line,
                                       InstanceKey from) throws ProgramException {
            InstanceKey bound = env.get(ref.name());
            if (bound != null && ref.isBare()) {
                return bound;
            }

            if (ref.name().equals(Parser.FINISH)) {
                if (!ref.isBare()) {
                    throw new ArityMismatchException(Parser.FINISH, 0, ref.arguments().size(), line);
                }
                return InstanceKey.FINISH;
            }

            StateDefinition def = program.definition(ref.name());
            if (def == null) {
                throw new UndefinedStateException(ref.name(), chainTo(from), line);
            }
            if (def.arity() != ref.arguments().size()) {
                throw new ArityMismatchException(def.getName(), def.arity(), ref.arguments().size(), line);
            }

            List<InstanceKey> arguments = new ArrayList<>(def.arity());
            for (StateReference arg : ref.arguments()) {
                arguments.add(concretize(arg, env, line, from));
            }
            return new InstanceKey(def.getName(), arguments);
        }

        private void discover(InstanceKey key, InstanceKey from, int line) throws InstantiationCycleException {
            if (parents.containsKey(key)) {
                return;
            }
            if (key.depth() > depthLimit) {
                List<String> chain = chainTo(from);
                chain.add(key.toString());
                throw new InstantiationCycleException(String.format(
                        "Expansion of '%s' grows more than %d levels deeper than the program's own references"
                                + " and never terminates",
                        key.definition(), maxNestingDepth), key.toString(), chain, line);
            }
            parents.put(key, from);
            queue.add(key);
            log.debug("Discovered {} from {}", key, from);
        }

        /**
         * Follow in-place self transitions from every symbol; seeing a symbol twice means the
         * instance never leaves.
         */
        private void checkInPlaceReentry(InstanceKey key, Map<Symbol, Transition> row)
                throws InstantiationCycleException {
            for (Symbol first : row.keySet()) {
                Set<Symbol> seen = new HashSet<>();
                Symbol symbol = first;
                Transition t = row.get(symbol);
                while (t != null && t.movement() == Movement.CURRENT && t.target().equals(key)) {
                    seen.add(symbol);
                    symbol = t.output();
                    if (seen.contains(symbol)) {
                        throw new InstantiationCycleException(String.format(
                                "State '%s' re-enters itself with identical arguments on '%s' without moving",
                                key, symbol), key.toString(), chainTo(key), t.line());
                    }
                    t = row.get(symbol);
                }
            }
        }

        private List<String> chainTo(InstanceKey key) {
            LinkedList<String> chain = new LinkedList<>();
            InstanceKey current = key;
            while (current != null) {
                chain.addFirst(current.toString());
                current = parents.get(current);
            }
            return chain;
        }

        /**
         * Deepest reference in the source: the start line and every rule target.
         */
        private int writtenDepth() {
            int deepest = program.getStart().depth();
            for (StateDefinition def : program.getDefinitions()) {
                for (TransitionRule rule : def.getRules().values()) {
                    deepest = Math.max(deepest, rule.target().depth());
                }
            }
            return deepest;
        }

        private List<StateDefinition> findUnreachable() {
            Set<String> used = new HashSet<>();
            for (InstanceKey key : rows.keySet()) {
                used.add(key.definition());
            }
            List<StateDefinition> unreachable = new ArrayList<>();
            for (StateDefinition def : program.getDefinitions()) {
                if (!used.contains(def.getName())) {
                    unreachable.add(def);
                    log.warn("Line {}: state '{}' is never reached from start", def.getLine(), def.signature());
                }
            }
            return unreachable;
        }
    }
}
