package domain.pipeline;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static DAG of tasks reachable from one or more terminal tasks.
 *
 * <p>Tasks are identified by reference. Building the graph validates it: a cycle raises
 * {@link CycleDetectedException} and two tasks sharing one output location raise
 * {@link IllegalStateException}, both before anything runs.</p>
 */
public final class TaskGraph {

    private final List<Task> terminals;
    private final List<Task> tasks;
    private final Map<Task, List<Task>> dependents;
    private final List<Task> order;

    private TaskGraph(List<Task> terminals) {
        this.terminals = List.copyOf(terminals);

        Set<Task> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Task> collected = new ArrayList<>();
        for (Task t : terminals) collect(t, seen, collected);
        this.tasks = Collections.unmodifiableList(collected);

        checkDistinctOutputs(collected);

        this.dependents = new IdentityHashMap<>();
        for (Task t : collected) dependents.put(t, new ArrayList<>());
        for (Task t : collected) {
            for (Task req : distinct(t.requires())) dependents.get(req).add(t);
        }

        this.order = Collections.unmodifiableList(topologicalSort());
    }

    public static TaskGraph of(Task... terminals) {
        if (terminals == null || terminals.length == 0) {
            throw new IllegalArgumentException("at least one terminal task is required");
        }
        return of(List.of(terminals));
    }

    public static TaskGraph of(Collection<? extends Task> terminals) {
        if (terminals == null || terminals.isEmpty()) {
            throw new IllegalArgumentException("at least one terminal task is required");
        }
        return new TaskGraph(new ArrayList<>(terminals));
    }

    // iterative DFS so that deep chains do not exhaust the stack
    private static void collect(Task root, Set<Task> seen, List<Task> out) {
        if (root == null) throw new IllegalArgumentException("task is null");
        Deque<Task> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Task t = stack.pop();
            if (!seen.add(t)) continue;
            out.add(t);
            List<Task> reqs = t.requires();
            if (reqs == null) throw new IllegalStateException("requires() returned null: " + t.id());
            for (int i = reqs.size() - 1; i >= 0; i--) {
                Task r = reqs.get(i);
                if (r == null) throw new IllegalStateException("null requirement in " + t.id());
                stack.push(r);
            }
        }
    }

    private static void checkDistinctOutputs(List<Task> tasks) {
        Map<LocalTarget, Task> owners = new HashMap<>();
        for (Task t : tasks) {
            Task other = owners.putIfAbsent(t.output(), t);
            if (other != null) {
                throw new IllegalStateException("tasks " + other.id() + " and " + t.id()
                        + " share output " + t.output());
            }
        }
    }

    private static List<Task> distinct(List<Task> reqs) {
        Set<Task> s = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Task> out = new ArrayList<>(reqs.size());
        for (Task r : reqs) {
            if (s.add(r)) out.add(r);
        }
        return out;
    }

    // Kahn's algorithm; ties resolved in discovery order so the result is deterministic
    private List<Task> topologicalSort() {
        Map<Task, Integer> inDegree = new IdentityHashMap<>();
        for (Task t : tasks) inDegree.put(t, distinct(t.requires()).size());

        Deque<Task> queue = new ArrayDeque<>();
        for (Task t : tasks) {
            if (inDegree.get(t) == 0) queue.add(t);
        }

        List<Task> result = new ArrayList<>(tasks.size());
        while (!queue.isEmpty()) {
            Task current = queue.poll();
            result.add(current);
            for (Task next : dependents.get(current)) {
                int d = inDegree.get(next) - 1;
                inDegree.put(next, d);
                if (d == 0) queue.add(next);
            }
        }

        if (result.size() < tasks.size()) {
            List<String> stuck = new ArrayList<>();
            for (Task t : tasks) {
                if (inDegree.get(t) > 0) stuck.add(t.id());
            }
            throw new CycleDetectedException("cycle detected among tasks " + stuck
                    + " (sorted " + result.size() + " of " + tasks.size() + ")");
        }
        return result;
    }

    public List<Task> getTerminals() {
        return terminals;
    }

    /**
     * All tasks, in discovery order (terminals first).
     */
    public List<Task> getTasks() {
        return tasks;
    }

    /**
     * Tasks ordered so that every task comes after all of its requirements.
     */
    public List<Task> topologicalOrder() {
        return order;
    }

    public List<Task> requirementsOf(Task task) {
        requireMember(task);
        return distinct(task.requires());
    }

    public List<Task> dependentsOf(Task task) {
        requireMember(task);
        return Collections.unmodifiableList(dependents.get(task));
    }

    public boolean contains(Task task) {
        return dependents.containsKey(task);
    }

    public int size() {
        return tasks.size();
    }

    private void requireMember(Task task) {
        if (!contains(task)) throw new IllegalArgumentException("task not in graph: " + (task == null ? null : task.id()));
    }
}
