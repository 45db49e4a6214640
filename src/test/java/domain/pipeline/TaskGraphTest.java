package domain.pipeline;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    @TempDir
    Path tempDir;

    @Test
    void should_collect_shared_requirement_once_and_order_topologically() {
        FakeTask src = new FakeTask("src", tempDir);
        FakeTask left = new FakeTask("left", tempDir, src);
        FakeTask right = new FakeTask("right", tempDir, src);
        FakeTask join = new FakeTask("join", tempDir, left, right);

        TaskGraph g = TaskGraph.of(join);

        assertEquals(4, g.size());
        assertEquals(List.of(join), g.getTerminals());
        assertTrue(g.contains(src));
        List<Task> order = g.topologicalOrder();
        assertEquals(src, order.get(0));
        assertEquals(join, order.get(3));
        assertTrue(order.indexOf(left) < order.indexOf(join));
        assertEquals(List.of(left, right), g.dependentsOf(src));
        assertEquals(List.of(left, right), g.requirementsOf(join));
    }

    @Test
    void should_detect_cycles_before_running() {
        FakeTask a = new FakeTask("a", tempDir);
        FakeTask b = new FakeTask("b", tempDir, a);
        a.requires.add(b);

        assertThrows(CycleDetectedException.class, () -> TaskGraph.of(b));
        assertEquals(0, a.runs.get() + b.runs.get());
    }

    @Test
    void should_reject_two_tasks_with_same_output() {
        FakeTask a = new FakeTask("a", new LocalTarget(tempDir.resolve("same")));
        FakeTask b = new FakeTask("b", new LocalTarget(tempDir.resolve("same")));
        FakeTask top = new FakeTask("top", tempDir, a, b);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> TaskGraph.of(top));
        assertTrue(e.getMessage().contains("share output"), e.getMessage());
    }

    @Test
    void should_require_a_terminal() {
        assertThrows(IllegalArgumentException.class, () -> TaskGraph.of(List.of()));
    }

    @Test
    void should_reject_foreign_tasks_in_queries() {
        TaskGraph g = TaskGraph.of(new FakeTask("a", tempDir));
        assertThrows(IllegalArgumentException.class, () -> g.requirementsOf(new FakeTask("b", tempDir)));
    }
}
