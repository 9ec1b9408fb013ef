package org.skylane.workers.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.workers.IWorkerBodyFactory;
import org.skylane.workers.channels.BoundedChannel;
import org.skylane.workers.control.WorkerController;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class WorkerPropertiesTest {

    private IWorkerBodyFactory factory;
    private WorkerController controller;
    private BoundedChannel<Integer> in;
    private BoundedChannel<Integer> out;

    @BeforeEach
    void setUp() {
        factory = () -> context -> { };
        controller = new WorkerController();
        in = new BoundedChannel<>("in", 5);
        out = new BoundedChannel<>("out", 5);
    }

    @Test
    void createsValidProperties() {
        Optional<WorkerProperties> properties = WorkerProperties.create("doubler", factory, 3, List.of(7, "x"), List.of(in), List.of(out), controller);

        assertTrue(properties.isPresent());
        WorkerProperties p = properties.get();
        assertEquals("doubler", p.getName());
        assertEquals(3, p.getCount());
        assertEquals(List.of(7, "x"), p.getWorkArguments());
        assertSame(in, p.getInputChannels().get(0));
        assertSame(out, p.getOutputChannels().get(0));
        assertSame(controller, p.getController());
        assertSame(factory, p.getBodyFactory());
    }

    @Test
    void copiesListsDefensivelyOnCreation() {
        List<IInputChannel<?>> inputs = new ArrayList<>(List.of(in));
        WorkerProperties p = WorkerProperties.create("w", factory, 1, List.of(), inputs, List.of(), controller).orElseThrow();
        inputs.clear();
        assertEquals(1, p.getInputChannels().size());
        assertThrows(UnsupportedOperationException.class, () -> p.getInputChannels().clear());
    }

    @Test
    void rejectsZeroOrNegativeCount() {
        assertTrue(WorkerProperties.create("w", factory, 0, List.of(), List.of(), List.of(), controller).isEmpty());
        assertTrue(WorkerProperties.create("w", factory, -2, List.of(), List.of(), List.of(), controller).isEmpty());
    }

    @Test
    void rejectsMissingBodyOrController() {
        assertTrue(WorkerProperties.create("w", null, 1, List.of(), List.of(), List.of(), controller).isEmpty());
        assertTrue(WorkerProperties.create("w", factory, 1, List.of(), List.of(), List.of(), null).isEmpty());
    }

    @Test
    void rejectsBlankName() {
        assertTrue(WorkerProperties.create(null, factory, 1, List.of(), List.of(), List.of(), controller).isEmpty());
        assertTrue(WorkerProperties.create("  ", factory, 1, List.of(), List.of(), List.of(), controller).isEmpty());
    }

    @Test
    void rejectsNullListsAndNullElements() {
        assertTrue(WorkerProperties.create("w", factory, 1, null, List.of(), List.of(), controller).isEmpty());
        assertTrue(WorkerProperties.create("w", factory, 1, List.of(), null, List.of(), controller).isEmpty());
        assertTrue(WorkerProperties.create("w", factory, 1, List.of(), List.of(), null, controller).isEmpty());
        assertTrue(WorkerProperties.create("w", factory, 1, Arrays.asList(1, null), List.of(), List.of(), controller).isEmpty());
        assertTrue(WorkerProperties.create("w", factory, 1, List.of(), Arrays.asList(in, null), List.of(), controller).isEmpty());
    }

    @Test
    void allowsWorkersWithoutChannels() {
        assertTrue(WorkerProperties.create("idle", factory, 1, List.of(), List.of(), List.of(), controller).isPresent());
    }
}
