package org.skylane.workers.bodies;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skylane.workers.api.workers.WorkerContext;
import org.skylane.workers.channels.BoundedChannel;
import org.skylane.workers.control.WorkerController;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RunningAverageWorkerTest {

    @Test
    void emitsTheMeanOfAllValuesSeenSoFar() throws Exception {
        BoundedChannel<Number> in = new BoundedChannel<>("in", 10);
        BoundedChannel<Double> out = new BoundedChannel<>("out", 10);
        WorkerContext context = new WorkerContext("avg", 0, List.of(), List.of(in), List.of(out), new WorkerController());
        RunningAverageWorker worker = new RunningAverageWorker();
        assertTrue(worker.setUp(context));

        in.offer(2);
        in.offer(4);
        in.offer(9.0);
        for (int i = 0; i < 3; i++) {
            worker.iterate(context);
        }

        assertEquals(List.of(2.0, 3.0, 5.0), out.drain());
        assertEquals(3L, worker.getMetrics().get("values_seen"));
    }

    @Test
    void replicasKeepIndependentState() throws Exception {
        BoundedChannel<Number> in = new BoundedChannel<>("in", 10);
        BoundedChannel<Double> out = new BoundedChannel<>("out", 10);
        WorkerController controller = new WorkerController();
        WorkerContext first = new WorkerContext("avg", 0, List.of(), List.of(in), List.of(out), controller);
        WorkerContext second = new WorkerContext("avg", 1, List.of(), List.of(in), List.of(out), controller);
        RunningAverageWorker a = new RunningAverageWorker();
        RunningAverageWorker b = new RunningAverageWorker();
        a.setUp(first);
        b.setUp(second);

        in.offer(10);
        a.iterate(first);
        in.offer(20);
        b.iterate(second);

        assertEquals(List.of(10.0, 20.0), out.drain());
    }
}
