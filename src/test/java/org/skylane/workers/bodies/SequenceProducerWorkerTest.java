package org.skylane.workers.bodies;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.skylane.workers.api.workers.WorkerContext;
import org.skylane.workers.channels.BoundedChannel;
import org.skylane.workers.control.WorkerController;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SequenceProducerWorkerTest {

    @Test
    void stopsEmittingAfterTheLimit() throws Exception {
        BoundedChannel<Integer> out = new BoundedChannel<>("out", 10);
        WorkerContext context = new WorkerContext("producer", 0, List.of(), List.of(), List.of(out), new WorkerController());
        SequenceProducerWorker worker = new SequenceProducerWorker(ConfigFactory.parseString("start = 10, maxMessages = 3"));
        assertTrue(worker.setUp(context));

        for (int i = 0; i < 4; i++) {
            worker.iterate(context);
        }

        assertEquals(List.of(10, 11, 12), out.drain());
        assertEquals(3L, worker.getMetrics().get("messages_sent"));
    }

    @Test
    void stopsAtIntegerMaxValueInsteadOfWrapping() throws Exception {
        BoundedChannel<Integer> out = new BoundedChannel<>("out", 10);
        WorkerContext context = new WorkerContext("producer", 0, List.of(), List.of(), List.of(out), new WorkerController());
        SequenceProducerWorker worker = new SequenceProducerWorker(ConfigFactory.parseString("start = 2147483646"));
        worker.setUp(context);

        for (int i = 0; i < 4; i++) {
            worker.iterate(context);
        }

        assertEquals(List.of(Integer.MAX_VALUE - 1, Integer.MAX_VALUE), out.drain());
        assertEquals(2L, worker.getMetrics().get("messages_sent"));
    }

    @Test
    void rejectsLimitBelowUnlimited() {
        assertThrows(IllegalArgumentException.class,
                () -> new SequenceProducerWorker(ConfigFactory.parseString("maxMessages = -2")));
    }

    @Test
    void refusesToStartWithoutOutput() {
        SequenceProducerWorker worker = new SequenceProducerWorker(ConfigFactory.empty());
        WorkerContext context = new WorkerContext("producer", 0, List.of(), List.of(), List.of(), new WorkerController());
        assertFalse(worker.setUp(context));
    }
}
