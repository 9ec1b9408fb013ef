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
public class LoggingSinkWorkerTest {

    @Test
    void consumesEveryMessage() throws Exception {
        BoundedChannel<Object> in = new BoundedChannel<>("in", 5);
        WorkerContext context = new WorkerContext("sink", 0, List.of(), List.of(in), List.of(), new WorkerController());
        LoggingSinkWorker worker = new LoggingSinkWorker(ConfigFactory.empty());
        assertTrue(worker.setUp(context));

        in.offer("a");
        in.offer(2);
        worker.iterate(context);
        worker.iterate(context);
        worker.iterate(context);

        assertEquals(2, worker.getMessagesReceived());
        assertTrue(in.isEmpty());
        assertEquals(2L, worker.getMetrics().get("messages_received"));
    }
}
