package org.skylane.workers.bodies;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.skylane.workers.api.channels.IInputChannel;
import org.skylane.workers.api.channels.IOutputChannel;
import org.skylane.workers.api.workers.WorkerContext;
import org.skylane.workers.control.WorkerController;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class ScalingWorkerTest {

    private IInputChannel<Integer> input;
    private IOutputChannel<Integer> output;
    private WorkerContext context;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        input = mock(IInputChannel.class);
        output = mock(IOutputChannel.class);
        context = new WorkerContext("scaler", 0, List.of(), List.of(input), List.of(output), new WorkerController());
    }

    @Test
    void multipliesEveryValueByTheFactor() throws Exception {
        when(input.get(eq(true), any(Duration.class))).thenReturn(Optional.of(3), Optional.of(-4));
        when(output.put(anyInt(), eq(true), any(Duration.class))).thenReturn(true);
        ScalingWorker worker = new ScalingWorker(ConfigFactory.parseString("factor = 3"));

        assertTrue(worker.setUp(context));
        worker.iterate(context);
        worker.iterate(context);

        verify(output).put(eq(9), eq(true), any(Duration.class));
        verify(output).put(eq(-12), eq(true), any(Duration.class));
    }

    @Test
    void defaultsToDoubling() throws Exception {
        when(input.get(eq(true), any(Duration.class))).thenReturn(Optional.of(21));
        when(output.put(anyInt(), eq(true), any(Duration.class))).thenReturn(true);
        ScalingWorker worker = new ScalingWorker(ConfigFactory.empty());

        worker.setUp(context);
        worker.iterate(context);

        verify(output).put(eq(42), eq(true), any(Duration.class));
    }

    @Test
    void sendsNothingWhenNoValueArrives() throws Exception {
        when(input.get(eq(true), any(Duration.class))).thenReturn(Optional.empty());
        ScalingWorker worker = new ScalingWorker(ConfigFactory.empty());

        worker.setUp(context);
        worker.iterate(context);

        verify(output, never()).put(any(), anyBoolean(), any());
    }

    @Test
    void refusesToStartWithoutChannels() {
        ScalingWorker worker = new ScalingWorker(ConfigFactory.empty());
        WorkerContext unwired = new WorkerContext("scaler", 0, List.of(), List.of(), List.of(), new WorkerController());
        assertFalse(worker.setUp(unwired));
    }
}
