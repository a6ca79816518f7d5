package net.pivx.rpc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import net.i2p.I2PAppContext;
import net.i2p.app.ClientAppManager;
import net.i2p.app.ClientAppState;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import net.pivx.rpc.timer.ManualTimerInterface;
import net.pivx.rpc.timer.SimpleTimer2RPCTimerInterface;

import static org.mockito.Mockito.*;
import static org.junit.Assert.*;

public class RPCServerTest {

    @Mock private AsyncRPCQueue queue;
    @Mock private ClientAppManager mgr;

    private RPCServer _server;
    private List<String> _events;

    @Before
    public void before() {
        MockitoAnnotations.initMocks(this);
        _server = new RPCServer(I2PAppContext.getGlobalContext(), mgr);
        _events = new ArrayList<String>();
        _server.getSignals().onStarted(new Runnable() {
            public void run() {
                _events.add("started");
            }
        });
        _server.getSignals().onStopped(new Runnable() {
            public void run() {
                _events.add("stopped");
            }
        });
    }

    @After
    public void after() {
        _server.shutdown(null);
    }

    @Test
    public void testLifecycle() {
        assertEquals(ClientAppState.INITIALIZED, _server.getState());
        assertFalse(_server.isRPCRunning());
        assertTrue(_server.getTable().appendCommand(new RPCCommand("misc", "a", new CountingActor("a", "x"), false)));

        _server.setAsyncRPCQueue(queue);
        assertTrue(_server.startRPC());
        assertTrue(_server.isRPCRunning());
        assertTrue(_server.getTable().isFrozen());
        assertFalse(_server.getTable().appendCommand(new RPCCommand("misc", "b", new CountingActor("b", "x"), false)));
        assertTrue(_server.getTimers().getTimerInterface() instanceof SimpleTimer2RPCTimerInterface);
        verify(queue).addWorker();
        assertEquals(Arrays.asList("started"), _events);

        // no restart
        assertFalse(_server.startRPC());

        _server.interruptRPC();
        assertFalse(_server.isRPCRunning());
        assertEquals(ClientAppState.STOPPING, _server.getState());

        _server.stopRPC();
        _server.stopRPC();
        assertEquals(ClientAppState.STOPPED, _server.getState());
        verify(queue, times(1)).closeAndWait();
        assertNull(_server.getTimers().getTimerInterface());
        assertEquals(Arrays.asList("started", "stopped"), _events);

        InOrder inOrder = inOrder(mgr);
        inOrder.verify(mgr).notify(_server, ClientAppState.STARTING, null, null);
        inOrder.verify(mgr).notify(_server, ClientAppState.RUNNING, null, null);
        inOrder.verify(mgr).notify(_server, ClientAppState.STOPPING, null, null);
        inOrder.verify(mgr).notify(_server, ClientAppState.STOPPED, null, null);
    }

    @Test
    public void testAsyncWorkerStartFails() {
        IllegalStateException boom = new IllegalStateException("no threads");
        doThrow(boom).when(queue).addWorker();
        _server.setAsyncRPCQueue(queue);
        assertFalse(_server.startRPC());
        assertEquals(ClientAppState.START_FAILED, _server.getState());
        assertFalse(_server.isRPCRunning());
        assertNull(_server.getTimers().getTimerInterface());
        assertTrue(_events.isEmpty());
        verify(mgr).notify(_server, ClientAppState.START_FAILED, "Failed to start", boom);
        verify(mgr, never()).notify(_server, ClientAppState.RUNNING, null, null);

        // no retry, and stop does nothing
        assertFalse(_server.startRPC());
        _server.stopRPC();
        assertEquals(ClientAppState.START_FAILED, _server.getState());
        verify(queue, never()).closeAndWait();
        assertTrue(_events.isEmpty());
    }

    @Test
    public void testStopWithoutStart() {
        _server.stopRPC();
        assertEquals(ClientAppState.INITIALIZED, _server.getState());
        assertTrue(_events.isEmpty());
    }

    @Test
    public void testStopCancelsTimers() throws Exception {
        ManualTimerInterface driver = new ManualTimerInterface();
        _server.getTimers().registerTimerInterface(driver);
        _server.startRPC();
        // ours is kept
        assertSame(driver, _server.getTimers().getTimerInterface());
        final List<String> ran = new ArrayList<String>();
        _server.getTimers().runLater("lock", new Runnable() {
            public void run() {
                ran.add("lock");
            }
        }, 10);
        _server.shutdown(null);
        assertEquals(0, driver.fireAll());
        assertTrue(ran.isEmpty());
        // not ours to remove
        assertSame(driver, _server.getTimers().getTimerInterface());
    }

    @Test
    public void testNoDefaultTimer() throws Exception {
        Properties props = new Properties();
        props.setProperty(RPCServer.PROP_DEFAULT_TIMER, "false");
        RPCServer server = new RPCServer(new RPCTestContext(props));
        server.startRPC();
        assertNull(server.getTimers().getTimerInterface());
        try {
            server.getTimers().runLater("x", new Runnable() { public void run() {} }, 1);
            fail();
        } catch (RPCException e) {
            assertEquals(RPCErrorCode.RPC_INTERNAL_ERROR, e.getCode());
        }
        server.shutdown(null);
    }

    @Test(expected = IllegalStateException.class)
    public void testStartupTwice() {
        _server.startup();
        _server.startup();
    }

    @Test
    public void testRequestShutdown() {
        assertFalse(_server.requestShutdown());
        final List<String> ran = new ArrayList<String>();
        _server.setShutdownRequest(new Runnable() {
            public void run() {
                ran.add("shutdown");
            }
        });
        assertTrue(_server.requestShutdown());
        assertEquals(Arrays.asList("shutdown"), ran);
    }

    @Test
    public void testSafeModeMonitor() {
        _server.getTable().appendCommand(new RPCCommand("wallet", "send", new CountingActor("send", "x"), false));
        _server.getWarmup().setFinished();
        _server.setSafeModeMonitor(new SafeModeMonitor() {
            public String getSafeModeWarning() {
                return "Warning: fork";
            }
        });
        _server.startRPC();
        try {
            _server.getTable().execute("send", null);
            fail();
        } catch (RPCException e) {
            assertEquals(RPCErrorCode.RPC_FORBIDDEN_BY_SAFE_MODE, e.getCode());
        }
    }
}
