package net.pivx.rpc.commands;

import static org.junit.Assert.*;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import net.i2p.I2PAppContext;

import net.pivx.rpc.CountingActor;
import net.pivx.rpc.RPCCommand;
import net.pivx.rpc.RPCErrorCode;
import net.pivx.rpc.RPCException;
import net.pivx.rpc.RPCParams;
import net.pivx.rpc.RPCServer;

public class ControlCommandsTest {

    private RPCServer _server;
    private AtomicInteger _shutdowns;

    @Before
    public void setUp() {
        _server = new RPCServer(I2PAppContext.getGlobalContext());
        _shutdowns = new AtomicInteger();
        _server.setShutdownRequest(new Runnable() {
            public void run() {
                _shutdowns.incrementAndGet();
            }
        });
        assertTrue(ControlCommands.register(_server));
        _server.getTable().appendCommand(new RPCCommand("blockchain", "getblockcount",
                                                        new CountingActor("getblockcount\n\nReturns the count.", "x"), false));
        _server.getWarmup().setFinished();
        _server.startRPC();
    }

    @After
    public void tearDown() {
        _server.shutdown(null);
    }

    @Test
    public void testRegisterTwice() {
        RPCServer server = new RPCServer(I2PAppContext.getGlobalContext());
        assertTrue(ControlCommands.register(server));
        assertFalse(ControlCommands.register(server));
        assertEquals(2, server.getTable().size());
    }

    @Test
    public void testHelpAll() throws Exception {
        String help = (String) _server.getTable().execute("help", RPCParams.EMPTY);
        assertEquals("== Control ==\n" +
                     "help ( \"command\" )\n" +
                     "stop\n" +
                     "\n" +
                     "== Blockchain ==\n" +
                     "getblockcount", help);
    }

    @Test
    public void testHelpOne() throws Exception {
        assertEquals("getblockcount\n\nReturns the count.",
                     _server.getTable().execute("help", RPCParams.of("getblockcount")));
        assertEquals("stop\n\nStop PIVX server.",
                     _server.getTable().execute("help", RPCParams.of("stop")));
        assertEquals(ControlCommands.Help.USAGE.substring(0, ControlCommands.Help.USAGE.length() - 1),
                     _server.getTable().execute("help", RPCParams.of("help")));
        assertEquals("help: unknown command: nosuch",
                     _server.getTable().execute("help", RPCParams.of("nosuch")));
    }

    @Test
    public void testHelpUsage() {
        try {
            _server.getTable().execute("help", RPCParams.of("a", "b"));
            fail();
        } catch (RPCException e) {
            assertEquals(RPCErrorCode.RPC_MISC_ERROR, e.getCode());
            assertTrue(e.getMessage().startsWith("help ( \"command\" )"));
        }
    }

    @Test
    public void testStop() throws Exception {
        assertEquals("PIVX server stopping", _server.getTable().execute("stop", RPCParams.EMPTY));
        assertEquals(1, _shutdowns.get());
    }

    @Test
    public void testAllowedInSafeMode() throws Exception {
        assertTrue(_server.getTable().get("help").isOkSafeMode());
        assertTrue(_server.getTable().get("stop").isOkSafeMode());
    }
}
