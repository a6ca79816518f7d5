package net.pivx.rpc;

import java.util.Properties;

import net.i2p.I2PAppContext;

/**
 * A context with its own properties that never becomes the global context,
 * so configured tests can't change what other tests see.
 */
public class RPCTestContext extends I2PAppContext {

    public RPCTestContext() {
        this(new Properties());
    }

    public RPCTestContext(Properties props) {
        super(false, props);
    }
}
