package suite;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)

@Suite.SuiteClasses({
    common.ObservableTest.class,
    common.UtilsTest.class,

    protocol.FrameTest.class,
    protocol.FrameCodecTest.class,

    transport.WebSocketTransportTest.class,

    events.HandlerTableTest.class,
    events.EventDispatcherTest.class,
    events.GameEventsTest.class,

    connection.ClientConfigTest.class,
    connection.ConnectionStateTest.class,
    connection.HandshakeStateMachineTest.class,
    connection.HeartbeatMonitorTest.class,
    connection.ReconnectPolicyTest.class,
    connection.ConnectionManagerTest.class,

    health.HealthPollerTest.class,
    health.HttpHealthCheckTest.class,

    diagnostics.ConnectionDiagnosticsTest.class,
})

public class SuiteRunner {
}
