package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.state.OsServiceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScServiceControlTest {

    private static final String QUERY_RUNNING = String.join(System.lineSeparator(),
        "SERVICE_NAME: orders",
        "        TYPE               : 10  WIN32_OWN_PROCESS",
        "        STATE              : 4  RUNNING",
        "                                (STOPPABLE, NOT_PAUSABLE, ACCEPTS_SHUTDOWN)",
        "        WIN32_EXIT_CODE    : 0  (0x0)");

    @Mock
    private CommandRunner commandRunner;

    private ScServiceControl serviceControl;

    @BeforeEach
    void setUp() {
        serviceControl = new ScServiceControl(commandRunner, new ServiceHostProperties());
    }

    private void givenOutcome(String verb, ProcessOutcome outcome) {
        when(commandRunner.run(eq(List.of("sc.exe", verb, "orders")), isNull(), any(Duration.class)))
            .thenReturn(outcome);
    }

    @Test
    void queryState_runningOutput_shouldParseRunning() throws Exception {
        givenOutcome("query", new ProcessOutcome(0, QUERY_RUNNING, "", false, 12));

        assertEquals(OsServiceState.RUNNING, serviceControl.queryState("orders"));
    }

    @Test
    void queryState_unknownService_shouldReturnNotFound() throws Exception {
        givenOutcome("query", new ProcessOutcome(1060, "", "The specified service does not exist", false, 8));

        assertEquals(OsServiceState.NOT_FOUND, serviceControl.queryState("orders"));
    }

    @Test
    void queryState_timedOut_shouldThrowTimeout() {
        givenOutcome("query", new ProcessOutcome(-1, "", "", true, 15000));

        ServiceControlException e = assertThrows(ServiceControlException.class,
            () -> serviceControl.queryState("orders"));
        assertEquals(ServiceControlException.Kind.TIMEOUT, e.getKind());
    }

    @Test
    void start_alreadyRunning_shouldSucceed() {
        givenOutcome("start", new ProcessOutcome(1056, "", "An instance of the service is already running.", false, 5));

        assertDoesNotThrow(() -> serviceControl.start("orders"));
    }

    @Test
    void stop_notActive_shouldSucceed() {
        givenOutcome("stop", new ProcessOutcome(1062, "", "The service has not been started.", false, 5));

        assertDoesNotThrow(() -> serviceControl.stop("orders"));
    }

    @Test
    void start_accessDenied_shouldThrowFailedWithDiagnostic() {
        givenOutcome("start", new ProcessOutcome(5, "", "Access is denied.", false, 5));

        ServiceControlException e = assertThrows(ServiceControlException.class, () -> serviceControl.start("orders"));
        assertEquals(ServiceControlException.Kind.FAILED, e.getKind());
        assertTrue(e.getMessage().contains("Access is denied."));
    }

    @Test
    void stop_unknownService_shouldThrowNotFound() {
        givenOutcome("stop", new ProcessOutcome(1060, "", "", false, 5));

        ServiceControlException e = assertThrows(ServiceControlException.class, () -> serviceControl.stop("orders"));
        assertTrue(e.isNotFound());
    }

    @ParameterizedTest
    @CsvSource({
        "1, STOPPED",
        "2, START_PENDING",
        "3, STOP_PENDING",
        "4, RUNNING",
        "7, PAUSED",
        "42, UNKNOWN"
    })
    void parseState_shouldMapScmCodes(int code, OsServiceState expected) {
        assertEquals(expected, ScServiceControl.parseState("STATE              : " + code + "  X"));
    }

    @Test
    void parseState_noStateLine_shouldBeUnknown() {
        assertEquals(OsServiceState.UNKNOWN, ScServiceControl.parseState("garbage"));
        assertEquals(OsServiceState.UNKNOWN, ScServiceControl.parseState(null));
    }
}
