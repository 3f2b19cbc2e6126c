package com.platform.servicehost.host;

import com.platform.servicehost.config.ServiceHostProperties;
import com.platform.servicehost.state.OsServiceState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ServiceControl} over the Windows {@code sc.exe} utility.
 */
@Slf4j
@Component
public class ScServiceControl implements ServiceControl {
    
    static final int ERROR_SERVICE_ALREADY_RUNNING = 1056;
    static final int ERROR_SERVICE_DOES_NOT_EXIST = 1060;
    static final int ERROR_SERVICE_NOT_ACTIVE = 1062;
    
    private static final String SC = "sc.exe";
    private static final Pattern STATE_LINE = Pattern.compile("STATE\\s*:\\s*(\\d+)");
    
    private final CommandRunner commandRunner;
    private final Duration commandTimeout;
    
    public ScServiceControl(CommandRunner commandRunner, ServiceHostProperties properties) {
        this.commandRunner = commandRunner;
        this.commandTimeout = properties.getControl().getCommandTimeout();
    }
    
    @Override
    public OsServiceState queryState(String serviceName) throws ServiceControlException {
        ProcessOutcome outcome = invoke("query", serviceName);
        if (outcome.exitCode() == ERROR_SERVICE_DOES_NOT_EXIST) {
            return OsServiceState.NOT_FOUND;
        }
        if (!outcome.isSuccess()) {
            throw failure("query", serviceName, outcome);
        }
        return parseState(outcome.stdout());
    }
    
    @Override
    public void start(String serviceName) throws ServiceControlException {
        ProcessOutcome outcome = invoke("start", serviceName);
        if (outcome.isSuccess() || outcome.exitCode() == ERROR_SERVICE_ALREADY_RUNNING) {
            return;
        }
        throw failure("start", serviceName, outcome);
    }
    
    @Override
    public void stop(String serviceName) throws ServiceControlException {
        ProcessOutcome outcome = invoke("stop", serviceName);
        if (outcome.isSuccess() || outcome.exitCode() == ERROR_SERVICE_NOT_ACTIVE) {
            return;
        }
        throw failure("stop", serviceName, outcome);
    }
    
    static OsServiceState parseState(String queryOutput) {
        if (queryOutput == null) {
            return OsServiceState.UNKNOWN;
        }
        Matcher matcher = STATE_LINE.matcher(queryOutput);
        if (!matcher.find()) {
            return OsServiceState.UNKNOWN;
        }
        return OsServiceState.fromScmCode(Integer.parseInt(matcher.group(1)));
    }
    
    private ProcessOutcome invoke(String verb, String serviceName) {
        log.debug("{} {} {}", SC, verb, serviceName);
        return commandRunner.run(List.of(SC, verb, serviceName), null, commandTimeout);
    }
    
    private ServiceControlException failure(String verb, String serviceName, ProcessOutcome outcome) {
        if (outcome.timedOut()) {
            return new ServiceControlException(ServiceControlException.Kind.TIMEOUT, serviceName,
                String.format("%s %s timed out after %d ms", SC, verb, outcome.elapsedMs()));
        }
        if (outcome.exitCode() == ERROR_SERVICE_DOES_NOT_EXIST) {
            return ServiceControlException.notFound(serviceName);
        }
        return new ServiceControlException(ServiceControlException.Kind.FAILED, serviceName,
            String.format("%s %s failed with exit code %d: %s", SC, verb, outcome.exitCode(), outcome.diagnostic()));
    }
}
