package com.platform.servicehost.host;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion or until its timeout, whichever comes first.
 * A timed-out process is forcibly terminated before this returns; nothing is left detached.
 */
public interface CommandRunner {
    
    ProcessOutcome run(List<String> command, Path workingDirectory, Duration timeout);
}
