package com.platform.servicehost.core;

import com.platform.servicehost.error.ErrorCode;
import com.platform.servicehost.model.ServiceRecord;
import com.platform.servicehost.security.CommandGuard;
import com.platform.servicehost.security.GuardResult;
import com.platform.servicehost.security.PathGuard;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validates a candidate record before any side effect: path and argument guards,
 * field limits, and existence of the referenced files.
 */
@Component
public class RequestValidator {
    
    public static final int MIN_DISPLAY_NAME = 3;
    public static final int MAX_DISPLAY_NAME = 100;
    public static final int MAX_DESCRIPTION = 500;
    public static final int MIN_STOP_TIMEOUT_MS = 1000;
    public static final int MAX_STOP_TIMEOUT_MS = 600000;
    
    private static final Pattern ENV_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.()-]{0,254}");
    
    private final PathGuard pathGuard;
    private final CommandGuard commandGuard;
    
    public RequestValidator(PathGuard pathGuard, CommandGuard commandGuard) {
        this.pathGuard = pathGuard;
        this.commandGuard = commandGuard;
    }
    
    /**
     * A single rejected field.
     */
    public record Violation(ErrorCode errorCode, String field, String rejectedValue, String reason) {
    }
    
    public Optional<Violation> validate(ServiceRecord candidate) {
        String displayName = candidate.getDisplayName();
        if (displayName == null || displayName.isBlank()
                || displayName.trim().length() < MIN_DISPLAY_NAME || displayName.length() > MAX_DISPLAY_NAME) {
            return violation(ErrorCode.VALIDATION_ERROR, "displayName", displayName,
                "Display name must be " + MIN_DISPLAY_NAME + "-" + MAX_DISPLAY_NAME + " characters");
        }
        if (hasControlCharacters(displayName)) {
            return violation(ErrorCode.VALIDATION_ERROR, "displayName", displayName, "Control characters are not allowed");
        }
        if (candidate.getDescription() != null && candidate.getDescription().length() > MAX_DESCRIPTION) {
            return violation(ErrorCode.VALIDATION_ERROR, "description", null,
                "Description exceeds " + MAX_DESCRIPTION + " characters");
        }
        
        Optional<Violation> executable = checkExecutable(candidate.getExecutablePath());
        if (executable.isPresent()) {
            return executable;
        }
        
        String scriptPath = candidate.getScriptPath();
        if (scriptPath != null && !scriptPath.isBlank()) {
            Optional<Violation> script = checkPath("scriptPath", scriptPath);
            if (script.isPresent()) {
                return script;
            }
            if (!isRegularFile(scriptPath)) {
                return violation(ErrorCode.INVALID_PATH, "scriptPath", scriptPath, "Script file does not exist");
            }
        }
        
        String workingDirectory = candidate.getWorkingDirectory();
        if (workingDirectory != null && !workingDirectory.isBlank()) {
            Optional<Violation> dir = checkPath("workingDirectory", workingDirectory);
            if (dir.isPresent()) {
                return dir;
            }
            if (!isDirectory(workingDirectory)) {
                return violation(ErrorCode.INVALID_PATH, "workingDirectory", workingDirectory,
                    "Working directory does not exist");
            }
        }
        
        GuardResult arguments = commandGuard.validate(candidate.getArguments(), isCommandInterpreted(candidate));
        if (arguments.isRejected()) {
            return violation(ErrorCode.UNSAFE_ARGUMENTS, "arguments", candidate.getArguments(), arguments.reason());
        }
        
        for (Map.Entry<String, String> entry : candidate.getEnvironmentVariables().entrySet()) {
            if (entry.getKey() == null || !ENV_NAME.matcher(entry.getKey()).matches()) {
                return violation(ErrorCode.VALIDATION_ERROR, "environmentVariables", entry.getKey(),
                    "Invalid environment variable name");
            }
            if (entry.getValue() == null || hasControlCharacters(entry.getValue())) {
                return violation(ErrorCode.VALIDATION_ERROR, "environmentVariables", entry.getKey(),
                    "Environment variable value must be a single line");
            }
        }
        
        if (candidate.getServiceAccount() != null && hasControlCharacters(candidate.getServiceAccount())) {
            return violation(ErrorCode.VALIDATION_ERROR, "serviceAccount", candidate.getServiceAccount(),
                "Control characters are not allowed");
        }
        
        int stopTimeout = candidate.getStopTimeoutMs();
        if (stopTimeout < MIN_STOP_TIMEOUT_MS || stopTimeout > MAX_STOP_TIMEOUT_MS) {
            return violation(ErrorCode.VALIDATION_ERROR, "stopTimeoutMs", String.valueOf(stopTimeout),
                "Stop timeout must be between " + MIN_STOP_TIMEOUT_MS + " and " + MAX_STOP_TIMEOUT_MS + " ms");
        }
        
        return Optional.empty();
    }
    
    private Optional<Violation> checkExecutable(String executablePath) {
        Optional<Violation> path = checkPath("executablePath", executablePath);
        if (path.isPresent()) {
            return path;
        }
        GuardResult type = commandGuard.validateExecutableType(executablePath);
        if (type.isRejected()) {
            return violation(ErrorCode.INVALID_EXECUTABLE, "executablePath", executablePath, type.reason());
        }
        if (!isRegularFile(executablePath)) {
            return violation(ErrorCode.INVALID_PATH, "executablePath", executablePath, "Executable does not exist");
        }
        return Optional.empty();
    }
    
    /**
     * The restart-on-exit wrapper is a batch file, so its arguments are parsed by cmd.exe too.
     */
    private boolean isCommandInterpreted(ServiceRecord candidate) {
        return candidate.getRestartPolicy().enabled()
            || commandGuard.runsThroughCommandInterpreter(candidate.getExecutablePath())
            || commandGuard.runsThroughCommandInterpreter(candidate.getScriptPath());
    }
    
    private Optional<Violation> checkPath(String field, String value) {
        GuardResult result = pathGuard.validate(value);
        if (result.isRejected()) {
            return violation(ErrorCode.INVALID_PATH, field, value, result.reason());
        }
        return Optional.empty();
    }
    
    private static boolean isRegularFile(String path) {
        try {
            return Files.isRegularFile(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
    
    private static boolean isDirectory(String path) {
        try {
            return Files.isDirectory(Path.of(path));
        } catch (InvalidPathException e) {
            return false;
        }
    }
    
    private static boolean hasControlCharacters(String value) {
        return value.chars().anyMatch(Character::isISOControl);
    }
    
    private static Optional<Violation> violation(ErrorCode code, String field, String value, String reason) {
        return Optional.of(new Violation(code, field, value, reason));
    }
}
